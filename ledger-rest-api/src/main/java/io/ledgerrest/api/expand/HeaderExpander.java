package io.ledgerrest.api.expand;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ledgerrest.api.internal.ProtoJson;
import io.ledgerrest.core.error.WireFormatException;
import java.io.IOException;

/**
 * Replaces the encoded {@code header} of ledger records with the decoded
 * header, all the way down.
 *
 * <p>
 * A block's batches and a batch's transactions are expanded before the
 * parent returns, so the result holds no encoded header at any depth. The
 * nodes are modified in place.
 *
 * <p>
 * The header may be held as a binary node or as base64 text, which is how
 * records read from JSON carry it.
 *
 * <p>
 * Expansion is all or nothing: a header that is not base64 or does not decode
 * as its record throws {@link WireFormatException} and the caller discards
 * the partly expanded tree.
 *
 * <pre>{@code
 * ObjectNode block = ProtoJson.toTree(reply.getBlock());
 * HeaderExpander.expandBlock(block);
 * block.get("header").get("block_num");   // "42"
 * }</pre>
 */
public final class HeaderExpander {

    private static final String HEADER = "header";

    private HeaderExpander() {
        // Utility class
    }

    public static ObjectNode expandBlock(final ObjectNode block) {
        return expand(RecordKind.BLOCK, block);
    }

    public static ObjectNode expandBatch(final ObjectNode batch) {
        return expand(RecordKind.BATCH, batch);
    }

    public static ObjectNode expandTransaction(final ObjectNode transaction) {
        return expand(RecordKind.TRANSACTION, transaction);
    }

    /**
     * Expands {@code node} as a record of {@code kind} along with everything
     * nested in it.
     *
     * @throws WireFormatException if any header is missing or malformed
     */
    public static ObjectNode expand(final RecordKind kind, final ObjectNode node) {
        node.set(HEADER, decodeHeader(kind, node));

        final String childField = kind.childField();
        final RecordKind childKind = kind.child();
        if (childField == null || childKind == null || !node.has(childField)) {
            return node;
        }
        final JsonNode children = node.get(childField);
        if (!children.isArray()) {
            throw new WireFormatException(kind.displayName() + " field '" + childField + "' is not a list");
        }
        for (JsonNode child : (ArrayNode) children) {
            if (!child.isObject()) {
                throw new WireFormatException(childKind.displayName() + " is not an object");
            }
            expand(childKind, (ObjectNode) child);
        }
        return node;
    }

    private static JsonNode decodeHeader(final RecordKind kind, final ObjectNode node) {
        final JsonNode encoded = node.get(HEADER);
        if (encoded == null || !(encoded.isBinary() || encoded.isTextual())) {
            throw new WireFormatException(kind.displayName() + " has no encoded header");
        }
        final byte[] bytes;
        try {
            bytes = encoded.binaryValue();
        } catch (IOException e) {
            throw new WireFormatException(kind.displayName() + " header is not valid base64", e);
        }
        return ProtoJson.toTree(kind.decodeHeader(bytes));
    }
}
