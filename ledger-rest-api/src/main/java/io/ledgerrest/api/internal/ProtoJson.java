package io.ledgerrest.api.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;
import io.ledgerrest.core.error.WireFormatException;
import java.util.List;

/**
 * Renders validator records as JSON trees.
 *
 * <p>
 * Fields keep their declared {@code snake_case} names and are written even
 * when they hold their default value. Following the protobuf JSON mapping,
 * 64-bit integers are written as strings, {@code bytes} as base64 text and
 * enum values by name.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class ProtoJson {

    private static final JsonFormat.Printer PRINTER = JsonFormat.printer()
            .includingDefaultValueFields()
            .preservingProtoFieldNames()
            .omittingInsignificantWhitespace();

    private ProtoJson() {
        // Utility class - prevent instantiation
    }

    /**
     * @throws WireFormatException if the record cannot be printed
     */
    public static ObjectNode toTree(final MessageOrBuilder record) {
        final JsonNode tree;
        try {
            tree = JsonSupport.MAPPER.readTree(PRINTER.print(record));
        } catch (InvalidProtocolBufferException | JsonProcessingException e) {
            throw new WireFormatException(
                    "Cannot render " + record.getDescriptorForType().getName() + " as JSON", e);
        }
        return (ObjectNode) tree;
    }

    public static ArrayNode toArray(final List<? extends MessageOrBuilder> records) {
        final ArrayNode array = JsonSupport.MAPPER.createArrayNode();
        for (MessageOrBuilder record : records) {
            array.add(toTree(record));
        }
        return array;
    }
}
