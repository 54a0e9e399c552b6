package io.ledgerrest.api.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ledgerrest.api.http.GatewayResponse;
import io.ledgerrest.api.internal.JsonSupport;
import io.ledgerrest.core.error.ApiError;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Builds the JSON bodies the gateway sends.
 *
 * <p>
 * A success envelope is the metadata members ({@code head}, {@code link})
 * plus {@code data} when there is any. Keys are sorted at every depth and
 * the text is indented by two spaces, so equal envelopes always render to
 * identical bytes. Characters outside ASCII are written as unicode
 * escapes.
 *
 * <pre>{@code
 * {
 *   "data": [],
 *   "head": "8f...",
 *   "link": "http://localhost:8080/state?head=8f..."
 * }
 * }</pre>
 */
public final class Envelope {

    private static final ObjectWriter WRITER = JsonSupport.MAPPER
            .writer(new EnvelopePrinter())
            .with(JsonWriteFeature.ESCAPE_NON_ASCII);

    private Envelope() {
        // Utility class
    }

    /**
     * @param data     the payload, omitted when {@code null}
     * @param metadata the head and link, omitted when {@code null}
     * @param status   the HTTP status to send
     */
    public static GatewayResponse wrap(final @Nullable Object data, final @Nullable Metadata metadata, final int status) {
        final ObjectNode envelope = metadata == null
                ? JsonSupport.MAPPER.createObjectNode()
                : JsonSupport.MAPPER.valueToTree(metadata);
        if (data != null) {
            envelope.set("data", JsonSupport.MAPPER.valueToTree(data));
        }
        return GatewayResponse.json(status, render(envelope));
    }

    public static GatewayResponse wrap(final @Nullable Object data, final @Nullable Metadata metadata) {
        return wrap(data, metadata, 200);
    }

    /**
     * @return the response reporting {@code error} to the client
     */
    public static GatewayResponse error(final ApiError error) {
        final ObjectNode body = JsonSupport.MAPPER.createObjectNode();
        body.putObject("error")
                .put("code", error.code())
                .put("message", error.message())
                .put("title", error.title());
        return GatewayResponse.json(error.httpStatus(), render(body));
    }

    static String render(final JsonNode node) {
        try {
            return WRITER.writeValueAsString(sortKeys(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static JsonNode sortKeys(final JsonNode node) {
        if (node.isObject()) {
            final List<String> names = new ArrayList<>();
            final Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            Collections.sort(names);
            final ObjectNode sorted = JsonSupport.MAPPER.createObjectNode();
            for (String name : names) {
                sorted.set(name, sortKeys(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            final ArrayNode sorted = JsonSupport.MAPPER.createArrayNode();
            for (JsonNode element : node) {
                sorted.add(sortKeys(element));
            }
            return sorted;
        }
        return node;
    }
}
