package io.ledgerrest.api.envelope;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.ledgerrest.api.http.GatewayRequest;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The {@code head} and {@code link} that accompany an envelope's data.
 *
 * @param head the block the query ran against, when the validator named one
 * @param link a URL that repeats the query
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Metadata(@Nullable String head, String link) {

    public Metadata {
        Objects.requireNonNull(link, "link");
    }

    public static Metadata link(final String link) {
        return new Metadata(null, link);
    }

    /**
     * Builds the metadata for {@code request} answered at {@code headId}.
     *
     * <p>
     * Without a head the link is the request URL verbatim. With one, the link
     * pins the query to that head: {@code head=<headId>} comes first, then
     * every other query pair of the request in its original order.
     *
     * @param headId the head the validator reported, {@code null} or empty if none
     */
    public static Metadata compute(final GatewayRequest request, final @Nullable String headId) {
        if (headId == null || headId.isEmpty()) {
            return link(request.url());
        }
        final StringBuilder link = new StringBuilder()
                .append(request.scheme()).append("://").append(request.host())
                .append(request.path())
                .append("?head=").append(headId);
        for (Map.Entry<String, String> pair : request.query()) {
            if (!pair.getKey().equals("head")) {
                link.append('&').append(pair.getKey()).append('=').append(pair.getValue());
            }
        }
        return new Metadata(headId, link.toString());
    }
}
