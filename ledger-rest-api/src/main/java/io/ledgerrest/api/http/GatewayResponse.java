package io.ledgerrest.api.http;

import java.util.Objects;

/**
 * A complete HTTP response, independent of the server carrying it.
 *
 * @param status      the HTTP status code
 * @param contentType the value of the {@code Content-Type} header
 * @param body        the response text, sent as UTF-8
 */
public record GatewayResponse(int status, String contentType, String body) {

    public static final String APPLICATION_JSON = "application/json";

    public GatewayResponse {
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(body, "body");
    }

    public static GatewayResponse json(final int status, final String body) {
        return new GatewayResponse(status, APPLICATION_JSON, body);
    }
}
