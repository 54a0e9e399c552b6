package io.ledgerrest.api.http;

import io.netty.handler.codec.http.QueryStringDecoder;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An HTTP request as the route handlers see it.
 *
 * <p>
 * Query pairs keep the order and multiplicity they had on the wire;
 * {@link #queryParam(String)} returns the first value of a name.
 *
 * @param method      the HTTP method, upper case
 * @param scheme      {@code http} or {@code https}
 * @param host        the {@code Host} the client addressed, with port if given
 * @param path        the decoded path
 * @param uri         the path and query exactly as received
 * @param query       the decoded query pairs in wire order
 * @param pathParams  values bound by the matched route template
 * @param contentType the {@code Content-Type} header, if any
 * @param body        the request body, empty when there is none
 */
public record GatewayRequest(
        String method,
        String scheme,
        String host,
        String path,
        String uri,
        List<Map.Entry<String, String>> query,
        Map<String, String> pathParams,
        @Nullable String contentType,
        byte[] body) {

    public GatewayRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(uri, "uri");
        query = List.copyOf(query);
        pathParams = Map.copyOf(pathParams);
        Objects.requireNonNull(body, "body");
    }

    /**
     * Builds a request from its raw parts, splitting and decoding the query.
     *
     * @param uri the request target, path plus optional query
     */
    public static GatewayRequest of(
            final String method,
            final String scheme,
            final String host,
            final String uri,
            final @Nullable String contentType,
            final byte[] body) {
        final QueryStringDecoder decoder = new QueryStringDecoder(uri);
        return new GatewayRequest(
                method.toUpperCase(Locale.ROOT),
                scheme,
                host,
                decoder.path(),
                uri,
                parseQuery(decoder.rawQuery()),
                Map.of(),
                contentType,
                body);
    }

    /**
     * @return the same request with the route's path parameters bound
     */
    public GatewayRequest withPathParams(final Map<String, String> params) {
        return new GatewayRequest(method, scheme, host, path, uri, query, params, contentType, body);
    }

    /**
     * @return the absolute URL the client requested
     */
    public String url() {
        return scheme + "://" + host + uri;
    }

    /**
     * @return the first value of {@code name}, or {@code null} if absent
     */
    public @Nullable String queryParam(final String name) {
        for (Map.Entry<String, String> pair : query) {
            if (pair.getKey().equals(name)) {
                return pair.getValue();
            }
        }
        return null;
    }

    /**
     * @return the bound value, or an empty string if the route has no such
     *         parameter
     */
    public String pathParam(final String name) {
        return pathParams.getOrDefault(name, "");
    }

    /**
     * @return {@code true} if the media type of the body, ignoring parameters
     *         and case, is {@code mediaType}
     */
    public boolean hasMediaType(final String mediaType) {
        if (contentType == null) {
            return false;
        }
        final int semicolon = contentType.indexOf(';');
        final String type = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
        return type.trim().equalsIgnoreCase(mediaType);
    }

    private static List<Map.Entry<String, String>> parseQuery(final String rawQuery) {
        if (rawQuery.isEmpty()) {
            return List.of();
        }
        final List<Map.Entry<String, String>> pairs = new ArrayList<>();
        for (String component : rawQuery.split("&")) {
            if (component.isEmpty()) {
                continue;
            }
            final int eq = component.indexOf('=');
            final String name = eq < 0 ? component : component.substring(0, eq);
            final String value = eq < 0 ? "" : component.substring(eq + 1);
            pairs.add(new AbstractMap.SimpleImmutableEntry<>(
                    QueryStringDecoder.decodeComponent(name),
                    QueryStringDecoder.decodeComponent(value)));
        }
        return Collections.unmodifiableList(pairs);
    }
}
