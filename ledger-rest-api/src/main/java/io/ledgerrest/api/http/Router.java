package io.ledgerrest.api.http;

import io.ledgerrest.api.RouteHandler;
import io.ledgerrest.api.envelope.Envelope;
import io.ledgerrest.core.error.ApiError;
import io.ledgerrest.core.error.ApiException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps method and path to a handler and turns every outcome into a response.
 *
 * <p>
 * Templates are matched segment by segment; a {@code {name}} segment binds
 * one non-empty path segment. A path no template matches is
 * {@code RESOURCE_NOT_FOUND}; a path some template matches under another
 * method is {@code METHOD_NOT_ALLOWED}.
 *
 * <p><b>Thread Safety:</b> routes are registered before the router is shared;
 * {@link #dispatch} may then be called from any number of threads.
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    /**
     * Handles one routed request.
     */
    @FunctionalInterface
    public interface Handler {
        GatewayResponse handle(GatewayRequest request);
    }

    /**
     * A resolved route.
     *
     * @param handler    the handler to call
     * @param pathParams the values bound by the template
     */
    public record Match(Handler handler, Map<String, String> pathParams) {
    }

    private record Route(String method, List<String> segments, Handler handler) {

        @Nullable Map<String, String> bind(final List<String> path) {
            if (path.size() != segments.size()) {
                return null;
            }
            final Map<String, String> params = new HashMap<>();
            for (int i = 0; i < segments.size(); i++) {
                final String template = segments.get(i);
                final String actual = path.get(i);
                if (template.startsWith("{") && template.endsWith("}")) {
                    if (actual.isEmpty()) {
                        return null;
                    }
                    params.put(template.substring(1, template.length() - 1), actual);
                } else if (!template.equals(actual)) {
                    return null;
                }
            }
            return params;
        }
    }

    private final List<Route> routes = new ArrayList<>();

    /**
     * @return a router serving every endpoint of {@code handlers}
     */
    public static Router forHandlers(final RouteHandler handlers) {
        return new Router()
                .add("POST", "/batches", handlers::submitBatches)
                .add("GET", "/batch_status", handlers::listStatuses)
                .add("POST", "/batch_status", handlers::listStatuses)
                .add("GET", "/state", handlers::listState)
                .add("GET", "/state/{address}", handlers::fetchState)
                .add("GET", "/blocks", handlers::listBlocks)
                .add("GET", "/blocks/{block_id}", handlers::fetchBlock)
                .add("GET", "/batches", handlers::listBatches)
                .add("GET", "/batches/{batch_id}", handlers::fetchBatch);
    }

    public Router add(final String method, final String template, final Handler handler) {
        Objects.requireNonNull(handler, "handler");
        if (!template.startsWith("/")) {
            throw new IllegalArgumentException("Route template must start with '/': " + template);
        }
        routes.add(new Route(method, segments(template), handler));
        return this;
    }

    /**
     * @throws ApiException {@code RESOURCE_NOT_FOUND} or {@code METHOD_NOT_ALLOWED}
     */
    public Match resolve(final String method, final String path) {
        final List<String> segments = segments(path);
        boolean pathKnown = false;
        for (Route route : routes) {
            final Map<String, String> params = route.bind(segments);
            if (params == null) {
                continue;
            }
            if (route.method().equals(method)) {
                return new Match(route.handler(), params);
            }
            pathKnown = true;
        }
        throw (pathKnown ? ApiError.METHOD_NOT_ALLOWED : ApiError.RESOURCE_NOT_FOUND).exception();
    }

    /**
     * Routes {@code request} and runs its handler.
     *
     * <p>
     * Never throws: {@link ApiException}s become their error response, and
     * anything else is logged and reported as {@code INTERNAL_SERVER_ERROR}.
     */
    public GatewayResponse dispatch(final GatewayRequest request) {
        final long start = System.nanoTime();
        GatewayResponse response;
        try {
            final Match match = resolve(request.method(), request.path());
            response = match.handler().handle(request.withPathParams(match.pathParams()));
        } catch (ApiException e) {
            response = Envelope.error(e.error());
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling {} {}", request.method(), request.uri(), e);
            response = Envelope.error(ApiError.INTERNAL_SERVER_ERROR);
        }
        if (log.isDebugEnabled()) {
            log.debug("{} {} -> {} ({}ms)", request.method(), request.uri(), response.status(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
        return response;
    }

    private static List<String> segments(final String path) {
        return Arrays.asList(path.substring(path.startsWith("/") ? 1 : 0).split("/", -1));
    }
}
