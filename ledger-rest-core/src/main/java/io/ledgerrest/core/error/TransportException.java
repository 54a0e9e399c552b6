package io.ledgerrest.core.error;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The validator did not answer a request: either no reply arrived before the
 * caller's deadline, or the connection went away while the request was
 * outstanding.
 *
 * <p>
 * Transport failures are never retried by the gateway.
 */
public final class TransportException extends GatewayException {

    /**
     * Why no reply was delivered.
     */
    public enum Kind {
        /** The caller's timeout elapsed first. */
        TIMED_OUT,
        /** The connection was lost, closed, or never established. */
        DISCONNECTED
    }

    private final Kind kind;
    private final @Nullable String correlationId;

    public TransportException(final Kind kind, final String message, final @Nullable String correlationId) {
        this(kind, message, correlationId, null);
    }

    public TransportException(
            final Kind kind,
            final String message,
            final @Nullable String correlationId,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, correlationId), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.correlationId = correlationId;
    }

    public Kind kind() {
        return kind;
    }

    public @Nullable String correlationId() {
        return correlationId;
    }

    private static String augmentMessage(final String message, final @Nullable String correlationId) {
        if (correlationId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[correlationId=" + correlationId + "] " + message;
    }
}
