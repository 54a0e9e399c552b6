package io.ledgerrest.core.error;

/**
 * Base runtime exception for all gateway failures.
 *
 * <p>
 * The hierarchy is sealed so the HTTP layer can map every gateway failure to
 * an outcome with an exhaustive set of catch clauses:
 *
 * <pre>
 * GatewayException
 * ├── {@link ApiException}        - a client-visible error with its HTTP status
 * ├── {@link TransportException}  - the validator connection timed out or dropped
 * └── {@link WireFormatException} - bytes that violate the wire schema
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     reply = connection.send(type, content).result(timeout);
 * } catch (TransportException e) {
 *     throw new ApiException(e.kind() == TransportException.Kind.TIMED_OUT
 *             ? ApiError.VALIDATOR_TIMED_OUT
 *             : ApiError.VALIDATOR_DISCONNECTED, e);
 * }
 * }</pre>
 */
public sealed class GatewayException extends RuntimeException
        permits ApiException,
        TransportException,
        WireFormatException {

    public GatewayException(final String message) {
        super(message);
    }

    public GatewayException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
