package io.ledgerrest.core.error;

/**
 * Bytes that do not decode under the wire schema: a corrupt frame, an unknown
 * message type or status code, or a malformed nested header.
 *
 * <p>
 * When raised for validator output this is a contract violation, not a client
 * error, and surfaces as an internal server error.
 */
public final class WireFormatException extends GatewayException {

    public WireFormatException(final String message) {
        super(message);
    }

    public WireFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
