package io.ledgerrest.core.error;

import java.util.Objects;

/**
 * A failure that is reported to the HTTP client as-is.
 *
 * <p>
 * Thrown for malformed client input before anything is sent to the validator,
 * and by error traps when a validator reply carries a status that maps to an
 * HTTP error.
 */
public final class ApiException extends GatewayException {

    private final ApiError error;

    public ApiException(final ApiError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ApiException(final ApiError error, final Throwable cause) {
        super(Objects.requireNonNull(error, "error").message(), cause);
        this.error = error;
    }

    public ApiError error() {
        return error;
    }

    public int httpStatus() {
        return error.httpStatus();
    }

    @Override
    public String toString() {
        return "ApiException{"
                + "error="
                + error
                + ", status="
                + error.httpStatus()
                + ", code="
                + error.code()
                + "}";
    }
}
