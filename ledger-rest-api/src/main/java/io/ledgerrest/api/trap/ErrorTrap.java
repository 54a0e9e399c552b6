package io.ledgerrest.api.trap;

import io.ledgerrest.core.error.ApiError;
import io.ledgerrest.core.message.ReplyStatus;
import java.util.Objects;

/**
 * Maps one validator reply status to the client error it stands for.
 *
 * @param trigger the status that springs the trap
 * @param error   the error reported when it does
 */
public record ErrorTrap(ReplyStatus trigger, ApiError error) {

    public ErrorTrap {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(error, "error");
    }

    /**
     * @throws io.ledgerrest.core.error.ApiException if {@code status} is the trigger
     */
    public void check(final ReplyStatus status) {
        if (status == trigger) {
            throw error.exception();
        }
    }
}
