package io.ledgerrest.api.trap;

import io.ledgerrest.core.error.ApiError;
import io.ledgerrest.core.message.ReplyStatus;

/**
 * Factories for the traps individual endpoints add to the chain.
 */
public final class ErrorTraps {

    private ErrorTraps() {
        // Utility class
    }

    public static ErrorTrap invalidBatch() {
        return new ErrorTrap(ReplyStatus.INVALID_BATCH, ApiError.SUBMITTED_BATCHES_INVALID);
    }

    public static ErrorTrap statusesNotReturned() {
        return new ErrorTrap(ReplyStatus.NO_RESOURCE, ApiError.STATUS_RESPONSE_MISSING);
    }

    public static ErrorTrap missingLeaf() {
        return new ErrorTrap(ReplyStatus.NO_RESOURCE, ApiError.STATE_NOT_FOUND);
    }

    public static ErrorTrap badAddress() {
        return new ErrorTrap(ReplyStatus.INVALID_ADDRESS, ApiError.INVALID_STATE_ADDRESS);
    }

    public static ErrorTrap missingBlock() {
        return new ErrorTrap(ReplyStatus.NO_RESOURCE, ApiError.BLOCK_NOT_FOUND);
    }

    public static ErrorTrap invalidBlockId() {
        return new ErrorTrap(ReplyStatus.INVALID_ID, ApiError.INVALID_RESOURCE_ID);
    }

    public static ErrorTrap missingBatch() {
        return new ErrorTrap(ReplyStatus.NO_RESOURCE, ApiError.BATCH_NOT_FOUND);
    }

    public static ErrorTrap invalidBatchId() {
        return new ErrorTrap(ReplyStatus.INVALID_ID, ApiError.INVALID_RESOURCE_ID);
    }

    static ErrorTrap unknown() {
        return new ErrorTrap(ReplyStatus.INTERNAL_ERROR, ApiError.UNKNOWN_VALIDATOR_ERROR);
    }

    static ErrorTrap notReady() {
        return new ErrorTrap(ReplyStatus.NOT_READY, ApiError.VALIDATOR_NOT_READY);
    }

    static ErrorTrap missingHead() {
        return new ErrorTrap(ReplyStatus.NO_ROOT, ApiError.HEAD_NOT_FOUND);
    }
}
