package io.ledgerrest.core.message;

/**
 * Outcome codes a validator attaches to its replies.
 *
 * <p>
 * Not every reply type can carry every status, and the same status may be
 * sent under a different number by different reply types. See
 * {@link MessageType#statuses()} and {@link MessageType#codeOf(ReplyStatus)}.
 */
public enum ReplyStatus {
    STATUS_UNSET,
    OK,
    INTERNAL_ERROR,
    NOT_READY,
    NO_ROOT,
    NO_RESOURCE,
    INVALID_BATCH,
    INVALID_ID,
    INVALID_ADDRESS
}
