package io.ledgerrest.core.error;

/**
 * Every error the gateway reports to HTTP clients.
 *
 * <p>
 * Each constant carries the HTTP status, a stable numeric code that clients
 * can switch on, a short title and a human readable message. The codes are
 * part of the public API and must not be renumbered.
 */
public enum ApiError {

    UNKNOWN_VALIDATOR_ERROR(500, 10, "Unknown Validator Error",
            "An unknown error occurred with the validator while processing your request"),
    VALIDATOR_NOT_READY(503, 15, "Validator Not Ready",
            "The validator has no genesis block, and is not yet ready to be queried"),
    VALIDATOR_TIMED_OUT(503, 17, "Validator Timed Out",
            "The request timed out while waiting for a response from the validator"),
    VALIDATOR_DISCONNECTED(503, 18, "Validator Disconnected",
            "The validator disconnected before sending a response"),
    STATUS_RESPONSE_MISSING(500, 27, "Unable to Fetch Statuses",
            "An unknown error occurred while attempting to fetch batch statuses"),
    NO_BATCHES_SUBMITTED(400, 30, "No Batches Submitted",
            "The request body must contain an encoded BatchList with at least one Batch"),
    BAD_BATCH_LIST_ENCODING(400, 35, "Bad BatchList Encoding",
            "The request body could not be decoded as a BatchList"),
    SUBMITTED_BATCHES_INVALID(400, 40, "Submitted Batches Invalid",
            "The submitted BatchList was rejected by the validator"),
    WRONG_CONTENT_TYPE(400, 42, "Wrong Content Type",
            "Batches must be submitted as a BatchList with a 'Content-Type' of 'application/octet-stream'"),
    STATUS_WRONG_CONTENT_TYPE(400, 43, "Wrong Content Type",
            "Requests for batch statuses sent as a POST must have a 'Content-Type' of 'application/json'"),
    STATUS_BODY_INVALID(400, 44, "Bad Status Request",
            "Requests for batch statuses sent as a POST must have a JSON formatted body with an array of "
                    + "at least one id string"),
    MISSING_STATUS_ID(400, 45, "Id Query Invalid or Missing",
            "Requests for batch statuses must specify at least one id, either as an 'id' query parameter "
                    + "or in a JSON array body"),
    HEAD_NOT_FOUND(404, 50, "Head Not Found",
            "There is no block with the id specified in the 'head' query parameter"),
    INVALID_RESOURCE_ID(400, 60, "Invalid Resource Id",
            "Blockchain items are identified by 128 character hex-strings"),
    INVALID_STATE_ADDRESS(400, 62, "Invalid State Address",
            "The state address requested is malformed"),
    BLOCK_NOT_FOUND(404, 70, "Block Not Found",
            "There is no block with the id specified in the blockchain"),
    BATCH_NOT_FOUND(404, 71, "Batch Not Found",
            "There is no batch with the id specified in the blockchain"),
    STATE_NOT_FOUND(404, 75, "State Not Found",
            "There is no state data at the address specified"),
    RESOURCE_NOT_FOUND(404, 80, "Resource Not Found",
            "There is no resource at the path requested"),
    METHOD_NOT_ALLOWED(405, 81, "Method Not Allowed",
            "The resource requested does not support this HTTP method"),
    INTERNAL_SERVER_ERROR(500, 90, "Internal Server Error",
            "The gateway failed unexpectedly while processing your request");

    private final int httpStatus;
    private final int code;
    private final String title;
    private final String message;

    ApiError(final int httpStatus, final int code, final String title, final String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.title = title;
        this.message = message;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public int code() {
        return code;
    }

    public String title() {
        return title;
    }

    public String message() {
        return message;
    }

    /**
     * @return a new exception reporting this error
     */
    public ApiException exception() {
        return new ApiException(this);
    }
}
