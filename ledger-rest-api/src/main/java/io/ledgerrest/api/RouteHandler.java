package io.ledgerrest.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageLite;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.Parser;
import io.ledgerrest.api.envelope.Envelope;
import io.ledgerrest.api.envelope.Metadata;
import io.ledgerrest.api.expand.HeaderExpander;
import io.ledgerrest.api.expand.RecordKind;
import io.ledgerrest.api.http.GatewayRequest;
import io.ledgerrest.api.http.GatewayResponse;
import io.ledgerrest.api.internal.JsonSupport;
import io.ledgerrest.api.internal.ProtoJson;
import io.ledgerrest.api.trap.ErrorTrap;
import io.ledgerrest.api.trap.ErrorTraps;
import io.ledgerrest.api.trap.TrapChain;
import io.ledgerrest.core.error.ApiError;
import io.ledgerrest.core.error.ApiException;
import io.ledgerrest.core.error.TransportException;
import io.ledgerrest.core.error.WireFormatException;
import io.ledgerrest.core.message.Message;
import io.ledgerrest.core.message.MessageType;
import io.ledgerrest.core.protobuf.Batch;
import io.ledgerrest.core.protobuf.BatchList;
import io.ledgerrest.core.protobuf.BatchStatus;
import io.ledgerrest.core.protobuf.ClientBatchGetRequest;
import io.ledgerrest.core.protobuf.ClientBatchGetResponse;
import io.ledgerrest.core.protobuf.ClientBatchListRequest;
import io.ledgerrest.core.protobuf.ClientBatchListResponse;
import io.ledgerrest.core.protobuf.ClientBatchStatusRequest;
import io.ledgerrest.core.protobuf.ClientBatchStatusResponse;
import io.ledgerrest.core.protobuf.ClientBatchSubmitRequest;
import io.ledgerrest.core.protobuf.ClientBatchSubmitResponse;
import io.ledgerrest.core.protobuf.ClientBlockGetRequest;
import io.ledgerrest.core.protobuf.ClientBlockGetResponse;
import io.ledgerrest.core.protobuf.ClientBlockListRequest;
import io.ledgerrest.core.protobuf.ClientBlockListResponse;
import io.ledgerrest.core.protobuf.ClientStateGetRequest;
import io.ledgerrest.core.protobuf.ClientStateGetResponse;
import io.ledgerrest.core.protobuf.ClientStateListRequest;
import io.ledgerrest.core.protobuf.ClientStateListResponse;
import io.ledgerrest.rpc.Connection;
import io.ledgerrest.rpc.ReplyFuture;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The gateway's endpoints.
 *
 * <p>
 * Every handler follows the same path: validate the HTTP input, build the
 * typed validator request, send it over the shared {@link Connection}, wait
 * at most the configured timeout for the reply, run the reply status through
 * the {@link TrapChain}, expand encoded headers, and wrap the result in an
 * {@link Envelope}. Failures are thrown as {@link ApiException}; a lost or
 * silent validator becomes {@code VALIDATOR_DISCONNECTED} or
 * {@code VALIDATOR_TIMED_OUT}. Nothing is retried.
 *
 * <p><b>Thread Safety:</b> handlers hold no per-request state and may run on
 * any number of threads at once. Each blocks its calling thread while it
 * waits for the validator.
 */
public final class RouteHandler {

    private static final Logger log = LoggerFactory.getLogger(RouteHandler.class);

    static final String OCTET_STREAM = "application/octet-stream";

    /** Largest value the validator accepts as a commit wait, in seconds. */
    private static final long MAX_WAIT_SECONDS = 0xFFFFFFFFL;

    private final Connection connection;
    private final Duration timeout;

    /**
     * @param connection the connection to the validator
     * @param timeout    how long to wait for each validator reply
     */
    public RouteHandler(final Connection connection, final Duration timeout) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Whether, and how long, the validator should wait for commits before
     * replying.
     *
     * @param waitForCommit {@code true} to wait
     * @param seconds       the validator-side wait, {@code 0} when not waiting
     */
    record WaitSetting(boolean waitForCommit, long seconds) {
        static final WaitSetting NO_WAIT = new WaitSetting(false, 0);
    }

    /**
     * {@code POST /batches}: submits an encoded {@link BatchList}.
     *
     * <ul>
     *   <li>202 - submitted, no statuses requested; link to the batch status</li>
     *   <li>200 - waited, but some batches are not committed; data holds the statuses</li>
     *   <li>201 - waited and every batch is committed; link to the batches</li>
     * </ul>
     */
    public GatewayResponse submitBatches(final GatewayRequest request) {
        if (!request.hasMediaType(OCTET_STREAM)) {
            throw ApiError.WRONG_CONTENT_TYPE.exception();
        }
        if (request.body().length == 0) {
            throw ApiError.NO_BATCHES_SUBMITTED.exception();
        }
        final BatchList batchList;
        try {
            batchList = BatchList.parseFrom(request.body());
        } catch (InvalidProtocolBufferException e) {
            throw new ApiException(ApiError.BAD_BATCH_LIST_ENCODING, e);
        }
        if (batchList.getBatchesCount() == 0) {
            throw ApiError.NO_BATCHES_SUBMITTED.exception();
        }

        final WaitSetting wait = waitSetting(request);
        final ClientBatchSubmitResponse response = query(
                MessageType.CLIENT_BATCH_SUBMIT_REQUEST,
                ClientBatchSubmitRequest.newBuilder()
                        .addAllBatches(batchList.getBatchesList())
                        .setWaitForCommit(wait.waitForCommit())
                        .setTimeout((int) wait.seconds())
                        .build(),
                ClientBatchSubmitResponse.parser(),
                ErrorTraps.invalidBatch());

        final String ids = batchList.getBatchesList().stream()
                .map(Batch::getHeaderSignature)
                .collect(Collectors.joining(","));
        final String link = request.scheme() + "://" + request.host() + "/batch_status?id=" + ids;

        final Map<String, BatchStatus> statuses = response.getBatchStatusesMap();
        if (statuses.isEmpty()) {
            return Envelope.wrap(null, Metadata.link(link), 202);
        }
        if (statuses.values().stream().anyMatch(s -> s != BatchStatus.COMMITTED)) {
            return Envelope.wrap(statusNames(statuses), Metadata.link(link), 200);
        }
        return Envelope.wrap(null, Metadata.link(link.replace("batch_status", "batches")), 201);
    }

    /**
     * {@code GET|POST /batch_status}: reports the commit status of batches.
     *
     * <p>
     * GET takes a comma separated {@code id} query parameter; POST takes a
     * JSON array of id strings. Only GET responses carry metadata.
     */
    public GatewayResponse listStatuses(final GatewayRequest request) {
        final boolean post = "POST".equals(request.method());
        final List<String> ids = post ? statusIdsFromBody(request) : statusIdsFromQuery(request);

        final WaitSetting wait = waitSetting(request);
        final ClientBatchStatusResponse response = query(
                MessageType.CLIENT_BATCH_STATUS_REQUEST,
                ClientBatchStatusRequest.newBuilder()
                        .addAllBatchIds(ids)
                        .setWaitForCommit(wait.waitForCommit())
                        .setTimeout((int) wait.seconds())
                        .build(),
                ClientBatchStatusResponse.parser(),
                ErrorTraps.statusesNotReturned());

        final Metadata metadata = post ? null : Metadata.compute(request, null);
        return Envelope.wrap(statusNames(response.getBatchStatusesMap()), metadata);
    }

    /**
     * {@code GET /state}: lists state leaves, optionally under an address
     * prefix and at a given head.
     */
    public GatewayResponse listState(final GatewayRequest request) {
        final ClientStateListRequest.Builder builder = ClientStateListRequest.newBuilder();
        optional(request, "head", builder::setHeadId);
        optional(request, "address", builder::setAddress);
        final ClientStateListResponse response = query(
                MessageType.CLIENT_STATE_LIST_REQUEST,
                builder.build(),
                ClientStateListResponse.parser());

        return Envelope.wrap(
                ProtoJson.toArray(response.getLeavesList()),
                Metadata.compute(request, response.getHeadId()));
    }

    /**
     * {@code GET /state/{address}}: the base64 data stored at one address.
     */
    public GatewayResponse fetchState(final GatewayRequest request) {
        final ClientStateGetRequest.Builder builder = ClientStateGetRequest.newBuilder()
                .setAddress(request.pathParam("address"));
        optional(request, "head", builder::setHeadId);
        final ClientStateGetResponse response = query(
                MessageType.CLIENT_STATE_GET_REQUEST,
                builder.build(),
                ClientStateGetResponse.parser(),
                ErrorTraps.missingLeaf(),
                ErrorTraps.badAddress());

        return Envelope.wrap(
                Base64.getEncoder().encodeToString(response.getValue().toByteArray()),
                Metadata.compute(request, response.getHeadId()));
    }

    /**
     * {@code GET /blocks}: fully expanded blocks, optionally filtered by id.
     */
    public GatewayResponse listBlocks(final GatewayRequest request) {
        final ClientBlockListRequest.Builder builder = ClientBlockListRequest.newBuilder()
                .addAllBlockIds(filterIds(request));
        optional(request, "head", builder::setHeadId);
        final ClientBlockListResponse response = query(
                MessageType.CLIENT_BLOCK_LIST_REQUEST,
                builder.build(),
                ClientBlockListResponse.parser());

        return Envelope.wrap(
                expandAll(RecordKind.BLOCK, response.getBlocksList()),
                Metadata.compute(request, response.getHeadId()));
    }

    /**
     * {@code GET /blocks/{block_id}}: one fully expanded block.
     */
    public GatewayResponse fetchBlock(final GatewayRequest request) {
        final ClientBlockGetResponse response = query(
                MessageType.CLIENT_BLOCK_GET_REQUEST,
                ClientBlockGetRequest.newBuilder().setBlockId(request.pathParam("block_id")).build(),
                ClientBlockGetResponse.parser(),
                ErrorTraps.missingBlock(),
                ErrorTraps.invalidBlockId());

        requirePresent(response.hasBlock(), RecordKind.BLOCK);
        return Envelope.wrap(expand(RecordKind.BLOCK, response.getBlock()), Metadata.compute(request, null));
    }

    /**
     * {@code GET /batches}: fully expanded batches, optionally filtered by id.
     */
    public GatewayResponse listBatches(final GatewayRequest request) {
        final ClientBatchListRequest.Builder builder = ClientBatchListRequest.newBuilder()
                .addAllBatchIds(filterIds(request));
        optional(request, "head", builder::setHeadId);
        final ClientBatchListResponse response = query(
                MessageType.CLIENT_BATCH_LIST_REQUEST,
                builder.build(),
                ClientBatchListResponse.parser());

        return Envelope.wrap(
                expandAll(RecordKind.BATCH, response.getBatchesList()),
                Metadata.compute(request, response.getHeadId()));
    }

    /**
     * {@code GET /batches/{batch_id}}: one fully expanded batch.
     */
    public GatewayResponse fetchBatch(final GatewayRequest request) {
        final ClientBatchGetResponse response = query(
                MessageType.CLIENT_BATCH_GET_REQUEST,
                ClientBatchGetRequest.newBuilder().setBatchId(request.pathParam("batch_id")).build(),
                ClientBatchGetResponse.parser(),
                ErrorTraps.missingBatch(),
                ErrorTraps.invalidBatchId());

        requirePresent(response.hasBatch(), RecordKind.BATCH);
        return Envelope.wrap(expand(RecordKind.BATCH, response.getBatch()), Metadata.compute(request, null));
    }

    /**
     * Parses the {@code wait} query parameter.
     *
     * <p>
     * Absent or {@code false} (any case) means no wait. An integer is passed
     * to the validator as its wait in seconds. Anything else, including a
     * negative or oversized integer, waits 95% of the gateway timeout.
     */
    WaitSetting waitSetting(final GatewayRequest request) {
        final String wait = request.queryParam("wait");
        if (wait == null || wait.equalsIgnoreCase("false")) {
            return WaitSetting.NO_WAIT;
        }
        final long fallback = (long) (timeout.toSeconds() * 0.95);
        try {
            final long seconds = Long.parseLong(wait.strip());
            return new WaitSetting(true, seconds < 0 || seconds > MAX_WAIT_SECONDS ? fallback : seconds);
        } catch (NumberFormatException e) {
            return new WaitSetting(true, fallback);
        }
    }

    private <R extends MessageOrBuilder> R query(
            final MessageType requestType,
            final MessageLite request,
            final Parser<R> parser,
            final ErrorTrap... traps) {
        final Message reply = await(requestType, connection.send(requestType, request.toByteArray()));

        final MessageType expected = requestType.responseType();
        if (reply.messageType() != expected) {
            throw new WireFormatException(
                    "Expected " + expected + " but validator sent " + reply.messageType());
        }
        final R parsed;
        try {
            parsed = parser.parseFrom(reply.content());
        } catch (InvalidProtocolBufferException e) {
            throw new WireFormatException("Malformed " + expected + ": " + e.getMessage(), e);
        }
        TrapChain.check(expected, expected.statusOf(parsed), traps);
        return parsed;
    }

    private Message await(final MessageType requestType, final ReplyFuture future) {
        try {
            return future.result(timeout);
        } catch (TransportException e) {
            log.warn("{} failed: {}", requestType, e.getMessage());
            final ApiError error = e.kind() == TransportException.Kind.TIMED_OUT
                    ? ApiError.VALIDATOR_TIMED_OUT
                    : ApiError.VALIDATOR_DISCONNECTED;
            throw new ApiException(error, e);
        }
    }

    private static List<String> statusIdsFromQuery(final GatewayRequest request) {
        final String ids = request.queryParam("id");
        if (ids == null) {
            throw ApiError.MISSING_STATUS_ID.exception();
        }
        return Arrays.asList(ids.split(",", -1));
    }

    private static List<String> statusIdsFromBody(final GatewayRequest request) {
        if (!request.hasMediaType(GatewayResponse.APPLICATION_JSON)) {
            throw ApiError.STATUS_WRONG_CONTENT_TYPE.exception();
        }
        final JsonNode body;
        try {
            body = JsonSupport.MAPPER.readTree(request.body());
        } catch (IOException e) {
            throw new ApiException(ApiError.STATUS_BODY_INVALID, e);
        }
        if (body == null || !body.isArray()) {
            throw ApiError.STATUS_BODY_INVALID.exception();
        }
        if (body.isEmpty()) {
            throw ApiError.MISSING_STATUS_ID.exception();
        }
        final List<String> ids = new ArrayList<>(body.size());
        for (JsonNode id : body) {
            if (!id.isTextual()) {
                throw ApiError.STATUS_BODY_INVALID.exception();
            }
            ids.add(id.asText());
        }
        return ids;
    }

    /**
     * @return the ids in the {@code id} query parameter, or an empty list
     *         (no filter) when it is absent or empty
     */
    private static List<String> filterIds(final GatewayRequest request) {
        final String ids = request.queryParam("id");
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(ids.split(",", -1));
    }

    private static void optional(final GatewayRequest request, final String name, final Consumer<String> setter) {
        final String value = request.queryParam(name);
        if (value != null) {
            setter.accept(value);
        }
    }

    /**
     * @return the statuses by batch id, each written as its name
     */
    private static Map<String, String> statusNames(final Map<String, BatchStatus> statuses) {
        final Map<String, String> names = new TreeMap<>();
        statuses.forEach((id, status) -> names.put(id, status.name()));
        return names;
    }

    private static ObjectNode expand(final RecordKind kind, final MessageOrBuilder record) {
        return HeaderExpander.expand(kind, ProtoJson.toTree(record));
    }

    private static ArrayNode expandAll(final RecordKind kind, final List<? extends MessageOrBuilder> records) {
        final ArrayNode expanded = JsonSupport.MAPPER.createArrayNode();
        for (MessageOrBuilder record : records) {
            expanded.add(expand(kind, record));
        }
        return expanded;
    }

    private static void requirePresent(final boolean present, final RecordKind kind) {
        if (!present) {
            throw new WireFormatException("Validator reported OK but sent no " + kind.displayName());
        }
    }
}
