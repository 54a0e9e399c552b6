package io.ledgerrest.core.message;

import com.google.protobuf.Descriptors.EnumDescriptor;
import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.MessageOrBuilder;
import io.ledgerrest.core.error.WireFormatException;
import io.ledgerrest.core.protobuf.ClientBatchGetResponse;
import io.ledgerrest.core.protobuf.ClientBatchListResponse;
import io.ledgerrest.core.protobuf.ClientBatchStatusResponse;
import io.ledgerrest.core.protobuf.ClientBatchSubmitResponse;
import io.ledgerrest.core.protobuf.ClientBlockGetResponse;
import io.ledgerrest.core.protobuf.ClientBlockListResponse;
import io.ledgerrest.core.protobuf.ClientStateGetResponse;
import io.ledgerrest.core.protobuf.ClientStateListResponse;
import io.ledgerrest.core.protobuf.Validator;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Kinds of frame the gateway exchanges with the validator.
 *
 * <p>
 * Each constant mirrors the value of the same name in the validator's
 * {@code Message.MessageType} enumeration. Every request type is answered by
 * the reply type of the same name ending in {@code _RESPONSE}.
 *
 * <p>
 * A reply type knows the {@code Status} enumeration of its reply record. The
 * statuses, and the numbers they are sent as, come from that enumeration, so
 * two reply types can send the same status under different numbers and each
 * can carry only the statuses it declares. Request types carry no status.
 */
public enum MessageType {
    CLIENT_BATCH_SUBMIT_REQUEST,
    CLIENT_BATCH_SUBMIT_RESPONSE(ClientBatchSubmitResponse.Status.getDescriptor()),
    CLIENT_BATCH_STATUS_REQUEST,
    CLIENT_BATCH_STATUS_RESPONSE(ClientBatchStatusResponse.Status.getDescriptor()),
    CLIENT_STATE_LIST_REQUEST,
    CLIENT_STATE_LIST_RESPONSE(ClientStateListResponse.Status.getDescriptor()),
    CLIENT_STATE_GET_REQUEST,
    CLIENT_STATE_GET_RESPONSE(ClientStateGetResponse.Status.getDescriptor()),
    CLIENT_BLOCK_LIST_REQUEST,
    CLIENT_BLOCK_LIST_RESPONSE(ClientBlockListResponse.Status.getDescriptor()),
    CLIENT_BLOCK_GET_REQUEST,
    CLIENT_BLOCK_GET_RESPONSE(ClientBlockGetResponse.Status.getDescriptor()),
    CLIENT_BATCH_LIST_REQUEST,
    CLIENT_BATCH_LIST_RESPONSE(ClientBatchListResponse.Status.getDescriptor()),
    CLIENT_BATCH_GET_REQUEST,
    CLIENT_BATCH_GET_RESPONSE(ClientBatchGetResponse.Status.getDescriptor());

    private static final String STATUS_FIELD = "status";
    private static final Map<Integer, MessageType> BY_CODE = new HashMap<>();

    static {
        for (MessageType type : values()) {
            BY_CODE.put(type.code(), type);
        }
    }

    private final Validator.Message.MessageType wireType;
    private final @Nullable EnumDescriptor statusEnum;
    private final List<ReplyStatus> statuses;

    MessageType() {
        this(null);
    }

    MessageType(final @Nullable EnumDescriptor statusEnum) {
        this.wireType = Validator.Message.MessageType.valueOf(name());
        this.statusEnum = statusEnum;
        if (statusEnum == null) {
            this.statuses = List.of();
        } else {
            final List<ReplyStatus> table = new ArrayList<>();
            for (EnumValueDescriptor value : statusEnum.getValues()) {
                table.add(ReplyStatus.valueOf(value.getName()));
            }
            this.statuses = List.copyOf(table);
        }
    }

    /**
     * @return the number this type is sent as
     */
    public int code() {
        return wireType.getNumber();
    }

    public Validator.Message.MessageType wireType() {
        return wireType;
    }

    public boolean isReply() {
        return statusEnum != null;
    }

    /**
     * @return the statuses this reply type can carry, in declaration order;
     *         empty for request types
     */
    public List<ReplyStatus> statuses() {
        return statuses;
    }

    public boolean supports(final ReplyStatus status) {
        return statuses.contains(status);
    }

    /**
     * Resolves a status number sent under this reply type.
     *
     * @throws WireFormatException if this reply type declares no status with
     *                             that number
     */
    public ReplyStatus status(final int wireCode) {
        final EnumValueDescriptor value = statusEnum == null ? null : statusEnum.findValueByNumber(wireCode);
        if (value == null) {
            throw new WireFormatException("Status code " + wireCode + " is not defined for " + this);
        }
        return ReplyStatus.valueOf(value.getName());
    }

    /**
     * @return the number {@code status} is sent as under this reply type
     * @throws IllegalArgumentException if this type cannot carry {@code status}
     */
    public int codeOf(final ReplyStatus status) {
        final EnumValueDescriptor value = statusEnum == null ? null : statusEnum.findValueByName(status.name());
        if (value == null) {
            throw new IllegalArgumentException(this + " cannot carry status " + status);
        }
        return value.getNumber();
    }

    /**
     * Reads the {@code status} field of a decoded reply of this type.
     *
     * @throws IllegalArgumentException if {@code reply} is not a record of this
     *                                  reply type
     * @throws WireFormatException      if the validator sent an undeclared status
     */
    public ReplyStatus statusOf(final MessageOrBuilder reply) {
        final FieldDescriptor field = reply.getDescriptorForType().findFieldByName(STATUS_FIELD);
        if (statusEnum == null || field == null
                || field.getJavaType() != FieldDescriptor.JavaType.ENUM
                || field.getEnumType() != statusEnum) {
            throw new IllegalArgumentException(
                    reply.getDescriptorForType().getName() + " is not a " + this + " record");
        }
        return status(((EnumValueDescriptor) reply.getField(field)).getNumber());
    }

    /**
     * @return the reply type answering this request type
     * @throws IllegalStateException if this is already a reply type
     */
    public MessageType responseType() {
        if (isReply()) {
            throw new IllegalStateException(this + " is a reply type");
        }
        return valueOf(name().replace("_REQUEST", "_RESPONSE"));
    }

    /**
     * @throws WireFormatException if no message type uses {@code code}
     */
    public static MessageType fromCode(final int code) {
        final MessageType type = BY_CODE.get(code);
        if (type == null) {
            throw new WireFormatException("Unknown message type " + code);
        }
        return type;
    }
}
