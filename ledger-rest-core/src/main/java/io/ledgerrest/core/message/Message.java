package io.ledgerrest.core.message;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageLite;
import io.ledgerrest.core.error.WireFormatException;
import io.ledgerrest.core.protobuf.Validator;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single frame on the validator connection.
 *
 * <p>
 * The frame body is a serialized validator {@code Message}; the length
 * prefix in front of it belongs to the transport.
 *
 * @param messageType   the kind of payload carried in {@code content}
 * @param correlationId pairs a reply with the request it answers
 * @param content       the serialized request or reply record
 */
public record Message(MessageType messageType, String correlationId, byte[] content) {

    public Message {
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(content, "content");
    }

    public static Message of(final MessageType messageType, final String correlationId, final MessageLite content) {
        return new Message(messageType, correlationId, content.toByteArray());
    }

    public byte[] encode() {
        return Validator.Message.newBuilder()
                .setMessageType(messageType.wireType())
                .setCorrelationId(correlationId)
                .setContent(ByteString.copyFrom(content))
                .build()
                .toByteArray();
    }

    /**
     * @throws WireFormatException if the bytes are not a frame body or name an
     *                             unknown message type
     */
    public static Message decode(final byte[] frame) {
        final Validator.Message wire;
        try {
            wire = Validator.Message.parseFrom(frame);
        } catch (InvalidProtocolBufferException e) {
            throw new WireFormatException("Malformed Message: " + e.getMessage(), e);
        }
        return new Message(
                MessageType.fromCode(wire.getMessageTypeValue()),
                wire.getCorrelationId(),
                wire.getContent().toByteArray());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Message other
                && messageType == other.messageType
                && correlationId.equals(other.correlationId)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageType, correlationId, Arrays.hashCode(content));
    }

    @Override
    public String toString() {
        return "Message[" + messageType + ", correlationId=" + correlationId + ", " + content.length + " bytes]";
    }
}
