package io.ledgerrest.api.expand;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import io.ledgerrest.core.error.WireFormatException;
import io.ledgerrest.core.protobuf.BatchHeader;
import io.ledgerrest.core.protobuf.BlockHeader;
import io.ledgerrest.core.protobuf.TransactionHeader;
import org.jspecify.annotations.Nullable;

/**
 * The ledger records whose JSON form carries an encoded {@code header}.
 */
public enum RecordKind {
    BLOCK("Block", "batches"),
    BATCH("Batch", "transactions"),
    TRANSACTION("Transaction", null);

    private final String displayName;
    private final @Nullable String childField;

    RecordKind(final String displayName, final @Nullable String childField) {
        this.displayName = displayName;
        this.childField = childField;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @return the field holding nested records, or {@code null} for leaves
     */
    public @Nullable String childField() {
        return childField;
    }

    /**
     * @return the kind of the records under {@link #childField()}, or
     *         {@code null} for leaves
     */
    public @Nullable RecordKind child() {
        return switch (this) {
            case BLOCK -> BATCH;
            case BATCH -> TRANSACTION;
            case TRANSACTION -> null;
        };
    }

    /**
     * Parses this kind's header bytes into its header record.
     *
     * @throws WireFormatException if the bytes do not hold a header
     */
    public Message decodeHeader(final byte[] bytes) {
        try {
            return switch (this) {
                case BLOCK -> BlockHeader.parseFrom(bytes);
                case BATCH -> BatchHeader.parseFrom(bytes);
                case TRANSACTION -> TransactionHeader.parseFrom(bytes);
            };
        } catch (InvalidProtocolBufferException e) {
            throw new WireFormatException("Malformed " + displayName + "Header: " + e.getMessage(), e);
        }
    }
}
