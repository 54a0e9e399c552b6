package io.ledgerrest.rpc;

import io.ledgerrest.core.message.Message;
import io.ledgerrest.core.message.MessageType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Requests awaiting a reply, keyed by correlation id.
 *
 * <p>
 * Each slot is fulfilled at most once: whichever of {@link #fulfill},
 * {@link #expire} or {@link #failAll} removes it first completes its future,
 * and the others find nothing. A single lock guards the table; futures are
 * always completed after the lock is released so no callback runs under it.
 */
public final class PendingRequests {

    /**
     * One outstanding request.
     *
     * @param correlationId the id the reply must carry
     * @param requestType   the type of the request sent
     * @param sentAtNanos   {@link System#nanoTime()} when the slot was registered
     * @param future        completed with the reply, or exceptionally
     */
    public record Slot(
            String correlationId,
            MessageType requestType,
            long sentAtNanos,
            CompletableFuture<Message> future) {
    }

    private final Object lock = new Object();
    private final Map<String, Slot> slots = new HashMap<>();

    /**
     * @throws IllegalStateException if {@code correlationId} is already pending
     */
    public Slot register(final String correlationId, final MessageType requestType) {
        final Slot slot = new Slot(correlationId, requestType, System.nanoTime(), new CompletableFuture<>());
        synchronized (lock) {
            if (slots.putIfAbsent(correlationId, slot) != null) {
                throw new IllegalStateException("Correlation id " + correlationId + " is already pending");
            }
        }
        return slot;
    }

    /**
     * Completes the slot matching the reply's correlation id.
     *
     * @return {@code false} if no request with that id is pending
     */
    public boolean fulfill(final Message reply) {
        final Slot slot;
        synchronized (lock) {
            slot = slots.remove(reply.correlationId());
        }
        if (slot == null) {
            return false;
        }
        slot.future().complete(reply);
        return true;
    }

    /**
     * Fails {@code slot} with {@code cause} if it is still the one pending
     * under its id.
     *
     * @return {@code true} if this call removed and failed the slot
     */
    public boolean expire(final Slot slot, final Throwable cause) {
        synchronized (lock) {
            if (!slots.remove(slot.correlationId(), slot)) {
                return false;
            }
        }
        slot.future().completeExceptionally(cause);
        return true;
    }

    /**
     * Fails every pending slot.
     *
     * @param causeFor builds the failure for each slot's correlation id
     * @return the number of slots failed
     */
    public int failAll(final Function<String, ? extends Throwable> causeFor) {
        final List<Slot> drained;
        synchronized (lock) {
            drained = new ArrayList<>(slots.values());
            slots.clear();
        }
        for (Slot slot : drained) {
            slot.future().completeExceptionally(causeFor.apply(slot.correlationId()));
        }
        return drained.size();
    }

    public @Nullable Slot get(final String correlationId) {
        synchronized (lock) {
            return slots.get(correlationId);
        }
    }

    public int size() {
        synchronized (lock) {
            return slots.size();
        }
    }
}
