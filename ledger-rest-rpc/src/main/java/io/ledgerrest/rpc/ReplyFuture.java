package io.ledgerrest.rpc;

import io.ledgerrest.core.error.TransportException;
import io.ledgerrest.core.message.Message;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Handle on the reply to one request sent over a {@link Connection}.
 *
 * <p>
 * {@link #result(Duration)} is the only blocking call on the request path.
 * When it times out the request's pending slot is released, so a reply that
 * arrives later is dropped as stale.
 */
public final class ReplyFuture {

    private final String correlationId;
    private final CompletableFuture<Message> future;
    private final Predicate<TransportException> abandon;

    /**
     * @param correlationId the id of the request
     * @param future        completed by the connection with the reply
     * @param abandon       releases the pending slot with the given failure;
     *                      returns {@code false} if the slot was already gone
     */
    ReplyFuture(
            final String correlationId,
            final CompletableFuture<Message> future,
            final Predicate<TransportException> abandon) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.future = Objects.requireNonNull(future, "future");
        this.abandon = Objects.requireNonNull(abandon, "abandon");
    }

    /**
     * A future that already holds its reply. Intended for test doubles.
     */
    public static ReplyFuture completed(final Message reply) {
        return new ReplyFuture(reply.correlationId(), CompletableFuture.completedFuture(reply), e -> false);
    }

    /**
     * A future that already failed. Intended for test doubles and for sends
     * rejected before anything was written.
     */
    public static ReplyFuture failed(final String correlationId, final TransportException cause) {
        return new ReplyFuture(correlationId, CompletableFuture.failedFuture(cause), e -> false);
    }

    public String correlationId() {
        return correlationId;
    }

    /**
     * Blocks until the reply arrives or {@code timeout} elapses.
     *
     * @return the reply frame
     * @throws TransportException {@code TIMED_OUT} if no reply arrived in time,
     *                            {@code DISCONNECTED} if the connection was lost
     *                            or closed first
     */
    public Message result(final Duration timeout) {
        try {
            return future.get(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return giveUp(new TransportException(
                    TransportException.Kind.TIMED_OUT,
                    "No reply from validator within " + timeout.toMillis() + "ms",
                    correlationId));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return giveUp(new TransportException(
                    TransportException.Kind.TIMED_OUT,
                    "Interrupted while waiting for validator reply",
                    correlationId,
                    e));
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TransportException transport) {
                throw transport;
            }
            throw new TransportException(
                    TransportException.Kind.DISCONNECTED,
                    "Request failed before a reply arrived",
                    correlationId,
                    e.getCause());
        }
    }

    public CompletableFuture<Message> toCompletableFuture() {
        return future;
    }

    private Message giveUp(final TransportException cause) {
        if (abandon.test(cause) || !future.isDone()) {
            throw cause;
        }
        // the slot was settled while the deadline fired
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof TransportException transport) {
                throw transport;
            }
            throw cause;
        }
    }
}
