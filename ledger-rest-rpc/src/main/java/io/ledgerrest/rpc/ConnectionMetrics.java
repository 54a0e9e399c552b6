package io.ledgerrest.rpc;

import io.ledgerrest.core.message.MessageType;
import java.time.Duration;

/**
 * Hook for collecting metrics from the validator connection.
 *
 * <p>
 * Implementations can bridge to Micrometer, Prometheus or any other backend.
 * By default a no-op implementation is used ({@link #noop()}).
 *
 * <p>
 * <strong>Thread Safety:</strong> methods are called from caller threads, the
 * Disruptor thread and Netty I/O threads concurrently.
 */
public interface ConnectionMetrics {

    /**
     * Called when a request frame has been queued for writing.
     */
    default void onRequestSent(MessageType requestType) {
    }

    /**
     * Called when a reply is matched to its pending request.
     *
     * @param requestType the type of the request that was answered
     * @param latency     time from send to reply
     */
    default void onReplyReceived(MessageType requestType, Duration latency) {
    }

    /**
     * Called when a request gives up waiting for its reply.
     */
    default void onRequestTimeout(MessageType requestType) {
    }

    /**
     * Called when a reply arrives whose correlation id is not pending.
     */
    default void onStaleReply(String correlationId) {
    }

    /**
     * Called when the validator connection is lost.
     */
    default void onConnectionLost() {
    }

    /**
     * Called when the validator connection is re-established after a loss.
     */
    default void onReconnect() {
    }

    static ConnectionMetrics noop() {
        return NoopConnectionMetrics.INSTANCE;
    }
}

/**
 * Internal no-op implementation of ConnectionMetrics.
 */
enum NoopConnectionMetrics implements ConnectionMetrics {
    INSTANCE
}
