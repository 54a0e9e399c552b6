package io.ledgerrest.rpc;

import io.ledgerrest.core.message.MessageType;

/**
 * A persistent duplex connection to one validator, shared by every in-flight
 * request.
 *
 * <p>
 * Requests and replies are paired by correlation id, so replies may arrive in
 * any order. Sending never blocks on the network; only
 * {@link ReplyFuture#result(java.time.Duration)} waits.
 */
public interface Connection extends AutoCloseable {

    /**
     * Sends a request frame.
     *
     * @param requestType the kind of request; must not be a reply type
     * @param content     the encoded request record
     * @return a handle on the reply; already failed with {@code DISCONNECTED}
     *         if the connection is down
     */
    ReplyFuture send(MessageType requestType, byte[] content);

    boolean isConnected();

    /**
     * Closes the connection. Outstanding requests fail with
     * {@code DISCONNECTED}.
     */
    @Override
    void close();
}
