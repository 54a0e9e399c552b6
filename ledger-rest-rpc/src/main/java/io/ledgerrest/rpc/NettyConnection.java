package io.ledgerrest.rpc;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.ledgerrest.core.error.TransportException;
import io.ledgerrest.core.message.Message;
import io.ledgerrest.core.message.MessageType;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.util.concurrent.ScheduledFuture;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Connection} over a single TCP channel using Netty and LMAX Disruptor.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Any number of handler
 * threads may call {@link #send} concurrently. Outbound frames are published
 * to a Disruptor ring buffer and written by a single consumer thread that
 * flushes once per batch. Replies are matched on the Netty I/O thread through
 * the {@link PendingRequests} table.
 *
 * <p><b>Failure handling:</b>
 * <ul>
 *   <li>Correlation ids come from a counter and are never reused.</li>
 *   <li>Every request gets a deadline on the event loop
 *       ({@link ConnectionConfig#defaultRequestTimeout()}) so its slot is
 *       reclaimed even if nobody waits for it.</li>
 *   <li>When the channel drops, every pending request fails with
 *       {@code DISCONNECTED} and a new channel is attempted after
 *       {@link ConnectionConfig#reconnectDelay()}. Requests are never
 *       replayed.</li>
 *   <li>Replies nobody is waiting for are logged and dropped.</li>
 * </ul>
 */
public final class NettyConnection implements Connection {

    private static final Logger log = LoggerFactory.getLogger(NettyConnection.class);

    private final ConnectionConfig config;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final PendingRequests pending = new PendingRequests();

    private final AtomicLong correlationIds = new AtomicLong(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean everConnected = new AtomicBoolean(false);
    private volatile @Nullable Channel channel;
    private volatile CompletableFuture<Void> connectedSignal = new CompletableFuture<>();

    private final Disruptor<FrameEvent> disruptor;
    private final RingBuffer<FrameEvent> ringBuffer;

    private volatile ConnectionMetrics metrics = ConnectionMetrics.noop();

    private NettyConnection(ConnectionConfig config) {
        this.config = Objects.requireNonNull(config, "config");

        this.group = new NioEventLoopGroup(config.ioThreads(), r -> {
            Thread t = new Thread(r, "ledger-rest-validator-io");
            t.setDaemon(true);
            return t;
        });

        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LengthFieldBasedFrameDecoder(config.maxFrameLength(), 0, 4, 0, 4));
                        p.addLast(new LengthFieldPrepender(4));
                        p.addLast(new MessageCodec());
                        p.addLast(new ReplyHandler());
                    }
                });

        WaitStrategy waitStrategy = switch (config.waitStrategy()) {
            case BLOCKING -> new BlockingWaitStrategy();
            case YIELDING -> new YieldingWaitStrategy();
        };

        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "ledger-rest-disruptor");
            t.setDaemon(true);
            return t;
        };

        this.disruptor = new Disruptor<>(
                FrameEvent::new,
                config.ringBufferSize(),
                threadFactory,
                ProducerType.MULTI,
                waitStrategy);
        this.disruptor.handleEventsWith(this::handleEvent);
        this.disruptor.start();
        this.ringBuffer = disruptor.getRingBuffer();
    }

    /**
     * Creates a connection and starts connecting in the background.
     *
     * <p>
     * The method returns immediately. Until the first channel is up, sends
     * fail with {@code DISCONNECTED}; use {@link #awaitConnected(Duration)}
     * to wait for it.
     *
     * @param config the connection configuration
     * @return the new connection
     */
    public static NettyConnection open(ConnectionConfig config) {
        NettyConnection connection = new NettyConnection(config);
        log.info("Connecting to validator at {}", config.url());
        connection.connect();
        return connection;
    }

    /**
     * Sets a custom metrics collector.
     *
     * @throws NullPointerException if metrics is null
     */
    public void setMetrics(ConnectionMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Waits until a channel to the validator is up.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitConnected(Duration timeout) {
        try {
            connectedSignal.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return isConnected();
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            return false;
        }
    }

    @Override
    public boolean isConnected() {
        Channel ch = channel;
        return !closed.get() && ch != null && ch.isActive();
    }

    /**
     * @return the number of requests still awaiting a reply
     */
    public int pendingRequests() {
        return pending.size();
    }

    @Override
    public ReplyFuture send(MessageType requestType, byte[] content) {
        if (requestType.isReply()) {
            throw new IllegalArgumentException(requestType + " is a reply type");
        }
        String correlationId = Long.toString(correlationIds.getAndIncrement());

        Channel ch = this.channel;
        if (closed.get() || ch == null || !ch.isActive()) {
            return ReplyFuture.failed(correlationId, new TransportException(
                    TransportException.Kind.DISCONNECTED,
                    "Not connected to validator at " + config.url(),
                    correlationId));
        }

        return dispatch(ch, requestType, correlationId, content);
    }

    /**
     * Registers a slot, arms its deadline on {@code ch}'s event loop and
     * queues the frame.
     *
     * <p>
     * If the event loop refuses the deadline because the connection is being
     * closed, the slot is released and the request fails with
     * {@code DISCONNECTED} without being written.
     */
    ReplyFuture dispatch(Channel ch, MessageType requestType, String correlationId, byte[] content) {
        PendingRequests.Slot slot = pending.register(correlationId, requestType);
        Duration deadline = config.defaultRequestTimeout();
        ScheduledFuture<?> deadlineTask;
        try {
            deadlineTask = ch.eventLoop().schedule(() -> {
                expire(slot, new TransportException(
                        TransportException.Kind.TIMED_OUT,
                        "No reply from validator within " + deadline.toMillis() + "ms",
                        correlationId));
            }, deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            TransportException cause = new TransportException(
                    TransportException.Kind.DISCONNECTED,
                    "Connection to validator at " + config.url() + " is closing",
                    correlationId,
                    e);
            pending.expire(slot, cause);
            log.debug("Dropped {} [correlationId={}], event loop is shutting down", requestType, correlationId);
            return ReplyFuture.failed(correlationId, cause);
        }

        slot.future().whenComplete((reply, error) -> {
            deadlineTask.cancel(false);
            if (reply != null) {
                metrics.onReplyReceived(requestType, Duration.ofNanos(System.nanoTime() - slot.sentAtNanos()));
            }
        });

        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(new Message(requestType, correlationId, content), slot);
        } finally {
            ringBuffer.publish(sequence);
        }
        metrics.onRequestSent(requestType);
        log.debug("Sent {} [correlationId={}]", requestType, correlationId);

        return new ReplyFuture(correlationId, slot.future(), cause -> expire(slot, cause));
    }

    /**
     * Closes the channel and releases all resources.
     *
     * <p>
     * Pending requests fail with {@code DISCONNECTED}. The connection cannot
     * be reused afterwards.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        pending.failAll(id -> new TransportException(
                TransportException.Kind.DISCONNECTED, "Connection closed", id));

        try {
            disruptor.halt();
        } catch (Exception e) {
            log.warn("Error halting Disruptor", e);
        }

        Channel ch = channel;
        if (ch != null) {
            try {
                ch.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while closing channel", e);
            } catch (Exception e) {
                log.warn("Error closing channel", e);
            }
        }

        try {
            group.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down EventLoopGroup", e);
        } catch (Exception e) {
            log.warn("Error shutting down EventLoopGroup", e);
        }
        log.info("Closed connection to validator at {}", config.url());
    }

    private boolean expire(PendingRequests.Slot slot, TransportException cause) {
        if (!pending.expire(slot, cause)) {
            return false;
        }
        metrics.onRequestTimeout(slot.requestType());
        log.debug("Gave up on {} [correlationId={}]", slot.requestType(), slot.correlationId());
        return true;
    }

    private void connect() {
        if (closed.get()) {
            return;
        }
        try {
            bootstrap.connect(config.host(), config.port()).addListener((ChannelFutureListener) future -> {
                if (future.isSuccess()) {
                    onConnected(future.channel());
                } else {
                    log.warn("Connection to validator at {} failed: {}", config.url(), future.cause().getMessage());
                    scheduleReconnect();
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Connect not attempted, event loop is shutting down");
        }
    }

    private void onConnected(Channel ch) {
        if (closed.get()) {
            ch.close();
            return;
        }
        this.channel = ch;
        if (everConnected.getAndSet(true)) {
            log.info("Reconnected to validator at {}", config.url());
            metrics.onReconnect();
        } else {
            log.info("Connected to validator at {}", config.url());
        }
        connectedSignal.complete(null);
    }

    private void onDisconnected(Channel ch) {
        if (this.channel == ch) {
            this.channel = null;
        }
        if (connectedSignal.isDone()) {
            connectedSignal = new CompletableFuture<>();
        }
        int failed = pending.failAll(id -> new TransportException(
                TransportException.Kind.DISCONNECTED, "Validator connection lost", id));
        if (closed.get()) {
            return;
        }
        log.warn("Lost connection to validator at {}, failed {} pending request(s)", config.url(), failed);
        metrics.onConnectionLost();
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (closed.get()) {
            return;
        }
        try {
            group.schedule(this::connect, config.reconnectDelay().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Reconnect not scheduled, event loop is shutting down");
        }
    }

    /**
     * Writes a frame from the ring buffer; flushes at end of batch.
     */
    private void handleEvent(FrameEvent event, long sequence, boolean endOfBatch) {
        Message message = event.message;
        PendingRequests.Slot slot = event.slot;
        event.clear();

        Channel ch = this.channel;
        if (ch != null && ch.isActive()) {
            ch.write(message).addListener(future -> {
                if (!future.isSuccess()) {
                    pending.expire(slot, new TransportException(
                            TransportException.Kind.DISCONNECTED,
                            "Failed to write request",
                            slot.correlationId(),
                            future.cause()));
                }
            });
            if (endOfBatch) {
                ch.flush();
            }
        } else {
            pending.expire(slot, new TransportException(
                    TransportException.Kind.DISCONNECTED,
                    "Not connected to validator at " + config.url(),
                    slot.correlationId()));
        }
    }

    private final class ReplyHandler extends SimpleChannelInboundHandler<Message> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Message msg) {
            if (!msg.messageType().isReply()) {
                log.debug("Ignoring unsolicited {} frame", msg.messageType());
                return;
            }
            if (!pending.fulfill(msg)) {
                log.warn("Dropping {} with unknown correlation id {}", msg.messageType(), msg.correlationId());
                metrics.onStaleReply(msg.correlationId());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            onDisconnected(ctx.channel());
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Validator channel error, closing channel", cause);
            ctx.close();
        }
    }

    // Event class for Disruptor - pre-allocated and reused
    static final class FrameEvent {
        @Nullable Message message;
        PendingRequests.@Nullable Slot slot;

        void set(Message message, PendingRequests.Slot slot) {
            this.message = message;
            this.slot = slot;
        }

        void clear() {
            this.message = null;
            this.slot = null;
        }
    }
}
