package io.ledgerrest.api.http;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.buffer.Unpooled;
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
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.UnorderedThreadPoolEventExecutor;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves a {@link Router} over HTTP/1.1 using Netty.
 *
 * <p>
 * Sockets are read and written on Netty's event loops. Each aggregated
 * request is handed to a shared pool where the route handlers run, taken by
 * whichever handler thread is idle. A handler blocked on the validator
 * therefore never stalls I/O or requests arriving on other connections.
 * Responses on one connection are written in the order its requests
 * arrived. Keep-alive is honoured; bodies larger than the configured limit
 * are rejected with {@code 413} before any handler runs.
 */
public final class HttpGatewayServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpGatewayServer.class);

    private final Router router;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final UnorderedThreadPoolEventExecutor handlerExecutor;
    private final Channel serverChannel;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private HttpGatewayServer(
            final Router router,
            final String host,
            final int port,
            final int handlerThreads,
            final int maxBodySize) throws InterruptedException {
        this.router = Objects.requireNonNull(router, "router");
        this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("ledger-rest-http-boss", true));
        this.workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("ledger-rest-http-io", true));
        this.handlerExecutor = new UnorderedThreadPoolEventExecutor(handlerThreads,
                new DefaultThreadFactory("ledger-rest-handler", true));

        final ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(maxBodySize));
                        p.addLast("dispatch", new DispatchHandler());
                    }
                });

        try {
            this.serverChannel = bootstrap.bind(host, port).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            shutdownGroups();
            throw e;
        }
    }

    /**
     * Binds the server and starts accepting connections.
     *
     * @param router         the routes to serve
     * @param host           the interface to listen on
     * @param port           the port, {@code 0} for an ephemeral one
     * @param handlerThreads threads running route handlers
     * @param maxBodySize    largest request body accepted, in bytes
     * @throws InterruptedException if interrupted while binding
     */
    public static HttpGatewayServer start(
            final Router router,
            final String host,
            final int port,
            final int handlerThreads,
            final int maxBodySize) throws InterruptedException {
        final HttpGatewayServer server = new HttpGatewayServer(router, host, port, handlerThreads, maxBodySize);
        log.info("Listening on http://{}:{}", host, server.port());
        return server;
    }

    /**
     * @return the port actually bound
     */
    public int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /**
     * Stops accepting connections and releases all threads.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            serverChannel.close().sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing server channel", e);
        }
        shutdownGroups();
        log.info("HTTP server stopped");
    }

    private void shutdownGroups() {
        bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        handlerExecutor.shutdownGracefully(0, 5, TimeUnit.SECONDS);
    }

    private static GatewayRequest toGatewayRequest(final ChannelHandlerContext ctx, final FullHttpRequest request) {
        String host = request.headers().get(HttpHeaderNames.HOST);
        if (host == null || host.isEmpty()) {
            final InetSocketAddress local = (InetSocketAddress) ctx.channel().localAddress();
            host = local.getHostString() + ":" + local.getPort();
        }
        return GatewayRequest.of(
                request.method().name(),
                "http",
                host,
                request.uri(),
                request.headers().get(HttpHeaderNames.CONTENT_TYPE),
                ByteBufUtil.getBytes(request.content()));
    }

    private static FullHttpResponse toHttpResponse(final HttpVersion version, final GatewayResponse response) {
        final ByteBuf content = Unpooled.copiedBuffer(response.body(), StandardCharsets.UTF_8);
        final FullHttpResponse http = new DefaultFullHttpResponse(
                version, HttpResponseStatus.valueOf(response.status()), content);
        http.headers().set(HttpHeaderNames.CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
        return http;
    }

    private static void write(
            final ChannelHandlerContext ctx,
            final HttpVersion version,
            final boolean keepAlive,
            final GatewayResponse response) {
        final FullHttpResponse http = toHttpResponse(version, response);
        if (keepAlive) {
            if (!version.isKeepAliveDefault()) {
                http.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            }
            ctx.writeAndFlush(http);
        } else {
            http.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
        }
    }

    /**
     * Reads on the channel's event loop and dispatches to the handler pool;
     * one instance per channel.
     */
    private final class DispatchHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        // completes once the previous response on this channel is written;
        // only touched on the channel's event loop
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            final boolean keepAlive = HttpUtil.isKeepAlive(request);
            final HttpVersion version = request.protocolVersion();

            if (!request.decoderResult().isSuccess()) {
                final FullHttpResponse bad = new DefaultFullHttpResponse(
                        version, HttpResponseStatus.BAD_REQUEST, Unpooled.EMPTY_BUFFER);
                bad.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
                ctx.writeAndFlush(bad).addListener(ChannelFutureListener.CLOSE);
                return;
            }

            // copied out here, the request buffer is released when this returns
            final GatewayRequest gatewayRequest = toGatewayRequest(ctx, request);
            final CompletableFuture<GatewayResponse> response =
                    CompletableFuture.supplyAsync(() -> router.dispatch(gatewayRequest), handlerExecutor);

            tail = tail
                    .thenCompose(previous -> response)
                    .thenAccept(r -> write(ctx, version, keepAlive, r))
                    .exceptionally(e -> {
                        log.error("Failed to answer {} {}, closing channel",
                                gatewayRequest.method(), gatewayRequest.uri(), e);
                        ctx.close();
                        return null;
                    });
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("HTTP channel error, closing channel", cause);
            ctx.close();
        }
    }
}
