package io.ledgerrest.rpc;

import io.ledgerrest.core.message.Message;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.util.concurrent.GlobalEventExecutor;
import java.net.InetSocketAddress;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * In-process validator speaking the framed protocol on an ephemeral port.
 *
 * <p>
 * With a responder installed every request is answered immediately;
 * without one, requests queue up in {@link #received()} and the test answers
 * them with {@link #reply(Message)} in whatever order it likes.
 */
final class FakeValidator implements AutoCloseable {

    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final BlockingQueue<Message> received = new LinkedBlockingQueue<>();
    private final Channel server;
    private volatile Function<Message, Message> responder;

    FakeValidator() throws InterruptedException {
        server = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        clients.add(ch);
                        ch.pipeline().addLast(
                                new LengthFieldBasedFrameDecoder(1 << 20, 0, 4, 0, 4),
                                new LengthFieldPrepender(4),
                                new MessageCodec(),
                                new SimpleChannelInboundHandler<Message>() {
                                    @Override
                                    protected void channelRead0(ChannelHandlerContext ctx, Message msg) {
                                        Function<Message, Message> current = responder;
                                        if (current != null) {
                                            ctx.writeAndFlush(current.apply(msg));
                                        } else {
                                            received.add(msg);
                                        }
                                    }
                                });
                    }
                })
                .bind("127.0.0.1", 0)
                .sync()
                .channel();
    }

    String url() {
        return "tcp://127.0.0.1:" + ((InetSocketAddress) server.localAddress()).getPort();
    }

    void respondWith(Function<Message, Message> responder) {
        this.responder = responder;
    }

    BlockingQueue<Message> received() {
        return received;
    }

    Message take() throws InterruptedException {
        Message msg = received.poll(5, TimeUnit.SECONDS);
        if (msg == null) {
            throw new AssertionError("validator received no request within 5s");
        }
        return msg;
    }

    void reply(Message reply) {
        clients.writeAndFlush(reply).syncUninterruptibly();
    }

    void reply(byte[] rawFrameBody) {
        clients.writeAndFlush(Unpooled.wrappedBuffer(rawFrameBody)).syncUninterruptibly();
    }

    /**
     * Closes every client channel while keeping the listener up.
     */
    void dropClients() {
        clients.close().syncUninterruptibly();
    }

    @Override
    public void close() {
        clients.close().syncUninterruptibly();
        server.close().syncUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
