package io.ledgerrest.rpc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.ledgerrest.core.error.TransportException;
import io.ledgerrest.core.message.Message;
import io.ledgerrest.core.message.MessageType;
import io.netty.channel.Channel;
import io.netty.channel.EventLoop;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NettyConnectionTest {

    private static final MessageType REQUEST = MessageType.CLIENT_BLOCK_GET_REQUEST;

    private FakeValidator validator;
    private RecordingMetrics metrics;
    private final List<NettyConnection> connections = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        validator = new FakeValidator();
        metrics = new RecordingMetrics();
    }

    @AfterEach
    void tearDown() {
        connections.forEach(NettyConnection::close);
        validator.close();
    }

    private NettyConnection connect(ConnectionConfig.Builder builder) {
        NettyConnection connection = NettyConnection.open(builder.reconnectDelay(Duration.ofMillis(50)).build());
        connection.setMetrics(metrics);
        connections.add(connection);
        assertTrue(connection.awaitConnected(Duration.ofSeconds(5)), "connection did not come up");
        return connection;
    }

    private NettyConnection connect() {
        return connect(ConnectionConfig.builder(validator.url()));
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static Message echo(Message request) {
        return new Message(request.messageType().responseType(), request.correlationId(), request.content());
    }

    @Test
    void testRequestReceivesReply() {
        NettyConnection connection = connect();
        validator.respondWith(NettyConnectionTest::echo);

        Message reply = connection.send(REQUEST, utf8("ping")).result(Duration.ofSeconds(5));

        assertEquals(MessageType.CLIENT_BLOCK_GET_RESPONSE, reply.messageType());
        assertEquals("ping", new String(reply.content(), StandardCharsets.UTF_8));
        assertEquals(0, connection.pendingRequests());
        assertEquals(1, metrics.sent.get());
    }

    @Test
    void testConcurrentRequestsEachReceiveTheirOwnReply() throws Exception {
        NettyConnection connection = connect();
        int threads = 8;
        int perThread = 16;

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<List<ReplyFuture>>> sends = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                sends.add(pool.submit(() -> {
                    List<ReplyFuture> futures = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        futures.add(connection.send(REQUEST, utf8(thread + "-" + i)));
                    }
                    return futures;
                }));
            }

            List<ReplyFuture> futures = new ArrayList<>();
            for (Future<List<ReplyFuture>> send : sends) {
                futures.addAll(send.get(5, TimeUnit.SECONDS));
            }

            List<Message> requests = new ArrayList<>();
            for (int i = 0; i < threads * perThread; i++) {
                requests.add(validator.take());
            }
            Set<String> ids = new HashSet<>();
            requests.forEach(r -> ids.add(r.correlationId()));
            assertEquals(threads * perThread, ids.size(), "correlation ids must be unique");

            // answer in an order unrelated to the send order
            Collections.shuffle(requests, new Random(7));
            requests.forEach(r -> validator.reply(echo(r)));

            for (int t = 0; t < threads; t++) {
                List<ReplyFuture> own = sends.get(t).get();
                for (int i = 0; i < perThread; i++) {
                    Message reply = own.get(i).result(Duration.ofSeconds(5));
                    assertEquals(t + "-" + i, new String(reply.content(), StandardCharsets.UTF_8));
                    assertEquals(own.get(i).correlationId(), reply.correlationId());
                }
            }
            assertEquals(threads * perThread, futures.size());
            assertEquals(0, connection.pendingRequests());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testWaiterTimesOutAfterItsDeadline() throws Exception {
        NettyConnection connection = connect();
        ReplyFuture future = connection.send(REQUEST, utf8("never answered"));
        validator.take();

        long start = System.nanoTime();
        TransportException ex = assertThrows(TransportException.class,
                () -> future.result(Duration.ofMillis(200)));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(TransportException.Kind.TIMED_OUT, ex.kind());
        assertEquals(future.correlationId(), ex.correlationId());
        assertTrue(elapsedMs >= 190, "returned too early: " + elapsedMs + "ms");
        assertTrue(elapsedMs < 2_000, "returned too late: " + elapsedMs + "ms");
        assertEquals(0, connection.pendingRequests());
        assertEquals(1, metrics.timeouts.get());
    }

    @Test
    void testLateReplyIsDroppedAndNeverDeliveredElsewhere() throws Exception {
        NettyConnection connection = connect();
        ReplyFuture abandoned = connection.send(REQUEST, utf8("first"));
        Message first = validator.take();
        assertThrows(TransportException.class, () -> abandoned.result(Duration.ofMillis(50)));

        ReplyFuture current = connection.send(REQUEST, utf8("second"));
        Message second = validator.take();
        validator.reply(echo(first));
        validator.reply(echo(second));

        Message reply = current.result(Duration.ofSeconds(5));
        assertEquals("second", new String(reply.content(), StandardCharsets.UTF_8));
        assertEquals(1, metrics.staleReplies.get());
    }

    @Test
    void testUndecodableFrameDoesNotKillTheConnection() throws Exception {
        NettyConnection connection = connect();
        ReplyFuture future = connection.send(REQUEST, utf8("after garbage"));
        Message request = validator.take();

        validator.reply(new byte[] {(byte) 0xC5, 0x01});
        validator.reply(echo(request));

        assertEquals("after garbage",
                new String(future.result(Duration.ofSeconds(5)).content(), StandardCharsets.UTF_8));
        assertTrue(connection.isConnected());
    }

    @Test
    void testConnectionLossFailsEveryPendingRequestAndReconnects() throws Exception {
        NettyConnection connection = connect();
        List<ReplyFuture> futures = List.of(
                connection.send(REQUEST, utf8("a")),
                connection.send(REQUEST, utf8("b")),
                connection.send(REQUEST, utf8("c")));
        for (int i = 0; i < futures.size(); i++) {
            validator.take();
        }

        validator.dropClients();

        for (ReplyFuture future : futures) {
            long start = System.nanoTime();
            TransportException ex = assertThrows(TransportException.class,
                    () -> future.result(Duration.ofSeconds(10)));
            assertEquals(TransportException.Kind.DISCONNECTED, ex.kind());
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 5_000);
        }
        assertEquals(0, connection.pendingRequests());

        assertTrue(connection.awaitConnected(Duration.ofSeconds(5)), "did not reconnect");
        validator.respondWith(NettyConnectionTest::echo);
        Message reply = connection.send(REQUEST, utf8("again")).result(Duration.ofSeconds(5));
        assertEquals("again", new String(reply.content(), StandardCharsets.UTF_8));
        assertEquals(1, metrics.connectionsLost.get());
        assertEquals(1, metrics.reconnects.get());
    }

    @Test
    void testSendWhileDisconnectedFailsImmediately() throws Exception {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }
        NettyConnection connection = NettyConnection.open(
                ConnectionConfig.builder("tcp://127.0.0.1:" + unusedPort)
                        .reconnectDelay(Duration.ofSeconds(10))
                        .build());
        connections.add(connection);

        long start = System.nanoTime();
        TransportException ex = assertThrows(TransportException.class,
                () -> connection.send(REQUEST, utf8("x")).result(Duration.ofSeconds(30)));

        assertEquals(TransportException.Kind.DISCONNECTED, ex.kind());
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1_000);
        assertFalse(connection.isConnected());
    }

    @Test
    void testSendRacingCloseFailsInsteadOfThrowing() throws Exception {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }
        NettyConnection connection = NettyConnection.open(
                ConnectionConfig.builder("tcp://127.0.0.1:" + unusedPort)
                        .reconnectDelay(Duration.ofSeconds(10))
                        .build());
        connection.setMetrics(metrics);
        connections.add(connection);

        // the channel's event loop has already begun shutting down
        EventLoop loop = mock(EventLoop.class);
        when(loop.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class)))
                .thenThrow(new RejectedExecutionException("event executor terminated"));
        Channel channel = mock(Channel.class);
        when(channel.isActive()).thenReturn(true);
        when(channel.eventLoop()).thenReturn(loop);

        ReplyFuture future = connection.dispatch(channel, REQUEST, "99", utf8("late"));

        TransportException ex = assertThrows(TransportException.class, () -> future.result(Duration.ofSeconds(1)));
        assertEquals(TransportException.Kind.DISCONNECTED, ex.kind());
        assertEquals("99", ex.correlationId());
        assertEquals(0, connection.pendingRequests());
        assertEquals(0, metrics.sent.get());
        assertEquals(0, metrics.timeouts.get());
    }

    @Test
    void testUnwaitedRequestIsReclaimedAtDefaultDeadline() throws Exception {
        NettyConnection connection = connect(ConnectionConfig.builder(validator.url())
                .defaultRequestTimeout(Duration.ofMillis(150)));
        ReplyFuture future = connection.send(REQUEST, utf8("orphan"));
        validator.take();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (connection.pendingRequests() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        assertEquals(0, connection.pendingRequests());
        assertTrue(future.toCompletableFuture().isCompletedExceptionally());
        TransportException ex = assertThrows(TransportException.class, () -> future.result(Duration.ZERO));
        assertEquals(TransportException.Kind.TIMED_OUT, ex.kind());
        assertEquals(1, metrics.timeouts.get());
    }

    @Test
    void testCloseFailsPendingRequests() throws Exception {
        NettyConnection connection = connect();
        ReplyFuture future = connection.send(REQUEST, utf8("pending"));
        validator.take();

        connection.close();

        TransportException ex = assertThrows(TransportException.class, () -> future.result(Duration.ofSeconds(5)));
        assertEquals(TransportException.Kind.DISCONNECTED, ex.kind());
        assertFalse(connection.isConnected());
        assertEquals(TransportException.Kind.DISCONNECTED, assertThrows(TransportException.class,
                () -> connection.send(REQUEST, utf8("late")).result(Duration.ofSeconds(1))).kind());
    }

    @Test
    void testReplyTypesCannotBeSent() {
        NettyConnection connection = connect();
        assertThrows(IllegalArgumentException.class,
                () -> connection.send(MessageType.CLIENT_BLOCK_GET_RESPONSE, new byte[0]));
    }
}
