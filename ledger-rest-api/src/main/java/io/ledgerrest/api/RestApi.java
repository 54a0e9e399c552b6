package io.ledgerrest.api;

import ch.qos.logback.classic.Level;
import io.ledgerrest.api.http.HttpGatewayServer;
import io.ledgerrest.api.http.Router;
import io.ledgerrest.rpc.NettyConnection;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: connects to the validator and serves the HTTP API until the
 * process is stopped.
 *
 * <pre>
 * java -jar ledger-rest-api.jar -B 0.0.0.0:8008 -C tcp://validator:4004 -v
 * </pre>
 */
public final class RestApi {

    private static final Logger log = LoggerFactory.getLogger(RestApi.class);

    private RestApi() {
    }

    public static void main(String[] args) throws InterruptedException {
        if (GatewayConfig.isHelpRequested(args)) {
            System.out.println(GatewayConfig.USAGE);
            return;
        }
        final GatewayConfig config;
        try {
            config = GatewayConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }
        applyVerbosity(config.verbosity());

        final NettyConnection connection = NettyConnection.open(config.connectionConfig());
        final HttpGatewayServer server;
        try {
            server = HttpGatewayServer.start(
                    Router.forHandlers(new RouteHandler(connection, config.timeout())),
                    config.bindHost(),
                    config.bindPort(),
                    config.handlerThreads(),
                    config.maxBodySize());
        } catch (InterruptedException | RuntimeException e) {
            connection.close();
            throw e;
        }
        if (!connection.awaitConnected(Duration.ofSeconds(5))) {
            log.warn("Validator at {} not reachable yet, requests fail until it is", config.validatorUrl());
        }

        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            server.close();
            connection.close();
            stopped.countDown();
        }, "ledger-rest-shutdown"));
        stopped.await();
    }

    /**
     * Sets the {@code io.ledgerrest} log level: 0 keeps INFO, 1 is DEBUG,
     * 2 or more is TRACE.
     */
    static void applyVerbosity(int verbosity) {
        final Level level = verbosity <= 0 ? Level.INFO : verbosity == 1 ? Level.DEBUG : Level.TRACE;
        if (LoggerFactory.getLogger("io.ledgerrest") instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(level);
        } else {
            log.warn("Logging backend is not Logback, ignoring verbosity {}", verbosity);
        }
    }
}
