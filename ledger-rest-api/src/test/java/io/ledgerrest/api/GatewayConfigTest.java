package io.ledgerrest.api;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.ledgerrest.rpc.ConnectionConfig;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

class GatewayConfigTest {

    @Test
    void testDefaults() {
        GatewayConfig config = GatewayConfig.fromArgs();

        assertEquals("localhost", config.bindHost());
        assertEquals(8080, config.bindPort());
        assertEquals("tcp://localhost:4004", config.validatorUrl());
        assertEquals(Duration.ofSeconds(300), config.timeout());
        assertEquals(16, config.handlerThreads());
        assertEquals(0, config.verbosity());
        assertEquals(10 * 1024 * 1024, config.maxBodySize());
    }

    @Test
    void testShortOptions() {
        GatewayConfig config = GatewayConfig.fromArgs("-B", "0.0.0.0:8008", "-C", "tcp://validator:4004",
                "-t", "60", "-vv");

        assertEquals("0.0.0.0", config.bindHost());
        assertEquals(8008, config.bindPort());
        assertEquals("tcp://validator:4004", config.validatorUrl());
        assertEquals(Duration.ofSeconds(60), config.timeout());
        assertEquals(2, config.verbosity());
    }

    @Test
    void testLongOptionsWithInlineValues() {
        GatewayConfig config = GatewayConfig.fromArgs("--bind=api.local:9000", "--connect", "tcp://10.0.0.2:4004",
                "--timeout=5", "--verbose", "-v");

        assertEquals("api.local", config.bindHost());
        assertEquals(9000, config.bindPort());
        assertEquals(Duration.ofSeconds(5), config.timeout());
        assertEquals(2, config.verbosity());
    }

    @Test
    void testConnectionConfigUsesTimeoutAsDefaultRequestTimeout() {
        ConnectionConfig connection = GatewayConfig.fromArgs("-C", "tcp://validator:4004", "-t", "42")
                .connectionConfig();

        assertEquals("validator", connection.host());
        assertEquals(4004, connection.port());
        assertEquals(Duration.ofSeconds(42), connection.defaultRequestTimeout());
    }

    @ParameterizedTest
    @ValueSource(strings = {"-B localhost", "-B :8080", "-B host:", "-B host:abc", "-t 0", "-t soon", "-C http://x:1",
            "-C tcp://nohost", "--nope", "-x", "-B"})
    void testMalformedArgumentsShowUsage(String args) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> GatewayConfig.fromArgs(args.split(" ")));
        assertTrue(ex.getMessage().contains("usage: ledger-rest-api"), ex.getMessage());
    }

    @Test
    void testHelpDetection() {
        assertTrue(GatewayConfig.isHelpRequested("-v", "--help"));
        assertTrue(GatewayConfig.isHelpRequested("-h"));
        assertFalse(GatewayConfig.isHelpRequested("-v"));
    }

    @Test
    void testBuilderRejectsBadValues() {
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.builder().bind("h", 70000).build());
        assertThrows(IllegalArgumentException.class,
                () -> GatewayConfig.builder().timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> GatewayConfig.builder().validatorUrl("validator:4004").build());
    }

    @Test
    void testVerbosityRaisesProjectLogLevel() {
        Logger logger = (Logger) LoggerFactory.getLogger("io.ledgerrest");
        Level original = logger.getLevel();
        try {
            RestApi.applyVerbosity(1);
            assertEquals(Level.DEBUG, logger.getLevel());
            RestApi.applyVerbosity(3);
            assertEquals(Level.TRACE, logger.getLevel());
            RestApi.applyVerbosity(0);
            assertEquals(Level.INFO, logger.getLevel());
        } finally {
            logger.setLevel(original);
        }
    }
}
