package io.ledgerrest.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConnectionConfigTest {

    @Test
    void testDefaults() {
        ConnectionConfig config = ConnectionConfig.withDefaults("tcp://localhost:4004");

        assertEquals("localhost", config.host());
        assertEquals(4004, config.port());
        assertEquals(Duration.ofSeconds(300), config.defaultRequestTimeout());
        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(Duration.ofSeconds(1), config.reconnectDelay());
        assertEquals(1024, config.ringBufferSize());
        assertEquals(ConnectionConfig.WaitStrategyType.BLOCKING, config.waitStrategy());
        assertEquals(1, config.ioThreads());
        assertEquals(64 * 1024 * 1024, config.maxFrameLength());
    }

    @Test
    void testBuilderOverridesDefaults() {
        ConnectionConfig config = ConnectionConfig.builder("tcp://10.0.0.5:9000")
                .defaultRequestTimeout(Duration.ofSeconds(5))
                .reconnectDelay(Duration.ofMillis(250))
                .ringBufferSize(64)
                .waitStrategy(ConnectionConfig.WaitStrategyType.YIELDING)
                .build();

        assertEquals(Duration.ofSeconds(5), config.defaultRequestTimeout());
        assertEquals(Duration.ofMillis(250), config.reconnectDelay());
        assertEquals(64, config.ringBufferSize());
        assertEquals(ConnectionConfig.WaitStrategyType.YIELDING, config.waitStrategy());
    }

    @ParameterizedTest
    @ValueSource(strings = {"http://localhost:4004", "localhost:4004", "tcp://localhost", "tcp://:4004", "tcp://bad host:1"})
    void testRejectsInvalidUrls(String url) {
        assertThrows(IllegalArgumentException.class, () -> ConnectionConfig.withDefaults(url));
    }

    @Test
    void testRejectsRingBufferSizeNotPowerOfTwo() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ConnectionConfig.builder("tcp://localhost:4004").ringBufferSize(1000).build());
        assertTrue(ex.getMessage().contains("power of 2"));
    }

    @Test
    void testRejectsNegativeRequestTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> ConnectionConfig.builder("tcp://localhost:4004")
                        .defaultRequestTimeout(Duration.ofSeconds(-1))
                        .build());
    }
}
