package io.ledgerrest.rpc;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link NettyConnection}.
 *
 * <p>
 * Zero or {@code null} components fall back to their defaults, so callers only
 * set what they care about:
 *
 * <pre>{@code
 * ConnectionConfig config = ConnectionConfig.builder("tcp://validator:4004")
 *         .defaultRequestTimeout(Duration.ofSeconds(30))
 *         .reconnectDelay(Duration.ofMillis(500))
 *         .build();
 *
 * Connection connection = NettyConnection.open(config);
 * }</pre>
 *
 * @param url                   the validator endpoint, {@code tcp://host:port}
 * @param defaultRequestTimeout how long an unanswered request keeps its slot
 *                              when nobody is waiting on it
 * @param connectTimeout        connection establishment timeout
 * @param reconnectDelay        fixed delay between connection attempts
 * @param ringBufferSize        Disruptor ring buffer size for outbound frames
 *                              (must be power of 2)
 * @param waitStrategy          Disruptor wait strategy type
 * @param ioThreads             number of Netty I/O threads
 * @param maxFrameLength        largest inbound frame accepted, in bytes
 */
public record ConnectionConfig(
        String url,
        Duration defaultRequestTimeout,
        Duration connectTimeout,
        Duration reconnectDelay,
        int ringBufferSize,
        WaitStrategyType waitStrategy,
        int ioThreads,
        int maxFrameLength) {

    /**
     * Disruptor wait strategy types.
     */
    public enum WaitStrategyType {
        /** Parks the publishing thread; cheap on CPU. */
        BLOCKING,
        /** Spins and yields; lower latency at the cost of a busy core. */
        YIELDING
    }

    private static final String SCHEME = "tcp";
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(300);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(1);
    private static final int DEFAULT_RING_SIZE = 1024;
    private static final int DEFAULT_IO_THREADS = 1;
    private static final int DEFAULT_MAX_FRAME_LENGTH = 64 * 1024 * 1024; // 64MB

    public ConnectionConfig {
        Objects.requireNonNull(url, "url");
        validateUrl(url);

        if (defaultRequestTimeout == null)
            defaultRequestTimeout = DEFAULT_REQUEST_TIMEOUT;
        if (connectTimeout == null)
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        if (reconnectDelay == null)
            reconnectDelay = DEFAULT_RECONNECT_DELAY;
        if (ringBufferSize <= 0)
            ringBufferSize = DEFAULT_RING_SIZE;
        if (waitStrategy == null)
            waitStrategy = WaitStrategyType.BLOCKING;
        if (ioThreads <= 0)
            ioThreads = DEFAULT_IO_THREADS;
        if (maxFrameLength <= 0)
            maxFrameLength = DEFAULT_MAX_FRAME_LENGTH;

        if ((ringBufferSize & (ringBufferSize - 1)) != 0) {
            throw new IllegalArgumentException(
                    "ringBufferSize must be a power of 2, got: " + ringBufferSize);
        }
        if (defaultRequestTimeout.isNegative() || defaultRequestTimeout.isZero()) {
            throw new IllegalArgumentException(
                    "defaultRequestTimeout must be positive, got: " + defaultRequestTimeout);
        }
    }

    /**
     * Creates a configuration with all defaults for the given URL.
     */
    public static ConnectionConfig withDefaults(String url) {
        return new ConnectionConfig(url, null, null, null, 0, null, 0, 0);
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    public String host() {
        return URI.create(url).getHost();
    }

    public int port() {
        return URI.create(url).getPort();
    }

    private static void validateUrl(String url) {
        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("url is not a valid URI: " + url, e);
        }
        if (uri.getScheme() == null || !SCHEME.equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("url must use tcp scheme, got: " + uri.getScheme());
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new IllegalArgumentException("url must have a valid host: " + url);
        }
        if (uri.getPort() <= 0) {
            throw new IllegalArgumentException("url must have an explicit port: " + url);
        }
    }

    /**
     * Builder for {@link ConnectionConfig}.
     */
    public static final class Builder {
        private final String url;
        private Duration defaultRequestTimeout = null;
        private Duration connectTimeout = null;
        private Duration reconnectDelay = null;
        private int ringBufferSize = 0;
        private WaitStrategyType waitStrategy = null;
        private int ioThreads = 0;
        private int maxFrameLength = 0;

        private Builder(String url) {
            this.url = Objects.requireNonNull(url, "url");
        }

        /**
         * Default: 300 seconds.
         */
        public Builder defaultRequestTimeout(Duration timeout) {
            this.defaultRequestTimeout = timeout;
            return this;
        }

        /**
         * Default: 10 seconds.
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Default: 1 second.
         */
        public Builder reconnectDelay(Duration delay) {
            this.reconnectDelay = delay;
            return this;
        }

        /**
         * Must be a power of 2. Default: 1024.
         */
        public Builder ringBufferSize(int ringBufferSize) {
            this.ringBufferSize = ringBufferSize;
            return this;
        }

        /**
         * Default: BLOCKING.
         */
        public Builder waitStrategy(WaitStrategyType waitStrategy) {
            this.waitStrategy = waitStrategy;
            return this;
        }

        /**
         * Default: 1.
         */
        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Default: 64 MiB.
         */
        public Builder maxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public ConnectionConfig build() {
            return new ConnectionConfig(
                    url,
                    defaultRequestTimeout,
                    connectTimeout,
                    reconnectDelay,
                    ringBufferSize,
                    waitStrategy,
                    ioThreads,
                    maxFrameLength);
        }
    }
}
