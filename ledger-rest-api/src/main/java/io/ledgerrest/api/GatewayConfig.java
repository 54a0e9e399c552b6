package io.ledgerrest.api;

import io.ledgerrest.rpc.ConnectionConfig;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the gateway process.
 *
 * <p>
 * Zero or {@code null} components fall back to their defaults:
 *
 * <pre>{@code
 * GatewayConfig config = GatewayConfig.builder()
 *         .bind("0.0.0.0", 8008)
 *         .validatorUrl("tcp://validator:4004")
 *         .timeout(Duration.ofSeconds(60))
 *         .build();
 * }</pre>
 *
 * @param bindHost       the interface the HTTP server listens on
 * @param bindPort       the HTTP port; {@code 0} is not a default but an
 *                       ephemeral port chosen at bind time
 * @param validatorUrl   the validator endpoint, {@code tcp://host:port}
 * @param timeout        how long a request waits for the validator; also the
 *                       base of the default commit wait
 * @param handlerThreads threads running route handlers
 * @param verbosity      0 for INFO logging, 1 for DEBUG, 2 or more for TRACE
 * @param maxBodySize    largest request body accepted, in bytes
 */
public record GatewayConfig(
        String bindHost,
        int bindPort,
        String validatorUrl,
        Duration timeout,
        int handlerThreads,
        int verbosity,
        int maxBodySize) {

    static final String DEFAULT_BIND_HOST = "localhost";
    static final int DEFAULT_BIND_PORT = 8080;
    static final String DEFAULT_VALIDATOR_URL = "tcp://localhost:4004";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);
    private static final int DEFAULT_HANDLER_THREADS = 16;
    private static final int DEFAULT_MAX_BODY_SIZE = 10 * 1024 * 1024; // 10MB

    public static final String USAGE = String.join(System.lineSeparator(),
            "usage: ledger-rest-api [-h] [-B BIND] [-C CONNECT] [-t TIMEOUT] [-v]",
            "",
            "  -h, --help             show this help message and exit",
            "  -B, --bind BIND        host:port to listen on (default: localhost:8080)",
            "  -C, --connect CONNECT  validator url (default: tcp://localhost:4004)",
            "  -t, --timeout TIMEOUT  seconds to wait for a validator reply (default: 300)",
            "  -v, --verbose          enable more verbose output, may be repeated");

    public GatewayConfig {
        if (bindHost == null || bindHost.isEmpty())
            bindHost = DEFAULT_BIND_HOST;
        if (validatorUrl == null)
            validatorUrl = DEFAULT_VALIDATOR_URL;
        if (timeout == null)
            timeout = DEFAULT_TIMEOUT;
        if (handlerThreads <= 0)
            handlerThreads = DEFAULT_HANDLER_THREADS;
        if (maxBodySize <= 0)
            maxBodySize = DEFAULT_MAX_BODY_SIZE;

        if (bindPort < 0 || bindPort > 65535) {
            throw new IllegalArgumentException("bindPort must be between 0 and 65535, got: " + bindPort);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        if (verbosity < 0) {
            throw new IllegalArgumentException("verbosity must not be negative, got: " + verbosity);
        }
        // rejects a malformed validator url
        connectionConfig(validatorUrl, timeout);
    }

    public static GatewayConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the configuration of the validator connection; unanswered
     *         requests are reclaimed after {@link #timeout()}
     */
    public ConnectionConfig connectionConfig() {
        return connectionConfig(validatorUrl, timeout);
    }

    private static ConnectionConfig connectionConfig(String url, Duration timeout) {
        return ConnectionConfig.builder(url)
                .defaultRequestTimeout(timeout)
                .build();
    }

    /**
     * @return {@code true} if the arguments ask for the usage text
     */
    public static boolean isHelpRequested(String... args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses command-line arguments.
     *
     * <p>
     * Options take their value as the next argument or after {@code =}
     * ({@code --bind=0.0.0.0:8008}). {@code -v} may be repeated or stacked
     * ({@code -vv}).
     *
     * @throws IllegalArgumentException with the usage text if an argument is
     *                                  unknown or malformed
     */
    public static GatewayConfig fromArgs(String... args) {
        Builder builder = builder();
        int verbosity = 0;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inline = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                inline = arg.substring(eq + 1);
                arg = arg.substring(0, eq);
            }
            switch (arg) {
                case "-B", "--bind" -> {
                    String value = inline != null ? inline : valueOf(args, ++i, arg);
                    int colon = value.lastIndexOf(':');
                    if (colon <= 0 || colon == value.length() - 1) {
                        throw usageError("bind must be host:port, got: " + value);
                    }
                    builder.bind(value.substring(0, colon), parseInt(value.substring(colon + 1), arg));
                }
                case "-C", "--connect" -> builder.validatorUrl(inline != null ? inline : valueOf(args, ++i, arg));
                case "-t", "--timeout" -> {
                    int seconds = parseInt(inline != null ? inline : valueOf(args, ++i, arg), arg);
                    if (seconds <= 0) {
                        throw usageError("timeout must be a positive number of seconds, got: " + seconds);
                    }
                    builder.timeout(Duration.ofSeconds(seconds));
                }
                case "--verbose" -> verbosity++;
                case "-h", "--help" -> {
                    // handled by the caller through isHelpRequested
                }
                default -> {
                    if (arg.matches("-v+")) {
                        verbosity += arg.length() - 1;
                    } else {
                        throw usageError("unrecognized argument: " + arg);
                    }
                }
            }
        }
        try {
            return builder.verbosity(verbosity).build();
        } catch (IllegalArgumentException e) {
            throw usageError(e.getMessage());
        }
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length) {
            throw usageError("argument " + option + ": expected one argument");
        }
        return args[index];
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw usageError("argument " + option + ": invalid int value: '" + value + "'");
        }
    }

    private static IllegalArgumentException usageError(String message) {
        return new IllegalArgumentException(message + System.lineSeparator() + USAGE);
    }

    /**
     * Builder for {@link GatewayConfig}.
     */
    public static final class Builder {
        private String bindHost = null;
        private int bindPort = DEFAULT_BIND_PORT;
        private String validatorUrl = null;
        private Duration timeout = null;
        private int handlerThreads = 0;
        private int verbosity = 0;
        private int maxBodySize = 0;

        private Builder() {
        }

        public Builder bind(String host, int port) {
            this.bindHost = Objects.requireNonNull(host, "host");
            this.bindPort = port;
            return this;
        }

        public Builder validatorUrl(String url) {
            this.validatorUrl = Objects.requireNonNull(url, "url");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder handlerThreads(int handlerThreads) {
            this.handlerThreads = handlerThreads;
            return this;
        }

        public Builder verbosity(int verbosity) {
            this.verbosity = verbosity;
            return this;
        }

        public Builder maxBodySize(int maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(bindHost, bindPort, validatorUrl, timeout,
                    handlerThreads, verbosity, maxBodySize);
        }
    }
}
