package com.tictactoe.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server settings. Immutable; build with {@link #builder()} or {@link #fromArgs}.
 */
public final class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 65432;
    public static final int DEFAULT_MAX_WORKERS = 10;
    public static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_MAX_LINE_LENGTH = 8192;

    private final String host;
    private final int port;
    private final int maxWorkers;
    private final int idleTimeoutSeconds;
    private final int maxLineLength;

    private ServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.maxWorkers = builder.maxWorkers;
        this.idleTimeoutSeconds = builder.idleTimeoutSeconds;
        this.maxLineLength = builder.maxLineLength;
    }

    public static ServerConfig defaults() {
        return builder().build();
    }

    /**
     * Parses {@code --host}, {@code --port}, {@code --max-workers} and
     * {@code --idle-timeout}. Values may be given as {@code --port 9000} or
     * {@code --port=9000}. Bad numbers keep the default and are logged, unknown
     * flags are logged and skipped.
     */
    public static ServerConfig fromArgs(String[] args) {
        Builder builder = builder();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String value = null;

            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            } else if (i + 1 < args.length) {
                value = args[i + 1];
            }

            switch (name) {
                case "--host" -> builder.host(value != null ? value : DEFAULT_HOST);
                case "--port" -> builder.port(parseInt(name, value, DEFAULT_PORT, 0));
                case "--max-workers" -> builder.maxWorkers(parseInt(name, value, DEFAULT_MAX_WORKERS, 1));
                case "--idle-timeout" -> builder.idleTimeoutSeconds(parseInt(name, value, DEFAULT_IDLE_TIMEOUT_SECONDS, 0));
                default -> {
                    logger.warn("Ignoring unknown argument '{}'", arg);
                    continue;
                }
            }
            if (eq < 0 || !arg.startsWith("--")) {
                i++;
            }
        }
        return builder.build();
    }

    private static int parseInt(String name, String value, int fallback, int min) {
        if (value == null) {
            logger.warn("Missing value for {}, using default {}", name, fallback);
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < min) {
                logger.warn("Value '{}' for {} is below {}, using default {}", value, name, min, fallback);
                return fallback;
            }
            return parsed;
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}, using default {}", value, name, fallback);
            return fallback;
        }
    }

    public String getHost() {
        return host;
    }

    /** Port to bind; 0 picks a free port. */
    public int getPort() {
        return port;
    }

    /** Maximum number of simultaneously connected clients. */
    public int getMaxWorkers() {
        return maxWorkers;
    }

    /** Seconds without input before a connection is dropped; 0 disables. */
    public int getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private int idleTimeoutSeconds = DEFAULT_IDLE_TIMEOUT_SECONDS;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder idleTimeoutSeconds(int idleTimeoutSeconds) {
            this.idleTimeoutSeconds = idleTimeoutSeconds;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public ServerConfig build() {
            if (maxWorkers < 1) {
                throw new IllegalArgumentException("maxWorkers must be at least 1, was " + maxWorkers);
            }
            if (maxLineLength < 1) {
                throw new IllegalArgumentException("maxLineLength must be at least 1, was " + maxLineLength);
            }
            return new ServerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", maxWorkers=" + maxWorkers +
                ", idleTimeoutSeconds=" + idleTimeoutSeconds +
                ", maxLineLength=" + maxLineLength +
                '}';
    }
}
