package org.scoringapi.gateway.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Immutable configuration for the gateway.
 * Values come from environment variables, then a {@code .env} file in the working
 * directory or its parent, then defaults.
 */
public final class GatewayConfig {

    private static final Logger LOG = Logger.getLogger(GatewayConfig.class.getName());

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final String DEFAULT_LOG_FILE = "/app/logs/gateway/gateway.log";
    public static final int DEFAULT_STORE_MAX_ENTRIES = 10_000;

    public static final String HOST_KEY = "GATEWAY_HOST";
    public static final String PORT_KEY = "GATEWAY_PORT";
    public static final String WORKER_THREADS_KEY = "GATEWAY_WORKER_THREADS";
    public static final String LOG_FILE_KEY = "GATEWAY_LOG_FILE";
    public static final String FILE_LOGGING_ENABLED_KEY = "GATEWAY_FILE_LOGGING_ENABLED";
    public static final String STORE_MAX_ENTRIES_KEY = "GATEWAY_STORE_MAX_ENTRIES";

    // Server
    private final String host;
    private final int port;
    private final int workerThreads;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    // Store
    private final int storeMaxEntries;

    private GatewayConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.workerThreads = builder.workerThreads;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
        this.storeMaxEntries = builder.storeMaxEntries;
    }

    /**
     * Creates configuration from environment variables and {@code .env} files.
     */
    public static GatewayConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        Dotenv parentDotenv = Dotenv.configure()
                .directory("../")
                .ignoreIfMissing()
                .load();
        return fromLookup(key -> firstNonBlank(System.getenv(key), dotenv.get(key), parentDotenv.get(key)));
    }

    /**
     * Creates configuration from an arbitrary key lookup; missing keys return null.
     */
    public static GatewayConfig fromLookup(UnaryOperator<String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        return new Builder()
                .host(getString(lookup, HOST_KEY, DEFAULT_HOST))
                .port(getInt(lookup, PORT_KEY, DEFAULT_PORT))
                .workerThreads(getInt(lookup, WORKER_THREADS_KEY, DEFAULT_WORKER_THREADS))
                .logFilePath(getString(lookup, LOG_FILE_KEY, DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, FILE_LOGGING_ENABLED_KEY, false))
                .storeMaxEntries(getInt(lookup, STORE_MAX_ENTRIES_KEY, DEFAULT_STORE_MAX_ENTRIES))
                .build();
    }

    // Getters
    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public int getStoreMaxEntries() {
        return storeMaxEntries;
    }

    // Lookup helpers
    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static String getString(UnaryOperator<String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(UnaryOperator<String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(UnaryOperator<String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    @Override
    public String toString() {
        return "GatewayConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", workerThreads=" + workerThreads +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                ", storeMaxEntries=" + storeMaxEntries +
                '}';
    }

    /**
     * Builder for GatewayConfig.
     */
    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = false;
        private int storeMaxEntries = DEFAULT_STORE_MAX_ENTRIES;

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host must not be null");
            return this;
        }

        /**
         * Port to listen on; 0 picks a free port.
         */
        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 0 and 65535");
            }
            this.port = port;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be at least 1");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public Builder storeMaxEntries(int storeMaxEntries) {
            if (storeMaxEntries < 1) {
                throw new IllegalArgumentException("storeMaxEntries must be at least 1");
            }
            this.storeMaxEntries = storeMaxEntries;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(this);
        }
    }
}
