package io.ailang.standalone.config;

import java.util.Locale;
import java.util.Set;

/**
 * Configuration of the AILang HTTP service.
 *
 * <p>Every field has a default; use {@link #builder()} to construct instances.
 *
 * @param host          bind address
 * @param port          listen port, {@code 0} for an ephemeral port
 * @param maxBodyBytes  largest accepted request body
 * @param healthEnabled whether the liveness endpoint is registered
 * @param healthPath    liveness endpoint path
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  level for the application loggers
 */
public record ServerConfig(
        String host,
        int port,
        int maxBodyBytes,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    static final Set<String> LOGGING_FORMATS = Set.of("text", "json");

    /** Creates a new builder with the defaults applied. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a configuration holding only the defaults. */
    public static ServerConfig defaults() {
        return builder().build();
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8787;
        private int maxBodyBytes = 1_048_576; // 1 MB
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws IllegalArgumentException if a value is out of range
         */
        public ServerConfig build() {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("server.host must not be empty");
            }
            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException("server.port out of range: " + port);
            }
            if (maxBodyBytes <= 0) {
                throw new IllegalArgumentException("server.max-body-bytes must be positive: " + maxBodyBytes);
            }
            if (healthPath == null || !healthPath.startsWith("/")) {
                throw new IllegalArgumentException("health.path must start with '/': " + healthPath);
            }
            String format = loggingFormat == null ? "" : loggingFormat.toLowerCase(Locale.ROOT);
            if (!LOGGING_FORMATS.contains(format)) {
                throw new IllegalArgumentException("logging.format must be text or json: " + loggingFormat);
            }
            return new ServerConfig(
                    host,
                    port,
                    maxBodyBytes,
                    healthEnabled,
                    healthPath,
                    format,
                    loggingLevel == null ? "INFO" : loggingLevel.toUpperCase(Locale.ROOT));
        }
    }
}
