package io.formresolve.standalone.config;

import io.formresolve.core.model.UnknownValuePolicy;

/**
 * Root configuration of the standalone form service. Every field has a default; use
 * {@link #builder()} to construct instances.
 *
 * @param serverHost                bind address of the HTTP server
 * @param serverPort                listen port, {@code 0} for an ephemeral port
 * @param schemasDir                directory scanned for {@code *.yaml}/{@code *.yml} schema files
 * @param defaultUnknownValuePolicy policy for schemas whose operation block omits one
 * @param problemStatus             HTTP status of rejected compilations
 * @param reloadEnabled             watch {@code schemasDir} and hot-reload on change
 * @param reloadDebounceMs          debounce period for file change events
 * @param healthEnabled             register the liveness and readiness endpoints
 * @param healthPath                liveness probe path
 * @param readyPath                 readiness probe path
 * @param loggingFormat             {@code json} or {@code text}
 * @param loggingLevel              root log level
 * @param adminReloadPath           reload trigger endpoint path
 */
public record ServerConfig(
        String serverHost,
        int serverPort,
        String schemasDir,
        UnknownValuePolicy defaultUnknownValuePolicy,
        int problemStatus,
        boolean reloadEnabled,
        int reloadDebounceMs,
        boolean healthEnabled,
        String healthPath,
        String readyPath,
        String loggingFormat,
        String loggingLevel,
        String adminReloadPath) {

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {
        private String serverHost = "0.0.0.0";
        private int serverPort = 9090;
        private String schemasDir = "./schemas";
        private UnknownValuePolicy defaultUnknownValuePolicy = UnknownValuePolicy.STRICT_THROW;
        private int problemStatus = 422;
        private boolean reloadEnabled = true;
        private int reloadDebounceMs = 500;
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String readyPath = "/ready";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";
        private String adminReloadPath = "/admin/reload";

        Builder() {}

        public Builder serverHost(String serverHost) {
            this.serverHost = serverHost;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder schemasDir(String schemasDir) {
            this.schemasDir = schemasDir;
            return this;
        }

        public Builder defaultUnknownValuePolicy(UnknownValuePolicy defaultUnknownValuePolicy) {
            this.defaultUnknownValuePolicy = defaultUnknownValuePolicy;
            return this;
        }

        public Builder problemStatus(int problemStatus) {
            this.problemStatus = problemStatus;
            return this;
        }

        public Builder reloadEnabled(boolean reloadEnabled) {
            this.reloadEnabled = reloadEnabled;
            return this;
        }

        public Builder reloadDebounceMs(int reloadDebounceMs) {
            this.reloadDebounceMs = reloadDebounceMs;
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

        public Builder readyPath(String readyPath) {
            this.readyPath = readyPath;
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

        public Builder adminReloadPath(String adminReloadPath) {
            this.adminReloadPath = adminReloadPath;
            return this;
        }

        /**
         * Builds the {@link ServerConfig}.
         *
         * @throws ConfigLoadException if a value is out of range
         */
        public ServerConfig build() {
            if (serverPort < 0 || serverPort > 65535) {
                throw new ConfigLoadException("server.port must be between 0 and 65535, got " + serverPort);
            }
            if (problemStatus < 400 || problemStatus > 599) {
                throw new ConfigLoadException(
                        "engine.problem-status must be an HTTP error status (400-599), got " + problemStatus);
            }
            if (reloadDebounceMs < 0) {
                throw new ConfigLoadException("reload.debounce-ms must not be negative, got " + reloadDebounceMs);
            }
            return new ServerConfig(
                    serverHost,
                    serverPort,
                    schemasDir,
                    defaultUnknownValuePolicy,
                    problemStatus,
                    reloadEnabled,
                    reloadDebounceMs,
                    healthEnabled,
                    healthPath,
                    readyPath,
                    loggingFormat,
                    loggingLevel,
                    adminReloadPath);
        }
    }
}
