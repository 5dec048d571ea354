package com.incidentsentinel.service;

import java.util.Objects;

/**
 * Typed, immutable configuration for the Incident Sentinel service.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * service can be configured from a container definition or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private final String resourceId;
    private final int detectionIntervalSeconds;
    private final int lookbackMinutes;
    private final int fetchParallelism;

    // ---------------------------------------------------------------
    // API
    // ---------------------------------------------------------------
    private final String apiHost;
    private final int apiPort;

    // ---------------------------------------------------------------
    // Storage / sources
    // ---------------------------------------------------------------
    private final String rulesConfigPath;
    private final String incidentStorePath;
    private final String metricsDataDir;

    private ServiceConfig(Builder b) {
        this.resourceId = b.resourceId;
        this.detectionIntervalSeconds = b.detectionIntervalSeconds;
        this.lookbackMinutes = b.lookbackMinutes;
        this.fetchParallelism = b.fetchParallelism;
        this.apiHost = b.apiHost;
        this.apiPort = b.apiPort;
        this.rulesConfigPath = b.rulesConfigPath;
        this.incidentStorePath = b.incidentStorePath;
        this.metricsDataDir = b.metricsDataDir;
    }

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric env-var cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .resourceId(env("MONITORED_RESOURCE_ID", ""))
                    .detectionIntervalSeconds(parseIntEnv("DETECTION_INTERVAL_SECONDS", "60"))
                    .lookbackMinutes(parseIntEnv("DETECTION_LOOKBACK_MINUTES", "10"))
                    .fetchParallelism(parseIntEnv("FETCH_PARALLELISM", "3"))
                    .apiHost(env("API_HOST", "0.0.0.0"))
                    .apiPort(parseIntEnv("API_PORT", "8000"))
                    .rulesConfigPath(env("RULES_CONFIG_PATH", ""))
                    .incidentStorePath(env("INCIDENT_STORE_PATH", "incidents.jsonl"))
                    .metricsDataDir(env("METRICS_DATA_DIR", "metrics"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getResourceId() {
        return resourceId;
    }

    public int getDetectionIntervalSeconds() {
        return detectionIntervalSeconds;
    }

    public int getLookbackMinutes() {
        return lookbackMinutes;
    }

    public int getFetchParallelism() {
        return fetchParallelism;
    }

    public String getApiHost() {
        return apiHost;
    }

    public int getApiPort() {
        return apiPort;
    }

    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public String getIncidentStorePath() {
        return incidentStorePath;
    }

    public String getMetricsDataDir() {
        return metricsDataDir;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} requires a resource id and checks that the interval,
     * lookback and parallelism are positive and the port is in
     * [0, 65535]. Port 0 binds an ephemeral port.
     * </p>
     */
    public static class Builder {
        private String resourceId;
        private int detectionIntervalSeconds = 60;
        private int lookbackMinutes = 10;
        private int fetchParallelism = 3;
        private String apiHost = "0.0.0.0";
        private int apiPort = 8000;
        private String rulesConfigPath = "";
        private String incidentStorePath = "incidents.jsonl";
        private String metricsDataDir = "metrics";

        public Builder resourceId(String v) {
            this.resourceId = v;
            return this;
        }

        public Builder detectionIntervalSeconds(int v) {
            this.detectionIntervalSeconds = v;
            return this;
        }

        public Builder lookbackMinutes(int v) {
            this.lookbackMinutes = v;
            return this;
        }

        public Builder fetchParallelism(int v) {
            this.fetchParallelism = v;
            return this;
        }

        public Builder apiHost(String v) {
            this.apiHost = v;
            return this;
        }

        public Builder apiPort(int v) {
            this.apiPort = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder incidentStorePath(String v) {
            this.incidentStorePath = v;
            return this;
        }

        public Builder metricsDataDir(String v) {
            this.metricsDataDir = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            requireNonBlank(resourceId, "resourceId (MONITORED_RESOURCE_ID)");
            requireNonBlank(apiHost, "apiHost");
            requireNonBlank(incidentStorePath, "incidentStorePath");
            requireNonBlank(metricsDataDir, "metricsDataDir");
            Objects.requireNonNull(rulesConfigPath, "rulesConfigPath required");

            if (detectionIntervalSeconds < 1) {
                throw new IllegalArgumentException(
                        "detectionIntervalSeconds must be >= 1, got: " + detectionIntervalSeconds);
            }
            if (lookbackMinutes < 1) {
                throw new IllegalArgumentException(
                        "lookbackMinutes must be >= 1, got: " + lookbackMinutes);
            }
            if (fetchParallelism < 1) {
                throw new IllegalArgumentException(
                        "fetchParallelism must be >= 1, got: " + fetchParallelism);
            }
            if (apiPort < 0 || apiPort > 65_535) {
                throw new IllegalArgumentException(
                        "apiPort must be in [0, 65535], got: " + apiPort);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "resourceId='" + resourceId + '\'' +
                ", detectionIntervalSeconds=" + detectionIntervalSeconds +
                ", lookbackMinutes=" + lookbackMinutes +
                ", fetchParallelism=" + fetchParallelism +
                ", apiHost='" + apiHost + '\'' +
                ", apiPort=" + apiPort +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                ", incidentStorePath='" + incidentStorePath + '\'' +
                ", metricsDataDir='" + metricsDataDir + '\'' +
                '}';
    }
}
