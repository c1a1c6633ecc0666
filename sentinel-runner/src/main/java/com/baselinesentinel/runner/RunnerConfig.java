package com.baselinesentinel.runner;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable process configuration of the sentinel runner.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the runner is configured entirely through Kubernetes Deployment env vars
 * or Docker {@code -e} flags. Detection thresholds live in the YAML file
 * named by {@code SENTINEL_CONFIG_PATH}, not here.
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
public final class RunnerConfig {

    /** Where anomaly reports go. */
    public enum SinkType {
        LOG,
        KAFKA;

        static SinkType parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "REPORT_SINK must be one of log, kafka, got: '" + value + "'", e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Metric source
    // ---------------------------------------------------------------
    private final String metricsBaseUrl;
    private final Duration metricsQueryTimeout;

    // ---------------------------------------------------------------
    // AWS sources
    // ---------------------------------------------------------------
    private final String awsRegion;
    private final List<String> rdsClusterIdentifiers;
    private final List<String> elastiCacheReplicationGroups;
    private final int redisScanLimit;

    // ---------------------------------------------------------------
    // Detection configuration
    // ---------------------------------------------------------------
    private final String sentinelConfigPath;

    // ---------------------------------------------------------------
    // HTTP (health + trigger)
    // ---------------------------------------------------------------
    private final int httpPort;
    private final String triggerApiKey;

    // ---------------------------------------------------------------
    // Schedule
    // ---------------------------------------------------------------
    private final LocalTime scheduleTime;
    private final int scheduleIntervalDays;

    // ---------------------------------------------------------------
    // Report sink
    // ---------------------------------------------------------------
    private final SinkType reportSink;
    private final String kafkaBootstrapServers;
    private final String kafkaReportTopic;

    // ---------------------------------------------------------------
    // Deployment inventory
    // ---------------------------------------------------------------
    private final boolean inventoryEnabled;
    private final String kubernetesNamespace;

    private RunnerConfig(Builder b) {
        this.metricsBaseUrl = stripTrailingSlash(b.metricsBaseUrl);
        this.metricsQueryTimeout = b.metricsQueryTimeout;
        this.awsRegion = b.awsRegion;
        this.rdsClusterIdentifiers = List.copyOf(b.rdsClusterIdentifiers);
        this.elastiCacheReplicationGroups = List.copyOf(b.elastiCacheReplicationGroups);
        this.redisScanLimit = b.redisScanLimit;
        this.sentinelConfigPath = b.sentinelConfigPath;
        this.httpPort = b.httpPort;
        this.triggerApiKey = b.triggerApiKey;
        this.scheduleTime = b.scheduleTime;
        this.scheduleIntervalDays = b.scheduleIntervalDays;
        this.reportSink = b.reportSink;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaReportTopic = b.kafkaReportTopic;
        this.inventoryEnabled = b.inventoryEnabled;
        this.kubernetesNamespace = b.kubernetesNamespace;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RunnerConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link RunnerConfig} from the given variables.
     *
     * @param env variable map, e.g. {@link System#getenv()}
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment must not be null");
        try {
            return new Builder()
                    .metricsBaseUrl(env(env, "METRICS_BASE_URL", "http://localhost:9090"))
                    .metricsQueryTimeout(Duration.ofSeconds(
                            Long.parseLong(env(env, "METRICS_QUERY_TIMEOUT_SECONDS", "30"))))
                    .awsRegion(env(env, "AWS_REGION", "ap-south-1"))
                    .rdsClusterIdentifiers(list(env(env, "RDS_CLUSTER_IDENTIFIERS", "")))
                    .elastiCacheReplicationGroups(list(env(env, "ELASTICACHE_REPLICATION_GROUPS", "")))
                    .redisScanLimit(Integer.parseInt(env(env, "REDIS_SCAN_LIMIT", "100000")))
                    .sentinelConfigPath(env(env, "SENTINEL_CONFIG_PATH", ""))
                    .httpPort(Integer.parseInt(env(env, "HTTP_PORT", "8080")))
                    .triggerApiKey(env(env, "TRIGGER_API_KEY", ""))
                    .scheduleTime(LocalTime.parse(env(env, "SCHEDULE_TIME", "12:45")))
                    .scheduleIntervalDays(Integer.parseInt(env(env, "SCHEDULE_INTERVAL_DAYS", "1")))
                    .reportSink(SinkType.parse(env(env, "REPORT_SINK", "log")))
                    .kafkaBootstrapServers(env(env, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaReportTopic(env(env, "KAFKA_REPORT_TOPIC", "anomaly-reports"))
                    .inventoryEnabled(Boolean.parseBoolean(env(env, "INVENTORY_ENABLED", "true")))
                    .kubernetesNamespace(env(env, "KUBERNETES_NAMESPACE", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                    "SCHEDULE_TIME must look like HH:mm, got: '" + e.getParsedString() + "'", e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka producer {@link Properties} for report publishing.
     *
     * @return new Properties instance
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("retries", "3");
        props.setProperty("enable.idempotence", "true");
        props.setProperty("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        props.setProperty("value.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        props.setProperty("client.id", "baseline-sentinel");
        return props;
    }

    /**
     * @return {@code true} when {@code /trigger} requires an API key
     */
    public boolean isTriggerProtected() {
        return !triggerApiKey.isEmpty();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getMetricsBaseUrl() {
        return metricsBaseUrl;
    }

    public Duration getMetricsQueryTimeout() {
        return metricsQueryTimeout;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    public List<String> getRdsClusterIdentifiers() {
        return rdsClusterIdentifiers;
    }

    public List<String> getElastiCacheReplicationGroups() {
        return elastiCacheReplicationGroups;
    }

    public int getRedisScanLimit() {
        return redisScanLimit;
    }

    public String getSentinelConfigPath() {
        return sentinelConfigPath;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public String getTriggerApiKey() {
        return triggerApiKey;
    }

    public LocalTime getScheduleTime() {
        return scheduleTime;
    }

    public int getScheduleIntervalDays() {
        return scheduleIntervalDays;
    }

    public SinkType getReportSink() {
        return reportSink;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaReportTopic() {
        return kafkaReportTopic;
    }

    public boolean isInventoryEnabled() {
        return inventoryEnabled;
    }

    public String getKubernetesNamespace() {
        return kubernetesNamespace;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     *
     * <p>
     * {@link #build()} checks the port range, positive timeout, interval and
     * scan limit, and non-blank URL, region and topic.
     * </p>
     */
    public static class Builder {
        private String metricsBaseUrl = "http://localhost:9090";
        private Duration metricsQueryTimeout = Duration.ofSeconds(30);
        private String awsRegion = "ap-south-1";
        private List<String> rdsClusterIdentifiers = List.of();
        private List<String> elastiCacheReplicationGroups = List.of();
        private int redisScanLimit = 100_000;
        private String sentinelConfigPath = "";
        private int httpPort = 8080;
        private String triggerApiKey = "";
        private LocalTime scheduleTime = LocalTime.of(12, 45);
        private int scheduleIntervalDays = 1;
        private SinkType reportSink = SinkType.LOG;
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaReportTopic = "anomaly-reports";
        private boolean inventoryEnabled = true;
        private String kubernetesNamespace = "";

        public Builder metricsBaseUrl(String v) {
            this.metricsBaseUrl = v;
            return this;
        }

        public Builder metricsQueryTimeout(Duration v) {
            this.metricsQueryTimeout = v;
            return this;
        }

        public Builder awsRegion(String v) {
            this.awsRegion = v;
            return this;
        }

        public Builder rdsClusterIdentifiers(List<String> v) {
            this.rdsClusterIdentifiers = v;
            return this;
        }

        public Builder elastiCacheReplicationGroups(List<String> v) {
            this.elastiCacheReplicationGroups = v;
            return this;
        }

        public Builder redisScanLimit(int v) {
            this.redisScanLimit = v;
            return this;
        }

        public Builder sentinelConfigPath(String v) {
            this.sentinelConfigPath = v;
            return this;
        }

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder triggerApiKey(String v) {
            this.triggerApiKey = v;
            return this;
        }

        public Builder scheduleTime(LocalTime v) {
            this.scheduleTime = v;
            return this;
        }

        public Builder scheduleIntervalDays(int v) {
            this.scheduleIntervalDays = v;
            return this;
        }

        public Builder reportSink(SinkType v) {
            this.reportSink = v;
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaReportTopic(String v) {
            this.kafkaReportTopic = v;
            return this;
        }

        public Builder inventoryEnabled(boolean v) {
            this.inventoryEnabled = v;
            return this;
        }

        public Builder kubernetesNamespace(String v) {
            this.kubernetesNamespace = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunnerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            requireNonBlank(metricsBaseUrl, "metricsBaseUrl");
            requireNonBlank(awsRegion, "awsRegion");
            Objects.requireNonNull(rdsClusterIdentifiers, "rdsClusterIdentifiers required");
            Objects.requireNonNull(elastiCacheReplicationGroups, "elastiCacheReplicationGroups required");
            Objects.requireNonNull(metricsQueryTimeout, "metricsQueryTimeout required");
            Objects.requireNonNull(scheduleTime, "scheduleTime required");
            Objects.requireNonNull(reportSink, "reportSink required");
            if (sentinelConfigPath == null) {
                sentinelConfigPath = "";
            }
            if (triggerApiKey == null) {
                triggerApiKey = "";
            }
            if (kubernetesNamespace == null) {
                kubernetesNamespace = "";
            }

            if (metricsQueryTimeout.isNegative() || metricsQueryTimeout.isZero()) {
                throw new IllegalArgumentException(
                        "metricsQueryTimeout must be > 0, got: " + metricsQueryTimeout);
            }
            if (httpPort < 1 || httpPort > 65_535) {
                throw new IllegalArgumentException(
                        "httpPort must be in [1, 65535], got: " + httpPort);
            }
            if (redisScanLimit < 1) {
                throw new IllegalArgumentException(
                        "redisScanLimit must be >= 1, got: " + redisScanLimit);
            }
            if (scheduleIntervalDays < 1) {
                throw new IllegalArgumentException(
                        "scheduleIntervalDays must be >= 1, got: " + scheduleIntervalDays);
            }
            if (reportSink == SinkType.KAFKA) {
                requireNonBlank(kafkaBootstrapServers, "kafkaBootstrapServers");
                requireNonBlank(kafkaReportTopic, "kafkaReportTopic");
            }

            return new RunnerConfig(this);
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

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    /** Comma-separated values, blanks dropped. */
    static List<String> list(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "metricsBaseUrl='" + metricsBaseUrl + '\'' +
                ", metricsQueryTimeout=" + metricsQueryTimeout +
                ", awsRegion='" + awsRegion + '\'' +
                ", rdsClusterIdentifiers=" + rdsClusterIdentifiers +
                ", elastiCacheReplicationGroups=" + elastiCacheReplicationGroups +
                ", redisScanLimit=" + redisScanLimit +
                ", sentinelConfigPath='" + sentinelConfigPath + '\'' +
                ", httpPort=" + httpPort +
                ", triggerProtected=" + isTriggerProtected() +
                ", scheduleTime=" + scheduleTime +
                ", scheduleIntervalDays=" + scheduleIntervalDays +
                ", reportSink=" + reportSink +
                ", kafkaReportTopic='" + kafkaReportTopic + '\'' +
                ", inventoryEnabled=" + inventoryEnabled +
                ", kubernetesNamespace='" + kubernetesNamespace + '\'' +
                '}';
    }
}
