package com.wildsentinel.service;

import com.wildsentinel.core.dispatch.WebhookChannel;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable runtime configuration for the alert service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults.
 * Engine tuning (weights, thresholds, species profiles) is not here; it lives
 * in {@code engine.yml}, see
 * {@link com.wildsentinel.core.config.EngineConfigLoader}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaDetectionTopic;
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Workers
    // ---------------------------------------------------------------
    private final int workerThreads;
    private final int cameraQueueCapacity;
    private final int dispatchThreads;
    private final int dispatchQueueCapacity;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final String engineConfigPath;
    private final Duration contextTimeout;

    // ---------------------------------------------------------------
    // API
    // ---------------------------------------------------------------
    private final int apiPort;

    // ---------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------
    private final String webhookSecret;
    private final String webhookSignatureHeader;
    private final String smtpHost;
    private final int smtpPort;
    private final String smtpUsername;
    private final String smtpPassword;
    private final String smtpFrom;

    private ServiceConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaDetectionTopic = b.kafkaDetectionTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.workerThreads = b.workerThreads;
        this.cameraQueueCapacity = b.cameraQueueCapacity;
        this.dispatchThreads = b.dispatchThreads;
        this.dispatchQueueCapacity = b.dispatchQueueCapacity;
        this.engineConfigPath = b.engineConfigPath;
        this.contextTimeout = b.contextTimeout;
        this.apiPort = b.apiPort;
        this.webhookSecret = b.webhookSecret;
        this.webhookSignatureHeader = b.webhookSignatureHeader;
        this.smtpHost = b.smtpHost;
        this.smtpPort = b.smtpPort;
        this.smtpUsername = b.smtpUsername;
        this.smtpPassword = b.smtpPassword;
        this.smtpFrom = b.smtpFrom;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaDetectionTopic(env("KAFKA_DETECTION_TOPIC", "detections"))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "wildlife-alerts"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "wildlife-sentinel"))
                    .workerThreads(parseIntEnv("WORKER_THREADS", "4"))
                    .cameraQueueCapacity(parseIntEnv("CAMERA_QUEUE_CAPACITY", "256"))
                    .dispatchThreads(parseIntEnv("DISPATCH_THREADS", "4"))
                    .dispatchQueueCapacity(parseIntEnv("DISPATCH_QUEUE_CAPACITY", "1024"))
                    .engineConfigPath(env("ENGINE_CONFIG_PATH", ""))
                    .contextTimeout(Duration.ofMillis(parseLongEnv("CONTEXT_TIMEOUT_MS", "1000")))
                    .apiPort(parseIntEnv("API_PORT", "8080"))
                    .webhookSecret(env("WEBHOOK_SECRET", ""))
                    .webhookSignatureHeader(env("WEBHOOK_SIGNATURE_HEADER",
                            WebhookChannel.DEFAULT_SIGNATURE_HEADER))
                    .smtpHost(env("SMTP_HOST", ""))
                    .smtpPort(parseIntEnv("SMTP_PORT", "587"))
                    .smtpUsername(env("SMTP_USERNAME", ""))
                    .smtpPassword(env("SMTP_PASSWORD", ""))
                    .smtpFrom(env("SMTP_FROM", "alerts@wildsentinel.local"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka consumer {@link Properties}.
     *
     * @return new Properties instance configured for consumption
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        props.setProperty("enable.auto.commit", "true");
        props.setProperty("key.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        props.setProperty("value.deserializer", "org.apache.kafka.common.serialization.ByteArrayDeserializer");
        return props;
    }

    /**
     * Build Kafka producer {@link Properties}.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        props.setProperty("value.serializer", "org.apache.kafka.common.serialization.ByteArraySerializer");
        return props;
    }

    /**
     * @return {@code true} when an SMTP host is configured and email delivery
     *         should be enabled
     */
    public boolean isEmailEnabled() {
        return !smtpHost.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaDetectionTopic() {
        return kafkaDetectionTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getCameraQueueCapacity() {
        return cameraQueueCapacity;
    }

    public int getDispatchThreads() {
        return dispatchThreads;
    }

    public int getDispatchQueueCapacity() {
        return dispatchQueueCapacity;
    }

    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public Duration getContextTimeout() {
        return contextTimeout;
    }

    public int getApiPort() {
        return apiPort;
    }

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public String getWebhookSignatureHeader() {
        return webhookSignatureHeader;
    }

    public String getSmtpHost() {
        return smtpHost;
    }

    public int getSmtpPort() {
        return smtpPort;
    }

    public String getSmtpUsername() {
        return smtpUsername;
    }

    public String getSmtpPassword() {
        return smtpPassword;
    }

    public String getSmtpFrom() {
        return smtpFrom;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (thread counts and capacities &gt; 0, ports in [0, 65535] where
     * 0 binds an ephemeral port, positive context timeout, non-blank topic
     * names).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaDetectionTopic = "detections";
        private String kafkaAlertTopic = "wildlife-alerts";
        private String kafkaGroupId = "wildlife-sentinel";
        private int workerThreads = 4;
        private int cameraQueueCapacity = 256;
        private int dispatchThreads = 4;
        private int dispatchQueueCapacity = 1024;
        private String engineConfigPath = "";
        private Duration contextTimeout = Duration.ofSeconds(1);
        private int apiPort = 8080;
        private String webhookSecret = "";
        private String webhookSignatureHeader = WebhookChannel.DEFAULT_SIGNATURE_HEADER;
        private String smtpHost = "";
        private int smtpPort = 587;
        private String smtpUsername = "";
        private String smtpPassword = "";
        private String smtpFrom = "alerts@wildsentinel.local";

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaDetectionTopic(String v) {
            this.kafkaDetectionTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder cameraQueueCapacity(int v) {
            this.cameraQueueCapacity = v;
            return this;
        }

        public Builder dispatchThreads(int v) {
            this.dispatchThreads = v;
            return this;
        }

        public Builder dispatchQueueCapacity(int v) {
            this.dispatchQueueCapacity = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder contextTimeout(Duration v) {
            this.contextTimeout = v;
            return this;
        }

        public Builder apiPort(int v) {
            this.apiPort = v;
            return this;
        }

        public Builder webhookSecret(String v) {
            this.webhookSecret = v;
            return this;
        }

        public Builder webhookSignatureHeader(String v) {
            this.webhookSignatureHeader = v;
            return this;
        }

        public Builder smtpHost(String v) {
            this.smtpHost = v;
            return this;
        }

        public Builder smtpPort(int v) {
            this.smtpPort = v;
            return this;
        }

        public Builder smtpUsername(String v) {
            this.smtpUsername = v;
            return this;
        }

        public Builder smtpPassword(String v) {
            this.smtpPassword = v;
            return this;
        }

        public Builder smtpFrom(String v) {
            this.smtpFrom = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            Objects.requireNonNull(contextTimeout, "contextTimeout required");
            requireNonBlank(kafkaDetectionTopic, "kafkaDetectionTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(webhookSignatureHeader, "webhookSignatureHeader");
            requireNonBlank(smtpFrom, "smtpFrom");
            engineConfigPath = engineConfigPath == null ? "" : engineConfigPath;
            webhookSecret = webhookSecret == null ? "" : webhookSecret;
            smtpHost = smtpHost == null ? "" : smtpHost;

            requirePositive(workerThreads, "workerThreads");
            requirePositive(cameraQueueCapacity, "cameraQueueCapacity");
            requirePositive(dispatchThreads, "dispatchThreads");
            requirePositive(dispatchQueueCapacity, "dispatchQueueCapacity");
            if (contextTimeout.isNegative() || contextTimeout.isZero()) {
                throw new IllegalArgumentException("contextTimeout must be > 0, got: " + contextTimeout);
            }
            if (apiPort < 0 || apiPort > 65_535) {
                throw new IllegalArgumentException("apiPort must be in [0, 65535], got: " + apiPort);
            }
            if (smtpPort < 1 || smtpPort > 65_535) {
                throw new IllegalArgumentException("smtpPort must be in [1, 65535], got: " + smtpPort);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
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
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaDetectionTopic='" + kafkaDetectionTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", workerThreads=" + workerThreads +
                ", cameraQueueCapacity=" + cameraQueueCapacity +
                ", dispatchThreads=" + dispatchThreads +
                ", dispatchQueueCapacity=" + dispatchQueueCapacity +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", contextTimeout=" + contextTimeout +
                ", apiPort=" + apiPort +
                ", webhookSigned=" + !webhookSecret.isEmpty() +
                ", smtpHost='" + smtpHost + '\'' +
                ", smtpPort=" + smtpPort +
                '}';
    }
}
