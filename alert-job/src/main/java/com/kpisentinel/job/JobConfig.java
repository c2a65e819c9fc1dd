package com.kpisentinel.job;

import com.kpisentinel.core.config.EngineSettings;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration of the daily KPI Sentinel run.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job
 * is configured the same way from a cron entry, a container or a shell.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    // ---------------------------------------------------------------
    // Input
    // ---------------------------------------------------------------
    private final String metricsInputPath;
    private final String modelParamsPath;
    private final int pastDays;
    private final int historyDays;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final boolean limsupAlert;
    private final boolean futurePredictions;
    private final int parallelism;
    private final long fitTimeoutSeconds;

    // ---------------------------------------------------------------
    // Forecast store
    // ---------------------------------------------------------------
    private final boolean evaluatePredictions;
    private final String forecastStorePath;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final boolean publishAlerts;
    private final boolean publishOnlyAlerts;
    private final String kafkaBootstrapServers;
    private final String kafkaAlertTopic;

    private JobConfig(Builder b) {
        this.metricsInputPath = b.metricsInputPath;
        this.modelParamsPath = b.modelParamsPath;
        this.pastDays = b.pastDays;
        this.historyDays = b.historyDays;
        this.limsupAlert = b.limsupAlert;
        this.futurePredictions = b.futurePredictions;
        this.parallelism = b.parallelism;
        this.fitTimeoutSeconds = b.fitTimeoutSeconds;
        this.evaluatePredictions = b.evaluatePredictions;
        this.forecastStorePath = b.forecastStorePath;
        this.publishAlerts = b.publishAlerts;
        this.publishOnlyAlerts = b.publishOnlyAlerts;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static JobConfig fromEnvironment(Map<String, String> env) {
        try {
            return new Builder()
                    .metricsInputPath(env(env, "METRICS_INPUT_PATH", "metrics.csv"))
                    .modelParamsPath(env(env, "MODEL_PARAMS_PATH", ""))
                    .pastDays(Integer.parseInt(env(env, "PAST_DAYS", "1")))
                    .historyDays(Integer.parseInt(env(env, "HISTORY_DAYS", "365")))
                    .limsupAlert(Boolean.parseBoolean(env(env, "LIMSUP_ALERT", "false")))
                    .futurePredictions(Boolean.parseBoolean(env(env, "FUTURE_PREDICTIONS", "false")))
                    .parallelism(Integer.parseInt(env(env, "FIT_PARALLELISM", "1")))
                    .fitTimeoutSeconds(Long.parseLong(env(env, "FIT_TIMEOUT_SECONDS", "300")))
                    .evaluatePredictions(Boolean.parseBoolean(env(env, "EVALUATE_PREDICTIONS", "false")))
                    .forecastStorePath(env(env, "FORECAST_STORE_PATH", "forecasts.csv"))
                    .publishAlerts(Boolean.parseBoolean(env(env, "PUBLISH_ALERTS", "true")))
                    .publishOnlyAlerts(Boolean.parseBoolean(env(env, "PUBLISH_ONLY_ALERTS", "true")))
                    .kafkaBootstrapServers(env(env, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaAlertTopic(env(env, "KAFKA_ALERT_TOPIC", "kpi-alerts"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Derived settings
    // ---------------------------------------------------------------

    /**
     * @return settings handed to the detection engine
     */
    public EngineSettings engineSettings() {
        return EngineSettings.builder()
                .limsupAlertEnabled(limsupAlert)
                .sendFuturePredictions(futurePredictions)
                .parallelism(parallelism)
                .fitTimeout(Duration.ofSeconds(fitTimeoutSeconds))
                .build();
    }

    /**
     * Build Kafka producer {@link Properties}.
     *
     * @return new Properties instance configured for alert publication
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("client.id", "kpi-sentinel");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getMetricsInputPath() {
        return metricsInputPath;
    }

    public String getModelParamsPath() {
        return modelParamsPath;
    }

    public int getPastDays() {
        return pastDays;
    }

    public int getHistoryDays() {
        return historyDays;
    }

    public boolean isLimsupAlert() {
        return limsupAlert;
    }

    public boolean isFuturePredictions() {
        return futurePredictions;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getFitTimeoutSeconds() {
        return fitTimeoutSeconds;
    }

    public boolean isEvaluatePredictions() {
        return evaluatePredictions;
    }

    public String getForecastStorePath() {
        return forecastStorePath;
    }

    public boolean isPublishAlerts() {
        return publishAlerts;
    }

    public boolean isPublishOnlyAlerts() {
        return publishOnlyAlerts;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (past days &gt;= 0, history days &gt;= 2, parallelism &gt; 0,
     * timeout &gt; 0, non-blank paths and topic).
     * </p>
     */
    public static class Builder {
        private String metricsInputPath = "metrics.csv";
        private String modelParamsPath = "";
        private int pastDays = 1;
        private int historyDays = 365;
        private boolean limsupAlert;
        private boolean futurePredictions;
        private int parallelism = 1;
        private long fitTimeoutSeconds = 300;
        private boolean evaluatePredictions;
        private String forecastStorePath = "forecasts.csv";
        private boolean publishAlerts = true;
        private boolean publishOnlyAlerts = true;
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaAlertTopic = "kpi-alerts";

        public Builder metricsInputPath(String v) {
            this.metricsInputPath = v;
            return this;
        }

        public Builder modelParamsPath(String v) {
            this.modelParamsPath = v;
            return this;
        }

        public Builder pastDays(int v) {
            this.pastDays = v;
            return this;
        }

        public Builder historyDays(int v) {
            this.historyDays = v;
            return this;
        }

        public Builder limsupAlert(boolean v) {
            this.limsupAlert = v;
            return this;
        }

        public Builder futurePredictions(boolean v) {
            this.futurePredictions = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder fitTimeoutSeconds(long v) {
            this.fitTimeoutSeconds = v;
            return this;
        }

        public Builder evaluatePredictions(boolean v) {
            this.evaluatePredictions = v;
            return this;
        }

        public Builder forecastStorePath(String v) {
            this.forecastStorePath = v;
            return this;
        }

        public Builder publishAlerts(boolean v) {
            this.publishAlerts = v;
            return this;
        }

        public Builder publishOnlyAlerts(boolean v) {
            this.publishOnlyAlerts = v;
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(modelParamsPath, "modelParamsPath required");
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(metricsInputPath, "metricsInputPath");
            requireNonBlank(forecastStorePath, "forecastStorePath");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");

            if (pastDays < 0) {
                throw new IllegalArgumentException("pastDays must be >= 0, got: " + pastDays);
            }
            if (historyDays < 2) {
                throw new IllegalArgumentException("historyDays must be >= 2, got: " + historyDays);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (fitTimeoutSeconds < 1) {
                throw new IllegalArgumentException(
                        "fitTimeoutSeconds must be >= 1, got: " + fitTimeoutSeconds);
            }

            return new JobConfig(this);
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
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "metricsInputPath='" + metricsInputPath + '\'' +
                ", modelParamsPath='" + modelParamsPath + '\'' +
                ", pastDays=" + pastDays +
                ", historyDays=" + historyDays +
                ", limsupAlert=" + limsupAlert +
                ", futurePredictions=" + futurePredictions +
                ", parallelism=" + parallelism +
                ", fitTimeoutSeconds=" + fitTimeoutSeconds +
                ", evaluatePredictions=" + evaluatePredictions +
                ", forecastStorePath='" + forecastStorePath + '\'' +
                ", publishAlerts=" + publishAlerts +
                ", publishOnlyAlerts=" + publishOnlyAlerts +
                ", kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                '}';
    }
}
