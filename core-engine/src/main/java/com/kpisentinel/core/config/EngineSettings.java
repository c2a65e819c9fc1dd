package com.kpisentinel.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Run-wide switches of the alert detection engine.
 *
 * <p>
 * Use the {@link Builder}; {@link Builder#build()} validates the values.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineSettings {

    private final boolean limsupAlertEnabled;
    private final boolean sendFuturePredictions;
    private final int parallelism;
    private final Duration fitTimeout;

    private EngineSettings(Builder b) {
        this.limsupAlertEnabled = b.limsupAlertEnabled;
        this.sendFuturePredictions = b.sendFuturePredictions;
        this.parallelism = b.parallelism;
        this.fitTimeout = b.fitTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} if values above the upper bound raise an alert
     */
    public boolean isLimsupAlertEnabled() {
        return limsupAlertEnabled;
    }

    /**
     * @return {@code true} if the forecast table is part of the result
     */
    public boolean isSendFuturePredictions() {
        return sendFuturePredictions;
    }

    /**
     * @return number of worker threads fitting forecast models
     */
    public int getParallelism() {
        return parallelism;
    }

    /**
     * @return maximum time to wait for one metric's forecast
     */
    public Duration getFitTimeout() {
        return fitTimeout;
    }

    /**
     * Fluent builder for {@link EngineSettings}.
     */
    public static class Builder {
        private boolean limsupAlertEnabled;
        private boolean sendFuturePredictions;
        private int parallelism = 1;
        private Duration fitTimeout = Duration.ofMinutes(5);

        public Builder limsupAlertEnabled(boolean v) {
            this.limsupAlertEnabled = v;
            return this;
        }

        public Builder sendFuturePredictions(boolean v) {
            this.sendFuturePredictions = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder fitTimeout(Duration v) {
            this.fitTimeout = v;
            return this;
        }

        /**
         * @return validated settings
         * @throws IllegalArgumentException if parallelism or timeout are out of
         *                                  range
         */
        public EngineSettings build() {
            Objects.requireNonNull(fitTimeout, "fitTimeout required");
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (fitTimeout.isZero() || fitTimeout.isNegative()) {
                throw new IllegalArgumentException("fitTimeout must be positive, got: " + fitTimeout);
            }
            return new EngineSettings(this);
        }
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "limsupAlertEnabled=" + limsupAlertEnabled +
                ", sendFuturePredictions=" + sendFuturePredictions +
                ", parallelism=" + parallelism +
                ", fitTimeout=" + fitTimeout +
                '}';
    }
}
