package com.example.retrain.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds and switches read by {@link DecisionPolicy}.
 * Lives in memory only and resets to its defaults on restart.
 */
public record PolicyConfig(
        double minQualityThreshold,
        double degradationThreshold,
        boolean autoRetrainEnabled,
        Duration minRetrainInterval) {

    public static final double DEFAULT_MIN_QUALITY = 0.5;
    public static final double DEFAULT_DEGRADATION = 0.1;
    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofHours(6);

    public PolicyConfig {
        Objects.requireNonNull(minRetrainInterval, "minRetrainInterval");
        if (!Double.isFinite(minQualityThreshold)) {
            throw new IllegalArgumentException("min_quality_threshold must be a finite number");
        }
        if (!Double.isFinite(degradationThreshold)) {
            throw new IllegalArgumentException("degradation_threshold must be a finite number");
        }
        if (minRetrainInterval.isNegative()) {
            throw new IllegalArgumentException("min_retrain_interval must not be negative");
        }
    }

    public static PolicyConfig defaults() {
        return new PolicyConfig(DEFAULT_MIN_QUALITY, DEFAULT_DEGRADATION, true, DEFAULT_MIN_INTERVAL);
    }

    /** Returns a copy with only the non-null fields of {@code update} applied. */
    public PolicyConfig merge(PolicyConfigUpdate update) {
        if (update == null) return this;
        return new PolicyConfig(
                update.minQualityThreshold() != null ? update.minQualityThreshold() : minQualityThreshold,
                update.degradationThreshold() != null ? update.degradationThreshold() : degradationThreshold,
                update.autoRetrainEnabled() != null ? update.autoRetrainEnabled() : autoRetrainEnabled,
                update.minRetrainInterval() != null ? update.minRetrainInterval() : minRetrainInterval);
    }

    public double minRetrainIntervalHours() {
        return minRetrainInterval.toMillis() / 3_600_000.0;
    }
}
