package com.example.retrain.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Last-known facts about the deployed model family, persisted by a
 * {@link com.example.retrain.store.StateStore}.
 *
 * <p>
 * Optional fields are {@code null} while unset. The record is immutable; every
 * transition produces a new instance that is written back as a whole, so readers
 * never observe a half-updated state.
 * </p>
 *
 * @param lastRetrainTime     completion time of the last successful retrain
 * @param lastDataFingerprint dataset fingerprint recorded at the last retrain
 * @param lastQualityScore    quality score recorded at the last retrain
 * @param retrainCount        number of successful retrains, never decreases
 * @param lastCheckTime       last time a decision was evaluated
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record EngineState(
        @JsonProperty("last_retrain_time") Instant lastRetrainTime,
        @JsonProperty("last_data_fingerprint") String lastDataFingerprint,
        @JsonProperty("last_quality_score") Double lastQualityScore,
        @JsonProperty("retrain_count") long retrainCount,
        @JsonProperty("last_check_time") Instant lastCheckTime) {

    public EngineState {
        if (retrainCount < 0) {
            throw new IllegalArgumentException("retrainCount must be >= 0, was " + retrainCount);
        }
    }

    /** State of a store that has never been written. */
    public static EngineState initial() {
        return new EngineState(null, null, null, 0L, null);
    }

    public EngineState withLastCheckTime(Instant checkedAt) {
        return new EngineState(lastRetrainTime, lastDataFingerprint, lastQualityScore, retrainCount, checkedAt);
    }

    /**
     * Transition applied after a successful training job.
     * The retrain time never moves backwards, even if the clock does.
     */
    public EngineState afterSuccessfulRetrain(Instant completedAt, String fingerprint, Double qualityScore) {
        Instant retrainTime = (lastRetrainTime != null && lastRetrainTime.isAfter(completedAt))
                ? lastRetrainTime
                : completedAt;
        return new EngineState(retrainTime, fingerprint, qualityScore, retrainCount + 1, completedAt);
    }
}
