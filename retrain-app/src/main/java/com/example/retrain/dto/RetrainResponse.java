package com.example.retrain.dto;

import com.example.retrain.engine.RetrainOutcome;

import java.time.Instant;

/**
 * Wire form of a {@link RetrainOutcome}. {@code success=false} is a normal response, not an HTTP error.
 */
public record RetrainResponse(
        String retrain_id,
        boolean success,
        String reason,
        Instant start_time,
        double duration_seconds,
        Double new_performance,
        String error,
        String message,
        Instant timestamp) {

    public static RetrainResponse of(RetrainOutcome o, Instant now) {
        return new RetrainResponse(o.retrainId(), o.success(), o.reason(), o.startTime(), o.durationSeconds(),
                o.newQuality(), o.error(), o.message(), now);
    }
}
