package com.example.retrain.dto;

import com.example.retrain.engine.CheckResult;

import java.time.Instant;

/**
 * Response of {@code POST /v1/retrain/check}; {@code outcome} is {@code null} when no retrain ran.
 */
public record CheckResponse(boolean retrain_triggered, String reason, RetrainResponse outcome) {

    public static CheckResponse of(CheckResult r, Instant now) {
        return new CheckResponse(r.retrainTriggered(), r.reason(),
                r.outcome() == null ? null : RetrainResponse.of(r.outcome(), now));
    }
}
