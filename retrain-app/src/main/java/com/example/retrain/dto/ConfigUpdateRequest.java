package com.example.retrain.dto;

import com.example.retrain.engine.PolicyConfigUpdate;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Duration;

/**
 * Body of {@code POST /v1/retrain/config}; absent fields keep their current value.
 */
public record ConfigUpdateRequest(
        Double min_quality_threshold,
        Double degradation_threshold,
        Boolean auto_retrain_enabled,
        @PositiveOrZero Double min_retrain_interval_hours) {

    public PolicyConfigUpdate toUpdate() {
        Duration interval = min_retrain_interval_hours == null
                ? null
                : Duration.ofMillis(Math.round(min_retrain_interval_hours * 3_600_000.0));
        return new PolicyConfigUpdate(min_quality_threshold, degradation_threshold, auto_retrain_enabled, interval);
    }
}
