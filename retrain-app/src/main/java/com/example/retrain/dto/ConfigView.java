package com.example.retrain.dto;

import com.example.retrain.engine.PolicyConfig;

public record ConfigView(
        double min_quality_threshold,
        double degradation_threshold,
        boolean auto_retrain_enabled,
        double min_retrain_interval_hours) {

    public static ConfigView of(PolicyConfig c) {
        return new ConfigView(c.minQualityThreshold(), c.degradationThreshold(), c.autoRetrainEnabled(),
                c.minRetrainIntervalHours());
    }
}
