package com.example.retrain.engine;

import java.time.Duration;

/**
 * Partial {@link PolicyConfig}: {@code null} components are left unchanged by
 * {@link PolicyConfig#merge(PolicyConfigUpdate)}.
 */
public record PolicyConfigUpdate(
        Double minQualityThreshold,
        Double degradationThreshold,
        Boolean autoRetrainEnabled,
        Duration minRetrainInterval) {

    public static PolicyConfigUpdate autoRetrain(boolean enabled) {
        return new PolicyConfigUpdate(null, null, enabled, null);
    }
}
