package com.example.retrain.dto;

/**
 * Body of {@code POST /v1/retrain/trigger}. Both fields are optional.
 *
 * @param reason free text recorded with the attempt, defaults to {@code "Manual API trigger"}
 * @param force  {@code true} to bypass the cooldown
 */
public record TriggerRequest(String reason, Boolean force) {

    public static final String DEFAULT_REASON = "Manual API trigger";

    public String reasonOrDefault() {
        return (reason == null || reason.isBlank()) ? DEFAULT_REASON : reason;
    }

    public boolean forced() {
        return Boolean.TRUE.equals(force);
    }
}
