package com.example.retrain.store;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One line of the retrain event log.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetrainEvent(
        String id,
        Instant timestamp,
        String reason,
        boolean success,
        Double duration_seconds,
        Double old_performance,
        Double new_performance,
        String error_message) {
}
