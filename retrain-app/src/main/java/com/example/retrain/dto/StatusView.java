package com.example.retrain.dto;

import com.example.retrain.engine.EngineState;
import com.example.retrain.engine.EngineStatus;

import java.time.Instant;

/**
 * Response of {@code GET /v1/retrain/status}.
 * {@code current_performance} is {@code null} when there is no model or no dataset to score it on.
 */
public record StatusView(
        boolean auto_retrain_enabled,
        boolean should_retrain,
        String retrain_reason,
        Double current_performance,
        boolean data_changed,
        Instant last_retrain_time,
        long retrain_count,
        Instant last_check_time,
        String last_data_fingerprint,
        Double last_performance,
        ConfigView config,
        Instant timestamp) {

    public static StatusView of(EngineStatus s, Instant now) {
        EngineState st = s.state();
        return new StatusView(
                s.config().autoRetrainEnabled(),
                s.verdict().shouldRetrain(),
                s.verdict().reason(),
                s.currentQuality().isPresent() ? s.currentQuality().getAsDouble() : null,
                s.dataChanged(),
                st.lastRetrainTime(),
                st.retrainCount(),
                st.lastCheckTime(),
                st.lastDataFingerprint(),
                st.lastQualityScore(),
                ConfigView.of(s.config()),
                now);
    }
}
