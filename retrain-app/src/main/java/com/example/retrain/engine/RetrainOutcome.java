package com.example.retrain.engine;

import java.time.Instant;

/**
 * Result of a single retrain attempt. Job failures are reported here, not thrown.
 *
 * @param retrainId       random id correlating the attempt with the event log
 * @param success         {@code true} when the training job exited with status 0
 * @param reason          why the retrain was requested
 * @param startTime       when the attempt started
 * @param durationSeconds wall-clock duration of the attempt
 * @param newQuality      quality re-evaluated after a successful job, {@code null} otherwise or if unknown
 * @param error           captured stderr of a failed job, {@code null} on success
 * @param message         one-line summary for display
 */
public record RetrainOutcome(
        String retrainId,
        boolean success,
        String reason,
        Instant startTime,
        double durationSeconds,
        Double newQuality,
        String error,
        String message) {

    static RetrainOutcome succeeded(String id, String reason, Instant start, double seconds, Double quality) {
        return new RetrainOutcome(id, true, reason, start, seconds, quality, null,
                String.format(java.util.Locale.ROOT, "Retraining completed successfully in %.1fs", seconds));
    }

    static RetrainOutcome failed(String id, String reason, Instant start, double seconds, String error) {
        return new RetrainOutcome(id, false, reason, start, seconds, null, error,
                "Retraining failed: " + error);
    }
}
