package com.example.retrain.engine;

/**
 * Result of {@link RetrainOrchestrator#checkAndRetrain()}.
 *
 * @param retrainTriggered whether the verdict started a retrain
 * @param reason           verdict reason
 * @param outcome          the retrain outcome, {@code null} when no action was taken
 */
public record CheckResult(boolean retrainTriggered, String reason, RetrainOutcome outcome) {

    static CheckResult noAction(String reason) {
        return new CheckResult(false, reason, null);
    }
}
