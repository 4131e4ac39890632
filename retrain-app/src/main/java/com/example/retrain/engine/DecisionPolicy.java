package com.example.retrain.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Combines cooldown, data-change and quality signals into a {@link Verdict}.
 *
 * <h2>Rules, in order</h2>
 * <ol>
 *   <li>Auto-retrain disabled: no, and nothing else is checked.</li>
 *   <li>Last successful retrain younger than {@link PolicyConfig#minRetrainInterval()}: no, and
 *       nothing else is checked. Forcing past the cooldown is the orchestrator's business.</li>
 *   <li>Otherwise every trigger that holds adds a reason: changed data, quality below the
 *       absolute minimum, or (only when not below the minimum) quality degraded by more than
 *       {@link PolicyConfig#degradationThreshold()} since the last retrain.</li>
 * </ol>
 *
 * <p>
 * Pure and stateless: no I/O, the current instant is an argument. Never throws for valid
 * (non-null) inputs.
 * </p>
 */
public final class DecisionPolicy {

    static final String DISABLED = "auto-retrain disabled";
    static final String DATA_CHANGED = "data has changed";

    private DecisionPolicy() {}

    public static Verdict decide(EngineState state,
                                 PolicyConfig config,
                                 boolean dataChanged,
                                 OptionalDouble quality,
                                 Instant now) {
        if (!config.autoRetrainEnabled()) {
            return Verdict.no(DISABLED);
        }

        Instant lastRetrain = state.lastRetrainTime();
        if (lastRetrain != null
                && Duration.between(lastRetrain, now).compareTo(config.minRetrainInterval()) < 0) {
            return Verdict.cooldown("Too soon since last retrain (" + lastRetrain + ")");
        }

        List<String> reasons = new ArrayList<>(3);
        if (dataChanged) {
            reasons.add(DATA_CHANGED);
        }
        if (quality.isPresent()) {
            double current = quality.getAsDouble();
            Double previous = state.lastQualityScore();
            if (current < config.minQualityThreshold()) {
                reasons.add(String.format(Locale.ROOT, "Performance below threshold (%.3f < %.3f)",
                        current, config.minQualityThreshold()));
            } else if (previous != null && (previous - current) > config.degradationThreshold()) {
                reasons.add(String.format(Locale.ROOT, "Performance degraded (%.3f -> %.3f)",
                        previous, current));
            }
        }
        return new Verdict(!reasons.isEmpty(), reasons, false);
    }
}
