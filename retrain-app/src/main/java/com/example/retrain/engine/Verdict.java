package com.example.retrain.engine;

import java.util.List;

/**
 * Outcome of one {@link DecisionPolicy} evaluation.
 *
 * @param shouldRetrain   whether a retrain is warranted
 * @param reasons         ordered, human-readable reasons; empty when nothing triggered
 * @param cooldownBlocked {@code true} when the verdict was produced by the cooldown rule
 */
public record Verdict(boolean shouldRetrain, List<String> reasons, boolean cooldownBlocked) {

    static final String NO_TRIGGERS = "no retrain triggers";

    public Verdict {
        reasons = List.copyOf(reasons);
    }

    static Verdict no(String reason) {
        return new Verdict(false, List.of(reason), false);
    }

    static Verdict cooldown(String reason) {
        return new Verdict(false, List.of(reason), true);
    }

    /** Reasons joined for display. */
    public String reason() {
        return reasons.isEmpty() ? NO_TRIGGERS : String.join("; ", reasons);
    }
}
