package com.example.retrain.engine;

import java.util.OptionalDouble;

/**
 * Read-only snapshot returned by {@link RetrainOrchestrator#status()}.
 */
public record EngineStatus(
        EngineState state,
        Verdict verdict,
        OptionalDouble currentQuality,
        boolean dataChanged,
        PolicyConfig config) {
}
