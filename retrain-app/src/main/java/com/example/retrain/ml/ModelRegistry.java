package com.example.retrain.ml;

import java.io.IOException;

/**
 * Versioned store of trained models.
 */
public interface ModelRegistry {

    /**
     * @return the highest registered version of {@code name}
     * @throws ModelNotFoundException if no version is registered
     */
    RegisteredModel latest(String name) throws IOException;

    /**
     * Stores {@code model} as the next version of {@code name}.
     *
     * @return the stored entry, carrying its assigned version
     */
    RegisteredModel register(String name, LinearModel model, int samples, double trainingR2) throws IOException;
}
