package com.example.retrain.ml;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A model version as stored in the registry.
 *
 * @param name       model family name
 * @param version    1-based version, increasing per registration
 * @param model      the fitted model
 * @param samples    number of training rows
 * @param trainingR2 R² on the held-out split measured at training time
 * @param createdAt  registration time
 */
public record RegisteredModel(
        String name,
        int version,
        LinearModel model,
        int samples,
        @JsonProperty("training_r2") double trainingR2,
        @JsonProperty("created_at") Instant createdAt) {
}
