package com.example.retrain.ml;

import java.util.OptionalDouble;

/**
 * Current quality of the deployed model, higher is better.
 */
public interface QualityEvaluator {

    /**
     * @return the score, or empty when there is no model or no data to score it on
     */
    OptionalDouble currentQuality();
}
