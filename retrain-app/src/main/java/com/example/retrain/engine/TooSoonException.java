package com.example.retrain.engine;

import lombok.Getter;

/**
 * A retrain was requested inside the cooldown window. Recoverable: retry later or force.
 */
@Getter
public class TooSoonException extends RuntimeException {

    private final String blockingReason;

    public TooSoonException(String blockingReason) {
        super("Retraining not allowed: " + blockingReason + ". Use force=true to override.");
        this.blockingReason = blockingReason;
    }
}
