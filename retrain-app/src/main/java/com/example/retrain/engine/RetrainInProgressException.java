package com.example.retrain.engine;

/**
 * Another state-affecting operation already holds the engine.
 */
public class RetrainInProgressException extends RuntimeException {

    public RetrainInProgressException() {
        super("Retrain already in progress");
    }
}
