package com.example.retrain.ml;

public class ModelNotFoundException extends RuntimeException {

    public ModelNotFoundException(String name) {
        super("No registered model named '" + name + "'");
    }
}
