package com.example.retrain.store;

/**
 * The state store could not be read or written. Fatal for the calling operation.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
