package com.missioncontrol.core.store;

/**
 * Thrown when the record store cannot complete an operation. Fatal to the single
 * operation that hit it; a transaction in progress has been rolled back.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
