package com.worker.lookup.store;

/**
 * Runtime exception thrown when the record store fails, times out or
 * is otherwise unable to answer a search.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
