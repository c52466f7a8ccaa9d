package com.worker.lookup.core.model;

/**
 * Thrown when raw input cannot become a {@link SearchTerm}: blank, too short or too long.
 * The search path never lets this escape; it answers with an empty result instead.
 */
public class InvalidSearchTermException extends IllegalArgumentException {

    public InvalidSearchTermException(String message) {
        super(message);
    }
}
