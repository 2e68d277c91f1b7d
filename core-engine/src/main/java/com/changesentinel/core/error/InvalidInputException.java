package com.changesentinel.core.error;

/**
 * Thrown when the data handed to an operation cannot support it: a series
 * that is too short, a segment outside the series, or a segment shorter than
 * the cost family requires.
 *
 * @since 1.0.0
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}
