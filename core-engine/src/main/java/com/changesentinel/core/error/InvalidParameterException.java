package com.changesentinel.core.error;

/**
 * Thrown for an out-of-range tuning parameter: a false-positive level outside
 * (0, 1), a negative penalty, a non-positive threshold, a replicate count
 * below one or an unknown model family.
 *
 * @since 1.0.0
 */
public class InvalidParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidParameterException(String message) {
        super(message);
    }
}
