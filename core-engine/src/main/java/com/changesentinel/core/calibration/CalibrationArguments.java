package com.changesentinel.core.calibration;

import com.changesentinel.core.error.InvalidInputException;
import com.changesentinel.core.error.InvalidParameterException;

final class CalibrationArguments {

    private CalibrationArguments() {
        // utility class - not instantiable
    }

    static void check(int n, int minimumLength, double alpha) {
        if (!(alpha > 0 && alpha < 1)) {
            throw new InvalidParameterException("alpha must be in (0, 1), got: " + alpha);
        }
        if (n < minimumLength) {
            throw new InvalidInputException("Calibration needs a series length >= " + minimumLength
                    + ", got: " + n);
        }
    }
}
