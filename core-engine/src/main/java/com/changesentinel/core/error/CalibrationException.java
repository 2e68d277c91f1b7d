package com.changesentinel.core.error;

/**
 * Thrown when a Monte Carlo replicate fails. The whole calibration is
 * abandoned; the failing replicate is reported rather than dropped from the
 * quantile.
 *
 * @since 1.0.0
 */
public class CalibrationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final int replicateIndex;

    public CalibrationException(int replicateIndex, Throwable cause) {
        super("Monte Carlo replicate " + replicateIndex + " failed: " + cause.getMessage(), cause);
        this.replicateIndex = replicateIndex;
    }

    /**
     * @return zero-based index of the replicate that failed
     */
    public int getReplicateIndex() {
        return replicateIndex;
    }
}
