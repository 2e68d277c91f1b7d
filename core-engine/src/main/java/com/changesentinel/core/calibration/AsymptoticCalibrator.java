package com.changesentinel.core.calibration;

import com.changesentinel.core.model.CalibrationMethod;
import com.changesentinel.core.model.CalibrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Closed-form threshold from the Gumbel limit of the normalized CUSUM maximum.
 *
 * <p>
 * With a<sub>n</sub> = (2 log log n)<sup>&minus;1/2</sup>,
 * b<sub>n</sub> = 1/a<sub>n</sub> + &frac12;&middot;a<sub>n</sub>&middot;log log log n and
 * u<sub>&alpha;</sub> = &minus;log(&minus;log(1&minus;&alpha;)&middot;&radic;(2&pi;)), the
 * critical value for C<sub>max</sub> is c&#771; = a<sub>n</sub>u<sub>&alpha;</sub> + b<sub>n</sub>
 * and the returned threshold is c&#771;&sup2;.
 * </p>
 *
 * <p>
 * <strong>Conservative for finite n.</strong> The normalized maximum
 * converges at rate O(log log n), so for practical lengths the threshold is
 * noticeably larger than the true (1&minus;&alpha;) quantile and the realised
 * false-positive rate sits below &alpha;. Use {@link MonteCarloCalibrator}
 * for a sharper value.
 * </p>
 *
 * <p>
 * Requires n &ge; 3: log log log n is undefined for n = 2.
 * </p>
 *
 * @since 1.0.0
 */
public final class AsymptoticCalibrator implements ThresholdCalibrator {

    private static final Logger LOG = LoggerFactory.getLogger(AsymptoticCalibrator.class);

    static final int MIN_LENGTH = 3;

    @Override
    public CalibrationResult calibrate(int n, double alpha) {
        CalibrationArguments.check(n, MIN_LENGTH, alpha);
        double logLogN = Math.log(Math.log(n));
        double a = 1.0 / Math.sqrt(2 * logLogN);
        double b = 1.0 / a + 0.5 * a * Math.log(logLogN);
        double u = -Math.log(-Math.log(1 - alpha) * Math.sqrt(2 * Math.PI));
        double critical = a * u + b;
        double threshold = critical * critical;

        List<String> warnings = new ArrayList<>();
        if (critical <= 0) {
            String warning = String.format(
                    "Asymptotic critical value %.4f is not positive for n=%d, alpha=%.4f; "
                            + "the limit law is not usable here", critical, n, alpha);
            LOG.warn(warning);
            warnings.add(warning);
        }

        LOG.debug("Asymptotic threshold for n={}, alpha={}: {}", n, alpha, threshold);
        return new CalibrationResult(CalibrationMethod.ASYMPTOTIC, n, alpha, threshold, null, warnings);
    }

    @Override
    public CalibrationMethod method() {
        return CalibrationMethod.ASYMPTOTIC;
    }
}
