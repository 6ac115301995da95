package com.causalgraph.discovery;

import java.util.Arrays;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Statistical screens used to validate causal hypotheses.
 *
 * <p>{@link #laggedCausalityPValue} is a lightweight stand-in for a Granger test: it correlates
 * the cause at {@code t} with the effect at {@code t + 1} and reports {@code 1 - |r|} as a
 * pseudo p-value. There is no autoregression and no lag selection. It is a screen, and a
 * rejection means "insufficient evidence", not "disproven".
 *
 * <p>Both methods expect series of equal length, aligned on their most recent points; see
 * {@link #alignLatest}.
 */
public final class CausalityStatistics {

    private static final double EPSILON = 1e-8;

    private CausalityStatistics() {}

    /** Best correlation found by the cross-correlation sweep and the lag it occurred at. */
    public record LaggedCorrelation(double correlation, int lag) {}

    /**
     * Truncates both series to their common length, keeping the most recent points.
     *
     * @return a two-element array {cause, effect}
     */
    public static double[][] alignLatest(double[] cause, double[] effect) {
        int n = Math.min(cause.length, effect.length);
        return new double[][] {
            Arrays.copyOfRange(cause, cause.length - n, cause.length),
            Arrays.copyOfRange(effect, effect.length - n, effect.length)
        };
    }

    /**
     * Pseudo p-value of "cause at t predicts effect at t+1": {@code 1 - |corr|}, clamped to
     * [0, 1]. Returns 1.0 when the correlation is undefined (fewer than two aligned pairs or a
     * constant slice).
     */
    public static double laggedCausalityPValue(double[] cause, double[] effect) {
        int n = Math.min(cause.length, effect.length);
        if (n < 3) {
            return 1.0;
        }
        double[] causeLagged = Arrays.copyOfRange(cause, 0, n - 1);
        double[] effectCurrent = Arrays.copyOfRange(effect, 1, n);
        double correlation = pearson(causeLagged, effectCurrent);
        if (Double.isNaN(correlation)) {
            return 1.0;
        }
        return Math.max(0.0, Math.min(1.0, 1.0 - Math.abs(correlation)));
    }

    /**
     * Sweeps lags {@code -L..L} with {@code L = n / 2} over z-normalized series and returns the
     * correlation with the largest magnitude. A positive lag pairs earlier cause values with
     * later effect values. Undefined correlations are skipped; if all are undefined the result
     * is (0, 0).
     */
    public static LaggedCorrelation crossCorrelation(double[] cause, double[] effect) {
        int n = Math.min(cause.length, effect.length);
        if (n < 2) {
            return new LaggedCorrelation(0.0, 0);
        }
        double[] c = normalize(Arrays.copyOf(cause, n));
        double[] e = normalize(Arrays.copyOf(effect, n));

        int maxLag = n / 2;
        double best = 0.0;
        int bestLag = 0;
        boolean found = false;
        for (int lag = -maxLag; lag <= maxLag; lag++) {
            int shift = Math.abs(lag);
            double[] x;
            double[] y;
            if (lag >= 0) {
                x = Arrays.copyOfRange(c, 0, n - shift);
                y = Arrays.copyOfRange(e, shift, n);
            } else {
                x = Arrays.copyOfRange(c, shift, n);
                y = Arrays.copyOfRange(e, 0, n - shift);
            }
            double correlation = pearson(x, y);
            if (Double.isNaN(correlation)) {
                continue;
            }
            if (!found || Math.abs(correlation) > Math.abs(best)) {
                best = correlation;
                bestLag = lag;
                found = true;
            }
        }
        return new LaggedCorrelation(best, bestLag);
    }

    /** Pearson correlation; NaN when undefined. */
    static double pearson(double[] x, double[] y) {
        if (x.length < 2 || x.length != y.length) {
            return Double.NaN;
        }
        return new PearsonsCorrelation().correlation(x, y);
    }

    private static double[] normalize(double[] values) {
        double mean = new Mean().evaluate(values);
        double std = new StandardDeviation(false).evaluate(values);
        double[] normalized = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            normalized[i] = (values[i] - mean) / (std + EPSILON);
        }
        return normalized;
    }
}
