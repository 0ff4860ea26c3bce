package com.conveyal.hills.summary;

import com.google.common.collect.ImmutableList;
import org.apache.commons.math3.stat.descriptive.moment.Kurtosis;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Max;
import org.apache.commons.math3.stat.descriptive.rank.Min;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Descriptive statistics of one group of values. Variance and standard deviation are the bias-corrected sample
 * versions, undefined (NaN) for fewer than two values. Skewness needs at least three values and excess kurtosis at
 * least four. Percentiles interpolate linearly between order statistics (the R-7 estimator, as in most spreadsheet and
 * dataframe software).
 */
public class SummaryStatistics {

    /** Names of the fixed columns, in output order. Percentile columns follow them. */
    public static final List<String> BASE_COLUMNS = ImmutableList.of(
            "count", "mean", "min", "max", "stdev", "sem", "var", "cv", "skew", "kurt");

    public final long count;

    public final double mean;

    public final double min;

    public final double max;

    public final double stdev;

    public final double sem;

    public final double var;

    /** Coefficient of variation: stdev / mean, or zero when the mean is not positive. */
    public final double cv;

    public final double skew;

    public final double kurt;

    /** Percentile values keyed by column name (p25, p95...) in the order they were requested. */
    public final Map<String, Double> percentiles;

    private SummaryStatistics (long count, double mean, double min, double max, double var,
                               double skew, double kurt, Map<String, Double> percentiles) {
        this.count = count;
        this.mean = mean;
        this.min = min;
        this.max = max;
        this.var = var;
        this.stdev = Math.sqrt(var);
        this.sem = count > 0 ? stdev / Math.sqrt(count) : Double.NaN;
        this.cv = mean > 0 ? stdev / mean : 0;
        this.skew = skew;
        this.kurt = kurt;
        this.percentiles = Collections.unmodifiableMap(percentiles);
    }

    /**
     * Compute statistics over the given values.
     * @param percentiles fractions in [0, 1], e.g. 0.95 for the 95th percentile.
     */
    public static SummaryStatistics of (double[] values, List<Double> percentiles) {
        int n = values.length;
        Map<String, Double> percentileValues = new LinkedHashMap<>();
        if (n == 0) {
            for (double p : percentiles) {
                percentileValues.put(columnName(p), Double.NaN);
            }
            return new SummaryStatistics(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                    Double.NaN, Double.NaN, percentileValues);
        }
        double mean = new Mean().evaluate(values);
        double min = new Min().evaluate(values);
        double max = new Max().evaluate(values);
        double var = n < 2 ? Double.NaN : new Variance(true).evaluate(values);

        // The incremental forms report zero rather than NaN for constant samples.
        Skewness skewness = new Skewness();
        skewness.incrementAll(values);
        Kurtosis kurtosis = new Kurtosis();
        kurtosis.incrementAll(values);

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(sorted);
        for (double p : percentiles) {
            checkArgument(p >= 0 && p <= 1, "Percentile %s is outside [0, 1].", p);
            // Percentile rejects a quantile of zero, which is the minimum by definition.
            double value = p == 0 ? sorted[0] : percentile.evaluate(p * 100);
            percentileValues.put(columnName(p), value);
        }
        return new SummaryStatistics(n, mean, min, max, var, skewness.getResult(), kurtosis.getResult(),
                percentileValues);
    }

    /** Column name for a percentile fraction: 0.95 becomes p95. */
    public static String columnName (double percentile) {
        return "p" + Math.round(percentile * 100);
    }

    /** All column names for the given percentiles, fixed columns first. */
    public static List<String> columns (List<Double> percentiles) {
        List<String> columns = new ArrayList<>(BASE_COLUMNS);
        for (double p : percentiles) {
            columns.add(columnName(p));
        }
        return columns;
    }

    /** Look up a statistic by column name. */
    public double get (String column) {
        switch (column) {
            case "count": return count;
            case "mean": return mean;
            case "min": return min;
            case "max": return max;
            case "stdev": return stdev;
            case "sem": return sem;
            case "var": return var;
            case "cv": return cv;
            case "skew": return skew;
            case "kurt": return kurt;
            default:
                Double value = percentiles.get(column);
                if (value == null) {
                    throw new IllegalArgumentException("Unknown statistic " + column);
                }
                return value;
        }
    }

    @Override
    public String toString () {
        return String.format("n=%d mean=%.4f min=%.4f max=%.4f stdev=%.4f %s", count, mean, min, max, stdev,
                percentiles);
    }

}
