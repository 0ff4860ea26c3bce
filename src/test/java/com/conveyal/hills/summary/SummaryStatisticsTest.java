package com.conveyal.hills.summary;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SummaryStatisticsTest {

    private static final double DELTA = 1e-9;

    private static final List<Double> PERCENTILES = Arrays.asList(0.25, 0.5, 0.75, 0.95, 0.99);

    @Test
    public void testAgainstHandComputedValues () {
        SummaryStatistics stats = SummaryStatistics.of(new double[] {2, 4, 4, 4, 5, 5, 7, 9}, PERCENTILES);
        assertEquals(8, stats.count);
        assertEquals(5.0, stats.mean, DELTA);
        assertEquals(2.0, stats.min, DELTA);
        assertEquals(9.0, stats.max, DELTA);
        assertEquals(32.0 / 7, stats.var, DELTA);
        assertEquals(2.138089935299395, stats.stdev, DELTA);
        assertEquals(0.7559289460184544, stats.sem, DELTA);
        assertEquals(2.138089935299395 / 5, stats.cv, DELTA);
        assertEquals(0.8184875533567996, stats.skew, DELTA);
        assertEquals(0.940625, stats.kurt, DELTA);
        assertEquals(4.0, stats.get("p25"), DELTA);
        assertEquals(4.5, stats.get("p50"), DELTA);
        assertEquals(5.5, stats.get("p75"), DELTA);
        assertEquals(8.3, stats.get("p95"), DELTA);
        assertEquals(8.86, stats.get("p99"), DELTA);
    }

    @Test
    public void testPercentilesInterpolateLinearly () {
        SummaryStatistics stats = SummaryStatistics.of(new double[] {5, 1, 4, 2, 3}, Arrays.asList(0.0, 0.25, 0.95, 1.0));
        assertEquals(1.0, stats.get("p0"), DELTA);
        assertEquals(2.0, stats.get("p25"), DELTA);
        assertEquals(4.8, stats.get("p95"), DELTA);
        assertEquals(5.0, stats.get("p100"), DELTA);
        assertEquals(0.0, stats.skew, DELTA);
        assertEquals(-1.2, stats.kurt, DELTA);
    }

    @Test
    public void testSmallSamples () {
        SummaryStatistics one = SummaryStatistics.of(new double[] {3}, PERCENTILES);
        assertEquals(1, one.count);
        assertEquals(3.0, one.mean, DELTA);
        assertTrue(Double.isNaN(one.var));
        assertTrue(Double.isNaN(one.stdev));
        assertTrue(Double.isNaN(one.sem));
        assertTrue(Double.isNaN(one.skew));
        assertEquals(3.0, one.get("p95"), DELTA);

        SummaryStatistics three = SummaryStatistics.of(new double[] {1, 2, 6}, PERCENTILES);
        assertTrue(Double.isNaN(three.kurt));
        assertTrue(!Double.isNaN(three.skew));

        SummaryStatistics none = SummaryStatistics.of(new double[0], PERCENTILES);
        assertEquals(0, none.count);
        assertTrue(Double.isNaN(none.mean));
        assertTrue(Double.isNaN(none.get("p50")));
    }

    @Test
    public void testCoefficientOfVariationWithZeroMean () {
        SummaryStatistics zeros = SummaryStatistics.of(new double[] {0, 0, 0, 0}, PERCENTILES);
        assertEquals(0.0, zeros.cv, DELTA);
        assertEquals(0.0, zeros.stdev, DELTA);
    }

    @Test
    public void testColumns () {
        List<String> columns = SummaryStatistics.columns(PERCENTILES);
        assertEquals(15, columns.size());
        assertEquals("count", columns.get(0));
        assertEquals("kurt", columns.get(9));
        assertEquals(Arrays.asList("p25", "p50", "p75", "p95", "p99"), columns.subList(10, 15));
        assertEquals("p50", SummaryStatistics.columnName(0.5));
        assertEquals("p29", SummaryStatistics.columnName(0.29));
        assertThrows(IllegalArgumentException.class,
                () -> SummaryStatistics.of(new double[] {1}, Collections.emptyList()).get("median"));
    }

    @Test
    public void testPercentileOutOfRange () {
        assertThrows(IllegalArgumentException.class,
                () -> SummaryStatistics.of(new double[] {1, 2}, Collections.singletonList(1.5)));
    }

}
