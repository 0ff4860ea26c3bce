package com.conveyal.hills.binning;

import com.conveyal.hills.model.EdgeBinMode;
import com.conveyal.hills.model.RecordRelationship;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OccupancyIncrementBuilderTest {

    private static final double DELTA = 1e-12;

    private static final LocalDateTime ORIGIN = LocalDateTime.parse("2024-01-01T00:00");

    private final OccupancyIncrementBuilder fractional =
            new OccupancyIncrementBuilder(ORIGIN, 30, EdgeBinMode.FRACTIONAL);

    private final OccupancyIncrementBuilder wholeBin =
            new OccupancyIncrementBuilder(ORIGIN, 30, EdgeBinMode.WHOLE_BIN);

    private static LocalDateTime t (String time) {
        return LocalDateTime.parse("2024-01-01T" + time);
    }

    private static OccupancyIncrement build (OccupancyIncrementBuilder builder, String entry, String exit, double w) {
        return builder.build(t(entry), t(exit), w, RecordRelationship.INNER);
    }

    @Test
    public void testStayWithinOneBin () {
        OccupancyIncrement increment = build(fractional, "07:05", "07:22", 1.0);
        assertEquals(14, increment.entryBin);
        assertEquals(14, increment.exitBin);
        assertArrayEquals(new double[] {17.0 / 30}, increment.valuesCopy(), DELTA);
    }

    @Test
    public void testStaySpanningTwoBins () {
        OccupancyIncrement increment = build(fractional, "07:20", "07:40", 1.0);
        assertArrayEquals(new double[] {10.0 / 30, 10.0 / 30}, increment.valuesCopy(), DELTA);
    }

    @Test
    public void testInteriorBinsGetFullWeight () {
        OccupancyIncrement increment = build(fractional, "07:20", "08:50", 1.0);
        assertEquals(14, increment.entryBin);
        assertEquals(17, increment.exitBin);
        assertArrayEquals(new double[] {10.0 / 30, 1, 1, 20.0 / 30}, increment.valuesCopy(), DELTA);
        assertEquals(3.0, increment.sum(), DELTA);

        OccupancyIncrement weighted = build(fractional, "07:20", "08:50", 2.5);
        assertArrayEquals(new double[] {2.5 / 3, 2.5, 2.5, 2.5 * 2 / 3}, weighted.valuesCopy(), DELTA);
    }

    @Test
    public void testExitOnBinBoundary () {
        // The exit bin is the one starting at the exit instant, and it receives nothing.
        OccupancyIncrement increment = build(fractional, "07:20", "08:00", 1.0);
        assertEquals(16, increment.exitBin);
        assertArrayEquals(new double[] {10.0 / 30, 1, 0}, increment.valuesCopy(), DELTA);
    }

    @Test
    public void testWholeBinMode () {
        assertArrayEquals(new double[] {1.0}, build(wholeBin, "07:05", "07:22", 1.0).valuesCopy(), DELTA);
        assertArrayEquals(new double[] {1, 1, 1, 1}, build(wholeBin, "07:20", "08:50", 1.0).valuesCopy(), DELTA);
    }

    @Test
    public void testFractionsStayWithinUnitInterval () {
        LocalDateTime entry = t("00:00");
        for (int minutes = 0; minutes <= 600; minutes += 7) {
            LocalDateTime exit = entry.plusMinutes(minutes).plusSeconds(13);
            OccupancyIncrement increment = fractional.build(entry, exit, 1.0, RecordRelationship.INNER);
            for (int i = 0; i < increment.length(); i++) {
                double v = increment.value(i);
                assertTrue(v >= 0 && v <= 1, "bin value " + v);
            }
            assertEquals((minutes * 60 + 13) / 1800.0, increment.sum(), 1e-9);
            entry = entry.plusMinutes(3);
        }
    }

    @Test
    public void testBuildWithinGrid () {
        // 48 half-hour bins cover 2024-01-01.
        OccupancyIncrement late = fractional.buildWithinGrid(
                t("23:40"), LocalDateTime.parse("9999-12-31T00:00"), 1.0, RecordRelationship.RIGHT, 48);
        assertEquals(47, late.entryBin);
        assertEquals(47, late.exitBin);
        assertTrue(late.rawExitBin > 100_000_000L);
        assertArrayEquals(new double[] {20.0 / 30}, late.valuesCopy(), DELTA);

        OccupancyIncrement early = fractional.buildWithinGrid(
                LocalDateTime.parse("0001-01-01T00:00"), t("00:45"), 2.0, RecordRelationship.LEFT, 48);
        assertEquals(0, early.entryBin);
        assertEquals(1, early.exitBin);
        assertTrue(early.rawEntryBin < -30_000_000L);
        assertArrayEquals(new double[] {2.0, 1.0}, early.valuesCopy(), DELTA);

        // Same values as building over every bin touched and clipping afterward.
        LocalDateTime entry = LocalDateTime.parse("2023-12-31T22:10");
        LocalDateTime exit = LocalDateTime.parse("2024-01-02T01:20");
        OccupancyIncrement clipped = new BoundaryAdjuster(48)
                .clip(fractional.build(entry, exit, 1.0, RecordRelationship.OUTER));
        OccupancyIncrement bounded = fractional.buildWithinGrid(entry, exit, 1.0, RecordRelationship.OUTER, 48);
        assertEquals(clipped.entryBin, bounded.entryBin);
        assertEquals(clipped.exitBin, bounded.exitBin);
        assertEquals(clipped.rawEntryBin, bounded.rawEntryBin);
        assertEquals(clipped.rawExitBin, bounded.rawExitBin);
        assertArrayEquals(clipped.valuesCopy(), bounded.valuesCopy(), DELTA);
    }

    @Test
    public void testStayOffGridRejected () {
        assertThrows(IllegalArgumentException.class, () -> fractional.buildWithinGrid(
                t("01:00"), t("02:00"), 1.0, RecordRelationship.INNER, 2));
    }

    @Test
    public void testInconsistentEntryBinFailsLoudly () {
        // Bin 13 ends at 07:00, before the stay begins, which would give a negative fraction.
        assertThrows(IllegalStateException.class, () -> fractional.entryFraction(t("07:05"), t("07:22"), 13));
        assertThrows(IllegalStateException.class, () -> fractional.exitFraction(t("07:05"), t("07:22"), 15));
    }

    @Test
    public void testBackwardsStayRejected () {
        assertThrows(IllegalArgumentException.class, () -> build(fractional, "08:00", "07:00", 1.0));
    }

}
