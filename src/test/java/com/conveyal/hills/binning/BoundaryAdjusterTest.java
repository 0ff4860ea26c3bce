package com.conveyal.hills.binning;

import com.conveyal.hills.model.EdgeBinMode;
import com.conveyal.hills.model.RecordRelationship;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static com.conveyal.hills.model.RecordRelationship.BACKWARDS;
import static com.conveyal.hills.model.RecordRelationship.INNER;
import static com.conveyal.hills.model.RecordRelationship.LEFT;
import static com.conveyal.hills.model.RecordRelationship.NONE;
import static com.conveyal.hills.model.RecordRelationship.OUTER;
import static com.conveyal.hills.model.RecordRelationship.RIGHT;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BoundaryAdjusterTest {

    private static final double DELTA = 1e-12;

    private static final LocalDateTime ORIGIN = LocalDateTime.parse("2024-01-01T00:00");

    /** 48 half-hour bins covering 2024-01-01. */
    private final BoundaryAdjuster adjuster = new BoundaryAdjuster(48);

    private final OccupancyIncrementBuilder builder = new OccupancyIncrementBuilder(ORIGIN, 30, EdgeBinMode.FRACTIONAL);

    private OccupancyIncrement build (String entry, String exit, RecordRelationship relationship) {
        return builder.build(LocalDateTime.parse(entry), LocalDateTime.parse(exit), 1.0, relationship);
    }

    @Test
    public void testInnerUnchanged () {
        OccupancyIncrement increment = build("2024-01-01T07:20", "2024-01-01T08:50", INNER);
        assertSame(increment, adjuster.clip(increment));
    }

    @Test
    public void testLeftDropsTimeBeforeWindow () {
        OccupancyIncrement raw = build("2023-12-31T23:00", "2024-01-01T01:15", LEFT);
        assertEquals(-2, raw.entryBin);
        assertArrayEquals(new double[] {1, 1, 1, 1, 0.5}, raw.valuesCopy(), DELTA);

        OccupancyIncrement clipped = adjuster.clip(raw);
        assertEquals(0, clipped.entryBin);
        assertEquals(2, clipped.exitBin);
        assertEquals(-2, clipped.rawEntryBin);
        assertArrayEquals(new double[] {1, 1, 0.5}, clipped.valuesCopy(), DELTA);
    }

    @Test
    public void testRightDropsTimeAfterGrid () {
        OccupancyIncrement raw = build("2024-01-01T23:00", "2024-01-02T01:00", RIGHT);
        assertEquals(46, raw.entryBin);
        assertEquals(50, raw.exitBin);

        OccupancyIncrement clipped = adjuster.clip(raw);
        assertEquals(46, clipped.entryBin);
        assertEquals(47, clipped.exitBin);
        assertEquals(50, clipped.rawExitBin);
        assertArrayEquals(new double[] {1, 1}, clipped.valuesCopy(), DELTA);
    }

    @Test
    public void testOuterClipsBothEnds () {
        OccupancyIncrement clipped = adjuster.clip(build("2023-12-31T12:10", "2024-01-02T06:45", OUTER));
        assertEquals(0, clipped.entryBin);
        assertEquals(47, clipped.exitBin);
        assertEquals(48, clipped.length());
        assertEquals(48.0, clipped.sum(), DELTA);
    }

    @Test
    public void testOnlyAccumulatedTypesAreClipped () {
        OccupancyIncrement backwards = new OccupancyIncrement(BACKWARDS, 3, 3, 3, 3, new double[] {0});
        assertThrows(IllegalArgumentException.class, () -> adjuster.clip(backwards));
    }

    @Test
    public void testRelationshipCounts () {
        adjuster.count(INNER);
        adjuster.count(INNER);
        adjuster.count(LEFT);
        adjuster.count(NONE);
        adjuster.count(BACKWARDS);
        assertEquals(2, adjuster.countOf(INNER));
        assertEquals(1, adjuster.countOf(NONE));
        assertEquals(0, adjuster.countOf(OUTER));
        assertEquals(4, adjuster.relationshipCounts().size());
        assertFalse(adjuster.relationshipCounts().containsKey(RIGHT));
    }

}
