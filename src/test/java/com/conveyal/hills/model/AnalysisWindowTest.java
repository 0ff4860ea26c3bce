package com.conveyal.hills.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AnalysisWindowTest {

    @Test
    public void testWholeDaysGiveWholeDaysOfBins () {
        AnalysisWindow week = AnalysisWindow.ofDates(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7));
        assertEquals(LocalDateTime.parse("2024-01-07T23:59:59"), week.end);
        assertEquals(7 * 24, week.binCount(60));
        assertEquals(7 * 48, week.binCount(30));
        assertEquals(7 * 288, week.binCount(5));
        assertEquals(LocalDateTime.parse("2024-01-08T00:00"), week.gridEnd(30));
    }

    @Test
    public void testBinCountOfExplicitWindow () {
        // An end exactly on a boundary starts one more bin.
        AnalysisWindow window = new AnalysisWindow(
                LocalDateTime.parse("2024-01-01T00:00"), LocalDateTime.parse("2024-01-02T00:00"));
        assertEquals(49, window.binCount(30));
        assertEquals(LocalDateTime.parse("2024-01-02T00:30"), window.gridEnd(30));
    }

    @Test
    public void testClosedOpen () {
        AnalysisWindow window = new AnalysisWindow(
                LocalDateTime.parse("2024-01-01T00:00"), LocalDateTime.parse("2024-01-02T00:00"));
        assertTrue(window.contains(window.start));
        assertTrue(window.contains(LocalDateTime.parse("2024-01-01T23:59:59.999")));
        assertFalse(window.contains(window.end));
        assertFalse(window.contains(LocalDateTime.parse("2023-12-31T23:59:59")));
    }

    @Test
    public void testEndMustFollowStart () {
        LocalDateTime t = LocalDateTime.parse("2024-01-01T00:00");
        assertThrows(HillsException.class, () -> new AnalysisWindow(t, t));
        assertThrows(HillsException.class, () -> new AnalysisWindow(t, t.minusDays(1)));
        assertThrows(HillsException.class, () -> new AnalysisWindow(null, t));
    }

}
