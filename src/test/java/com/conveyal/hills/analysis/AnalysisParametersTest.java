package com.conveyal.hills.analysis;

import com.conveyal.hills.model.EdgeBinMode;
import com.conveyal.hills.model.HillsException;
import com.conveyal.hills.model.LengthOfStayUnit;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AnalysisParametersTest {

    private static AnalysisParameters.Builder valid () {
        return AnalysisParameters.builder().dates(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7));
    }

    @Test
    public void testDefaults () {
        AnalysisParameters parameters = valid().build();
        assertEquals(60, parameters.reportBinMinutes);
        assertEquals(5, parameters.highresBinMinutes);
        assertEquals(EdgeBinMode.FRACTIONAL, parameters.edgeBinMode);
        assertEquals(AnalysisParameters.DEFAULT_PERCENTILES, parameters.percentiles);
        assertEquals(LengthOfStayUnit.HOURS, parameters.losUnit);
        assertTrue(parameters.totals);
        assertTrue(parameters.nonstationary);
        assertTrue(parameters.stationary);
        assertFalse(parameters.keepHighResolution);
        assertFalse(parameters.adjustCensoredDepartures);
        assertEquals(1, parameters.threads);
        assertEquals(LocalDateTime.parse("2024-01-01T00:00"), parameters.window.start);
        assertEquals(LocalDateTime.parse("2024-01-07T23:59:59"), parameters.window.end);
    }

    @Test
    public void testSingleDayWindow () {
        AnalysisParameters parameters =
                AnalysisParameters.builder().dates(LocalDate.of(2024, 3, 5), LocalDate.of(2024, 3, 5)).build();
        assertEquals(24, parameters.window.binCount(60));
    }

    @Test
    public void testEffectiveFineBin () {
        assertEquals(60, valid().build().effectiveFineBinMinutes());
        assertEquals(5, valid().keepHighResolution(true).build().effectiveFineBinMinutes());
        assertEquals(5, valid().edgeBinMode(EdgeBinMode.WHOLE_BIN).build().effectiveFineBinMinutes());
        assertEquals(15, valid().reportBinMinutes(30).highresBinMinutes(15).edgeBinMode(EdgeBinMode.WHOLE_BIN)
                .build().effectiveFineBinMinutes());
    }

    @Test
    public void testValidationErrors () {
        assertThrows(HillsException.class, () -> AnalysisParameters.builder().build());
        assertThrows(HillsException.class,
                () -> AnalysisParameters.builder().dates(LocalDate.of(2024, 1, 7), LocalDate.of(2024, 1, 1)).build());
        assertThrows(HillsException.class,
                () -> AnalysisParameters.builder().dates(LocalDate.of(2024, 1, 7), null).build());
        assertThrows(HillsException.class, () -> valid().reportBinMinutes(0).build());
        assertThrows(HillsException.class, () -> valid().highresBinMinutes(-5).build());
        assertThrows(HillsException.class, () -> valid().reportBinMinutes(7).highresBinMinutes(1).build());
        assertThrows(HillsException.class, () -> valid().highresBinMinutes(90).build());
        assertThrows(HillsException.class, () -> valid().highresBinMinutes(25).build());
        assertThrows(HillsException.class, () -> valid().percentiles(Arrays.asList(0.5, 1.5)).build());
        assertThrows(HillsException.class, () -> valid().percentiles(Arrays.asList(0.5, null)).build());
        assertThrows(HillsException.class, () -> valid().threads(0).build());
        assertThrows(HillsException.class, () -> valid().losUnit(null).build());
        assertThrows(HillsException.class, () -> valid().categoriesToExclude(null).build());
    }

    @Test
    public void testExplicitWindow () {
        AnalysisParameters parameters = AnalysisParameters.builder()
                .window(LocalDateTime.parse("2024-01-01T06:00"), LocalDateTime.parse("2024-01-01T18:00"))
                .reportBinMinutes(30)
                .highresBinMinutes(10)
                .build();
        assertEquals(LocalDateTime.parse("2024-01-01T18:00"), parameters.window.end);
        assertEquals(30, parameters.effectiveFineBinMinutes());
    }

    @Test
    public void testToBuilderCopiesEverything () {
        AnalysisParameters original = valid()
                .scenarioName("ward")
                .reportBinMinutes(30)
                .highresBinMinutes(10)
                .edgeBinMode(EdgeBinMode.WHOLE_BIN)
                .keepHighResolution(true)
                .adjustCensoredDepartures(true)
                .categoriesToExclude(Collections.singleton("ART"))
                .percentiles(Collections.singletonList(0.9))
                .totals(false)
                .stationary(false)
                .losUnit(LengthOfStayUnit.MINUTES)
                .threads(3)
                .build();
        AnalysisParameters copy = original.toBuilder().build();
        assertEquals(original.toString(), copy.toString());
        assertEquals(original.categoriesToExclude, copy.categoriesToExclude);
        assertEquals(original.window.start, copy.window.start);
        assertEquals(original.window.end, copy.window.end);
        assertEquals(LengthOfStayUnit.MINUTES, copy.losUnit);
        assertTrue(copy.adjustCensoredDepartures);
        assertFalse(copy.stationary);
        assertEquals(3, copy.threads);
    }

}
