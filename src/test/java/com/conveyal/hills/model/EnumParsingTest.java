package com.conveyal.hills.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class EnumParsingTest {

    @Test
    public void testEdgeBinMode () {
        assertEquals(EdgeBinMode.FRACTIONAL, EdgeBinMode.parse("1"));
        assertEquals(EdgeBinMode.FRACTIONAL, EdgeBinMode.parse(" Fractional "));
        assertEquals(EdgeBinMode.WHOLE_BIN, EdgeBinMode.parse("2"));
        assertEquals(EdgeBinMode.WHOLE_BIN, EdgeBinMode.parse("whole-bin"));
        assertEquals(EdgeBinMode.WHOLE_BIN, EdgeBinMode.parse("entire"));
        assertThrows(HillsException.class, () -> EdgeBinMode.parse("3"));
    }

    @Test
    public void testLengthOfStayUnit () {
        assertEquals(LengthOfStayUnit.HOURS, LengthOfStayUnit.parse("hr"));
        assertEquals(LengthOfStayUnit.MINUTES, LengthOfStayUnit.parse("m"));
        assertEquals(LengthOfStayUnit.DAYS, LengthOfStayUnit.parse("Days"));
        assertThrows(HillsException.class, () -> LengthOfStayUnit.parse("fortnights"));
        assertEquals(1.5, LengthOfStayUnit.HOURS.convert(Duration.ofMinutes(90)), 1e-12);
        assertEquals(0.25, LengthOfStayUnit.DAYS.convert(Duration.ofHours(6)), 1e-12);
        assertEquals(90.5, LengthOfStayUnit.SECONDS.convert(Duration.ofMillis(90_500)), 1e-12);
    }

}
