package com.conveyal.hills;

import com.conveyal.hills.analysis.AnalysisParameters;
import com.conveyal.hills.model.EdgeBinMode;
import com.conveyal.hills.model.HillsException;
import com.conveyal.hills.model.LengthOfStayUnit;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HillsConfigTest {

    @TempDir
    File tempDir;

    private static Properties required () {
        Properties properties = new Properties();
        properties.setProperty("stop-data-csv", "stops.csv");
        properties.setProperty("in-field", "InRoomTS");
        properties.setProperty("out-field", "OutRoomTS");
        properties.setProperty("start-date", "2024-01-01");
        properties.setProperty("end-date", "2024-03-31");
        return properties;
    }

    private static HillsConfig config (Properties properties) {
        return new HillsConfig(properties, Collections.emptyMap(), Collections.emptyMap());
    }

    @Test
    public void testDefaults () {
        HillsConfig config = config(required());
        assertEquals(new File("stops.csv"), config.stopDataCsv);
        assertEquals("InRoomTS", config.inField);
        assertNull(config.catField);
        assertNull(config.weightField);
        assertEquals(LocalDate.of(2024, 1, 1), config.startDate);
        assertEquals("scenario", config.scenarioName);
        assertEquals(60, config.reportBinMinutes);
        assertEquals(5, config.highresBinMinutes);
        assertEquals(EdgeBinMode.FRACTIONAL, config.edgeBins);
        assertFalse(config.keepHighResolution);
        assertEquals(AnalysisParameters.DEFAULT_PERCENTILES, config.percentiles);
        assertTrue(config.catsToExclude.isEmpty());
        assertTrue(config.totals);
        assertEquals(LengthOfStayUnit.HOURS, config.losUnits);
        assertEquals(new File("."), config.outputPath);
        assertEquals(1, config.threads);

        AnalysisParameters parameters = config.toParameters();
        assertEquals(LocalDate.of(2024, 3, 31), parameters.window.end.toLocalDate());
        assertEquals(91 * 24, parameters.window.binCount(60));
    }

    @Test
    public void testParsedValues () {
        Properties properties = required();
        properties.setProperty("cat-field", "PatType");
        properties.setProperty("scenario-name", "ssu_2024");
        properties.setProperty("report-bin-minutes", "30");
        properties.setProperty("highres-bin-minutes", "10");
        properties.setProperty("edge-bins", "2");
        properties.setProperty("keep-highres", "yes");
        properties.setProperty("adjust-censored-departures", "true");
        properties.setProperty("percentiles", "0.5, 0.9");
        properties.setProperty("cats-to-exclude", "ART, CAT,");
        properties.setProperty("totals", "false");
        properties.setProperty("los-units", "min");
        properties.setProperty("output-path", "out");
        HillsConfig config = config(properties);
        assertEquals("PatType", config.catField);
        assertEquals(EdgeBinMode.WHOLE_BIN, config.edgeBins);
        assertTrue(config.keepHighResolution);
        assertTrue(config.adjustCensoredDepartures);
        assertEquals(Arrays.asList(0.5, 0.9), config.percentiles);
        assertEquals(Arrays.asList("ART", "CAT"), config.catsToExclude);
        assertFalse(config.totals);
        assertEquals(LengthOfStayUnit.MINUTES, config.losUnits);

        AnalysisParameters parameters = config.toParameters();
        assertEquals("ssu_2024", parameters.scenarioName);
        assertEquals(10, parameters.effectiveFineBinMinutes());
        assertTrue(parameters.categoriesToExclude.contains("CAT"));
    }

    @Test
    public void testEnvironmentAndSystemPropertyOverrides () {
        HillsConfig config = new HillsConfig(required(),
                ImmutableMap.of("HILLS_REPORT_BIN_MINUTES", "30", "HILLS_THREADS", "2", "PATH", "/usr/bin"),
                ImmutableMap.of("hills.threads", "4"));
        assertEquals(30, config.reportBinMinutes);
        assertEquals(4, config.threads);
    }

    @Test
    public void testAllErrorsReportedTogether () {
        Properties properties = required();
        properties.remove("in-field");
        properties.setProperty("threads", "many");
        properties.setProperty("edge-bins", "sometimes");
        properties.setProperty("end-date", "2024-13-01");
        properties.setProperty("totals", "maybe");
        HillsException e = assertThrows(HillsException.class, () -> config(properties));
        assertEquals("Missing or invalid configuration properties: edge-bins, end-date, in-field, threads, totals",
                e.getMessage());
    }

    @Test
    public void testInconsistentValuesFailOnConversion () {
        Properties properties = required();
        properties.setProperty("report-bin-minutes", "50");
        HillsConfig config = config(properties);
        assertThrows(HillsException.class, config::toParameters);
    }

    @Test
    public void testFromFile () throws IOException {
        File file = new File(tempDir, "hills.properties");
        try (Writer writer = new FileWriter(file)) {
            required().store(writer, null);
        }
        Properties loaded = ConfigBase.propsFromFile(file.getPath());
        assertEquals("OutRoomTS", loaded.getProperty("out-field"));
        assertThrows(HillsException.class, () -> ConfigBase.propsFromFile(new File(tempDir, "none").getPath()));
    }

}
