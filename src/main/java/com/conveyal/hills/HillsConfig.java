package com.conveyal.hills;

import com.conveyal.hills.analysis.AnalysisParameters;
import com.conveyal.hills.io.StopRecordCsvReader;
import com.conveyal.hills.model.EdgeBinMode;
import com.conveyal.hills.model.HillsException;
import com.conveyal.hills.model.LengthOfStayUnit;

import java.io.File;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration of a command line analysis run, loaded from properties. The stop data file, its entry and exit
 * columns and the analysis dates are required; everything else falls back to the analysis defaults.
 */
public class HillsConfig extends ConfigBase {

    public final File stopDataCsv;
    public final String inField;
    public final String outField;
    public final String catField;
    public final String weightField;
    public final LocalDate startDate;
    public final LocalDate endDate;
    public final String scenarioName;
    public final int reportBinMinutes;
    public final int highresBinMinutes;
    public final EdgeBinMode edgeBins;
    public final boolean keepHighResolution;
    public final boolean adjustCensoredDepartures;
    public final List<Double> percentiles;
    public final List<String> catsToExclude;
    public final boolean totals;
    public final LengthOfStayUnit losUnits;
    public final File outputPath;
    public final int threads;

    public HillsConfig (Properties properties) {
        this(properties, System.getenv(), System.getProperties());
    }

    HillsConfig (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        super(properties, environment, systemProperties);
        String csv = strProp("stop-data-csv");
        stopDataCsv = csv == null ? null : new File(csv);
        inField = strProp("in-field");
        outField = strProp("out-field");
        catField = optStrProp("cat-field");
        weightField = optStrProp("weight-field");
        startDate = dateProp("start-date");
        endDate = dateProp("end-date");
        scenarioName = optStrProp("scenario-name") == null ? "scenario" : optStrProp("scenario-name");
        reportBinMinutes = intProp("report-bin-minutes", 60);
        highresBinMinutes = intProp("highres-bin-minutes", 5);
        edgeBins = enumProp("edge-bins", EdgeBinMode.FRACTIONAL);
        keepHighResolution = boolProp("keep-highres", false);
        adjustCensoredDepartures = boolProp("adjust-censored-departures", false);
        percentiles = doubleListProp("percentiles", AnalysisParameters.DEFAULT_PERCENTILES);
        catsToExclude = listProp("cats-to-exclude");
        totals = boolProp("totals", true);
        losUnits = losProp("los-units", LengthOfStayUnit.HOURS);
        outputPath = new File(optStrProp("output-path") == null ? "." : optStrProp("output-path"));
        threads = intProp("threads", 1);
        throwIfErrors();
    }

    /** @throws HillsException if the configured values are inconsistent. */
    public AnalysisParameters toParameters () {
        return AnalysisParameters.builder()
                .scenarioName(scenarioName)
                .dates(startDate, endDate)
                .reportBinMinutes(reportBinMinutes)
                .highresBinMinutes(highresBinMinutes)
                .edgeBinMode(edgeBins)
                .keepHighResolution(keepHighResolution)
                .adjustCensoredDepartures(adjustCensoredDepartures)
                .percentiles(percentiles)
                .categoriesToExclude(catsToExclude)
                .totals(totals)
                .losUnit(losUnits)
                .threads(threads)
                .build();
    }

    public StopRecordCsvReader csvReader () {
        return new StopRecordCsvReader(inField, outField, catField, weightField);
    }

    private LocalDate dateProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return LocalDate.parse(val);
            } catch (DateTimeParseException e) {
                recordError(key, "not a yyyy-MM-dd date: " + val);
            }
        }
        return null;
    }

    private EdgeBinMode enumProp (String key, EdgeBinMode defaultValue) {
        String val = optStrProp(key);
        if (val != null) {
            try {
                return EdgeBinMode.parse(val);
            } catch (HillsException e) {
                recordError(key, e.getMessage());
            }
        }
        return defaultValue;
    }

    private LengthOfStayUnit losProp (String key, LengthOfStayUnit defaultValue) {
        String val = optStrProp(key);
        if (val != null) {
            try {
                return LengthOfStayUnit.parse(val);
            } catch (HillsException e) {
                recordError(key, e.getMessage());
            }
        }
        return defaultValue;
    }

}
