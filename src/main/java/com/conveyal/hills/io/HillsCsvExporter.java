package com.conveyal.hills.io;

import com.conveyal.hills.analysis.HillsResult;
import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.model.Measure;
import com.conveyal.hills.rollup.RollupRow;
import com.conveyal.hills.rollup.RollupTable;
import com.conveyal.hills.summary.ImpliedOperatingHours;
import com.conveyal.hills.summary.StatisticsMode;
import com.conveyal.hills.summary.SummaryRow;
import com.conveyal.hills.summary.SummaryStatistics;
import com.conveyal.hills.summary.SummaryTable;
import com.csvreader.CsvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.FileOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Writes analysis results as CSV files into an output directory, file names prefixed with the scenario name:
 * <pre>
 *   scenario_bydatetime_category.csv           one row per report bin
 *   scenario_bydatetime_highres_category.csv   one row per fine bin, when kept
 *   scenario_measure_mode_category.csv         summary statistics, e.g. scenario_occupancy_nonstationary_total.csv
 *   scenario_los.csv                           length of stay statistics, one row per category
 *   scenario_operating_hours.csv               implied operating hours, one row per category and day
 * </pre>
 * Floating point values are written with six decimal places, undefined values as empty cells.
 */
public class HillsCsvExporter {

    private static final Logger LOG = LoggerFactory.getLogger(HillsCsvExporter.class);

    public static final char CSV_DELIMITER = ',';

    public static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static final String[] BYDATETIME_COLUMNS = {
            "datetime", "arrivals", "departures", "occupancy", "day_of_week", "dow_name", "bin_of_day", "bin_of_week"
    };

    private final File outputDirectory;

    private final String scenarioName;

    public HillsCsvExporter (File outputDirectory, String scenarioName) {
        checkArgument(scenarioName != null && !scenarioName.isEmpty(), "Scenario name is required.");
        this.outputDirectory = outputDirectory;
        this.scenarioName = scenarioName;
    }

    /** Write every table in the result. Returns the files written. */
    public List<File> exportAll (HillsResult result) throws IOException {
        if (!outputDirectory.isDirectory() && !outputDirectory.mkdirs()) {
            throw new IOException("Could not create output directory " + outputDirectory);
        }
        List<File> files = new ArrayList<>();
        for (RollupTable table : result.byDatetime.values()) {
            files.add(exportByDatetime(table, "bydatetime"));
        }
        for (RollupTable table : result.highResolution.values()) {
            files.add(exportByDatetime(table, "bydatetime_highres"));
        }
        for (Map<CategoryKey, Map<Measure, SummaryTable>> byCategory : result.summaries.values()) {
            for (Map<Measure, SummaryTable> byMeasure : byCategory.values()) {
                for (SummaryTable table : byMeasure.values()) {
                    files.add(exportSummary(table));
                }
            }
        }
        files.add(exportLengthOfStay(result.lengthOfStay, result.parameters.percentiles));
        Map<CategoryKey, Map<Measure, SummaryTable>> nonstationary = result.summaries.get(StatisticsMode.NONSTATIONARY);
        if (nonstationary != null) {
            List<ImpliedOperatingHours> hours = new ArrayList<>();
            for (CategoryKey category : nonstationary.keySet()) {
                hours.add(result.operatingHours(category));
            }
            files.add(exportOperatingHours(hours));
        }
        LOG.info("Wrote {} CSV files to {}", files.size(), outputDirectory);
        return files;
    }

    public File exportByDatetime (RollupTable table, String stub) throws IOException {
        File file = file(String.format("%s_%s_%s.csv", scenarioName, stub, fileSafe(table.category)));
        CsvWriter writer = open(file);
        try {
            writer.writeRecord(BYDATETIME_COLUMNS);
            for (RollupRow row : table.rows()) {
                writer.writeRecord(new String[] {
                        row.datetime.format(DATETIME_FORMAT),
                        formatDouble(row.arrivals),
                        formatDouble(row.departures),
                        formatDouble(row.occupancy),
                        Integer.toString(row.dayOfWeek),
                        row.dowName,
                        Integer.toString(row.binOfDay),
                        Integer.toString(row.binOfWeek)
                });
            }
        } finally {
            writer.close();
        }
        return file;
    }

    public File exportSummary (SummaryTable table) throws IOException {
        File file = file(String.format("%s_%s_%s_%s.csv", scenarioName, table.measure.columnName,
                table.mode.label(), fileSafe(table.category)));
        boolean nonstationary = table.mode == StatisticsMode.NONSTATIONARY;
        List<String> header = new ArrayList<>();
        header.add("category");
        if (nonstationary) {
            header.add("day_of_week");
            header.add("dow_name");
            header.add("bin_of_day");
            header.add("bin_of_day_str");
        }
        header.addAll(table.columns);
        CsvWriter writer = open(file);
        try {
            writer.writeRecord(header.toArray(new String[0]));
            for (SummaryRow row : table.rows()) {
                List<String> values = new ArrayList<>(header.size());
                values.add(row.key.category.name);
                if (nonstationary) {
                    values.add(Integer.toString(row.key.dayOfWeek));
                    values.add(row.key.dowName);
                    values.add(Integer.toString(row.key.binOfDay));
                    values.add(row.key.binOfDayStr);
                }
                addStatistics(values, row.statistics, table.columns);
                writer.writeRecord(values.toArray(new String[0]));
            }
        } finally {
            writer.close();
        }
        return file;
    }

    public File exportLengthOfStay (Map<CategoryKey, SummaryStatistics> lengthOfStay, List<Double> percentiles)
            throws IOException {
        File file = file(scenarioName + "_los.csv");
        List<String> columns = SummaryStatistics.columns(percentiles);
        CsvWriter writer = open(file);
        try {
            List<String> header = new ArrayList<>();
            header.add("category");
            header.addAll(columns);
            writer.writeRecord(header.toArray(new String[0]));
            for (Map.Entry<CategoryKey, SummaryStatistics> entry : lengthOfStay.entrySet()) {
                List<String> values = new ArrayList<>();
                values.add(entry.getKey().name);
                addStatistics(values, entry.getValue(), columns);
                writer.writeRecord(values.toArray(new String[0]));
            }
        } finally {
            writer.close();
        }
        return file;
    }

    public File exportOperatingHours (List<ImpliedOperatingHours> hours) throws IOException {
        File file = file(scenarioName + "_operating_hours.csv");
        CsvWriter writer = open(file);
        try {
            writer.writeRecord(new String[] {"category", "day_of_week", "dow_name", "open", "opens", "closes"});
            for (ImpliedOperatingHours categoryHours : hours) {
                for (ImpliedOperatingHours.Day day : categoryHours.days) {
                    writer.writeRecord(new String[] {
                            categoryHours.category.name,
                            Integer.toString(day.dayOfWeek),
                            day.dowName,
                            Boolean.toString(day.open),
                            day.open ? day.opens : "",
                            day.open ? day.closes : ""
                    });
                }
            }
        } finally {
            writer.close();
        }
        return file;
    }

    private static void addStatistics (List<String> values, SummaryStatistics statistics, List<String> columns) {
        for (String column : columns) {
            if (column.equals("count")) {
                values.add(Long.toString(statistics.count));
            } else {
                values.add(formatDouble(statistics.get(column)));
            }
        }
    }

    public static String formatDouble (double value) {
        if (Double.isNaN(value)) {
            return "";
        }
        return String.format(Locale.ROOT, "%.6f", value);
    }

    /** Category names come from the data, so anything unusual is replaced in file names. */
    static String fileSafe (CategoryKey category) {
        return category.name.replaceAll("[^A-Za-z0-9_.-]", "_");
    }

    private File file (String name) {
        return new File(outputDirectory, name);
    }

    private static CsvWriter open (File file) throws IOException {
        BufferedWriter bufferedWriter = new BufferedWriter(
                new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8));
        return new CsvWriter(bufferedWriter, CSV_DELIMITER);
    }

}
