package com.conveyal.hills.io;

import com.conveyal.hills.model.HillsException;
import com.conveyal.hills.model.StopRecord;
import com.csvreader.CsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.SignStyle;
import java.util.ArrayList;
import java.util.List;

import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;

/**
 * Reads stop records from a CSV file with a header row. The entry and exit columns are required. Category and weight
 * columns are optional, but if a name is given for them the column must exist. Empty cells give missing timestamps,
 * missing categories or the default weight; any other unreadable cell is an error reporting its line.
 */
public class StopRecordCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(StopRecordCsvReader.class);

    public static final char CSV_DELIMITER = ',';

    /**
     * ISO dates optionally followed by a time of day, separated by T or a space, with optional seconds and fractional
     * seconds: 2024-01-01, 2024-01-01 7:05, 2024-01-01T07:05:30.250
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
                .optionalStart().appendLiteral('T').optionalEnd()
                .optionalStart().appendLiteral(' ').optionalEnd()
                .appendValue(HOUR_OF_DAY, 1, 2, SignStyle.NOT_NEGATIVE)
                .appendLiteral(':')
                .appendValue(MINUTE_OF_HOUR, 2)
                .optionalStart()
                    .appendLiteral(':')
                    .appendValue(SECOND_OF_MINUTE, 2)
                    .optionalStart().appendFraction(NANO_OF_SECOND, 0, 9, true).optionalEnd()
                .optionalEnd()
            .optionalEnd()
            .parseDefaulting(HOUR_OF_DAY, 0)
            .parseDefaulting(MINUTE_OF_HOUR, 0)
            .toFormatter();

    private final String inField;

    private final String outField;

    private final String catField;

    private final String weightField;

    /**
     * @param catField the category column, or null if records are not categorized.
     * @param weightField the occupancy weight column, or null to give every record unit weight.
     */
    public StopRecordCsvReader (String inField, String outField, String catField, String weightField) {
        this.inField = inField;
        this.outField = outField;
        this.catField = catField;
        this.weightField = weightField;
    }

    public List<StopRecord> read (File file) throws IOException {
        LOG.info("Reading stop records from {}", file);
        try (InputStream inputStream = new FileInputStream(file)) {
            return read(inputStream);
        }
    }

    public List<StopRecord> read (InputStream inputStream) throws IOException {
        CsvReader reader = new CsvReader(inputStream, CSV_DELIMITER, StandardCharsets.UTF_8);
        try {
            if (!reader.readHeaders()) {
                throw new HillsException("Stop data CSV is empty.");
            }
            int inCol = requireColumn(reader, inField);
            int outCol = requireColumn(reader, outField);
            int catCol = catField == null ? -1 : requireColumn(reader, catField);
            int weightCol = weightField == null ? -1 : requireColumn(reader, weightField);

            List<StopRecord> records = new ArrayList<>();
            StopRecordReadProgress progress = new StopRecordReadProgress(LOG, 100_000);
            while (reader.readRecord()) {
                // Header is line 1 and getCurrentRecord is zero-based.
                long line = reader.getCurrentRecord() + 2;
                LocalDateTime entry = parseTimestamp(reader.get(inCol), inField, line);
                LocalDateTime exit = parseTimestamp(reader.get(outCol), outField, line);
                String category = catCol < 0 ? null : emptyToNull(reader.get(catCol));
                double weight = weightCol < 0 ? StopRecord.DEFAULT_WEIGHT : parseWeight(reader.get(weightCol), line);
                records.add(new StopRecord(entry, exit, category, weight));
                progress.row(line, entry != null, exit != null);
            }
            progress.done();
            return records;
        } finally {
            reader.close();
        }
    }

    private static int requireColumn (CsvReader reader, String field) throws IOException {
        int col = reader.getIndex(field);
        if (col < 0) {
            throw new HillsException(String.format("%s is not a column in the stop data.", field));
        }
        return col;
    }

    /** Parse a timestamp cell, returning null for an empty cell. */
    public static LocalDateTime parseTimestamp (String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return LocalDateTime.parse(trimmed, TIMESTAMP_FORMAT);
    }

    private static LocalDateTime parseTimestamp (String text, String field, long line) {
        try {
            return parseTimestamp(text);
        } catch (DateTimeParseException e) {
            throw new HillsException(String.format("Cannot read %s timestamp '%s' on line %d.", field, text, line), e);
        }
    }

    private static double parseWeight (String text, long line) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return StopRecord.DEFAULT_WEIGHT;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new HillsException(String.format("Improperly formatted weight '%s' on line %d.", text, line), e);
        }
    }

    private static String emptyToNull (String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

}
