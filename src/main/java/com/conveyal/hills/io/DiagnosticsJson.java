package com.conveyal.hills.io;

import com.conveyal.hills.analysis.AnalysisDiagnostics;
import com.conveyal.hills.analysis.HillsResult;
import com.conveyal.hills.model.CategoryKey;
import com.conveyal.hills.summary.SummaryStatistics;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.File;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Static methods for writing the diagnostics of an analysis run as JSON, for inspection after a command line run.
 */
public abstract class DiagnosticsJson {

    public static final ObjectMapper objectMapper = createObjectMapper();

    private static ObjectMapper createObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(LocalDateTimeSerializer.makeModule());
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        return objectMapper;
    }

    /** The JSON document: run identification, diagnostics and length of stay statistics. */
    public static class Report {
        public final String scenario;
        public final LocalDateTime start;
        public final LocalDateTime end;
        public final int reportBinMinutes;
        public final int fineBinMinutes;
        public final AnalysisDiagnostics diagnostics;
        public final Map<CategoryKey, SummaryStatistics> lengthOfStay;

        Report (HillsResult result) {
            this.scenario = result.parameters.scenarioName;
            this.start = result.parameters.window.start;
            this.end = result.parameters.window.end;
            this.reportBinMinutes = result.parameters.reportBinMinutes;
            this.fineBinMinutes = result.parameters.effectiveFineBinMinutes();
            this.diagnostics = result.diagnostics;
            this.lengthOfStay = result.lengthOfStay;
        }
    }

    public static String toJson (HillsResult result) {
        try {
            return objectMapper.writeValueAsString(new Report(result));
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    public static void write (HillsResult result, File file) throws IOException {
        objectMapper.writeValue(file, new Report(result));
    }

    /** Serialize LocalDateTimes as ISO strings without requiring the jsr310 module. */
    public static class LocalDateTimeSerializer extends JsonSerializer<LocalDateTime> {

        public static SimpleModule makeModule () {
            Version moduleVersion = new Version(1, 0, 0, null, null, null);
            SimpleModule module = new SimpleModule("LocalDateTime", moduleVersion);
            module.addSerializer(LocalDateTime.class, new LocalDateTimeSerializer());
            return module;
        }

        @Override
        public void serialize (LocalDateTime value, JsonGenerator jsonGenerator, SerializerProvider provider)
                throws IOException {
            jsonGenerator.writeString(value.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        }

    }

}
