package com.conveyal.hills;

import ch.qos.logback.classic.Level;
import com.conveyal.hills.analysis.HillsAnalysis;
import com.conveyal.hills.analysis.HillsResult;
import com.conveyal.hills.io.DiagnosticsJson;
import com.conveyal.hills.io.HillsCsvExporter;
import com.conveyal.hills.model.StopRecord;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Command line entry point: reads stop data from CSV, runs the analysis and writes the result tables and diagnostics
 * into the output directory. Options may be given on the command line, in a properties file named with --config, or
 * both, in which case the command line wins.
 */
public class HillsMain {

    private static final Logger LOG = LoggerFactory.getLogger(HillsMain.class);

    private static final String CONFIG_OPT = "config";
    private static final String VERBOSE_OPT = "v";
    private static final String HELP_OPT = "h";

    public static void main (String[] args) {
        System.exit(run(args));
    }

    /** Run with the given arguments, returning the process exit code. */
    public static int run (String[] args) {
        Options options = options();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printHelp(options);
            return 2;
        }
        if (cmd.hasOption(HELP_OPT)) {
            printHelp(options);
            return 0;
        }
        int verbosity;
        try {
            verbosity = Integer.parseInt(cmd.getOptionValue(VERBOSE_OPT, "1"));
        } catch (NumberFormatException e) {
            System.err.println("Verbosity must be an integer, not " + cmd.getOptionValue(VERBOSE_OPT));
            printHelp(options);
            return 2;
        }
        setVerbosity(verbosity);
        try {
            HillsConfig config = new HillsConfig(properties(cmd, options));
            HillsResult result = run(config);
            for (String warning : result.diagnostics.getWarnings()) {
                System.err.println("WARNING: " + warning);
            }
            return 0;
        } catch (Exception e) {
            LOG.debug("Analysis failed", e);
            System.err.println("Analysis failed: " + causeChain(e));
            return 1;
        }
    }

    static HillsResult run (HillsConfig config) throws Exception {
        List<StopRecord> records = config.csvReader().read(config.stopDataCsv);
        HillsResult result = new HillsAnalysis(config.toParameters()).run(records);
        HillsCsvExporter exporter = new HillsCsvExporter(config.outputPath, config.scenarioName);
        exporter.exportAll(result);
        File diagnosticsFile = new File(config.outputPath, config.scenarioName + "_diagnostics.json");
        DiagnosticsJson.write(result, diagnosticsFile);
        LOG.info("Wrote diagnostics to {}", diagnosticsFile);
        return result;
    }

    /**
     * Every option except help, verbosity and the config file itself corresponds to a configuration property with the
     * same name as its long form.
     */
    static Options options () {
        Options options = new Options();
        options.addOption(valued("s", "scenario-name", "Scenario name used as output file prefix."));
        options.addOption(valued("f", "stop-data-csv", "CSV file of stop records."));
        options.addOption(valued(null, "in-field", "Column holding entry timestamps."));
        options.addOption(valued(null, "out-field", "Column holding exit timestamps."));
        options.addOption(valued(null, "start-date", "First day of the analysis, yyyy-MM-dd."));
        options.addOption(valued(null, "end-date", "Last day of the analysis, yyyy-MM-dd, included."));
        options.addOption(valued("c", "cat-field", "Column holding categories. (Optional)"));
        options.addOption(valued("w", "weight-field", "Column holding occupancy weights. (Optional)"));
        options.addOption(valued("b", "report-bin-minutes", "Report bin size in minutes, dividing 1440. Default 60."));
        options.addOption(valued(null, "highres-bin-minutes", "Fine bin size in minutes. Default 5."));
        options.addOption(valued("e", "edge-bins", "fractional (1) or whole_bin (2). Default fractional."));
        options.addOption(valued("p", "percentiles", "Comma separated percentiles in [0, 1]."));
        options.addOption(valued("x", "cats-to-exclude", "Comma separated categories to leave out."));
        options.addOption(valued(null, "totals", "true or false: compute the total over categories. Default true."));
        options.addOption(valued(null, "los-units", "Length of stay units: days, hours, minutes, seconds."));
        options.addOption(valued("o", "output-path", "Directory for output files. Default current directory."));
        options.addOption(valued("t", "threads", "Worker threads for per-category accumulation. Default 1."));
        options.addOption(null, "keep-highres", false, "Also write the fine resolution by-datetime tables.");
        options.addOption(null, "adjust-censored-departures", false,
                "Give records without an exit time an exit at the end of the analysis.");
        options.addOption(valued(null, CONFIG_OPT, "Properties file with any of the options above."));
        options.addOption(valued(VERBOSE_OPT, "verbose", "0 = warnings, 1 = info (default), 2 = debug."));
        options.addOption(HELP_OPT, "help", false, "Print all command line options, then exit.");
        return options;
    }

    private static Option valued (String shortName, String longName, String description) {
        return Option.builder(shortName).longOpt(longName).hasArg().desc(description).build();
    }

    /** Properties from the config file if any, overridden by options given on the command line. */
    static Properties properties (CommandLine cmd, Options options) {
        Properties properties = new Properties();
        if (cmd.hasOption(CONFIG_OPT)) {
            properties.putAll(ConfigBase.propsFromFile(cmd.getOptionValue(CONFIG_OPT)));
        }
        for (Option option : cmd.getOptions()) {
            String key = option.getLongOpt();
            if (key == null || key.equals(CONFIG_OPT) || key.equals("verbose") || key.equals("help")) {
                continue;
            }
            properties.setProperty(key, option.hasArg() ? option.getValue() : "true");
        }
        return properties;
    }

    /**
     * One line summary of a failure and its causes, root cause first, e.g.
     * "IOException: disk full, caused HillsException: Cannot write output."
     */
    static String causeChain (Throwable throwable) {
        List<String> items = new ArrayList<>();
        Set<Throwable> seen = new HashSet<>();
        while (throwable != null && seen.add(throwable)) {
            String item = throwable.getClass().getSimpleName();
            if (throwable.getMessage() != null) {
                item += ": " + throwable.getMessage();
            }
            items.add(item);
            throwable = throwable.getCause();
        }
        Collections.reverse(items);
        return String.join(", caused ", items);
    }

    static void setVerbosity (int verbosity) {
        Level level = verbosity <= 0 ? Level.WARN : verbosity == 1 ? Level.INFO : Level.DEBUG;
        ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(level);
    }

    private static void printHelp (Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("occupancy-hills [options]", options);
    }

}
