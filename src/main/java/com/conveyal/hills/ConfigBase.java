package com.conveyal.hills;

import com.conveyal.hills.model.HillsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load configuration from properties. Values from a properties file can be
 * overridden by environment variables and system properties carrying the "hills" prefix.
 *
 * Every problem found while reading (a missing required key, an unparseable value) is recorded rather than thrown, so
 * that all of them can be reported together once reading is finished.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String HILLS_PROPERTY_PREFIX = "hills-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators, and must be prefixed with "hills", e.g. HILLS_REPORT_BIN_MINUTES=30 or -Dhills.threads=4.
     * Precedence of configuration sources is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this(properties, System.getenv(), System.getProperties());
    }

    protected ConfigBase (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
        setPropertiesFromMap(environment, "environment variable");
        setPropertiesFromMap(systemProperties, "system properties");
    }

    /** Static convenience method to uniformly load files into properties and report errors. */
    public static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new HillsException("Could not load configuration properties from " + filename, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    /** A required value. Missing values are recorded, so callers can ignore nulls. */
    protected String strProp (String key) {
        String value = optStrProp(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value;
    }

    /** An optional value, null when absent or blank. */
    protected String optStrProp (String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    protected int intProp (String key, int defaultValue) {
        String val = optStrProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return defaultValue;
    }

    protected boolean boolProp (String key, boolean defaultValue) {
        String val = optStrProp(key);
        if (val != null) {
            // Boolean.parseBoolean will return false for any string other than "true".
            // We want to be more strict.
            if ("true".equalsIgnoreCase(val) || "yes".equalsIgnoreCase(val)) {
                return true;
            } else if ("false".equalsIgnoreCase(val) || "no".equalsIgnoreCase(val)) {
                return false;
            } else {
                LOG.error("Value of configuration option '{}' could not be parsed as a boolean: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return defaultValue;
    }

    /** A comma separated list of strings, empty when absent. */
    protected List<String> listProp (String key) {
        String val = optStrProp(key);
        if (val == null) {
            return Collections.emptyList();
        }
        List<String> values = new ArrayList<>();
        for (String part : val.split(",")) {
            if (!part.trim().isEmpty()) {
                values.add(part.trim());
            }
        }
        return values;
    }

    /** A comma separated list of numbers, or the default when absent. */
    protected List<Double> doubleListProp (String key, List<Double> defaultValue) {
        if (optStrProp(key) == null) {
            return defaultValue;
        }
        List<Double> values = new ArrayList<>();
        for (String part : listProp(key)) {
            try {
                values.add(Double.parseDouble(part));
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as numbers: {}", key, part);
                keysWithErrors.add(key);
            }
        }
        return values;
    }

    /** Record a value that was present but unusable, so it is reported along with any others. */
    protected void recordError (String key, String message) {
        LOG.error("Configuration option '{}': {}", key, message);
        keysWithErrors.add(key);
    }

    /** Call this after reading all properties to enforce the presence and validity of all configuration options. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw new HillsException("Missing or invalid configuration properties: " + String.join(", ", keysWithErrors));
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties
     * (e.g. supplied on the JVM command line). Case and separators are normalized to conform to both properties and
     * environment variable conventions. Properties are Object-Object Maps so key and value are cast to String.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String) entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String) entry.getValue());
            if (key.startsWith(HILLS_PROPERTY_PREFIX)) {
                // Strip off prefix to get the key that would be used in our config file.
                key = key.substring(HILLS_PROPERTY_PREFIX.length());
                String existingKey = properties.getProperty(key);
                if (existingKey != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
