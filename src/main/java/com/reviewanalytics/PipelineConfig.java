package com.reviewanalytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Pipeline settings. Defaults come from {@code review-pipeline.properties} on
 * the classpath; any key can be overridden with a JVM system property of the
 * same name, e.g. {@code -Dspark.master=yarn}.
 */
public class PipelineConfig {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String RESOURCE = "review-pipeline.properties";

    public static final String APP_NAME = "spark.app.name";
    public static final String MASTER = "spark.master";
    public static final String INPUT_DELIMITER = "input.delimiter";
    public static final String INPUT_DATE_PATTERN = "input.date.pattern";
    public static final String CLEANED_DIR = "output.cleaned.dir";
    public static final String RESULTS_DIR = "output.results.dir";
    public static final String STAGING_DIR = "output.staging.dir";
    public static final String TOP_CUSTOMERS_LIMIT = "report.top.customers.limit";

    private final String appName;
    private final String master;
    private final String delimiter;
    private final String datePattern;
    private final String cleanedDir;
    private final String resultsDir;
    private final String stagingDir;
    private final int topCustomersLimit;

    private PipelineConfig(Properties props) {
        this.appName = props.getProperty(APP_NAME, "ReviewAnalyticsPipeline");
        this.master = props.getProperty(MASTER, "local[*]");
        this.delimiter = props.getProperty(INPUT_DELIMITER, ",");
        this.datePattern = props.getProperty(INPUT_DATE_PATTERN, "uuuu-MM-dd");
        this.cleanedDir = requireName(props, CLEANED_DIR, "processed-data");
        this.resultsDir = requireName(props, RESULTS_DIR, "analytics-results");
        this.stagingDir = requireName(props, STAGING_DIR, "_staging");
        this.topCustomersLimit = parseInt(props, TOP_CUSTOMERS_LIMIT, 5);

        if (delimiter.isEmpty()) {
            throw new IllegalArgumentException(INPUT_DELIMITER + " must not be empty");
        }
        try {
            ReviewCleaner.strictFormatter(datePattern);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + INPUT_DATE_PATTERN + ": " + datePattern, e);
        }
        if (!stagingDir.startsWith("_") && !stagingDir.startsWith(".")) {
            LOG.warn("Staging directory {} is not hidden from query engines", stagingDir);
        }
    }

    /**
     * Classpath defaults overlaid with system properties.
     */
    public static PipelineConfig load() {
        Properties props = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                LOG.debug("No {} on classpath, using built-in defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (isPipelineKey(key)) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        return new PipelineConfig(props);
    }

    public static PipelineConfig fromProperties(Properties props) {
        return new PipelineConfig(props);
    }

    private static boolean isPipelineKey(String key) {
        return key.equals(APP_NAME) || key.equals(MASTER)
            || key.startsWith("input.") || key.startsWith("output.") || key.startsWith("report.");
    }

    private static String requireName(Properties props, String key, String defaultValue) {
        String value = props.getProperty(key, defaultValue).trim();
        if (value.isEmpty() || value.contains("..")) {
            throw new IllegalArgumentException("Invalid " + key + ": '" + value + "'");
        }
        return value;
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": '" + value + "'", e);
        }
    }

    public String getAppName() {
        return appName;
    }

    public String getMaster() {
        return master;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public String getDatePattern() {
        return datePattern;
    }

    public String getCleanedDir() {
        return cleanedDir;
    }

    public String getResultsDir() {
        return resultsDir;
    }

    public String getStagingDir() {
        return stagingDir;
    }

    public int getTopCustomersLimit() {
        return topCustomersLimit;
    }
}
