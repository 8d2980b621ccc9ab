import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Grid limits. Loaded from a YAML classpath resource (spreadsheet.yml by default),
 * command line arguments "--key=value" or "--key value" take precedence.
 */
public class SpreadsheetConfig {
    private static final Logger LOG = LoggerFactory.getLogger(SpreadsheetConfig.class);

    public static final String DEFAULT_RESOURCE = "spreadsheet.yml";

    public static final String MAX_ROWS = "grid.max-rows";
    public static final String MAX_COLS = "grid.max-cols";
    public static final String DEFAULT_ROWS = "grid.default-rows";
    public static final String DEFAULT_COLS = "grid.default-cols";

    private final int maxRows, maxCols;
    private final int defaultRows, defaultCols;

    public SpreadsheetConfig(int maxRows, int maxCols, int defaultRows, int defaultCols) {
        if (maxRows < 1 || maxCols < 1) {
            throw new IllegalArgumentException(String.format(
                    "Grid limits must be positive: %d x %d", maxRows, maxCols));
        }
        if (defaultRows < 1 || defaultRows > maxRows || defaultCols < 1 || defaultCols > maxCols) {
            throw new IllegalArgumentException(String.format(
                    "Default grid %d x %d is outside limits %d x %d", defaultRows, defaultCols, maxRows, maxCols));
        }
        this.maxRows = maxRows;
        this.maxCols = maxCols;
        this.defaultRows = defaultRows;
        this.defaultCols = defaultCols;
    }

    public static SpreadsheetConfig defaults() {
        return new SpreadsheetConfig(30, 15, 10, 10);
    }

    public static SpreadsheetConfig load() {
        return load(new String[0], DEFAULT_RESOURCE);
    }

    public static SpreadsheetConfig load(String[] args, String resourceName) {
        Map<String, String> values = loadResource(resourceName);
        values.putAll(parseArgs(args));
        return fromMap(values);
    }

    static SpreadsheetConfig fromMap(Map<String, String> values) {
        SpreadsheetConfig defaults = defaults();
        return new SpreadsheetConfig(
                getInt(values, MAX_ROWS, defaults.maxRows),
                getInt(values, MAX_COLS, defaults.maxCols),
                getInt(values, DEFAULT_ROWS, defaults.defaultRows),
                getInt(values, DEFAULT_COLS, defaults.defaultCols));
    }

    public int getMaxRows() {
        return maxRows;
    }

    public int getMaxCols() {
        return maxCols;
    }

    public int getDefaultRows() {
        return defaultRows;
    }

    public int getDefaultCols() {
        return defaultCols;
    }

    private static Map<String, String> loadResource(String resourceName) {
        Map<String, String> flat = new HashMap<>();
        try (InputStream is = SpreadsheetConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (is == null) {
                LOG.warn("Config resource {} not found, using defaults", resourceName);
                return flat;
            }
            Object root = new Yaml().load(is);
            if (root instanceof Map) {
                flatten("", (Map<?, ?>) root, flat);
            } else if (root != null) {
                throw new IllegalArgumentException("Config resource " + resourceName + " is not a YAML mapping");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config resource " + resourceName, e);
        }
        return flat;
    }

    /**
     * Nested YAML keys become dotted names: grid: {max-rows: 30} -> grid.max-rows=30
     */
    private static void flatten(String prefix, Map<?, ?> source, Map<String, String> target) {
        source.forEach((key, value) -> {
            String fullKey = prefix.isEmpty() ? String.valueOf(key) : prefix + "." + key;
            if (value instanceof Map) {
                flatten(fullKey, (Map<?, ?>) value, target);
            } else if (value != null) {
                target.put(fullKey, value.toString());
            }
        });
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> result = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--") || arg.length() == 2) {
                continue;
            }
            String key = arg.substring(2);
            int eq = key.indexOf('=');
            if (eq >= 0) {
                result.put(key.substring(0, eq), key.substring(eq + 1));
            } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                result.put(key, args[++i]);
            }
        }
        return result;
    }

    private static int getInt(Map<String, String> values, String key, int defaultValue) {
        String value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Config value %s must be integer: %s", key, value), e);
        }
    }

    @Override
    public String toString() {
        return String.format("max %dx%d, default %dx%d", maxRows, maxCols, defaultRows, defaultCols);
    }
}
