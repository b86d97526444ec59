package io.specwatch.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Loads {@link SpecWatchConfig} from an optional {@code specwatch.properties} file at the
 * project root. Keys mirror the builder methods; absent keys keep the builder defaults.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_FILE_NAME = "specwatch.properties";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Reads {@code specwatch.properties} from {@code projectDir}, or returns the defaults
     * when the file does not exist.
     *
     * @throws IllegalArgumentException if the file is unreadable or holds malformed values
     */
    public static SpecWatchConfig load(Path projectDir) {
        Path file = projectDir.resolve(CONFIG_FILE_NAME);
        if (!Files.isRegularFile(file)) {
            log.debug("No {} under {}, using defaults", CONFIG_FILE_NAME, projectDir);
            return SpecWatchConfig.builder().build();
        }

        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to read " + file + ": " + e.getMessage(), e);
        }
        log.info("Loaded configuration from {}", file);
        return fromProperties(props);
    }

    /**
     * Applies the given properties on top of the builder defaults.
     */
    public static SpecWatchConfig fromProperties(Properties props) {
        SpecWatchConfig.Builder builder = SpecWatchConfig.builder();

        for (String key : props.stringPropertyNames()) {
            String value = props.getProperty(key).trim();
            switch (key) {
                case "specSuffix" -> builder.specSuffix(value);
                case "excludePaths" -> builder.excludePaths(splitList(value));
                case "debounceMillis" -> builder.debounce(Duration.ofMillis(parseLong(key, value)));
                case "incremental" -> builder.incremental(parseBoolean(key, value));
                case "useCache" -> builder.useCache(parseBoolean(key, value));
                case "discoveryParallelism" -> builder.discoveryParallelism((int) parseLong(key, value));
                case "baseRef" -> builder.baseRef(value);
                case "includeUncommitted" -> builder.includeUncommitted(parseBoolean(key, value));
                case "includeStaged" -> builder.includeStaged(parseBoolean(key, value));
                default -> log.warn("Ignoring unknown configuration key '{}'", key);
            }
        }
        return builder.build();
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be a number but was '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) return true;
        if ("false".equalsIgnoreCase(value)) return false;
        throw new IllegalArgumentException("'" + key + "' must be true or false but was '" + value + "'");
    }
}
