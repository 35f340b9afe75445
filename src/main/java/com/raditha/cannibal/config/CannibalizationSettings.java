package com.raditha.cannibal.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads cannibalization configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > YAML > defaults. A preset chosen on
 * the command line replaces everything else.
 *
 * <pre>
 * cannibalization:
 *   preset: moderate          # strict | moderate | lenient
 *   threshold: 0.8
 *   min_keywords: 10
 *   parallelism: 4
 *   exclude_fragment_urls: true
 * </pre>
 */
public class CannibalizationSettings {

    private static final Logger logger = LoggerFactory.getLogger(CannibalizationSettings.class);

    public static final String CONFIG_KEY = "cannibalization";
    public static final Path DEFAULT_CONFIG_FILE = Path.of("cannibalization.yml");

    private final Map<String, Object> yamlConfig;

    private CannibalizationSettings(Map<String, Object> yamlConfig) {
        this.yamlConfig = yamlConfig;
    }

    /**
     * Settings with no YAML values; only CLI values and defaults apply.
     */
    public static CannibalizationSettings defaults() {
        return new CannibalizationSettings(Map.of());
    }

    /**
     * Load the given file, or {@link #DEFAULT_CONFIG_FILE} if it exists when
     * no file is given.
     *
     * @param configFile explicit config file, may be null
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the file is not valid YAML
     */
    public static CannibalizationSettings load(Path configFile) throws IOException {
        Path file = configFile;
        if (file == null) {
            if (!Files.exists(DEFAULT_CONFIG_FILE)) {
                return defaults();
            }
            file = DEFAULT_CONFIG_FILE;
        }

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return fromYaml(new Yaml().load(reader), file.toString());
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid YAML in " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse settings from YAML text.
     */
    public static CannibalizationSettings parse(String yaml) {
        try {
            return fromYaml(new Yaml().load(yaml), "<string>");
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid YAML: " + e.getMessage(), e);
        }
    }

    private static CannibalizationSettings fromYaml(Object root, String origin) {
        if (!(root instanceof Map<?, ?> rootMap)) {
            logger.debug("No configuration found in {}", origin);
            return defaults();
        }
        Object section = rootMap.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            logger.debug("No '{}' section in {}", CONFIG_KEY, origin);
            return defaults();
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        logger.debug("Loaded configuration from {}", origin);
        return new CannibalizationSettings(config);
    }

    /**
     * Build the effective configuration.
     *
     * @param thresholdCLI   CLI threshold (null = use YAML/default)
     * @param minKeywordsCLI CLI minimum keyword count (null = use YAML/default)
     * @param parallelismCLI CLI worker count (null = use YAML/default)
     * @param presetCLI      CLI preset name (null = use YAML/default)
     * @return complete configuration
     */
    public CannibalizationConfig toConfig(Double thresholdCLI, Integer minKeywordsCLI,
            Integer parallelismCLI, String presetCLI) {
        if (presetCLI != null) {
            return CannibalizationConfig.fromPreset(presetCLI);
        }

        String preset = getString(yamlConfig, "preset", null);
        CannibalizationConfig base = preset != null
                ? CannibalizationConfig.fromPreset(preset)
                : CannibalizationConfig.moderate();

        double threshold = thresholdCLI != null
                ? thresholdCLI
                : getDouble(yamlConfig, "threshold", base.threshold());
        int minKeywords = minKeywordsCLI != null
                ? minKeywordsCLI
                : getInt(yamlConfig, "min_keywords", base.minKeywords());
        int parallelism = parallelismCLI != null
                ? parallelismCLI
                : getInt(yamlConfig, "parallelism", base.parallelism());
        boolean excludeFragments = getBoolean(yamlConfig, "exclude_fragment_urls", base.excludeFragmentUrls());

        return new CannibalizationConfig(threshold, minKeywords, parallelism, excludeFragments);
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if ((value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)
                && ((Number) value).longValue() == ((Number) value).intValue()) {
            return ((Number) value).intValue();
        }
        throw new IllegalArgumentException(key + " must be a whole number, got: " + value);
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            throw new IllegalArgumentException(key + " must be a number, got: " + value);
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value != null) {
            throw new IllegalArgumentException(key + " must be true or false, got: " + value);
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
