package com.raditha.bytelift.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads decompiler settings from a YAML file with CLI overrides.
 *
 * Configuration priority: CLI arguments > decompiler.yml > defaults
 */
public class DecompilerSettingsLoader {

    private static final Logger logger = LoggerFactory.getLogger(DecompilerSettingsLoader.class);

    private static final String CONFIG_KEY = "decompiler";
    private static final String DEFAULT_RESOURCE = "decompiler.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private DecompilerSettingsLoader() {
        /* this is only a utility class */
    }

    /**
     * Load settings, applying CLI overrides where provided.
     *
     * @param configFile     YAML file to read (null = the bundled decompiler.yml, if any)
     * @param presetCLI      CLI preset name (null = use YAML/default)
     * @param disabledCLI    transforms disabled on the command line, added to those from YAML
     * @param showDocsCLI    true forces documentation on (false = use YAML/default)
     * @param abortAfterCLI  CLI abort point (null = use YAML/default)
     * @param threadsCLI     CLI worker count (0 = use YAML/default)
     * @return complete settings
     * @throws ConfigurationException when the file cannot be read or a value is invalid
     */
    public static DecompilerSettings loadConfig(Path configFile, String presetCLI, List<String> disabledCLI,
            boolean showDocsCLI, String abortAfterCLI, int threadsCLI) {
        Map<String, Object> config = readSection(configFile);

        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        DecompilerSettings base = preset != null ? forPreset(preset) : DecompilerSettings.defaults();

        List<String> disabled = new ArrayList<>(getListString(config, "disabled_transforms"));
        if (disabledCLI != null) {
            disabled.addAll(disabledCLI);
        }

        try {
            return new DecompilerSettings(
                    merge(base.disabledTransforms(), disabled),
                    showDocsCLI || getBoolean(config, "show_documentation", base.showDocumentation()),
                    abortAfterCLI != null ? abortAfterCLI : getString(config, "abort_after", base.abortAfter()),
                    getInt(config, "max_position_retries", base.maxPositionRetries()),
                    getInt(config, "max_pipeline_cycles", base.maxPipelineCycles()),
                    threadsCLI != 0 ? threadsCLI : getInt(config, "parallelism", base.parallelism()));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid decompiler configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Settings from the bundled configuration with no overrides.
     */
    public static DecompilerSettings loadDefault() {
        return loadConfig(null, null, List.of(), false, null, 0);
    }

    static DecompilerSettings forPreset(String preset) {
        return switch (preset) {
            case "minimal" -> DecompilerSettings.minimal();
            case "default", "defaults" -> DecompilerSettings.defaults();
            default -> throw new ConfigurationException("Unknown preset: " + preset);
        };
    }

    private static Map<String, Object> readSection(Path configFile) {
        Object raw;
        if (configFile != null) {
            if (!Files.isRegularFile(configFile)) {
                throw new ConfigurationException("Configuration file not found: " + configFile);
            }
            try (InputStream in = Files.newInputStream(configFile)) {
                raw = YAML.readValue(in, Map.class);
            } catch (IOException e) {
                throw new ConfigurationException("Could not read " + configFile + ": " + e.getMessage(), e);
            }
            logger.debug("Loaded configuration from {}", configFile);
        } else {
            raw = readBundled();
        }

        if (raw instanceof Map<?, ?> root && root.get(CONFIG_KEY) instanceof Map<?, ?> section) {
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) section;
            return config;
        }
        return Map.of();
    }

    private static Object readBundled() {
        try (InputStream in = DecompilerSettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return null;
            }
            return YAML.readValue(in, Map.class);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read bundled " + DEFAULT_RESOURCE, e);
        }
    }

    private static Set<String> merge(Set<String> first, List<String> second) {
        Set<String> all = new LinkedHashSet<>(first);
        all.addAll(second);
        return all;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean b) {
            return b;
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

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
