package com.raditha.sweep.config;

import com.raditha.sweep.rewrite.ReassignmentPolicy;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads sweeper configuration from {@code sweeper.yml} with CLI overrides.
 *
 * Configuration priority: CLI arguments > sweeper.yml > defaults
 */
public class SweeperSettings {

    public static final String CONFIG_KEY = "sweeper";
    public static final String DEFAULT_CONFIG_FILE = "sweeper.yml";

    private SweeperSettings() {
    }

    /**
     * Values given on the command line. Null fields fall back to YAML or defaults.
     *
     * @param markerPrefix       --marker
     * @param reassignmentPolicy --reassignment
     * @param threads            --threads
     * @param excludePatterns    --exclude, added to the YAML patterns
     * @param dryRun             --mode dry-run
     */
    public record Overrides(
            String markerPrefix,
            ReassignmentPolicy reassignmentPolicy,
            Integer threads,
            List<String> excludePatterns,
            Boolean dryRun) {

        public Overrides {
            excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        }

        public static Overrides none() {
            return new Overrides(null, null, null, List.of(), null);
        }
    }

    /**
     * Load configuration from a YAML file, applying CLI overrides where provided.
     *
     * @param configFile explicit configuration file, or null to use {@code sweeper.yml}
     *                   in the working directory when it exists
     * @throws IllegalArgumentException if an explicit file is missing or the YAML is invalid
     */
    public static SweeperConfig loadConfig(Path configFile, Overrides cli) throws IOException {
        Path file = configFile;
        if (file == null) {
            Path fallback = Path.of(DEFAULT_CONFIG_FILE);
            file = Files.isRegularFile(fallback) ? fallback : null;
        } else if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Configuration file not found: " + file);
        }
        Map<String, Object> section = file == null ? Map.of() : readSection(file);
        return loadConfig(section, cli);
    }

    /**
     * Build configuration from the {@code sweeper} section of a parsed YAML document.
     */
    public static SweeperConfig loadConfig(Map<String, Object> config, Overrides cli) {
        String marker = cli.markerPrefix() != null
                ? cli.markerPrefix()
                : getString(config, "marker_prefix", SweeperConfig.DEFAULT_MARKER_PREFIX);

        ReassignmentPolicy policy = cli.reassignmentPolicy() != null
                ? cli.reassignmentPolicy()
                : ReassignmentPolicy.fromString(getString(config, "reassignment", "all-writes"));

        int threads = cli.threads() != null ? cli.threads() : getInt(config, "threads", SweeperConfig.defaultThreads());

        Set<String> excludeDirectories = new LinkedHashSet<>(SweeperConfig.DEFAULT_EXCLUDED_DIRECTORIES);
        excludeDirectories.addAll(getListString(config, "exclude_directories"));

        List<String> excludePatterns = new ArrayList<>(getListString(config, "exclude_patterns"));
        excludePatterns.addAll(cli.excludePatterns());

        boolean dryRun = cli.dryRun() != null ? cli.dryRun() : getBoolean(config, "dry_run", false);

        return new SweeperConfig(marker, policy, excludeDirectories, excludePatterns, threads, dryRun);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> readSection(Path file) throws IOException {
        Object document;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid YAML in " + file + ": " + e.getMessage(), e);
        }
        if (document == null) {
            return Map.of();
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Expected a mapping at the top of " + file);
        }
        Object section = ((Map<String, Object>) document).get(CONFIG_KEY);
        if (section == null) {
            return Map.of();
        }
        if (!(section instanceof Map)) {
            throw new IllegalArgumentException("'" + CONFIG_KEY + "' in " + file + " must be a mapping");
        }
        return (Map<String, Object>) section;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
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
