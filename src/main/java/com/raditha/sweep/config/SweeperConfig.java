package com.raditha.sweep.config;

import com.raditha.sweep.rewrite.ReassignmentPolicy;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Configuration for a sweep.
 *
 * @param markerPrefix       names starting with this prefix are never removed
 * @param reassignmentPolicy which writes of a dead binding are deleted
 * @param excludeDirectories directory names skipped anywhere in the tree
 * @param excludePatterns    file patterns to exclude (glob format, relative to the sweep root)
 * @param threads            number of worker threads
 * @param dryRun             compute and report changes without writing them
 */
public record SweeperConfig(
        String markerPrefix,
        ReassignmentPolicy reassignmentPolicy,
        Set<String> excludeDirectories,
        List<String> excludePatterns,
        int threads,
        boolean dryRun) {

    public static final String DEFAULT_MARKER_PREFIX = "_";

    public static final Set<String> DEFAULT_EXCLUDED_DIRECTORIES = Set.of(
            "node_modules", ".venv", "venv", "__pycache__", ".next", "dist", "build",
            "target", ".git", ".svn", ".hg", ".idea");

    /**
     * Validate configuration.
     */
    public SweeperConfig {
        if (markerPrefix == null || markerPrefix.isEmpty()) {
            throw new IllegalArgumentException("markerPrefix must not be empty");
        }
        if (reassignmentPolicy == null) {
            throw new IllegalArgumentException("reassignmentPolicy cannot be null");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        excludeDirectories = excludeDirectories == null ? Set.of() : Set.copyOf(excludeDirectories);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    public static SweeperConfig defaults() {
        return new SweeperConfig(
                DEFAULT_MARKER_PREFIX,
                ReassignmentPolicy.ALL_WRITES,
                DEFAULT_EXCLUDED_DIRECTORIES,
                List.of(),
                defaultThreads(),
                false);
    }

    public static int defaultThreads() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public SweeperConfig withDryRun(boolean value) {
        return new SweeperConfig(markerPrefix, reassignmentPolicy, excludeDirectories, excludePatterns, threads, value);
    }

    public boolean isExcludedDirectory(String directoryName) {
        return excludeDirectories.contains(directoryName);
    }

    /**
     * Check if a file path matches any exclusion pattern.
     *
     * @param filePath path relative to the sweep root, with {@code /} separators
     */
    public boolean shouldExclude(String filePath) {
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(filePath, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Glob matching with {@code **}, {@code *} and {@code ?}. A leading {@code **}{@code /}
     * also matches files at the root.
     */
    static boolean matchesGlobPattern(String path, String pattern) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (pattern.startsWith("**/", i)) {
                regex.append("(?:.*/)?");
                i += 3;
            } else if (pattern.startsWith("**", i)) {
                regex.append(".*");
                i += 2;
            } else if (c == '*') {
                regex.append("[^/]*");
                i++;
            } else if (c == '?') {
                regex.append("[^/]");
                i++;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        return path.matches(regex.toString());
    }
}
