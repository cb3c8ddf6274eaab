package com.raditha.sweep.cli;

import com.raditha.sweep.config.SweeperConfig;
import com.raditha.sweep.config.SweeperSettings;
import com.raditha.sweep.engine.DeadBindingEngine;
import com.raditha.sweep.engine.DirectorySweeper;
import com.raditha.sweep.engine.SweepSummary;
import com.raditha.sweep.metrics.MetricsExporter;
import com.raditha.sweep.model.ErrorKind;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.FileResult;
import com.raditha.sweep.model.Grammar;
import com.raditha.sweep.rewrite.ReassignmentPolicy;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the dead binding sweeper.
 * <p>
 * Usage:
 * java -jar sweeper.jar [options] [file-or-directory...]
 * <p>
 * Configuration priority: CLI arguments > sweeper.yml > defaults
 */
@Command(name = "sweeper", mixinStandardHelpOptions = true, version = "Sweeper v1.0.0",
        description = "Removes local variables whose values are never read")
@SuppressWarnings("java:S106")
public class SweeperCLI implements Callable<Integer> {

    private static final String SEPARATOR = "=".repeat(60);

    @Parameters(arity = "0..*", paramLabel = "<path>",
            description = "Files or directories to sweep (default: current directory)")
    private List<Path> paths = new ArrayList<>();

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--mode", description = "Run mode: apply or dry-run (default: apply)", paramLabel = "<mode>",
            converter = RunModeConverter.class)
    private RunMode runMode;

    @Option(names = "--grammar", description = "Force a grammar: python, java, javascript or typescript",
            paramLabel = "<grammar>", converter = GrammarConverter.class)
    private Grammar grammar;

    @Option(names = "--threads", description = "Worker threads (default: available processors)", paramLabel = "<n>")
    private Integer threads;

    @Option(names = "--marker", description = "Prefix of names that are never removed (default: _)",
            paramLabel = "<prefix>")
    private String marker;

    @Option(names = "--reassignment", description = "Writes removed for a dead binding: all-writes or last-write-wins",
            paramLabel = "<policy>", converter = ReassignmentPolicyConverter.class)
    private ReassignmentPolicy reassignment;

    @Option(names = "--exclude", description = "Glob of files to skip, relative to each root (repeatable)",
            paramLabel = "<glob>")
    private List<String> excludes = new ArrayList<>();

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    @Option(names = "--output", description = "Directory for exported metrics", paramLabel = "<path>")
    private Path outputPath;

    @Option(names = "--fail-on-error", description = "Exit with status 1 when any file fails")
    private boolean failOnError = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Boolean dryRun = runMode == null ? null : runMode == RunMode.DRY_RUN;
        SweeperConfig config = SweeperSettings.loadConfig(configFile,
                new SweeperSettings.Overrides(marker, reassignment, threads, excludes, dryRun));

        List<Path> roots = paths.isEmpty() ? List.of(Path.of(".")) : paths;
        DirectorySweeper sweeper = new DirectorySweeper(config, new DeadBindingEngine(config), grammar);

        if (!jsonOutput) {
            System.out.println("Scanning: " + String.join(", ", roots.stream().map(Path::toString).toList()));
            if (config.dryRun()) {
                System.out.println("Dry run: no files will be modified");
            }
            System.out.println(SEPARATOR);
        }

        SweepSummary summary = sweeper.sweep(roots, result -> {
            if (!jsonOutput) {
                printFileResult(result);
            }
        });

        MetricsExporter exporter = new MetricsExporter();
        MetricsExporter.ProjectMetrics metrics = exporter.buildMetrics(summary, projectName(roots), config.dryRun());
        if (jsonOutput) {
            System.out.println(exporter.toJson(metrics));
        } else {
            printSummary(summary, config.dryRun());
        }

        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(exporter, metrics);
        }

        return failOnError && summary.hasErrors() ? 1 : 0;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit code mapping used by {@link #main(String[])}.
     */
    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new SweeperCLI());

        // Configure error handling
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            // Handle execution exceptions with appropriate exit codes
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        // Configure parameter exception handler for better error messages
        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threads != null && threads < 1) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }

        if (marker != null && marker.isEmpty()) {
            throw new IllegalArgumentException("Marker prefix must not be empty");
        }

        // Validate export format
        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase();
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new IllegalArgumentException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
            exportFormat = format;
        }

        // Validate output path is a directory if specified
        if (outputPath != null && Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
        }
    }

    private static void printFileResult(FileResult result) {
        if (result.hasErrors()) {
            ErrorRecord error = result.errors().get(0);
            if (error.kind() == ErrorKind.PARSE_ERROR) {
                System.out.printf("  ⚠ Syntax error in %s: %s%n", result.path(), error.message());
            } else {
                System.out.printf("  ✗ Error processing %s: %s%n", result.path(), error.message());
            }
            return;
        }
        switch (result.status()) {
            case REWRITTEN -> System.out.printf("  ✓ Removed %d unused variable(s) from %s%n",
                    result.removedCount(), result.path());
            case PREVIEWED -> {
                System.out.printf("  ✓ Would remove %d unused variable(s) from %s%n",
                        result.removedCount(), result.path());
                System.out.println(result.diff());
            }
            default -> {
                // unchanged files only show their warnings
            }
        }
        for (ErrorRecord warning : result.warnings()) {
            System.out.printf("    · %s: %s%n", result.path().getFileName(), warning);
        }
    }

    private static void printSummary(SweepSummary summary, boolean dryRun) {
        System.out.println();
        System.out.println(SEPARATOR);
        System.out.println("Summary:");
        for (Map.Entry<Grammar, Integer> entry : summary.processedByGrammar().entrySet()) {
            System.out.printf("  %s files processed: %d%n", displayName(entry.getKey()), entry.getValue());
        }
        System.out.printf("  Total unused variables %s: %d%n", dryRun ? "found" : "removed", summary.getTotalRemoved());
        System.out.printf("  Total errors encountered: %d%n", summary.getTotalErrors());
        System.out.printf("  Time elapsed: %d ms%n", summary.getElapsed().toMillis());
        System.out.println(SEPARATOR);

        if (summary.getTotalErrors() == 0) {
            System.out.println("✅ Cleanup completed successfully!");
        } else {
            System.out.printf("⚠ Cleanup completed with %d error(s)%n", summary.getTotalErrors());
        }
    }

    private static String displayName(Grammar grammar) {
        return switch (grammar) {
            case PYTHON -> "Python";
            case JAVA -> "Java";
            case JAVASCRIPT -> "JavaScript";
            case TYPESCRIPT -> "TypeScript";
        };
    }

    private static String projectName(List<Path> roots) {
        Path first = roots.get(0).toAbsolutePath().normalize();
        Path name = first.getFileName();
        return name != null ? name.toString() : "project";
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(MetricsExporter exporter, MetricsExporter.ProjectMetrics metrics) throws IOException {
        Path outputDir = outputPath != null ? outputPath : Path.of(".");

        if ("csv".equals(exportFormat) || "both".equals(exportFormat)) {
            Path csvPath = outputDir.resolve("sweeper-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            if (!jsonOutput) {
                System.out.println("\n✓ Metrics exported to: " + csvPath.toAbsolutePath());
            }
        }

        if ("json".equals(exportFormat) || "both".equals(exportFormat)) {
            Path jsonPath = outputDir.resolve("sweeper-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            if (!jsonOutput) {
                System.out.println("✓ Metrics exported to: " + jsonPath.toAbsolutePath());
            }
        }
    }

    /**
     * Custom converter for RunMode enum to handle CLI string values.
     */
    public static class RunModeConverter implements ITypeConverter<RunMode> {
        @Override
        public RunMode convert(String value) throws Exception {
            return RunMode.fromString(value);
        }
    }

    /**
     * Custom converter for ReassignmentPolicy enum to handle CLI string values.
     */
    public static class ReassignmentPolicyConverter implements ITypeConverter<ReassignmentPolicy> {
        @Override
        public ReassignmentPolicy convert(String value) throws Exception {
            return ReassignmentPolicy.fromString(value);
        }
    }

    public static class GrammarConverter implements ITypeConverter<Grammar> {
        @Override
        public Grammar convert(String value) throws Exception {
            return Grammar.fromString(value);
        }
    }
}
