package com.raditha.sweep.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.sweep.engine.SweepSummary;
import com.raditha.sweep.model.Binding;
import com.raditha.sweep.model.FileResult;
import com.raditha.sweep.model.Grammar;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports sweep metrics to CSV and JSON formats for dashboard integration
 * and historical tracking.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Project-level metrics aggregated from all swept files.
     */
    public record ProjectMetrics(
            String projectName,
            LocalDateTime timestamp,
            boolean dryRun,
            int totalFiles,
            int filesProcessed,
            int totalRemoved,
            int totalErrors,
            int totalWarnings,
            Map<String, Integer> processedByGrammar,
            List<FileMetrics> files) {
    }

    /**
     * Per-file metrics.
     */
    public record FileMetrics(
            String file,
            String grammar,
            String status,
            int removedCount,
            int errorCount,
            int warningCount,
            List<String> removedBindings,
            List<String> errors) {
    }

    /**
     * Build aggregated metrics from a sweep.
     */
    public ProjectMetrics buildMetrics(SweepSummary summary, String projectName, boolean dryRun) {
        List<FileMetrics> files = summary.getResults().stream()
                .map(this::buildFileMetrics)
                .toList();

        Map<String, Integer> byGrammar = new LinkedHashMap<>();
        for (Map.Entry<Grammar, Integer> entry : summary.processedByGrammar().entrySet()) {
            byGrammar.put(entry.getKey().getTag(), entry.getValue());
        }

        return new ProjectMetrics(
                projectName,
                LocalDateTime.now(),
                dryRun,
                summary.getFilesScanned(),
                summary.getFilesProcessed(),
                summary.getTotalRemoved(),
                summary.getTotalErrors(),
                summary.getTotalWarnings(),
                byGrammar,
                files);
    }

    private FileMetrics buildFileMetrics(FileResult result) {
        List<String> removed = result.spans().stream()
                .flatMap(span -> span.reasons().stream())
                .map(Binding::getName)
                .distinct()
                .toList();
        return new FileMetrics(
                result.path().toString(),
                result.grammar().getTag(),
                result.status().name(),
                result.removedCount(),
                result.getErrorCount(),
                result.warnings().size(),
                removed,
                result.errors().stream().map(Object::toString).toList());
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(ProjectMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        // Header - Summary
        csv.append("# Project Summary\n");
        csv.append("timestamp,project,dry_run,total_files,files_processed,total_removed,total_errors,total_warnings\n");
        csv.append(String.format("%s,%s,%s,%d,%d,%d,%d,%d\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                csvField(metrics.projectName()),
                metrics.dryRun(),
                metrics.totalFiles(),
                metrics.filesProcessed(),
                metrics.totalRemoved(),
                metrics.totalErrors(),
                metrics.totalWarnings()));

        csv.append("\n");

        // Header - Per-file metrics
        csv.append("# Per-File Metrics\n");
        csv.append("file,grammar,status,removed,errors,warnings,bindings\n");

        for (FileMetrics file : metrics.files()) {
            String bindings = file.removedBindings().isEmpty()
                    ? "NONE"
                    : String.join(";", file.removedBindings());

            csv.append(String.format("%s,%s,%s,%d,%d,%d,%s\n",
                    csvField(file.file()),
                    file.grammar(),
                    file.status(),
                    file.removedCount(),
                    file.errorCount(),
                    file.warningCount(),
                    csvField(bindings)));
        }

        writeOutput(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(ProjectMetrics metrics, Path outputPath) throws IOException {
        writeOutput(outputPath, toJson(metrics) + "\n");
    }

    public String toJson(ProjectMetrics metrics) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(metrics);
    }

    private static void writeOutput(Path outputPath, String content) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, content, StandardCharsets.UTF_8);
    }

    static String csvField(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
