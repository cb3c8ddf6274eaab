package com.raditha.sweep.engine;

import com.raditha.sweep.analysis.LivenessClassifier;
import com.raditha.sweep.analysis.LivenessReport;
import com.raditha.sweep.config.SweeperConfig;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.FileResult;
import com.raditha.sweep.model.FileStatus;
import com.raditha.sweep.model.Grammar;
import com.raditha.sweep.model.RemovalSpan;
import com.raditha.sweep.parser.SourceAnalyzers;
import com.raditha.sweep.parser.SourceLines;
import com.raditha.sweep.parser.SourceParseException;
import com.raditha.sweep.rewrite.DiffGenerator;
import com.raditha.sweep.rewrite.FilePatcher;
import com.raditha.sweep.rewrite.RemovalPlan;
import com.raditha.sweep.rewrite.RewritePlanner;
import com.raditha.sweep.scope.ScopeGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the whole pipeline on one file: analyse, classify, plan, patch, repeated
 * until the text is stable.
 * <p>
 * The engine holds only configuration. Every call builds its own scope graph and
 * plan, so one instance can serve several threads as long as no two of them
 * process the same path.
 */
public class DeadBindingEngine {
    private static final Logger logger = LoggerFactory.getLogger(DeadBindingEngine.class);

    private final SweeperConfig config;
    private final FilePatcher patcher;
    private final LivenessClassifier classifier;
    private final RewritePlanner planner;
    private final DiffGenerator diffGenerator = new DiffGenerator();

    public DeadBindingEngine() {
        this(SweeperConfig.defaults());
    }

    public DeadBindingEngine(SweeperConfig config) {
        this(config, new FilePatcher());
    }

    public DeadBindingEngine(SweeperConfig config, FilePatcher patcher) {
        this.config = config;
        this.patcher = patcher;
        this.classifier = new LivenessClassifier(config.markerPrefix(), config.reassignmentPolicy());
        this.planner = new RewritePlanner(config.reassignmentPolicy());
    }

    /**
     * Analyse source text without touching any file.
     */
    public FileAnalysis analyze(String source, Grammar grammar) throws SourceParseException {
        ScopeGraph graph = SourceAnalyzers.forGrammar(grammar).buildScopeGraph(source);
        LivenessReport liveness = classifier.classify(graph);
        RemovalPlan plan = planner.plan(graph, liveness.dead());
        return new FileAnalysis(graph, liveness, plan);
    }

    public RemovalPlan plan(String source, Grammar grammar) throws SourceParseException {
        return analyze(source, grammar).plan();
    }

    /**
     * The source text with its dead bindings removed.
     */
    public String rewrite(String source, Grammar grammar) throws SourceParseException {
        return sweep(source, grammar).text();
    }

    /**
     * Remove dead bindings pass after pass until none is left.
     * <p>
     * Deleting a statement deletes the reads it contained, which can leave other
     * bindings dead, so a single pass is not enough for the output to be stable.
     * Every non-empty pass deletes at least one line, which bounds the loop.
     */
    public RewriteResult sweep(String source, Grammar grammar) throws SourceParseException {
        String text = source;
        List<Integer> originalLines = new ArrayList<>();
        for (int line = 1; line <= SourceLines.of(source).count(); line++) {
            originalLines.add(line);
        }
        List<RemovalSpan> removed = new ArrayList<>();
        int removedCount = 0;
        int passes = 0;
        while (true) {
            FileAnalysis analysis = passes == 0 ? analyze(text, grammar) : reanalyze(text, grammar);
            passes++;
            RemovalPlan plan = analysis.plan();
            if (plan.isEmpty()) {
                List<ErrorRecord> warnings = toOriginalLines(analysis.warnings(), originalLines);
                logger.debug("Stable after {} pass(es), removed {} binding(s)", passes, removedCount);
                return new RewriteResult(text, RewritePlanner.merge(removed), removedCount, warnings, passes);
            }
            for (RemovalSpan span : plan.spans()) {
                removed.add(new RemovalSpan(originalLines.get(span.startLine() - 1),
                        originalLines.get(span.endLine() - 1), span.reasons()));
            }
            removedCount += plan.getRemovedCount();
            text = patcher.splice(text, plan.spans());
            originalLines = survivingLines(originalLines, plan.spans());
        }
    }

    private FileAnalysis reanalyze(String text, Grammar grammar) {
        try {
            return analyze(text, grammar);
        } catch (SourceParseException e) {
            throw new IllegalStateException("Rewritten text no longer parses: " + e.getMessage(), e);
        }
    }

    private static List<Integer> survivingLines(List<Integer> originalLines, List<RemovalSpan> spans) {
        List<Integer> surviving = new ArrayList<>(originalLines.size());
        int spanIndex = 0;
        for (int line = 1; line <= originalLines.size(); line++) {
            while (spanIndex < spans.size() && spans.get(spanIndex).endLine() < line) {
                spanIndex++;
            }
            if (spanIndex >= spans.size() || spans.get(spanIndex).startLine() > line) {
                surviving.add(originalLines.get(line - 1));
            }
        }
        return surviving;
    }

    private static List<ErrorRecord> toOriginalLines(List<ErrorRecord> warnings, List<Integer> originalLines) {
        List<ErrorRecord> mapped = new ArrayList<>(warnings.size());
        for (ErrorRecord warning : warnings) {
            int line = warning.line();
            if (line >= 1 && line <= originalLines.size()) {
                line = originalLines.get(line - 1);
            }
            mapped.add(new ErrorRecord(warning.kind(), warning.message(), line));
        }
        return mapped;
    }

    /**
     * Process a file, writing it unless the configuration asks for a dry run.
     */
    public FileResult process(Path path, Grammar grammar) {
        return run(path, grammar, !config.dryRun());
    }

    public FileResult apply(Path path, Grammar grammar) {
        return run(path, grammar, true);
    }

    /**
     * Compute the change and its diff without writing.
     */
    public FileResult preview(Path path, Grammar grammar) {
        return run(path, grammar, false);
    }

    private FileResult run(Path path, Grammar grammar, boolean write) {
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Cannot read {}: {}", path, e.toString());
            return FileResult.failed(path, grammar, ErrorRecord.ioError("Cannot read file: " + e));
        }

        RewriteResult result;
        try {
            result = sweep(source, grammar);
        } catch (SourceParseException e) {
            logger.debug("Skipping {}: {}", path, e.getMessage());
            return FileResult.failed(path, grammar, ErrorRecord.parseError(e.getMessage(), e.getLine()));
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while analysing {}", path, e);
            return FileResult.failed(path, grammar, ErrorRecord.internalError(e.toString()));
        }

        List<ErrorRecord> warnings = result.warnings();
        if (result.isUnchanged()) {
            return new FileResult(path, grammar, FileStatus.UNCHANGED, 0, List.of(), warnings, List.of(), "");
        }
        if (!write) {
            String diff = diffGenerator.generateUnifiedDiff(String.valueOf(path.getFileName()), source, result.text());
            return new FileResult(path, grammar, FileStatus.PREVIEWED, result.removedCount(), List.of(), warnings,
                    result.spans(), diff);
        }

        try {
            patcher.write(path, result.text());
        } catch (IOException e) {
            logger.warn("Cannot write {}: {}", path, e.toString());
            return new FileResult(path, grammar, FileStatus.FAILED, 0,
                    List.of(ErrorRecord.ioError("Cannot write file: " + e)), warnings, List.of(), "");
        }
        logger.info("Removed {} dead binding(s) from {}", result.removedCount(), path);
        return new FileResult(path, grammar, FileStatus.REWRITTEN, result.removedCount(), List.of(), warnings,
                result.spans(), "");
    }
}
