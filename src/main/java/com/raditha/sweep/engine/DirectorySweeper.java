package com.raditha.sweep.engine;

import com.raditha.sweep.config.SweeperConfig;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.FileResult;
import com.raditha.sweep.model.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Finds source files under a set of roots and runs the engine on each of them.
 * <p>
 * Files are de-duplicated before any work starts and each one is submitted to the
 * pool exactly once, so no two workers ever patch the same file. Results are
 * reported in path order.
 */
public class DirectorySweeper {
    private static final Logger logger = LoggerFactory.getLogger(DirectorySweeper.class);

    private final SweeperConfig config;
    private final DeadBindingEngine engine;
    private final Grammar forcedGrammar;

    public DirectorySweeper(SweeperConfig config) {
        this(config, new DeadBindingEngine(config), null);
    }

    /**
     * @param forcedGrammar grammar for every file, or null to pick it from the extension
     */
    public DirectorySweeper(SweeperConfig config, DeadBindingEngine engine, Grammar forcedGrammar) {
        this.config = config;
        this.engine = engine;
        this.forcedGrammar = forcedGrammar;
    }

    /**
     * Collect the files to process.
     * <p>
     * Files named explicitly are always included; with a forced grammar they are read
     * as that grammar whatever their extension. Directory walks skip excluded
     * directories and patterns and keep only files of a known grammar (only of the
     * forced grammar when there is one).
     *
     * @return files keyed by normalized absolute path, sorted, each with its grammar
     */
    public Map<Path, Grammar> collectFiles(List<Path> roots) throws IOException {
        Map<Path, Grammar> files = new LinkedHashMap<>();
        for (Path root : roots) {
            if (Files.isRegularFile(root)) {
                Optional<Grammar> grammar = forcedGrammar != null ? Optional.of(forcedGrammar) : Grammar.fromPath(root);
                if (grammar.isPresent()) {
                    files.putIfAbsent(root.toAbsolutePath().normalize(), grammar.get());
                } else {
                    logger.warn("Skipping {}: unknown file type", root);
                }
            } else if (Files.isDirectory(root)) {
                walk(root, files);
            } else {
                throw new NoSuchFileException(root.toString());
            }
        }
        Map<Path, Grammar> sorted = new LinkedHashMap<>();
        files.keySet().stream().sorted().forEach(path -> sorted.put(path, files.get(path)));
        return sorted;
    }

    private void walk(Path root, Map<Path, Grammar> files) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && dir.getFileName() != null
                        && config.isExcludedDirectory(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                String relative = root.relativize(file).toString().replace('\\', '/');
                if (config.shouldExclude(relative)) {
                    return FileVisitResult.CONTINUE;
                }
                Grammar.fromPath(file)
                        .filter(g -> forcedGrammar == null || g == forcedGrammar)
                        .ifPresent(g -> files.putIfAbsent(file.toAbsolutePath().normalize(), g));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                logger.warn("Cannot visit {}: {}", file, e.toString());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    public SweepSummary sweep(List<Path> roots) throws IOException, InterruptedException {
        return sweep(roots, result -> { });
    }

    /**
     * Process every collected file on a fixed pool of {@link SweeperConfig#threads()} workers.
     *
     * @param listener called on the calling thread for each result, in path order
     */
    public SweepSummary sweep(List<Path> roots, Consumer<FileResult> listener)
            throws IOException, InterruptedException {
        long start = System.nanoTime();
        Map<Path, Grammar> files = collectFiles(roots);
        logger.debug("Sweeping {} file(s) with {} thread(s)", files.size(), config.threads());

        SweepSummary summary = new SweepSummary();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(config.threads(), files.size())));
        try {
            List<Map.Entry<Path, Grammar>> entries = new ArrayList<>(files.entrySet());
            List<Future<FileResult>> futures = new ArrayList<>();
            for (Map.Entry<Path, Grammar> entry : entries) {
                futures.add(pool.submit(() -> engine.process(entry.getKey(), entry.getValue())));
            }
            for (int i = 0; i < futures.size(); i++) {
                FileResult result = await(futures.get(i), entries.get(i).getKey(), entries.get(i).getValue());
                summary.add(result);
                listener.accept(result);
            }
        } finally {
            pool.shutdownNow();
        }
        summary.setElapsed(Duration.ofNanos(System.nanoTime() - start));
        return summary;
    }

    private static FileResult await(Future<FileResult> future, Path path, Grammar grammar)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            logger.error("Worker failed on {}", path, e.getCause());
            return FileResult.failed(path, grammar, ErrorRecord.internalError(String.valueOf(e.getCause())));
        }
    }
}
