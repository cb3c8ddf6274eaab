package com.raditha.sweep.engine;

import com.raditha.sweep.config.SweeperConfig;
import com.raditha.sweep.model.FileResult;
import com.raditha.sweep.model.FileStatus;
import com.raditha.sweep.model.Grammar;
import com.raditha.sweep.rewrite.ReassignmentPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DirectorySweeper - file discovery and parallel processing.
 */
class DirectorySweeperTest {

    @TempDir
    Path tempDir;

    private SweeperConfig config;

    @BeforeEach
    void setUp() throws IOException {
        config = new SweeperConfig("_", ReassignmentPolicy.ALL_WRITES, SweeperConfig.DEFAULT_EXCLUDED_DIRECTORIES,
                List.of("**/generated_*.py"), 4, false);

        write("src/app.py", "x = 1\ny = 2\nprint(x)\n");
        write("src/util.js", "const a = 1;\nconst b = 2;\nconsole.log(a);\n");
        write("src/Main.java", "class Main {\n    void run() {\n        int unused = 1;\n        go();\n    }\n}\n");
        write("src/types.d.ts", "declare const unused: number;\n");
        write("src/generated_models.py", "z = 1\n");
        write("node_modules/lib/index.js", "const z = 1;\n");
        write("README.md", "# readme\n");
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testCollectFilesSkipsExcludedAndUnknownFiles() throws IOException {
        Map<Path, Grammar> files = new DirectorySweeper(config).collectFiles(List.of(tempDir));

        List<String> names = files.keySet().stream().map(p -> p.getFileName().toString()).toList();
        assertEquals(List.of("Main.java", "app.py", "util.js"), names);
        assertEquals(Grammar.JAVA, files.get(tempDir.resolve("src/Main.java").toAbsolutePath().normalize()));
    }

    @Test
    void testOverlappingRootsAreDeduplicated() throws IOException {
        DirectorySweeper sweeper = new DirectorySweeper(config);
        Map<Path, Grammar> files = sweeper.collectFiles(
                List.of(tempDir, tempDir.resolve("src"), tempDir.resolve("src/app.py")));

        assertEquals(3, files.size());
    }

    @Test
    void testForcedGrammar() throws IOException {
        Path script = write("bin/tool", "unused = 1\n");
        DirectorySweeper sweeper = new DirectorySweeper(config, new DeadBindingEngine(config), Grammar.PYTHON);

        Map<Path, Grammar> files = sweeper.collectFiles(List.of(tempDir.resolve("src"), script));

        assertEquals(Set.of("app.py", "tool"),
                Set.copyOf(files.keySet().stream().map(p -> p.getFileName().toString()).toList()));
        assertEquals(Grammar.PYTHON, files.get(script.toAbsolutePath().normalize()));
    }

    @Test
    void testExplicitFileIsIncludedEvenWhenExcluded() throws IOException {
        Path generated = tempDir.resolve("src/generated_models.py");
        Map<Path, Grammar> files = new DirectorySweeper(config).collectFiles(List.of(generated));

        assertEquals(1, files.size());
    }

    @Test
    void testMissingRoot() {
        assertThrows(NoSuchFileException.class,
                () -> new DirectorySweeper(config).collectFiles(List.of(tempDir.resolve("nope"))));
    }

    @Test
    void testSweepProcessesEveryFile() throws Exception {
        List<FileResult> seen = new ArrayList<>();

        SweepSummary summary = new DirectorySweeper(config).sweep(List.of(tempDir), seen::add);

        assertEquals(3, summary.getFilesScanned());
        assertEquals(3, summary.getFilesProcessed());
        assertEquals(3, summary.getTotalRemoved());
        assertFalse(summary.hasErrors());
        assertEquals(summary.getResults(), seen, "Listener sees results in path order");
        assertEquals(1, summary.processedByGrammar().get(Grammar.PYTHON));
        assertEquals(0, summary.processedByGrammar().get(Grammar.TYPESCRIPT));
        assertEquals(1, summary.removedByGrammar().get(Grammar.JAVASCRIPT));
        assertTrue(seen.stream().allMatch(r -> r.status() == FileStatus.REWRITTEN));

        assertEquals("x = 1\nprint(x)\n", Files.readString(tempDir.resolve("src/app.py")));
        assertEquals("z = 1\n", Files.readString(tempDir.resolve("src/generated_models.py")));
        assertEquals("const z = 1;\n", Files.readString(tempDir.resolve("node_modules/lib/index.js")));
    }

    @Test
    void testOneBadFileDoesNotStopTheSweep() throws Exception {
        write("src/broken.py", "def broken(:\n");

        SweepSummary summary = new DirectorySweeper(config).sweep(List.of(tempDir));

        assertEquals(4, summary.getFilesScanned());
        assertEquals(1, summary.getTotalErrors());
        assertEquals(3, summary.getTotalRemoved());
        assertTrue(summary.hasErrors());
    }

    @Test
    void testDryRunSweepWritesNothing() throws Exception {
        SweepSummary summary = new DirectorySweeper(config.withDryRun(true)).sweep(List.of(tempDir));

        assertEquals(3, summary.getTotalRemoved());
        assertTrue(summary.getResults().stream().allMatch(r -> r.status() == FileStatus.PREVIEWED));
        assertEquals("x = 1\ny = 2\nprint(x)\n", Files.readString(tempDir.resolve("src/app.py")));
    }

    @Test
    void testEmptyDirectory() throws Exception {
        Path empty = Files.createDirectory(tempDir.resolve("empty"));

        SweepSummary summary = new DirectorySweeper(config).sweep(List.of(empty));

        assertEquals(0, summary.getFilesScanned());
        assertEquals(0, summary.getTotalRemoved());
    }
}
