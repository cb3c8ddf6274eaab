package com.raditha.sweep.config;

import com.raditha.sweep.rewrite.ReassignmentPolicy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SweeperConfigTest {

    @Test
    void testDefaults() {
        SweeperConfig config = SweeperConfig.defaults();

        assertEquals("_", config.markerPrefix());
        assertEquals(ReassignmentPolicy.ALL_WRITES, config.reassignmentPolicy());
        assertTrue(config.threads() >= 1);
        assertFalse(config.dryRun());
        assertTrue(config.isExcludedDirectory("node_modules"));
        assertTrue(config.isExcludedDirectory("__pycache__"));
        assertFalse(config.isExcludedDirectory("src"));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new SweeperConfig("", ReassignmentPolicy.ALL_WRITES, Set.of(), List.of(), 1, false));
        assertThrows(IllegalArgumentException.class,
                () -> new SweeperConfig("_", null, Set.of(), List.of(), 1, false));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new SweeperConfig("_", ReassignmentPolicy.ALL_WRITES, Set.of(), List.of(), 0, false));
        assertEquals("threads must be >= 1", e.getMessage());
    }

    @Test
    void testCollectionsAreCopied() {
        List<String> patterns = new ArrayList<>(List.of("*.py"));
        SweeperConfig config = new SweeperConfig("_", ReassignmentPolicy.ALL_WRITES, null, patterns, 2, false);
        patterns.add("*.js");

        assertEquals(List.of("*.py"), config.excludePatterns());
        assertTrue(config.excludeDirectories().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> config.excludePatterns().add("x"));
    }

    @Test
    void testWithDryRun() {
        SweeperConfig config = SweeperConfig.defaults().withDryRun(true);

        assertTrue(config.dryRun());
        assertEquals(SweeperConfig.defaults().excludeDirectories(), config.excludeDirectories());
    }

    @Test
    void testGlobPatterns() {
        assertTrue(SweeperConfig.matchesGlobPattern("app.py", "*.py"));
        assertFalse(SweeperConfig.matchesGlobPattern("src/app.py", "*.py"));
        assertTrue(SweeperConfig.matchesGlobPattern("src/app.py", "**/*.py"));
        assertTrue(SweeperConfig.matchesGlobPattern("app.py", "**/*.py"));
        assertTrue(SweeperConfig.matchesGlobPattern("src/gen/deep/model.ts", "src/gen/**"));
        assertTrue(SweeperConfig.matchesGlobPattern("test_a.py", "test_?.py"));
        assertFalse(SweeperConfig.matchesGlobPattern("test_ab.py", "test_?.py"));
        assertFalse(SweeperConfig.matchesGlobPattern("appXpy", "app.py"), "Dots are literal");
    }

    @Test
    void testShouldExclude() {
        SweeperConfig config = new SweeperConfig("_", ReassignmentPolicy.ALL_WRITES, Set.of(),
                List.of("**/migrations/*.py", "legacy/**"), 1, false);

        assertTrue(config.shouldExclude("app/migrations/0001_initial.py"));
        assertTrue(config.shouldExclude("legacy/old.js"));
        assertFalse(config.shouldExclude("app/models.py"));
    }
}
