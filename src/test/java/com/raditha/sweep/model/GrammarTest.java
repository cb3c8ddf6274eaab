package com.raditha.sweep.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GrammarTest {

    @ParameterizedTest
    @CsvSource({
            "python, PYTHON",
            "PY, PYTHON",
            "java, JAVA",
            "JavaScript, JAVASCRIPT",
            "mjs, JAVASCRIPT",
            "typescript, TYPESCRIPT",
            "tsx, TYPESCRIPT"
    })
    void testFromString(String value, Grammar expected) {
        assertEquals(expected, Grammar.fromString(value));
    }

    @Test
    void testFromStringRejectsUnknownGrammar() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Grammar.fromString("cobol"));
        assertTrue(e.getMessage().contains("Unknown grammar: cobol"));
        assertTrue(e.getMessage().contains("python, java, javascript, typescript"));
    }

    @Test
    void testFromStringRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> Grammar.fromString(null));
    }

    @Test
    void testFromPath() {
        assertEquals(Optional.of(Grammar.PYTHON), Grammar.fromPath(Path.of("pkg", "module.py")));
        assertEquals(Optional.of(Grammar.JAVA), Grammar.fromPath(Path.of("App.JAVA")));
        assertEquals(Optional.of(Grammar.TYPESCRIPT), Grammar.fromPath(Path.of("view.tsx")));
        assertEquals(Optional.of(Grammar.JAVASCRIPT), Grammar.fromPath(Path.of("index.cjs")));
    }

    @Test
    void testDeclarationFilesAndUnknownExtensionsAreSkipped() {
        assertTrue(Grammar.fromPath(Path.of("types.d.ts")).isEmpty());
        assertTrue(Grammar.fromPath(Path.of("README.md")).isEmpty());
        assertTrue(Grammar.fromPath(Path.of("Makefile")).isEmpty());
    }

    @Test
    void testAnalysisModes() {
        assertEquals(AnalysisMode.STRUCTURAL, Grammar.PYTHON.getMode());
        assertEquals(AnalysisMode.STRUCTURAL, Grammar.JAVA.getMode());
        assertEquals(AnalysisMode.TOKEN_HEURISTIC, Grammar.JAVASCRIPT.getMode());
        assertEquals(AnalysisMode.TOKEN_HEURISTIC, Grammar.TYPESCRIPT.getMode());
        assertTrue(Grammar.PYTHON.blocksNeedStatement());
        assertFalse(Grammar.JAVA.blocksNeedStatement());
    }
}
