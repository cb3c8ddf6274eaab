package com.raditha.sweep.model;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Source grammars the engine understands, each with its declared analysis mode.
 */
public enum Grammar {
    PYTHON("python", AnalysisMode.STRUCTURAL, true, ".py", ".pyi"),
    JAVA("java", AnalysisMode.STRUCTURAL, false, ".java"),
    JAVASCRIPT("javascript", AnalysisMode.TOKEN_HEURISTIC, false, ".js", ".jsx", ".mjs", ".cjs"),
    TYPESCRIPT("typescript", AnalysisMode.TOKEN_HEURISTIC, false, ".ts", ".tsx", ".mts", ".cts");

    private final String tag;
    private final AnalysisMode mode;
    private final boolean blocksNeedStatement;
    private final List<String> extensions;

    Grammar(String tag, AnalysisMode mode, boolean blocksNeedStatement, String... extensions) {
        this.tag = tag;
        this.mode = mode;
        this.blocksNeedStatement = blocksNeedStatement;
        this.extensions = List.of(extensions);
    }

    public String getTag() {
        return tag;
    }

    public AnalysisMode getMode() {
        return mode;
    }

    /**
     * True when an indented block must keep at least one statement (Python suites).
     */
    public boolean blocksNeedStatement() {
        return blocksNeedStatement;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    /**
     * Convert a grammar tag or a file extension to a Grammar.
     *
     * @throws IllegalArgumentException if the value names no grammar
     */
    public static Grammar fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Grammar value cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Grammar grammar : values()) {
            if (grammar.tag.equals(normalized) || grammar.extensions.contains("." + normalized)) {
                return grammar;
            }
        }
        throw new IllegalArgumentException("Unknown grammar: " + value + ". Must be one of: "
                + String.join(", ", Arrays.stream(values()).map(Grammar::getTag).toList()));
    }

    /**
     * Select the grammar for a file by its extension.
     */
    public static Optional<Grammar> fromPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".d.ts")) {
            // declaration files carry no executable bindings
            return Optional.empty();
        }
        for (Grammar grammar : values()) {
            for (String extension : grammar.extensions) {
                if (name.endsWith(extension)) {
                    return Optional.of(grammar);
                }
            }
        }
        return Optional.empty();
    }
}
