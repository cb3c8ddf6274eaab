package com.raditha.sweep.parser.python;

import com.raditha.sweep.parser.SourceParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Groups Python tokens into statements and nested suites.
 * <p>
 * Expressions are not parsed into trees here: the scope walker reads them as token
 * runs. What this parser guarantees is the statement structure: every compound
 * header that ends in a colon owns an indented suite, indentation is consistent,
 * and statements separated by semicolons are split apart.
 */
public class PythonParser {

    /**
     * Keywords that can only start a compound statement.
     */
    static final Set<String> COMPOUND_KEYWORDS = Set.of(
            "if", "elif", "else", "while", "for", "try", "except", "finally",
            "with", "def", "class", "async");

    /**
     * Soft keywords: compound only when the line ends with a colon.
     */
    static final Set<String> SOFT_COMPOUND_KEYWORDS = Set.of("match", "case");

    private final List<PyToken> tokens;
    private int pos;

    public PythonParser(List<PyToken> tokens) {
        this.tokens = tokens;
    }

    public static PyBlock parse(String source) throws SourceParseException {
        return new PythonParser(new PythonLexer(source).tokenize()).parseModule();
    }

    public PyBlock parseModule() throws SourceParseException {
        PyBlock module = parseStatements(false);
        PyToken end = peek();
        if (end.type() != PyTokenType.END) {
            throw new SourceParseException("invalid syntax", end.line());
        }
        return module;
    }

    private PyBlock parseStatements(boolean nested) throws SourceParseException {
        List<PyStatement> statements = new ArrayList<>();
        while (true) {
            PyToken next = peek();
            switch (next.type()) {
                case END:
                    return new PyBlock(statements);
                case DEDENT:
                    if (nested) {
                        return new PyBlock(statements);
                    }
                    throw new SourceParseException("unindent does not match any outer indentation level", next.line());
                case INDENT:
                    throw new SourceParseException("unexpected indent", next.line());
                case NEWLINE:
                    pos++;
                    break;
                default:
                    statements.addAll(splitLogicalLine(readLogicalLine()));
            }
        }
    }

    private List<PyToken> readLogicalLine() {
        List<PyToken> line = new ArrayList<>();
        while (peek().type() != PyTokenType.NEWLINE && peek().type() != PyTokenType.END) {
            line.add(tokens.get(pos++));
        }
        if (peek().type() == PyTokenType.NEWLINE) {
            pos++;
        }
        return line;
    }

    private List<PyStatement> splitLogicalLine(List<PyToken> line) throws SourceParseException {
        PyToken first = line.get(0);
        boolean endsWithColon = line.get(line.size() - 1).isOp(":");

        if (!endsWithColon && isCompoundKeyword(first)) {
            // header and body on one line, e.g. "if ready: go()"
            return List.of(new PyStatement(line, null, true));
        }

        List<List<PyToken>> parts = new ArrayList<>();
        List<PyToken> current = new ArrayList<>();
        for (PyToken token : line) {
            if (token.isOp(";")) {
                if (!current.isEmpty()) {
                    parts.add(current);
                }
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        if (!current.isEmpty()) {
            parts.add(current);
        }
        if (parts.isEmpty()) {
            throw new SourceParseException("invalid syntax", first.line());
        }

        boolean shared = parts.size() > 1;
        List<PyStatement> statements = new ArrayList<>();
        for (int i = 0; i < parts.size() - 1; i++) {
            statements.add(new PyStatement(parts.get(i), null, shared));
        }
        List<PyToken> last = parts.get(parts.size() - 1);
        if (!endsWithColon) {
            statements.add(new PyStatement(last, null, shared));
            return statements;
        }

        PyToken keyword = last.get(0);
        if (shared || !(isCompoundKeyword(keyword) || isSoftKeyword(keyword))) {
            throw new SourceParseException("invalid syntax", keyword.line());
        }
        if (peek().type() != PyTokenType.INDENT) {
            throw new SourceParseException("expected an indented block after '" + keyword.text() + "'",
                    keyword.line());
        }
        pos++;
        PyBlock body = parseStatements(true);
        if (peek().type() != PyTokenType.DEDENT) {
            throw new SourceParseException("invalid syntax", peek().line());
        }
        pos++;
        statements.add(new PyStatement(last, body, false));
        return statements;
    }

    private static boolean isCompoundKeyword(PyToken token) {
        return token.type() == PyTokenType.NAME && COMPOUND_KEYWORDS.contains(token.text());
    }

    private static boolean isSoftKeyword(PyToken token) {
        return token.type() == PyTokenType.NAME && SOFT_COMPOUND_KEYWORDS.contains(token.text());
    }

    private PyToken peek() {
        return tokens.get(Math.min(pos, tokens.size() - 1));
    }
}
