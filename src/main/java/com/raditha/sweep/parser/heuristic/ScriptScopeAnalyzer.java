package com.raditha.sweep.parser.heuristic;

import com.raditha.sweep.model.AnalysisMode;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.Grammar;
import com.raditha.sweep.model.Range;
import com.raditha.sweep.model.WriteSite;
import com.raditha.sweep.parser.SourceAnalyzer;
import com.raditha.sweep.scope.ScopeGraph;
import com.raditha.sweep.scope.ScopeGraphBuilder;

import java.util.HashSet;
import java.util.Set;

/**
 * Token heuristic for JavaScript and TypeScript.
 * <p>
 * Declarations are recognised only when {@code const}, {@code let} or {@code var}
 * starts a line and declares a single plain name. Every other occurrence of an
 * identifier outside comments, including inside strings and templates, counts as a
 * read. Everything lands in the module scope.
 */
public class ScriptScopeAnalyzer implements SourceAnalyzer {

    private static final Set<String> DECLARATION_KEYWORDS = Set.of("const", "let", "var");

    /**
     * Last characters of a line after which an expression obviously continues.
     */
    private static final String CONTINUES_AFTER = "=+-*/%&|^!?:,.(<[{~";

    /**
     * First characters of a line that continue the previous expression.
     */
    private static final String CONTINUES_WITH = ".?:+-*/%&|^,=";

    public ScriptScopeAnalyzer(Grammar grammar) {
        if (grammar.getMode() != AnalysisMode.TOKEN_HEURISTIC) {
            throw new IllegalArgumentException("Grammar " + grammar.getTag() + " is not analysed heuristically");
        }
    }

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.TOKEN_HEURISTIC;
    }

    @Override
    public ScopeGraph buildScopeGraph(String source) {
        ScriptText text = new ScriptText(source);
        ScopeGraphBuilder builder = new ScopeGraphBuilder(AnalysisMode.TOKEN_HEURISTIC);
        Set<Integer> declaredNames = new HashSet<>();

        for (int line = 1; line <= text.lineCount(); line++) {
            scanDeclaration(text, line, builder, declaredNames);
        }
        loadIdentifiers(text, builder, declaredNames);
        return builder.build();
    }

    /**
     * Record the declaration starting on a line, if any.
     *
     * @param declaredNames receives the offset of each declared name so it is not
     *                      counted as a read
     */
    private void scanDeclaration(ScriptText text, int line, ScopeGraphBuilder builder, Set<Integer> declaredNames) {
        int lineEnd = text.lineEnd(line);
        int i = skipBlanks(text, text.lineStart(line), lineEnd);
        if (i >= lineEnd || text.isLiteral(i)) {
            return;
        }
        String keyword = word(text, i);
        if (!DECLARATION_KEYWORDS.contains(keyword)) {
            return;
        }
        int afterKeyword = i + keyword.length();
        int nameStart = skipBlanks(text, afterKeyword, lineEnd);
        if (nameStart == afterKeyword || nameStart >= lineEnd) {
            return;
        }
        char first = text.charAt(nameStart);
        if (first == '{' || first == '[') {
            builder.warn(ErrorRecord.ambiguous("Destructuring declaration; keeping all of its names", line));
            return;
        }
        String name = word(text, nameStart);
        if (name.isEmpty()) {
            return;
        }

        int cursor = skipBlanks(text, nameStart + name.length(), text.length());
        if (cursor < text.length() && text.isCode(cursor, ':')) {
            cursor = skipTypeAnnotation(text, cursor + 1);
        }
        boolean initialized = cursor < text.length() && text.isCode(cursor, '=')
                && !(cursor + 1 < text.length() && (text.charAt(cursor + 1) == '=' || text.charAt(cursor + 1) == '>'));
        boolean bare = cursor >= text.length() || text.isCode(cursor, ';') || text.isCode(cursor, ',')
                || text.charAt(cursor) == '\n' || text.charAt(cursor) == '\r';
        if (!initialized && !bare) {
            return;
        }

        StatementEnd end = findStatementEnd(text, cursor);
        if (end.multipleDeclarators()) {
            builder.warn(ErrorRecord.ambiguous("Declaration of several variables in one statement; keeping all of them",
                    line));
            return;
        }

        Range range = new Range(line, text.lineOf(end.offset()), i - text.lineStart(line) + 1,
                text.columnOf(end.offset()));
        WriteSite site = builder.site(range, false, WriteSite.NO_BLOCK, unremovableReason(text, line, end));
        builder.write(name, site);
        declaredNames.add(nameStart);
    }

    private String unremovableReason(ScriptText text, int line, StatementEnd end) {
        int endLine = text.lineOf(end.offset());
        String endContent = text.codeLine(endLine);
        if (!endContent.substring(Math.min(endContent.length(), text.columnOf(end.offset()))).isBlank()) {
            return "shares its line with other code";
        }
        String previous = previousCodeLine(text, line);
        if (previous.endsWith(")") || previous.endsWith("=>")
                || endsWithWord(previous, "else") || endsWithWord(previous, "do")) {
            return "may be the body of a control statement without braces";
        }
        return null;
    }

    /**
     * Skip a TypeScript annotation up to the initializer or the end of the declarator.
     *
     * @return offset of the {@code =}, {@code ;}, {@code ,} or line break ending the type
     */
    private static int skipTypeAnnotation(ScriptText text, int from) {
        int depth = 0;
        int i = from;
        while (i < text.length()) {
            if (text.isLiteral(i)) {
                i++;
                continue;
            }
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';
            if (c == '(' || c == '[' || c == '{' || c == '<') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}' || c == '>') && !(c == '>' && i > 0 && text.charAt(i - 1) == '=')) {
                depth--;
            } else if (depth == 0 && c == '=' && next != '>' && next != '=') {
                return i;
            } else if (depth == 0 && (c == ';' || c == ',' || c == '\n' || c == '\r')) {
                return i;
            }
            if (c == '=' && next == '>') {
                i += 2;
                continue;
            }
            i++;
        }
        return i;
    }

    /**
     * Find the last character of the statement: a {@code ;} at bracket depth zero, or
     * the end of a line after which no expression could continue.
     */
    private static StatementEnd findStatementEnd(ScriptText text, int from) {
        int depth = 0;
        boolean comma = false;
        int lastCode = Math.max(0, from - 1);
        for (int i = from; i < text.length(); i++) {
            if (text.isLiteral(i)) {
                lastCode = i;
                continue;
            }
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth < 0) {
                    return new StatementEnd(lastCode, comma);
                }
            } else if (depth == 0 && c == ';') {
                return new StatementEnd(i, comma);
            } else if (depth == 0 && c == ',') {
                comma = true;
            } else if (depth == 0 && (c == '\n' || c == '\r') && lineEndsStatement(text, lastCode, i)) {
                return new StatementEnd(lastCode, comma);
            }
            if (!Character.isWhitespace(c)) {
                lastCode = i;
            }
        }
        return new StatementEnd(lastCode, comma);
    }

    private static boolean lineEndsStatement(ScriptText text, int lastCode, int lineBreak) {
        if (!text.isLiteral(lastCode) && CONTINUES_AFTER.indexOf(text.charAt(lastCode)) >= 0) {
            return false;
        }
        int next = lineBreak;
        while (next < text.length() && Character.isWhitespace(text.charAt(next))) {
            next++;
        }
        return next >= text.length() || text.isLiteral(next) || CONTINUES_WITH.indexOf(text.charAt(next)) < 0;
    }

    private static void loadIdentifiers(ScriptText text, ScopeGraphBuilder builder, Set<Integer> declaredNames) {
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (isIdentifierStart(c) && (i == 0 || !isIdentifierPart(text.charAt(i - 1)))) {
                String name = word(text, i);
                if (!declaredNames.contains(i)) {
                    builder.load(name, text.lineOf(i));
                }
                i += name.length();
            } else {
                i++;
            }
        }
    }

    private static String previousCodeLine(ScriptText text, int line) {
        for (int previous = line - 1; previous >= 1; previous--) {
            String content = text.codeLine(previous).strip();
            if (!content.isEmpty()) {
                return content;
            }
        }
        return "";
    }

    private static boolean endsWithWord(String line, String word) {
        if (!line.endsWith(word)) {
            return false;
        }
        int before = line.length() - word.length() - 1;
        return before < 0 || !isIdentifierPart(line.charAt(before));
    }

    private static int skipBlanks(ScriptText text, int from, int limit) {
        int i = from;
        while (i < limit && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static String word(ScriptText text, int from) {
        if (from >= text.length() || !isIdentifierStart(text.charAt(from))) {
            return "";
        }
        int i = from + 1;
        while (i < text.length() && isIdentifierPart(text.charAt(i))) {
            i++;
        }
        StringBuilder sb = new StringBuilder(i - from);
        for (int k = from; k < i; k++) {
            sb.append(text.charAt(k));
        }
        return sb.toString();
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || c == '$' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || c == '$' || Character.isLetterOrDigit(c);
    }

    private record StatementEnd(int offset, boolean multipleDeclarators) {
    }
}
