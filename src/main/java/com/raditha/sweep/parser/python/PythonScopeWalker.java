package com.raditha.sweep.parser.python;

import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.ScopeKind;
import com.raditha.sweep.model.WriteSite;
import com.raditha.sweep.parser.SourceParseException;
import com.raditha.sweep.scope.ScopeGraphBuilder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks a parsed Python module and feeds bindings and references to a
 * {@link ScopeGraphBuilder}.
 * <p>
 * Expressions are read as token runs: a name is a load unless it is an attribute
 * after a dot, a keyword argument, or the target of an assignment. Anything the
 * walker cannot classify is treated as a load, which can only keep bindings alive.
 */
class PythonScopeWalker {

    static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break",
            "class", "continue", "def", "del", "elif", "else", "except", "finally", "for",
            "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not", "or",
            "pass", "raise", "return", "try", "while", "with", "yield");

    private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ScopeGraphBuilder builder;

    PythonScopeWalker(ScopeGraphBuilder builder) {
        this.builder = builder;
    }

    void walkModule(PyBlock module) throws SourceParseException {
        walkBlock(module, false, false);
    }

    private void walkBlock(PyBlock block, boolean inLoop, boolean requiresStatement) throws SourceParseException {
        int blockId = builder.registerBlock(block.size(), requiresStatement);
        for (PyStatement statement : block.statements()) {
            walkStatement(statement, inLoop, blockId);
        }
    }

    private void walkStatement(PyStatement statement, boolean inLoop, int blockId) throws SourceParseException {
        List<PyToken> tokens = statement.tokens();
        int start = 0;
        if (tokens.get(0).isName("async") && tokens.size() > 1) {
            start = 1;
        }
        PyToken first = tokens.get(start);
        if (first.isOp("@")) {
            walkExpression(tokens, start + 1, tokens.size());
            return;
        }
        if (first.type() == PyTokenType.NAME) {
            switch (first.text()) {
                case "def" -> {
                    walkFunction(statement, start);
                    return;
                }
                case "class" -> {
                    walkClass(statement, start);
                    return;
                }
                case "for" -> {
                    walkFor(statement, start, inLoop);
                    return;
                }
                case "while" -> {
                    walkHeader(statement, start + 1, true);
                    return;
                }
                case "if", "elif", "else", "try", "finally" -> {
                    walkHeader(statement, start + 1, inLoop);
                    return;
                }
                case "except" -> {
                    walkExcept(statement, start, inLoop);
                    return;
                }
                case "with" -> {
                    walkWith(statement, start, inLoop);
                    return;
                }
                case "global", "nonlocal" -> {
                    tokens.stream().skip(start + 1L)
                            .filter(t -> t.type() == PyTokenType.NAME)
                            .forEach(t -> builder.declareOuter(t.text(), t.line()));
                    return;
                }
                case "import", "from" -> {
                    tokens.stream()
                            .filter(t -> t.type() == PyTokenType.NAME && !KEYWORDS.contains(t.text()))
                            .forEach(t -> builder.store(t.text(), t.line()));
                    return;
                }
                case "match", "case" -> {
                    if (statement.hasBody()) {
                        walkHeader(statement, start + 1, inLoop);
                        return;
                    }
                }
                default -> {
                    // simple statement
                }
            }
        }
        walkSimple(statement, inLoop, blockId);
    }

    /**
     * Header expression up to the colon, then the body.
     */
    private void walkHeader(PyStatement statement, int from, boolean bodyInLoop) throws SourceParseException {
        List<PyToken> tokens = statement.tokens();
        int colon = headerColon(tokens, from);
        if (colon < 0) {
            walkExpression(tokens, from, tokens.size());
            return;
        }
        walkExpression(tokens, from, colon);
        walkBody(statement, colon, bodyInLoop);
    }

    private void walkBody(PyStatement statement, int colon, boolean inLoop) throws SourceParseException {
        if (statement.hasBody()) {
            walkBlock(statement.body(), inLoop, true);
            return;
        }
        List<PyToken> tokens = statement.tokens();
        List<PyToken> part = new ArrayList<>();
        for (int i = colon + 1; i < tokens.size(); i++) {
            PyToken token = tokens.get(i);
            if (token.isOp(";")) {
                walkInline(part, inLoop);
                part = new ArrayList<>();
            } else {
                part.add(token);
            }
        }
        walkInline(part, inLoop);
    }

    private void walkInline(List<PyToken> part, boolean inLoop) throws SourceParseException {
        if (!part.isEmpty()) {
            walkStatement(new PyStatement(part, null, true), inLoop, WriteSite.NO_BLOCK);
        }
    }

    private void walkFunction(PyStatement statement, int start) throws SourceParseException {
        List<PyToken> tokens = statement.tokens();
        if (tokens.size() < start + 4 || tokens.get(start + 1).type() != PyTokenType.NAME
                || !tokens.get(start + 2).isOp("(")) {
            throw new SourceParseException("invalid function definition", tokens.get(start).line());
        }
        PyToken name = tokens.get(start + 1);
        builder.store(name.text(), name.line());

        int close = matchingBracket(tokens, start + 2);
        List<PyToken> parameters = parameters(tokens, start + 3, close);

        int colon;
        if (close + 1 < tokens.size() && tokens.get(close + 1).isOp("->")) {
            colon = headerColon(tokens, close + 2);
            walkExpression(tokens, close + 2, colon < 0 ? tokens.size() : colon);
        } else {
            colon = close + 1;
        }
        if (colon < 0 || colon >= tokens.size() || !tokens.get(colon).isOp(":")) {
            throw new SourceParseException("expected ':' after function signature", name.line());
        }

        builder.openScope(ScopeKind.FUNCTION, tokens.get(start).line());
        parameters.forEach(p -> builder.parameter(p.text(), p.line()));
        walkBody(statement, colon, false);
        builder.closeScope();
    }

    private void walkClass(PyStatement statement, int start) throws SourceParseException {
        List<PyToken> tokens = statement.tokens();
        if (tokens.size() < start + 3 || tokens.get(start + 1).type() != PyTokenType.NAME) {
            throw new SourceParseException("invalid class definition", tokens.get(start).line());
        }
        PyToken name = tokens.get(start + 1);
        builder.store(name.text(), name.line());
        int colon = headerColon(tokens, start + 2);
        if (colon < 0) {
            throw new SourceParseException("expected ':' after class header", name.line());
        }
        walkExpression(tokens, start + 2, colon);

        builder.openScope(ScopeKind.CLASS, tokens.get(start).line());
        walkBody(statement, colon, false);
        builder.closeScope();
    }

    private void walkFor(PyStatement statement, int start, boolean inLoop) throws SourceParseException {
        List<PyToken> tokens = statement.tokens();
        int in = -1;
        int depth = 0;
        for (int i = start + 1; i < tokens.size(); i++) {
            PyToken token = tokens.get(i);
            depth += bracketDelta(token);
            if (depth == 0 && token.isName("in")) {
                in = i;
                break;
            }
        }
        if (in < 0) {
            throw new SourceParseException("expected 'in' in for statement", tokens.get(start).line());
        }
        storeNames(tokens, start + 1, in);
        int colon = headerColon(tokens, in + 1);
        if (colon < 0) {
            throw new SourceParseException("expected ':' after for statement", tokens.get(start).line());
        }
        walkExpression(tokens, in + 1, colon);
        walkBody(statement, colon, true);
    }

    private void walkExcept(PyStatement statement, int start, boolean inLoop) throws SourceParseException {
        List<PyToken> tokens = statement.tokens();
        int colon = headerColon(tokens, start + 1);
        if (colon < 0) {
            throw new SourceParseException("expected ':' after except clause", tokens.get(start).line());
        }
        int as = indexOfName(tokens, "as", start + 1, colon);
        if (as < 0) {
            walkExpression(tokens, start + 1, colon);
        } else {
            walkExpression(tokens, start + 1, as);
            storeNames(tokens, as + 1, colon);
        }
        walkBody(statement, colon, inLoop);
    }

    /**
     * {@code with a as b, c as (d, e):} loads the context expressions and stores the
     * names after each {@code as}.
     */
    private void walkWith(PyStatement statement, int start, boolean inLoop) throws SourceParseException {
        List<PyToken> tokens = statement.tokens();
        int colon = headerColon(tokens, start + 1);
        if (colon < 0) {
            throw new SourceParseException("expected ':' after with statement", tokens.get(start).line());
        }
        boolean[] target = new boolean[tokens.size()];
        for (int i = start + 1; i < colon; i++) {
            if (!tokens.get(i).isName("as")) {
                continue;
            }
            target[i] = true;
            int depth = 0;
            for (int j = i + 1; j < colon; j++) {
                PyToken token = tokens.get(j);
                if (depth == 0 && (token.isOp(",") || token.isCloseBracket())) {
                    break;
                }
                depth += bracketDelta(token);
                if (token.type() == PyTokenType.NAME) {
                    builder.store(token.text(), token.line());
                }
                target[j] = true;
            }
        }
        int runStart = start + 1;
        for (int i = start + 1; i <= colon; i++) {
            if (i == colon || target[i]) {
                walkExpression(tokens, runStart, i);
                runStart = i + 1;
            }
        }
        walkBody(statement, colon, inLoop);
    }

    private void walkSimple(PyStatement statement, boolean inLoop, int blockId) throws SourceParseException {
        List<PyToken> tokens = statement.tokens();
        List<Integer> equals = new ArrayList<>();
        int augmented = -1;
        int annotation = -1;
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            PyToken token = tokens.get(i);
            if (token.isOpenBracket() || token.isCloseBracket()) {
                depth += bracketDelta(token);
                continue;
            }
            if (depth != 0) {
                continue;
            }
            if (token.isName("lambda")) {
                break;
            }
            if (token.isOp("=")) {
                equals.add(i);
            } else if (equals.isEmpty() && token.type() == PyTokenType.OP
                    && AUGMENTED_ASSIGNMENTS.contains(token.text())) {
                augmented = i;
                break;
            } else if (equals.isEmpty() && annotation < 0 && token.isOp(":")) {
                annotation = i;
            }
        }

        if (augmented >= 0) {
            // x += 1 reads x
            walkExpression(tokens, 0, augmented);
            walkExpression(tokens, augmented + 1, tokens.size());
            return;
        }
        if (equals.isEmpty()) {
            if (annotation > 0) {
                walkTargetWithoutValue(tokens, annotation);
                walkExpression(tokens, annotation + 1, tokens.size());
            } else {
                walkExpression(tokens, 0, tokens.size());
            }
            return;
        }

        int lastEquals = equals.get(equals.size() - 1);
        walkExpression(tokens, lastEquals + 1, tokens.size());

        List<int[]> targets = new ArrayList<>();
        int targetStart = 0;
        for (int eq : equals) {
            targets.add(new int[] {targetStart, eq});
            targetStart = eq + 1;
        }
        if (annotation > 0 && annotation < equals.get(0)) {
            walkExpression(tokens, annotation + 1, equals.get(0));
            targets.set(0, new int[] {0, annotation});
        }
        if (tokens.get(0).isName("type") && equals.get(0) == 2 && tokens.get(1).type() == PyTokenType.NAME) {
            // type alias statement: type Alias = ...
            builder.store(tokens.get(1).text(), tokens.get(1).line());
            return;
        }

        WriteSite site = builder.site(statement.range(), inLoop, blockId, unremovableReason(statement, targets));
        for (int[] target : targets) {
            walkTarget(tokens, target[0], target[1], site);
        }
    }

    private void walkTarget(List<PyToken> tokens, int from, int to, WriteSite site) throws SourceParseException {
        if (to - from == 1 && isPlainName(tokens.get(from))) {
            builder.write(tokens.get(from).text(), site);
        } else if (isAttributeOrSubscript(tokens, from, to)) {
            walkExpression(tokens, from, to);
        } else {
            builder.warn(ErrorRecord.ambiguous("Cannot classify assignment target '" + text(tokens, from, to)
                    + "'; keeping all of its names", tokens.get(from).line()));
            walkExpression(tokens, from, to);
        }
    }

    /**
     * {@code x: int} declares without binding a value.
     */
    private void walkTargetWithoutValue(List<PyToken> tokens, int annotation) throws SourceParseException {
        if (annotation == 1 && isPlainName(tokens.get(0))) {
            builder.store(tokens.get(0).text(), tokens.get(0).line());
        } else {
            walkExpression(tokens, 0, annotation);
        }
    }

    private String unremovableReason(PyStatement statement, List<int[]> targets) {
        if (statement.sharesLine()) {
            return "shares its line with other statements";
        }
        if (statement.tokens().stream().anyMatch(t -> t.isOp(":="))) {
            return "contains an assignment expression";
        }
        for (int[] target : targets) {
            if (target[1] - target[0] != 1 || !isPlainName(statement.tokens().get(target[0]))) {
                return "also assigns to '" + text(statement.tokens(), target[0], target[1]) + "'";
            }
        }
        return null;
    }

    /**
     * Walk an expression token run, recording loads and nested lambda scopes.
     */
    private void walkExpression(List<PyToken> tokens, int from, int to) throws SourceParseException {
        Deque<String> brackets = new ArrayDeque<>();
        int i = from;
        while (i < to) {
            PyToken token = tokens.get(i);
            switch (token.type()) {
                case OP -> {
                    int close = token.isOpenBracket() ? closingBracket(tokens, i, to) : -1;
                    if (close > 0 && comprehensionFor(tokens, i + 1, close) > 0) {
                        walkComprehension(tokens, i, close);
                        i = close + 1;
                    } else if (token.isOpenBracket()) {
                        brackets.push(token.text());
                    } else if (token.isCloseBracket() && !brackets.isEmpty()) {
                        brackets.pop();
                    }
                    i++;
                }
                case STRING -> {
                    loadFormattedNames(token);
                    i++;
                }
                case NAME -> {
                    if (token.isName("lambda")) {
                        i = walkLambda(tokens, i, to);
                    } else {
                        classifyName(tokens, i, to, brackets);
                        i++;
                    }
                }
                default -> i++;
            }
        }
    }

    /**
     * A comprehension or generator expression runs in its own scope whose locals are
     * the loop targets. Only the first iterable is evaluated in the enclosing scope.
     */
    private void walkComprehension(List<PyToken> tokens, int open, int close) throws SourceParseException {
        // clause i covers tokens [start, end); the first one is the element, with no keyword
        List<int[]> clauses = new ArrayList<>();
        int depth = 0;
        int keyword = -1;
        for (int i = open + 1; i <= close; i++) {
            PyToken token = tokens.get(i);
            boolean boundary = i == close || (depth == 0 && (token.isName("for")
                    || (token.isName("if") && keyword >= 0)
                    || (token.isName("async") && i + 1 < close && tokens.get(i + 1).isName("for"))));
            if (boundary) {
                clauses.add(new int[] {keyword, i});
                if (token.isName("async")) {
                    i++;
                }
                keyword = i;
            } else {
                depth += bracketDelta(token);
            }
        }

        PyToken firstFor = tokens.get(clauses.get(1)[0]);
        int firstIn = indexOfName(tokens, "in", clauses.get(1)[0] + 1, clauses.get(1)[1]);
        if (firstIn < 0) {
            throw new SourceParseException("expected 'in' in comprehension", firstFor.line());
        }
        walkExpression(tokens, firstIn + 1, clauses.get(1)[1]);

        builder.openScope(ScopeKind.CLOSURE, tokens.get(open).line());
        for (int[] clause : clauses.subList(1, clauses.size())) {
            if (tokens.get(clause[0]).isName("for")) {
                int in = indexOfName(tokens, "in", clause[0] + 1, clause[1]);
                if (in < 0) {
                    throw new SourceParseException("expected 'in' in comprehension", tokens.get(clause[0]).line());
                }
                declareComprehensionTargets(tokens, clause[0] + 1, in);
            }
        }
        walkExpression(tokens, open + 1, clauses.get(0)[1]);
        for (int c = 2; c < clauses.size(); c++) {
            int[] clause = clauses.get(c);
            if (tokens.get(clause[0]).isName("if")) {
                walkExpression(tokens, clause[0] + 1, clause[1]);
            } else {
                walkExpression(tokens, indexOfName(tokens, "in", clause[0] + 1, clause[1]) + 1, clause[1]);
            }
        }
        builder.closeScope();
    }

    private void declareComprehensionTargets(List<PyToken> tokens, int from, int to) throws SourceParseException {
        for (int i = from; i < to; i++) {
            PyToken token = tokens.get(i);
            if (token.isOp(".") || token.isOp("[")) {
                // for obj.attr in ...: assigns into an existing object
                walkExpression(tokens, from, to);
                return;
            }
        }
        for (int i = from; i < to; i++) {
            if (isPlainName(tokens.get(i))) {
                builder.parameter(tokens.get(i).text(), tokens.get(i).line());
            }
        }
    }

    /**
     * Index of the first {@code for} directly inside a bracket pair, or -1.
     */
    private static int comprehensionFor(List<PyToken> tokens, int from, int to) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            PyToken token = tokens.get(i);
            if (depth == 0 && token.isName("for") && i > from) {
                return i;
            }
            depth += bracketDelta(token);
        }
        return -1;
    }

    /**
     * Index of the bracket closing the one at {@code open}, or -1 when it lies at or
     * beyond {@code to}.
     */
    private static int closingBracket(List<PyToken> tokens, int open, int to) {
        int depth = 0;
        for (int i = open; i < to; i++) {
            depth += bracketDelta(tokens.get(i));
            if (depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private void classifyName(List<PyToken> tokens, int i, int to, Deque<String> brackets) {
        PyToken token = tokens.get(i);
        if (KEYWORDS.contains(token.text())) {
            return;
        }
        if (i > 0 && tokens.get(i - 1).isOp(".")) {
            return;
        }
        PyToken next = i + 1 < to ? tokens.get(i + 1) : null;
        if (next != null && next.isOp("=") && "(".equals(brackets.peek())) {
            // keyword argument name
            return;
        }
        if (next != null && next.isOp(":=")) {
            builder.store(token.text(), token.line());
            return;
        }
        builder.load(token.text(), token.line());
    }

    /**
     * @return index of the first token after the lambda body
     */
    private int walkLambda(List<PyToken> tokens, int lambda, int to) throws SourceParseException {
        int colon = -1;
        int depth = 0;
        for (int i = lambda + 1; i < to; i++) {
            PyToken token = tokens.get(i);
            depth += bracketDelta(token);
            if (depth == 0 && token.isOp(":")) {
                colon = i;
                break;
            }
        }
        if (colon < 0) {
            throw new SourceParseException("expected ':' in lambda", tokens.get(lambda).line());
        }
        List<PyToken> parameters = parameters(tokens, lambda + 1, colon);

        int end = colon + 1;
        int pendingColons = 0;
        depth = 0;
        while (end < to) {
            PyToken token = tokens.get(end);
            if (token.isCloseBracket() && depth == 0) {
                break;
            }
            if (depth == 0) {
                if (token.isOp(",") || token.isName("for") || token.isName("async")) {
                    break;
                }
                if (token.isName("lambda")) {
                    pendingColons++;
                } else if (token.isOp(":")) {
                    if (pendingColons == 0) {
                        break;
                    }
                    pendingColons--;
                }
            }
            depth += bracketDelta(token);
            end++;
        }

        builder.openScope(ScopeKind.CLOSURE, tokens.get(lambda).line());
        parameters.forEach(p -> builder.parameter(p.text(), p.line()));
        walkExpression(tokens, colon + 1, end);
        builder.closeScope();
        return end;
    }

    /**
     * Parse a parameter list, loading annotations and defaults in the enclosing scope.
     *
     * @return the parameter name tokens
     */
    private List<PyToken> parameters(List<PyToken> tokens, int from, int to) throws SourceParseException {
        List<PyToken> names = new ArrayList<>();
        int segmentStart = from;
        int depth = 0;
        for (int i = from; i <= to; i++) {
            boolean boundary = i == to;
            if (!boundary) {
                PyToken token = tokens.get(i);
                if (depth == 0 && token.isOp(",")) {
                    boundary = true;
                } else {
                    depth += bracketDelta(token);
                }
            }
            if (boundary) {
                parameter(tokens, segmentStart, i, names);
                segmentStart = i + 1;
            }
        }
        return names;
    }

    private void parameter(List<PyToken> tokens, int from, int to, List<PyToken> names) throws SourceParseException {
        int i = from;
        while (i < to && (tokens.get(i).isOp("*") || tokens.get(i).isOp("**"))) {
            i++;
        }
        if (i >= to || tokens.get(i).isOp("/")) {
            return;
        }
        PyToken name = tokens.get(i);
        if (!isPlainName(name)) {
            throw new SourceParseException("invalid parameter '" + name.text() + "'", name.line());
        }
        names.add(name);
        int rest = i + 1;
        if (rest < to && tokens.get(rest).isOp(":")) {
            int equals = indexOfOp(tokens, "=", rest + 1, to);
            walkExpression(tokens, rest + 1, equals < 0 ? to : equals);
            rest = equals < 0 ? to : equals;
        }
        if (rest < to && tokens.get(rest).isOp("=")) {
            walkExpression(tokens, rest + 1, to);
        }
    }

    private void storeNames(List<PyToken> tokens, int from, int to) {
        for (int i = from; i < to; i++) {
            PyToken token = tokens.get(i);
            if (isPlainName(token) && !(i > 0 && tokens.get(i - 1).isOp("."))) {
                builder.store(token.text(), token.line());
            }
        }
    }

    /**
     * Names inside the replacement fields of an f-string are reads.
     */
    private void loadFormattedNames(PyToken token) {
        String text = token.text();
        int quote = 0;
        while (quote < text.length() && text.charAt(quote) != '"' && text.charAt(quote) != '\'') {
            quote++;
        }
        if (text.substring(0, quote).toLowerCase().indexOf('f') < 0) {
            return;
        }
        int i = quote;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                i += 2;
                continue;
            }
            if (c != '{') {
                i++;
                continue;
            }
            int depth = 1;
            int j = i + 1;
            while (j < text.length() && depth > 0) {
                if (text.charAt(j) == '{') {
                    depth++;
                } else if (text.charAt(j) == '}') {
                    depth--;
                }
                j++;
            }
            int line = token.line() + (int) text.substring(0, i).chars().filter(ch -> ch == '\n').count();
            loadIdentifiers(text.substring(i + 1, Math.max(i + 1, j - 1)), line);
            i = j;
        }
    }

    private void loadIdentifiers(String expression, int line) {
        Matcher matcher = IDENTIFIER.matcher(expression);
        while (matcher.find()) {
            int before = matcher.start() - 1;
            while (before >= 0 && Character.isWhitespace(expression.charAt(before))) {
                before--;
            }
            boolean attributeOrConversion = before >= 0
                    && (expression.charAt(before) == '.' || expression.charAt(before) == '!');
            if (!attributeOrConversion && !KEYWORDS.contains(matcher.group())) {
                builder.load(matcher.group(), line);
            }
        }
    }

    /**
     * Index of the colon ending a compound header, skipping lambda colons and
     * anything inside brackets. -1 when absent.
     */
    static int headerColon(List<PyToken> tokens, int from) {
        int depth = 0;
        int pendingLambdas = 0;
        for (int i = from; i < tokens.size(); i++) {
            PyToken token = tokens.get(i);
            depth += bracketDelta(token);
            if (depth != 0) {
                continue;
            }
            if (token.isName("lambda")) {
                pendingLambdas++;
            } else if (token.isOp(":")) {
                if (pendingLambdas == 0) {
                    return i;
                }
                pendingLambdas--;
            }
        }
        return -1;
    }

    private static int matchingBracket(List<PyToken> tokens, int open) throws SourceParseException {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            depth += bracketDelta(tokens.get(i));
            if (depth == 0) {
                return i;
            }
        }
        throw new SourceParseException("'" + tokens.get(open).text() + "' was never closed", tokens.get(open).line());
    }

    private static int indexOfName(List<PyToken> tokens, String name, int from, int to) {
        for (int i = from; i < to; i++) {
            if (tokens.get(i).isName(name)) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOfOp(List<PyToken> tokens, String op, int from, int to) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            PyToken token = tokens.get(i);
            if (depth == 0 && token.isOp(op)) {
                return i;
            }
            depth += bracketDelta(token);
        }
        return -1;
    }

    private static int bracketDelta(PyToken token) {
        if (token.isOpenBracket()) {
            return 1;
        }
        return token.isCloseBracket() ? -1 : 0;
    }

    private static boolean isPlainName(PyToken token) {
        return token.type() == PyTokenType.NAME && !KEYWORDS.contains(token.text());
    }

    /**
     * {@code a.b}, {@code a[i]}, {@code a.b[i].c}: assignment into an existing object.
     */
    private static boolean isAttributeOrSubscript(List<PyToken> tokens, int from, int to) {
        if (to - from < 2 || !isPlainName(tokens.get(from))) {
            return false;
        }
        int depth = 0;
        for (int i = from; i < to; i++) {
            PyToken token = tokens.get(i);
            if (depth == 0 && (token.isOp(",") || token.isOp("*"))) {
                return false;
            }
            depth += bracketDelta(token);
        }
        PyToken last = tokens.get(to - 1);
        return last.isOp("]") || (last.type() == PyTokenType.NAME && tokens.get(to - 2).isOp("."));
    }

    private static String text(List<PyToken> tokens, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            PyToken token = tokens.get(i);
            PyToken previous = i > from ? tokens.get(i - 1) : null;
            if (previous != null && (previous.isOp(",")
                    || (token.type() != PyTokenType.OP && previous.type() != PyTokenType.OP))) {
                sb.append(' ');
            }
            sb.append(token.text());
        }
        return sb.toString();
    }
}
