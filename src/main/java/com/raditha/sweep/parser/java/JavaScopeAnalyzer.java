package com.raditha.sweep.parser.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.raditha.sweep.model.AnalysisMode;
import com.raditha.sweep.model.ErrorRecord;
import com.raditha.sweep.model.Range;
import com.raditha.sweep.model.ScopeKind;
import com.raditha.sweep.model.WriteSite;
import com.raditha.sweep.parser.SourceAnalyzer;
import com.raditha.sweep.parser.SourceLines;
import com.raditha.sweep.parser.SourceParseException;
import com.raditha.sweep.scope.ScopeGraph;
import com.raditha.sweep.scope.ScopeGraphBuilder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structural front end for Java built on JavaParser.
 * <p>
 * Only local variables are binding candidates. A local is written by its
 * declaration and by plain {@code =} assignments that resolve to it; fields,
 * parameters, loop variables, resources, catch parameters and pattern variables
 * are never bindings.
 */
public class JavaScopeAnalyzer implements SourceAnalyzer {

    private final ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.STRUCTURAL;
    }

    @Override
    public ScopeGraph buildScopeGraph(String source) throws SourceParseException {
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw toParseException(result.getProblems());
        }
        ScopeGraphBuilder builder = new ScopeGraphBuilder(AnalysisMode.STRUCTURAL);
        result.getResult().get().accept(new ScopeVisitor(builder, SourceLines.of(source)), null);
        return builder.build();
    }

    private static SourceParseException toParseException(List<Problem> problems) {
        if (problems.isEmpty()) {
            return new SourceParseException("Java source could not be parsed", 0);
        }
        Problem first = problems.get(0);
        int line = first.getLocation()
                .flatMap(TokenRange::toRange)
                .map(range -> range.begin.line)
                .orElse(0);
        return new SourceParseException(first.getMessage(), line);
    }

    /**
     * Visitor that mirrors JavaParser's tree into the scope graph.
     */
    private static class ScopeVisitor extends VoidVisitorAdapter<Void> {
        private final ScopeGraphBuilder builder;
        private final SourceLines lines;
        /**
         * Per scope: local name to the nodes its declarations are visible in.
         */
        private final Deque<Map<String, List<Node>>> locals = new ArrayDeque<>();

        ScopeVisitor(ScopeGraphBuilder builder, SourceLines lines) {
            this.builder = builder;
            this.lines = lines;
            this.locals.push(new HashMap<>());
        }

        @Override
        public void visit(MethodDeclaration n, Void arg) {
            open(ScopeKind.FUNCTION, n);
            declareParameters(n.getParameters());
            super.visit(n, arg);
            close();
        }

        @Override
        public void visit(ConstructorDeclaration n, Void arg) {
            open(ScopeKind.FUNCTION, n);
            declareParameters(n.getParameters());
            super.visit(n, arg);
            close();
        }

        @Override
        public void visit(CompactConstructorDeclaration n, Void arg) {
            open(ScopeKind.FUNCTION, n);
            // record components are the implicit parameters of a compact constructor
            n.findAncestor(RecordDeclaration.class).ifPresent(record ->
                    record.getParameters().forEach(p -> builder.parameter(p.getNameAsString(), line(p))));
            super.visit(n, arg);
            close();
        }

        @Override
        public void visit(InitializerDeclaration n, Void arg) {
            open(ScopeKind.FUNCTION, n);
            super.visit(n, arg);
            close();
        }

        @Override
        public void visit(LambdaExpr n, Void arg) {
            open(ScopeKind.CLOSURE, n);
            declareParameters(n.getParameters());
            super.visit(n, arg);
            close();
        }

        @Override
        public void visit(ClassOrInterfaceDeclaration n, Void arg) {
            open(ScopeKind.CLASS, n);
            super.visit(n, arg);
            close();
        }

        @Override
        public void visit(EnumDeclaration n, Void arg) {
            open(ScopeKind.CLASS, n);
            super.visit(n, arg);
            close();
        }

        @Override
        public void visit(RecordDeclaration n, Void arg) {
            open(ScopeKind.CLASS, n);
            super.visit(n, arg);
            close();
        }

        @Override
        public void visit(ObjectCreationExpr n, Void arg) {
            n.getScope().ifPresent(scope -> scope.accept(this, arg));
            n.getArguments().forEach(argument -> argument.accept(this, arg));
            n.getAnonymousClassBody().ifPresent(body -> {
                open(ScopeKind.CLASS, n);
                body.forEach(member -> member.accept(this, arg));
                close();
            });
        }

        @Override
        public void visit(NameExpr n, Void arg) {
            builder.load(n.getNameAsString(), line(n));
        }

        @Override
        public void visit(VariableDeclarationExpr n, Void arg) {
            n.getVariables().forEach(v -> v.getInitializer().ifPresent(init -> init.accept(this, arg)));

            Optional<ExpressionStmt> statement = n.getParentNode()
                    .filter(ExpressionStmt.class::isInstance)
                    .map(ExpressionStmt.class::cast);
            if (statement.isEmpty()) {
                // for headers, resources, for-each variables
                n.getVariables().forEach(v -> builder.store(v.getNameAsString(), line(v)));
                return;
            }
            if (n.getVariables().size() > 1) {
                builder.warn(ErrorRecord.ambiguous("Declaration of " + n.getVariables().size()
                        + " variables in one statement; keeping all of them", line(n)));
                n.getVariables().forEach(v -> builder.store(v.getNameAsString(), line(v)));
                return;
            }

            VariableDeclarator variable = n.getVariable(0);
            String reason = unremovableReason(statement.get(), variable.getInitializer().orElse(null));
            builder.write(variable.getNameAsString(), site(statement.get(), reason));
            declareLocal(variable.getNameAsString(), statement.get());
        }

        @Override
        public void visit(AssignExpr n, Void arg) {
            if (n.getOperator() != AssignExpr.Operator.ASSIGN || !n.getTarget().isNameExpr()) {
                // compound assignment reads its target
                super.visit(n, arg);
                return;
            }
            n.getValue().accept(this, arg);

            String name = n.getTarget().asNameExpr().getNameAsString();
            if (!isLocal(name, n)) {
                builder.store(name, line(n));
                return;
            }
            Optional<ExpressionStmt> statement = n.getParentNode()
                    .filter(ExpressionStmt.class::isInstance)
                    .map(ExpressionStmt.class::cast);
            if (statement.isPresent()) {
                builder.write(name, site(statement.get(), unremovableReason(statement.get(), n.getValue())));
            } else {
                builder.write(name, site(n, "is assigned inside an expression"));
            }
        }

        private void declareParameters(List<Parameter> parameters) {
            parameters.forEach(p -> builder.parameter(p.getNameAsString(), line(p)));
        }

        private void open(ScopeKind kind, Node node) {
            builder.openScope(kind, line(node));
            locals.push(new HashMap<>());
        }

        private void close() {
            locals.pop();
            builder.closeScope();
        }

        private void declareLocal(String name, ExpressionStmt statement) {
            Node holder = statement.getParentNode().orElse(statement);
            if (holder instanceof SwitchEntry) {
                // a local declared under one case label is visible in the following ones
                holder = holder.getParentNode().orElse(holder);
            }
            locals.peek().computeIfAbsent(name, k -> new ArrayList<>()).add(holder);
        }

        private boolean isLocal(String name, Node use) {
            return locals.peek().getOrDefault(name, List.of()).stream().anyMatch(holder -> holder.isAncestorOf(use));
        }

        private WriteSite site(Node node, String unremovableReason) {
            Range range = node.getRange().map(Range::from).orElseThrow(
                    () -> new IllegalStateException("Node without position: " + node));
            return builder.site(range, inLoop(node), WriteSite.NO_BLOCK, unremovableReason);
        }

        private String unremovableReason(ExpressionStmt statement, Expression value) {
            Node parent = statement.getParentNode().orElse(null);
            if (!(parent instanceof BlockStmt) && !(parent instanceof SwitchEntry)) {
                return "is the body of a control statement";
            }
            Range range = statement.getRange().map(Range::from).orElse(null);
            if (range == null
                    || !lines.onlyWhitespaceBefore(range.startLine(), range.startColumn())
                    || !lines.onlyCommentAfter(range.endLine(), range.endColumn(), "//")) {
                return "shares its line with other code";
            }
            if (value != null && hasEmbeddedWrite(value)) {
                return "contains an embedded assignment";
            }
            return null;
        }

        private static boolean hasEmbeddedWrite(Expression value) {
            if (value instanceof AssignExpr || value.findFirst(AssignExpr.class).isPresent()) {
                return true;
            }
            return value.findAll(UnaryExpr.class).stream().anyMatch(u -> switch (u.getOperator()) {
                case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> true;
                default -> false;
            });
        }

        /**
         * True when a loop encloses the node inside its own callable.
         */
        private static boolean inLoop(Node node) {
            Optional<Node> parent = node.getParentNode();
            while (parent.isPresent()) {
                Node p = parent.get();
                if (p instanceof ForStmt || p instanceof ForEachStmt || p instanceof WhileStmt || p instanceof DoStmt) {
                    return true;
                }
                if (p instanceof BodyDeclaration || p instanceof LambdaExpr || p instanceof ObjectCreationExpr) {
                    return false;
                }
                parent = p.getParentNode();
            }
            return false;
        }

        private static int line(Node node) {
            return node.getBegin().map(position -> position.line).orElse(1);
        }
    }
}
