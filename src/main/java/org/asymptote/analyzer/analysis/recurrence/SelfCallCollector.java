package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.analysis.LoopProgressClassifier;
import org.asymptote.analyzer.frontend.TreeWalker;
import org.asymptote.analyzer.frontend.parser.ast.ArrayAccess;
import org.asymptote.analyzer.frontend.parser.ast.Assignment;
import org.asymptote.analyzer.frontend.parser.ast.AstVisitor;
import org.asymptote.analyzer.frontend.parser.ast.BinaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.Block;
import org.asymptote.analyzer.frontend.parser.ast.Call;
import org.asymptote.analyzer.frontend.parser.ast.Expression;
import org.asymptote.analyzer.frontend.parser.ast.ForLoop;
import org.asymptote.analyzer.frontend.parser.ast.Identifier;
import org.asymptote.analyzer.frontend.parser.ast.IfElse;
import org.asymptote.analyzer.frontend.parser.ast.Literal;
import org.asymptote.analyzer.frontend.parser.ast.ProcedureDecl;
import org.asymptote.analyzer.frontend.parser.ast.Program;
import org.asymptote.analyzer.frontend.parser.ast.RepeatUntilLoop;
import org.asymptote.analyzer.frontend.parser.ast.ReturnStmt;
import org.asymptote.analyzer.frontend.parser.ast.Statement;
import org.asymptote.analyzer.frontend.parser.ast.UnaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.WhileLoop;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Collects the self-calls of a procedure along its most expensive path: of the two branches of a
 * conditional only the one with more self-calls counts. A loop with constant bounds contributes its
 * self-calls once per pass; any other loop marks them as nested.
 */
public final class SelfCallCollector {

    /** The most self-calls a constant loop is expanded to before it is treated like any other loop. */
    static final int MAX_EXPANDED_CALLS = 64;

    private SelfCallCollector() {
    }

    /**
     * The self-calls along the most expensive path, and whether any is nested in a loop.
     *
     * @param calls The calls, in source order.
     * @param insideLoop {@code true} if a counted call sits in a loop body.
     */
    public record SelfCalls(List<Call> calls, boolean insideLoop) {
        static final SelfCalls NONE = new SelfCalls(List.of(), false);

        public SelfCalls {
            calls = List.copyOf(calls);
        }

        SelfCalls then(SelfCalls next) {
            if (next.calls.isEmpty() && !next.insideLoop) {
                return this;
            }
            List<Call> all = new ArrayList<>(calls);
            all.addAll(next.calls);
            return new SelfCalls(all, insideLoop || next.insideLoop);
        }

        SelfCalls inLoop() {
            return calls.isEmpty() ? this : new SelfCalls(calls, true);
        }

        SelfCalls repeated(int passes) {
            List<Call> all = new ArrayList<>();
            for (int i = 0; i < passes; i++) {
                all.addAll(calls);
            }
            return new SelfCalls(all, insideLoop);
        }
    }

    /**
     * @param procedure A procedure.
     * @return Its self-calls along the most expensive path.
     */
    public static SelfCalls collect(ProcedureDecl procedure) {
        return procedure.body().accept(new PathVisitor(procedure.procedureName()));
    }

    private static final class PathVisitor implements AstVisitor<SelfCalls> {
        private final String procedureName;

        PathVisitor(String procedureName) {
            this.procedureName = procedureName;
        }

        private SelfCalls inExpression(Expression expression) {
            if (expression == null) {
                return SelfCalls.NONE;
            }
            List<Call> calls = TreeWalker.collect(expression, Call.class).stream()
                    .filter(c -> c.targets(procedureName))
                    .collect(Collectors.toList());
            return calls.isEmpty() ? SelfCalls.NONE : new SelfCalls(calls, false);
        }

        @Override
        public SelfCalls visitProgram(Program node) {
            return SelfCalls.NONE;
        }

        @Override
        public SelfCalls visitProcedure(ProcedureDecl node) {
            return node.body().accept(this);
        }

        @Override
        public SelfCalls visitBlock(Block node) {
            SelfCalls result = SelfCalls.NONE;
            for (Statement statement : node.statements()) {
                result = result.then(statement.accept(this));
            }
            return result;
        }

        @Override
        public SelfCalls visitFor(ForLoop node) {
            SelfCalls body = node.body().accept(this);
            OptionalInt passes = LoopProgressClassifier.constantIterations(node);
            boolean expand = passes.isPresent() && passes.getAsInt() >= 1
                    && (long) passes.getAsInt() * body.calls().size() <= MAX_EXPANDED_CALLS;
            SelfCalls loop = expand ? body.repeated(passes.getAsInt()) : body.inLoop();
            return inExpression(node.start()).then(inExpression(node.end())).then(loop);
        }

        @Override
        public SelfCalls visitWhile(WhileLoop node) {
            return inExpression(node.condition()).then(node.body().accept(this).inLoop());
        }

        @Override
        public SelfCalls visitRepeat(RepeatUntilLoop node) {
            return node.body().accept(this).inLoop().then(inExpression(node.condition()));
        }

        @Override
        public SelfCalls visitIf(IfElse node) {
            SelfCalls thenCalls = node.thenBranch().accept(this);
            SelfCalls elseCalls = node.hasElse() ? node.elseBranch().accept(this) : SelfCalls.NONE;
            SelfCalls heavier = elseCalls.calls().size() > thenCalls.calls().size() ? elseCalls : thenCalls;
            return inExpression(node.condition()).then(heavier);
        }

        @Override
        public SelfCalls visitAssignment(Assignment node) {
            return inExpression(node.target()).then(inExpression(node.value()));
        }

        @Override
        public SelfCalls visitCall(Call node) {
            return inExpression(node);
        }

        @Override
        public SelfCalls visitReturn(ReturnStmt node) {
            return inExpression(node.value());
        }

        @Override
        public SelfCalls visitArrayAccess(ArrayAccess node) {
            return inExpression(node);
        }

        @Override
        public SelfCalls visitBinary(BinaryExpr node) {
            return inExpression(node);
        }

        @Override
        public SelfCalls visitUnary(UnaryExpr node) {
            return inExpression(node);
        }

        @Override
        public SelfCalls visitLiteral(Literal node) {
            return SelfCalls.NONE;
        }

        @Override
        public SelfCalls visitIdentifier(Identifier node) {
            return SelfCalls.NONE;
        }
    }
}
