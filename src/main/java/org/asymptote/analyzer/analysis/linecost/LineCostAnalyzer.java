package org.asymptote.analyzer.analysis.linecost;

import org.asymptote.analyzer.analysis.BuiltIns;
import org.asymptote.analyzer.analysis.LoopProgressClassifier;
import org.asymptote.analyzer.analysis.LoopShape;
import org.asymptote.analyzer.analysis.recurrence.SizeTransform;
import org.asymptote.analyzer.analysis.recurrence.SizeTransformDeducer;
import org.asymptote.analyzer.frontend.AstPrinter;
import org.asymptote.analyzer.frontend.TreeWalker;
import org.asymptote.analyzer.frontend.parser.ProcedureTable;
import org.asymptote.analyzer.frontend.parser.ast.ArrayAccess;
import org.asymptote.analyzer.frontend.parser.ast.Assignment;
import org.asymptote.analyzer.frontend.parser.ast.AstNode;
import org.asymptote.analyzer.frontend.parser.ast.AstVisitor;
import org.asymptote.analyzer.frontend.parser.ast.BinaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.Block;
import org.asymptote.analyzer.frontend.parser.ast.Call;
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
import org.asymptote.analyzer.model.GrowthRate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Attributes a cost to every statement from the loops enclosing it.
 * <p>
 * Each enclosing loop contributes its iteration count as a factor: {@code n} for counting and
 * constant-step loops, {@code log n} for loops that divide their control value or halve a range,
 * {@code 1} for constant bounds. A call to a declared, non-recursive procedure is additionally
 * charged the callee's dominating line cost. Recursive calls are labeled with their recurrence
 * term instead. The analysis is purely structural and never solves recurrences.
 * <p>
 * Instances are stateless and may be shared between threads.
 */
public class LineCostAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(LineCostAnalyzer.class);

    /** The scope name of the main block. */
    public static final String MAIN_SCOPE = "main";

    private final LoopProgressClassifier classifier;
    private final SizeTransformDeducer deducer;

    public LineCostAnalyzer() {
        this(new LoopProgressClassifier(), new SizeTransformDeducer());
    }

    public LineCostAnalyzer(LoopProgressClassifier classifier, SizeTransformDeducer deducer) {
        this.classifier = classifier;
        this.deducer = deducer;
    }

    /**
     * Computes line costs without access to the source text; snippets are rendered from the tree.
     * @param program The parsed program.
     * @return The line cost report.
     */
    public LineCostReport analyze(Program program) {
        return analyze(program, null);
    }

    /**
     * Computes the line costs of every procedure and of the main block.
     * @param program The parsed program.
     * @param source The source text the program was parsed from, used for snippets, or {@code null}.
     * @return The line cost report, rows in source order.
     */
    public LineCostReport analyze(Program program, String source) {
        ProcedureTable table = ProcedureTable.of(program);
        String[] lines = source == null ? new String[0] : source.split("\\R", -1);
        Context context = new Context(table, lines);

        List<LineCost> rows = new ArrayList<>();
        for (ProcedureDecl procedure : table.all()) {
            rows.addAll(context.walk(procedure.procedureName(), procedure.body()));
        }
        if (program.body() != null) {
            rows.addAll(context.walk(MAIN_SCOPE, program.body()));
        }
        rows.sort((a, b) -> Integer.compare(a.line(), b.line()));
        LineCostReport report = LineCostReport.of(rows);
        LOG.debug("Computed {} line costs, dominating cost {}", rows.size(), report.total().render());
        return report;
    }

    /**
     * Per-invocation state: the procedure table, the source lines and the memo of callee costs.
     */
    private final class Context {
        private final ProcedureTable table;
        private final String[] lines;
        private final Map<String, GrowthRate> calleeCosts = new HashMap<>();
        private final Set<String> inProgress = new HashSet<>();

        Context(ProcedureTable table, String[] lines) {
            this.table = table;
            this.lines = lines;
        }

        List<LineCost> walk(String scope, Block body) {
            Walker walker = new Walker(this, scope);
            body.accept(walker);
            return walker.rows;
        }

        /**
         * The dominating line cost of a procedure, with a cycle guard for mutual recursion.
         */
        GrowthRate calleeCost(ProcedureDecl callee) {
            String key = callee.procedureName().toLowerCase(Locale.ROOT);
            GrowthRate cached = calleeCosts.get(key);
            if (cached != null) {
                return cached;
            }
            if (!inProgress.add(key)) {
                return GrowthRate.CONSTANT;
            }
            try {
                GrowthRate cost = LineCostReport.of(walk(callee.procedureName(), callee.body()))
                        .structuralCostOf(callee.procedureName());
                calleeCosts.put(key, cost);
                return cost;
            } finally {
                inProgress.remove(key);
            }
        }

        String snippet(AstNode node) {
            int index = node.line() - 1;
            if (index >= 0 && index < lines.length && !lines[index].isBlank()) {
                return lines[index].trim();
            }
            return AstPrinter.header(node);
        }
    }

    private final class Walker implements AstVisitor<Void> {
        private final Context context;
        private final String scope;
        private final ProcedureDecl self;
        private final Deque<GrowthRate> factors = new ArrayDeque<>();
        private final List<LineCost> rows = new ArrayList<>();
        private int splitCount = 0;

        Walker(Context context, String scope) {
            this.context = context;
            this.scope = scope;
            this.self = context.table.lookup(scope).orElse(null);
            factors.push(GrowthRate.CONSTANT);
        }

        private GrowthRate factor() {
            return factors.peek();
        }

        private void statementRow(Statement statement, List<AstNode> expressions) {
            GrowthRate callCost = GrowthRate.CONSTANT;
            List<String> terms = new ArrayList<>();
            List<String> callees = new ArrayList<>();
            for (AstNode expression : expressions) {
                for (Call call : TreeWalker.collect(expression, Call.class)) {
                    if (self != null && call.targets(self.procedureName())) {
                        terms.add("T(" + termLabel(call) + ")");
                        continue;
                    }
                    if (BuiltIns.isBuiltIn(call.calleeName())) {
                        continue;
                    }
                    ProcedureDecl callee = context.table.lookup(call.calleeName()).orElse(null);
                    if (callee == null) {
                        continue;
                    }
                    boolean recursive = TreeWalker.collect(callee.body(), Call.class).stream()
                            .anyMatch(c -> c.targets(callee.procedureName()));
                    if (recursive) {
                        terms.add("T_" + callee.procedureName() + "(n)");
                    }
                    callCost = callCost.max(context.calleeCost(callee));
                    callees.add(callee.procedureName());
                }
            }
            GrowthRate cost = factor().times(callCost);
            String explanation = explain(callees);
            if (!terms.isEmpty()) {
                String label = String.join(" + ", terms);
                if (!factor().isConstant()) {
                    label = factor().render() + " · (" + label + ")";
                }
                rows.add(new LineCost(statement.line(), context.snippet(statement), cost, label,
                        explanation + "; recursive cost " + String.join(" + ", terms) + " is a recurrence term",
                        Origin.RECURRENCE, scope));
            } else {
                rows.add(new LineCost(statement.line(), context.snippet(statement), cost, cost.render(),
                        explanation, Origin.STRUCTURAL, scope));
            }
        }

        private String termLabel(Call call) {
            SizeTransform transform = deducer.deduce(self, call).transform();
            if (transform instanceof SizeTransform.Split) {
                transform = new SizeTransform.Split(splitCount++ % 2 == 0);
            }
            return transform.label();
        }

        private String explain(List<String> callees) {
            String runs = factor().isConstant() ? "runs once per invocation" : "runs " + factor().render() + " times";
            if (callees.isEmpty()) {
                return runs;
            }
            return runs + ", calling " + String.join(", ", callees);
        }

        private void loop(Statement loop, LoopShape shape, Block body) {
            GrowthRate headerCost = factor().times(shape.iterations());
            rows.add(new LineCost(loop.line(), context.snippet(loop), headerCost, headerCost.render(),
                    "loop header: " + shape.description(), Origin.STRUCTURAL, scope));
            factors.push(headerCost);
            try {
                body.accept(this);
            } finally {
                factors.pop();
            }
        }

        @Override
        public Void visitProgram(Program node) {
            return null;
        }

        @Override
        public Void visitProcedure(ProcedureDecl node) {
            return null;
        }

        @Override
        public Void visitBlock(Block node) {
            for (Statement statement : node.statements()) {
                statement.accept(this);
            }
            return null;
        }

        @Override
        public Void visitFor(ForLoop node) {
            loop(node, classifier.classify(node), node.body());
            return null;
        }

        @Override
        public Void visitWhile(WhileLoop node) {
            loop(node, classifier.classify(node), node.body());
            return null;
        }

        @Override
        public Void visitRepeat(RepeatUntilLoop node) {
            loop(node, classifier.classify(node), node.body());
            return null;
        }

        @Override
        public Void visitIf(IfElse node) {
            statementRow(node, List.of(node.condition()));
            node.thenBranch().accept(this);
            if (node.hasElse()) {
                node.elseBranch().accept(this);
            }
            return null;
        }

        @Override
        public Void visitAssignment(Assignment node) {
            statementRow(node, List.of(node.target(), node.value()));
            return null;
        }

        @Override
        public Void visitCall(Call node) {
            statementRow(node, List.of(node));
            return null;
        }

        @Override
        public Void visitReturn(ReturnStmt node) {
            statementRow(node, node.getChildren());
            return null;
        }

        // Expressions are costed through their enclosing statement.

        @Override
        public Void visitArrayAccess(ArrayAccess node) {
            return null;
        }

        @Override
        public Void visitBinary(BinaryExpr node) {
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpr node) {
            return null;
        }

        @Override
        public Void visitLiteral(Literal node) {
            return null;
        }

        @Override
        public Void visitIdentifier(Identifier node) {
            return null;
        }
    }
}
