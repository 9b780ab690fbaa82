package org.asymptote.analyzer.analysis.structural;

import org.asymptote.analyzer.analysis.LoopProgressClassifier;
import org.asymptote.analyzer.analysis.LoopShape;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceExtractor;
import org.asymptote.analyzer.analysis.recurrence.SizeTransformDeducer;
import org.asymptote.analyzer.frontend.TreeWalker;
import org.asymptote.analyzer.frontend.parser.ProcedureTable;
import org.asymptote.analyzer.frontend.parser.ast.ArrayAccess;
import org.asymptote.analyzer.frontend.parser.ast.Assignment;
import org.asymptote.analyzer.frontend.parser.ast.AstNode;
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
import org.asymptote.analyzer.model.Annotation;
import org.asymptote.analyzer.model.AnnotationKind;
import org.asymptote.analyzer.model.ComplexityResult;
import org.asymptote.analyzer.model.GrowthRate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Derives best, worst and average case growth by composing costs bottom-up over the tree.
 * <p>
 * Sequences take the dominating part, loops multiply their body by the iteration count,
 * conditionals take the cheaper branch for the best case and the more expensive one otherwise, and
 * calls charge the callee's cost. Self-recursive procedures are estimated by {@link RecursionShapes}.
 * The engine itself is stateless; every analysis runs on its own memo of procedure costs.
 */
public class StructuralEngine {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralEngine.class);

    private final LoopProgressClassifier classifier;
    private final RecursionShapes shapes;

    public StructuralEngine() {
        this(new LoopProgressClassifier(), new SizeTransformDeducer());
    }

    public StructuralEngine(LoopProgressClassifier classifier, SizeTransformDeducer deducer) {
        this.classifier = classifier;
        this.shapes = new RecursionShapes(deducer);
    }

    /**
     * @param program The parsed program.
     * @return The cost of the program's entry point.
     */
    public ComplexityResult analyze(Program program) {
        return analyzeProgram(program).result();
    }

    /**
     * Analyzes the entry point twice: once in full and once with calls to recursive procedures
     * charged as constant.
     * @param program The parsed program.
     * @return Both results, the entry scope and the main recursive procedure.
     */
    public StructuralReport analyzeProgram(Program program) {
        ProcedureTable table = ProcedureTable.of(program);
        Optional<ProcedureDecl> entryProcedure = program.hasBody() ? Optional.empty() : entryProcedure(program);
        String entry = entryProcedure.map(ProcedureDecl::procedureName).orElse("main");

        Analysis full = new Analysis(table, false);
        CaseCost cost = full.entryCost(program, entryProcedure);
        Analysis residualPass = new Analysis(table, true);
        CaseCost residual = residualPass.entryCost(program, entryProcedure);

        Optional<String> recursive = recursiveProcedure(program, table, entryProcedure);
        LOG.debug("Structural cost of {}: best {}, worst {}, average {}", entry,
                cost.best().render(), cost.worst().render(), cost.average().render());
        return new StructuralReport(
                cost.toResult(new ArrayList<>(full.annotations)),
                residual.toResult(new ArrayList<>(residualPass.annotations)),
                entry, recursive);
    }

    /**
     * The entry of a file without main block is the first procedure no other procedure calls.
     */
    static Optional<ProcedureDecl> entryProcedure(Program program) {
        for (ProcedureDecl candidate : program.procedures()) {
            boolean called = program.procedures().stream()
                    .filter(other -> other != candidate)
                    .flatMap(other -> TreeWalker.collect(other.body(), Call.class).stream())
                    .anyMatch(call -> call.targets(candidate.procedureName()));
            if (!called) {
                return Optional.of(candidate);
            }
        }
        return program.procedures().stream().findFirst();
    }

    /**
     * The entry procedure if it calls itself, otherwise the first self-recursive procedure
     * reachable from the entry scope in call order.
     */
    static Optional<String> recursiveProcedure(Program program, ProcedureTable table, Optional<ProcedureDecl> entry) {
        Deque<AstNode> pending = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        if (entry.isPresent()) {
            if (isSelfRecursive(entry.get())) {
                return Optional.of(entry.get().procedureName());
            }
            seen.add(key(entry.get().procedureName()));
            pending.add(entry.get().body());
        } else if (program.hasBody()) {
            pending.add(program.body());
        }
        while (!pending.isEmpty()) {
            AstNode scope = pending.poll();
            for (Call call : TreeWalker.collect(scope, Call.class)) {
                Optional<ProcedureDecl> callee = table.lookup(call.calleeName());
                if (callee.isEmpty() || !seen.add(key(callee.get().procedureName()))) {
                    continue;
                }
                if (isSelfRecursive(callee.get())) {
                    return Optional.of(callee.get().procedureName());
                }
                pending.add(callee.get().body());
            }
        }
        return Optional.empty();
    }

    static boolean isSelfRecursive(ProcedureDecl procedure) {
        return !RecurrenceExtractor.selfCalls(procedure).isEmpty();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * One run of the engine over one program.
     */
    private final class Analysis implements AstVisitor<CaseCost> {
        private final ProcedureTable table;
        private final boolean recursionAsConstant;
        private final Map<String, CaseCost> memo = new HashMap<>();
        private final Deque<String> inProgress = new ArrayDeque<>();
        private final Set<Annotation> annotations = new LinkedHashSet<>();
        private int loopDepth;

        Analysis(ProcedureTable table, boolean recursionAsConstant) {
            this.table = table;
            this.recursionAsConstant = recursionAsConstant;
        }

        CaseCost entryCost(Program program, Optional<ProcedureDecl> entryProcedure) {
            if (program.hasBody()) {
                return program.body().accept(this);
            }
            if (entryProcedure.isEmpty()) {
                return CaseCost.CONSTANT;
            }
            return recursionAsConstant ? localCost(entryProcedure.get()) : procedureCost(entryProcedure.get());
        }

        private CaseCost procedureCost(ProcedureDecl procedure) {
            String key = key(procedure.procedureName());
            CaseCost cached = memo.get(key);
            if (cached != null) {
                return cached;
            }
            CaseCost local = localCost(procedure);
            CaseCost cost = isSelfRecursive(procedure) ? shapes.estimate(procedure, local, annotations) : local;
            memo.put(key, cost);
            LOG.debug("Cost of procedure {}: worst {}", procedure.procedureName(), cost.worst().render());
            return cost;
        }

        /**
         * The cost of one invocation, self-calls charged as constant.
         */
        private CaseCost localCost(ProcedureDecl procedure) {
            inProgress.push(key(procedure.procedureName()));
            try {
                return procedure.body().accept(this);
            } finally {
                inProgress.pop();
            }
        }

        private CaseCost expression(Expression expression) {
            return expression == null ? CaseCost.CONSTANT : expression.accept(this);
        }

        private CaseCost loop(Statement loop, LoopShape shape, CaseCost perPass) {
            annotate(loop, shape);
            return new CaseCost(
                    perPass.best().times(shape.bestIterations()),
                    perPass.worst().times(shape.iterations()),
                    perPass.average().times(shape.iterations()));
        }

        private void annotate(Statement loop, LoopShape shape) {
            int line = loop.line();
            switch (shape.kind()) {
                case MULTIPLICATIVE:
                case HALVING_RANGE:
                    annotations.add(Annotation.of(AnnotationKind.LOGARITHMIC_LOOP,
                            "runs a logarithmic number of times: " + shape.description(), line));
                    break;
                case UNRESOLVED:
                    annotations.add(Annotation.assumption(AnnotationKind.UNRESOLVED_PROGRESS,
                            "progress could not be determined, assumed linear: " + shape.description(), line));
                    break;
                case FLAG:
                    annotations.add(Annotation.of(AnnotationKind.FLAG_CONTROLLED_LOOP,
                            "ends when a flag is set: " + shape.description(), line));
                    break;
                default:
                    break;
            }
            if (shape.earlyExit()) {
                annotations.add(Annotation.of(AnnotationKind.EARLY_EXIT,
                        "can stop after its first pass", line));
            }
        }

        @Override
        public CaseCost visitProgram(Program node) {
            return node.hasBody() ? node.body().accept(this) : CaseCost.CONSTANT;
        }

        @Override
        public CaseCost visitProcedure(ProcedureDecl node) {
            return procedureCost(node);
        }

        @Override
        public CaseCost visitBlock(Block node) {
            CaseCost cost = CaseCost.CONSTANT;
            for (Statement statement : node.statements()) {
                cost = cost.max(statement.accept(this));
            }
            return cost;
        }

        @Override
        public CaseCost visitFor(ForLoop node) {
            CaseCost bounds = expression(node.start()).max(expression(node.end())).max(expression(node.step()));
            LoopShape shape = classifier.classify(node);
            loopDepth++;
            CaseCost body = node.body().accept(this);
            loopDepth--;
            return bounds.max(loop(node, shape, body));
        }

        @Override
        public CaseCost visitWhile(WhileLoop node) {
            LoopShape shape = classifier.classify(node);
            loopDepth++;
            CaseCost perPass = expression(node.condition()).max(node.body().accept(this));
            loopDepth--;
            return loop(node, shape, perPass);
        }

        @Override
        public CaseCost visitRepeat(RepeatUntilLoop node) {
            LoopShape shape = classifier.classify(node);
            loopDepth++;
            CaseCost perPass = node.body().accept(this).max(expression(node.condition()));
            loopDepth--;
            return loop(node, shape, perPass);
        }

        @Override
        public CaseCost visitIf(IfElse node) {
            CaseCost thenCost = node.thenBranch().accept(this);
            CaseCost elseCost = node.hasElse() ? node.elseBranch().accept(this) : CaseCost.CONSTANT;
            // The average takes the heavier branch: half of it has the same growth.
            CaseCost branches = new CaseCost(
                    thenCost.best().min(elseCost.best()),
                    thenCost.worst().max(elseCost.worst()),
                    thenCost.average().max(elseCost.average()));
            return expression(node.condition()).max(branches);
        }

        @Override
        public CaseCost visitAssignment(Assignment node) {
            return expression(node.target()).max(expression(node.value()));
        }

        @Override
        public CaseCost visitCall(Call node) {
            CaseCost arguments = CaseCost.CONSTANT;
            for (Expression argument : node.arguments()) {
                arguments = arguments.max(expression(argument));
            }
            Optional<ProcedureDecl> found = table.lookup(node.calleeName());
            if (found.isEmpty()) {
                return arguments;
            }
            ProcedureDecl callee = found.get();
            String key = key(callee.procedureName());
            if (inProgress.contains(key)) {
                if (key.equals(inProgress.peek())) {
                    return arguments;
                }
                annotations.add(Annotation.assumption(AnnotationKind.RECURSION,
                        "mutual recursion through " + callee.procedureName() + " approximated as linear", node.line()));
                return arguments.max(CaseCost.uniform(GrowthRate.LINEAR));
            }
            boolean recursive = isSelfRecursive(callee);
            if (recursive && loopDepth > 0) {
                annotations.add(Annotation.of(AnnotationKind.CALL_INSIDE_LOOP,
                        "recursive procedure " + callee.procedureName() + " is called inside a loop", node.line()));
            }
            if (recursive && recursionAsConstant) {
                return arguments;
            }
            int depth = loopDepth;
            loopDepth = 0;
            try {
                return arguments.max(procedureCost(callee));
            } finally {
                loopDepth = depth;
            }
        }

        @Override
        public CaseCost visitReturn(ReturnStmt node) {
            return expression(node.value());
        }

        @Override
        public CaseCost visitArrayAccess(ArrayAccess node) {
            CaseCost cost = expression(node.base());
            for (Expression index : node.indices()) {
                cost = cost.max(expression(index));
            }
            return cost;
        }

        @Override
        public CaseCost visitBinary(BinaryExpr node) {
            return expression(node.left()).max(expression(node.right()));
        }

        @Override
        public CaseCost visitUnary(UnaryExpr node) {
            return expression(node.operand());
        }

        @Override
        public CaseCost visitLiteral(Literal node) {
            return CaseCost.CONSTANT;
        }

        @Override
        public CaseCost visitIdentifier(Identifier node) {
            return CaseCost.CONSTANT;
        }
    }
}
