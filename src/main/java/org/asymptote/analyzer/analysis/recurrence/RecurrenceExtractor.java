package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.analysis.linecost.LineCostAnalyzer;
import org.asymptote.analyzer.analysis.linecost.LineCostReport;
import org.asymptote.analyzer.frontend.AstPrinter;
import org.asymptote.analyzer.frontend.TreeWalker;
import org.asymptote.analyzer.frontend.parser.ProcedureTable;
import org.asymptote.analyzer.frontend.parser.ast.BinaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.Call;
import org.asymptote.analyzer.frontend.parser.ast.Expression;
import org.asymptote.analyzer.frontend.parser.ast.IfElse;
import org.asymptote.analyzer.frontend.parser.ast.ProcedureDecl;
import org.asymptote.analyzer.frontend.parser.ast.Program;
import org.asymptote.analyzer.frontend.parser.ast.Statement;
import org.asymptote.analyzer.frontend.parser.ast.UnaryExpr;
import org.asymptote.analyzer.model.GrowthRate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Extracts the recurrence of a self-recursive procedure.
 * <p>
 * Self-calls are counted along the most expensive path: the calls of both branches of a conditional
 * are not added, only the branch with more calls counts, so that binary search yields one term and
 * not two. Each call's size transform is deduced from its arguments, and calls with equal transforms
 * are grouped into one term. The non-recursive cost is the dominating line cost of the procedure's
 * structural lines.
 */
public class RecurrenceExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(RecurrenceExtractor.class);

    private final SizeTransformDeducer deducer;
    private final LineCostAnalyzer lineCostAnalyzer;

    public RecurrenceExtractor() {
        this(new SizeTransformDeducer(), new LineCostAnalyzer());
    }

    public RecurrenceExtractor(SizeTransformDeducer deducer, LineCostAnalyzer lineCostAnalyzer) {
        this.deducer = deducer;
        this.lineCostAnalyzer = lineCostAnalyzer;
    }

    /**
     * Extracts the recurrence of a procedure, computing line costs on the fly.
     * @param program The parsed program.
     * @param procedureName The procedure to extract.
     * @return The relation, or empty if the procedure does not exist or never calls itself.
     */
    public Optional<RecurrenceRelation> extract(Program program, String procedureName) {
        return extract(program, procedureName, lineCostAnalyzer.analyze(program));
    }

    /**
     * Extracts the recurrence of a procedure.
     * @param program The parsed program.
     * @param procedureName The procedure to extract.
     * @param lineCosts The line costs of the program, used for the non-recursive cost.
     * @return The relation, or empty if the procedure does not exist or never calls itself.
     */
    public Optional<RecurrenceRelation> extract(Program program, String procedureName, LineCostReport lineCosts) {
        Optional<ProcedureDecl> found = ProcedureTable.of(program).lookup(procedureName);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        ProcedureDecl procedure = found.get();
        List<Call> allSelfCalls = selfCalls(procedure);
        if (allSelfCalls.isEmpty()) {
            return Optional.empty();
        }

        SelfCallCollector.SelfCalls path = SelfCallCollector.collect(procedure);
        List<String> notes = new ArrayList<>();
        if (path.calls().size() < allSelfCalls.size()) {
            notes.add((allSelfCalls.size() - path.calls().size())
                    + " self-call(s) lie in exclusive branches; only the branch with most calls is counted");
        } else if (path.calls().size() > allSelfCalls.size()) {
            notes.add("Self-calls in a loop with constant bounds are counted once per pass");
        }
        if (path.insideLoop()) {
            notes.add("A self-call is nested inside a loop; the recurrence does not capture the iteration");
        }

        Map<SizeTransform, Integer> grouped = new LinkedHashMap<>();
        int splits = 0;
        for (Call call : path.calls()) {
            SizeTransformDeducer.Deduction deduction = deducer.deduce(procedure, call);
            SizeTransform transform = deduction.transform();
            if (transform instanceof SizeTransform.Split) {
                transform = new SizeTransform.Split(splits++ % 2 == 0);
            }
            if (deduction.note() != null && !notes.contains(deduction.note())) {
                notes.add(deduction.note());
            }
            grouped.merge(transform, 1, Integer::sum);
        }
        List<RecursiveTerm> terms = grouped.entrySet().stream()
                .map(e -> new RecursiveTerm(e.getValue(), e.getKey()))
                .collect(Collectors.toList());

        GrowthRate cost = lineCosts.structuralCostOf(procedure.procedureName());
        String equation = RecurrenceRelation.equationOf(terms, cost);
        String baseCase = baseCase(procedure, notes);
        String explanation = String.format("%s makes %d recursive call(s) per invocation (%s) and does %s work outside them",
                procedure.procedureName(), path.calls().size(),
                terms.stream().map(RecursiveTerm::render).collect(Collectors.joining(", ")),
                cost.render());

        LOG.debug("Extracted recurrence for {}: {}", procedure.procedureName(), equation);
        return Optional.of(new RecurrenceRelation(procedure.procedureName(), equation, baseCase, explanation,
                notes, terms, cost, path.insideLoop()));
    }

    /**
     * @param procedure A procedure.
     * @return All calls the procedure makes to itself, in source order.
     */
    public static List<Call> selfCalls(ProcedureDecl procedure) {
        return TreeWalker.collect(procedure.body(), Call.class).stream()
                .filter(c -> c.targets(procedure.procedureName()))
                .collect(Collectors.toList());
    }

    /**
     * The base case is the smallest-input branch of the leading guard: its condition when the
     * then-branch makes no self-call, the negated condition when only the then-branch does.
     */
    private String baseCase(ProcedureDecl procedure, List<String> notes) {
        for (Statement statement : procedure.body().statements()) {
            if (statement instanceof IfElse guard) {
                boolean thenRecurses = mentionsSelf(guard.thenBranch(), procedure);
                boolean elseRecurses = guard.hasElse() && mentionsSelf(guard.elseBranch(), procedure);
                if (!thenRecurses) {
                    return "T(n) = 1 when " + AstPrinter.render(guard.condition());
                }
                if (!elseRecurses) {
                    return "T(n) = 1 when " + negate(guard.condition());
                }
            }
            if (mentionsSelf(statement, procedure)) {
                break;
            }
        }
        notes.add("No guard before the first self-call; a constant base case is assumed");
        return "T(1) = 1 (assumed)";
    }

    private static boolean mentionsSelf(Statement statement, ProcedureDecl procedure) {
        return TreeWalker.collect(statement, Call.class).stream().anyMatch(c -> c.targets(procedure.procedureName()));
    }

    /**
     * @param condition A condition.
     * @return The negated condition, with comparisons flipped instead of wrapped in {@code not}.
     */
    static String negate(Expression condition) {
        if (condition instanceof BinaryExpr bin) {
            String flipped;
            switch (bin.operator()) {
                case "<": flipped = ">="; break;
                case "<=": flipped = ">"; break;
                case ">": flipped = "<="; break;
                case ">=": flipped = "<"; break;
                case "=": flipped = "<>"; break;
                case "<>": flipped = "="; break;
                default: flipped = null; break;
            }
            if (flipped != null) {
                return AstPrinter.render(new BinaryExpr(bin.left(), flipped, bin.right(), bin.sourceInfo()));
            }
        }
        if (condition instanceof UnaryExpr unary && "not".equals(unary.operator())) {
            return AstPrinter.render(unary.operand());
        }
        return "not (" + AstPrinter.render(condition) + ")";
    }
}
