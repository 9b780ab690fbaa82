package org.asymptote.analyzer.analysis.structural;

import org.asymptote.analyzer.analysis.recurrence.RecurrenceSolver;
import org.asymptote.analyzer.analysis.recurrence.SelfCallCollector;
import org.asymptote.analyzer.analysis.recurrence.SizeTransform;
import org.asymptote.analyzer.analysis.recurrence.SizeTransformDeducer;
import org.asymptote.analyzer.frontend.TreeWalker;
import org.asymptote.analyzer.frontend.parser.ast.Block;
import org.asymptote.analyzer.frontend.parser.ast.Call;
import org.asymptote.analyzer.frontend.parser.ast.IfElse;
import org.asymptote.analyzer.frontend.parser.ast.ProcedureDecl;
import org.asymptote.analyzer.frontend.parser.ast.ReturnStmt;
import org.asymptote.analyzer.model.Annotation;
import org.asymptote.analyzer.model.AnnotationKind;
import org.asymptote.analyzer.model.GrowthRate;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Recognizes common shapes of self-recursion and estimates their growth without solving a
 * recurrence: linear recursion, branching recursion (Fibonacci, Hanoi), halving (binary search),
 * divide and conquer (merge sort) and partitioning (quicksort).
 */
final class RecursionShapes {

    private final SizeTransformDeducer deducer;

    RecursionShapes(SizeTransformDeducer deducer) {
        this.deducer = deducer;
    }

    /**
     * @param procedure A self-recursive procedure.
     * @param local The cost of one invocation with every self-call charged as constant.
     * @param annotations Receives the recognized shape.
     * @return The estimated cost of the procedure.
     */
    CaseCost estimate(ProcedureDecl procedure, CaseCost local, Collection<Annotation> annotations) {
        String name = procedure.procedureName();
        int line = procedure.line();
        SelfCallCollector.SelfCalls path = SelfCallCollector.collect(procedure);
        List<SizeTransform> transforms = path.calls().stream()
                .map(call -> deducer.deduce(procedure, call).transform())
                .collect(Collectors.toList());

        long subtract = count(transforms, SizeTransform.Subtract.class);
        long divide = count(transforms, SizeTransform.Divide.class);
        long split = count(transforms, SizeTransform.Split.class);
        long unknown = count(transforms, SizeTransform.Unknown.class);

        annotations.add(Annotation.of(AnnotationKind.RECURSION,
                name + " calls itself " + transforms.size() + " time(s) per invocation", line));
        if (divide + split > 0) {
            annotations.add(Annotation.of(AnnotationKind.DIVIDE_AND_CONQUER_CANDIDATE,
                    name + " recurses on a fraction of its input", line));
        }
        if (local.worst().isExponential()) {
            return local;
        }

        if (path.insideLoop()) {
            if (subtract + unknown > 0) {
                annotations.add(Annotation.assumption(AnnotationKind.CALL_INSIDE_LOOP,
                        "a self-call of " + name + " is nested in a loop; growth is taken as at least exponential", line));
                return CaseCost.uniform(GrowthRate.EXPONENTIAL.times(local.worst()));
            }
            annotations.add(Annotation.assumption(AnnotationKind.CALL_INSIDE_LOOP,
                    "a self-call of " + name + " is nested in a loop; the loop is assumed to run a constant number of times", line));
        }

        if (split >= 2 && subtract + divide + unknown == 0) {
            // Partitioning: balanced splits in the best and average case, one-sided in the worst.
            // Every level above the base case partitions, also in the best case.
            GrowthRate partition = local.average();
            GrowthRate balanced = partition.times(GrowthRate.LOGARITHMIC).max(partition);
            return new CaseCost(balanced, local.worst().times(GrowthRate.LINEAR), balanced);
        }
        if (divide > 0 && subtract + split + unknown == 0) {
            double divisor = transforms.stream()
                    .mapToDouble(t -> ((SizeTransform.Divide) t).divisor())
                    .max().orElse(2);
            GrowthRate worst = RecurrenceSolver.masterCase((int) divide, divisor, local.worst()).bound();
            GrowthRate average = RecurrenceSolver.masterCase((int) divide, divisor, local.average()).bound();
            GrowthRate best = worst;
            if (divide == 1 && canFinishEarly(procedure)) {
                annotations.add(Annotation.of(AnnotationKind.EARLY_EXIT,
                        name + " can return before recursing", line));
                best = local.best();
            }
            return new CaseCost(best, worst, average);
        }
        if (subtract >= 2 && divide + split + unknown == 0) {
            return CaseCost.uniform(GrowthRate.EXPONENTIAL.times(local.worst()));
        }
        if (subtract == 1 && divide + split + unknown == 0) {
            CaseCost linear = local.times(GrowthRate.LINEAR);
            if (canFinishEarly(procedure)) {
                annotations.add(Annotation.of(AnnotationKind.EARLY_EXIT,
                        name + " can return before recursing", line));
                return new CaseCost(local.best(), linear.worst(), linear.average());
            }
            return linear;
        }

        annotations.add(Annotation.assumption(AnnotationKind.RECURSION,
                "the subproblem sizes of " + name + " are not all understood; a recursion depth of n is assumed", line));
        return local.times(GrowthRate.LINEAR);
    }

    private static long count(List<SizeTransform> transforms, Class<? extends SizeTransform> type) {
        return transforms.stream().filter(type::isInstance).count();
    }

    /**
     * A procedure can finish early when, besides its base case, another branch returns without
     * recursing.
     */
    static boolean canFinishEarly(ProcedureDecl procedure) {
        String name = procedure.procedureName();
        int exits = 0;
        for (IfElse branch : TreeWalker.collect(procedure.body(), IfElse.class)) {
            if (returnsWithoutRecursing(branch.thenBranch(), name)) {
                exits++;
            }
            if (branch.hasElse() && returnsWithoutRecursing(branch.elseBranch(), name)) {
                exits++;
            }
        }
        return exits >= 2;
    }

    private static boolean returnsWithoutRecursing(Block block, String name) {
        boolean returns = block.statements().stream().anyMatch(s -> s instanceof ReturnStmt);
        return returns && TreeWalker.collect(block, Call.class).stream().noneMatch(c -> c.targets(name));
    }
}
