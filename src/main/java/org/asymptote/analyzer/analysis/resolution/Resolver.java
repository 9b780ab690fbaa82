package org.asymptote.analyzer.analysis.resolution;

import org.asymptote.analyzer.analysis.recurrence.RecurrenceRelation;
import org.asymptote.analyzer.analysis.recurrence.SolverOutcome;
import org.asymptote.analyzer.analysis.structural.StructuralReport;
import org.asymptote.analyzer.model.Annotation;
import org.asymptote.analyzer.model.AnnotationKind;
import org.asymptote.analyzer.model.ComplexityResult;
import org.asymptote.analyzer.model.GrowthRate;
import org.asymptote.analyzer.model.MathStep;
import org.asymptote.analyzer.model.SolutionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Merges the structural result and the solver outcome into one decision.
 * <p>
 * Recursion nested in iteration, logarithmic loops and unresolved loop progress are outside the
 * simple recurrence model, so the structural result wins whenever one of them was flagged. Otherwise
 * a solved recurrence decides the bound, widened by the work outside the recursive calls and
 * narrowed in the best case by the structural estimate. An unsolvable recurrence falls back to the
 * structural result.
 */
public class Resolver {

    private static final Logger LOG = LoggerFactory.getLogger(Resolver.class);

    /**
     * @param structural The structural report of the program.
     * @param relation The extracted recurrence, if the program revolves around a recursive procedure.
     * @param outcome The solver outcome for that recurrence.
     * @return The decision.
     */
    public Resolution resolve(StructuralReport structural, Optional<RecurrenceRelation> relation,
                              Optional<SolverOutcome> outcome) {
        ComplexityResult result = structural.result();
        if (relation.isEmpty() || outcome.isEmpty()) {
            return fromStructure(result, "no recursive procedure drives the cost of " + structural.entry(),
                    List.of(), List.of());
        }
        if (result.hasAnnotation(AnnotationKind.CALL_INSIDE_LOOP)
                || result.hasAnnotation(AnnotationKind.LOGARITHMIC_LOOP)
                || result.hasAnnotation(AnnotationKind.UNRESOLVED_PROGRESS)) {
            LOG.debug("Preferring the structural result over the recurrence of {}", relation.get().procedure());
            return fromStructure(result, "the loops around or inside the recursion are not captured by "
                    + relation.get().equation(), outcome.get().steps(), List.of());
        }
        if (outcome.get() instanceof SolverOutcome.Solved solved) {
            return fromSolver(structural, relation.get(), solved);
        }

        SolverOutcome.Unsolvable unsolvable = (SolverOutcome.Unsolvable) outcome.get();
        LOG.info("Recurrence of {} not solved ({}), using the structural result",
                relation.get().procedure(), unsolvable.reason());
        Annotation unsolved = Annotation.of(AnnotationKind.RECURRENCE_UNSOLVED,
                relation.get().equation() + ": " + unsolvable.reason(), 0);
        return fromStructure(result, "the recurrence could not be solved: " + unsolvable.reason(),
                unsolvable.steps(), List.of(unsolved));
    }

    private Resolution fromSolver(StructuralReport structural, RecurrenceRelation relation, SolverOutcome.Solved solved) {
        GrowthRate bound = solved.bound();
        ComplexityResult residual = structural.residual();
        GrowthRate worst = bound.max(residual.worst());
        GrowthRate average = bound.max(residual.average());
        GrowthRate best = structural.result().best().min(bound).max(residual.best());

        List<MathStep> steps = new ArrayList<>(solved.steps());
        if (worst.compareTo(bound) != 0) {
            steps.add(new MathStep("Work outside the recursion", residual.worst().render() + " dominates " + bound.render()));
        }
        if (best.compareTo(bound) != 0) {
            steps.add(new MathStep("Best case", "structural estimate " + best.render()));
        }

        List<Annotation> annotations = new ArrayList<>(structural.result().annotations());
        annotations.addAll(solved.annotations());
        String justification = relation.equation() + " solves to " + bound.render() + ". " + solved.justification();
        LOG.debug("Recurrence of {} decides the bound: {}", relation.procedure(), bound.render());
        return new Resolution(best, worst, average, solved.method().displayName(), justification, steps, annotations);
    }

    private Resolution fromStructure(ComplexityResult result, String reason, List<MathStep> tried, List<Annotation> extra) {
        List<MathStep> steps = new ArrayList<>(tried);
        steps.add(new MathStep("Best case", "cheapest branches and earliest exits: " + result.best().render()));
        steps.add(new MathStep("Worst case", "most expensive path through every loop: " + result.worst().render()));
        steps.add(new MathStep("Average case", "heavier branch of each conditional: " + result.average().render()));
        List<Annotation> annotations = new ArrayList<>(result.annotations());
        annotations.addAll(extra);
        String justification = "Costs composed over the program structure because " + reason + ".";
        if (result.hasAssumptions()) {
            justification += " Part of the bound rests on assumptions listed in the annotations.";
        }
        return new Resolution(result.best(), result.worst(), result.average(),
                SolutionMethod.STRUCTURAL.displayName(), justification, steps, annotations);
    }
}
