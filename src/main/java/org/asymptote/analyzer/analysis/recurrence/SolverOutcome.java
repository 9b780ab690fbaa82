package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.model.Annotation;
import org.asymptote.analyzer.model.GrowthRate;
import org.asymptote.analyzer.model.MathStep;
import org.asymptote.analyzer.model.SolutionMethod;

import java.util.List;

/**
 * The result of solving a recurrence. Failing to find a closed form is a regular outcome, not an error.
 */
public sealed interface SolverOutcome {

    /**
     * @return The derivation steps, in order.
     */
    List<MathStep> steps();

    boolean isSolved();

    /**
     * A closed-form tight bound.
     *
     * @param bound The growth of {@code T(n)}, a Θ bound.
     * @param method The method that produced it.
     * @param justification A sentence explaining the result.
     * @param steps The derivation.
     * @param annotations Assumptions and recognized patterns.
     */
    record Solved(GrowthRate bound, SolutionMethod method, String justification, List<MathStep> steps,
                  List<Annotation> annotations) implements SolverOutcome {
        public Solved {
            steps = List.copyOf(steps);
            annotations = annotations == null ? List.of() : List.copyOf(annotations);
        }

        @Override
        public boolean isSolved() {
            return true;
        }
    }

    /**
     * No method applied or converged.
     *
     * @param reason Why the recurrence could not be solved.
     * @param steps The steps tried.
     */
    record Unsolvable(String reason, List<MathStep> steps) implements SolverOutcome {
        public Unsolvable {
            steps = List.copyOf(steps);
        }

        @Override
        public boolean isSolved() {
            return false;
        }
    }
}
