package org.asymptote.analyzer.analysis.resolution;

import org.asymptote.analyzer.model.Annotation;
import org.asymptote.analyzer.model.Bound;
import org.asymptote.analyzer.model.GrowthRate;
import org.asymptote.analyzer.model.MathStep;

import java.util.List;

/**
 * The final decision over all analysis stages.
 *
 * @param best The best case, reported as Ω.
 * @param worst The worst case, reported as O.
 * @param average The average case, reported as Θ.
 * @param method The display name of the method that decided the bound.
 * @param justification A sentence explaining the decision.
 * @param steps The math steps of the deciding path.
 * @param annotations The annotations of every stage that contributed.
 */
public record Resolution(
        GrowthRate best,
        GrowthRate worst,
        GrowthRate average,
        String method,
        String justification,
        List<MathStep> steps,
        List<Annotation> annotations
) {

    public Resolution {
        steps = List.copyOf(steps);
        annotations = List.copyOf(annotations);
    }

    /**
     * @return {@code Θ(g)} when all three cases agree, {@code O(worst)} otherwise.
     */
    public String mainResult() {
        boolean tight = best.compareTo(worst) == 0 && average.compareTo(worst) == 0;
        return worst.toNotation(tight ? Bound.THETA : Bound.O);
    }

    public String bestCase() {
        return best.toNotation(Bound.OMEGA);
    }

    public String averageCase() {
        return average.toNotation(Bound.THETA);
    }

    public String worstCase() {
        return worst.toNotation(Bound.O);
    }
}
