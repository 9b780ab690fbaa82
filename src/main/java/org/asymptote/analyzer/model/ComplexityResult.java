package org.asymptote.analyzer.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Best, worst and average case growth plus the annotations explaining them.
 *
 * @param best The best case, reported as a lower bound.
 * @param worst The worst case, reported as an upper bound.
 * @param average The heuristic average case.
 * @param annotations The notes attached by the producing stage.
 */
public record ComplexityResult(
        GrowthRate best,
        GrowthRate worst,
        GrowthRate average,
        List<Annotation> annotations
) {

    public ComplexityResult {
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    /**
     * @param rate A growth rate.
     * @return A result with all three cases equal.
     */
    public static ComplexityResult uniform(GrowthRate rate) {
        return new ComplexityResult(rate, rate, rate, List.of());
    }

    public boolean hasAnnotation(AnnotationKind kind) {
        return annotations.stream().anyMatch(a -> a.kind() == kind);
    }

    /**
     * @return {@code true} if any annotation marks the result as resting on an assumption.
     */
    public boolean hasAssumptions() {
        return annotations.stream().anyMatch(Annotation::assumption);
    }

    /**
     * @param more Annotations to append.
     * @return A copy with the annotations appended.
     */
    public ComplexityResult withAnnotations(Collection<Annotation> more) {
        List<Annotation> all = new ArrayList<>(annotations);
        all.addAll(more);
        return new ComplexityResult(best, worst, average, all);
    }

    public boolean isTight() {
        return best.compareTo(worst) == 0;
    }
}
