package org.asymptote.analyzer.analysis.structural;

import org.asymptote.analyzer.model.Annotation;
import org.asymptote.analyzer.model.ComplexityResult;
import org.asymptote.analyzer.model.GrowthRate;

import java.util.List;

/**
 * The best, worst and average growth of a piece of code, without annotations.
 */
record CaseCost(GrowthRate best, GrowthRate worst, GrowthRate average) {

    static final CaseCost CONSTANT = uniform(GrowthRate.CONSTANT);

    static CaseCost uniform(GrowthRate rate) {
        return new CaseCost(rate, rate, rate);
    }

    /**
     * Sequential composition: the dominating part wins in every case.
     */
    CaseCost max(CaseCost other) {
        return new CaseCost(best.max(other.best), worst.max(other.worst), average.max(other.average));
    }

    CaseCost times(GrowthRate factor) {
        return new CaseCost(best.times(factor), worst.times(factor), average.times(factor));
    }

    ComplexityResult toResult(List<Annotation> annotations) {
        return new ComplexityResult(best, worst, average, annotations);
    }
}
