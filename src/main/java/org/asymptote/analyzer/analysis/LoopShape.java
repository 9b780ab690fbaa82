package org.asymptote.analyzer.analysis;

import org.asymptote.analyzer.model.GrowthRate;

/**
 * The iteration-count descriptor of one loop.
 *
 * @param kind How the loop progresses.
 * @param iterations The number of passes as a function of {@code n}.
 * @param earlyExit {@code true} if the loop can finish after its first pass.
 * @param description A short human readable explanation.
 */
public record LoopShape(ProgressKind kind, GrowthRate iterations, boolean earlyExit, String description) {

    /**
     * @return The factor one pass of the body is multiplied with in the best case.
     */
    public GrowthRate bestIterations() {
        return earlyExit ? GrowthRate.CONSTANT : iterations;
    }

    public boolean isAssumption() {
        return kind == ProgressKind.UNRESOLVED;
    }
}
