package org.asymptote.analyzer.model;

/**
 * The method that produced a final bound.
 */
public enum SolutionMethod {
    MASTER_THEOREM("Master theorem"),
    SUMMATION("Summation of the unrolled recurrence"),
    UNROLLING("Unrolling"),
    CHARACTERISTIC_EQUATION("Characteristic equation"),
    SUBSTITUTION("Bounded substitution"),
    STRUCTURAL("Structural analysis");

    private final String displayName;

    SolutionMethod(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
