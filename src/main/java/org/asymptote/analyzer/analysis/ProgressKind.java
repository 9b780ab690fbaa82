package org.asymptote.analyzer.analysis;

/**
 * How a loop moves toward termination.
 */
public enum ProgressKind {
    /** The control value changes by a constant amount each pass. */
    ADDITIVE,
    /** The control value is multiplied or divided by a constant each pass. */
    MULTIPLICATIVE,
    /** A range {@code [low, high]} is halved around a midpoint each pass. */
    HALVING_RANGE,
    /** The loop counts to the square root of the input. */
    SQUARE_ROOT,
    /** Both bounds are constants. */
    CONSTANT_BOUND,
    /** The loop runs until a boolean flag changes. */
    FLAG,
    /** The update of the control value could not be classified. */
    UNRESOLVED;

    public boolean isLogarithmic() {
        return this == MULTIPLICATIVE || this == HALVING_RANGE;
    }
}
