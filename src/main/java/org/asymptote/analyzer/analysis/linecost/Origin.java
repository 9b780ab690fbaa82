package org.asymptote.analyzer.analysis.linecost;

/**
 * Where the cost of a line comes from.
 */
public enum Origin {
    /** Derived from the enclosing loops. */
    STRUCTURAL,
    /** The line makes a recursive call whose cost is a term of a recurrence. */
    RECURRENCE
}
