package org.asymptote.analyzer.model;

/**
 * The shapes and events the analysis stages flag on a result.
 */
public enum AnnotationKind {
    /** A call, possibly recursive, nested inside a loop body; charged multiplicatively. */
    CALL_INSIDE_LOOP,
    /** A recursive call operating on a subrange, such as {@code mid} or {@code low..high} splits. */
    DIVIDE_AND_CONQUER_CANDIDATE,
    /** A conditional loop whose progress could not be classified; the bound is conservative. */
    UNRESOLVED_PROGRESS,
    /** A loop that divides or multiplies its control value by a constant each pass. */
    LOGARITHMIC_LOOP,
    /** A loop that can leave after its first iteration through a return or a flag. */
    EARLY_EXIT,
    /** A loop controlled only by a boolean flag. */
    FLAG_CONTROLLED_LOOP,
    /** A recognized recursion shape. */
    RECURSION,
    /** A recurrence was extracted but could not be solved in closed form. */
    RECURRENCE_UNSOLVED,
    /** A Fibonacci-shaped recurrence. */
    FIBONACCI_PATTERN,
    /** A result that relies on an assumption rather than a derivation. */
    ASSUMPTION
}
