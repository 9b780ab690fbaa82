package org.asymptote.analyzer.analysis.recurrence;

/**
 * A group of self-calls with the same size transform, e.g. {@code 2T(n/2)}.
 *
 * @param coefficient The number of calls, at least one.
 * @param transform The size transform shared by the calls.
 */
public record RecursiveTerm(int coefficient, SizeTransform transform) {

    public String render() {
        return (coefficient == 1 ? "" : String.valueOf(coefficient)) + "T(" + transform.label() + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
