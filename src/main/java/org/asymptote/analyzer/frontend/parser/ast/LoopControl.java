package org.asymptote.analyzer.frontend.parser.ast;

/**
 * The control variable and bound of a loop. Conditional loops whose condition does not compare
 * a variable against a bound carry the unresolved state instead of failing.
 *
 * @param variable The control variable, or {@code null} when unresolved.
 * @param bound The bound the variable is compared against, or {@code null} when unresolved.
 */
public record LoopControl(Identifier variable, Expression bound) {

    private static final LoopControl UNRESOLVED = new LoopControl(null, null);

    public static LoopControl unresolved() {
        return UNRESOLVED;
    }

    public boolean isResolved() {
        return variable != null;
    }
}
