package org.asymptote.analyzer.model;

/**
 * The asymptotic notation a growth rate is reported in.
 */
public enum Bound {
    /** Upper bound, used for the worst case. */
    O("O"),
    /** Lower bound, used for the best case. */
    OMEGA("Ω"),
    /** Tight bound, used for the average case and for solved recurrences. */
    THETA("Θ");

    private final String symbol;

    Bound(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
