package org.asymptote.analyzer.model;

/**
 * One step of an explanatory derivation, e.g. {@code ("Critical exponent", "c = log_2(2) = 1")}.
 *
 * @param label What the step establishes.
 * @param value The formula or value.
 */
public record MathStep(String label, String value) {

    @Override
    public String toString() {
        return label + ": " + value;
    }
}
