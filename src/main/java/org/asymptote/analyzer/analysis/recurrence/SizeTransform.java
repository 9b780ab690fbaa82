package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.model.GrowthRate;

/**
 * How the input size of a recursive call relates to the size of the calling invocation.
 */
public sealed interface SizeTransform {

    /**
     * @return The symbolic size of the subproblem, e.g. {@code n-1}, {@code n/2}, {@code k}.
     */
    String label();

    /**
     * @param size A concrete input size.
     * @return The nominal size of the subproblem, never larger than {@code size - 1} for shrinking transforms.
     */
    double apply(double size);

    /**
     * {@code n - amount}.
     *
     * @param amount The constant decrement, at least one.
     */
    record Subtract(int amount) implements SizeTransform {
        @Override
        public String label() {
            return "n-" + amount;
        }

        @Override
        public double apply(double size) {
            return size - amount;
        }
    }

    /**
     * {@code n / divisor}.
     *
     * @param divisor The constant divisor, greater than one.
     */
    record Divide(double divisor) implements SizeTransform {
        @Override
        public String label() {
            return "n/" + GrowthRate.formatNumber(divisor);
        }

        @Override
        public double apply(double size) {
            return Math.floor(size / divisor);
        }
    }

    /**
     * One side of a data-dependent split at position {@code k}, as in partition-based sorting.
     * Nominally balanced.
     *
     * @param left {@code true} for the part of size {@code k}, {@code false} for {@code n-k-1}.
     */
    record Split(boolean left) implements SizeTransform {
        @Override
        public String label() {
            return left ? "k" : "n-k-1";
        }

        @Override
        public double apply(double size) {
            double half = Math.floor(size / 2);
            return left ? half : size - half - 1;
        }
    }

    /**
     * A size that could not be deduced from the argument expressions. Nominally {@code n-1}.
     *
     * @param expression The argument text that was not understood.
     */
    record Unknown(String expression) implements SizeTransform {
        @Override
        public String label() {
            return "?";
        }

        @Override
        public double apply(double size) {
            return size - 1;
        }
    }
}
