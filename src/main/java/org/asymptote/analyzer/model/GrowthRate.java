package org.asymptote.analyzer.model;

import java.util.Locale;

/**
 * A symbolic growth descriptor over the input size {@code n}: {@code b^n · n^d · log^k n}.
 * <p>
 * Instances are ordered by asymptotic dominance: the exponential base first, then the polynomial
 * degree, then the logarithm power. Degrees and bases within {@code 1e-9} of an integer are snapped
 * to it, so that computed exponents such as {@code log_2(8)} compare equal to their exact value.
 *
 * @param degree The polynomial degree, {@code >= 0}.
 * @param logPower The power of the logarithmic factor, {@code >= 0}.
 * @param exponentialBase The exponential base; {@code 1} means no exponential factor.
 */
public record GrowthRate(double degree, int logPower, double exponentialBase) implements Comparable<GrowthRate> {

    private static final double EPSILON = 1e-9;

    /** The golden ratio, the growth base of Fibonacci-shaped recursion. */
    public static final double GOLDEN_RATIO = (1 + Math.sqrt(5)) / 2;

    public static final GrowthRate CONSTANT = new GrowthRate(0, 0, 1);
    public static final GrowthRate LOGARITHMIC = new GrowthRate(0, 1, 1);
    public static final GrowthRate LINEAR = new GrowthRate(1, 0, 1);
    public static final GrowthRate LINEARITHMIC = new GrowthRate(1, 1, 1);
    public static final GrowthRate QUADRATIC = new GrowthRate(2, 0, 1);
    public static final GrowthRate CUBIC = new GrowthRate(3, 0, 1);
    public static final GrowthRate EXPONENTIAL = new GrowthRate(0, 0, 2);

    public GrowthRate {
        if (degree < 0 || logPower < 0 || exponentialBase < 1 - EPSILON) {
            throw new IllegalArgumentException("Invalid growth rate: degree=" + degree
                    + ", logPower=" + logPower + ", base=" + exponentialBase);
        }
        degree = snap(degree);
        exponentialBase = Math.max(1, snap(exponentialBase));
    }

    /**
     * @param degree A polynomial degree.
     * @return {@code n^degree}.
     */
    public static GrowthRate polynomial(double degree) {
        return new GrowthRate(degree, 0, 1);
    }

    /**
     * @param base An exponential base greater than one.
     * @return {@code base^n}.
     */
    public static GrowthRate exponential(double base) {
        return new GrowthRate(0, 0, base);
    }

    private static double snap(double value) {
        double rounded = Math.rint(value);
        return Math.abs(value - rounded) < EPSILON ? rounded : value;
    }

    /**
     * @param other Another growth rate.
     * @return The growth of the product of both costs.
     */
    public GrowthRate times(GrowthRate other) {
        return new GrowthRate(degree + other.degree, logPower + other.logPower,
                exponentialBase * other.exponentialBase);
    }

    /**
     * @param other Another growth rate.
     * @return The dominating one of the two, which is also the growth of their sum.
     */
    public GrowthRate max(GrowthRate other) {
        return compareTo(other) >= 0 ? this : other;
    }

    /**
     * @param other Another growth rate.
     * @return The dominated one of the two.
     */
    public GrowthRate min(GrowthRate other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public boolean isConstant() {
        return degree == 0 && logPower == 0 && !isExponential();
    }

    public boolean isExponential() {
        return exponentialBase > 1;
    }

    public boolean isPolylogarithmic() {
        return !isExponential() && degree == 0 && logPower > 0;
    }

    public boolean dominates(GrowthRate other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(GrowthRate other) {
        int byBase = compareWithTolerance(exponentialBase, other.exponentialBase);
        if (byBase != 0) {
            return byBase;
        }
        int byDegree = compareWithTolerance(degree, other.degree);
        if (byDegree != 0) {
            return byDegree;
        }
        return Integer.compare(logPower, other.logPower);
    }

    private static int compareWithTolerance(double a, double b) {
        if (Math.abs(a - b) < EPSILON) {
            return 0;
        }
        return Double.compare(a, b);
    }

    /**
     * Renders the growth in the usual notation, e.g. {@code 1}, {@code log n}, {@code n log n},
     * {@code n^2}, {@code n^1.58}, {@code 2^n} or {@code φ^n}.
     * @param variable The name of the size variable, usually {@code n}.
     * @return The rendered expression.
     */
    public String render(String variable) {
        StringBuilder out = new StringBuilder();
        if (isExponential()) {
            out.append(formatBase(exponentialBase)).append('^').append(variable);
        }
        if (degree > 0) {
            appendPart(out, degree == 1 ? variable : variable + "^" + formatNumber(degree));
        }
        if (logPower > 0) {
            appendPart(out, logPower == 1 ? "log " + variable : "log^" + logPower + " " + variable);
        }
        return out.length() == 0 ? "1" : out.toString();
    }

    /**
     * @return The rendering over {@code n}.
     */
    public String render() {
        return render("n");
    }

    /**
     * Evaluates the growth at a concrete size, with base-2 logarithms floored at one.
     * @param size A positive input size.
     * @return The nominal cost at that size.
     */
    public double valueAt(double size) {
        double n = Math.max(size, 1);
        double log = Math.max(Math.log(n) / Math.log(2), 1);
        return Math.pow(exponentialBase, n) * Math.pow(n, degree) * Math.pow(log, logPower);
    }

    /**
     * @param bound The notation.
     * @return For example {@code Θ(n log n)}.
     */
    public String toNotation(Bound bound) {
        return bound.symbol() + "(" + render() + ")";
    }

    private static void appendPart(StringBuilder out, String part) {
        if (out.length() > 0) {
            out.append(' ');
        }
        out.append(part);
    }

    private static String formatBase(double base) {
        if (Math.abs(base - GOLDEN_RATIO) < 1e-6) {
            return "φ";
        }
        return formatNumber(base);
    }

    /**
     * @param value A number.
     * @return The number without a fraction if integral, else with at most two decimals.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        String text = String.format(Locale.ROOT, "%.2f", value);
        while (text.endsWith("0")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }

    @Override
    public String toString() {
        return render();
    }
}
