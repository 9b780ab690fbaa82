package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.model.Annotation;
import org.asymptote.analyzer.model.AnnotationKind;
import org.asymptote.analyzer.model.Bound;
import org.asymptote.analyzer.model.GrowthRate;
import org.asymptote.analyzer.model.MathStep;
import org.asymptote.analyzer.model.SolutionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Solves recurrences in closed form.
 * <p>
 * Methods are tried in a fixed order: the Master theorem for {@code a T(n/b) + f(n)}, the special
 * forms of subtractive recurrences (summation, unrolling, characteristic equation), and finally a
 * bounded substitution that evaluates the recurrence numerically for a capped number of sample sizes
 * and looks for a candidate growth the samples converge to. Data-dependent splits and undeduced
 * sizes are never guessed at.
 */
public class RecurrenceSolver {

    private static final Logger LOG = LoggerFactory.getLogger(RecurrenceSolver.class);

    /** The default number of substitution samples. */
    public static final int DEFAULT_SUBSTITUTION_STEPS = 10;

    private static final int MIN_STEPS = 4;
    private static final int MAX_STEPS = 16;
    private static final int CONVERGENCE_WINDOW = 4;
    private static final double CONVERGENCE_TOLERANCE = 1.2;

    private static final List<GrowthRate> CANDIDATES = List.of(
            GrowthRate.CONSTANT,
            GrowthRate.LOGARITHMIC,
            new GrowthRate(0, 2, 1),
            GrowthRate.polynomial(0.5),
            GrowthRate.LINEAR,
            GrowthRate.LINEARITHMIC,
            new GrowthRate(1, 2, 1),
            GrowthRate.polynomial(1.5),
            GrowthRate.QUADRATIC,
            new GrowthRate(2, 1, 1),
            GrowthRate.CUBIC,
            GrowthRate.polynomial(4));

    private final int substitutionSteps;

    public RecurrenceSolver() {
        this(DEFAULT_SUBSTITUTION_STEPS);
    }

    /**
     * @param substitutionSteps The number of sample sizes the substitution method evaluates,
     *                          clamped to {@code [4, 16]}.
     */
    public RecurrenceSolver(int substitutionSteps) {
        this.substitutionSteps = Math.max(MIN_STEPS, Math.min(MAX_STEPS, substitutionSteps));
    }

    /**
     * @param relation The recurrence.
     * @return The closed form, or {@link SolverOutcome.Unsolvable} with the reason.
     */
    public SolverOutcome solve(RecurrenceRelation relation) {
        List<MathStep> steps = new ArrayList<>();
        steps.add(new MathStep("Recurrence", relation.equation()));
        if (relation.terms().isEmpty()) {
            return unsolvable("the relation has no recursive term", steps);
        }
        if (relation.anyTransformIs(SizeTransform.Split.class)) {
            steps.add(new MathStep("Classification", "data-dependent split T(k) + T(n-k-1)"));
            return unsolvable("the split point k depends on the input data, so no single closed form exists", steps);
        }
        if (relation.anyTransformIs(SizeTransform.Unknown.class)) {
            steps.add(new MathStep("Classification", "undeduced subproblem size T(?)"));
            return unsolvable("the size of a recursive call could not be deduced", steps);
        }

        SolverOutcome outcome;
        if (relation.allTransformsAre(SizeTransform.Divide.class) && sameDivisor(relation)) {
            outcome = master(relation, steps);
        } else if (relation.allTransformsAre(SizeTransform.Subtract.class)) {
            outcome = relation.nonRecursiveCost().isExponential()
                    ? exponentialSummation(relation, steps)
                    : subtractive(relation, steps);
        } else {
            outcome = substitution(relation, steps);
        }
        if (outcome instanceof SolverOutcome.Solved solved) {
            LOG.debug("Solved {} by {}: {}", relation.equation(), solved.method(), solved.bound().toNotation(Bound.THETA));
        } else {
            LOG.info("Could not solve {}", relation.equation());
        }
        return outcome;
    }

    private static boolean sameDivisor(RecurrenceRelation relation) {
        double first = ((SizeTransform.Divide) relation.terms().get(0).transform()).divisor();
        return relation.terms().stream()
                .allMatch(t -> Math.abs(((SizeTransform.Divide) t.transform()).divisor() - first) < 1e-9);
    }

    // Master theorem.

    private SolverOutcome master(RecurrenceRelation relation, List<MathStep> steps) {
        int a = relation.totalCalls();
        double b = ((SizeTransform.Divide) relation.terms().get(0).transform()).divisor();
        GrowthRate f = relation.nonRecursiveCost();
        if (f.isExponential()) {
            return substitution(relation, steps);
        }
        double c = Math.log(a) / Math.log(b);
        GrowthRate critical = GrowthRate.polynomial(c);

        steps.add(new MathStep("Identify coefficients", "a = " + a));
        steps.add(new MathStep("Identify coefficients", "b = " + GrowthRate.formatNumber(b)));
        steps.add(new MathStep("Identify coefficients", "f(n) = " + f.render()));
        steps.add(new MathStep("Critical exponent", "c = log_" + GrowthRate.formatNumber(b) + "(" + a + ") = "
                + GrowthRate.formatNumber(critical.degree())));

        MasterCase masterCase = masterCase(a, b, f);
        List<Annotation> annotations = new ArrayList<>();
        String comparison;
        switch (masterCase.number()) {
            case 1:
                comparison = "f(n) = " + f.render() + " grows slower than n^c = " + critical.render() + " (case 1)";
                break;
            case 2:
                comparison = "f(n) = " + f.render() + " matches n^c = " + critical.render()
                        + (f.logPower() > 0 ? " up to log^" + f.logPower() + " n" : "") + " (case 2)";
                break;
            default:
                comparison = "f(n) = " + f.render() + " grows faster than n^c = " + critical.render() + " (case 3)";
                annotations.add(Annotation.assumption(AnnotationKind.ASSUMPTION,
                        "Regularity condition a·f(n/b) <= k·f(n) for some k < 1 is assumed, not verified", 0));
                break;
        }
        steps.add(new MathStep("Comparison", comparison));
        steps.add(new MathStep("Conclusion", "T(n) = " + masterCase.bound().toNotation(Bound.THETA)));

        String justification = String.format("Master theorem case %d with a = %d, b = %s, f(n) = %s: T(n) = %s",
                masterCase.number(), a, GrowthRate.formatNumber(b), f.render(), masterCase.bound().toNotation(Bound.THETA));
        if (masterCase.number() == 3) {
            justification += " (regularity condition assumed)";
        }
        return new SolverOutcome.Solved(masterCase.bound(), SolutionMethod.MASTER_THEOREM, justification, steps, annotations);
    }

    /**
     * The case of the Master theorem that applies and the bound it yields.
     *
     * @param number 1, 2 or 3.
     * @param bound The resulting growth.
     */
    public record MasterCase(int number, GrowthRate bound) {
    }

    /**
     * Applies the Master theorem to {@code T(n) = a T(n/b) + f(n)}; case 2 covers
     * {@code f(n) = n^c log^k n} with result {@code n^c log^(k+1) n}.
     * @param a The number of subproblems, at least one.
     * @param b The shrink factor, greater than one.
     * @param f The non-exponential cost outside the recursive calls.
     * @return The case and bound.
     */
    public static MasterCase masterCase(int a, double b, GrowthRate f) {
        GrowthRate critical = GrowthRate.polynomial(Math.log(a) / Math.log(b));
        int byDegree = Double.compare(snap(f.degree()), snap(critical.degree()));
        if (byDegree < 0) {
            return new MasterCase(1, critical);
        }
        if (byDegree == 0) {
            return new MasterCase(2, new GrowthRate(critical.degree(), f.logPower() + 1, 1));
        }
        return new MasterCase(3, f);
    }

    private static double snap(double value) {
        return Math.round(value * 1e9) / 1e9;
    }

    // Subtractive forms.

    private SolverOutcome subtractive(RecurrenceRelation relation, List<MathStep> steps) {
        GrowthRate f = relation.nonRecursiveCost();
        TreeMap<Integer, Integer> coefficients = new TreeMap<>();
        for (RecursiveTerm term : relation.terms()) {
            coefficients.merge(((SizeTransform.Subtract) term.transform()).amount(), term.coefficient(), Integer::sum);
        }

        if (coefficients.size() == 1) {
            int amount = coefficients.keySet().iterator().next();
            int a = coefficients.get(amount);
            if (a == 1) {
                GrowthRate bound = GrowthRate.LINEAR.times(f);
                steps.add(new MathStep("Unroll", "T(n) = f(n) + f(n-" + amount + ") + f(n-" + (2 * amount) + ") + ... + T(1)"));
                steps.add(new MathStep("Number of terms", amount == 1 ? "n" : "n/" + amount));
                steps.add(new MathStep("Summation", "Σ f(n - " + amount + "i) with f(n) = " + f.render()
                        + " is Θ(n · " + f.render() + ")"));
                steps.add(new MathStep("Conclusion", "T(n) = " + bound.toNotation(Bound.THETA)));
                return new SolverOutcome.Solved(bound, SolutionMethod.SUMMATION,
                        "Each call removes " + amount + " from the input and costs " + f.render()
                                + ", so the " + (amount == 1 ? "n" : "n/" + amount) + " levels sum to "
                                + bound.toNotation(Bound.THETA),
                        steps, List.of());
            }
            double base = Math.pow(a, 1.0 / amount);
            GrowthRate bound = GrowthRate.exponential(base);
            steps.add(new MathStep("Unroll", "level i has " + a + "^i calls of cost f(n-" + amount + "i)"));
            steps.add(new MathStep("Depth", amount == 1 ? "n levels" : "n/" + amount + " levels"));
            steps.add(new MathStep("Summation", "Σ " + a + "^i · f(n-" + amount + "i) is dominated by the last level, "
                    + a + "^(n/" + amount + ")"));
            steps.add(new MathStep("Conclusion", "T(n) = " + bound.toNotation(Bound.THETA)));
            return new SolverOutcome.Solved(bound, SolutionMethod.UNROLLING,
                    a + " calls on n-" + amount + " multiply the number of calls by " + a
                            + " per level: T(n) = " + bound.toNotation(Bound.THETA),
                    steps, List.of());
        }

        int order = coefficients.lastKey();
        double root = dominantRoot(coefficients, order);
        GrowthRate bound = GrowthRate.exponential(root);
        steps.add(new MathStep("Characteristic equation", characteristic(coefficients, order)));
        boolean fibonacci = coefficients.equals(Map.of(1, 1, 2, 1));
        steps.add(new MathStep("Dominant root", String.format(Locale.ROOT, "r ≈ %.3f", root)
                + (fibonacci ? " (φ, the golden ratio)" : "")));
        steps.add(new MathStep("Conclusion", "T(n) = " + bound.toNotation(Bound.THETA)));

        List<Annotation> annotations = new ArrayList<>();
        String justification;
        if (fibonacci) {
            annotations.add(Annotation.of(AnnotationKind.FIBONACCI_PATTERN,
                    "T(n) = T(n-1) + T(n-2) + f(n) is the Fibonacci recurrence; it grows like φ^n ≈ 1.618^n", 0));
            justification = "Fibonacci-shaped recurrence: the characteristic root is the golden ratio, T(n) = "
                    + bound.toNotation(Bound.THETA) + ", an exponential bound below 2^n";
        } else {
            justification = String.format(Locale.ROOT, "The dominant root of the characteristic equation is %.3f, T(n) = %s",
                    root, bound.toNotation(Bound.THETA));
        }
        return new SolverOutcome.Solved(bound, SolutionMethod.CHARACTERISTIC_EQUATION, justification, steps, annotations);
    }

    /**
     * Sums the levels of a subtractive recurrence whose own cost is exponential,
     * {@code f(n) = b^n · g(n)}. With {@code r} the growth of the homogeneous part ({@code 1} for a
     * single call), the level costs form a geometric series: the top level dominates when
     * {@code b > r}, the leaves when {@code b < r}, and all {@code n} levels weigh alike when they match.
     */
    private SolverOutcome exponentialSummation(RecurrenceRelation relation, List<MathStep> steps) {
        GrowthRate f = relation.nonRecursiveCost();
        TreeMap<Integer, Integer> coefficients = new TreeMap<>();
        for (RecursiveTerm term : relation.terms()) {
            coefficients.merge(((SizeTransform.Subtract) term.transform()).amount(), term.coefficient(), Integer::sum);
        }
        int order = coefficients.lastKey();
        double root = relation.totalCalls() == 1 ? 1 : dominantRoot(coefficients, order);
        double base = f.exponentialBase();

        GrowthRate bound;
        String dominated;
        if (Math.abs(base - root) < 1e-6) {
            bound = f.times(GrowthRate.LINEAR);
            dominated = "every one of the n levels costs about f(n)";
        } else if (base > root) {
            bound = f;
            dominated = "the series is dominated by its first term f(n)";
        } else {
            bound = GrowthRate.exponential(root);
            dominated = "the series is dominated by the " + GrowthRate.formatNumber(root) + "^n leaves";
        }
        steps.add(new MathStep("Unroll", "T(n) = Σ level costs, level i costs about "
                + GrowthRate.formatNumber(root) + "^i · f(n - i) with f(n) = " + f.render()));
        steps.add(new MathStep("Summation", "ratio between consecutive levels ≈ "
                + GrowthRate.formatNumber(root) + "/" + GrowthRate.formatNumber(base) + ", so " + dominated));
        steps.add(new MathStep("Conclusion", "T(n) = " + bound.toNotation(Bound.THETA)));
        return new SolverOutcome.Solved(bound, SolutionMethod.SUMMATION,
                "The exponential cost " + f.render() + " forms a geometric series over the levels; "
                        + dominated + ": T(n) = " + bound.toNotation(Bound.THETA),
                steps, List.of());
    }

    private static String characteristic(Map<Integer, Integer> coefficients, int order) {
        StringBuilder rhs = new StringBuilder();
        for (Map.Entry<Integer, Integer> entry : coefficients.entrySet()) {
            int power = order - entry.getKey();
            if (rhs.length() > 0) {
                rhs.append(" + ");
            }
            if (entry.getValue() != 1) {
                rhs.append(entry.getValue());
            }
            rhs.append(power == 0 ? (entry.getValue() == 1 ? "1" : "") : power == 1 ? "x" : "x^" + power);
        }
        return "x^" + order + " = " + rhs;
    }

    /**
     * Finds the largest real root of {@code x^k = Σ a_j x^(k - c_j)} by bisection. The polynomial is
     * negative at 1 and positive at {@code 1 + Σ a_j}, and the root there is unique.
     */
    static double dominantRoot(Map<Integer, Integer> coefficients, int order) {
        int sum = coefficients.values().stream().mapToInt(Integer::intValue).sum();
        double low = 1;
        double high = 1 + sum;
        for (int i = 0; i < 200; i++) {
            double mid = (low + high) / 2;
            double value = Math.pow(mid, order);
            for (Map.Entry<Integer, Integer> entry : coefficients.entrySet()) {
                value -= entry.getValue() * Math.pow(mid, order - entry.getKey());
            }
            if (value > 0) {
                high = mid;
            } else {
                low = mid;
            }
        }
        return (low + high) / 2;
    }

    // Bounded substitution.

    private SolverOutcome substitution(RecurrenceRelation relation, List<MathStep> steps) {
        int size = 1 << (substitutionSteps + 2);
        double[] t = new double[size + 1];
        t[0] = 1;
        t[1] = 1;
        GrowthRate f = relation.nonRecursiveCost();
        for (int m = 2; m <= size; m++) {
            double value = evaluate(f, m);
            for (RecursiveTerm term : relation.terms()) {
                int sub = (int) Math.floor(term.transform().apply(m));
                sub = Math.max(0, Math.min(m - 1, sub));
                value += term.coefficient() * t[sub];
            }
            t[m] = value;
        }

        int[] samples = new int[substitutionSteps];
        for (int i = 0; i < substitutionSteps; i++) {
            samples[i] = 1 << (i + 3);
            steps.add(new MathStep("Substitute n = " + samples[i], "T(" + samples[i] + ") ≈ " + format(t[samples[i]])));
        }

        for (GrowthRate candidate : CANDIDATES) {
            double min = Double.POSITIVE_INFINITY;
            double max = 0;
            boolean finite = true;
            for (int i = substitutionSteps - CONVERGENCE_WINDOW; i < substitutionSteps; i++) {
                double ratio = t[samples[i]] / evaluate(candidate, samples[i]);
                if (!Double.isFinite(ratio) || ratio <= 0) {
                    finite = false;
                    break;
                }
                min = Math.min(min, ratio);
                max = Math.max(max, ratio);
            }
            if (finite && max / min <= CONVERGENCE_TOLERANCE) {
                steps.add(new MathStep("Candidate", "g(n) = " + candidate.render() + ", T(n)/g(n) stays within ["
                        + format(min) + ", " + format(max) + "] over the last " + CONVERGENCE_WINDOW + " samples"));
                steps.add(new MathStep("Conclusion", "T(n) = " + candidate.toNotation(Bound.THETA)));
                return new SolverOutcome.Solved(candidate, SolutionMethod.SUBSTITUTION,
                        "Evaluating the recurrence up to n = " + samples[substitutionSteps - 1]
                                + " shows T(n)/" + candidate.render() + " converging",
                        steps, List.of(Annotation.assumption(AnnotationKind.ASSUMPTION,
                                "Bound inferred from " + substitutionSteps + " numeric samples, not proven", 0)));
            }
        }
        steps.add(new MathStep("Candidate", "no candidate growth up to n^4 matches the samples"));
        return unsolvable("bounded substitution did not converge within " + substitutionSteps + " samples", steps);
    }

    private static double evaluate(GrowthRate rate, double n) {
        double log = Math.max(1, Math.log(n) / Math.log(2));
        return Math.pow(n, rate.degree()) * Math.pow(log, rate.logPower()) * Math.pow(rate.exponentialBase(), n);
    }

    private static String format(double value) {
        if (!Double.isFinite(value)) {
            return "∞";
        }
        if (Math.abs(value) >= 1e6) {
            return String.format(Locale.ROOT, "%.3e", value);
        }
        return GrowthRate.formatNumber(value);
    }

    private static SolverOutcome unsolvable(String reason, List<MathStep> steps) {
        steps.add(new MathStep("Result", "unsolvable: " + reason));
        return new SolverOutcome.Unsolvable(reason, steps);
    }
}
