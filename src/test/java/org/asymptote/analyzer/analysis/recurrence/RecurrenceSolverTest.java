package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.model.Annotation;
import org.asymptote.analyzer.model.AnnotationKind;
import org.asymptote.analyzer.model.GrowthRate;
import org.asymptote.analyzer.model.MathStep;
import org.asymptote.analyzer.model.SolutionMethod;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

/**
 * Unit tests for the {@link RecurrenceSolver}.
 * The recurrences are given in text form and parsed with {@link RecurrenceParser}.
 */
public class RecurrenceSolverTest {

    private final RecurrenceSolver solver = new RecurrenceSolver();

    private SolverOutcome.Solved solved(String recurrence) {
        SolverOutcome outcome = solver.solve(RecurrenceParser.parse(recurrence));
        assertThat(outcome).isInstanceOf(SolverOutcome.Solved.class);
        return (SolverOutcome.Solved) outcome;
    }

    /**
     * The merge sort recurrence falls into case 2; the derivation names a, b, f(n) and the critical exponent.
     */
    @Test
    @Tag("unit")
    void testMasterTheoremCaseTwo() {
        // Act
        SolverOutcome.Solved outcome = solved("T(n) = 2T(n/2) + n");

        // Assert
        assertThat(outcome.bound()).isEqualTo(GrowthRate.LINEARITHMIC);
        assertThat(outcome.method()).isEqualTo(SolutionMethod.MASTER_THEOREM);
        assertThat(outcome.steps()).extracting(MathStep::value)
                .contains("a = 2", "b = 2", "f(n) = n", "c = log_2(2) = 1", "T(n) = Θ(n log n)");
        assertThat(outcome.justification()).contains("case 2");
    }

    @Test
    @Tag("unit")
    void testMasterTheoremCaseOne() {
        SolverOutcome.Solved outcome = solved("T(n) = 8T(n/2) + n^2");

        assertThat(outcome.bound()).isEqualTo(GrowthRate.CUBIC);
        assertThat(outcome.justification()).contains("case 1");
    }

    /**
     * Case 3 holds only under the regularity condition, which is recorded as an assumption.
     */
    @Test
    @Tag("unit")
    void testMasterTheoremCaseThree() {
        SolverOutcome.Solved outcome = solved("T(n) = 2T(n/2) + n^2");

        assertThat(outcome.bound()).isEqualTo(GrowthRate.QUADRATIC);
        assertThat(outcome.annotations()).anyMatch(a -> a.assumption() && a.kind() == AnnotationKind.ASSUMPTION);
        assertThat(outcome.justification()).endsWith("(regularity condition assumed)");
    }

    @Test
    @Tag("unit")
    void testBinarySearchRecurrence() {
        SolverOutcome.Solved outcome = solved("T(n) = T(n/2) + 1");

        assertThat(outcome.bound()).isEqualTo(GrowthRate.LOGARITHMIC);
    }

    @Test
    @Tag("unit")
    void testFractionalCriticalExponent() {
        SolverOutcome.Solved outcome = solved("T(n) = 3T(n/2) + n");

        assertThat(outcome.bound().degree()).isCloseTo(Math.log(3) / Math.log(2), offset(1e-9));
        assertThat(outcome.bound().render()).isEqualTo("n^1.58");
    }

    @Test
    @Tag("unit")
    void testLinearRecursionSums() {
        SolverOutcome.Solved constant = solved("T(n) = T(n-1) + 1");
        SolverOutcome.Solved linear = solved("T(n) = T(n-1) + n");

        assertThat(constant.bound()).isEqualTo(GrowthRate.LINEAR);
        assertThat(constant.method()).isEqualTo(SolutionMethod.SUMMATION);
        assertThat(linear.bound()).isEqualTo(GrowthRate.QUADRATIC);
    }

    /**
     * Two calls on n-1 double the work per level: the towers of Hanoi.
     */
    @Test
    @Tag("unit")
    void testUnrollingDoublesPerLevel() {
        SolverOutcome.Solved outcome = solved("T(n) = 2T(n-1) + 1");

        assertThat(outcome.bound()).isEqualTo(GrowthRate.EXPONENTIAL);
        assertThat(outcome.method()).isEqualTo(SolutionMethod.UNROLLING);
    }

    /**
     * An exponential cost per level is summed as a geometric series instead of being sampled.
     */
    @Test
    @Tag("unit")
    void testExponentialCostIsSummed() {
        // Act
        SolverOutcome.Solved single = solved("T(n) = T(n-1) + 2^n");
        SolverOutcome.Solved matching = solved("T(n) = 2T(n-1) + 2^n");
        SolverOutcome.Solved leaves = solved("T(n) = 3T(n-1) + 2^n");

        // Assert
        assertThat(single.bound()).isEqualTo(GrowthRate.EXPONENTIAL);
        assertThat(single.method()).isEqualTo(SolutionMethod.SUMMATION);
        assertThat(single.steps()).extracting(MathStep::value).contains("T(n) = Θ(2^n)");
        assertThat(matching.bound()).isEqualTo(GrowthRate.EXPONENTIAL.times(GrowthRate.LINEAR));
        assertThat(leaves.bound()).isEqualTo(GrowthRate.exponential(3));
    }

    @Test
    @Tag("unit")
    void testFibonacciUsesTheGoldenRatio() {
        // Act
        SolverOutcome.Solved outcome = solved("T(n) = T(n-1) + T(n-2) + 1");

        // Assert
        assertThat(outcome.method()).isEqualTo(SolutionMethod.CHARACTERISTIC_EQUATION);
        assertThat(outcome.bound().exponentialBase()).isCloseTo(GrowthRate.GOLDEN_RATIO, offset(1e-6));
        assertThat(outcome.bound().render()).isEqualTo("φ^n");
        assertThat(outcome.annotations()).extracting(Annotation::kind).containsExactly(AnnotationKind.FIBONACCI_PATTERN);
        assertThat(outcome.steps()).extracting(MathStep::value).contains("x^2 = x + 1");
    }

    @Test
    @Tag("unit")
    void testDominantRootOfTribonacci() {
        Map<Integer, Integer> coefficients = new TreeMap<>(Map.of(1, 1, 2, 1, 3, 1));

        double root = RecurrenceSolver.dominantRoot(coefficients, 3);

        assertThat(root).isCloseTo(1.839, offset(1e-3));
    }

    /**
     * Different divisors are outside the Master theorem; the numeric samples converge to a linear bound.
     */
    @Test
    @Tag("unit")
    void testSubstitutionForUnevenDivisors() {
        // Act
        SolverOutcome.Solved outcome = solved("T(n) = T(n/2) + T(n/4) + n");

        // Assert
        assertThat(outcome.method()).isEqualTo(SolutionMethod.SUBSTITUTION);
        assertThat(outcome.bound()).isEqualTo(GrowthRate.LINEAR);
        assertThat(outcome.steps()).filteredOn(s -> s.label().startsWith("Substitute n = ")).hasSize(10);
        assertThat(outcome.annotations()).allMatch(Annotation::assumption);
    }

    @Test
    @Tag("unit")
    void testSubstitutionStepsAreConfigurable() {
        SolverOutcome outcome = new RecurrenceSolver(6).solve(RecurrenceParser.parse("T(n) = T(n/2) + T(n/4) + n"));

        assertThat(outcome.steps()).filteredOn(s -> s.label().startsWith("Substitute n = ")).hasSize(6);
    }

    @Test
    @Tag("unit")
    void testDataDependentSplitIsUnsolvable() {
        // Act
        SolverOutcome outcome = solver.solve(RecurrenceParser.parse("T(n) = T(k) + T(n-k-1) + n"));

        // Assert
        assertThat(outcome.isSolved()).isFalse();
        assertThat(((SolverOutcome.Unsolvable) outcome).reason()).contains("split point");
        assertThat(outcome.steps()).last().extracting(MathStep::label).isEqualTo("Result");
    }

    @Test
    @Tag("unit")
    void testUndeducedSizeIsUnsolvable() {
        SolverOutcome outcome = solver.solve(RecurrenceParser.parse("T(n) = T(sqrt n) + 1"));

        assertThat(outcome).isInstanceOf(SolverOutcome.Unsolvable.class);
    }

    @Test
    @Tag("unit")
    void testDivergingSubstitutionIsUnsolvable() {
        SolverOutcome outcome = solver.solve(RecurrenceParser.parse("T(n) = T(n/2) + T(n/3) + 2^n"));

        assertThat(outcome).isInstanceOf(SolverOutcome.Unsolvable.class);
        assertThat(((SolverOutcome.Unsolvable) outcome).reason()).contains("did not converge");
    }

    @Test
    @Tag("unit")
    void testMasterCaseSelection() {
        assertThat(RecurrenceSolver.masterCase(1, 2, GrowthRate.CONSTANT))
                .isEqualTo(new RecurrenceSolver.MasterCase(2, GrowthRate.LOGARITHMIC));
        assertThat(RecurrenceSolver.masterCase(4, 2, GrowthRate.LINEAR).number()).isEqualTo(1);
        assertThat(RecurrenceSolver.masterCase(2, 2, GrowthRate.LINEARITHMIC).bound())
                .isEqualTo(new GrowthRate(1, 2, 1));
    }
}
