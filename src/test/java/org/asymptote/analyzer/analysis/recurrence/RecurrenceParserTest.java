package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.model.GrowthRate;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RecurrenceParser}.
 */
public class RecurrenceParserTest {

    @Test
    @Tag("unit")
    void testParsesCoefficientsAndCost() {
        // Act
        RecurrenceRelation relation = RecurrenceParser.parse("T(n) = 2T(n/2) + n log n");

        // Assert
        assertThat(relation.terms()).containsExactly(new RecursiveTerm(2, new SizeTransform.Divide(2)));
        assertThat(relation.nonRecursiveCost()).isEqualTo(GrowthRate.LINEARITHMIC);
        assertThat(relation.equation()).isEqualTo("T(n) = 2T(n/2) + n log n");
        assertThat(relation.baseCase()).isEqualTo("T(1) = 1 (assumed)");
    }

    /**
     * Repeated terms with the same size are merged; notation wrappers and constant factors are ignored.
     */
    @Test
    @Tag("unit")
    void testMergesTermsAndStripsNotation() {
        RecurrenceRelation relation = RecurrenceParser.parse("T(n) = T(n-1) + T(n-1) + Θ(3n^2)");

        assertThat(relation.terms()).containsExactly(new RecursiveTerm(2, new SizeTransform.Subtract(1)));
        assertThat(relation.nonRecursiveCost()).isEqualTo(GrowthRate.QUADRATIC);
    }

    @Test
    @Tag("unit")
    void testRightHandSideOnly() {
        RecurrenceRelation relation = RecurrenceParser.parse("T(n-1) + T(n-2)");

        assertThat(relation.totalCalls()).isEqualTo(2);
        assertThat(relation.nonRecursiveCost()).isEqualTo(GrowthRate.CONSTANT);
    }

    @Test
    @Tag("unit")
    void testSplitSidesAndExponentialCost() {
        RecurrenceRelation split = RecurrenceParser.parse("T(n) = T(k) + T(n-k-1) + n");
        RecurrenceRelation exponential = RecurrenceParser.parse("T(n) = T(n/2) + 2^n");

        assertThat(split.terms()).extracting(RecursiveTerm::transform)
                .containsExactly(new SizeTransform.Split(true), new SizeTransform.Split(false));
        assertThat(exponential.nonRecursiveCost()).isEqualTo(GrowthRate.EXPONENTIAL);
    }

    @Test
    @Tag("unit")
    void testRejectsMalformedInput() {
        assertThatThrownBy(() -> RecurrenceParser.parse("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecurrenceParser.parse("T(n) = n^2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No recursive term");
        assertThatThrownBy(() -> RecurrenceParser.parse("T(n) = T(n/1) + 1"))
                .hasMessageContaining("Divisor must be greater than 1");
        assertThatThrownBy(() -> RecurrenceParser.parse("T(n) = T(n/2) + banana"))
                .hasMessageContaining("Unsupported cost term");
    }
}
