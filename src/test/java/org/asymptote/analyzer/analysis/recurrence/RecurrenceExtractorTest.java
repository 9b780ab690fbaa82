package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.SamplePrograms;
import org.asymptote.analyzer.api.AnalysisException;
import org.asymptote.analyzer.frontend.parser.ast.Program;
import org.asymptote.analyzer.model.GrowthRate;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link RecurrenceExtractor}.
 * These tests verify that self-calls are grouped into terms by subproblem size, that the
 * non-recursive cost comes from the line costs and that the base case is read from the leading guard.
 */
public class RecurrenceExtractorTest {

    private final RecurrenceExtractor extractor = new RecurrenceExtractor();

    @Test
    @Tag("unit")
    void testMergeSortHalvesTwice() throws AnalysisException {
        // Arrange
        Program program = SamplePrograms.parse(SamplePrograms.MERGE_SORT);

        // Act
        RecurrenceRelation relation = extractor.extract(program, "mergesort").orElseThrow();

        // Assert
        assertThat(relation.equation()).isEqualTo("T(n) = 2T(n/2) + n");
        assertThat(relation.totalCalls()).isEqualTo(2);
        assertThat(relation.allTransformsAre(SizeTransform.Divide.class)).isTrue();
        assertThat(relation.nonRecursiveCost()).isEqualTo(GrowthRate.LINEAR);
        assertThat(relation.baseCase()).isEqualTo("T(n) = 1 when p >= r");
        assertThat(relation.callInsideLoop()).isFalse();
        assertThat(relation.explanation()).contains("mergesort makes 2 recursive call(s)");
    }

    @Test
    @Tag("unit")
    void testFactorial() throws AnalysisException {
        RecurrenceRelation relation = extractor.extract(SamplePrograms.parse(SamplePrograms.FACTORIAL), "fact")
                .orElseThrow();

        assertThat(relation.equation()).isEqualTo("T(n) = T(n-1) + 1");
        assertThat(relation.baseCase()).isEqualTo("T(n) = 1 when n <= 1");
        assertThat(relation.notes()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testFibonacciKeepsBothTerms() throws AnalysisException {
        RecurrenceRelation relation = extractor.extract(SamplePrograms.parse(SamplePrograms.FIBONACCI), "fib")
                .orElseThrow();

        assertThat(relation.equation()).isEqualTo("T(n) = T(n-1) + T(n-2) + 1");
        assertThat(relation.terms()).extracting(RecursiveTerm::transform)
                .containsExactly(new SizeTransform.Subtract(1), new SizeTransform.Subtract(2));
    }

    /**
     * Only the heavier of two exclusive branches is counted, and the skipped call is noted.
     */
    @Test
    @Tag("unit")
    void testExclusiveBranchesCountOnce() throws AnalysisException {
        RecurrenceRelation relation = extractor.extract(
                SamplePrograms.parse(SamplePrograms.RECURSIVE_BINARY_SEARCH), "bsearch").orElseThrow();

        assertThat(relation.equation()).isEqualTo("T(n) = T(n/2) + 1");
        assertThat(relation.baseCase()).isEqualTo("T(n) = 1 when low > high");
        assertThat(relation.notes()).anyMatch(note -> note.contains("exclusive branches"));
    }

    /**
     * A self-call in a loop with constant bounds is multiplied by the number of passes.
     */
    @Test
    @Tag("unit")
    void testConstantLoopMultipliesTheCoefficient() throws AnalysisException {
        // Act
        RecurrenceRelation relation = extractor.extract(SamplePrograms.parse(SamplePrograms.STRASSEN), "strassen")
                .orElseThrow();

        // Assert
        assertThat(relation.equation()).isEqualTo("T(n) = 7T(n/2) + n^2");
        assertThat(relation.totalCalls()).isEqualTo(7);
        assertThat(relation.callInsideLoop()).isFalse();
        assertThat(relation.notes()).anyMatch(note -> note.contains("once per pass"));
    }

    @Test
    @Tag("unit")
    void testSelfCallInInputBoundLoopIsFlagged() throws AnalysisException {
        Program program = SamplePrograms.parse(String.join("\n",
                "procedure spread(n)",
                "  if n <= 1 then",
                "    return 1",
                "  end",
                "  for t <- 1 to n do",
                "    spread(n / 2)",
                "  end",
                "end"));

        RecurrenceRelation relation = extractor.extract(program, "spread").orElseThrow();

        assertThat(relation.totalCalls()).isEqualTo(1);
        assertThat(relation.callInsideLoop()).isTrue();
    }

    @Test
    @Tag("unit")
    void testQuickSortSplitsAtDataDependentPoint() throws AnalysisException {
        RecurrenceRelation relation = extractor.extract(SamplePrograms.parse(SamplePrograms.QUICK_SORT), "quicksort")
                .orElseThrow();

        assertThat(relation.equation()).isEqualTo("T(n) = T(k) + T(n-k-1) + n");
        assertThat(relation.anyTransformIs(SizeTransform.Split.class)).isTrue();
        assertThat(relation.notes()).anyMatch(note -> note.contains("q <- partition(A, p, r)"));
    }

    /**
     * A procedure without self-calls, or an unknown name, has no recurrence.
     */
    @Test
    @Tag("unit")
    void testNoRecurrenceWithoutSelfCall() throws AnalysisException {
        Program program = SamplePrograms.parse(SamplePrograms.MERGE_SORT);

        Optional<RecurrenceRelation> merge = extractor.extract(program, "merge");
        Optional<RecurrenceRelation> missing = extractor.extract(program, "heapsort");

        assertThat(merge).isEmpty();
        assertThat(missing).isEmpty();
    }

    @Test
    @Tag("unit")
    void testMissingGuardAssumesConstantBaseCase() throws AnalysisException {
        Program program = SamplePrograms.parse("procedure loop(n)\n  x <- n\n  loop(n - 1)\nend");

        RecurrenceRelation relation = extractor.extract(program, "loop").orElseThrow();

        assertThat(relation.baseCase()).isEqualTo("T(1) = 1 (assumed)");
        assertThat(relation.notes()).anyMatch(note -> note.contains("No guard"));
    }
}
