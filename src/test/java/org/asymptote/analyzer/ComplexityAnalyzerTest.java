package org.asymptote.analyzer;

import org.asymptote.analyzer.api.AnalysisException;
import org.asymptote.analyzer.api.IGrammarCorrector;
import org.asymptote.analyzer.api.LexException;
import org.asymptote.analyzer.api.ParseException;
import org.asymptote.analyzer.model.Annotation;
import org.asymptote.analyzer.model.AnnotationKind;
import org.asymptote.analyzer.report.AnalysisReport;
import org.asymptote.analyzer.report.ReportSerializer;
import org.asymptote.config.AnalyzerOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests for the {@link ComplexityAnalyzer}: classic algorithms from source text to the
 * final decision, the single grammar-correction retry and the absence of shared state between runs.
 */
@ExtendWith(MockitoExtension.class)
public class ComplexityAnalyzerTest {

    private static final String MISSING_DO = String.join("\n",
            "begin",
            "  for i <- 1 to n",
            "    x <- i",
            "  end",
            "end");

    private static final String FIXED_DO = String.join("\n",
            "begin",
            "  for i <- 1 to n do",
            "    x <- i",
            "  end",
            "end");

    @Mock
    private IGrammarCorrector corrector;

    @Test
    @Tag("unit")
    void testIterativeProgramIsDecidedStructurally() throws AnalysisException {
        // Act
        AnalysisReport report = new ComplexityAnalyzer().analyze(SamplePrograms.BUBBLE_SORT, "bubble.txt");

        // Assert
        assertThat(report.programName()).isEqualTo("bubble.txt");
        assertThat(report.recurrence()).isEmpty();
        assertThat(report.recursionTree()).isEmpty();
        assertThat(report.resolution().mainResult()).isEqualTo("Θ(n^2)");
        assertThat(report.resolution().method()).isEqualTo("Structural analysis");
        assertThat(report.wasCorrected()).isFalse();
    }

    /**
     * Merge sort is solved by the Master theorem and comes with a complete recursion tree.
     */
    @Test
    @Tag("unit")
    void testMergeSort() throws AnalysisException {
        // Act
        AnalysisReport report = new ComplexityAnalyzer().analyze(SamplePrograms.MERGE_SORT);

        // Assert
        assertThat(report.programName()).isEqualTo("<memory>");
        assertThat(report.recurrence()).hasValueSatisfying(r -> assertThat(r.equation()).isEqualTo("T(n) = 2T(n/2) + n"));
        assertThat(report.outcome().isSolved()).isTrue();
        assertThat(report.resolution().mainResult()).isEqualTo("Θ(n log n)");
        assertThat(report.resolution().method()).isEqualTo("Master theorem");
        assertThat(report.recursionTree()).hasValueSatisfying(tree -> assertThat(tree.truncated()).isFalse());
    }

    /**
     * Seven half-size calls from a constant loop follow the Master theorem instead of the loop fallback.
     */
    @Test
    @Tag("unit")
    void testStrassenShapedRecursion() throws AnalysisException {
        AnalysisReport report = new ComplexityAnalyzer().analyze(SamplePrograms.STRASSEN);

        assertThat(report.recurrence()).hasValueSatisfying(r -> assertThat(r.equation()).isEqualTo("T(n) = 7T(n/2) + n^2"));
        assertThat(report.resolution().mainResult()).isEqualTo("Θ(n^2.81)");
        assertThat(report.resolution().method()).isEqualTo("Master theorem");
        assertThat(report.resolution().annotations()).extracting(Annotation::kind)
                .doesNotContain(AnnotationKind.CALL_INSIDE_LOOP);
    }

    @Test
    @Tag("unit")
    void testFibonacciGrowsWithTheGoldenRatio() throws AnalysisException {
        AnalysisReport report = new ComplexityAnalyzer().analyze(SamplePrograms.FIBONACCI);

        assertThat(report.resolution().mainResult()).isEqualTo("Θ(φ^n)");
        assertThat(report.resolution().bestCase()).isEqualTo("Ω(φ^n)");
        assertThat(report.resolution().annotations()).extracting(Annotation::kind)
                .contains(AnnotationKind.FIBONACCI_PATTERN);
    }

    /**
     * The data-dependent split of quick sort cannot be solved; the structural cases take over.
     */
    @Test
    @Tag("unit")
    void testQuickSortFallsBackToStructure() throws AnalysisException {
        AnalysisReport report = new ComplexityAnalyzer().analyze(SamplePrograms.QUICK_SORT);

        assertThat(report.outcome().isSolved()).isFalse();
        assertThat(report.resolution().mainResult()).isEqualTo("O(n^2)");
        assertThat(report.resolution().bestCase()).isEqualTo("Ω(n log n)");
        assertThat(report.resolution().averageCase()).isEqualTo("Θ(n log n)");
        assertThat(report.resolution().annotations()).extracting(Annotation::kind)
                .contains(AnnotationKind.RECURRENCE_UNSOLVED);
    }

    @Test
    @Tag("unit")
    void testRecursiveBinarySearchCanFinishEarly() throws AnalysisException {
        AnalysisReport report = new ComplexityAnalyzer().analyze(SamplePrograms.RECURSIVE_BINARY_SEARCH);

        assertThat(report.resolution().bestCase()).isEqualTo("Ω(1)");
        assertThat(report.resolution().worstCase()).isEqualTo("O(log n)");
        assertThat(report.resolution().mainResult()).isEqualTo("O(log n)");
    }

    @Test
    @Tag("unit")
    void testParseErrorWithoutCorrectorPropagates() {
        ParseException error = catchThrowableOfType(
                () -> new ComplexityAnalyzer().analyze(MISSING_DO, "loop.txt"), ParseException.class);

        assertThat(error.getExpected()).isEqualTo("'do'");
        assertThat(error.getSourceInfo().fileName()).isEqualTo("loop.txt");
    }

    /**
     * After a parse error the corrector is consulted once and the report notes the rewrite.
     */
    @Test
    @Tag("unit")
    void testCorrectedSourceIsAnalyzed() throws AnalysisException {
        // Arrange
        when(corrector.correct(eq(MISSING_DO), any(ParseException.class))).thenReturn(Optional.of(FIXED_DO));
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(AnalyzerOptions.defaults(), corrector);

        // Act
        AnalysisReport report = analyzer.analyze(MISSING_DO, "loop.txt");

        // Assert
        assertThat(report.wasCorrected()).isTrue();
        assertThat(report.correctionNote()).startsWith("Source was rewritten after: Expected 'do'");
        assertThat(report.resolution().mainResult()).isEqualTo("Θ(n)");
        verify(corrector, times(1)).correct(eq(MISSING_DO), any(ParseException.class));
    }

    /**
     * A correction that still fails to parse is not retried again; its own error surfaces.
     */
    @Test
    @Tag("unit")
    void testFailedCorrectionSurfacesItsOwnError() {
        // Arrange
        String stillBroken = "begin\n  x <- 1\n";
        when(corrector.correct(anyString(), any(ParseException.class))).thenReturn(Optional.of(stillBroken));
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(AnalyzerOptions.defaults(), corrector);

        // Act
        ParseException error = catchThrowableOfType(() -> analyzer.analyze(MISSING_DO, "loop.txt"), ParseException.class);

        // Assert
        assertThat(error.getExpected()).isEqualTo("'end'");
        verify(corrector, times(1)).correct(anyString(), any(ParseException.class));
    }

    @Test
    @Tag("unit")
    void testEmptyCorrectionRethrowsOriginalError() {
        when(corrector.correct(anyString(), any(ParseException.class))).thenReturn(Optional.empty());
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(AnalyzerOptions.defaults(), corrector);

        assertThatThrownBy(() -> analyzer.analyze(MISSING_DO, "loop.txt"))
                .isInstanceOf(ParseException.class)
                .hasMessageStartingWith("Expected 'do'");
    }

    @Test
    @Tag("unit")
    void testLexErrorsAreNeverCorrected() {
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(AnalyzerOptions.defaults(), corrector);

        assertThatThrownBy(() -> analyzer.analyze("begin\n  x <- 1 @ 2\nend", "lex.txt"))
                .isInstanceOf(LexException.class);
        verifyNoInteractions(corrector);
    }

    @Test
    @Tag("unit")
    void testDisabledCorrectionIsNotConsulted() {
        AnalyzerOptions disabled = new AnalyzerOptions(6, 1024, 64, 10, false);
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(disabled, corrector);

        assertThatThrownBy(() -> analyzer.analyze(MISSING_DO, "loop.txt")).isInstanceOf(ParseException.class);
        verifyNoInteractions(corrector);
    }

    /**
     * The same input always yields the same report, also when one analyzer is shared by several threads.
     */
    @Test
    @Tag("unit")
    void testReportsAreDeterministicAcrossThreads() throws Exception {
        // Arrange
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer();
        ReportSerializer serializer = new ReportSerializer(false);
        String expected = serializer.toJson(analyzer.analyze(SamplePrograms.MERGE_SORT, "mergesort.txt"));
        ExecutorService executor = Executors.newFixedThreadPool(4);

        // Act
        List<Future<String>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                String source = i % 2 == 0 ? SamplePrograms.MERGE_SORT : SamplePrograms.QUICK_SORT;
                futures.add(executor.submit(() -> serializer.toJson(analyzer.analyze(source, "mergesort.txt"))));
            }
        } finally {
            executor.shutdown();
        }
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // Assert
        for (int i = 0; i < futures.size(); i += 2) {
            assertThat(futures.get(i).get()).isEqualTo(expected);
        }
        assertThat(futures.get(1).get()).isEqualTo(futures.get(3).get());
    }
}
