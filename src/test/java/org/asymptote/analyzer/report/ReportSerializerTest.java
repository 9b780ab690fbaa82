package org.asymptote.analyzer.report;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.asymptote.analyzer.ComplexityAnalyzer;
import org.asymptote.analyzer.SamplePrograms;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceParser;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceRelation;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceSolver;
import org.asymptote.analyzer.api.AnalysisException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link ReportSerializer}. The reports come from real analyses.
 */
public class ReportSerializerTest {

    private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();
    private final ReportSerializer serializer = new ReportSerializer();

    @Test
    @Tag("unit")
    void testIterativeReportSections() throws AnalysisException {
        // Arrange
        AnalysisReport report = analyzer.analyze(SamplePrograms.BUBBLE_SORT, "bubble.txt");

        // Act
        JsonObject json = serializer.toJsonTree(report);

        // Assert
        assertThat(json.keySet()).containsExactly("program", "lexer", "parser", "line_costs", "extraction",
                "solution", "annotations", "diagnostics");
        assertThat(json.get("program").getAsString()).isEqualTo("bubble.txt");

        JsonObject firstToken = json.getAsJsonObject("lexer").getAsJsonArray("tokens").get(0).getAsJsonObject();
        assertThat(firstToken.get("type").getAsString()).isEqualTo("BEGIN");
        assertThat(firstToken.get("line").getAsInt()).isEqualTo(1);
        assertThat(firstToken.get("column").getAsInt()).isEqualTo(1);

        JsonObject extraction = json.getAsJsonObject("extraction");
        assertThat(extraction.has("procedure")).isFalse();
        assertThat(extraction.get("equation").getAsString()).isEmpty();

        JsonObject solution = json.getAsJsonObject("solution");
        assertThat(solution.get("main_result").getAsString()).isEqualTo("Θ(n^2)");
        assertThat(solution.getAsJsonObject("cases").get("best").getAsString()).isEqualTo("Ω(n^2)");
        assertThat(solution.has("recurrence_solved")).isFalse();
        assertThat(json.getAsJsonObject("line_costs").get("total").getAsString()).isEqualTo("n^2");
    }

    /**
     * A recursive program carries the extracted recurrence and the recursion tree.
     */
    @Test
    @Tag("unit")
    void testRecursiveReportSections() throws AnalysisException {
        // Arrange
        AnalysisReport report = analyzer.analyze(SamplePrograms.MERGE_SORT, "mergesort.txt");

        // Act
        JsonObject json = serializer.toJsonTree(report);

        // Assert
        JsonObject extraction = json.getAsJsonObject("extraction");
        assertThat(extraction.get("procedure").getAsString()).isEqualTo("mergesort");
        assertThat(extraction.get("equation").getAsString()).isEqualTo("T(n) = 2T(n/2) + n");
        assertThat(json.getAsJsonObject("solution").get("recurrence_solved").getAsBoolean()).isTrue();

        JsonObject tree = json.getAsJsonObject("recursion_tree");
        JsonArray levels = tree.getAsJsonArray("levels");
        assertThat(levels).hasSize(7);
        assertThat(levels.get(1).getAsJsonObject().get("count").getAsInt()).isEqualTo(2);
        assertThat(tree.getAsJsonObject("structure").get("label").getAsString()).isEqualTo("T(n)");
        assertThat(tree.get("truncated").getAsBoolean()).isFalse();
        assertThat(json.has("grammar_correction")).isFalse();
    }

    @Test
    @Tag("unit")
    void testCorrectionSection() throws AnalysisException {
        AnalysisReport report = analyzer.analyze(SamplePrograms.LINEAR_SEARCH).withCorrectionNote("rewritten");

        JsonObject correction = serializer.toJsonTree(report).getAsJsonObject("grammar_correction");

        assertThat(correction.get("applied").getAsBoolean()).isTrue();
        assertThat(correction.get("note").getAsString()).isEqualTo("rewritten");
    }

    @Test
    @Tag("unit")
    void testCompactOutputIsSingleLine() throws AnalysisException {
        AnalysisReport report = analyzer.analyze(SamplePrograms.LINEAR_SEARCH);

        String compact = new ReportSerializer(false).toJson(report);

        assertThat(compact).doesNotContain("\n");
        assertThat(JsonParser.parseString(compact)).isEqualTo(serializer.toJsonTree(report));
    }

    @Test
    @Tag("unit")
    void testSolvedRecurrenceDocument() {
        // Arrange
        RecurrenceRelation relation = RecurrenceParser.parse("T(n) = 2T(n/2) + n");

        // Act
        JsonObject json = serializer.toJsonTree(relation, new RecurrenceSolver().solve(relation));

        // Assert
        assertThat(json.get("solved").getAsBoolean()).isTrue();
        assertThat(json.get("result").getAsString()).isEqualTo("Θ(n log n)");
        assertThat(json.get("method_used").getAsString()).isEqualTo("Master theorem");
        assertThat(json.getAsJsonArray("math_steps")).isNotEmpty();
        assertThat(json.has("reason")).isFalse();
    }

    @Test
    @Tag("unit")
    void testUnsolvedRecurrenceDocument() {
        RecurrenceRelation relation = RecurrenceParser.parse("T(n) = T(k) + T(n-k-1) + n");

        JsonObject json = serializer.toJsonTree(relation, new RecurrenceSolver().solve(relation));

        assertThat(json.get("solved").getAsBoolean()).isFalse();
        assertThat(json.get("reason").getAsString()).contains("split point");
        assertThat(json.has("result")).isFalse();
    }
}
