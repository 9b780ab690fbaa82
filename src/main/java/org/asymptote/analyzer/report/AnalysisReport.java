package org.asymptote.analyzer.report;

import org.asymptote.analyzer.analysis.linecost.LineCostReport;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceRelation;
import org.asymptote.analyzer.analysis.recurrence.SolverOutcome;
import org.asymptote.analyzer.analysis.resolution.Resolution;
import org.asymptote.analyzer.analysis.tree.RecursionTree;
import org.asymptote.analyzer.diagnostics.Diagnostic;
import org.asymptote.analyzer.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * Everything one analysis produced, from the token stream to the final decision.
 *
 * @param programName The logical name of the analyzed source.
 * @param tokens The token stream, end-of-file token included.
 * @param astDump The indented rendering of the syntax tree.
 * @param lineCosts The per-line costs.
 * @param relation The extracted recurrence, or {@code null} if no recursive procedure drives the cost.
 * @param outcome The solver outcome for {@code relation}, or {@code null}.
 * @param tree The recursion tree for {@code relation}, or {@code null}.
 * @param resolution The final decision.
 * @param diagnostics The warnings and infos collected along the way.
 * @param correctionNote A note describing the grammar correction that was applied, or {@code null}.
 */
public record AnalysisReport(
        String programName,
        List<Token> tokens,
        String astDump,
        LineCostReport lineCosts,
        RecurrenceRelation relation,
        SolverOutcome outcome,
        RecursionTree tree,
        Resolution resolution,
        List<Diagnostic> diagnostics,
        String correctionNote
) {

    public AnalysisReport {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public Optional<RecurrenceRelation> recurrence() {
        return Optional.ofNullable(relation);
    }

    public Optional<RecursionTree> recursionTree() {
        return Optional.ofNullable(tree);
    }

    public boolean wasCorrected() {
        return correctionNote != null;
    }

    /**
     * @param note The note describing the applied correction.
     * @return A copy carrying the note.
     */
    public AnalysisReport withCorrectionNote(String note) {
        return new AnalysisReport(programName, tokens, astDump, lineCosts, relation, outcome, tree, resolution,
                diagnostics, note);
    }
}
