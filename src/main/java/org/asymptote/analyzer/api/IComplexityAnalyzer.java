package org.asymptote.analyzer.api;

import org.asymptote.analyzer.report.AnalysisReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface of the complexity analyzer.
 */
public interface IComplexityAnalyzer {

    /**
     * Analyzes the given pseudocode.
     *
     * @param source The full source text.
     * @param programName A logical name for the source, used in diagnostics.
     * @return The analysis report. Never {@code null} once the source parses.
     * @throws AnalysisException if the source cannot be lexed or parsed.
     */
    AnalysisReport analyze(String source, String programName) throws AnalysisException;

    /**
     * Analyzes the given pseudocode under the logical name {@code <memory>}.
     * @param source The full source text.
     * @return The analysis report.
     * @throws AnalysisException if the source cannot be lexed or parsed.
     */
    default AnalysisReport analyze(String source) throws AnalysisException {
        return analyze(source, "<memory>");
    }

    /**
     * Analyzes the pseudocode stored in a file.
     * @param programPath The path to the source file.
     * @return The analysis report.
     * @throws AnalysisException if the source cannot be lexed or parsed.
     * @throws IOException if the file cannot be read.
     */
    default AnalysisReport analyze(Path programPath) throws AnalysisException, IOException {
        return analyze(Files.readString(programPath), programPath.getFileName().toString());
    }
}
