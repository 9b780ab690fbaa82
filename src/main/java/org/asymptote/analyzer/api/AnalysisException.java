package org.asymptote.analyzer.api;

/**
 * An exception that is thrown when the source text cannot be turned into an AST.
 * <p>
 * It is part of the public API and hides the internal types of the lexer and parser.
 * Later pipeline stages never throw it: once the source parses, a report is always produced.
 */
public class AnalysisException extends Exception {

    private final transient SourceInfo sourceInfo;

    /**
     * Constructs a new analysis exception with the specified detail message.
     * @param message The detail message.
     */
    public AnalysisException(String message) {
        super(message, null);
        this.sourceInfo = null;
    }

    /**
     * Constructs a new analysis exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
        this.sourceInfo = null;
    }

    /**
     * Constructs a new analysis exception with the specified detail message and source information.
     * @param message The detail message.
     * @param sourceInfo The position the failure refers to.
     */
    public AnalysisException(String message, SourceInfo sourceInfo) {
        super(String.format("%s at %s", message, sourceInfo), null);
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The position of the failure, or {@code null} if the failure is not position-bound.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
