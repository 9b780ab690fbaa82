package org.asymptote.analyzer.api;

/**
 * Thrown by the lexer on the first character it cannot recognize. Lexing is a single
 * pass without recovery, so this is fatal to the request and never retried.
 */
public class LexException extends AnalysisException {

    private final String offendingCharacter;

    /**
     * @param message The detail message.
     * @param offendingCharacter The character (as a string, to support supplementary code points).
     * @param sourceInfo The position of the character.
     */
    public LexException(String message, String offendingCharacter, SourceInfo sourceInfo) {
        super(message, sourceInfo);
        this.offendingCharacter = offendingCharacter;
    }

    public String getOffendingCharacter() {
        return offendingCharacter;
    }
}
