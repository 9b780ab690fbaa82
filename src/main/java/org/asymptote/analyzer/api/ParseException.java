package org.asymptote.analyzer.api;

/**
 * Thrown by the parser on a structural mismatch. Carries what was expected, what was found
 * and where, which is enough for a grammar-correction collaborator to rewrite the source.
 */
public class ParseException extends AnalysisException {

    private final String expected;
    private final String found;

    /**
     * @param expected A human readable description of the expected token or construct.
     * @param found The text of the token actually found.
     * @param sourceInfo The position of the offending token.
     */
    public ParseException(String expected, String found, SourceInfo sourceInfo) {
        super(String.format("Expected %s but found '%s'", expected, found), sourceInfo);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
