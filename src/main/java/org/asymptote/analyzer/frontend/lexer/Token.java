package org.asymptote.analyzer.frontend.lexer;

import org.asymptote.analyzer.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., keyword, identifier, number).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (a {@link Long} or {@link Double} for numbers,
 *              the unquoted content for strings), or {@code null}.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins, counted in code points.
 * @param fileName The logical name of the source this token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The position of this token as API source information.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }

    @Override
    public String toString() {
        return String.format("%s '%s' %d:%d", type, text, line, column);
    }
}
