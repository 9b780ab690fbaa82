package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.List;

/**
 * A literal value.
 *
 * @param kind The literal kind.
 * @param value The value: a {@link Long} or {@link Double} for numbers, a {@link String},
 *              a {@link Boolean}, or {@code null} for {@code null} and infinity.
 * @param text The literal as written.
 * @param sourceInfo The position of the literal.
 */
public record Literal(
        Kind kind,
        Object value,
        String text,
        SourceInfo sourceInfo
) implements Expression {

    /**
     * The kinds of literal.
     */
    public enum Kind {
        NUMBER,
        STRING,
        BOOLEAN,
        NULL,
        INFINITY
    }

    /**
     * @return The numeric value, or {@code null} if this is not a number literal.
     */
    public Double numericValue() {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
