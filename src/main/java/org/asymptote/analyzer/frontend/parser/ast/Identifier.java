package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.List;
import java.util.Locale;

/**
 * A variable or procedure name.
 *
 * @param name The name as written.
 * @param sourceInfo The position of the name.
 */
public record Identifier(String name, SourceInfo sourceInfo) implements Expression {

    /**
     * @param other Another name.
     * @return {@code true} if both names are equal ignoring case.
     */
    public boolean sameNameAs(String other) {
        return other != null && name.toLowerCase(Locale.ROOT).equals(other.toLowerCase(Locale.ROOT));
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
