package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.List;

/**
 * {@code return [value]}.
 *
 * @param value The returned value, or {@code null}.
 * @param sourceInfo The position of the {@code return} keyword.
 */
public record ReturnStmt(Expression value, SourceInfo sourceInfo) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
