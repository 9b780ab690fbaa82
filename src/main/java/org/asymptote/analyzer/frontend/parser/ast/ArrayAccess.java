package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code base[i, j, ...]}.
 *
 * @param base The indexed expression.
 * @param indices One or more index expressions.
 * @param sourceInfo The position of the base.
 */
public record ArrayAccess(
        Expression base,
        List<Expression> indices,
        SourceInfo sourceInfo
) implements Expression {

    public ArrayAccess {
        indices = indices == null ? List.of() : List.copyOf(indices);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(base);
        children.addAll(indices);
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArrayAccess(this);
    }
}
