package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code if condition then thenBranch [else elseBranch]}.
 *
 * @param condition The condition.
 * @param thenBranch The branch taken when the condition holds.
 * @param elseBranch The alternative branch, or {@code null}.
 * @param sourceInfo The position of the {@code if} keyword.
 */
public record IfElse(
        Expression condition,
        Block thenBranch,
        Block elseBranch,
        SourceInfo sourceInfo
) implements Statement {

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.add(thenBranch);
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
