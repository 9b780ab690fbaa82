package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.List;

/**
 * {@code while condition do body}.
 *
 * @param condition The loop condition.
 * @param control The control variable and bound read off the condition, possibly unresolved.
 * @param body The loop body.
 * @param sourceInfo The position of the {@code while} keyword.
 */
public record WhileLoop(
        Expression condition,
        LoopControl control,
        Block body,
        SourceInfo sourceInfo
) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}
