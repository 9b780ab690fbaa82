package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.List;

/**
 * {@code repeat body until condition}. The body runs at least once.
 *
 * @param body The loop body.
 * @param condition The exit condition.
 * @param control The control variable and bound read off the condition, possibly unresolved.
 * @param sourceInfo The position of the {@code repeat} keyword.
 */
public record RepeatUntilLoop(
        Block body,
        Expression condition,
        LoopControl control,
        SourceInfo sourceInfo
) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(body, condition);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRepeat(this);
    }
}
