package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A counting loop: {@code for v <- start to|downto end [step s] do body}.
 *
 * @param variable The control variable.
 * @param start The initial value.
 * @param end The final value.
 * @param step The explicit step, or {@code null} for unit steps.
 * @param descending {@code true} for {@code downto}.
 * @param body The loop body.
 * @param sourceInfo The position of the {@code for} keyword.
 */
public record ForLoop(
        Identifier variable,
        Expression start,
        Expression end,
        Expression step,
        boolean descending,
        Block body,
        SourceInfo sourceInfo
) implements Statement {

    /**
     * @return The control variable paired with the final value.
     */
    public LoopControl control() {
        return new LoopControl(variable, end);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(variable);
        children.add(start);
        children.add(end);
        if (step != null) {
            children.add(step);
        }
        children.add(body);
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}
