package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.List;

/**
 * A unary operation: {@code -}, {@code not}, {@code ceil} or {@code floor}.
 *
 * @param operator The normalized operator.
 * @param operand The operand.
 * @param sourceInfo The position of the operator.
 */
public record UnaryExpr(
        String operator,
        Expression operand,
        SourceInfo sourceInfo
) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
