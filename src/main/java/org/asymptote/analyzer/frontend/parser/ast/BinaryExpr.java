package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.List;

/**
 * A binary operation. Operators are normalized: {@code + - * / ^ mod div and or = <> < <= > >=},
 * plus {@code ..} for ranges and {@code .} for field access.
 *
 * @param left The left operand.
 * @param operator The normalized operator.
 * @param right The right operand.
 * @param sourceInfo The position of the left operand.
 */
public record BinaryExpr(
        Expression left,
        String operator,
        Expression right,
        SourceInfo sourceInfo
) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
