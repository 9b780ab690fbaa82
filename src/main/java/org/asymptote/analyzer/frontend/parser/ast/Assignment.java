package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.List;

/**
 * {@code target <- value}. The target is an {@link Identifier}, an {@link ArrayAccess} or a field access.
 *
 * @param target The assigned location.
 * @param value The assigned value.
 * @param sourceInfo The position of the target.
 */
public record Assignment(
        Expression target,
        Expression value,
        SourceInfo sourceInfo
) implements Statement {

    /**
     * @return The name of the assigned variable (the base name for indexed and field targets),
     *         or {@code null} if the target has no identifiable base.
     */
    public String targetName() {
        Expression base = target;
        while (true) {
            if (base instanceof Identifier id) {
                return id.name();
            } else if (base instanceof ArrayAccess access) {
                base = access.base();
            } else if (base instanceof BinaryExpr bin && ".".equals(bin.operator())) {
                base = bin.left();
            } else {
                return null;
            }
        }
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
