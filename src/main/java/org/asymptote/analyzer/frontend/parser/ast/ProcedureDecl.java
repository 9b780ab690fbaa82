package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A named procedure. Calls to it, including its own recursive calls, are resolved by name.
 *
 * @param name The procedure's name.
 * @param parameters The formal parameters, without array annotations.
 * @param body The procedure body.
 * @param sourceInfo The position of the declaration.
 */
public record ProcedureDecl(
        Identifier name,
        List<Identifier> parameters,
        Block body,
        SourceInfo sourceInfo
) implements AstNode {

    public ProcedureDecl {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * @return The name of the procedure as written.
     */
    public String procedureName() {
        return name.name();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(parameters);
        children.add(body);
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProcedure(this);
    }
}
