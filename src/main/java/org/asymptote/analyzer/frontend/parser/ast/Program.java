package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of the tree: the procedures declared in the source, followed by an optional main block.
 *
 * @param name The name from an {@code algorithm NAME} header, or {@code null}.
 * @param procedures The declared procedures, in source order.
 * @param body The main block, or {@code null} for a file that only declares procedures.
 * @param sourceInfo The position of the first token.
 */
public record Program(
        String name,
        List<ProcedureDecl> procedures,
        Block body,
        SourceInfo sourceInfo
) implements AstNode {

    public Program {
        procedures = procedures == null ? List.of() : List.copyOf(procedures);
    }

    /**
     * @return {@code true} if the program has a main block.
     */
    public boolean hasBody() {
        return body != null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(procedures);
        if (body != null) {
            children.add(body);
        }
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
