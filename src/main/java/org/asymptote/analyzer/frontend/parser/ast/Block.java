package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A sequence of statements.
 *
 * @param statements The statements in source order.
 * @param delimited {@code true} if the block was opened with {@code begin}; relaxed loop and
 *                  conditional bodies have an implicit opening and are closed by the
 *                  enclosing statement's {@code end} (or {@code else}).
 * @param sourceInfo The position of the opening delimiter or first statement.
 */
public record Block(
        List<Statement> statements,
        boolean delimited,
        SourceInfo sourceInfo
) implements Statement {

    public Block {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
