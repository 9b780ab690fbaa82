package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The set of node kinds is closed. Every analysis that needs to distinguish node kinds does so
 * through {@link AstVisitor}, so adding a kind breaks compilation everywhere it is not handled.
 * The tree is strictly owned top-down: procedures reference each other (and themselves) by name only.
 */
public sealed interface AstNode permits Program, ProcedureDecl, Statement, Expression {

    /**
     * @return The position where this node starts in the source.
     */
    SourceInfo sourceInfo();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    List<AstNode> getChildren();

    /**
     * Dispatches to the matching method of the visitor.
     *
     * @param visitor The visitor.
     * @param <R> The result type of the visitor.
     * @return The visitor's result for this node.
     */
    <R> R accept(AstVisitor<R> visitor);

    /**
     * @return The source line this node starts on.
     */
    default int line() {
        return sourceInfo().lineNumber();
    }
}
