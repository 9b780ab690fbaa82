package org.asymptote.analyzer.frontend.parser.ast;

/**
 * A node that can appear in statement position inside a {@link Block}.
 */
public sealed interface Statement extends AstNode
        permits Block, ForLoop, WhileLoop, RepeatUntilLoop, IfElse, Assignment, Call, ReturnStmt {
}
