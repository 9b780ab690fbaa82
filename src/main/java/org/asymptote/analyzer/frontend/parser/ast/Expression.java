package org.asymptote.analyzer.frontend.parser.ast;

/**
 * A node that produces a value.
 */
public sealed interface Expression extends AstNode
        permits Call, ArrayAccess, BinaryExpr, UnaryExpr, Literal, Identifier {
}
