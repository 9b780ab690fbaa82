package org.asymptote.analyzer.frontend.parser.ast;

/**
 * Exhaustive visitor over the closed set of AST node kinds.
 *
 * @param <R> The result type.
 */
public interface AstVisitor<R> {
    R visitProgram(Program node);

    R visitProcedure(ProcedureDecl node);

    R visitBlock(Block node);

    R visitFor(ForLoop node);

    R visitWhile(WhileLoop node);

    R visitRepeat(RepeatUntilLoop node);

    R visitIf(IfElse node);

    R visitAssignment(Assignment node);

    R visitCall(Call node);

    R visitReturn(ReturnStmt node);

    R visitArrayAccess(ArrayAccess node);

    R visitBinary(BinaryExpr node);

    R visitUnary(UnaryExpr node);

    R visitLiteral(Literal node);

    R visitIdentifier(Identifier node);
}
