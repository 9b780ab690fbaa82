package org.asymptote.analyzer.frontend;

import org.asymptote.analyzer.frontend.parser.ast.ArrayAccess;
import org.asymptote.analyzer.frontend.parser.ast.Assignment;
import org.asymptote.analyzer.frontend.parser.ast.AstNode;
import org.asymptote.analyzer.frontend.parser.ast.AstVisitor;
import org.asymptote.analyzer.frontend.parser.ast.BinaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.Block;
import org.asymptote.analyzer.frontend.parser.ast.Call;
import org.asymptote.analyzer.frontend.parser.ast.Expression;
import org.asymptote.analyzer.frontend.parser.ast.ForLoop;
import org.asymptote.analyzer.frontend.parser.ast.Identifier;
import org.asymptote.analyzer.frontend.parser.ast.IfElse;
import org.asymptote.analyzer.frontend.parser.ast.Literal;
import org.asymptote.analyzer.frontend.parser.ast.ProcedureDecl;
import org.asymptote.analyzer.frontend.parser.ast.Program;
import org.asymptote.analyzer.frontend.parser.ast.RepeatUntilLoop;
import org.asymptote.analyzer.frontend.parser.ast.ReturnStmt;
import org.asymptote.analyzer.frontend.parser.ast.Statement;
import org.asymptote.analyzer.frontend.parser.ast.UnaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.WhileLoop;

import java.util.stream.Collectors;

/**
 * Renders AST nodes as text: expressions in pseudocode notation, statements as a one-line
 * header, and whole trees as an indented dump.
 */
public final class AstPrinter {

    private AstPrinter() {
    }

    /**
     * @param expression An expression.
     * @return The expression in pseudocode notation, e.g. {@code A[i + 1] > key}.
     */
    public static String render(Expression expression) {
        return expression == null ? "" : expression.accept(new Renderer());
    }

    /**
     * @param node Any node.
     * @return The one-line form of the node, e.g. {@code for i <- 1 to n} or {@code x <- x + 1}.
     */
    public static String header(AstNode node) {
        return node.accept(new Renderer());
    }

    /**
     * @param node The root of the dump.
     * @return An indented, multi-line rendering of the tree.
     */
    public static String dump(AstNode node) {
        StringBuilder out = new StringBuilder();
        dump(node, 0, out);
        return out.toString();
    }

    private static void dump(AstNode node, int depth, StringBuilder out) {
        out.append("  ".repeat(depth)).append(node.getClass().getSimpleName());
        if (node instanceof Expression expression) {
            out.append(' ').append(render(expression)).append('\n');
            return;
        }
        String header = header(node);
        if (!header.isEmpty()) {
            out.append(' ').append(header);
        }
        out.append(" @").append(node.line()).append('\n');
        for (AstNode child : node.getChildren()) {
            if (child instanceof Statement || child instanceof ProcedureDecl) {
                dump(child, depth + 1, out);
            }
        }
    }

    private static final class Renderer implements AstVisitor<String> {

        @Override
        public String visitProgram(Program node) {
            return node.name() == null ? "" : node.name();
        }

        @Override
        public String visitProcedure(ProcedureDecl node) {
            return node.procedureName() + "(" + node.parameters().stream()
                    .map(Identifier::name).collect(Collectors.joining(", ")) + ")";
        }

        @Override
        public String visitBlock(Block node) {
            return node.delimited() ? "begin" : "";
        }

        @Override
        public String visitFor(ForLoop node) {
            String text = "for " + node.variable().name() + " <- " + render(node.start())
                    + (node.descending() ? " downto " : " to ") + render(node.end());
            return node.step() == null ? text : text + " step " + render(node.step());
        }

        @Override
        public String visitWhile(WhileLoop node) {
            return "while " + render(node.condition());
        }

        @Override
        public String visitRepeat(RepeatUntilLoop node) {
            return "repeat until " + render(node.condition());
        }

        @Override
        public String visitIf(IfElse node) {
            return "if " + render(node.condition());
        }

        @Override
        public String visitAssignment(Assignment node) {
            return render(node.target()) + " <- " + render(node.value());
        }

        @Override
        public String visitCall(Call node) {
            return node.calleeName() + "(" + node.arguments().stream()
                    .map(AstPrinter::render).collect(Collectors.joining(", ")) + ")";
        }

        @Override
        public String visitReturn(ReturnStmt node) {
            return node.value() == null ? "return" : "return " + render(node.value());
        }

        @Override
        public String visitArrayAccess(ArrayAccess node) {
            return render(node.base()) + "[" + node.indices().stream()
                    .map(AstPrinter::render).collect(Collectors.joining(", ")) + "]";
        }

        @Override
        public String visitBinary(BinaryExpr node) {
            if (".".equals(node.operator()) || "..".equals(node.operator())) {
                return render(node.left()) + node.operator() + render(node.right());
            }
            return operand(node.left()) + " " + node.operator() + " " + operand(node.right());
        }

        private String operand(Expression expression) {
            String text = render(expression);
            return expression instanceof BinaryExpr bin && !".".equals(bin.operator()) ? "(" + text + ")" : text;
        }

        @Override
        public String visitUnary(UnaryExpr node) {
            switch (node.operator()) {
                case "ceil":
                    return "⌈" + render(node.operand()) + "⌉";
                case "floor":
                    return "⌊" + render(node.operand()) + "⌋";
                case "not":
                    return "not " + operand(node.operand());
                default:
                    return node.operator() + operand(node.operand());
            }
        }

        @Override
        public String visitLiteral(Literal node) {
            return node.text();
        }

        @Override
        public String visitIdentifier(Identifier node) {
            return node.name();
        }
    }
}
