package org.asymptote.analyzer.frontend.parser;

import org.asymptote.analyzer.api.ParseException;
import org.asymptote.analyzer.api.SourceInfo;
import org.asymptote.analyzer.diagnostics.DiagnosticsEngine;
import org.asymptote.analyzer.frontend.lexer.Token;
import org.asymptote.analyzer.frontend.lexer.TokenType;
import org.asymptote.analyzer.frontend.parser.ast.ArrayAccess;
import org.asymptote.analyzer.frontend.parser.ast.Assignment;
import org.asymptote.analyzer.frontend.parser.ast.BinaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.Block;
import org.asymptote.analyzer.frontend.parser.ast.Call;
import org.asymptote.analyzer.frontend.parser.ast.Expression;
import org.asymptote.analyzer.frontend.parser.ast.ForLoop;
import org.asymptote.analyzer.frontend.parser.ast.Identifier;
import org.asymptote.analyzer.frontend.parser.ast.IfElse;
import org.asymptote.analyzer.frontend.parser.ast.Literal;
import org.asymptote.analyzer.frontend.parser.ast.LoopControl;
import org.asymptote.analyzer.frontend.parser.ast.ProcedureDecl;
import org.asymptote.analyzer.frontend.parser.ast.Program;
import org.asymptote.analyzer.frontend.parser.ast.RepeatUntilLoop;
import org.asymptote.analyzer.frontend.parser.ast.ReturnStmt;
import org.asymptote.analyzer.frontend.parser.ast.Statement;
import org.asymptote.analyzer.frontend.parser.ast.UnaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.WhileLoop;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A recursive-descent parser for the pseudocode dialect. It consumes the tokens produced by the
 * {@link org.asymptote.analyzer.frontend.lexer.Lexer} and builds a {@link Program}.
 * <p>
 * Each production looks at most one token ahead (two for the {@code swap} statement and for
 * telling a procedure header from a main-program header). There is no backtracking and no
 * recovery: the first mismatch is reported to the {@link DiagnosticsEngine} and thrown as a
 * {@link ParseException}.
 */
public class Parser {

    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", "<=", ">", ">=", "=", "<>");

    /** The deepest nesting of statements and expressions accepted. */
    public static final int MAX_NESTING = 256;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * <pre>program := { procedure } [ algorithm NAME ] [ begin statements end ] EOF</pre>
     * @return The program node.
     * @throws ParseException on the first structural mismatch.
     */
    public Program parse() throws ParseException {
        SourceInfo start = peek().sourceInfo();
        List<ProcedureDecl> procedures = new ArrayList<>();
        String name = null;
        Block body = null;

        skipSeparators();
        while (isProcedureHeader()) {
            procedures.add(procedure());
            skipSeparators();
        }
        if (check(TokenType.ALGORITHM)) {
            advance();
            name = consume(TokenType.IDENTIFIER, "the algorithm name").text();
            skipSeparators();
        }
        if (!isAtEnd() || procedures.isEmpty()) {
            Token begin = consume(TokenType.BEGIN, "'begin'");
            List<Statement> statements = statements(TokenType.END);
            consume(TokenType.END, "'end'");
            body = new Block(statements, true, begin.sourceInfo());
        }
        skipSeparators();
        while (isProcedureHeader()) {
            procedures.add(procedure());
            skipSeparators();
        }
        if (!isAtEnd()) {
            throw error("end of file");
        }
        return new Program(name, procedures, body, start);
    }

    private boolean isProcedureHeader() {
        if (check(TokenType.PROCEDURE)) {
            return true;
        }
        if (check(TokenType.ALGORITHM)) {
            return peekAt(1).type() == TokenType.IDENTIFIER && peekAt(2).type() == TokenType.LEFT_PAREN;
        }
        return check(TokenType.IDENTIFIER) && peekAt(1).type() == TokenType.LEFT_PAREN;
    }

    private ProcedureDecl procedure() throws ParseException {
        Token anchor = peek();
        match(TokenType.PROCEDURE, TokenType.ALGORITHM);
        Token nameToken = consume(TokenType.IDENTIFIER, "a procedure name");
        consume(TokenType.LEFT_PAREN, "'('");
        List<Identifier> parameters = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                parameters.add(parameter());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')'");
        Block body = closedBody();
        return new ProcedureDecl(identifier(nameToken), parameters, body, anchor.sourceInfo());
    }

    private Identifier parameter() throws ParseException {
        Token name = consume(TokenType.IDENTIFIER, "a parameter name");
        // Array annotations such as A[1..n] or A[n]..[m] carry no meaning for the analysis.
        while (check(TokenType.LEFT_BRACKET)) {
            skipBracketed();
            if (match(TokenType.RANGE) && !check(TokenType.LEFT_BRACKET)) {
                throw error("'[' after '..' in a parameter annotation");
            }
        }
        return identifier(name);
    }

    private void skipBracketed() throws ParseException {
        consume(TokenType.LEFT_BRACKET, "'['");
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) {
                throw error("']'");
            }
            Token token = advance();
            if (token.type() == TokenType.LEFT_BRACKET) depth++;
            if (token.type() == TokenType.RIGHT_BRACKET) depth--;
        }
    }

    /**
     * Parses a body that is either a delimited {@code begin ... end} block, or a relaxed sequence of
     * statements running up to one of the given terminators, which is left unconsumed.
     */
    private Block body(TokenType... terminators) throws ParseException {
        skipSeparators();
        if (check(TokenType.BEGIN)) {
            Token begin = advance();
            List<Statement> statements = statements(TokenType.END);
            consume(TokenType.END, "'end'");
            return new Block(statements, true, begin.sourceInfo());
        }
        SourceInfo start = peek().sourceInfo();
        return new Block(statements(terminators), false, start);
    }

    private List<Statement> statements(TokenType... terminators) throws ParseException {
        List<Statement> statements = new ArrayList<>();
        skipSeparators();
        while (!isAtEnd() && !checkAny(terminators)) {
            statements.add(statement());
            skipSeparators();
        }
        return statements;
    }

    private Statement statement() throws ParseException {
        enter();
        try {
            return nestedStatement();
        } finally {
            depth--;
        }
    }

    private Statement nestedStatement() throws ParseException {
        Token token = peek();
        switch (token.type()) {
            case FOR:
                return forLoop();
            case WHILE:
                return whileLoop();
            case REPEAT:
                return repeatLoop();
            case IF:
                return ifStatement();
            case CALL:
                return callStatement();
            case RETURN:
                return returnStatement();
            case BEGIN: {
                advance();
                List<Statement> statements = statements(TokenType.END);
                consume(TokenType.END, "'end'");
                return new Block(statements, true, token.sourceInfo());
            }
            case IDENTIFIER:
                if (isSwap()) {
                    return swapStatement();
                }
                if (isBarePrint()) {
                    Token keyword = advance();
                    return new Call(identifier(keyword), List.of(expression()), keyword.sourceInfo());
                }
                return assignmentOrCall();
            default:
                throw error("a statement");
        }
    }

    private ForLoop forLoop() throws ParseException {
        Token keyword = advance();
        Identifier variable = identifier(consume(TokenType.IDENTIFIER, "the loop variable"));
        if (!match(TokenType.ASSIGN, TokenType.EQUAL)) {
            throw error("an assignment symbol");
        }
        Expression start = expression();
        boolean descending;
        if (match(TokenType.TO)) {
            descending = false;
        } else if (match(TokenType.DOWNTO)) {
            descending = true;
        } else {
            throw error("'to' or 'downto'");
        }
        Expression end = expression();
        Expression step = null;
        if (match(TokenType.STEP)) {
            step = expression();
        }
        consume(TokenType.DO, "'do'");
        Block body = closedBody();
        return new ForLoop(variable, start, end, step, descending, body, keyword.sourceInfo());
    }

    private WhileLoop whileLoop() throws ParseException {
        Token keyword = advance();
        Expression condition = expression();
        consume(TokenType.DO, "'do'");
        Block body = closedBody();
        return new WhileLoop(condition, controlOf(condition), body, keyword.sourceInfo());
    }

    /**
     * A {@code begin ... end} block, or a relaxed body that must be closed by {@code end}.
     */
    private Block closedBody() throws ParseException {
        skipSeparators();
        if (check(TokenType.BEGIN)) {
            return body(TokenType.END);
        }
        Block body = body(TokenType.END);
        consume(TokenType.END, "'end'");
        return body;
    }

    private RepeatUntilLoop repeatLoop() throws ParseException {
        Token keyword = advance();
        SourceInfo bodyStart = peek().sourceInfo();
        List<Statement> statements = statements(TokenType.UNTIL);
        consume(TokenType.UNTIL, "'until'");
        Expression condition = expression();
        Block body = new Block(statements, false, bodyStart);
        return new RepeatUntilLoop(body, condition, controlOf(condition), keyword.sourceInfo());
    }

    private IfElse ifStatement() throws ParseException {
        Token keyword = advance();
        Expression condition = expression();
        consume(TokenType.THEN, "'then'");
        skipSeparators();
        boolean delimitedThen = check(TokenType.BEGIN);
        Block thenBranch = body(TokenType.ELSE, TokenType.END);
        skipSeparators();
        Block elseBranch = null;
        if (match(TokenType.ELSE)) {
            skipSeparators();
            if (check(TokenType.IF)) {
                // An else-if chain shares the closing 'end' of its last branch.
                enter();
                IfElse nested;
                try {
                    nested = ifStatement();
                } finally {
                    depth--;
                }
                elseBranch = new Block(List.of(nested), false, nested.sourceInfo());
            } else if (check(TokenType.BEGIN)) {
                elseBranch = body(TokenType.END);
            } else {
                elseBranch = body(TokenType.END);
                consume(TokenType.END, "'end'");
            }
        } else if (!delimitedThen) {
            consume(TokenType.END, "'end'");
        }
        return new IfElse(condition, thenBranch, elseBranch, keyword.sourceInfo());
    }

    private Call callStatement() throws ParseException {
        Token keyword = advance();
        Token name = consume(TokenType.IDENTIFIER, "a procedure name after CALL");
        List<Expression> arguments = new ArrayList<>();
        if (match(TokenType.LEFT_PAREN)) {
            arguments = arguments();
        }
        return new Call(identifier(name), arguments, keyword.sourceInfo());
    }

    private ReturnStmt returnStatement() throws ParseException {
        Token keyword = advance();
        Expression value = null;
        // The value must start on the same line; a bare return is followed by a new statement.
        if (!isAtEnd() && peek().line() == keyword.line()
                && !checkAny(TokenType.END, TokenType.ELSE, TokenType.UNTIL, TokenType.SEMICOLON)) {
            value = expression();
        }
        return new ReturnStmt(value, keyword.sourceInfo());
    }

    private boolean isSwap() {
        if (!"swap".equals(peek().text().toLowerCase(Locale.ROOT))) {
            return false;
        }
        TokenType next = peekAt(1).type();
        return next == TokenType.IDENTIFIER || next == TokenType.NUMBER;
    }

    private boolean isBarePrint() {
        if (!"print".equals(peek().text().toLowerCase(Locale.ROOT))) {
            return false;
        }
        TokenType next = peekAt(1).type();
        return next == TokenType.STRING || next == TokenType.IDENTIFIER || next == TokenType.NUMBER;
    }

    private Call swapStatement() throws ParseException {
        Token keyword = advance();
        Expression first = expression();
        if (!match(TokenType.WITH, TokenType.COMMA)) {
            throw error("'with'");
        }
        Expression second = expression();
        return new Call(identifier(keyword), List.of(first, second), keyword.sourceInfo());
    }

    private Statement assignmentOrCall() throws ParseException {
        Token start = peek();
        Expression target = postfix(identifier(advance()));
        if (match(TokenType.ASSIGN, TokenType.EQUAL)) {
            Expression value = expression();
            return new Assignment(target, value, start.sourceInfo());
        }
        if (target instanceof Call call) {
            return call;
        }
        throw error("an assignment symbol");
    }

    // Expressions, lowest precedence first.

    /**
     * Parses an expression with the usual precedence:
     * {@code or < and < equality < comparison < + - < * / mod div < ^ < unary < postfix}.
     * @return The expression node.
     * @throws ParseException if no valid expression starts at the current token.
     */
    public Expression expression() throws ParseException {
        enter();
        try {
            return or();
        } finally {
            depth--;
        }
    }

    private Expression or() throws ParseException {
        Expression expr = and();
        while (match(TokenType.OR)) {
            expr = new BinaryExpr(expr, "or", and(), expr.sourceInfo());
        }
        return expr;
    }

    private Expression and() throws ParseException {
        Expression expr = equality();
        while (match(TokenType.AND)) {
            expr = new BinaryExpr(expr, "and", equality(), expr.sourceInfo());
        }
        return expr;
    }

    private Expression equality() throws ParseException {
        Expression expr = comparison();
        while (match(TokenType.EQUAL, TokenType.NOT_EQUAL)) {
            String operator = previous().type() == TokenType.EQUAL ? "=" : "<>";
            expr = new BinaryExpr(expr, operator, comparison(), expr.sourceInfo());
        }
        return expr;
    }

    private Expression comparison() throws ParseException {
        Expression expr = term();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            String operator = switch (previous().type()) {
                case LESS -> "<";
                case LESS_EQUAL -> "<=";
                case GREATER -> ">";
                default -> ">=";
            };
            expr = new BinaryExpr(expr, operator, term(), expr.sourceInfo());
        }
        return expr;
    }

    private Expression term() throws ParseException {
        Expression expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            String operator = previous().text();
            expr = new BinaryExpr(expr, operator, factor(), expr.sourceInfo());
        }
        return expr;
    }

    private Expression factor() throws ParseException {
        Expression expr = power();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.MOD, TokenType.DIV)) {
            String operator = previous().text().toLowerCase(Locale.ROOT);
            expr = new BinaryExpr(expr, operator, power(), expr.sourceInfo());
        }
        return expr;
    }

    private Expression power() throws ParseException {
        Expression base = unary();
        if (match(TokenType.CARET)) {
            // Right associative.
            enter();
            try {
                return new BinaryExpr(base, "^", power(), base.sourceInfo());
            } finally {
                depth--;
            }
        }
        return base;
    }

    private Expression unary() throws ParseException {
        enter();
        try {
            return prefixed();
        } finally {
            depth--;
        }
    }

    private Expression prefixed() throws ParseException {
        if (match(TokenType.MINUS, TokenType.PLUS)) {
            Token operator = previous();
            Expression operand = unary();
            if (operator.type() == TokenType.PLUS) {
                return operand;
            }
            return new UnaryExpr("-", operand, operator.sourceInfo());
        }
        if (match(TokenType.NOT)) {
            Token operator = previous();
            return new UnaryExpr("not", unary(), operator.sourceInfo());
        }
        return primary();
    }

    private Expression primary() throws ParseException {
        Token token = peek();
        switch (token.type()) {
            case NUMBER:
                advance();
                return postfix(new Literal(Literal.Kind.NUMBER, token.value(), token.text(), token.sourceInfo()));
            case STRING:
                advance();
                return new Literal(Literal.Kind.STRING, token.value(), token.text(), token.sourceInfo());
            case TRUE:
            case FALSE:
                advance();
                return new Literal(Literal.Kind.BOOLEAN, token.type() == TokenType.TRUE, token.text(), token.sourceInfo());
            case NULL:
                advance();
                return new Literal(Literal.Kind.NULL, null, token.text(), token.sourceInfo());
            case INFINITY:
                advance();
                return new Literal(Literal.Kind.INFINITY, null, token.text(), token.sourceInfo());
            case CALL:
                return callStatement();
            case IDENTIFIER:
                return postfix(identifier(advance()));
            case LEFT_PAREN: {
                advance();
                Expression inner = expression();
                consume(TokenType.RIGHT_PAREN, "')'");
                return postfix(inner);
            }
            case CEIL_OPEN: {
                advance();
                Expression inner = expression();
                consume(TokenType.CEIL_CLOSE, "'⌉'");
                return new UnaryExpr("ceil", inner, token.sourceInfo());
            }
            case FLOOR_OPEN: {
                advance();
                Expression inner = expression();
                consume(TokenType.FLOOR_CLOSE, "'⌋'");
                return new UnaryExpr("floor", inner, token.sourceInfo());
            }
            default:
                throw error("an expression");
        }
    }

    private Expression postfix(Expression expr) throws ParseException {
        while (true) {
            if (match(TokenType.LEFT_BRACKET)) {
                List<Expression> indices = new ArrayList<>();
                do {
                    indices.add(expression());
                } while (match(TokenType.COMMA));
                consume(TokenType.RIGHT_BRACKET, "']'");
                expr = new ArrayAccess(expr, indices, expr.sourceInfo());
            } else if (match(TokenType.DOT)) {
                Token field = consume(TokenType.IDENTIFIER, "a field name after '.'");
                expr = new BinaryExpr(expr, ".", identifier(field), expr.sourceInfo());
            } else if (check(TokenType.LEFT_PAREN) && expr instanceof Identifier callee) {
                advance();
                expr = new Call(callee, arguments(), callee.sourceInfo());
            } else if (match(TokenType.RANGE)) {
                expr = new BinaryExpr(expr, "..", term(), expr.sourceInfo());
            } else {
                return expr;
            }
        }
    }

    /** Parses the argument list after an opening parenthesis, including the closing one. */
    private List<Expression> arguments() throws ParseException {
        List<Expression> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "')'");
        return arguments;
    }

    /**
     * Reads the control variable and bound off a loop condition such as {@code i <= n},
     * {@code low <= high and not found}, or {@code n > 1}. Anything else is unresolved.
     */
    static LoopControl controlOf(Expression condition) {
        if (condition instanceof BinaryExpr bin) {
            if ("and".equals(bin.operator()) || "or".equals(bin.operator())) {
                LoopControl left = controlOf(bin.left());
                return left.isResolved() ? left : controlOf(bin.right());
            }
            if (COMPARISON_OPERATORS.contains(bin.operator())) {
                if (bin.left() instanceof Identifier variable) {
                    return new LoopControl(variable, bin.right());
                }
                if (bin.right() instanceof Identifier variable) {
                    return new LoopControl(variable, bin.left());
                }
            }
        }
        return LoopControl.unresolved();
    }

    private Identifier identifier(Token token) {
        return new Identifier(token.text(), token.sourceInfo());
    }

    /**
     * Opens one level of nesting.
     * @throws ParseException past {@link #MAX_NESTING} levels, before the call stack runs out.
     */
    private void enter() throws ParseException {
        if (++depth > MAX_NESTING) {
            throw error("at most " + MAX_NESTING + " levels of nesting");
        }
    }

    private void skipSeparators() {
        while (check(TokenType.SEMICOLON)) {
            advance();
        }
    }

    private ParseException error(String expected) {
        Token found = peek();
        String text = found.type() == TokenType.END_OF_FILE ? "end of file" : found.text();
        ParseException exception = new ParseException(expected, text, found.sourceInfo());
        diagnostics.reportError(exception.getMessage(), found.fileName(), found.line(), found.column());
        return exception;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String expected) throws ParseException {
        if (check(type)) return advance();
        throw error(expected);
    }
}
