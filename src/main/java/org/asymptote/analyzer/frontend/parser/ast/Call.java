package org.asymptote.analyzer.frontend.parser.ast;

import org.asymptote.analyzer.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A procedure call, either as a statement ({@code CALL f(x)}, {@code f(x)}, {@code swap a with b})
 * or as a function call inside an expression.
 *
 * @param callee The name of the called procedure.
 * @param arguments The actual arguments.
 * @param sourceInfo The position of the call.
 */
public record Call(
        Identifier callee,
        List<Expression> arguments,
        SourceInfo sourceInfo
) implements Statement, Expression {

    public Call {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public String calleeName() {
        return callee.name();
    }

    /**
     * @param procedureName A procedure name.
     * @return {@code true} if this call targets that procedure, compared case-insensitively.
     */
    public boolean targets(String procedureName) {
        return procedureName != null
                && callee.name().toLowerCase(Locale.ROOT).equals(procedureName.toLowerCase(Locale.ROOT));
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(callee);
        children.addAll(arguments);
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
