package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.analysis.LoopProgressClassifier;
import org.asymptote.analyzer.frontend.AstPrinter;
import org.asymptote.analyzer.frontend.TreeWalker;
import org.asymptote.analyzer.frontend.parser.ast.Assignment;
import org.asymptote.analyzer.frontend.parser.ast.BinaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.Call;
import org.asymptote.analyzer.frontend.parser.ast.Expression;
import org.asymptote.analyzer.frontend.parser.ast.Identifier;
import org.asymptote.analyzer.frontend.parser.ast.Literal;
import org.asymptote.analyzer.frontend.parser.ast.ProcedureDecl;
import org.asymptote.analyzer.frontend.parser.ast.UnaryExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deduces the size transform of a self-call by comparing its arguments with the formal parameters.
 * <p>
 * Arguments equal to their parameter, equal to another parameter (as with the pegs of the towers of
 * Hanoi) or independent of it (accumulators, literals) are neutral. {@code p-c} and {@code p+c}
 * shrink the size by {@code c}; {@code p/c}, {@code p div c} and their floor and ceiling forms divide it.
 * An argument based on a local variable is a halving when that variable is the midpoint of two
 * parameters, and a data-dependent split otherwise.
 */
public final class SizeTransformDeducer {

    /**
     * The outcome of a deduction.
     *
     * @param transform The deduced transform.
     * @param note An explanation of anything unresolved, or {@code null}.
     */
    public record Deduction(SizeTransform transform, String note) {
    }

    private enum Effect { NEUTRAL, SUBTRACT, DIVIDE, SPLIT, UNKNOWN }

    private record ArgumentEffect(Effect effect, double amount, String text) {
    }

    /**
     * @param procedure The recursive procedure.
     * @param call A call to that procedure from its own body.
     * @return The deduced transform. {@link SizeTransform.Split} results are always the left side;
     *         callers assign sides by call order.
     */
    public Deduction deduce(ProcedureDecl procedure, Call call) {
        List<Identifier> parameters = procedure.parameters();
        List<Expression> arguments = call.arguments();
        List<Assignment> assignments = TreeWalker.collect(procedure.body(), Assignment.class);

        List<ArgumentEffect> effects = new ArrayList<>();
        int count = Math.min(parameters.size(), arguments.size());
        for (int i = 0; i < count; i++) {
            effects.add(effectOf(parameters.get(i).name(), arguments.get(i), parameters, assignments));
        }

        double divisor = 0;
        double subtract = 0;
        String split = null;
        String unknown = null;
        for (ArgumentEffect effect : effects) {
            switch (effect.effect()) {
                case DIVIDE:
                    divisor = Math.max(divisor, effect.amount());
                    break;
                case SPLIT:
                    split = effect.text();
                    break;
                case SUBTRACT:
                    subtract += effect.amount();
                    break;
                case UNKNOWN:
                    unknown = effect.text();
                    break;
                default:
                    break;
            }
        }
        if (divisor > 1) {
            return new Deduction(new SizeTransform.Divide(divisor), null);
        }
        if (split != null) {
            return new Deduction(new SizeTransform.Split(true),
                    "The split point in " + split + " is not a constant fraction of the input");
        }
        if (subtract >= 1) {
            return new Deduction(new SizeTransform.Subtract((int) Math.round(subtract)), null);
        }
        String text = AstPrinter.render(call);
        if (unknown != null) {
            return new Deduction(new SizeTransform.Unknown(unknown),
                    "Could not deduce the input size of " + text + " from the argument " + unknown);
        }
        return new Deduction(new SizeTransform.Unknown(text),
                "The arguments of " + text + " do not shrink the input");
    }

    private ArgumentEffect effectOf(String parameter, Expression argument, List<Identifier> parameters,
                                    List<Assignment> assignments) {
        String text = AstPrinter.render(argument);
        if (argument instanceof Identifier id) {
            if (id.sameNameAs(parameter) || isParameter(id.name(), parameters)) {
                return new ArgumentEffect(Effect.NEUTRAL, 0, text);
            }
            return localEffect(id.name(), 0, parameters, assignments, text);
        }
        if (argument instanceof Literal) {
            return new ArgumentEffect(Effect.NEUTRAL, 0, text);
        }
        Expression unwrapped = unwrapRounding(argument);
        if (unwrapped instanceof BinaryExpr bin && bin.left() instanceof Identifier base) {
            double amount = LoopProgressClassifier.numberValue(bin.right());
            boolean constant = !Double.isNaN(amount);
            if (base.sameNameAs(parameter)) {
                switch (bin.operator()) {
                    case "-":
                    case "+":
                        return constant && amount >= 1
                                ? new ArgumentEffect(Effect.SUBTRACT, amount, text)
                                : new ArgumentEffect(Effect.UNKNOWN, 0, text);
                    case "/":
                    case "div":
                        return constant && amount > 1
                                ? new ArgumentEffect(Effect.DIVIDE, amount, text)
                                : new ArgumentEffect(Effect.UNKNOWN, 0, text);
                    default:
                        return new ArgumentEffect(Effect.UNKNOWN, 0, text);
                }
            }
            if (!isParameter(base.name(), parameters) && ("-".equals(bin.operator()) || "+".equals(bin.operator())) && constant) {
                return localEffect(base.name(), amount, parameters, assignments, text);
            }
        }
        boolean mentionsParameter = TreeWalker.collect(argument, Identifier.class).stream()
                .anyMatch(id -> id.sameNameAs(parameter));
        return new ArgumentEffect(mentionsParameter ? Effect.UNKNOWN : Effect.NEUTRAL, 0, text);
    }

    /**
     * An argument based on a local variable: a midpoint halves the range, anything else is a split.
     */
    private ArgumentEffect localEffect(String local, double offset, List<Identifier> parameters,
                                       List<Assignment> assignments, String text) {
        Optional<Assignment> definition = assignments.stream()
                .filter(a -> a.target() instanceof Identifier target && target.sameNameAs(local))
                .findFirst();
        if (definition.isEmpty()) {
            return new ArgumentEffect(Effect.NEUTRAL, 0, text);
        }
        Expression value = definition.get().value();
        for (int i = 0; i < parameters.size(); i++) {
            for (int j = i + 1; j < parameters.size(); j++) {
                if (LoopProgressClassifier.isMidpoint(value, parameters.get(i).name(), parameters.get(j).name())) {
                    return new ArgumentEffect(Effect.DIVIDE, 2, text);
                }
            }
        }
        boolean derivedFromParameters = TreeWalker.collect(value, Identifier.class).stream()
                .anyMatch(id -> isParameter(id.name(), parameters));
        if (value instanceof Call || derivedFromParameters) {
            return new ArgumentEffect(Effect.SPLIT, offset, local + " <- " + AstPrinter.render(value));
        }
        return new ArgumentEffect(Effect.NEUTRAL, 0, text);
    }

    private static Expression unwrapRounding(Expression expression) {
        if (expression instanceof UnaryExpr unary && ("floor".equals(unary.operator()) || "ceil".equals(unary.operator()))) {
            return unary.operand();
        }
        if (expression instanceof Call call && (call.targets("floor") || call.targets("ceil")) && call.arguments().size() == 1) {
            return call.arguments().get(0);
        }
        return expression;
    }

    private static boolean isParameter(String name, List<Identifier> parameters) {
        return parameters.stream().anyMatch(p -> p.sameNameAs(name));
    }
}
