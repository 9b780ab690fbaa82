package org.asymptote.analyzer.analysis;

import org.asymptote.analyzer.frontend.AstPrinter;
import org.asymptote.analyzer.frontend.TreeWalker;
import org.asymptote.analyzer.frontend.parser.ast.Assignment;
import org.asymptote.analyzer.frontend.parser.ast.BinaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.Block;
import org.asymptote.analyzer.frontend.parser.ast.Call;
import org.asymptote.analyzer.frontend.parser.ast.Expression;
import org.asymptote.analyzer.frontend.parser.ast.ForLoop;
import org.asymptote.analyzer.frontend.parser.ast.Identifier;
import org.asymptote.analyzer.frontend.parser.ast.Literal;
import org.asymptote.analyzer.frontend.parser.ast.LoopControl;
import org.asymptote.analyzer.frontend.parser.ast.RepeatUntilLoop;
import org.asymptote.analyzer.frontend.parser.ast.ReturnStmt;
import org.asymptote.analyzer.frontend.parser.ast.Statement;
import org.asymptote.analyzer.frontend.parser.ast.UnaryExpr;
import org.asymptote.analyzer.frontend.parser.ast.WhileLoop;
import org.asymptote.analyzer.model.GrowthRate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Classifies how a loop progresses and derives its iteration count.
 * <p>
 * Counting loops are linear unless both bounds are constants or the bound is a square root; a body
 * that reassigns the loop variable is classified by that update instead.
 * Conditional loops are classified by how their body updates the control variable read off the
 * condition: constant steps are linear, constant factors and midpoint halving are logarithmic, a
 * constant step against a squared bound ({@code i * i <= n}) is a square root, and anything else is
 * unresolved and approximated as linear. The classifier is stateless.
 */
public final class LoopProgressClassifier {

    private static final List<String> FLAG_HINTS = List.of(
            "found", "encontr", "flag", "exist", "swapped", "intercambi", "done", "sorted", "stop");

    private enum Update { ADD_UP, ADD_DOWN, MULTIPLY, OTHER }

    public LoopShape classify(ForLoop loop) {
        boolean earlyExit = hasEarlyReturn(loop.body());
        String variable = loop.variable().name();
        List<Update> updates = new ArrayList<>();
        for (Assignment assignment : TreeWalker.collect(loop.body(), Assignment.class)) {
            if (assignment.target() instanceof Identifier target && target.sameNameAs(variable)) {
                updates.add(classifyUpdate(variable, assignment.value()));
            }
        }
        if (updates.contains(Update.OTHER)) {
            return new LoopShape(ProgressKind.UNRESOLVED, GrowthRate.LINEAR, earlyExit,
                    "the body reassigns the loop variable " + variable + " by an unpredictable amount");
        }
        if (updates.contains(Update.MULTIPLY)) {
            return new LoopShape(ProgressKind.MULTIPLICATIVE, GrowthRate.LOGARITHMIC, earlyExit,
                    "the body multiplies or divides the loop variable " + variable + " by a constant factor");
        }
        if (isNumber(loop.start()) && isNumber(loop.end())) {
            return new LoopShape(ProgressKind.CONSTANT_BOUND, GrowthRate.CONSTANT, earlyExit,
                    "constant bounds " + AstPrinter.render(loop.start()) + ".." + AstPrinter.render(loop.end()));
        }
        if (isCallTo(loop.end(), "sqrt")) {
            return new LoopShape(ProgressKind.SQUARE_ROOT, GrowthRate.polynomial(0.5), earlyExit,
                    "counts up to a square root");
        }
        if (isCallTo(loop.end(), "log")) {
            return new LoopShape(ProgressKind.MULTIPLICATIVE, GrowthRate.LOGARITHMIC, earlyExit,
                    "counts up to a logarithm");
        }
        return new LoopShape(ProgressKind.ADDITIVE, GrowthRate.LINEAR, earlyExit,
                loop.variable().name() + " steps through " + AstPrinter.render(loop.start())
                        + (loop.descending() ? " downto " : " to ") + AstPrinter.render(loop.end()));
    }

    /**
     * @param loop A counting loop.
     * @return The number of passes when both bounds and the step are number literals and the body
     *         never assigns the loop variable, empty otherwise.
     */
    public static OptionalInt constantIterations(ForLoop loop) {
        double start = numberValue(loop.start());
        double end = numberValue(loop.end());
        double step = loop.step() == null ? 1 : Math.abs(numberValue(loop.step()));
        if (Double.isNaN(start) || Double.isNaN(end) || Double.isNaN(step) || step == 0) {
            return OptionalInt.empty();
        }
        boolean reassigned = TreeWalker.collect(loop.body(), Assignment.class).stream()
                .anyMatch(a -> a.target() instanceof Identifier target && target.sameNameAs(loop.variable().name()));
        if (reassigned) {
            return OptionalInt.empty();
        }
        double span = loop.descending() ? start - end : end - start;
        return span < 0 ? OptionalInt.of(0) : OptionalInt.of((int) Math.floor(span / step) + 1);
    }

    public LoopShape classify(WhileLoop loop) {
        return classifyConditional(loop.condition(), loop.control(), loop.body());
    }

    public LoopShape classify(RepeatUntilLoop loop) {
        return classifyConditional(loop.condition(), loop.control(), loop.body());
    }

    /**
     * Dispatches to the overload for the given loop statement.
     * @param loop A {@link ForLoop}, {@link WhileLoop} or {@link RepeatUntilLoop}.
     * @return The loop's shape.
     */
    public LoopShape classify(Statement loop) {
        if (loop instanceof ForLoop forLoop) {
            return classify(forLoop);
        } else if (loop instanceof WhileLoop whileLoop) {
            return classify(whileLoop);
        } else if (loop instanceof RepeatUntilLoop repeatLoop) {
            return classify(repeatLoop);
        }
        throw new IllegalArgumentException("Not a loop: " + loop.getClass().getSimpleName());
    }

    private LoopShape classifyConditional(Expression condition, LoopControl control, Block body) {
        List<Assignment> assignments = TreeWalker.collect(body, Assignment.class);
        Set<String> flags = flagVariables(condition, assignments);
        boolean earlyReturn = hasEarlyReturn(body);

        if (isHalvingRange(condition, assignments)) {
            return new LoopShape(ProgressKind.HALVING_RANGE, GrowthRate.LOGARITHMIC, earlyReturn || !flags.isEmpty(),
                    "the range " + AstPrinter.render(condition) + " is halved around a midpoint each pass");
        }

        Identifier root = squaredVariable(condition);
        if (root != null) {
            boolean stepsUp = false;
            boolean other = false;
            for (Assignment assignment : assignments) {
                if (assignment.target() instanceof Identifier target && target.sameNameAs(root.name())) {
                    Update update = classifyUpdate(root.name(), assignment.value());
                    stepsUp |= update == Update.ADD_UP;
                    other |= update != Update.ADD_UP;
                }
            }
            if (stepsUp && !other) {
                return new LoopShape(ProgressKind.SQUARE_ROOT, GrowthRate.polynomial(0.5), earlyReturn || !flags.isEmpty(),
                        root.name() + " counts up while its square stays within " + AstPrinter.render(condition));
            }
        }

        if (control.isResolved()) {
            List<Identifier> candidates = new ArrayList<>();
            candidates.add(control.variable());
            if (control.bound() instanceof Identifier other) {
                candidates.add(other);
            }
            List<Update> updates = new ArrayList<>();
            String updated = null;
            for (Identifier candidate : candidates) {
                for (Assignment assignment : assignments) {
                    if (assignment.target() instanceof Identifier target && target.sameNameAs(candidate.name())) {
                        updates.add(classifyUpdate(candidate.name(), assignment.value()));
                        updated = candidate.name();
                    }
                }
                if (!updates.isEmpty()) {
                    break;
                }
            }
            if (!updates.isEmpty()) {
                boolean earlyExit = earlyReturn || !flags.isEmpty();
                if (updates.contains(Update.OTHER)) {
                    return new LoopShape(ProgressKind.UNRESOLVED, GrowthRate.LINEAR, earlyExit,
                            "the update of " + updated + " is not a constant step or factor");
                }
                if (updates.contains(Update.ADD_UP) || updates.contains(Update.ADD_DOWN)) {
                    boolean countsUp = !updates.contains(Update.ADD_DOWN);
                    if (countsUp && isNumber(control.bound()) && control.variable().sameNameAs(updated)) {
                        return new LoopShape(ProgressKind.CONSTANT_BOUND, GrowthRate.CONSTANT, earlyExit,
                                updated + " counts up to the constant " + AstPrinter.render(control.bound()));
                    }
                    return new LoopShape(ProgressKind.ADDITIVE, GrowthRate.LINEAR, earlyExit,
                            updated + " changes by a constant step");
                }
                return new LoopShape(ProgressKind.MULTIPLICATIVE, GrowthRate.LOGARITHMIC, earlyExit,
                        updated + " is multiplied or divided by a constant factor");
            }
        }
        if (!flags.isEmpty()) {
            return new LoopShape(ProgressKind.FLAG, GrowthRate.LINEAR, true,
                    "controlled by the flag " + String.join(", ", flags));
        }
        return new LoopShape(ProgressKind.UNRESOLVED, GrowthRate.LINEAR, earlyReturn,
                "no update of the condition " + AstPrinter.render(condition) + " could be classified");
    }

    private Update classifyUpdate(String variable, Expression value) {
        if (value instanceof UnaryExpr unary && ("floor".equals(unary.operator()) || "ceil".equals(unary.operator()))) {
            return classifyUpdate(variable, unary.operand());
        }
        if (value instanceof Call call && (call.targets("floor") || call.targets("ceil")) && call.arguments().size() == 1) {
            return classifyUpdate(variable, call.arguments().get(0));
        }
        if (!(value instanceof BinaryExpr bin)) {
            return Update.OTHER;
        }
        boolean leftIsVar = isVariable(bin.left(), variable);
        boolean rightIsVar = isVariable(bin.right(), variable);
        Expression other = leftIsVar ? bin.right() : bin.left();
        if (!leftIsVar && !rightIsVar) {
            return Update.OTHER;
        }
        switch (bin.operator()) {
            case "+":
                if (isStep(other)) {
                    return isNegative(other) ? Update.ADD_DOWN : Update.ADD_UP;
                }
                return Update.OTHER;
            case "-":
                return leftIsVar && isStep(other) ? Update.ADD_DOWN : Update.OTHER;
            case "/":
            case "div":
                return leftIsVar && numberValue(other) > 1 ? Update.MULTIPLY : Update.OTHER;
            case "*":
                return numberValue(other) > 1 ? Update.MULTIPLY : Update.OTHER;
            default:
                return Update.OTHER;
        }
    }

    /**
     * @param condition A loop condition.
     * @return {@code v} for conditions such as {@code v * v <= n} or {@code n >= v * v}, else {@code null}.
     */
    private static Identifier squaredVariable(Expression condition) {
        if (!(condition instanceof BinaryExpr bin)) {
            return null;
        }
        if ("and".equals(bin.operator())) {
            Identifier left = squaredVariable(bin.left());
            return left != null ? left : squaredVariable(bin.right());
        }
        Expression squared;
        switch (bin.operator()) {
            case "<":
            case "<=":
                squared = bin.left();
                break;
            case ">":
            case ">=":
                squared = bin.right();
                break;
            default:
                return null;
        }
        if (squared instanceof BinaryExpr product && product.left() instanceof Identifier v) {
            boolean square = "*".equals(product.operator()) && isVariable(product.right(), v.name());
            boolean power = "^".equals(product.operator()) && numberValue(product.right()) == 2;
            if (square || power) {
                return v;
            }
        }
        return null;
    }

    /**
     * Recognizes {@code while low <= high} loops that compute {@code mid} from both bounds and move
     * one of the bounds to it.
     */
    private boolean isHalvingRange(Expression condition, List<Assignment> assignments) {
        if (!(condition instanceof BinaryExpr bin)) {
            return false;
        }
        if ("and".equals(bin.operator()) || "or".equals(bin.operator())) {
            return isHalvingRange(bin.left(), assignments) || isHalvingRange(bin.right(), assignments);
        }
        if (!(bin.left() instanceof Identifier low) || !(bin.right() instanceof Identifier high)) {
            return false;
        }
        for (Assignment midAssignment : assignments) {
            String mid = midAssignment.target() instanceof Identifier id ? id.name() : null;
            if (mid == null || !isMidpoint(midAssignment.value(), low.name(), high.name())) {
                continue;
            }
            for (Assignment bound : assignments) {
                String target = bound.target() instanceof Identifier id ? id.name() : null;
                boolean movesBound = low.sameNameAs(target) || high.sameNameAs(target);
                if (movesBound && mentions(bound.value(), mid)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @param value An expression.
     * @param low The lower bound name.
     * @param high The upper bound name.
     * @return {@code true} for {@code (low + high) / 2}, its {@code div}, floor and ceiling forms,
     *         and {@code low + (high - low) / 2}.
     */
    public static boolean isMidpoint(Expression value, String low, String high) {
        if (value instanceof UnaryExpr unary && ("floor".equals(unary.operator()) || "ceil".equals(unary.operator()))) {
            return isMidpoint(unary.operand(), low, high);
        }
        if (value instanceof Call call && (call.targets("floor") || call.targets("ceil")) && call.arguments().size() == 1) {
            return isMidpoint(call.arguments().get(0), low, high);
        }
        if (!(value instanceof BinaryExpr bin)) {
            return false;
        }
        if (("/".equals(bin.operator()) || "div".equals(bin.operator())) && numberValue(bin.right()) == 2) {
            Set<String> names = identifierNames(bin.left());
            return containsIgnoreCase(names, low) && containsIgnoreCase(names, high);
        }
        if ("+".equals(bin.operator()) && isVariable(bin.left(), low)) {
            Set<String> names = identifierNames(bin.right());
            return containsIgnoreCase(names, high) && mentionsDivisionByTwo(bin.right());
        }
        return false;
    }

    private static boolean mentionsDivisionByTwo(Expression expression) {
        return TreeWalker.collect(expression, BinaryExpr.class).stream()
                .anyMatch(b -> ("/".equals(b.operator()) || "div".equals(b.operator())) && numberValue(b.right()) == 2);
    }

    /**
     * @param body A loop body.
     * @return {@code true} if the body contains a {@code return}, which leaves the loop early.
     */
    public static boolean hasEarlyReturn(Block body) {
        return !TreeWalker.collect(body, ReturnStmt.class).isEmpty();
    }

    /**
     * @param condition A loop condition.
     * @param assignments The assignments of the loop body.
     * @return The condition variables that act as boolean flags: assigned a boolean literal in the
     *         body, or named like one and assigned in the body.
     */
    static Set<String> flagVariables(Expression condition, List<Assignment> assignments) {
        Set<String> flags = new LinkedHashSet<>();
        for (Identifier id : TreeWalker.collect(condition, Identifier.class)) {
            for (Assignment assignment : assignments) {
                if (!(assignment.target() instanceof Identifier target) || !target.sameNameAs(id.name())) {
                    continue;
                }
                boolean booleanValue = assignment.value() instanceof Literal literal
                        && literal.kind() == Literal.Kind.BOOLEAN;
                if (booleanValue || looksLikeFlag(id.name())) {
                    flags.add(id.name());
                }
            }
        }
        return flags;
    }

    /**
     * @param name A variable name.
     * @return {@code true} if the name suggests a boolean flag, e.g. {@code found} or {@code swapped}.
     */
    public static boolean looksLikeFlag(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return FLAG_HINTS.stream().anyMatch(lower::contains);
    }

    private static boolean isStep(Expression expression) {
        if (isNumber(expression)) {
            return true;
        }
        if (expression instanceof UnaryExpr unary && "-".equals(unary.operator())) {
            return isStep(unary.operand());
        }
        // i <- i + step with a loop-invariant step variable.
        return expression instanceof Identifier;
    }

    private static boolean isNegative(Expression expression) {
        if (expression instanceof UnaryExpr unary && "-".equals(unary.operator())) {
            return true;
        }
        Double value = expression instanceof Literal literal ? literal.numericValue() : null;
        return value != null && value < 0;
    }

    private static boolean isVariable(Expression expression, String name) {
        return expression instanceof Identifier id && id.sameNameAs(name);
    }

    private static boolean isNumber(Expression expression) {
        return expression instanceof Literal literal && literal.kind() == Literal.Kind.NUMBER;
    }

    private static boolean isCallTo(Expression expression, String name) {
        return expression instanceof Call call && call.targets(name);
    }

    /**
     * @param expression An expression.
     * @return Its numeric value if it is a number literal, else {@code NaN}.
     */
    public static double numberValue(Expression expression) {
        if (expression instanceof Literal literal && literal.numericValue() != null) {
            return literal.numericValue();
        }
        return Double.NaN;
    }

    private static boolean mentions(Expression expression, String name) {
        return containsIgnoreCase(identifierNames(expression), name);
    }

    static Set<String> identifierNames(Expression expression) {
        Set<String> names = new LinkedHashSet<>();
        for (Identifier id : TreeWalker.collect(expression, Identifier.class)) {
            names.add(id.name());
        }
        return names;
    }

    private static boolean containsIgnoreCase(Set<String> names, String name) {
        return names.stream().anyMatch(n -> n.equalsIgnoreCase(name));
    }
}
