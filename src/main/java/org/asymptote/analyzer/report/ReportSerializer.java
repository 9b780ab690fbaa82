package org.asymptote.analyzer.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.asymptote.analyzer.analysis.linecost.LineCost;
import org.asymptote.analyzer.analysis.linecost.LineCostReport;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceRelation;
import org.asymptote.analyzer.analysis.recurrence.SolverOutcome;
import org.asymptote.analyzer.analysis.resolution.Resolution;
import org.asymptote.analyzer.analysis.tree.RecursionLevel;
import org.asymptote.analyzer.analysis.tree.RecursionTree;
import org.asymptote.analyzer.analysis.tree.RecursionTreeNode;
import org.asymptote.analyzer.diagnostics.Diagnostic;
import org.asymptote.analyzer.frontend.lexer.Token;
import org.asymptote.analyzer.model.Annotation;
import org.asymptote.analyzer.model.Bound;
import org.asymptote.analyzer.model.MathStep;

import java.util.List;
import java.util.Map;

/**
 * Converts an {@link AnalysisReport} into the JSON document consumed by presentation layers.
 * <p>
 * Top-level sections: {@code lexer}, {@code parser}, {@code line_costs}, {@code extraction},
 * {@code solution}, {@code recursion_tree} (only for recursive programs), {@code annotations},
 * {@code diagnostics} and {@code grammar_correction} (only after a correction).
 */
public final class ReportSerializer {

    private final Gson gson;

    public ReportSerializer() {
        this(true);
    }

    /**
     * @param prettyPrinting {@code true} for indented output.
     */
    public ReportSerializer(boolean prettyPrinting) {
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (prettyPrinting) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public String toJson(AnalysisReport report) {
        return gson.toJson(toJsonTree(report));
    }

    public String toJson(JsonObject object) {
        return gson.toJson(object);
    }

    /**
     * @param report A report.
     * @return The report as a JSON tree.
     */
    public JsonObject toJsonTree(AnalysisReport report) {
        JsonObject root = new JsonObject();
        root.addProperty("program", report.programName());
        root.add("lexer", lexer(report.tokens()));

        JsonObject parser = new JsonObject();
        parser.addProperty("ast_dump", report.astDump());
        root.add("parser", parser);

        root.add("line_costs", lineCosts(report.lineCosts()));
        root.add("extraction", extraction(report.relation()));
        root.add("solution", solution(report.resolution(), report.outcome()));
        if (report.tree() != null) {
            root.add("recursion_tree", tree(report.tree()));
        }
        root.add("annotations", annotations(report.resolution().annotations()));
        root.add("diagnostics", diagnostics(report.diagnostics()));
        if (report.wasCorrected()) {
            JsonObject correction = new JsonObject();
            correction.addProperty("applied", true);
            correction.addProperty("note", report.correctionNote());
            root.add("grammar_correction", correction);
        }
        return root;
    }

    /**
     * @param relation A recurrence solved on its own.
     * @param outcome Its solver outcome.
     * @return The equation with the outcome and its derivation.
     */
    public JsonObject toJsonTree(RecurrenceRelation relation, SolverOutcome outcome) {
        JsonObject json = new JsonObject();
        json.addProperty("equation", relation.equation());
        json.addProperty("base_case", relation.baseCase());
        json.addProperty("solved", outcome.isSolved());
        if (outcome instanceof SolverOutcome.Solved solved) {
            json.addProperty("result", solved.bound().toNotation(Bound.THETA));
            json.addProperty("method_used", solved.method().displayName());
            json.addProperty("justification", solved.justification());
            json.add("annotations", annotations(solved.annotations()));
        } else {
            json.addProperty("reason", ((SolverOutcome.Unsolvable) outcome).reason());
        }
        json.add("math_steps", steps(outcome.steps()));
        return json;
    }

    private static JsonObject lexer(List<Token> tokens) {
        JsonArray array = new JsonArray();
        for (Token token : tokens) {
            JsonObject json = new JsonObject();
            json.addProperty("type", token.type().name());
            json.addProperty("text", token.text());
            json.addProperty("line", token.line());
            json.addProperty("column", token.column());
            array.add(json);
        }
        JsonObject lexer = new JsonObject();
        lexer.add("tokens", array);
        return lexer;
    }

    private static JsonObject lineCosts(LineCostReport report) {
        JsonArray rows = new JsonArray();
        for (LineCost row : report.rows()) {
            JsonObject json = new JsonObject();
            json.addProperty("line", row.line());
            json.addProperty("code", row.snippet());
            json.addProperty("cost", row.costLabel());
            json.addProperty("scope", row.scope());
            json.addProperty("explanation", row.explanation());
            rows.add(json);
        }
        JsonObject breakdown = new JsonObject();
        for (Map.Entry<String, Integer> entry : report.breakdown().entrySet()) {
            breakdown.addProperty(entry.getKey(), entry.getValue());
        }
        JsonObject json = new JsonObject();
        json.add("rows", rows);
        json.add("breakdown", breakdown);
        json.addProperty("total", report.total().render());
        return json;
    }

    private static JsonObject extraction(RecurrenceRelation relation) {
        JsonObject json = new JsonObject();
        if (relation == null) {
            json.addProperty("equation", "");
            json.addProperty("explanation", "No self-recursive procedure; no recurrence to extract.");
            json.addProperty("base_case", "");
            json.add("notes", new JsonArray());
            return json;
        }
        json.addProperty("procedure", relation.procedure());
        json.addProperty("equation", relation.equation());
        json.addProperty("explanation", relation.explanation());
        json.addProperty("base_case", relation.baseCase());
        json.add("notes", strings(relation.notes()));
        return json;
    }

    private static JsonObject solution(Resolution resolution, SolverOutcome outcome) {
        JsonObject cases = new JsonObject();
        cases.addProperty("best", resolution.bestCase());
        cases.addProperty("average", resolution.averageCase());
        cases.addProperty("worst", resolution.worstCase());

        JsonObject json = new JsonObject();
        json.addProperty("main_result", resolution.mainResult());
        json.add("cases", cases);
        json.addProperty("method_used", resolution.method());
        json.addProperty("justification", resolution.justification());
        json.add("math_steps", steps(resolution.steps()));
        if (outcome != null) {
            json.addProperty("recurrence_solved", outcome.isSolved());
        }
        return json;
    }

    private static JsonArray steps(List<MathStep> steps) {
        JsonArray array = new JsonArray();
        for (MathStep step : steps) {
            JsonObject json = new JsonObject();
            json.addProperty("label", step.label());
            json.addProperty("value", step.value());
            array.add(json);
        }
        return array;
    }

    private static JsonObject tree(RecursionTree tree) {
        JsonArray levels = new JsonArray();
        for (RecursionLevel level : tree.levels()) {
            JsonObject json = new JsonObject();
            json.addProperty("depth", level.depth());
            json.addProperty("count", level.count());
            json.add("labels", strings(level.labels()));
            json.addProperty("cost", level.costExpression());
            json.addProperty("nominal_cost", level.nominalCost());
            levels.add(json);
        }
        JsonObject json = new JsonObject();
        json.add("levels", levels);
        json.add("structure", node(tree.root()));
        json.addProperty("total", tree.total());
        json.addProperty("truncated", tree.truncated());
        return json;
    }

    private static JsonObject node(RecursionTreeNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("label", node.label());
        json.addProperty("cost", node.cost());
        JsonArray children = new JsonArray();
        for (RecursionTreeNode child : node.children()) {
            children.add(node(child));
        }
        json.add("children", children);
        return json;
    }

    private static JsonArray annotations(List<Annotation> annotations) {
        JsonArray array = new JsonArray();
        for (Annotation annotation : annotations) {
            JsonObject json = new JsonObject();
            json.addProperty("kind", annotation.kind().name());
            json.addProperty("message", annotation.message());
            json.addProperty("line", annotation.line());
            json.addProperty("assumption", annotation.assumption());
            array.add(json);
        }
        return array;
    }

    private static JsonArray diagnostics(List<Diagnostic> diagnostics) {
        JsonArray array = new JsonArray();
        for (Diagnostic diagnostic : diagnostics) {
            JsonObject json = new JsonObject();
            json.addProperty("type", diagnostic.type().name());
            json.addProperty("message", diagnostic.message());
            json.addProperty("line", diagnostic.lineNumber());
            json.addProperty("column", diagnostic.columnNumber());
            array.add(json);
        }
        return array;
    }

    private static JsonArray strings(List<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }
}
