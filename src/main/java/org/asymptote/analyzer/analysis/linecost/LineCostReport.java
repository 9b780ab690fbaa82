package org.asymptote.analyzer.analysis.linecost;

import org.asymptote.analyzer.model.GrowthRate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All line costs of a program, in source order, with a breakdown by cost class and the dominating total.
 *
 * @param rows The line costs.
 * @param breakdown The number of rows per cost label, in order of first appearance.
 * @param total The dominating cost over all rows.
 */
public record LineCostReport(List<LineCost> rows, Map<String, Integer> breakdown, GrowthRate total) {

    public LineCostReport {
        rows = List.copyOf(rows);
        breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }

    /**
     * @param rows The line costs.
     * @return A report with breakdown and total derived from the rows.
     */
    public static LineCostReport of(List<LineCost> rows) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        GrowthRate total = GrowthRate.CONSTANT;
        for (LineCost row : rows) {
            breakdown.merge(row.costLabel(), 1, Integer::sum);
            total = total.max(row.cost());
        }
        return new LineCostReport(rows, breakdown, total);
    }

    /**
     * @param scope A procedure name or {@code main}.
     * @return The rows of that scope.
     */
    public List<LineCost> rowsOf(String scope) {
        return rows.stream().filter(r -> r.scope().equalsIgnoreCase(scope)).toList();
    }

    /**
     * @param scope A procedure name or {@code main}.
     * @return The dominating cost of the scope's structural rows, which excludes recursive calls.
     */
    public GrowthRate structuralCostOf(String scope) {
        return rowsOf(scope).stream()
                .filter(r -> r.origin() == Origin.STRUCTURAL)
                .map(LineCost::cost)
                .reduce(GrowthRate.CONSTANT, GrowthRate::max);
    }
}
