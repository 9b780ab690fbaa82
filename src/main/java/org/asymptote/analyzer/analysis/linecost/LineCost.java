package org.asymptote.analyzer.analysis.linecost;

import org.asymptote.analyzer.model.GrowthRate;

/**
 * The cost attributed to one source statement.
 *
 * @param line The source line.
 * @param snippet The source text of the line.
 * @param cost How often the statement runs, times the cost of the procedures it calls.
 * @param costLabel The rendered cost, or the recursive term for recursive calls, e.g. {@code T(n/2)}.
 * @param explanation Why the line has this cost.
 * @param origin Whether the cost is structural or a recurrence term.
 * @param scope The procedure the line belongs to, or {@code main}.
 */
public record LineCost(
        int line,
        String snippet,
        GrowthRate cost,
        String costLabel,
        String explanation,
        Origin origin,
        String scope
) {
}
