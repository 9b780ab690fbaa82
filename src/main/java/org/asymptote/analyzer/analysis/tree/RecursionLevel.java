package org.asymptote.analyzer.analysis.tree;

import java.util.List;

/**
 * The aggregate of one depth of a recursion tree.
 *
 * @param depth The depth, zero for the root.
 * @param count The number of invocations at this depth.
 * @param labels The distinct call labels at this depth, in breadth-first order.
 * @param costExpression The symbolic cost of the level, e.g. {@code 4 × n/4}.
 * @param nominalCost The cost of the level at the nominal input size.
 */
public record RecursionLevel(int depth, int count, List<String> labels, String costExpression, double nominalCost) {

    public RecursionLevel {
        labels = List.copyOf(labels);
    }
}
