package org.asymptote.analyzer.analysis.tree;

import java.util.List;

/**
 * A bounded expansion of a recurrence, for explanation only.
 *
 * @param root The top-level invocation.
 * @param levels The per-depth aggregates.
 * @param total The sum of the nominal level costs.
 * @param truncated {@code true} if the depth or node cap stopped the expansion before every branch
 *                  reached its base case.
 */
public record RecursionTree(RecursionTreeNode root, List<RecursionLevel> levels, double total, boolean truncated) {

    public RecursionTree {
        levels = List.copyOf(levels);
    }

    public int depth() {
        return levels.size() - 1;
    }

    public int nodeCount() {
        return levels.stream().mapToInt(RecursionLevel::count).sum();
    }
}
