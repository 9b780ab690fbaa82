package org.asymptote.analyzer.analysis.tree;

import java.util.List;

/**
 * One invocation in a recursion tree.
 *
 * @param label The call with its symbolic input size, e.g. {@code T(n/2)}.
 * @param cost The non-recursive work of the invocation, e.g. {@code n/2}.
 * @param children The invocations it makes, empty for base cases and truncated nodes.
 */
public record RecursionTreeNode(String label, String cost, List<RecursionTreeNode> children) {

    public RecursionTreeNode {
        children = List.copyOf(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
