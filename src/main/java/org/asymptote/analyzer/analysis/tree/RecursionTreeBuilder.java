package org.asymptote.analyzer.analysis.tree;

import org.asymptote.analyzer.analysis.recurrence.RecurrenceRelation;
import org.asymptote.analyzer.analysis.recurrence.RecursiveTerm;
import org.asymptote.analyzer.analysis.recurrence.SizeTransform;
import org.asymptote.analyzer.model.GrowthRate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Expands a recurrence breadth-first into a recursion tree.
 * <p>
 * Every node carries a symbolic size ({@code n/4}, {@code n-2}, {@code k}) for display and a nominal
 * concrete size that only decides whether the base case is reached. The expansion stops at the base
 * case, at the depth cap or when the node cap is reached.
 */
public class RecursionTreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(RecursionTreeBuilder.class);

    public static final int DEFAULT_MAX_DEPTH = 6;
    public static final int DEFAULT_MAX_NODES = 1024;
    public static final double DEFAULT_NOMINAL_SIZE = 64;

    private final int maxDepth;
    private final int maxNodes;
    private final double nominalSize;

    public RecursionTreeBuilder() {
        this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODES, DEFAULT_NOMINAL_SIZE);
    }

    /**
     * @param maxDepth The deepest level to expand, zero for the root only.
     * @param maxNodes The largest number of nodes the tree may hold.
     * @param nominalSize The concrete input size of the root.
     * @throws IllegalArgumentException if a cap is out of range.
     */
    public RecursionTreeBuilder(int maxDepth, int maxNodes, double nominalSize) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        if (nominalSize <= 1) {
            throw new IllegalArgumentException("nominalSize must exceed 1: " + nominalSize);
        }
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
        this.nominalSize = nominalSize;
    }

    public RecursionTree build(RecurrenceRelation relation) {
        return build(relation, maxDepth);
    }

    /**
     * @param relation The recurrence to expand.
     * @param depthLimit The deepest level to expand for this tree.
     * @return The tree with its level aggregates.
     */
    public RecursionTree build(RecurrenceRelation relation, int depthLimit) {
        if (depthLimit < 0) {
            throw new IllegalArgumentException("depthLimit must not be negative: " + depthLimit);
        }
        GrowthRate cost = relation.nonRecursiveCost();
        PendingNode root = new PendingNode(Size.ROOT, nominalSize, cost);
        List<RecursionLevel> levels = new ArrayList<>();
        List<PendingNode> frontier = List.of(root);
        int nodes = 1;
        boolean truncated = false;

        for (int depth = 0; !frontier.isEmpty(); depth++) {
            levels.add(level(depth, frontier, cost));
            if (depth == depthLimit) {
                truncated = frontier.stream().anyMatch(node -> !node.isBase());
                break;
            }
            List<PendingNode> next = new ArrayList<>();
            expansion:
            for (PendingNode node : frontier) {
                if (node.isBase()) {
                    continue;
                }
                for (RecursiveTerm term : relation.terms()) {
                    for (int i = 0; i < term.coefficient(); i++) {
                        if (nodes >= maxNodes) {
                            truncated = true;
                            break expansion;
                        }
                        PendingNode child = node.child(term.transform(), cost);
                        node.children.add(child);
                        next.add(child);
                        nodes++;
                    }
                }
            }
            frontier = next;
        }

        double total = levels.stream().mapToDouble(RecursionLevel::nominalCost).sum();
        LOG.debug("Recursion tree for {}: {} levels, {} nodes, truncated={}",
                relation.procedure(), levels.size(), nodes, truncated);
        return new RecursionTree(root.freeze(), levels, total, truncated);
    }

    private static RecursionLevel level(int depth, List<PendingNode> nodes, GrowthRate cost) {
        Map<String, Integer> grouped = new LinkedHashMap<>();
        double nominal = 0;
        for (PendingNode node : nodes) {
            grouped.merge(node.cost, 1, Integer::sum);
            nominal += node.isBase() ? 1 : cost.valueAt(node.nominal);
        }
        String expression = grouped.entrySet().stream()
                .map(e -> e.getValue() == 1 ? e.getKey() : e.getValue() + " × " + e.getKey())
                .collect(Collectors.joining(" + "));
        List<String> labels = nodes.stream().map(PendingNode::label).distinct().collect(Collectors.toList());
        return new RecursionLevel(depth, nodes.size(), labels, expression, nominal);
    }

    /**
     * A symbolic size {@code n/divisor - offset}, or a fixed label for sizes that do not compose.
     */
    private record Size(double divisor, double offset, String fixed) {
        static final Size ROOT = new Size(1, 0, null);

        Size apply(SizeTransform transform) {
            if (transform instanceof SizeTransform.Split || transform instanceof SizeTransform.Unknown) {
                return new Size(divisor, offset, transform.label());
            }
            if (fixed != null) {
                return this;
            }
            if (transform instanceof SizeTransform.Divide divide) {
                return new Size(divisor * divide.divisor(), offset / divide.divisor(), null);
            }
            SizeTransform.Subtract subtract = (SizeTransform.Subtract) transform;
            return new Size(divisor, offset + subtract.amount(), null);
        }

        String render() {
            if (fixed != null) {
                return fixed;
            }
            StringBuilder out = new StringBuilder("n");
            if (divisor > 1) {
                out.append('/').append(GrowthRate.formatNumber(divisor));
            }
            if (offset > 0) {
                out.append('-').append(GrowthRate.formatNumber(offset));
            }
            return out.toString();
        }
    }

    private static final class PendingNode {
        private final Size size;
        private final double nominal;
        private final String cost;
        private final List<PendingNode> children = new ArrayList<>();

        PendingNode(Size size, double nominal, GrowthRate work) {
            this.size = size;
            this.nominal = nominal;
            this.cost = isBase() ? "1" : work.render(variable(size.render(), work));
        }

        boolean isBase() {
            return nominal <= 1;
        }

        String label() {
            return "T(" + size.render() + ")";
        }

        PendingNode child(SizeTransform transform, GrowthRate work) {
            return new PendingNode(size.apply(transform), transform.apply(nominal), work);
        }

        RecursionTreeNode freeze() {
            return new RecursionTreeNode(label(), cost,
                    children.stream().map(PendingNode::freeze).collect(Collectors.toList()));
        }

        private static String variable(String size, GrowthRate work) {
            boolean linear = work.degree() == 1 && work.logPower() == 0 && !work.isExponential();
            return linear || size.matches("[a-z]") ? size : "(" + size + ")";
        }
    }
}
