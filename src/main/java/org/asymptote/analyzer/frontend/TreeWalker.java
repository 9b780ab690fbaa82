package org.asymptote.analyzer.frontend;

import org.asymptote.analyzer.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * for passes that only care about a few node kinds, such as collecting calls or assignments.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and its children recursively, pre-order.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Collects every node of the given kind below (and including) the root, in pre-order.
     * @param root The root to search.
     * @param type The node class.
     * @param <T> The node type.
     * @return The matching nodes.
     */
    public static <T extends AstNode> List<T> collect(AstNode root, Class<T> type) {
        List<T> found = new ArrayList<>();
        new TreeWalker(Map.of(type, node -> found.add(type.cast(node)))).walk(root);
        return found;
    }
}
