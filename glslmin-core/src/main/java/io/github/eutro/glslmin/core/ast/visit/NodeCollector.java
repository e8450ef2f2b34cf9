package io.github.eutro.glslmin.core.ast.visit;

import io.github.eutro.glslmin.core.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Collects the nodes of a tree that match a filter, in pre-order.
 * <p>
 * The filter sees the node and its ancestors, root first, not including the node itself.
 */
public class NodeCollector extends AstVisitor {
    private final BiPredicate<Node, List<Node>> filter;
    private final List<Node> collected = new ArrayList<>();
    private final List<Node> nodeStack = new ArrayList<>();

    public NodeCollector(BiPredicate<Node, List<Node>> filter) {
        this.filter = filter;
    }

    @Override
    public void visitNode(Node node) {
        if (filter.test(node, Collections.unmodifiableList(nodeStack))) {
            collected.add(node);
        }
        nodeStack.add(node);
        try {
            super.visitNode(node);
        } finally {
            nodeStack.remove(nodeStack.size() - 1);
        }
    }

    public List<Node> getCollected() {
        return collected;
    }

    public static List<Node> collectNodes(Node root, BiPredicate<Node, List<Node>> filter) {
        NodeCollector collector = new NodeCollector(filter);
        collector.visitNode(root);
        return collector.getCollected();
    }

    public static List<Node> collectNodes(Node root, Predicate<Node> filter) {
        return collectNodes(root, (node, stack) -> filter.test(node));
    }
}
