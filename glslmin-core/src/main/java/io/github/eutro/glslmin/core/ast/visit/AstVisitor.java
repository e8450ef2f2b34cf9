package io.github.eutro.glslmin.core.ast.visit;

import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A read-only, pre-order walk over an AST.
 * <p>
 * Subclasses register hooks per {@link NodeType} in their constructor. For each node,
 * {@link #visitNode(Node)} runs the before hook, then either the custom visit registered
 * for the type or {@link #visitChildren(Node) all children in field order}, then the
 * after hook. Types without hooks are simply walked through.
 * <p>
 * Visitors can also be mixed into an
 * {@link io.github.eutro.glslmin.core.ast.transform.AstTransformer}, which calls
 * {@link #enter(Node)} and {@link #exit(Node)} around each node it transforms.
 */
public class AstVisitor {
    private final Map<NodeType, Consumer<Node>> beforeHooks = new EnumMap<>(NodeType.class);
    private final Map<NodeType, Consumer<Node>> afterHooks = new EnumMap<>(NodeType.class);
    private final Map<NodeType, Consumer<Node>> visits = new EnumMap<>(NodeType.class);

    protected void onBeforeVisit(NodeType type, Consumer<Node> hook) {
        beforeHooks.merge(type, hook, Consumer::andThen);
    }

    protected void onAfterVisit(NodeType type, Consumer<Node> hook) {
        afterHooks.merge(type, hook, Consumer::andThen);
    }

    /**
     * Replace the default child traversal for a node type.
     * The visit is responsible for calling {@link #visitChildren(Node)} if it wants to recurse.
     *
     * @param type  The node type.
     * @param visit The visit function.
     */
    protected void onVisit(NodeType type, Consumer<Node> visit) {
        visits.put(type, visit);
    }

    public void visitNode(Node node) {
        enter(node);
        Consumer<Node> visit = visits.get(node.getType());
        if (visit != null) {
            visit.accept(node);
        } else {
            visitChildren(node);
        }
        exit(node);
    }

    public void visitChildren(Node node) {
        for (String field : node.getFieldNames()) {
            Object value = node.get(field);
            if (value instanceof Node) {
                visitNode((Node) value);
            } else if (value instanceof List) {
                for (Node child : node.getNodes(field)) {
                    visitNode(child);
                }
            }
        }
    }

    /**
     * Run the before hook for a node, without visiting it.
     *
     * @param node The node.
     */
    public void enter(Node node) {
        Consumer<Node> hook = beforeHooks.get(node.getType());
        if (hook != null) hook.accept(node);
    }

    /**
     * Run the after hook for a node, without visiting it.
     *
     * @param node The node.
     */
    public void exit(Node node) {
        Consumer<Node> hook = afterHooks.get(node.getType());
        if (hook != null) hook.accept(node);
    }
}
