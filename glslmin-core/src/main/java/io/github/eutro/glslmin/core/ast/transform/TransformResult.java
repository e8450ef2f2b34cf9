package io.github.eutro.glslmin.core.ast.transform;

import io.github.eutro.glslmin.core.ast.Node;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a transform function decided to do with a node.
 */
public final class TransformResult {
    public enum Kind {
        /**
         * Keep the node passed to the transform function.
         */
        KEEP,
        /**
         * Remove the node from its parent.
         */
        DELETE,
        /**
         * Replace the node with one other node.
         */
        REPLACE,
        /**
         * Replace the node with any number of nodes, spliced into the parent's list.
         */
        REPLACE_MANY,
    }

    private static final TransformResult KEEP = new TransformResult(Kind.KEEP, Collections.emptyList());
    private static final TransformResult DELETE = new TransformResult(Kind.DELETE, Collections.emptyList());

    private final Kind kind;
    private final List<Node> nodes;

    private TransformResult(Kind kind, List<Node> nodes) {
        this.kind = kind;
        this.nodes = nodes;
    }

    public static TransformResult keep() {
        return KEEP;
    }

    public static TransformResult delete() {
        return DELETE;
    }

    public static TransformResult replace(@NotNull Node node) {
        return new TransformResult(Kind.REPLACE, Collections.singletonList(node));
    }

    /**
     * Replace a node with a list of nodes. An empty list deletes the node.
     *
     * @param nodes The replacement nodes.
     * @return The result.
     */
    public static TransformResult replaceMany(@NotNull List<Node> nodes) {
        if (nodes.isEmpty()) return DELETE;
        return new TransformResult(Kind.REPLACE_MANY, Collections.unmodifiableList(new ArrayList<>(nodes)));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The nodes this result stands for, which is empty for {@link Kind#DELETE}.
     *
     * @return The nodes.
     * @throws IllegalStateException For {@link Kind#KEEP}, whose node is only known to the transformer.
     */
    public List<Node> getNodes() {
        if (kind == Kind.KEEP) throw new IllegalStateException("KEEP has no resolved node");
        return nodes;
    }

    /**
     * Whether this result is exactly the given node, unchanged.
     *
     * @param node The node.
     * @return Whether this result is that node.
     */
    public boolean isIdentity(Node node) {
        return kind == Kind.REPLACE && nodes.get(0) == node;
    }

    TransformResult resolve(Node working) {
        return kind == Kind.KEEP ? replace(working) : this;
    }

    @Override
    public String toString() {
        return kind + (nodes.isEmpty() ? "" : nodes.toString());
    }
}
