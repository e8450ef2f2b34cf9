package io.github.eutro.glslmin.core.ast.transform;

import io.github.eutro.glslmin.core.ast.IdAllocator;
import io.github.eutro.glslmin.core.ast.Node;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Replaces a range of a list field of one node in a tree, rebuilding only the path
 * from that node to the root.
 * <p>
 * Inserted nodes are used as given, keeping their ids.
 */
public class SpliceTransformer extends AstTransformer {
    private final Node target;
    private final String field;
    private final int start;
    private final int deleteCount;
    private final List<Node> inserted;
    private List<Node> removedNodes = Collections.emptyList();
    private boolean spliced = false;

    /**
     * @param ids         The id allocator for cloned ancestors.
     * @param target      The node whose field to splice, located by identity.
     * @param field       The name of a list field of the target.
     * @param start       The index to start removing at.
     * @param deleteCount The number of nodes to remove.
     * @param inserted    The nodes to insert at {@code start}.
     * @throws IllegalArgumentException If the field is not a list or the range does not fit in it.
     */
    public SpliceTransformer(IdAllocator ids, Node target, String field, int start, int deleteCount, List<Node> inserted) {
        super(ids);
        Object value = target.get(field);
        if (!(value instanceof List)) {
            throw new IllegalArgumentException(field + " wasn't an array.");
        }
        int size = ((List<?>) value).size();
        if (start < 0 || deleteCount < 0 || start > size || start + deleteCount > size) {
            throw new IllegalArgumentException("cannot remove " + deleteCount + " nodes at " + start
                    + " from " + field + " of size " + size);
        }
        this.target = target;
        this.field = field;
        this.start = start;
        this.deleteCount = deleteCount;
        this.inserted = new ArrayList<>(inserted);
    }

    @Override
    @Nullable
    protected TransformFunction getTransformFunction(Node node) {
        return node == target ? this::spliceTarget : null;
    }

    private TransformResult spliceTarget(Node node, Node original) {
        List<Node> children = new ArrayList<>(node.getNodes(field));
        List<Node> range = children.subList(start, start + deleteCount);
        removedNodes = Collections.unmodifiableList(new ArrayList<>(range));
        range.clear();
        children.addAll(start, inserted);
        spliced = true;
        return TransformResult.replace(node.cloneWith(ids).set(field, children).build());
    }

    /**
     * Get the nodes removed by the last splice.
     *
     * @return The removed nodes.
     */
    public List<Node> getRemovedNodes() {
        return removedNodes;
    }

    public boolean hasSpliced() {
        return spliced;
    }

    public static Node splice(Node root, Node target, String field, int start, int deleteCount, List<Node> inserted) {
        return splice(IdAllocator.GLOBAL, root, target, field, start, deleteCount, inserted);
    }

    /**
     * Splice a list field of a node in a tree.
     *
     * @param ids         The id allocator for cloned nodes.
     * @param root        The root of the tree.
     * @param target      The node to splice, which must be in the tree.
     * @param field       The list field of the target.
     * @param start       The index to start removing at.
     * @param deleteCount The number of nodes to remove.
     * @param inserted    The nodes to insert.
     * @return The new root.
     * @throws IllegalArgumentException If the splice is invalid, before anything is cloned.
     */
    public static Node splice(IdAllocator ids, Node root, Node target, String field,
                              int start, int deleteCount, List<Node> inserted) {
        SpliceTransformer transformer = new SpliceTransformer(ids, target, field, start, deleteCount, inserted);
        Node result = transformer.transformNode(root);
        if (!transformer.hasSpliced()) {
            throw new IllegalArgumentException("target " + target.getType() + "#" + target.getId() + " is not in the tree");
        }
        return result;
    }
}
