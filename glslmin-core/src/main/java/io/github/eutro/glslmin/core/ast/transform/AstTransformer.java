package io.github.eutro.glslmin.core.ast.transform;

import io.github.eutro.glslmin.core.ast.IdAllocator;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.visit.AstVisitor;
import io.github.eutro.glslmin.core.passes.AstPass;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A post-order, copy-on-write rewriter of ASTs.
 * <p>
 * For each node, {@link #transform(Node)}:
 * <ol>
 *     <li>runs the {@link #mixinVisitor(AstVisitor) mixed-in visitors}' {@link AstVisitor#enter(Node) enter}
 *     hooks, then the before hook registered for the node's type, with the original node;</li>
 *     <li>transforms every child, in field order, splicing multi-node results into lists
 *     and dropping deleted children;</li>
 *     <li>if any child changed, makes a shallow clone of the node with a fresh synthetic id
 *     holding the new children, otherwise keeps the original node;</li>
 *     <li>calls the transform function for the node's type with that working node and the original;</li>
 *     <li>runs the mixed-in visitors' {@link AstVisitor#exit(Node) exit} hooks, then the
 *     after hook registered for the type, with the original node and the result.</li>
 * </ol>
 * A subtree in which nothing changes comes back as the very same node, so transformed
 * trees share every untouched subtree with their input.
 * <p>
 * Transformers are stateful; use a fresh instance for each tree, e.g. through {@link #pass(Supplier)}.
 */
public class AstTransformer {
    /**
     * Computes the replacement of a node whose children have already been transformed.
     */
    @FunctionalInterface
    public interface TransformFunction {
        /**
         * @param node     The working node, with transformed children.
         * @param original The node as it was before transformation.
         * @return The result.
         */
        TransformResult apply(Node node, Node original);
    }

    protected final IdAllocator ids;
    private final List<AstVisitor> mixins = new ArrayList<>();
    private final Map<NodeType, TransformFunction> transforms = new EnumMap<>(NodeType.class);
    private final Map<NodeType, Consumer<Node>> beforeHooks = new EnumMap<>(NodeType.class);
    private final Map<NodeType, BiConsumer<Node, TransformResult>> afterHooks = new EnumMap<>(NodeType.class);

    public AstTransformer() {
        this(IdAllocator.GLOBAL);
    }

    public AstTransformer(IdAllocator ids) {
        this.ids = ids;
    }

    public IdAllocator getIds() {
        return ids;
    }

    /**
     * Mix a visitor in, so it sees every node this transformer does.
     *
     * @param visitor The visitor.
     */
    public void mixinVisitor(AstVisitor visitor) {
        mixins.add(visitor);
    }

    protected void onBeforeTransform(NodeType type, Consumer<Node> hook) {
        beforeHooks.merge(type, hook, Consumer::andThen);
    }

    protected void onTransform(NodeType type, TransformFunction function) {
        transforms.put(type, function);
    }

    protected void onAfterTransform(NodeType type, BiConsumer<Node, TransformResult> hook) {
        afterHooks.merge(type, hook, BiConsumer::andThen);
    }

    /**
     * Get the transform function to apply to a node.
     *
     * @param node The original node.
     * @return The function, or null to keep the node as is.
     */
    @Nullable
    protected TransformFunction getTransformFunction(Node node) {
        return transforms.get(node.getType());
    }

    protected void beforeTransform(Node node) {
        for (AstVisitor mixin : mixins) {
            mixin.enter(node);
        }
        Consumer<Node> hook = beforeHooks.get(node.getType());
        if (hook != null) hook.accept(node);
    }

    protected void afterTransform(Node original, TransformResult result) {
        for (AstVisitor mixin : mixins) {
            mixin.exit(original);
        }
        BiConsumer<Node, TransformResult> hook = afterHooks.get(original.getType());
        if (hook != null) hook.accept(original, result);
    }

    /**
     * Transform a node and everything below it.
     *
     * @param node The node.
     * @return The result, never {@link TransformResult.Kind#KEEP}.
     */
    @NotNull
    public TransformResult transform(Node node) {
        beforeTransform(node);
        Node.Builder clone = null;
        for (String field : node.getFieldNames()) {
            Object value = node.get(field);
            if (value instanceof List) {
                List<Node> children = node.getNodes(field);
                List<Node> newChildren = new ArrayList<>(children.size());
                boolean changed = false;
                for (Node child : children) {
                    TransformResult result = transform(child);
                    if (!result.isIdentity(child)) changed = true;
                    newChildren.addAll(result.getNodes());
                }
                if (changed) {
                    if (clone == null) clone = node.cloneWith(ids);
                    clone.set(field, newChildren);
                }
            } else if (value instanceof Node) {
                Node child = (Node) value;
                TransformResult result = transform(child);
                if (!result.isIdentity(child)) {
                    List<Node> newNodes = result.getNodes();
                    if (newNodes.size() > 1) {
                        throw new IllegalStateException("cannot put " + newNodes.size()
                                + " nodes in single-node field " + field + " of " + node.getType());
                    }
                    if (clone == null) clone = node.cloneWith(ids);
                    clone.set(field, newNodes.isEmpty() ? null : newNodes.get(0));
                }
            }
        }
        Node working = clone == null ? node : clone.build();
        TransformFunction function = getTransformFunction(node);
        TransformResult result = function == null
                ? TransformResult.replace(working)
                : function.apply(working, node).resolve(working);
        afterTransform(node, result);
        return result;
    }

    /**
     * Transform a node that must end up as at most one node.
     *
     * @param node The node.
     * @return The new node, or null if it was deleted.
     * @throws IllegalStateException If the node was replaced with several nodes.
     */
    @Nullable
    public Node transformNode(Node node) {
        List<Node> nodes = transform(node).getNodes();
        if (nodes.size() > 1) {
            throw new IllegalStateException(node.getType() + " was replaced with " + nodes.size() + " nodes");
        }
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    /**
     * Create a pass that runs a fresh transformer from the factory over a root node.
     *
     * @param factory Creates the transformer.
     * @return The pass.
     */
    public static AstPass<Node, Node> pass(Supplier<? extends AstTransformer> factory) {
        return root -> {
            Node result = factory.get().transformNode(root);
            if (result == null) throw new IllegalStateException("the root node was deleted");
            return result;
        };
    }

    /**
     * Create a {@link #pass(Supplier) pass} that is reported under a name when it fails in a chain.
     *
     * @param name    The name.
     * @param factory Creates the transformer.
     * @return The pass.
     */
    public static AstPass<Node, Node> pass(String name, Supplier<? extends AstTransformer> factory) {
        return AstPass.named(name, pass(factory));
    }
}
