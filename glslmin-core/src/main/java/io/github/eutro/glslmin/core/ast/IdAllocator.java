package io.github.eutro.glslmin.core.ast;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out node ids.
 * <p>
 * Parsed nodes get positive, increasing ids. Nodes created by transformations
 * get negative ids, strictly decreasing in the order they are allocated, so the
 * two can never collide within one allocator.
 */
public final class IdAllocator {
    /**
     * The allocator used by parsers and transformers that are not given one explicitly.
     */
    public static final IdAllocator GLOBAL = new IdAllocator();

    private final AtomicInteger nextParsed = new AtomicInteger(1);
    private final AtomicInteger nextSynthetic = new AtomicInteger(-1);

    public int nextParsedId() {
        return nextParsed.getAndIncrement();
    }

    public int nextSyntheticId() {
        return nextSynthetic.getAndDecrement();
    }

    /**
     * Start building a new synthetic node.
     *
     * @param type The node type.
     * @return The builder.
     */
    public Node.Builder newNode(NodeType type) {
        return Node.builder(type, nextSyntheticId());
    }
}
