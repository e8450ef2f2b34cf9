package io.github.eutro.glslmin.core.ast;

import io.github.eutro.glslmin.core.ext.ExtHolder;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable GLSL AST node.
 * <p>
 * A node has an {@link #getId() id}, a {@link #getType() type} and an ordered set of named fields.
 * Field values are child nodes, unmodifiable lists of child nodes, or scalars:
 * {@link String}, {@link Boolean}, {@link Long} (int literals) and {@link Double} (float literals).
 * <p>
 * Nodes compare by identity. Transformations never mutate a node; they
 * {@link #cloneWith(IdAllocator) clone} it and build a new one, sharing every
 * untouched child.
 */
public final class Node extends ExtHolder {
    private final int id;
    private final NodeType type;
    private final Map<String, Object> fields;

    private Node(int id, NodeType type, Map<String, Object> fields) {
        this.id = id;
        this.type = type;
        this.fields = fields;
    }

    public static Builder builder(NodeType type, int id) {
        return new Builder(type, id, null);
    }

    public int getId() {
        return id;
    }

    public NodeType getType() {
        return type;
    }

    public boolean is(NodeType type) {
        return this.type == type;
    }

    /**
     * The names of the fields present on this node, in order.
     *
     * @return The field names.
     */
    public Set<String> getFieldNames() {
        return fields.keySet();
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    @Nullable
    public Object get(String field) {
        return fields.get(field);
    }

    @Nullable
    public Node getNode(String field) {
        Object value = fields.get(field);
        if (value == null) return null;
        if (!(value instanceof Node)) {
            throw new IllegalStateException("field " + field + " of " + type + " is not a node");
        }
        return (Node) value;
    }

    /**
     * Get a list field, or an empty list if absent.
     *
     * @param field The field name.
     * @return The nodes.
     */
    @SuppressWarnings("unchecked")
    @NotNull
    public List<Node> getNodes(String field) {
        Object value = fields.get(field);
        if (value == null) return Collections.emptyList();
        if (!(value instanceof List)) {
            throw new IllegalStateException("field " + field + " of " + type + " is not a list");
        }
        return (List<Node>) value;
    }

    @Nullable
    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    public boolean getBoolean(String field) {
        return Boolean.TRUE.equals(fields.get(field));
    }

    /**
     * Start building a shallow copy of this node with a fresh synthetic id.
     * Exts are carried over.
     *
     * @param ids The allocator for the new id.
     * @return The builder.
     */
    @Contract("_ -> new")
    public Builder cloneWith(IdAllocator ids) {
        Builder builder = new Builder(type, ids.nextSyntheticId(), this);
        builder.fields.putAll(fields);
        return builder;
    }

    @Override
    public String toString() {
        return type + "#" + id + fields;
    }

    /**
     * Builds {@link Node}s.
     */
    public static final class Builder {
        private NodeType type;
        private final int id;
        @Nullable
        private final Node source;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(NodeType type, int id, @Nullable Node source) {
            this.type = type;
            this.id = id;
            this.source = source;
        }

        public int getId() {
            return id;
        }

        public Builder type(NodeType type) {
            this.type = type;
            return this;
        }

        /**
         * Set a field. Setting {@code null} removes it; lists are copied.
         *
         * @param field The field name.
         * @param value The value.
         * @return This builder.
         */
        public Builder set(String field, @Nullable Object value) {
            if (value == null) {
                fields.remove(field);
            } else if (value instanceof List) {
                List<?> list = (List<?>) value;
                for (Object element : list) {
                    if (!(element instanceof Node)) {
                        throw new IllegalArgumentException("list field " + field + " holds a non-node: " + element);
                    }
                }
                fields.put(field, Collections.unmodifiableList(new ArrayList<>(list)));
            } else if (value instanceof Integer) {
                fields.put(field, ((Integer) value).longValue());
            } else {
                fields.put(field, value);
            }
            return this;
        }

        public Builder remove(String field) {
            fields.remove(field);
            return this;
        }

        @Nullable
        public Object get(String field) {
            return fields.get(field);
        }

        public Node build() {
            Node node = new Node(id, type, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
            if (source != null) node.copyExtsFrom(source);
            return node;
        }
    }
}
