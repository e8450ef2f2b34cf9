package io.github.eutro.glslmin.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key that associates a value of type {@code T} with an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation. The order only serves to keep holder maps sorted and
 * should not be relied on across program executions.
 *
 * @param <T> The type of the ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger(0);

    private final Class<? super T> type;
    private final int id = NEXT_ID.getAndIncrement();
    private final String name;

    private Ext(Class<? super T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext for values of the given class.
     * <p>
     * The class is only recorded for {@link #toString() debugging}; generic value types
     * can be keyed by their raw class.
     *
     * @param type The (raw) class of values of the ext.
     * @param name A human readable name.
     * @param <T>  The raw class type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    /**
     * Get the name this ext was created with.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Look this ext up in a container.
     *
     * @param ec The container.
     * @return The value, if present.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
