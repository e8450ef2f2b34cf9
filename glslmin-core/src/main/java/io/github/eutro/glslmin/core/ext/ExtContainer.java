package io.github.eutro.glslmin.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * A container for {@link Ext}s. See the {@link io.github.eutro.glslmin.core.ext package-level documentation}.
 */
public interface ExtContainer {
    /**
     * Associate {@code ext} with {@code value} in this container.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value associated with {@code ext}, or null if there is none.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value associated with {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value associated with {@code ext}, or throw if there is none.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new RuntimeException("Ext not present: " + ext);
    }

    /**
     * Get the value associated with {@code ext}, computing and attaching it if absent.
     *
     * @param ext      The ext.
     * @param compute  Computes the value if absent.
     * @param <T>      The type of the ext.
     * @return The value.
     */
    default <T> T getExtOrCompute(Ext<T> ext, Supplier<T> compute) {
        T value = getNullable(ext);
        if (value == null) {
            value = compute.get();
            attachExt(ext, value);
        }
        return value;
    }
}
