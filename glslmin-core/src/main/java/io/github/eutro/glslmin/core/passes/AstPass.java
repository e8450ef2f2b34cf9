package io.github.eutro.glslmin.core.passes;

import org.jetbrains.annotations.Nullable;

/**
 * A pass over (part of) a shader, taking an {@code A} and producing a {@code B}.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
@FunctionalInterface
public interface AstPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The output.
     */
    B run(A a);

    /**
     * Get the name this pass is reported under when it fails in a chain.
     *
     * @return The name, or null if the pass is anonymous.
     */
    @Nullable
    default String getName() {
        return null;
    }

    /**
     * Compose this pass with another, feeding this pass's output to it.
     *
     * @param next The pass to run after this one.
     * @param <C>  The final output type.
     * @return The composed pass.
     */
    default <C> AstPass<A, C> then(AstPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }

    /**
     * The pass that returns its input.
     *
     * @param <A> The type of the input.
     * @return The identity pass.
     */
    static <A> AstPass<A, A> identity() {
        return a -> a;
    }

    /**
     * Give a pass a name, such as that of the transformer or step it runs.
     *
     * @param name The name.
     * @param pass The pass.
     * @param <A>  The input type.
     * @param <B>  The output type.
     * @return A pass running {@code pass}, with the given name.
     */
    static <A, B> AstPass<A, B> named(String name, AstPass<A, B> pass) {
        return new AstPass<A, B>() {
            @Override
            public B run(A a) {
                return pass.run(a);
            }

            @Override
            public String getName() {
                return name;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
