package io.github.eutro.glslmin.core.passes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * A pass which runs one pass and gives its result to another.
 * <p>
 * Nested chains are flattened up front. When a pass in the chain throws, the exception
 * gets a suppressed marker naming that pass and its position, such as
 * {@code running pass 2 of 3 (BraceReducer) in chain}.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements AstPass<A, C> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChainedPass.class);

    private final List<AstPass<Object, Object>> passes;

    @SuppressWarnings("unchecked")
    public ChainedPass(AstPass<A, B> firstPass, AstPass<B, C> nextPass) {
        List<AstPass<Object, Object>> passes = new ArrayList<>();
        for (AstPass<?, ?> pass : new AstPass<?, ?>[]{firstPass, nextPass}) {
            if (pass instanceof ChainedPass) {
                passes.addAll(((ChainedPass<?, ?, ?>) pass).passes);
            } else {
                passes.add((AstPass<Object, Object>) pass);
            }
        }
        this.passes = Collections.unmodifiableList(passes);
    }

    /**
     * Get the passes of this chain, in the order they run.
     *
     * @return The passes.
     */
    public List<AstPass<Object, Object>> getPasses() {
        return passes;
    }

    @Override
    public String getName() {
        StringJoiner joiner = new StringJoiner(" -> ");
        for (int i = 0; i < passes.size(); i++) {
            joiner.add(describe(i));
        }
        return joiner.toString();
    }

    private String describe(int index) {
        String name = passes.get(index).getName();
        return name == null ? "#" + (index + 1) : name;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            AstPass<Object, Object> pass = passes.get(i);
            LOGGER.trace("Running pass {} of {} ({})", i + 1, passes.size(), describe(i));
            try {
                acc = pass.run(acc);
            } catch (RuntimeException e) {
                String name = pass.getName();
                e.addSuppressed(new RuntimeException("running pass " + (i + 1) + " of " + passes.size()
                        + (name == null ? "" : " (" + name + ")") + " in chain"));
                throw e;
            }
        }
        return (C) acc;
    }

    @Override
    public String toString() {
        return getName();
    }
}
