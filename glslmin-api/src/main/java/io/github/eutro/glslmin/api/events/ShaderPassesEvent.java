package io.github.eutro.glslmin.api.events;

import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.passes.AstPass;
import org.jetbrains.annotations.NotNull;

/**
 * Fired once the compiler steps have run, with the passes to apply to each shader.
 * <p>
 * Listeners can chain their own passes on, with {@link AstPass#then(AstPass)}.
 */
public class ShaderPassesEvent implements CompilerEvent {
    /**
     * The passes, applied to the vertex shader and then to the fragment shader.
     */
    @NotNull
    public AstPass<Node, Node> passes;

    /**
     * Construct a new ShaderPassesEvent.
     *
     * @param passes The initial passes.
     */
    public ShaderPassesEvent(@NotNull AstPass<Node, Node> passes) {
        this.passes = passes;
    }
}
