package io.github.eutro.glslmin.api.events;

import io.github.eutro.glslmin.core.compiler.Compiler;
import org.jetbrains.annotations.NotNull;

/**
 * Fired after the configured steps are registered on a compiler and before it runs,
 * so listeners can register steps of their own.
 */
public class RegisterStepsEvent implements CompilerEvent {
    /**
     * The compiler.
     */
    @NotNull
    public final Compiler compiler;

    /**
     * Construct a new RegisterStepsEvent.
     *
     * @param compiler The compiler.
     */
    public RegisterStepsEvent(@NotNull Compiler compiler) {
        this.compiler = compiler;
    }
}
