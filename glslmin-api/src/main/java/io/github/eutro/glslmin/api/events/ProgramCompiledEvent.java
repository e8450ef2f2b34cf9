package io.github.eutro.glslmin.api.events;

import io.github.eutro.glslmin.core.compiler.ShaderProgram;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a program is fully compiled.
 */
public class ProgramCompiledEvent implements CompilerEvent {
    /**
     * The compiled program.
     */
    @NotNull
    public final ShaderProgram program;

    /**
     * Construct a new ProgramCompiledEvent.
     *
     * @param program The program.
     */
    public ProgramCompiledEvent(@NotNull ShaderProgram program) {
        this.program = program;
    }
}
