package io.github.eutro.glslmin.api.events;

import io.github.eutro.glslmin.core.compiler.ShaderProgram;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a shader program has been loaded and parsed, before any step runs.
 * <p>
 * Listeners may edit the program or its ASTs.
 */
public class ProgramLoadedEvent implements CompilerEvent {
    /**
     * The program.
     */
    @NotNull
    public ShaderProgram program;

    /**
     * Construct a new ProgramLoadedEvent.
     *
     * @param program The program.
     */
    public ProgramLoadedEvent(@NotNull ShaderProgram program) {
        this.program = program;
    }
}
