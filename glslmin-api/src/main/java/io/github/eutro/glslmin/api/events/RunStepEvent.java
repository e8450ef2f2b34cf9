package io.github.eutro.glslmin.api.events;

import io.github.eutro.glslmin.core.compiler.CompilerStep;
import io.github.eutro.glslmin.core.compiler.ShaderProgram;
import org.jetbrains.annotations.NotNull;

/**
 * Fired just before a compiler step runs. Cancelling it skips the step.
 */
public class RunStepEvent extends CancellableEvent {
    /**
     * The step about to run.
     */
    @NotNull
    public final CompilerStep step;
    /**
     * The program it runs over.
     */
    @NotNull
    public final ShaderProgram program;

    /**
     * Construct a new RunStepEvent.
     *
     * @param step    The step.
     * @param program The program.
     */
    public RunStepEvent(@NotNull CompilerStep step, @NotNull ShaderProgram program) {
        this.step = step;
        this.program = program;
    }
}
