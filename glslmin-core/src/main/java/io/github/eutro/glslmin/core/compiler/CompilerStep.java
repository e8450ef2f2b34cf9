package io.github.eutro.glslmin.core.compiler;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * A unit of work in a {@link Compiler}.
 */
public interface CompilerStep {
    /**
     * Get the name of this step, unique within a compiler.
     *
     * @return The name.
     */
    String getName();

    /**
     * Get the names of the steps that must run before this one, if they are registered.
     *
     * @return The names of the dependencies.
     */
    List<String> getDependencies();

    /**
     * Run the step over a program, replacing its ASTs as needed.
     *
     * @param stepOutputs The outputs of the steps that have already run, by name.
     * @param program     The program.
     * @return The output of this step, made available to later steps.
     */
    @Nullable
    Object performStep(Map<String, Object> stepOutputs, ShaderProgram program);
}
