package io.github.eutro.glslmin.core.compiler;

/**
 * The phases of a compilation, in the order they run.
 */
public enum CompilerPhase {
    OPTIMIZATION,
    MINIFICATION,
}
