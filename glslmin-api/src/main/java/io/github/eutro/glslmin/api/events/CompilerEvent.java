package io.github.eutro.glslmin.api.events;

/**
 * The supertype of events fired by a {@link io.github.eutro.glslmin.api.GlslCompiler}.
 */
public interface CompilerEvent {
}
