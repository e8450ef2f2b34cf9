/**
 * Events that occur while compiling a shader program.
 * <p>
 * These can be used to inspect or edit the program, to add or skip compiler steps,
 * and to run extra passes over the shaders.
 * <p>
 * Listeners are added to a {@link io.github.eutro.glslmin.api.events.CompilerEventSource},
 * usually the {@link io.github.eutro.glslmin.api.GlslCompiler} itself, by event class.
 */
package io.github.eutro.glslmin.api.events;
