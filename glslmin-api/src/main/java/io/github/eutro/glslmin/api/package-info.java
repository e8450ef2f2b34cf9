/**
 * A configurable front end over the core glslmin compiler.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.glslmin.api.GlslCompiler}, which loads shader programs
 * through the {@link io.github.eutro.glslmin.api.Preprocessor} and compiles them.
 * <p>
 * The compiler can be configured with {@link io.github.eutro.glslmin.api.CompilerOptions}
 * and the {@link io.github.eutro.glslmin.api.events events API}.
 */
package io.github.eutro.glslmin.api;
