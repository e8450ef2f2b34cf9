/**
 * Parsing GLSL source into ASTs.
 * <p>
 * The entry point is {@link io.github.eutro.glslmin.core.parse.GlslParser#parse(String)}.
 */
package io.github.eutro.glslmin.core.parse;
