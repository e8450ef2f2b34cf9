/**
 * Rendering ASTs as GLSL source.
 */
package io.github.eutro.glslmin.core.gen;
