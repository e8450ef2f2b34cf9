/**
 * Composable passes over ASTs and shader programs.
 */
package io.github.eutro.glslmin.core.passes;
