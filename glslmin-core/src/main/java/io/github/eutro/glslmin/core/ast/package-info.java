/**
 * The GLSL abstract syntax tree.
 * <p>
 * {@link io.github.eutro.glslmin.core.ast.Node}s are immutable records of a
 * {@link io.github.eutro.glslmin.core.ast.NodeType} and named fields. Code that
 * walks the tree enumerates fields generically, so new node types need no changes
 * to visitors or transformers.
 * <p>
 * Node ids come from an {@link io.github.eutro.glslmin.core.ast.IdAllocator}:
 * positive for parsed nodes and negative for nodes made by transformations.
 */
package io.github.eutro.glslmin.core.ast;
