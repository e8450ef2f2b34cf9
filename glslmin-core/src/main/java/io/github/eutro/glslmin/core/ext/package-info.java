/**
 * The ext API associates arbitrary typed data with instances of
 * {@link io.github.eutro.glslmin.core.ext.ExtContainer}, most notably AST
 * {@link io.github.eutro.glslmin.core.ast.Node}s.
 *
 * <pre>{@code
 * class ShaderExts {
 *   public static final Ext<String> ORIGIN = Ext.create(String.class, "origin");
 * }
 *
 * node.attachExt(ShaderExts.ORIGIN, "lighting.glsl");
 * node.getExtOrThrow(ShaderExts.ORIGIN); // => "lighting.glsl"
 * }</pre>
 * <p>
 * Exts let passes keep scratch data or annotations on nodes without widening the
 * node model or threading ad-hoc {@link java.util.Map}s keyed by node id around.
 * Exts survive {@link io.github.eutro.glslmin.core.ast.Node#cloneWith cloning}, so
 * an annotation made by the parser is still there after any number of transformations.
 * <p>
 * Well-known exts are collected in {@link io.github.eutro.glslmin.core.ext.AstExts}.
 */
package io.github.eutro.glslmin.core.ext;
