/**
 * Copy-on-write AST transformation.
 * <p>
 * {@link io.github.eutro.glslmin.core.ast.transform.AstTransformer} is the engine; the other
 * classes here are general purpose transformations used by tools and compiler steps.
 */
package io.github.eutro.glslmin.core.ast.transform;
