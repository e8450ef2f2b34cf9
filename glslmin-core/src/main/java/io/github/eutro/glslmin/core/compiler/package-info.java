/**
 * The shader program model and the compiler that optimizes and minifies it.
 * <p>
 * A {@link io.github.eutro.glslmin.core.compiler.Compiler} runs
 * {@link io.github.eutro.glslmin.core.compiler.CompilerStep}s over a
 * {@link io.github.eutro.glslmin.core.compiler.ShaderProgram}, phase by phase.
 * Steps may depend on other steps by name, and read their outputs.
 * <p>
 * The built-in steps are:
 * <ul>
 *     <li>{@link io.github.eutro.glslmin.core.compiler.DeadFunctionRemover}</li>
 *     <li>{@link io.github.eutro.glslmin.core.compiler.BraceReducer}</li>
 *     <li>{@link io.github.eutro.glslmin.core.compiler.VariableMinifier}</li>
 *     <li>{@link io.github.eutro.glslmin.core.compiler.DeclarationConsolidation}</li>
 *     <li>{@link io.github.eutro.glslmin.core.compiler.FunctionMinifier}, which depends on the variable minifier</li>
 *     <li>{@link io.github.eutro.glslmin.core.compiler.ConstructorMinifier}</li>
 * </ul>
 * Most of them are plain transformers wrapped in a
 * {@link io.github.eutro.glslmin.core.compiler.TransformerStep}.
 */
package io.github.eutro.glslmin.core.compiler;
