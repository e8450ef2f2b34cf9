/**
 * Read-only walks over ASTs, and the analyses built on them.
 */
package io.github.eutro.glslmin.core.ast.visit;
