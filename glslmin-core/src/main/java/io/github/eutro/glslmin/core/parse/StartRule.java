package io.github.eutro.glslmin.core.parse;

/**
 * What a piece of source text is parsed as.
 */
public enum StartRule {
    /**
     * A whole translation unit, producing a {@code root} node.
     */
    PROGRAM,
    /**
     * A vertex shader, parsed like {@link #PROGRAM}.
     */
    VERTEX,
    /**
     * A fragment shader, parsed like {@link #PROGRAM}.
     */
    FRAGMENT,
    /**
     * A single statement as found in a function body.
     */
    STATEMENT,
    /**
     * An expression followed by a semicolon.
     */
    EXPRESSION_STATEMENT,
    /**
     * An expression without commas.
     */
    ASSIGNMENT_EXPRESSION,
    /**
     * A function header, optionally followed by a semicolon.
     */
    FUNCTION_PROTOTYPE,
}
