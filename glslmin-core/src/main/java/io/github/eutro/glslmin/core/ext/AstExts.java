package io.github.eutro.glslmin.core.ext;

import io.github.eutro.glslmin.core.ast.SourcePosition;

/**
 * Exts attached to AST nodes.
 */
public class AstExts {
    /**
     * Where in the source text a parsed node started.
     */
    public static final Ext<SourcePosition> SOURCE_POSITION = Ext.create(SourcePosition.class, "SOURCE_POSITION");
}
