package io.github.eutro.glslmin.core.compiler;

/**
 * A uniform of a compiled program.
 */
public class ShaderUniformEntry {
    public final String shortName;
    public final String originalName;
    public final String type;

    public ShaderUniformEntry(String shortName, String originalName, String type) {
        this.shortName = shortName;
        this.originalName = originalName;
        this.type = type;
    }

    @Override
    public String toString() {
        return type + " " + originalName + "->" + shortName;
    }
}
