package io.github.eutro.glslmin.core.compiler;

/**
 * A vertex attribute of a compiled program.
 */
public class ShaderAttributeEntry {
    public final String shortName;
    public final String originalName;
    /**
     * The number of components, 1 for scalars.
     */
    public final int variableSize;

    public ShaderAttributeEntry(String shortName, String originalName, int variableSize) {
        this.shortName = shortName;
        this.originalName = originalName;
        this.variableSize = variableSize;
    }

    /**
     * Get the number of components of an attribute type, such as 3 for {@code vec3}.
     *
     * @param typeName The type name.
     * @return The number of components.
     */
    public static int sizeOf(String typeName) {
        if (typeName.length() >= 4 && Character.isDigit(typeName.charAt(3))) {
            return typeName.charAt(3) - '0';
        }
        return 1;
    }

    @Override
    public String toString() {
        return originalName + "->" + shortName + "[" + variableSize + "]";
    }
}
