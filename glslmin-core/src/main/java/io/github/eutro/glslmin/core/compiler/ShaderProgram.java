package io.github.eutro.glslmin.core.compiler;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.visit.NodeCollector;
import io.github.eutro.glslmin.core.ast.visit.VariableScopeVisitor;
import io.github.eutro.glslmin.core.gen.Generator;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A vertex and fragment shader pair, with the metadata collected while loading and compiling it.
 */
public class ShaderProgram {
    public String className = "";
    public String superClass = "";
    public String namespace = "";
    public String template = "";
    public final List<String> jsRequires = new ArrayList<>();
    public final List<JsConst> jsConsts = new ArrayList<>();
    public boolean prettyPrint = false;
    public String originalVertexSource = "";
    public String originalFragmentSource = "";
    /**
     * Attributes by original name.
     */
    public final Map<String, ShaderAttributeEntry> attributeMap = new LinkedHashMap<>();
    /**
     * Uniforms by original name.
     */
    public final Map<String, ShaderUniformEntry> uniformMap = new LinkedHashMap<>();
    public final List<ShaderMode> shaderModes = new ArrayList<>();
    public final List<ShaderVariant> shaderVariants = new ArrayList<>();
    @NotNull
    public Node vertexAst;
    @NotNull
    public Node fragmentAst;

    public ShaderProgram(@NotNull Node vertexAst, @NotNull Node fragmentAst) {
        this.vertexAst = vertexAst;
        this.fragmentAst = fragmentAst;
    }

    public String getVertexSource() {
        return getVertexSource("\n");
    }

    public String getVertexSource(String newline) {
        return Generator.render(vertexAst, newline, prettyPrint);
    }

    public String getFragmentSource() {
        return getFragmentSource("\n");
    }

    public String getFragmentSource(String newline) {
        return Generator.render(fragmentAst, newline, prettyPrint);
    }

    public String getOriginalVertexSource(String newline) {
        return originalVertexSource.replace("\n", newline);
    }

    public String getOriginalFragmentSource(String newline) {
        return originalFragmentSource.replace("\n", newline);
    }

    public List<ShaderAttributeEntry> getAttributes() {
        return new ArrayList<>(attributeMap.values());
    }

    public List<ShaderUniformEntry> getUniforms() {
        return new ArrayList<>(uniformMap.values());
    }

    /**
     * Add entries for the attributes and uniforms of both shaders that no compiler step
     * recorded, under their current names.
     */
    public void defaultUniformsAndAttributes() {
        Map<String, ShaderAttributeEntry> attributesByShortName = new HashMap<>();
        for (ShaderAttributeEntry entry : attributeMap.values()) {
            attributesByShortName.put(entry.shortName, entry);
        }
        Map<String, ShaderUniformEntry> uniformsByShortName = new HashMap<>();
        for (ShaderUniformEntry entry : uniformMap.values()) {
            uniformsByShortName.put(entry.shortName, entry);
        }
        defaultProgramVariables(vertexAst, attributesByShortName, uniformsByShortName);
        defaultProgramVariables(fragmentAst, attributesByShortName, uniformsByShortName);
    }

    private void defaultProgramVariables(Node ast,
                                         Map<String, ShaderAttributeEntry> attributesByShortName,
                                         Map<String, ShaderUniformEntry> uniformsByShortName) {
        List<Node> publicDeclarators = NodeCollector.collectNodes(ast, node -> {
            if (!node.is(NodeType.DECLARATOR)) return false;
            String qualifier = node.getNode(Fields.TYPE_ATTRIBUTE).getString(Fields.QUALIFIER);
            return "attribute".equals(qualifier) || "uniform".equals(qualifier);
        });
        for (Node declarator : publicDeclarators) {
            Node type = declarator.getNode(Fields.TYPE_ATTRIBUTE);
            String typeName = type.getString(Fields.NAME);
            boolean isAttribute = "attribute".equals(type.getString(Fields.QUALIFIER));
            for (Node item : declarator.getNodes(Fields.DECLARATORS)) {
                String name = VariableScopeVisitor.itemName(item);
                if (isAttribute) {
                    if (!attributesByShortName.containsKey(name)) {
                        attributeMap.put(name, new ShaderAttributeEntry(name, name, ShaderAttributeEntry.sizeOf(typeName)));
                    }
                } else if (!uniformsByShortName.containsKey(name)) {
                    uniformMap.put(name, new ShaderUniformEntry(name, name, typeName));
                }
            }
        }
    }
}
