package io.github.eutro.glslmin.core.ast.transform;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.SourcePosition;
import io.github.eutro.glslmin.core.ast.visit.VariableScopeVisitor;
import io.github.eutro.glslmin.core.ext.AstExts;
import io.github.eutro.glslmin.core.gen.Generator;
import io.github.eutro.glslmin.core.parse.GlslParser;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces attributes with constant values.
 * <p>
 * The declarations of replaced attributes are removed, and every use of them is replaced
 * with a float literal or a {@code vecN} constructor. Uses that refer to a parameter or
 * local variable shadowing the attribute are left alone.
 */
public class ReplaceAttributeTransformer extends AstTransformer {
    private final Map<String, List<Double>> replacements;
    private final VariableScopeVisitor scope = new VariableScopeVisitor();
    private Map<String, Node> variablesInScope = Collections.emptyMap();
    @Nullable
    private Node currentDeclarator = null;
    private boolean replaceIdentifiers = true;

    /**
     * @param replacements A map from attribute name to its components; one component for a {@code float}
     *                     attribute, N for a {@code vecN} attribute.
     */
    public ReplaceAttributeTransformer(Map<String, List<Double>> replacements) {
        this.replacements = new LinkedHashMap<>(replacements);
        mixinVisitor(scope);
        onBeforeTransform(NodeType.DECLARATOR, node -> {
            currentDeclarator = node;
            replaceIdentifiers = false;
        });
        onTransform(NodeType.DECLARATOR, (node, original) -> node.getNodes(Fields.DECLARATORS).isEmpty()
                ? TransformResult.delete()
                : TransformResult.keep());
        onAfterTransform(NodeType.DECLARATOR, (original, result) -> {
            currentDeclarator = null;
            replaceIdentifiers = true;
        });
        onTransform(NodeType.DECLARATOR_ITEM, this::transformDeclaratorItem);
        onAfterTransform(NodeType.DECLARATOR_ITEM, (original, result) ->
                variablesInScope = scope.getCurrentScopeVariables());
        onBeforeTransform(NodeType.SCOPE, node -> variablesInScope = scope.getCurrentScopeVariables());
        onTransform(NodeType.IDENTIFIER, this::transformIdentifier);
    }

    private static boolean isAttribute(@Nullable Node declaration) {
        if (declaration == null) return false;
        Node type = declaration.getNode(Fields.TYPE_ATTRIBUTE);
        return type != null && "attribute".equals(type.getString(Fields.QUALIFIER));
    }

    private TransformResult transformDeclaratorItem(Node node, Node original) {
        if (isAttribute(currentDeclarator) && replacements.containsKey(VariableScopeVisitor.itemName(node))) {
            return TransformResult.delete();
        }
        Node initializer = node.getNode(Fields.INITIALIZER);
        if (initializer != null) {
            // the initializer was walked with replacement off, so walk it again
            replaceIdentifiers = true;
            Node newInitializer = transformNode(initializer);
            replaceIdentifiers = false;
            if (newInitializer != initializer) {
                return TransformResult.replace(node.cloneWith(ids).set(Fields.INITIALIZER, newInitializer).build());
            }
        }
        return TransformResult.keep();
    }

    private TransformResult transformIdentifier(Node node, Node original) {
        String name = node.getString(Fields.NAME);
        List<Double> replacement = replacements.get(name);
        if (!replaceIdentifiers || replacement == null) return TransformResult.keep();
        Node declaration = variablesInScope.get(name);
        if (!isAttribute(declaration)) return TransformResult.keep();

        String typeName = replacement.size() == 1 ? "float" : "vec" + replacement.size();
        String declaredType = declaration.getNode(Fields.TYPE_ATTRIBUTE).getString(Fields.NAME);
        if (!typeName.equals(declaredType)) {
            SourcePosition position = node.getNullable(AstExts.SOURCE_POSITION);
            throw new IllegalArgumentException("Wrong type! Replacing " + declaredType + " with " + typeName
                    + " for variable " + name + (position == null ? "" : " at " + position));
        }
        List<Node> components = new ArrayList<>();
        for (Double component : replacement) {
            components.add(ids.newNode(NodeType.FLOAT).set(Fields.VALUE, component).build());
        }
        if (components.size() == 1) return TransformResult.replace(components.get(0));
        return TransformResult.replace(ids.newNode(NodeType.FUNCTION_CALL)
                .set(Fields.FUNCTION_NAME, typeName)
                .set(Fields.PARAMETERS, components)
                .build());
    }

    /**
     * Replace attributes in GLSL source.
     *
     * @param source       The source.
     * @param replacements The attribute values.
     * @return The new source.
     */
    public static String replaceAttributes(String source, Map<String, List<Double>> replacements) {
        Node root = GlslParser.parse(source);
        return Generator.render(new ReplaceAttributeTransformer(replacements).transformNode(root));
    }
}
