package io.github.eutro.glslmin.core.ast.transform;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;

import java.util.List;
import java.util.Objects;

/**
 * Renames one function overload: its prototypes, its definition and calls to it.
 * <p>
 * Calls are matched by name and argument count only, since argument types are not known.
 */
public class FunctionRenameTransformer extends AstTransformer {
    private final Node targetPrototype;
    private final String newName;

    /**
     * @param targetPrototype A {@code function_prototype} or {@code function_declaration} describing the overload.
     * @param newName         The new name.
     */
    public FunctionRenameTransformer(Node targetPrototype, String newName) {
        this.targetPrototype = targetPrototype;
        this.newName = newName;
        onTransform(NodeType.FUNCTION_DECLARATION, this::renameFunction);
        onTransform(NodeType.FUNCTION_PROTOTYPE, this::renameFunction);
        onTransform(NodeType.FUNCTION_CALL, this::renameCall);
    }

    /**
     * Check whether two function headers declare the same overload.
     *
     * @param node      A function declaration or prototype.
     * @param prototype Another one.
     * @return Whether the names, return type names and parameter type names are equal.
     */
    public static boolean functionPrototypeEquals(Node node, Node prototype) {
        List<Node> parameters = node.getNodes(Fields.PARAMETERS);
        List<Node> otherParameters = prototype.getNodes(Fields.PARAMETERS);
        if (parameters.size() != otherParameters.size()) return false;
        for (int i = 0; i < parameters.size(); i++) {
            if (!Objects.equals(parameters.get(i).getString(Fields.TYPE_NAME),
                    otherParameters.get(i).getString(Fields.TYPE_NAME))) {
                return false;
            }
        }
        return Objects.equals(node.getString(Fields.NAME), prototype.getString(Fields.NAME))
                && Objects.equals(returnTypeName(node), returnTypeName(prototype));
    }

    private static String returnTypeName(Node function) {
        Node returnType = function.getNode(Fields.RETURN_TYPE);
        return returnType == null ? null : returnType.getString(Fields.NAME);
    }

    private TransformResult renameFunction(Node node, Node original) {
        if (!functionPrototypeEquals(node, targetPrototype)) return TransformResult.keep();
        return TransformResult.replace(node.cloneWith(ids).set(Fields.NAME, newName).build());
    }

    private TransformResult renameCall(Node node, Node original) {
        if (!Objects.equals(node.getString(Fields.FUNCTION_NAME), targetPrototype.getString(Fields.NAME))
                || node.getNodes(Fields.PARAMETERS).size() != targetPrototype.getNodes(Fields.PARAMETERS).size()) {
            return TransformResult.keep();
        }
        return TransformResult.replace(node.cloneWith(ids).set(Fields.FUNCTION_NAME, newName).build());
    }
}
