package io.github.eutro.glslmin.core.ast.transform;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;

/**
 * Renames every identifier with a given name, regardless of scope.
 */
public class IdentifierRenameTransformer extends AstTransformer {
    private final String oldName;
    private final String newName;

    public IdentifierRenameTransformer(String oldName, String newName) {
        this.oldName = oldName;
        this.newName = newName;
        onTransform(NodeType.IDENTIFIER, (node, original) -> oldName.equals(node.getString(Fields.NAME))
                ? TransformResult.replace(node.cloneWith(ids).set(Fields.NAME, newName).build())
                : TransformResult.keep());
    }

    public static Node renameVariable(Node root, String oldName, String newName) {
        return new IdentifierRenameTransformer(oldName, newName).transformNode(root);
    }
}
