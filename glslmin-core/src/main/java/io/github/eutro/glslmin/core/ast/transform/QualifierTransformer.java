package io.github.eutro.glslmin.core.ast.transform;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;

/**
 * Replaces one storage qualifier with another on every type, e.g. {@code varying} with {@code uniform}.
 */
public class QualifierTransformer extends AstTransformer {
    public QualifierTransformer(String oldQualifier, String newQualifier) {
        onTransform(NodeType.TYPE, (node, original) -> oldQualifier.equals(node.getString(Fields.QUALIFIER))
                ? TransformResult.replace(node.cloneWith(ids).set(Fields.QUALIFIER, newQualifier).build())
                : TransformResult.keep());
    }
}
