package io.github.eutro.glslmin.core.compiler;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.transform.AstTransformer;
import io.github.eutro.glslmin.core.ast.transform.TransformResult;

import java.util.List;

/**
 * Unwraps the bodies of control statements that are braced single statements,
 * so {@code if(x){return;}} becomes {@code if(x)return;}.
 */
public class BraceReducer extends AstTransformer {
    public static final String NAME = "BraceReducer";
    public static final CompilerStep STEP = new TransformerStep(NAME, pass(NAME, BraceReducer::new));

    public BraceReducer() {
        onTransform(NodeType.IF_STATEMENT, (node, original) ->
                TransformResult.replace(unwrapBody(unwrapBody(node, Fields.BODY), Fields.ELSE_BODY)));
        onTransform(NodeType.WHILE_STATEMENT, this::transformLoop);
        onTransform(NodeType.DO_STATEMENT, this::transformLoop);
        onTransform(NodeType.FOR_STATEMENT, this::transformLoop);
    }

    private TransformResult transformLoop(Node node, Node original) {
        return TransformResult.replace(unwrapBody(node, Fields.BODY));
    }

    private Node unwrapBody(Node node, String field) {
        Node body = node.getNode(field);
        if (body == null || !body.is(NodeType.SCOPE)) return node;
        List<Node> statements = body.getNodes(Fields.STATEMENTS);
        if (statements.size() != 1) return node;
        return node.cloneWith(ids).set(field, statements.get(0)).build();
    }
}
