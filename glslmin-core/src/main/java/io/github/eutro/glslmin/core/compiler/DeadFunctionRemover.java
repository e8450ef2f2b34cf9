package io.github.eutro.glslmin.core.compiler;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.transform.AstTransformer;
import io.github.eutro.glslmin.core.ast.transform.TransformResult;
import io.github.eutro.glslmin.core.ast.visit.CallGraphVisitor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes the functions, and their prototypes, that can't be reached from {@code main}
 * or from global initializers.
 */
public class DeadFunctionRemover extends AstTransformer {
    public static final String NAME = "DeadFunctionRemover";
    public static final CompilerStep STEP = new TransformerStep(NAME, pass(NAME, DeadFunctionRemover::new));

    private final Map<String, Boolean> functionAlive = new HashMap<>();

    public DeadFunctionRemover() {
        onBeforeTransform(NodeType.ROOT, this::findLiveFunctions);
        onTransform(NodeType.FUNCTION_DECLARATION, this::transformFunction);
        onTransform(NodeType.FUNCTION_PROTOTYPE, this::transformFunction);
    }

    private void findLiveFunctions(Node root) {
        Map<String, List<String>> callGraph = CallGraphVisitor.getCallGraph(root);
        functionAlive.clear();
        for (String function : callGraph.keySet()) {
            functionAlive.put(function, false);
        }
        markAlive("main", callGraph);
        markAlive(CallGraphVisitor.ROOT_NAME, callGraph);
    }

    private void markAlive(String function, Map<String, List<String>> callGraph) {
        if (Boolean.FALSE.equals(functionAlive.get(function))) {
            functionAlive.put(function, true);
            for (String callee : callGraph.get(function)) {
                markAlive(callee, callGraph);
            }
        }
    }

    private TransformResult transformFunction(Node node, Node original) {
        return Boolean.TRUE.equals(functionAlive.get(node.getString(Fields.NAME)))
                ? TransformResult.keep()
                : TransformResult.delete();
    }
}
