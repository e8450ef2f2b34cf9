package io.github.eutro.glslmin.core.ast.visit;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a map from each function name to the names it calls.
 * <p>
 * Calls made outside of any function body, such as global initializers, are attributed
 * to the pseudo function {@link #ROOT_NAME}. Overloads share an entry. Constructor calls
 * are recorded like any other call.
 */
public class CallGraphVisitor extends AstVisitor {
    public static final String ROOT_NAME = "#";

    private final Map<String, List<String>> callGraph = new LinkedHashMap<>();
    private String currentFunction = ROOT_NAME;

    public CallGraphVisitor() {
        callGraph.put(ROOT_NAME, new ArrayList<>());
        onBeforeVisit(NodeType.FUNCTION_DECLARATION, node -> {
            currentFunction = node.getString(Fields.NAME);
            callGraph.computeIfAbsent(currentFunction, $ -> new ArrayList<>());
        });
        onAfterVisit(NodeType.FUNCTION_DECLARATION, node -> currentFunction = ROOT_NAME);
        onBeforeVisit(NodeType.FUNCTION_CALL, node ->
                callGraph.get(currentFunction).add(node.getString(Fields.FUNCTION_NAME)));
    }

    public Map<String, List<String>> getCallGraph() {
        return callGraph;
    }

    public static Map<String, List<String>> getCallGraph(Node root) {
        CallGraphVisitor visitor = new CallGraphVisitor();
        visitor.visitNode(root);
        return visitor.getCallGraph();
    }
}
