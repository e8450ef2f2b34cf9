package io.github.eutro.glslmin.core.ast.visit;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks which variables are declared in which scope.
 * <p>
 * Scopes are the root, every {@code scope} node and, unless preprocessor variables are
 * promoted, every {@code preprocessor} node. Each scope has a frame of the declarators
 * and parameters declared directly in it. The parameters of a function declaration belong
 * to the first scope inside it, its body. Struct member declarators are registered in the
 * frame of the enclosing scope.
 * <p>
 * Can be mixed into a transformer to know, at any point, which declaration each name refers to.
 */
public class VariableScopeVisitor extends AstVisitor {
    @Nullable
    private final Node targetScope;
    private final List<List<Node>> stackFrames = new ArrayList<>();
    private List<Node> currentFrame = new ArrayList<>();
    private final Map<Integer, List<Node>> scopeIdToFrame = new LinkedHashMap<>();
    private List<Node> scopeParameters = new ArrayList<>();
    private Map<String, Node> variablesInScope = new LinkedHashMap<>();

    /**
     * @param targetScope             A scope whose visible variables should be recorded, or null.
     * @param promotePreprocessorVars Whether declarations inside preprocessor blocks belong to the enclosing scope.
     */
    public VariableScopeVisitor(@Nullable Node targetScope, boolean promotePreprocessorVars) {
        this.targetScope = targetScope;
        onBeforeVisit(NodeType.ROOT, this::enterScope);
        onBeforeVisit(NodeType.SCOPE, this::enterScope);
        onAfterVisit(NodeType.ROOT, this::exitScope);
        onAfterVisit(NodeType.SCOPE, this::exitScope);
        if (!promotePreprocessorVars) {
            onBeforeVisit(NodeType.PREPROCESSOR, this::enterScope);
            onAfterVisit(NodeType.PREPROCESSOR, this::exitScope);
        }
        onBeforeVisit(NodeType.DECLARATOR, node -> currentFrame.add(node));
        onBeforeVisit(NodeType.FUNCTION_DECLARATION, node ->
                scopeParameters = new ArrayList<>(node.getNodes(Fields.PARAMETERS)));
        onAfterVisit(NodeType.FUNCTION_DECLARATION, node -> scopeParameters = new ArrayList<>());
    }

    public VariableScopeVisitor() {
        this(null, false);
    }

    private void enterScope(Node node) {
        stackFrames.add(currentFrame);
        currentFrame = scopeParameters;
        scopeParameters = new ArrayList<>();
    }

    private void exitScope(Node node) {
        scopeIdToFrame.put(node.getId(), currentFrame);
        if (node == targetScope) {
            variablesInScope = getCurrentScopeVariables();
        }
        currentFrame = stackFrames.remove(stackFrames.size() - 1);
    }

    /**
     * Get the variables visible at the current point of the walk.
     * <p>
     * Inner declarations shadow outer ones. Parameters take precedence over any declarator of the same name.
     *
     * @return A map from name to the declarator or parameter node declaring it.
     */
    public Map<String, Node> getCurrentScopeVariables() {
        Map<String, Node> variables = new LinkedHashMap<>();
        addFrame(variables, currentFrame);
        for (int i = stackFrames.size() - 1; i >= 0; i--) {
            addFrame(variables, stackFrames.get(i));
        }
        return variables;
    }

    private static void addFrame(Map<String, Node> variables, List<Node> frame) {
        for (Node declaration : frame) {
            if (declaration.is(NodeType.DECLARATOR)) {
                for (Node item : declaration.getNodes(Fields.DECLARATORS)) {
                    variables.putIfAbsent(itemName(item), declaration);
                }
            } else if (declaration.is(NodeType.PARAMETER) && declaration.has(Fields.NAME)) {
                variables.put(declaration.getString(Fields.NAME), declaration);
            }
        }
    }

    /**
     * Get the name declared by a declarator item.
     *
     * @param item The declarator item.
     * @return The name.
     */
    public static String itemName(Node item) {
        Node name = item.getNode(Fields.NAME);
        if (name == null) throw new IllegalStateException("declarator item without a name: " + item);
        return name.getString(Fields.NAME);
    }

    public Map<Integer, List<Node>> getScopeIdToFrame() {
        return scopeIdToFrame;
    }

    public Map<String, Node> getVariablesInScope() {
        return variablesInScope;
    }

    /**
     * Map every scope of a tree to the declarations made directly in it.
     *
     * @param root The root.
     * @return A map from scope node id to its frame of declarator and parameter nodes, in order.
     */
    public static Map<Integer, List<Node>> getScopeToDeclarationMap(Node root) {
        VariableScopeVisitor visitor = new VariableScopeVisitor();
        visitor.visitNode(root);
        return visitor.getScopeIdToFrame();
    }

    /**
     * Find the variables visible at the end of the given scope.
     *
     * @param root                    The root of the tree.
     * @param targetScope             The scope, which must be in the tree.
     * @param promotePreprocessorVars Whether declarations inside preprocessor blocks belong to the enclosing scope.
     * @return A map from name to declaring node.
     */
    public static Map<String, Node> getVariablesInScope(Node root, Node targetScope, boolean promotePreprocessorVars) {
        VariableScopeVisitor visitor = new VariableScopeVisitor(targetScope, promotePreprocessorVars);
        visitor.visitNode(root);
        return visitor.getVariablesInScope();
    }
}
