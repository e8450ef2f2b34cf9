package io.github.eutro.glslmin.core.compiler;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.transform.AstTransformer;
import io.github.eutro.glslmin.core.ast.transform.TransformResult;
import io.github.eutro.glslmin.core.ast.visit.NodeCollector;
import io.github.eutro.glslmin.core.ast.visit.VariableScopeVisitor;
import io.github.eutro.glslmin.core.gen.Generator;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the declarations of each type within a scope into one declaration.
 * <p>
 * The merged declaration takes the place of the first declaration of its type, and
 * initializers become assignments where the variables used to be declared:
 * <pre>{@code int a;foo();int b=1;}</pre> becomes <pre>{@code int a,b;foo();b=1;}</pre>
 * <p>
 * Constants, for loop initializers and struct members are left alone, as are global
 * declarations with initializers, and attributes unless asked for.
 */
public class DeclarationConsolidation extends AstTransformer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeclarationConsolidation.class);
    public static final String NAME = "DeclarationConsolidation";

    private final boolean consolidateAttributes;
    private final Map<Integer, Map<String, List<Node>>> scopeIdToDeclarators = new HashMap<>();
    private final Deque<Map<String, List<Node>>> typeMapStack = new ArrayDeque<>();
    private final Deque<Node> declaratorStack = new ArrayDeque<>();
    private final Set<Integer> forInitializers = new HashSet<>();
    private Set<Integer> structDeclarators = new HashSet<>();

    /**
     * @param consolidateAttributes Whether attribute declarations should be merged too.
     */
    public DeclarationConsolidation(boolean consolidateAttributes) {
        this.consolidateAttributes = consolidateAttributes;
        onBeforeTransform(NodeType.ROOT, this::collectDeclarations);
        onBeforeTransform(NodeType.SCOPE, this::pushScope);
        onBeforeTransform(NodeType.PREPROCESSOR, this::pushScope);
        onAfterTransform(NodeType.ROOT, (node, result) -> typeMapStack.pop());
        onAfterTransform(NodeType.SCOPE, (node, result) -> typeMapStack.pop());
        onAfterTransform(NodeType.PREPROCESSOR, (node, result) -> typeMapStack.pop());
        onBeforeTransform(NodeType.DECLARATOR, declaratorStack::push);
        onAfterTransform(NodeType.DECLARATOR, (node, result) -> declaratorStack.pop());
        onTransform(NodeType.DECLARATOR_ITEM, this::transformDeclaratorItem);
        onTransform(NodeType.DECLARATOR, this::transformDeclarator);
    }

    public static CompilerStep step(boolean consolidateAttributes) {
        return new TransformerStep(NAME, pass(NAME, () -> new DeclarationConsolidation(consolidateAttributes)));
    }

    private void collectDeclarations(Node root) {
        for (Node forStatement : NodeCollector.collectNodes(root, node -> node.is(NodeType.FOR_STATEMENT))) {
            Node initializer = forStatement.getNode(Fields.INITIALIZER);
            if (initializer != null) forInitializers.add(initializer.getId());
        }
        structDeclarators = CompilerUtils.getStructDeclarations(root);

        Map<Integer, List<Node>> scopeDeclarations = VariableScopeVisitor.getScopeToDeclarationMap(root);
        for (Map.Entry<Integer, List<Node>> entry : scopeDeclarations.entrySet()) {
            boolean isGlobal = entry.getKey() == root.getId();
            Map<String, List<Node>> typeToItems = new LinkedHashMap<>();
            for (Node declaration : entry.getValue()) {
                if (!declaration.is(NodeType.DECLARATOR) || !shouldConsolidate(declaration, isGlobal)) continue;
                List<Node> items = typeToItems.computeIfAbsent(typeString(declaration), k -> new ArrayList<>());
                for (Node item : declaration.getNodes(Fields.DECLARATORS)) {
                    items.add(item.has(Fields.INITIALIZER)
                            ? item.cloneWith(ids).remove(Fields.INITIALIZER).build()
                            : item);
                }
            }
            for (Map.Entry<String, List<Node>> type : typeToItems.entrySet()) {
                if (type.getValue().size() > 1) {
                    LOGGER.debug("Merging {} {} variables into one declaration in {} scope #{}",
                            type.getValue().size(), type.getKey(), isGlobal ? "the global" : "local", entry.getKey());
                }
            }
            scopeIdToDeclarators.put(entry.getKey(), typeToItems);
        }
        pushScope(root);
    }

    private void pushScope(Node node) {
        Map<String, List<Node>> typeMap = scopeIdToDeclarators.get(node.getId());
        typeMapStack.push(typeMap == null ? new HashMap<>() : typeMap);
    }

    private static String typeString(Node declarator) {
        return Generator.render(declarator.getNode(Fields.TYPE_ATTRIBUTE));
    }

    private boolean shouldConsolidate(@Nullable Node declarator, boolean isGlobal) {
        if (declarator == null) return false;
        Node type = declarator.getNode(Fields.TYPE_ATTRIBUTE);
        String qualifier = type == null ? null : type.getString(Fields.QUALIFIER);
        if (!consolidateAttributes && "attribute".equals(qualifier)) return false;
        if ("const".equals(qualifier)) return false;
        Map<String, List<Node>> typeMap = typeMapStack.peek();
        if (typeMap != null) {
            List<Node> items = typeMap.get(typeString(declarator));
            // a lone declaration stays where it is
            if (items != null && items.size() <= 1) return false;
        }
        if (forInitializers.contains(declarator.getId())) return false;
        if (structDeclarators.contains(declarator.getId())) return false;
        if (isGlobal) {
            for (Node item : declarator.getNodes(Fields.DECLARATORS)) {
                if (item.has(Fields.INITIALIZER)) return false;
            }
        }
        return true;
    }

    private boolean isGlobalScope() {
        return typeMapStack.size() == 1;
    }

    private TransformResult transformDeclaratorItem(Node node, Node original) {
        if (!shouldConsolidate(declaratorStack.peek(), isGlobalScope())) return TransformResult.keep();
        Node initializer = node.getNode(Fields.INITIALIZER);
        if (initializer == null) return TransformResult.delete();
        Node assignment = ids.newNode(NodeType.BINARY)
                .set(Fields.OPERATOR, ids.newNode(NodeType.OPERATOR).set(Fields.OPERATOR, "=").build())
                .set(Fields.LEFT, node.getNode(Fields.NAME))
                .set(Fields.RIGHT, initializer)
                .build();
        return TransformResult.replace(ids.newNode(NodeType.EXPRESSION)
                .set(Fields.EXPRESSION, assignment)
                .build());
    }

    private TransformResult transformDeclarator(Node node, Node original) {
        if (!shouldConsolidate(original, isGlobalScope())) return TransformResult.keep();
        List<Node> result = new ArrayList<>();
        Map<String, List<Node>> typeMap = typeMapStack.peek();
        List<Node> scopeItems = typeMap == null ? null : typeMap.remove(typeString(original));
        if (scopeItems != null) {
            result.add(node.cloneWith(ids).set(Fields.DECLARATORS, scopeItems).build());
        }
        // the remaining items are the assignments that replaced initializers
        result.addAll(node.getNodes(Fields.DECLARATORS));
        return TransformResult.replaceMany(result);
    }
}
