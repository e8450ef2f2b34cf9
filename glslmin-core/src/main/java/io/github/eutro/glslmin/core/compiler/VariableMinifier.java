package io.github.eutro.glslmin.core.compiler;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.transform.AstTransformer;
import io.github.eutro.glslmin.core.ast.transform.TransformResult;
import io.github.eutro.glslmin.core.ast.visit.VariableScopeVisitor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gives variables and parameters the shortest names available in their scope.
 * <p>
 * Each scope renames with a copy of its parent's {@link NameGenerator}, so siblings
 * reuse the same short names. Varyings and uniforms are named first, on the generator
 * that survives the pass; running the fragment shader with the vertex shader's
 * {@link #getNameGenerator() final generator} keeps the names of the variables shared
 * between them in agreement.
 * <p>
 * Attributes and uniforms keep their names unless public variables are minified,
 * and struct members always do.
 */
public class VariableMinifier extends AstTransformer {
    public static final String NAME = "VariableMinifier";

    private final boolean minifyPublicVariables;
    @Nullable
    private final ShaderProgram program;
    private final Deque<NameGenerator> generatorStack = new ArrayDeque<>();
    private final Deque<Node> declaratorStack = new ArrayDeque<>();
    private NameGenerator nameGenerator;
    private Set<Integer> structDeclarators = Collections.emptySet();
    private int maxNameId = 0;

    public VariableMinifier(boolean minifyPublicVariables) {
        this(minifyPublicVariables, null, new NameGenerator());
    }

    /**
     * @param minifyPublicVariables Whether attributes and uniforms should be renamed.
     * @param program               The program to record attribute and uniform names in, or null.
     * @param nameGenerator         The generator to start from.
     */
    public VariableMinifier(boolean minifyPublicVariables,
                            @Nullable ShaderProgram program,
                            @NotNull NameGenerator nameGenerator) {
        this.minifyPublicVariables = minifyPublicVariables;
        this.program = program;
        this.nameGenerator = nameGenerator;

        onBeforeTransform(NodeType.ROOT, this::nameGlobals);
        onAfterTransform(NodeType.ROOT, (node, result) -> popStack());
        for (NodeType scope : new NodeType[]{
                NodeType.SCOPE,
                NodeType.FUNCTION_DECLARATION,
                NodeType.FUNCTION_PROTOTYPE,
        }) {
            onBeforeTransform(scope, node -> pushStack());
            onAfterTransform(scope, (node, result) -> popStack());
        }
        onBeforeTransform(NodeType.DECLARATOR, declaratorStack::push);
        onAfterTransform(NodeType.DECLARATOR, (node, result) -> declaratorStack.pop());
        onBeforeTransform(NodeType.DECLARATOR_ITEM, this::nameDeclaratorItem);
        onTransform(NodeType.PARAMETER, this::transformParameter);
        onTransform(NodeType.IDENTIFIER, this::transformIdentifier);
    }

    public static CompilerStep step(boolean minifyPublicVariables) {
        return new Step(minifyPublicVariables);
    }

    /**
     * Get the current name generator, which after a pass is the one holding the
     * names of the shared globals.
     *
     * @return The generator.
     */
    public NameGenerator getNameGenerator() {
        return nameGenerator;
    }

    /**
     * Get the highest name index used in any scope.
     *
     * @return The index.
     */
    public int getMaxNameId() {
        return maxNameId;
    }

    private static String qualifierOf(Node declarator) {
        return declarator.getNode(Fields.TYPE_ATTRIBUTE).getString(Fields.QUALIFIER);
    }

    private boolean shouldRename(@Nullable Node declarator) {
        if (declarator == null || !declarator.is(NodeType.DECLARATOR)) return false;
        String qualifier = qualifierOf(declarator);
        return (minifyPublicVariables || !("uniform".equals(qualifier) || "attribute".equals(qualifier)))
                && !structDeclarators.contains(declarator.getId());
    }

    private void nameGlobals(Node root) {
        structDeclarators = CompilerUtils.getStructDeclarations(root);
        List<String> localGlobals = new ArrayList<>();
        Map<String, Node> globals = VariableScopeVisitor.getVariablesInScope(root, root, true);
        // kept attribute and uniform names must not be handed out to anything else
        for (Map.Entry<String, Node> global : globals.entrySet()) {
            Node declarator = global.getValue();
            if (declarator != null && declarator.is(NodeType.DECLARATOR) && !shouldRename(declarator)) {
                String qualifier = qualifierOf(declarator);
                if ("uniform".equals(qualifier) || "attribute".equals(qualifier)) {
                    nameGenerator.reserve(global.getKey());
                }
            }
        }
        for (Map.Entry<String, Node> global : globals.entrySet()) {
            Node declarator = global.getValue();
            if (!shouldRename(declarator)) continue;
            String qualifier = qualifierOf(declarator);
            if ("varying".equals(qualifier) || "uniform".equals(qualifier)) {
                nameGenerator.shortenSymbol(global.getKey());
            } else {
                localGlobals.add(global.getKey());
            }
        }
        pushStack();
        for (String global : localGlobals) {
            nameGenerator.shortenSymbol(global);
        }
    }

    private void pushStack() {
        generatorStack.push(nameGenerator);
        nameGenerator = nameGenerator.clone();
    }

    private void popStack() {
        maxNameId = Math.max(maxNameId, nameGenerator.getNextNameIndex());
        nameGenerator = generatorStack.pop();
    }

    private void nameDeclaratorItem(Node item) {
        Node declarator = declaratorStack.peek();
        String originalName = VariableScopeVisitor.itemName(item);
        String newName = originalName;
        if (shouldRename(declarator)) {
            newName = nameGenerator.shortenSymbol(originalName);
        }
        if (program == null || declarator == null) return;
        Node type = declarator.getNode(Fields.TYPE_ATTRIBUTE);
        String qualifier = type.getString(Fields.QUALIFIER);
        String typeName = type.getString(Fields.NAME);
        if ("attribute".equals(qualifier)) {
            program.attributeMap.put(originalName,
                    new ShaderAttributeEntry(newName, originalName, ShaderAttributeEntry.sizeOf(typeName)));
        } else if ("uniform".equals(qualifier)) {
            program.uniformMap.put(originalName, new ShaderUniformEntry(newName, originalName, typeName));
        }
    }

    private TransformResult transformParameter(Node node, Node original) {
        String name = node.getString(Fields.NAME);
        if (name == null) return TransformResult.keep();
        return TransformResult.replace(node.cloneWith(ids)
                .set(Fields.NAME, nameGenerator.shortenSymbol(name))
                .build());
    }

    private TransformResult transformIdentifier(Node node, Node original) {
        String name = node.getString(Fields.NAME);
        String newName = nameGenerator.getShortSymbol(name);
        if (newName.equals(name)) return TransformResult.keep();
        return TransformResult.replace(node.cloneWith(ids).set(Fields.NAME, newName).build());
    }

    /**
     * The highest name indices used in each shader.
     */
    public static class Output {
        public final int vertexMaxId;
        public final int fragmentMaxId;

        public Output(int vertexMaxId, int fragmentMaxId) {
            this.vertexMaxId = vertexMaxId;
            this.fragmentMaxId = fragmentMaxId;
        }
    }

    private static class Step implements CompilerStep {
        private final boolean minifyPublicVariables;

        Step(boolean minifyPublicVariables) {
            this.minifyPublicVariables = minifyPublicVariables;
        }

        @Override
        public String getName() {
            return NAME;
        }

        @Override
        public List<String> getDependencies() {
            return Collections.emptyList();
        }

        @Override
        public Object performStep(Map<String, Object> stepOutputs, ShaderProgram program) {
            VariableMinifier vertex = new VariableMinifier(minifyPublicVariables, program, new NameGenerator());
            program.vertexAst = vertex.transformNode(program.vertexAst);
            VariableMinifier fragment = new VariableMinifier(minifyPublicVariables, program, vertex.getNameGenerator());
            program.fragmentAst = fragment.transformNode(program.fragmentAst);
            return new Output(vertex.getMaxNameId(), fragment.getMaxNameId());
        }
    }
}
