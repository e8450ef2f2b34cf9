package io.github.eutro.glslmin.core.compiler;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.transform.AstTransformer;
import io.github.eutro.glslmin.core.ast.transform.TransformResult;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Gives every function but {@code main} a short name, in its declarations, prototypes and calls.
 * <p>
 * Overloads share a name. Names start after the ones {@link VariableMinifier} handed out,
 * so functions and variables never clash.
 */
public class FunctionMinifier extends AstTransformer {
    public static final String NAME = "Function Minifier";
    public static final CompilerStep STEP = new Step();

    private final NameGenerator nameGenerator = new NameGenerator();

    public FunctionMinifier() {
        this(0);
    }

    /**
     * @param firstNameIndex The index of the first name to hand out.
     */
    public FunctionMinifier(int firstNameIndex) {
        nameGenerator.setNextNameIndex(firstNameIndex);
        onBeforeTransform(NodeType.FUNCTION_DECLARATION, this::nameFunction);
        onBeforeTransform(NodeType.FUNCTION_PROTOTYPE, this::nameFunction);
        onTransform(NodeType.FUNCTION_DECLARATION, (node, original) -> rename(node, Fields.NAME));
        onTransform(NodeType.FUNCTION_PROTOTYPE, (node, original) -> rename(node, Fields.NAME));
        onTransform(NodeType.FUNCTION_CALL, (node, original) -> rename(node, Fields.FUNCTION_NAME));
    }

    private void nameFunction(Node node) {
        String name = node.getString(Fields.NAME);
        if (!"main".equals(name)) {
            nameGenerator.shortenSymbol(name);
        }
    }

    private TransformResult rename(Node node, String field) {
        String name = node.getString(field);
        String newName = nameGenerator.getShortSymbol(name);
        if (newName.equals(name)) return TransformResult.keep();
        return TransformResult.replace(node.cloneWith(ids).set(field, newName).build());
    }

    private static class Step implements CompilerStep {
        @Override
        public String getName() {
            return NAME;
        }

        @Override
        public List<String> getDependencies() {
            return Collections.singletonList(VariableMinifier.NAME);
        }

        @Override
        public Object performStep(Map<String, Object> stepOutputs, ShaderProgram program) {
            Object variableOutput = stepOutputs.get(VariableMinifier.NAME);
            VariableMinifier.Output maxIds = variableOutput instanceof VariableMinifier.Output
                    ? (VariableMinifier.Output) variableOutput
                    : new VariableMinifier.Output(0, 0);
            int vertexStart = maxIds.vertexMaxId;
            int fragmentStart = maxIds.fragmentMaxId;
            program.vertexAst = pass(() -> new FunctionMinifier(vertexStart)).run(program.vertexAst);
            program.fragmentAst = pass(() -> new FunctionMinifier(fragmentStart)).run(program.fragmentAst);
            return null;
        }
    }
}
