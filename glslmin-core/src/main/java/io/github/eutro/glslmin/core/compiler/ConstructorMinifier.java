package io.github.eutro.glslmin.core.compiler;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.transform.AstTransformer;
import io.github.eutro.glslmin.core.ast.transform.TransformResult;
import io.github.eutro.glslmin.core.gen.Generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shortens calls to constructors of built-in types.
 * <ul>
 *     <li>whole float and bool arguments become int literals, since the constructor converts them;</li>
 *     <li>a constructor whose arguments are all the same is called with just one,
 *     as is a matrix constructor for a multiple of the identity;</li>
 *     <li>a constructor passed directly to another with exactly as many arguments as
 *     it has components is flattened into the outer call.</li>
 * </ul>
 */
public class ConstructorMinifier extends AstTransformer {
    public static final String NAME = "ConstructorMinifier";
    public static final CompilerStep STEP = new TransformerStep(NAME, pass(NAME, ConstructorMinifier::new));

    private static final Map<String, Integer> CONVERSION_FUNCTIONS = new HashMap<>();
    // WebGL only requires 17 bits per integer
    private static final double MAX_INT_MAGNITUDE = 1 << 16;

    static {
        CONVERSION_FUNCTIONS.put("vec2", 2);
        CONVERSION_FUNCTIONS.put("vec3", 3);
        CONVERSION_FUNCTIONS.put("vec4", 4);
        CONVERSION_FUNCTIONS.put("bvec2", 2);
        CONVERSION_FUNCTIONS.put("bvec3", 3);
        CONVERSION_FUNCTIONS.put("bvec4", 4);
        CONVERSION_FUNCTIONS.put("ivec2", 2);
        CONVERSION_FUNCTIONS.put("ivec3", 3);
        CONVERSION_FUNCTIONS.put("ivec4", 4);
        CONVERSION_FUNCTIONS.put("mat2", 4);
        CONVERSION_FUNCTIONS.put("mat3", 9);
        CONVERSION_FUNCTIONS.put("mat4", 16);
        CONVERSION_FUNCTIONS.put("float", 1);
        CONVERSION_FUNCTIONS.put("int", 1);
        CONVERSION_FUNCTIONS.put("bool", 1);
    }

    private final List<Node> nodeStack = new ArrayList<>();

    public ConstructorMinifier() {
        onTransform(NodeType.FLOAT, this::maybeConvertToInt);
        onTransform(NodeType.BOOL, this::maybeConvertToInt);
        onTransform(NodeType.FUNCTION_CALL, this::transformFunctionCall);
    }

    @Override
    protected void beforeTransform(Node node) {
        nodeStack.add(node);
        super.beforeTransform(node);
    }

    @Override
    protected void afterTransform(Node original, TransformResult result) {
        super.afterTransform(original, result);
        nodeStack.remove(nodeStack.size() - 1);
    }

    private boolean parentIsConstructor() {
        if (nodeStack.size() < 2) return false;
        Node parent = nodeStack.get(nodeStack.size() - 2);
        return parent.is(NodeType.FUNCTION_CALL)
                && CONVERSION_FUNCTIONS.containsKey(parent.getString(Fields.FUNCTION_NAME));
    }

    private TransformResult maybeConvertToInt(Node node, Node original) {
        if (!parentIsConstructor()) return TransformResult.keep();
        Object value = node.get(Fields.VALUE);
        double number;
        if (value instanceof Boolean) {
            number = (Boolean) value ? 1 : 0;
        } else {
            number = ((Number) value).doubleValue();
        }
        if (Math.abs(number) >= MAX_INT_MAGNITUDE || number != Math.rint(number)) return TransformResult.keep();
        return TransformResult.replace(node.cloneWith(ids)
                .type(NodeType.INT)
                .set(Fields.VALUE, (long) number)
                .build());
    }

    private TransformResult transformFunctionCall(Node node, Node original) {
        String functionName = node.getString(Fields.FUNCTION_NAME);
        Integer expectedArguments = CONVERSION_FUNCTIONS.get(functionName);
        if (expectedArguments == null) return TransformResult.keep();
        List<Node> parameters = node.getNodes(Fields.PARAMETERS);
        // the outer constructor does the conversion
        if (parentIsConstructor() && parameters.size() == expectedArguments) {
            return TransformResult.replaceMany(parameters);
        }
        if (parameters.size() <= 1) return TransformResult.keep();

        String first = Generator.render(parameters.get(0));
        boolean minify;
        if (functionName.startsWith("mat")) {
            minify = parameters.size() == expectedArguments && isIdentityMultiple(functionName, parameters, first);
        } else {
            minify = true;
            for (Node parameter : parameters) {
                if (!Generator.render(parameter).equals(first)) {
                    minify = false;
                    break;
                }
            }
        }
        if (!minify) return TransformResult.keep();
        return TransformResult.replace(node.cloneWith(ids)
                .set(Fields.PARAMETERS, Collections.singletonList(parameters.get(0)))
                .build());
    }

    private static boolean isIdentityMultiple(String functionName, List<Node> parameters, String diagonal) {
        int dimensions = functionName.charAt(functionName.length() - 1) - '0';
        for (int i = 0; i < dimensions; i++) {
            for (int j = 0; j < dimensions; j++) {
                String cell = Generator.render(parameters.get(i * dimensions + j));
                if (!cell.equals(i == j ? diagonal : "0")) return false;
            }
        }
        return true;
    }
}
