package io.github.eutro.glslmin.test;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.transform.AstTransformer;
import io.github.eutro.glslmin.core.gen.Generator;
import io.github.eutro.glslmin.core.parse.GlslParser;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class Utils {
    /**
     * Parse a program, transform it and check the rendered result.
     *
     * @param transformer The transformer.
     * @param source      The source to parse.
     * @param expected    The expected rendering.
     * @return The transformed tree.
     */
    public static Node assertTransforms(AstTransformer transformer, String source, String expected) {
        Node root = GlslParser.parse(source);
        Node result = Objects.requireNonNull(transformer.transformNode(root));
        assertEquals(expected, Generator.render(result));
        return result;
    }

    @NotNull
    public static Node statement(Node root, int... path) {
        Node node = root;
        for (int index : path) {
            node = node.getNodes(Fields.STATEMENTS).get(index);
        }
        return node;
    }

    @NotNull
    public static Node body(Node function) {
        return Objects.requireNonNull(function.getNode(Fields.BODY));
    }
}
