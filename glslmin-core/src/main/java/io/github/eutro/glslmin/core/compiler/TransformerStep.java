package io.github.eutro.glslmin.core.compiler;

import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.passes.AstPass;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A compiler step that runs the same pass over the vertex and fragment shaders.
 */
public class TransformerStep implements CompilerStep {
    private final String name;
    private final List<String> dependencies;
    private final AstPass<Node, Node> pass;

    public TransformerStep(String name, AstPass<Node, Node> pass) {
        this(name, Collections.emptyList(), pass);
    }

    public TransformerStep(String name, List<String> dependencies, AstPass<Node, Node> pass) {
        this.name = name;
        this.dependencies = Collections.unmodifiableList(dependencies);
        this.pass = pass;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> getDependencies() {
        return dependencies;
    }

    @Override
    @Nullable
    public Object performStep(Map<String, Object> stepOutputs, ShaderProgram program) {
        runOnShaders(name, pass, program);
        return null;
    }

    /**
     * Run a pass over the vertex shader and then the fragment shader of a program.
     * <p>
     * If the pass throws, the exception gets a suppressed marker naming the pass and the shader,
     * such as {@code running BraceReducer on the fragment shader}.
     *
     * @param name    The name to report the pass under.
     * @param pass    The pass.
     * @param program The program, which is modified in place.
     */
    public static void runOnShaders(String name, AstPass<Node, Node> pass, ShaderProgram program) {
        program.vertexAst = runOn(name, "vertex", pass, program.vertexAst);
        program.fragmentAst = runOn(name, "fragment", pass, program.fragmentAst);
    }

    private static Node runOn(String name, String shader, AstPass<Node, Node> pass, Node ast) {
        try {
            return pass.run(ast);
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("running " + name + " on the " + shader + " shader"));
            throw e;
        }
    }
}
