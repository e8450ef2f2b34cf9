package io.github.eutro.glslmin.test;

import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.transform.AstTransformer;
import io.github.eutro.glslmin.core.compiler.BraceReducer;
import io.github.eutro.glslmin.core.compiler.DeadFunctionRemover;
import io.github.eutro.glslmin.core.compiler.ShaderProgram;
import io.github.eutro.glslmin.core.compiler.TransformerStep;
import io.github.eutro.glslmin.core.gen.Generator;
import io.github.eutro.glslmin.core.parse.GlslParser;
import io.github.eutro.glslmin.core.parse.StartRule;
import io.github.eutro.glslmin.core.passes.AstPass;
import io.github.eutro.glslmin.core.passes.ChainedPass;
import org.junit.jupiter.api.Test;

import java.util.HashMap;

import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    @Test
    void testChain() {
        AstPass<String, Node> parse = GlslParser::parse;
        AstPass<String, String> minify = parse
                .then(AstTransformer.pass(DeadFunctionRemover::new))
                .then(AstTransformer.pass(BraceReducer::new))
                .then(Generator::render);
        assertEquals("void main(){if(x)return;}",
                minify.run("void unused(){}void main(){if(x){return;}}"));
    }

    @Test
    void testIdentity() {
        Node root = GlslParser.parse("void main(){}");
        assertSame(root, AstPass.<Node>identity().run(root));
        assertSame(root, AstPass.<Node>identity().then(AstPass.identity()).run(root));
    }

    @Test
    void testFailureIsAttributed() {
        AstPass<String, String> failing = AstPass.<String>identity()
                .then(s -> s + "!")
                .then(s -> {
                    throw new IllegalStateException(s);
                });
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> failing.run("boom"));
        assertEquals("boom!", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("running pass 3 of 3 in chain", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testFailureNamesThePass() {
        AstPass<Node, Node> chain = AstTransformer.pass(DeadFunctionRemover.NAME, DeadFunctionRemover::new)
                .then(AstPass.<Node, Node>named("explode", node -> {
                    throw new IllegalStateException("no");
                }))
                .then(AstTransformer.pass(BraceReducer.NAME, BraceReducer::new));
        assertEquals("DeadFunctionRemover -> explode -> BraceReducer", chain.getName());
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> chain.run(GlslParser.parse("void main(){}")));
        assertEquals("running pass 2 of 3 (explode) in chain", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testNestedChainsAreFlattened() {
        AstPass<String, String> inner = AstPass.<String>identity().then(s -> s + "b");
        AstPass<String, String> outer = AstPass.<String, String>named("a", s -> s + "a").then(inner);
        assertEquals(3, ((ChainedPass<?, ?, ?>) outer).getPasses().size());
        assertEquals("a -> #2 -> #3", outer.getName());
        assertEquals("xab", outer.run("x"));
    }

    @Test
    void testStepFailureNamesTheShader() {
        ShaderProgram program = new ShaderProgram(
                GlslParser.parse("void main(){}", StartRule.VERTEX),
                GlslParser.parse("float broken;void main(){}", StartRule.FRAGMENT));
        TransformerStep step = new TransformerStep("Picky", root -> {
            if (Generator.render(root).contains("broken")) throw new IllegalArgumentException("broken");
            return root;
        });
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> step.performStep(new HashMap<>(), program));
        assertEquals("running Picky on the fragment shader", e.getSuppressed()[0].getMessage());
    }
}
