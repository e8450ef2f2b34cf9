package io.github.eutro.glslmin.test;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.visit.VariableScopeVisitor;
import io.github.eutro.glslmin.core.parse.GlslParser;
import io.github.eutro.glslmin.core.parse.StartRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class VariableScopeVisitorTest {
    @Test
    void testRootScope() {
        Node root = GlslParser.parse("attribute int foo;void main(){int x,y,z;{float foo;}}", StartRule.VERTEX);
        Map<String, Node> variables = VariableScopeVisitor.getVariablesInScope(root, root, false);
        assertEquals(1, variables.size());
        assertSame(Utils.statement(root, 0), variables.get("foo"));
    }

    @Test
    void testInnerScope() {
        Node root = GlslParser.parse("attribute int foo;void main(int a,int b){int x,y,z;{float foo;}}", StartRule.VERTEX);
        Node body = Utils.body(Utils.statement(root, 1));
        Node inner = Utils.statement(body, 1);
        Map<String, Node> variables = VariableScopeVisitor.getVariablesInScope(root, inner, false);
        assertEquals(6, variables.size());
        assertSame(Utils.statement(inner, 0), variables.get("foo"));
        assertSame(Utils.statement(body, 0), variables.get("x"));
        assertSame(Utils.statement(root, 1).getNodes(Fields.PARAMETERS).get(0), variables.get("a"));
    }

    @Test
    void testParametersShadowLocals() {
        Node root = GlslParser.parse("attribute int foo;void main(int a,int b){int x,y,b;}", StartRule.VERTEX);
        Node function = Utils.statement(root, 1);
        Map<String, Node> variables = VariableScopeVisitor.getVariablesInScope(root, Utils.body(function), false);
        assertEquals(5, variables.size());
        assertSame(function.getNodes(Fields.PARAMETERS).get(1), variables.get("b"));
    }

    @Test
    void testPreprocessorScopes() {
        Node root = GlslParser.parse("#ifdef FOO\nfloat x;\n#endif\nvoid main(){}");
        Node block = Utils.statement(root, 0);
        assertTrue(VariableScopeVisitor.getVariablesInScope(root, root, false).isEmpty());
        assertEquals(1, VariableScopeVisitor.getVariablesInScope(root, root, true).size());

        Map<Integer, List<Node>> frames = VariableScopeVisitor.getScopeToDeclarationMap(root);
        assertEquals(1, frames.get(block.getId()).size());
        assertTrue(frames.get(root.getId()).isEmpty());
    }
}
