package io.github.eutro.glslmin.test;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.IdAllocator;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.transform.SpliceTransformer;
import io.github.eutro.glslmin.core.gen.Generator;
import io.github.eutro.glslmin.core.parse.GlslParser;
import io.github.eutro.glslmin.core.parse.StartRule;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class SpliceTransformerTest {
    @Test
    void testInsert() {
        Node root = GlslParser.parse("void heyItsAFunction(){}");
        Node body = Utils.body(Utils.statement(root, 0));
        Node newNode = GlslParser.parse("x++;", StartRule.EXPRESSION_STATEMENT);

        Node result = SpliceTransformer.splice(root, body, Fields.STATEMENTS, 0, 0, Collections.singletonList(newNode));
        Node newBody = Utils.body(Utils.statement(result, 0));
        assertEquals(1, newBody.getNodes(Fields.STATEMENTS).size());
        assertSame(newNode, Utils.statement(newBody, 0));
        assertEquals("void heyItsAFunction(){x++;}", Generator.render(result));
        assertTrue(body.getNodes(Fields.STATEMENTS).isEmpty());
    }

    @Test
    void testReplace() {
        Node root = GlslParser.parse("void heyItsAFunction(){y++;}");
        Node body = Utils.body(Utils.statement(root, 0));
        Node newNode = GlslParser.parse("x++;", StartRule.EXPRESSION_STATEMENT);

        SpliceTransformer transformer = new SpliceTransformer(
                IdAllocator.GLOBAL,
                body, Fields.STATEMENTS, 0, 1, Collections.singletonList(newNode));
        Node result = transformer.transformNode(root);
        assertEquals("void heyItsAFunction(){x++;}", Generator.render(result));
        assertEquals(1, transformer.getRemovedNodes().size());
        assertEquals("y++;", Generator.render(transformer.getRemovedNodes().get(0)));
    }

    @Test
    void testNotAList() {
        Node root = GlslParser.parse("void heyItsAFunction(){y++;}");
        String before = Generator.render(root);
        Node body = Utils.body(Utils.statement(root, 0));
        Node statement = Utils.statement(body, 0);
        int rootId = root.getId();
        assertThrows(IllegalArgumentException.class, () ->
                SpliceTransformer.splice(root, statement, Fields.OPERATOR, 0, 0, Collections.emptyList()));
        assertEquals(before, Generator.render(root));
        assertEquals(rootId, root.getId());
        assertSame(body, Utils.body(Utils.statement(root, 0)));
        assertSame(statement, Utils.statement(body, 0));
    }

    @Test
    void testEmptySpliceRendersIdentically() {
        Node root = GlslParser.parse("float x;void heyItsAFunction(){y++;x=2.;}");
        Node body = Utils.body(Utils.statement(root, 1));
        for (int i = 0; i <= body.getNodes(Fields.STATEMENTS).size(); i++) {
            Node result = SpliceTransformer.splice(root, body, Fields.STATEMENTS, i, 0, Collections.emptyList());
            assertEquals(Generator.render(root), Generator.render(result));
            assertSame(Utils.statement(root, 0), Utils.statement(result, 0));
        }
        Node result = SpliceTransformer.splice(root, root, Fields.STATEMENTS, 2, 0, Collections.emptyList());
        assertEquals("float x;void heyItsAFunction(){y++;x=2.;}", Generator.render(result));
    }

    @Test
    void testOutOfRange() {
        Node root = GlslParser.parse("void heyItsAFunction(){y++;}");
        Node body = Utils.body(Utils.statement(root, 0));
        assertThrows(IllegalArgumentException.class, () ->
                SpliceTransformer.splice(root, body, Fields.STATEMENTS, 1, 1, Collections.emptyList()));
    }

    @Test
    void testTargetNotInTree() {
        Node root = GlslParser.parse("void heyItsAFunction(){y++;}");
        Node other = GlslParser.parse("void other(){}");
        Node body = Utils.body(Utils.statement(other, 0));
        assertThrows(IllegalArgumentException.class, () ->
                SpliceTransformer.splice(root, body, Fields.STATEMENTS, 0, 0, Collections.emptyList()));
    }
}
