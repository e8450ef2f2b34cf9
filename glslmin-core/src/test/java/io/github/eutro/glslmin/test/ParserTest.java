package io.github.eutro.glslmin.test;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.SourcePosition;
import io.github.eutro.glslmin.core.ext.AstExts;
import io.github.eutro.glslmin.core.parse.GlslParser;
import io.github.eutro.glslmin.core.parse.ParseException;
import io.github.eutro.glslmin.core.parse.StartRule;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {
    @Test
    void testLiterals() {
        Node call = GlslParser.parse("vec3(1, 2.5, true)", StartRule.ASSIGNMENT_EXPRESSION);
        assertEquals(NodeType.FUNCTION_CALL, call.getType());
        assertEquals("vec3", call.getString(Fields.FUNCTION_NAME));
        assertEquals(1L, call.getNodes(Fields.PARAMETERS).get(0).get(Fields.VALUE));
        assertEquals(2.5, call.getNodes(Fields.PARAMETERS).get(1).get(Fields.VALUE));
        assertEquals(Boolean.TRUE, call.getNodes(Fields.PARAMETERS).get(2).get(Fields.VALUE));
        assertEquals(255L, GlslParser.parse("0xff", StartRule.ASSIGNMENT_EXPRESSION).get(Fields.VALUE));
    }

    @Test
    void testFunctions() {
        Node root = GlslParser.parse("float f(int a);float f(int a){return 1.;}");
        Node prototype = Utils.statement(root, 0);
        Node declaration = Utils.statement(root, 1);
        assertEquals(NodeType.FUNCTION_PROTOTYPE, prototype.getType());
        assertEquals(NodeType.FUNCTION_DECLARATION, declaration.getType());
        assertEquals("float", declaration.getNode(Fields.RETURN_TYPE).getString(Fields.NAME));
        assertEquals("a", declaration.getNodes(Fields.PARAMETERS).get(0).getString(Fields.NAME));
        assertEquals("int", declaration.getNodes(Fields.PARAMETERS).get(0).getString(Fields.TYPE_NAME));
    }

    @Test
    void testIds() {
        Node root = GlslParser.parse("float x;float y;");
        assertTrue(root.getId() > 0);
        assertNotEquals(Utils.statement(root, 0).getId(), Utils.statement(root, 1).getId());
    }

    @Test
    void testPositions() {
        Node root = GlslParser.parse("void main(){}\n  float x;");
        assertEquals(new SourcePosition(1, 1), Utils.statement(root, 0).getNullable(AstExts.SOURCE_POSITION));
        assertEquals(new SourcePosition(2, 3), Utils.statement(root, 1).getNullable(AstExts.SOURCE_POSITION));
    }

    @Test
    void testErrors() {
        ParseException e = assertThrows(ParseException.class,
                () -> GlslParser.parse("void main() {\n  int x = ;\n}"));
        assertEquals(2, e.getLine());
        assertEquals(11, e.getColumn());
        assertTrue(e.getMessage().startsWith("2:11: "));

        assertThrows(ParseException.class, () -> GlslParser.parse("x = 1;"));
        assertThrows(ParseException.class, () -> GlslParser.parse("void main(){"));
        assertThrows(ParseException.class, () -> GlslParser.parse("#ifdef FOO\nfloat x;\n"));
        assertThrows(ParseException.class, () -> GlslParser.parse("/* never closed"));
        assertThrows(ParseException.class, () -> GlslParser.parse("1 + 2", StartRule.EXPRESSION_STATEMENT));
    }

    @Test
    void testErrorMessages() {
        ParseException missing = assertThrows(ParseException.class,
                () -> GlslParser.parse("1 + 2", StartRule.EXPRESSION_STATEMENT));
        assertEquals("Expected \";\" but end of input found.", missing.getRawMessage());
        assertEquals("1:6: Expected \";\" but end of input found.", missing.getMessage());

        ParseException stray = assertThrows(ParseException.class, () -> GlslParser.parse("x = 1;"));
        assertEquals(1, stray.getLine());
        assertEquals(3, stray.getColumn());
        assertTrue(stray.getRawMessage().endsWith("but \"=\" found."), stray.getRawMessage());

        ParseException literal = assertThrows(ParseException.class,
                () -> GlslParser.parse("99999999999999999999", StartRule.ASSIGNMENT_EXPRESSION));
        assertEquals("Invalid integer literal \"99999999999999999999\"", literal.getRawMessage());

        ParseException macro = assertThrows(ParseException.class, () -> GlslParser.parse("#define\n"));
        assertEquals("Expected macro name", macro.getRawMessage());
    }

    @Test
    void testPreprocessor() {
        Node root = GlslParser.parse("#define MIX(a, b) ((a) + (b))\n" +
                "#ifdef FOO\n" +
                "float x;\n" +
                "#else\n" +
                "float y;\n" +
                "#endif\n" +
                "void main() {\n" +
                "#if 1\n" +
                "  discard;\n" +
                "#endif\n" +
                "}\n");
        Node define = Utils.statement(root, 0);
        assertEquals("#define", define.getString(Fields.DIRECTIVE));
        assertEquals("MIX", define.getString(Fields.IDENTIFIER));
        assertEquals(2, define.getNodes(Fields.PARAMETERS).size());
        assertEquals("b", define.getNodes(Fields.PARAMETERS).get(1).getString(Fields.NAME));
        assertEquals("((a) + (b))", define.getString(Fields.TOKEN_STRING));

        Node ifdef = Utils.statement(root, 1);
        assertEquals("#ifdef", ifdef.getString(Fields.DIRECTIVE));
        assertEquals("FOO", ifdef.getString(Fields.VALUE));
        assertEquals(1, ifdef.getNodes(Fields.GUARDED_STATEMENTS).size());
        Node elseBlock = ifdef.getNode(Fields.ELSE_BODY);
        assertEquals("#else", elseBlock.getString(Fields.DIRECTIVE));
        assertEquals(new SourcePosition(4, 1), elseBlock.getNullable(AstExts.SOURCE_POSITION));
        assertEquals(1, elseBlock.getNodes(Fields.GUARDED_STATEMENTS).size());

        Node body = Utils.statement(root, 2).getNode(Fields.BODY);
        Node guard = body.getNodes(Fields.STATEMENTS).get(0);
        assertEquals("#if", guard.getString(Fields.DIRECTIVE));
        assertNull(guard.getNode(Fields.ELSE_BODY));
        assertEquals(NodeType.DISCARD, guard.getNodes(Fields.GUARDED_STATEMENTS).get(0).getType());
    }

    @Test
    void testExpressionShapes() {
        Node assign = GlslParser.parse("a = b = c - d - e", StartRule.ASSIGNMENT_EXPRESSION);
        assertEquals("=", assign.getNode(Fields.OPERATOR).getString(Fields.OPERATOR));
        Node inner = assign.getNode(Fields.RIGHT);
        assertEquals("=", inner.getNode(Fields.OPERATOR).getString(Fields.OPERATOR));
        Node difference = inner.getNode(Fields.RIGHT);
        assertEquals("-", difference.getNode(Fields.OPERATOR).getString(Fields.OPERATOR));
        assertEquals(NodeType.BINARY, difference.getNode(Fields.LEFT).getType());
        assertEquals("e", difference.getNode(Fields.RIGHT).getString(Fields.NAME));

        Node postfix = GlslParser.parse("v.xy[1]++", StartRule.ASSIGNMENT_EXPRESSION);
        assertEquals(NodeType.POSTFIX, postfix.getType());
        assertEquals("++", postfix.getNode(Fields.OPERATOR).getString(Fields.OPERATOR));
        Node accessor = postfix.getNode(Fields.EXPRESSION);
        assertEquals(NodeType.ACCESSOR, accessor.getNode(Fields.OPERATOR).getType());
        Node selector = accessor.getNode(Fields.EXPRESSION);
        assertEquals("xy", selector.getNode(Fields.OPERATOR).getString(Fields.SELECTION));

        Node prototype = GlslParser.parse("highp vec4 shade(void)", StartRule.FUNCTION_PROTOTYPE);
        assertEquals(NodeType.FUNCTION_PROTOTYPE, prototype.getType());
        assertEquals("highp", prototype.getNode(Fields.RETURN_TYPE).getString(Fields.PRECISION));
        assertTrue(prototype.getNodes(Fields.PARAMETERS).isEmpty());
    }
}
