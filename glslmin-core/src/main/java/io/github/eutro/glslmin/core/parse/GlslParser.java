package io.github.eutro.glslmin.core.parse;

import io.github.eutro.glslmin.core.ast.IdAllocator;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ext.AstExts;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;

/**
 * Parses GLSL ES 1.00 with the {@code GlslEs} grammar.
 * <p>
 * Preprocessor directives are kept in the tree: conditional blocks become {@code preprocessor}
 * nodes guarding the statements between them, and other directives become leaf
 * {@code preprocessor} nodes. Every node is given a positive id and a
 * {@link AstExts#SOURCE_POSITION source position}.
 */
public final class GlslParser {
    private GlslParser() {
    }

    public static Node parse(String source) {
        return parse(source, StartRule.PROGRAM);
    }

    public static Node parse(String source, StartRule rule) {
        return parse(source, rule, IdAllocator.GLOBAL);
    }

    /**
     * Parse source text.
     *
     * @param source The source.
     * @param rule   What the source should contain.
     * @param ids    The allocator for node ids.
     * @return The parsed node.
     * @throws ParseException If the source does not match the rule.
     */
    public static Node parse(String source, StartRule rule, IdAllocator ids) {
        GlslEsLexer lexer = new GlslEsLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ParseErrorListener.INSTANCE);
        GlslEsParser parser = new GlslEsParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ParseErrorListener.INSTANCE);

        ParseTree tree;
        switch (rule) {
            case PROGRAM:
            case VERTEX:
            case FRAGMENT:
                tree = parser.translationUnit();
                break;
            case STATEMENT:
                tree = parser.statementEntry().statement();
                break;
            case EXPRESSION_STATEMENT:
                tree = parser.expressionStatementEntry().expressionStatement();
                break;
            case ASSIGNMENT_EXPRESSION:
                tree = parser.assignmentExpressionEntry().assignmentExpression();
                break;
            case FUNCTION_PROTOTYPE:
                tree = parser.functionPrototypeEntry();
                break;
            default:
                throw new IllegalArgumentException("unknown start rule " + rule);
        }
        return new AstBuilder(ids).visit(tree);
    }
}
