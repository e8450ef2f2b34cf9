package io.github.eutro.glslmin.core.parse;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.IdAllocator;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.SourcePosition;
import io.github.eutro.glslmin.core.ext.AstExts;
import io.github.eutro.glslmin.core.parse.GlslEsParser.*;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds AST nodes from a {@link GlslEsParser} parse tree.
 * <p>
 * Each node gets a fresh parsed id from the allocator and the position of the token it starts at.
 */
final class AstBuilder extends GlslEsBaseVisitor<Node> {
    private final IdAllocator ids;

    AstBuilder(IdAllocator ids) {
        this.ids = ids;
    }

    private Node.Builder node(NodeType type) {
        return Node.builder(type, ids.nextParsedId());
    }

    private static Node done(Node.Builder builder, Token at) {
        Node node = builder.build();
        node.attachExt(AstExts.SOURCE_POSITION, new SourcePosition(at.getLine(), at.getCharPositionInLine() + 1));
        return node;
    }

    private static Node done(Node.Builder builder, ParserRuleContext ctx) {
        return done(builder, ctx.getStart());
    }

    private List<Node> visitAll(List<? extends ParseTree> trees) {
        List<Node> nodes = new ArrayList<>(trees.size());
        for (ParseTree tree : trees) {
            nodes.add(visit(tree));
        }
        return nodes;
    }

    @Nullable
    private static String text(@Nullable ParserRuleContext ctx) {
        return ctx == null ? null : ctx.getText();
    }

    private Node identifier(Token name) {
        return done(node(NodeType.IDENTIFIER).set(Fields.NAME, name.getText()), name);
    }

    private Node operator(Token op) {
        return done(node(NodeType.OPERATOR).set(Fields.OPERATOR, op.getText()), op);
    }

    // top level

    @Override
    public Node visitTranslationUnit(TranslationUnitContext ctx) {
        Node.Builder root = node(NodeType.ROOT);
        return done(root.set(Fields.STATEMENTS, visitAll(ctx.externalDeclaration())), ctx);
    }

    @Override
    public Node visitExternalDeclaration(ExternalDeclarationContext ctx) {
        if (ctx.SEMI() != null) return done(node(NodeType.EXPRESSION), ctx);
        if (ctx.DIRECTIVE() != null) return directive(ctx.DIRECTIVE().getSymbol());
        return visit(ctx.getChild(0));
    }

    @Override
    public Node visitExternalConditional(ExternalConditionalContext ctx) {
        return conditional(ctx.PP_IF().getSymbol(), ctx.externalDeclaration(), ctx.externalBranch());
    }

    @Override
    public Node visitExternalBranch(ExternalBranchContext ctx) {
        if (ctx.PP_ELIF() != null) {
            return conditional(ctx.PP_ELIF().getSymbol(), ctx.externalDeclaration(), ctx.externalBranch());
        }
        if (ctx.PP_ELSE() != null) return elseBlock(ctx.PP_ELSE().getSymbol(), ctx.externalDeclaration());
        return null;
    }

    @Override
    public Node visitFunctionDefinition(FunctionDefinitionContext ctx) {
        Node returnType = type(ctx.fullType());
        boolean hasBody = ctx.compoundStatement() != null;
        Node.Builder function = node(hasBody ? NodeType.FUNCTION_DECLARATION : NodeType.FUNCTION_PROTOTYPE)
                .set(Fields.NAME, ctx.IDENTIFIER().getText())
                .set(Fields.RETURN_TYPE, returnType)
                .set(Fields.PARAMETERS, parameters(ctx.parameterList()));
        if (hasBody) function.set(Fields.BODY, visit(ctx.compoundStatement()));
        return done(function, ctx);
    }

    @Override
    public Node visitFunctionPrototypeEntry(FunctionPrototypeEntryContext ctx) {
        Node returnType = done(node(NodeType.TYPE)
                .set(Fields.NAME, ctx.typeName().getText())
                .set(Fields.PRECISION, text(ctx.precisionQualifier())), ctx);
        return done(node(NodeType.FUNCTION_PROTOTYPE)
                .set(Fields.NAME, ctx.IDENTIFIER().getText())
                .set(Fields.RETURN_TYPE, returnType)
                .set(Fields.PARAMETERS, parameters(ctx.parameterList())), ctx);
    }

    // f(void) takes no parameters
    private List<Node> parameters(@Nullable ParameterListContext ctx) {
        if (ctx == null || ctx.VOID() != null) return new ArrayList<>();
        return visitAll(ctx.parameter());
    }

    @Override
    public Node visitParameter(ParameterContext ctx) {
        Node.Builder parameter = node(NodeType.PARAMETER);
        if (ctx.CONST() != null) parameter.set(Fields.TYPE_QUALIFIER, ctx.CONST().getText());
        parameter.set(Fields.PARAMETER_QUALIFIER, text(ctx.parameterQualifier()));
        parameter.set(Fields.PRECISION, text(ctx.precisionQualifier()));
        parameter.set(Fields.TYPE_NAME, ctx.typeName().getText());
        if (ctx.IDENTIFIER() != null) {
            parameter.set(Fields.NAME, ctx.IDENTIFIER().getText());
            if (ctx.conditionalExpression() != null) {
                parameter.set(Fields.ARRAY_SIZE, visit(ctx.conditionalExpression()));
            }
        }
        return done(parameter, ctx);
    }

    // declarations

    @Nullable
    private static String qualifier(@Nullable TypeQualifierContext ctx) {
        if (ctx == null) return null;
        String storage = ctx.storageQualifier().getText();
        return ctx.INVARIANT() != null ? ctx.INVARIANT().getText() + " " + storage : storage;
    }

    private Node type(FullTypeContext ctx) {
        return done(node(NodeType.TYPE)
                .set(Fields.NAME, ctx.typeName().getText())
                .set(Fields.QUALIFIER, qualifier(ctx.typeQualifier()))
                .set(Fields.PRECISION, text(ctx.precisionQualifier())), ctx);
    }

    @Override
    public Node visitPrecisionDeclaration(PrecisionDeclarationContext ctx) {
        return done(node(NodeType.PRECISION)
                .set(Fields.PRECISION, ctx.precisionQualifier().getText())
                .set(Fields.PRECISION_TYPE, ctx.typeName().getText()), ctx);
    }

    @Override
    public Node visitInvariantDeclaration(InvariantDeclarationContext ctx) {
        List<Node> identifiers = new ArrayList<>();
        for (TerminalNode name : ctx.IDENTIFIER()) {
            identifiers.add(identifier(name.getSymbol()));
        }
        return done(node(NodeType.INVARIANT).set(Fields.IDENTIFIERS, identifiers), ctx);
    }

    @Override
    public Node visitStructDeclaration(StructDeclarationContext ctx) {
        Node.Builder struct = node(NodeType.STRUCT_DEFINITION).set(Fields.QUALIFIER, qualifier(ctx.typeQualifier()));
        if (ctx.IDENTIFIER() != null) struct.set(Fields.NAME, ctx.IDENTIFIER().getText());
        struct.set(Fields.MEMBERS, visitAll(ctx.structMember()));
        if (!ctx.memberDeclarator().isEmpty()) struct.set(Fields.DECLARATORS, visitAll(ctx.memberDeclarator()));
        return done(struct, ctx);
    }

    @Override
    public Node visitStructMember(StructMemberContext ctx) {
        Node type = done(node(NodeType.TYPE)
                .set(Fields.NAME, ctx.typeName().getText())
                .set(Fields.PRECISION, text(ctx.precisionQualifier())), ctx);
        return done(node(NodeType.DECLARATOR)
                .set(Fields.TYPE_ATTRIBUTE, type)
                .set(Fields.DECLARATORS, visitAll(ctx.memberDeclarator())), ctx);
    }

    @Override
    public Node visitMemberDeclarator(MemberDeclaratorContext ctx) {
        return declaratorItem(ctx.IDENTIFIER().getSymbol(), ctx.LBRACKET() != null, ctx.conditionalExpression(), null);
    }

    @Override
    public Node visitVariableDeclaration(VariableDeclarationContext ctx) {
        Node type = type(ctx.fullType());
        return done(node(NodeType.DECLARATOR)
                .set(Fields.TYPE_ATTRIBUTE, type)
                .set(Fields.DECLARATORS, visitAll(ctx.declaratorItem())), ctx);
    }

    @Override
    public Node visitDeclaratorItem(DeclaratorItemContext ctx) {
        return declaratorItem(ctx.IDENTIFIER().getSymbol(),
                ctx.LBRACKET() != null,
                ctx.conditionalExpression(),
                ctx.assignmentExpression());
    }

    private Node declaratorItem(Token name,
                                boolean isArray,
                                @Nullable ConditionalExpressionContext size,
                                @Nullable AssignmentExpressionContext initializer) {
        Node.Builder item = node(NodeType.DECLARATOR_ITEM).set(Fields.NAME, identifier(name));
        if (isArray) {
            item.set(Fields.IS_ARRAY, true);
            if (size != null) item.set(Fields.ARRAY_SIZE, visit(size));
        }
        if (initializer != null) item.set(Fields.INITIALIZER, visit(initializer));
        return done(item, name);
    }

    // statements

    @Override
    public Node visitBlockStatement(BlockStatementContext ctx) {
        return visit(ctx.compoundStatement());
    }

    @Override
    public Node visitDeclarationStatement(DeclarationStatementContext ctx) {
        return visit(ctx.declaration());
    }

    @Override
    public Node visitSimpleStatement(SimpleStatementContext ctx) {
        return visit(ctx.expressionStatement());
    }

    @Override
    public Node visitCompoundStatement(CompoundStatementContext ctx) {
        Node.Builder scope = node(NodeType.SCOPE);
        return done(scope.set(Fields.STATEMENTS, visitAll(ctx.statement())), ctx);
    }

    @Override
    public Node visitExpressionStatement(ExpressionStatementContext ctx) {
        Node.Builder statement = node(NodeType.EXPRESSION);
        if (ctx.expression() != null) statement.set(Fields.EXPRESSION, visit(ctx.expression()));
        return done(statement, ctx);
    }

    @Override
    public Node visitIfStatement(IfStatementContext ctx) {
        Node.Builder statement = node(NodeType.IF_STATEMENT)
                .set(Fields.CONDITION, visit(ctx.expression()))
                .set(Fields.BODY, visit(ctx.body));
        if (ctx.elseBody != null) statement.set(Fields.ELSE_BODY, visit(ctx.elseBody));
        return done(statement, ctx);
    }

    @Override
    public Node visitForStatement(ForStatementContext ctx) {
        Node.Builder statement = node(NodeType.FOR_STATEMENT)
                .set(Fields.INITIALIZER, visit(ctx.forInitializer().getChild(0)));
        if (ctx.condition != null) statement.set(Fields.CONDITION, visit(ctx.condition));
        if (ctx.increment != null) statement.set(Fields.INCREMENT, visit(ctx.increment));
        return done(statement.set(Fields.BODY, visit(ctx.statement())), ctx);
    }

    @Override
    public Node visitWhileStatement(WhileStatementContext ctx) {
        return done(node(NodeType.WHILE_STATEMENT)
                .set(Fields.CONDITION, visit(ctx.expression()))
                .set(Fields.BODY, visit(ctx.statement())), ctx);
    }

    @Override
    public Node visitDoStatement(DoStatementContext ctx) {
        return done(node(NodeType.DO_STATEMENT)
                .set(Fields.BODY, visit(ctx.statement()))
                .set(Fields.CONDITION, visit(ctx.expression())), ctx);
    }

    @Override
    public Node visitReturnStatement(ReturnStatementContext ctx) {
        Node.Builder statement = node(NodeType.RETURN);
        if (ctx.expression() != null) statement.set(Fields.VALUE, visit(ctx.expression()));
        return done(statement, ctx);
    }

    @Override
    public Node visitJumpStatement(JumpStatementContext ctx) {
        return done(node(NodeType.fromTag(ctx.getStart().getText())), ctx);
    }

    @Override
    public Node visitDirectiveStatement(DirectiveStatementContext ctx) {
        return directive(ctx.DIRECTIVE().getSymbol());
    }

    @Override
    public Node visitConditionalStatement(ConditionalStatementContext ctx) {
        return visit(ctx.statementConditional());
    }

    @Override
    public Node visitStatementConditional(StatementConditionalContext ctx) {
        return conditional(ctx.PP_IF().getSymbol(), ctx.statement(), ctx.statementBranch());
    }

    @Override
    public Node visitStatementBranch(StatementBranchContext ctx) {
        if (ctx.PP_ELIF() != null) {
            return conditional(ctx.PP_ELIF().getSymbol(), ctx.statement(), ctx.statementBranch());
        }
        if (ctx.PP_ELSE() != null) return elseBlock(ctx.PP_ELSE().getSymbol(), ctx.statement());
        return null;
    }

    // preprocessor

    private Node directive(Token token) {
        String text = Directives.clean(token.getText());
        String directive = Directives.name(text);
        String rest = Directives.rest(text);
        if ("#define".equals(directive)) return define(token, rest);
        Node.Builder node = node(NodeType.PREPROCESSOR).set(Fields.DIRECTIVE, directive);
        if (!rest.isEmpty()) node.set(Fields.VALUE, rest);
        return done(node, token);
    }

    private Node define(Token token, String rest) {
        int i = 0;
        while (i < rest.length() && (Character.isLetterOrDigit(rest.charAt(i)) || rest.charAt(i) == '_')) i++;
        if (i == 0) throw error("Expected macro name", token);
        Node.Builder define = node(NodeType.PREPROCESSOR)
                .set(Fields.DIRECTIVE, "#define")
                .set(Fields.IDENTIFIER, rest.substring(0, i));
        if (i < rest.length() && rest.charAt(i) == '(') {
            int close = rest.indexOf(')', i);
            if (close < 0) throw error("Expected \")\" in macro parameters", token);
            List<Node> parameters = new ArrayList<>();
            for (String parameter : rest.substring(i + 1, close).split(",")) {
                String name = parameter.trim();
                if (name.isEmpty()) continue;
                parameters.add(done(node(NodeType.IDENTIFIER).set(Fields.NAME, name), token));
            }
            define.set(Fields.PARAMETERS, parameters);
            i = close + 1;
        }
        String tokenString = rest.substring(i).trim();
        if (!tokenString.isEmpty()) define.set(Fields.TOKEN_STRING, tokenString);
        return done(define, token);
    }

    private Node conditional(Token token, List<? extends ParseTree> guarded, ParseTree branch) {
        String text = Directives.clean(token.getText());
        String value = Directives.rest(text);
        Node.Builder block = node(NodeType.PREPROCESSOR)
                .set(Fields.DIRECTIVE, Directives.name(text))
                .set(Fields.VALUE, value.isEmpty() ? null : value)
                .set(Fields.GUARDED_STATEMENTS, visitAll(guarded));
        return done(block.set(Fields.ELSE_BODY, visit(branch)), token);
    }

    private Node elseBlock(Token token, List<? extends ParseTree> guarded) {
        return done(node(NodeType.PREPROCESSOR)
                .set(Fields.DIRECTIVE, "#else")
                .set(Fields.GUARDED_STATEMENTS, visitAll(guarded)), token);
    }

    // expressions

    private Node binary(Token op, Node left, Node right) {
        return done(node(NodeType.BINARY)
                .set(Fields.OPERATOR, operator(op))
                .set(Fields.LEFT, left)
                .set(Fields.RIGHT, right), op);
    }

    // operand (op operand)*, folded to the left
    private Node leftAssociative(ParserRuleContext ctx) {
        Node left = visit(ctx.getChild(0));
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            Token op = ((TerminalNode) ctx.getChild(i)).getSymbol();
            left = binary(op, left, visit(ctx.getChild(i + 1)));
        }
        return left;
    }

    @Override
    public Node visitExpression(ExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitAssignmentExpression(AssignmentExpressionContext ctx) {
        Node left = visit(ctx.conditionalExpression());
        if (ctx.op == null) return left;
        return binary(ctx.op, left, visit(ctx.assignmentExpression()));
    }

    @Override
    public Node visitConditionalExpression(ConditionalExpressionContext ctx) {
        Node condition = visit(ctx.logicalOrExpression());
        if (ctx.QUESTION() == null) return condition;
        return done(node(NodeType.TERNARY)
                .set(Fields.CONDITION, condition)
                .set(Fields.IS_TRUE, visit(ctx.expression()))
                .set(Fields.IS_FALSE, visit(ctx.assignmentExpression())), ctx.QUESTION().getSymbol());
    }

    @Override
    public Node visitLogicalOrExpression(LogicalOrExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitLogicalXorExpression(LogicalXorExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitLogicalAndExpression(LogicalAndExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitInclusiveOrExpression(InclusiveOrExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitExclusiveOrExpression(ExclusiveOrExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitAndExpression(AndExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitEqualityExpression(EqualityExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitRelationalExpression(RelationalExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitShiftExpression(ShiftExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitAdditiveExpression(AdditiveExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitMultiplicativeExpression(MultiplicativeExpressionContext ctx) {
        return leftAssociative(ctx);
    }

    @Override
    public Node visitUnaryExpression(UnaryExpressionContext ctx) {
        if (ctx.op == null) return visit(ctx.postfixExpression());
        return done(node(NodeType.UNARY)
                .set(Fields.OPERATOR, operator(ctx.op))
                .set(Fields.EXPRESSION, visit(ctx.unaryExpression())), ctx.op);
    }

    @Override
    public Node visitPostfixExpression(PostfixExpressionContext ctx) {
        Node expression = visit(ctx.primaryExpression());
        for (PostfixOperatorContext postfix : ctx.postfixOperator()) {
            Token token = postfix.getStart();
            Node operator;
            if (postfix.LBRACKET() != null) {
                operator = done(node(NodeType.ACCESSOR).set(Fields.INDEX, visit(postfix.expression())), token);
            } else if (postfix.DOT() != null) {
                operator = done(node(NodeType.FIELD_SELECTOR)
                        .set(Fields.SELECTION, postfix.IDENTIFIER().getText()), token);
            } else {
                operator = operator(token);
            }
            expression = done(node(NodeType.POSTFIX)
                    .set(Fields.OPERATOR, operator)
                    .set(Fields.EXPRESSION, expression), token);
        }
        return expression;
    }

    @Override
    public Node visitPrimaryExpression(PrimaryExpressionContext ctx) {
        Token token = ctx.getStart();
        if (ctx.INT_CONSTANT() != null) {
            return done(node(NodeType.INT).set(Fields.VALUE, parseInt(token)), token);
        }
        if (ctx.FLOAT_CONSTANT() != null) {
            return done(node(NodeType.FLOAT).set(Fields.VALUE, Double.parseDouble(token.getText())), token);
        }
        if (ctx.TRUE() != null || ctx.FALSE() != null) {
            return done(node(NodeType.BOOL).set(Fields.VALUE, ctx.TRUE() != null), token);
        }
        if (ctx.functionCall() != null) return visit(ctx.functionCall());
        if (ctx.IDENTIFIER() != null) return identifier(token);
        return visit(ctx.expression());
    }

    private static long parseInt(Token token) {
        String text = token.getText();
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return Long.parseLong(text.substring(2), 16);
            }
            if (text.length() > 1 && text.startsWith("0")) {
                return Long.parseLong(text.substring(1), 8);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw error("Invalid integer literal \"" + text + "\"", token);
        }
    }

    @Override
    public Node visitFunctionCall(FunctionCallContext ctx) {
        return done(node(NodeType.FUNCTION_CALL)
                .set(Fields.FUNCTION_NAME, ctx.typeName().getText())
                .set(Fields.PARAMETERS, visitAll(ctx.assignmentExpression())), ctx);
    }

    private static ParseException error(String message, Token at) {
        return new ParseException(message, at.getLine(), at.getCharPositionInLine() + 1);
    }
}
