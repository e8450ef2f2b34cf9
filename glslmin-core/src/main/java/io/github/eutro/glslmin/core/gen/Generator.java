package io.github.eutro.glslmin.core.gen;

import io.github.eutro.glslmin.core.ast.Fields;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders ASTs back to GLSL source.
 * <p>
 * The default output is as compact as possible: no whitespace beyond what is needed to
 * separate tokens, the fewest parentheses that preserve the tree's structure, and the
 * shortest spelling of each literal. Preprocessor directives are always put on their own
 * lines, separated by a configurable newline string.
 */
public final class Generator {
    private static final int PREC_COMMA = -1;
    private static final int PREC_ASSIGN = 0;
    private static final int PREC_TERNARY = 1;
    private static final int PREC_UNARY = 13;
    private static final int PREC_POSTFIX = 14;
    private static final int PREC_PRIMARY = 15;

    private static final Map<String, Integer> BINARY_PRECEDENCE = new HashMap<>();

    static {
        String[][] levels = {
                {","},
                {"=", "+=", "-=", "*=", "/=", "%=", "<<=", ">>=", "&=", "^=", "|="},
                {},
                {"||"},
                {"^^"},
                {"&&"},
                {"|"},
                {"^"},
                {"&"},
                {"==", "!="},
                {"<", ">", "<=", ">="},
                {"<<", ">>"},
                {"+", "-"},
                {"*", "/", "%"},
        };
        for (int i = 0; i < levels.length; i++) {
            for (String op : levels[i]) {
                BINARY_PRECEDENCE.put(op, i - 1);
            }
        }
    }

    private final StringBuilder out = new StringBuilder();
    private final String newline;
    private final boolean pretty;
    private int indent = 0;

    private Generator(String newline, boolean pretty) {
        this.newline = newline;
        this.pretty = pretty;
    }

    public static String render(Node node) {
        return render(node, "\n", false);
    }

    public static String render(Node node, String newline) {
        return render(node, newline, false);
    }

    /**
     * Render a node as GLSL source.
     *
     * @param node    The node, of any type.
     * @param newline The line separator, used after preprocessor directives and when pretty printing.
     * @param pretty  Whether to indent blocks and space out operators.
     * @return The source.
     */
    public static String render(Node node, String newline, boolean pretty) {
        Generator generator = new Generator(newline, pretty);
        generator.emit(node);
        return generator.out.toString();
    }

    /**
     * Get the precedence of a binary or assignment operator. Higher binds tighter.
     *
     * @param operator The operator.
     * @return The precedence.
     * @throws IllegalArgumentException If the operator is not a binary operator.
     */
    public static int binaryPrecedence(String operator) {
        Integer precedence = BINARY_PRECEDENCE.get(operator);
        if (precedence == null) throw new IllegalArgumentException("not a binary operator: " + operator);
        return precedence;
    }

    /**
     * Spell an int literal as the shorter of its decimal and hexadecimal forms.
     *
     * @param value The value.
     * @return The literal.
     */
    public static String formatInt(long value) {
        String sign = value < 0 ? "-" : "";
        long abs = Math.abs(value);
        String decimal = Long.toString(abs);
        String hex = "0x" + Long.toHexString(abs);
        return sign + (hex.length() < decimal.length() ? hex : decimal);
    }

    /**
     * Spell a float literal as the shorter of its decimal ({@code 42.}, {@code .42})
     * and exponent ({@code 1e-6}, {@code 3.2e5}) forms.
     *
     * @param value The value.
     * @return The literal.
     */
    public static String formatFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("no GLSL literal for " + value);
        }
        if (value == 0) return "0.";
        String sign = value < 0 ? "-" : "";
        BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
        String digits = decimal.unscaledValue().toString();
        int point = digits.length() - decimal.scale();

        String plain;
        if (point <= 0) {
            plain = "." + "0".repeat(-point) + digits;
        } else if (point >= digits.length()) {
            plain = digits + "0".repeat(point - digits.length()) + ".";
        } else {
            plain = digits.substring(0, point) + "." + digits.substring(point);
        }
        String exponent = digits.charAt(0)
                + (digits.length() > 1 ? "." + digits.substring(1) : "")
                + "e" + (point - 1);
        return sign + (exponent.length() < plain.length() ? exponent : plain);
    }

    private void append(String text) {
        if (text.isEmpty()) return;
        int length = out.length();
        if (length > 0) {
            char last = out.charAt(length - 1);
            char first = text.charAt(0);
            if ((last == '+' || last == '-') && first == last) {
                out.append(' ');
            }
        }
        out.append(text);
    }

    private boolean endsWithNewline() {
        int length = out.length();
        int nl = newline.length();
        return length >= nl && out.substring(length - nl).equals(newline);
    }

    private void ensureNewline() {
        if (out.length() > 0 && !endsWithNewline()) {
            out.append(newline);
        }
    }

    private void prettyLine() {
        if (!pretty) return;
        if (out.length() > 0 && !endsWithNewline()) out.append(newline);
        out.append("  ".repeat(indent));
    }

    private String space() {
        return pretty ? " " : "";
    }

    private static int precedenceOf(Node node) {
        switch (node.getType()) {
            case BINARY:
                return binaryPrecedence(operatorOf(node));
            case TERNARY:
                return PREC_TERNARY;
            case UNARY:
                return PREC_UNARY;
            case POSTFIX:
                return PREC_POSTFIX;
            case INT:
            case FLOAT: {
                Object value = node.get(Fields.VALUE);
                return value instanceof Number && ((Number) value).doubleValue() < 0 ? PREC_UNARY : PREC_PRIMARY;
            }
            default:
                return PREC_PRIMARY;
        }
    }

    private static String operatorOf(Node node) {
        Node operator = node.getNode(Fields.OPERATOR);
        if (operator == null) throw new IllegalStateException(node.getType() + " without an operator");
        return operator.getString(Fields.OPERATOR);
    }

    private void emitWrapped(Node node, boolean parens) {
        if (parens) append("(");
        emit(node);
        if (parens) append(")");
    }

    private void emitAtLeast(Node node, int precedence) {
        emitWrapped(node, precedenceOf(node) < precedence);
    }

    private void emitList(List<Node> nodes, String separator) {
        boolean first = true;
        for (Node node : nodes) {
            if (!first) append(separator);
            first = false;
            emit(node);
        }
    }

    private void emitArguments(List<Node> nodes) {
        boolean first = true;
        for (Node node : nodes) {
            if (!first) append("," + space());
            first = false;
            emitAtLeast(node, PREC_ASSIGN);
        }
    }

    private void emitStatements(List<Node> statements) {
        for (Node statement : statements) {
            if (!statement.is(NodeType.PREPROCESSOR)) prettyLine();
            emit(statement);
        }
    }

    private void emitBlock(Node scope) {
        append("{");
        indent++;
        emitStatements(scope.getNodes(Fields.STATEMENTS));
        indent--;
        if (!scope.getNodes(Fields.STATEMENTS).isEmpty()) prettyLine();
        append("}");
    }

    // the statement following a keyword or closing parenthesis
    private void emitBody(String keyword, Node body) {
        append(keyword);
        if (body.is(NodeType.SCOPE)) {
            append(space());
        } else if (keyword.endsWith(")")) {
            append(space());
        } else {
            append(" ");
        }
        emit(body);
    }

    private void emitOptional(@Nullable Node node) {
        if (node != null) emit(node);
    }

    private void emit(Node node) {
        switch (node.getType()) {
            case ROOT:
                emitStatements(node.getNodes(Fields.STATEMENTS));
                break;
            case SCOPE:
                emitBlock(node);
                break;
            case IDENTIFIER:
                append(node.getString(Fields.NAME));
                break;
            case INT:
                append(formatInt(((Number) node.get(Fields.VALUE)).longValue()));
                break;
            case FLOAT:
                append(formatFloat(((Number) node.get(Fields.VALUE)).doubleValue()));
                break;
            case BOOL:
                append(String.valueOf(node.getBoolean(Fields.VALUE)));
                break;
            case OPERATOR:
                append(node.getString(Fields.OPERATOR));
                break;
            case BINARY:
                emitBinary(node);
                break;
            case TERNARY:
                emitWrapped(node.getNode(Fields.CONDITION), precedenceOf(node.getNode(Fields.CONDITION)) <= PREC_TERNARY);
                append(space() + "?" + space());
                emit(node.getNode(Fields.IS_TRUE));
                append(space() + ":" + space());
                emitAtLeast(node.getNode(Fields.IS_FALSE), PREC_TERNARY);
                break;
            case UNARY:
                append(operatorOf(node));
                emitAtLeast(node.getNode(Fields.EXPRESSION), PREC_UNARY);
                break;
            case POSTFIX:
                emitAtLeast(node.getNode(Fields.EXPRESSION), PREC_POSTFIX);
                emit(node.getNode(Fields.OPERATOR));
                break;
            case ACCESSOR:
                append("[");
                emit(node.getNode(Fields.INDEX));
                append("]");
                break;
            case FIELD_SELECTOR:
                append(".");
                append(node.getString(Fields.SELECTION));
                break;
            case FUNCTION_CALL:
                append(node.getString(Fields.FUNCTION_NAME));
                append("(");
                emitArguments(node.getNodes(Fields.PARAMETERS));
                append(")");
                break;
            case TYPE:
                if (node.has(Fields.QUALIFIER)) append(node.getString(Fields.QUALIFIER) + " ");
                if (node.has(Fields.PRECISION)) append(node.getString(Fields.PRECISION) + " ");
                append(node.getString(Fields.NAME));
                break;
            case PARAMETER:
                if (node.has(Fields.TYPE_QUALIFIER)) append(node.getString(Fields.TYPE_QUALIFIER) + " ");
                if (node.has(Fields.PARAMETER_QUALIFIER)) append(node.getString(Fields.PARAMETER_QUALIFIER) + " ");
                if (node.has(Fields.PRECISION)) append(node.getString(Fields.PRECISION) + " ");
                append(node.getString(Fields.TYPE_NAME));
                if (node.has(Fields.NAME)) append(" " + node.getString(Fields.NAME));
                if (node.has(Fields.ARRAY_SIZE)) {
                    append("[");
                    emit(node.getNode(Fields.ARRAY_SIZE));
                    append("]");
                }
                break;
            case DECLARATOR:
                emit(node.getNode(Fields.TYPE_ATTRIBUTE));
                append(" ");
                emitList(node.getNodes(Fields.DECLARATORS), "," + space());
                append(";");
                break;
            case DECLARATOR_ITEM:
                emit(node.getNode(Fields.NAME));
                if (node.getBoolean(Fields.IS_ARRAY) || node.has(Fields.ARRAY_SIZE)) {
                    append("[");
                    emitOptional(node.getNode(Fields.ARRAY_SIZE));
                    append("]");
                }
                if (node.has(Fields.INITIALIZER)) {
                    append(space() + "=" + space());
                    emitAtLeast(node.getNode(Fields.INITIALIZER), PREC_ASSIGN);
                }
                break;
            case FUNCTION_PROTOTYPE:
            case FUNCTION_DECLARATION:
                emit(node.getNode(Fields.RETURN_TYPE));
                append(" " + node.getString(Fields.NAME) + "(");
                emitArguments(node.getNodes(Fields.PARAMETERS));
                append(")");
                if (node.is(NodeType.FUNCTION_DECLARATION)) {
                    append(space());
                    emit(node.getNode(Fields.BODY));
                } else {
                    append(";");
                }
                break;
            case EXPRESSION:
                emitOptional(node.getNode(Fields.EXPRESSION));
                append(";");
                break;
            case RETURN:
                append("return");
                if (node.has(Fields.VALUE)) {
                    append(" ");
                    emit(node.getNode(Fields.VALUE));
                }
                append(";");
                break;
            case CONTINUE:
            case BREAK:
            case DISCARD:
                append(node.getType().getTag() + ";");
                break;
            case IF_STATEMENT:
                append("if" + space() + "(");
                emit(node.getNode(Fields.CONDITION));
                emitBody(")", node.getNode(Fields.BODY));
                if (node.has(Fields.ELSE_BODY)) {
                    if (pretty) append(" ");
                    emitBody("else", node.getNode(Fields.ELSE_BODY));
                }
                break;
            case FOR_STATEMENT:
                append("for" + space() + "(");
                emit(node.getNode(Fields.INITIALIZER));
                if (node.has(Fields.CONDITION)) {
                    append(space());
                    emit(node.getNode(Fields.CONDITION));
                }
                append(";");
                if (node.has(Fields.INCREMENT)) {
                    append(space());
                    emit(node.getNode(Fields.INCREMENT));
                }
                emitBody(")", node.getNode(Fields.BODY));
                break;
            case WHILE_STATEMENT:
                append("while" + space() + "(");
                emit(node.getNode(Fields.CONDITION));
                emitBody(")", node.getNode(Fields.BODY));
                break;
            case DO_STATEMENT:
                emitBody("do", node.getNode(Fields.BODY));
                append(space() + "while" + space() + "(");
                emit(node.getNode(Fields.CONDITION));
                append(")");
                break;
            case INVARIANT:
                append("invariant ");
                emitList(node.getNodes(Fields.IDENTIFIERS), "," + space());
                append(";");
                break;
            case PRECISION:
                append("precision " + node.getString(Fields.PRECISION) + " " + node.getString(Fields.PRECISION_TYPE) + ";");
                break;
            case STRUCT_DEFINITION:
                if (node.has(Fields.QUALIFIER)) append(node.getString(Fields.QUALIFIER) + " ");
                append("struct");
                if (node.has(Fields.NAME)) append(" " + node.getString(Fields.NAME));
                append(space() + "{");
                indent++;
                emitStatements(node.getNodes(Fields.MEMBERS));
                indent--;
                prettyLine();
                append("}");
                emitList(node.getNodes(Fields.DECLARATORS), "," + space());
                append(";");
                break;
            case PREPROCESSOR:
                emitPreprocessor(node, false);
                break;
            default:
                throw new IllegalArgumentException("cannot render " + node.getType());
        }
    }

    private void emitBinary(Node node) {
        String operator = operatorOf(node);
        int precedence = binaryPrecedence(operator);
        boolean rightAssociative = precedence == PREC_ASSIGN;

        Node left = node.getNode(Fields.LEFT);
        int leftPrecedence = precedenceOf(left);
        emitWrapped(left, leftPrecedence < precedence || leftPrecedence == precedence && rightAssociative);

        if (!pretty) {
            append(operator);
        } else if (precedence == PREC_COMMA) {
            append(", ");
        } else {
            append(" " + operator + " ");
        }

        Node right = node.getNode(Fields.RIGHT);
        int rightPrecedence = precedenceOf(right);
        boolean parens = rightPrecedence < precedence;
        if (rightPrecedence == precedence && !rightAssociative) {
            boolean associative = ("*".equals(operator) || "+".equals(operator))
                    && right.is(NodeType.BINARY)
                    && operator.equals(operatorOf(right));
            parens = !associative;
        }
        emitWrapped(right, parens);
    }

    private void emitPreprocessor(Node node, boolean isElse) {
        ensureNewline();
        String directive = node.getString(Fields.DIRECTIVE);
        out.append(directive);
        if ("#define".equals(directive)) {
            out.append(' ').append(node.getString(Fields.IDENTIFIER));
            if (node.has(Fields.PARAMETERS)) {
                out.append('(');
                boolean first = true;
                for (Node parameter : node.getNodes(Fields.PARAMETERS)) {
                    if (!first) out.append(',');
                    first = false;
                    out.append(parameter.getString(Fields.NAME));
                }
                out.append(')');
            }
            if (node.has(Fields.TOKEN_STRING)) out.append(' ').append(node.getString(Fields.TOKEN_STRING));
        } else if (node.has(Fields.VALUE)) {
            out.append(' ').append(node.getString(Fields.VALUE));
        }
        out.append(newline);
        if (node.has(Fields.GUARDED_STATEMENTS)) {
            emitStatements(node.getNodes(Fields.GUARDED_STATEMENTS));
            ensureNewline();
        }
        Node elseBody = node.getNode(Fields.ELSE_BODY);
        if (elseBody != null) {
            emitPreprocessor(elseBody, true);
        }
        if (node.has(Fields.GUARDED_STATEMENTS) && !isElse) {
            out.append("#endif").append(newline);
        }
    }
}
