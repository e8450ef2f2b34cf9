package io.github.eutro.glslmin.core.ast;

/**
 * Names of node fields, as produced by the parser.
 */
public final class Fields {
    private Fields() {
    }

    public static final String STATEMENTS = "statements";
    public static final String NAME = "name";
    public static final String RETURN_TYPE = "returnType";
    public static final String PARAMETERS = "parameters";
    public static final String BODY = "body";
    public static final String ELSE_BODY = "elseBody";
    public static final String TYPE_NAME = "type_name";
    public static final String TYPE_QUALIFIER = "typeQualifier";
    public static final String PARAMETER_QUALIFIER = "parameterQualifier";
    public static final String PRECISION = "precision";
    public static final String QUALIFIER = "qualifier";
    /**
     * The type named by a {@code precision} statement.
     */
    public static final String PRECISION_TYPE = "typeName";
    public static final String ARRAY_SIZE = "arraySize";
    public static final String IS_ARRAY = "isArray";
    public static final String TYPE_ATTRIBUTE = "typeAttribute";
    public static final String DECLARATORS = "declarators";
    public static final String INITIALIZER = "initializer";
    public static final String EXPRESSION = "expression";
    public static final String OPERATOR = "operator";
    public static final String LEFT = "left";
    public static final String RIGHT = "right";
    public static final String CONDITION = "condition";
    public static final String IS_TRUE = "is_true";
    public static final String IS_FALSE = "is_false";
    public static final String FUNCTION_NAME = "function_name";
    public static final String VALUE = "value";
    public static final String INDEX = "index";
    public static final String SELECTION = "selection";
    public static final String INCREMENT = "increment";
    public static final String DIRECTIVE = "directive";
    public static final String IDENTIFIER = "identifier";
    public static final String TOKEN_STRING = "token_string";
    public static final String GUARDED_STATEMENTS = "guarded_statements";
    public static final String IDENTIFIERS = "identifiers";
    public static final String MEMBERS = "members";
}
