package io.github.eutro.glslmin.core.ast;

import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;

/**
 * The kinds of AST node, each with the tag used for it by the grammar.
 */
public enum NodeType {
    ROOT("root"),
    SCOPE("scope"),
    FUNCTION_DECLARATION("function_declaration"),
    FUNCTION_PROTOTYPE("function_prototype"),
    PARAMETER("parameter"),
    TYPE("type"),
    DECLARATOR("declarator"),
    DECLARATOR_ITEM("declarator_item"),
    EXPRESSION("expression"),
    BINARY("binary"),
    UNARY("unary"),
    POSTFIX("postfix"),
    TERNARY("ternary"),
    FUNCTION_CALL("function_call"),
    IDENTIFIER("identifier"),
    INT("int"),
    FLOAT("float"),
    BOOL("bool"),
    OPERATOR("operator"),
    ACCESSOR("accessor"),
    FIELD_SELECTOR("field_selector"),
    RETURN("return"),
    CONTINUE("continue"),
    BREAK("break"),
    DISCARD("discard"),
    IF_STATEMENT("if_statement"),
    FOR_STATEMENT("for_statement"),
    WHILE_STATEMENT("while_statement"),
    DO_STATEMENT("do_statement"),
    PREPROCESSOR("preprocessor"),
    INVARIANT("invariant"),
    PRECISION("precision"),
    STRUCT_DEFINITION("struct_definition"),
    ;

    private static final Map<String, NodeType> BY_TAG = new HashMap<>();

    static {
        for (NodeType type : values()) {
            BY_TAG.put(type.tag, type);
        }
    }

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Look a node type up by its grammar tag.
     *
     * @param tag The tag, e.g. {@code "declarator_item"}.
     * @return The node type.
     * @throws IllegalArgumentException If no node type has that tag.
     */
    @NotNull
    public static NodeType fromTag(String tag) {
        NodeType type = BY_TAG.get(tag);
        if (type == null) throw new IllegalArgumentException("unknown node type: " + tag);
        return type;
    }

    @Override
    public String toString() {
        return tag;
    }
}
