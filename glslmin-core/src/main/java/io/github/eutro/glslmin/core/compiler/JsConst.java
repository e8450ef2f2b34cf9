package io.github.eutro.glslmin.core.compiler;

/**
 * A constant to declare alongside the program in generated host code.
 */
public class JsConst {
    public final String value;
    public final String expression;

    public JsConst(String value, String expression) {
        this.value = value;
        this.expression = expression;
    }

    @Override
    public String toString() {
        return value + "=" + expression;
    }
}
