package io.github.eutro.glslmin.core.parse;

/**
 * Thrown when source text is not valid GLSL.
 */
public class ParseException extends RuntimeException {
    private final String rawMessage;
    private final int line;
    private final int column;

    /**
     * @param message The description of the error, without position.
     * @param line    The 1-based line of the error.
     * @param column  The 1-based column of the error.
     */
    public ParseException(String message, int line, int column) {
        super(line + ":" + column + ": " + message);
        this.rawMessage = message;
        this.line = line;
        this.column = column;
    }

    /**
     * Get the description of the error, without its position.
     *
     * @return The message.
     */
    public String getRawMessage() {
        return rawMessage;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
