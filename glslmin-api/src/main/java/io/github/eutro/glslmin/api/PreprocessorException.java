package io.github.eutro.glslmin.api;

/**
 * Thrown when a shader program file can't be loaded, because of a malformed
 * directive or a syntax error in the shaders it assembles.
 */
public class PreprocessorException extends RuntimeException {
    public PreprocessorException(String message) {
        super(message);
    }

    public PreprocessorException(String message, Throwable cause) {
        super(message, cause);
    }
}
