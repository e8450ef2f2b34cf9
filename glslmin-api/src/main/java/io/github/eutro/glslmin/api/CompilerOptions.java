package io.github.eutro.glslmin.api;

import java.util.Locale;

/**
 * Which compiler steps a {@link GlslCompiler} runs, and how its output is formatted.
 * <p>
 * Everything is on by default, except pretty printing.
 */
public class CompilerOptions {
    /**
     * How far a renaming or merging step may reach.
     */
    public enum Level {
        /**
         * Every variable, including attributes and uniforms.
         */
        ALL,
        /**
         * Only variables that aren't visible from outside the program.
         */
        INTERNAL,
        /**
         * Don't run the step.
         */
        OFF,
        ;

        /**
         * Parse a level from its name, ignoring case.
         *
         * @param name The name.
         * @return The level.
         * @throws IllegalArgumentException If there is no such level.
         */
        public static Level parse(String name) {
            try {
                return valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid level: " + name + ", expected one of all, internal, off", e);
            }
        }
    }

    public boolean deadFunctionRemoval = true;
    public boolean braceRemoval = true;
    public Level variableRenaming = Level.ALL;
    public Level declarationConsolidation = Level.ALL;
    public boolean functionRenaming = true;
    public boolean constructorMinification = true;
    public boolean prettyPrint = false;
}
