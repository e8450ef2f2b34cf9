package io.github.eutro.glslmin.core.compiler;

import java.util.ArrayList;
import java.util.List;

/**
 * A preprocessor switch of a shader program, with its named settings.
 */
public class ShaderMode {
    /**
     * The name of the preprocessor macro that selects the setting.
     */
    public String preprocessorName = "";
    /**
     * The minified name of the mode, if any.
     */
    public String shortName = "";
    /**
     * The possible settings.
     */
    public final List<Setting> options = new ArrayList<>();

    /**
     * A named integer value of a mode.
     */
    public static class Setting {
        public final String name;
        public final int value;

        public Setting(String name, int value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public String toString() {
            return name + ":" + value;
        }
    }
}
