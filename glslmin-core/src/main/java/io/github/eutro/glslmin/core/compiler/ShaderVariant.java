package io.github.eutro.glslmin.core.compiler;

import java.util.ArrayList;
import java.util.List;

/**
 * A named combination of mode settings of a shader program.
 */
public class ShaderVariant {
    public String name = "";
    public final List<ShaderMode.Setting> modeSettings = new ArrayList<>();
}
