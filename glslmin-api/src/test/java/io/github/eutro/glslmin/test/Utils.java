package io.github.eutro.glslmin.test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public class Utils {
    public static final String TEXTURED_VERTEX = "varying vec2 a;attribute vec3 c;attribute vec2 d;uniform mat4 b;" +
            "void main(){a=d;gl_Position=b*vec4(c,1);}";
    public static final String TEXTURED_FRAGMENT = "varying vec2 a;" +
            "vec4 e(vec4 d){return d*vec4(1,.5,.5,1);}" +
            "uniform sampler2D c;" +
            "void main(){gl_FragColor=e(texture2D(c,a));}";

    public static String readShader(String name) {
        try (InputStream in = Utils.class.getResourceAsStream("/shaders/" + name)) {
            if (in == null) throw new IllegalArgumentException("no such shader: " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Load test shaders as library files, keyed by their path under the shaders directory.
     *
     * @param names The paths.
     * @return The library files.
     */
    public static Map<String, String> libraryFiles(String... names) {
        Map<String, String> files = new LinkedHashMap<>();
        for (String name : names) {
            files.put(name, readShader(name));
        }
        return files;
    }
}
