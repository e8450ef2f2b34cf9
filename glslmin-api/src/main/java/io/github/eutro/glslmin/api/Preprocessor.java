package io.github.eutro.glslmin.api;

import io.github.eutro.glslmin.core.ast.IdAllocator;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.compiler.JsConst;
import io.github.eutro.glslmin.core.compiler.ShaderMode;
import io.github.eutro.glslmin.core.compiler.ShaderProgram;
import io.github.eutro.glslmin.core.compiler.ShaderVariant;
import io.github.eutro.glslmin.core.parse.GlslParser;
import io.github.eutro.glslmin.core.parse.ParseException;
import io.github.eutro.glslmin.core.parse.StartRule;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assembles shader programs from files annotated with {@code //!} directives.
 * <p>
 * A program file holds both shaders. Lines go to the vertex shader, the fragment shader,
 * or both, according to the last of {@code //! VERTEX}, {@code //! FRAGMENT} and
 * {@code //! COMMON}; both is the default. The other directives are:
 * <ul>
 *     <li>{@code //! CLASS=name}, {@code //! SUPERCLASS=name}, {@code //! NAMESPACE=name}:
 *     names for the generated program class;</li>
 *     <li>{@code //! INCLUDE file}: includes another file, with its own sections, in place;</li>
 *     <li>{@code //! TEMPLATE name}: the template to render the program with;</li>
 *     <li>{@code //! MODE name opt:0,opt:1,...}: a preprocessor switch with at least two
 *     settings, or {@code OFF:0,ON:1} if none are given;</li>
 *     <li>{@code //! PROGRAM name mode:0,...}: a named combination of mode settings;</li>
 *     <li>{@code //! JSREQUIRE lib}, {@code //! JSCONST name expr}: host code dependencies;</li>
 *     <li>{@code //! OVERRIDE fn replacement}: turns the definitions of {@code fn} so far into
 *     prototypes, renaming their bodies to {@code replacement}.</li>
 * </ul>
 * Directive lines stay in the shader sources as comments. Parse errors are reported
 * against the file and line they came from.
 */
public final class Preprocessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(Preprocessor.class);

    private static final Pattern RE_CLASS = Pattern.compile("//!\\s*CLASS=(\\S*)");
    private static final Pattern RE_SUPERCLASS = Pattern.compile("//!\\s*SUPERCLASS=(\\S*)");
    private static final Pattern RE_NAMESPACE = Pattern.compile("//!\\s*NAMESPACE=(\\S*)");
    private static final Pattern RE_FRAGMENT = Pattern.compile("//!\\s*FRAGMENT");
    private static final Pattern RE_VERTEX = Pattern.compile("//!\\s*VERTEX");
    private static final Pattern RE_COMMON = Pattern.compile("//!\\s*COMMON");
    private static final Pattern RE_INCLUDE = Pattern.compile("//!\\s*INCLUDE\\s+(.*)");
    private static final Pattern RE_TEMPLATE = Pattern.compile("//!\\s*TEMPLATE\\s+(.*)");
    private static final Pattern RE_DEFAULT_MODE = Pattern.compile("//!\\s*MODE\\s+(\\S+)");
    private static final Pattern RE_MODE = Pattern.compile("//!\\s*MODE\\s+(\\S+)\\s+(.*)");
    private static final Pattern RE_JSREQUIRE = Pattern.compile("//!\\s*JSREQUIRE\\s+(\\S+)");
    private static final Pattern RE_JSCONST = Pattern.compile("//!\\s*JSCONST\\s+(\\S+)\\s+(.*)");
    private static final Pattern RE_OVERRIDE = Pattern.compile("//!\\s*OVERRIDE\\s+(\\S+)\\s+(\\S+)");
    private static final Pattern RE_PROGRAM = Pattern.compile("//!\\s*PROGRAM\\s+(\\S+)\\s+(.*)");
    private static final Pattern RE_SETTING_VALUE = Pattern.compile("[0-9]+");
    private static final String OVERRIDABLE_TYPES = "void|float|int|bool|vec2|vec3|vec4|ivec2|ivec3|ivec4"
            + "|bvec2|bvec3|bvec4|mat2|mat3|mat4";

    private Preprocessor() {
    }

    /**
     * Where a line of an assembled shader came from.
     */
    public static final class SourceLocation {
        public final String fileName;
        /**
         * The 0-based line within the file.
         */
        public final int localLine;

        public SourceLocation(String fileName, int localLine) {
            this.fileName = fileName;
            this.localLine = localLine;
        }

        @Override
        public String toString() {
            return fileName + " " + (localLine + 1);
        }
    }

    /**
     * Load a program file and parse its shaders.
     *
     * @param fileName     The name of the program file.
     * @param libraryFiles The contents of every file that may be loaded or included, by name.
     * @return The program.
     * @throws PreprocessorException If a directive is malformed, a file is missing or a shader doesn't parse.
     */
    @NotNull
    public static ShaderProgram parseFile(String fileName, Map<String, String> libraryFiles) {
        return parseFile(fileName, libraryFiles, IdAllocator.GLOBAL);
    }

    /**
     * Load a program file and parse its shaders.
     *
     * @param fileName     The name of the program file.
     * @param libraryFiles The contents of every file that may be loaded or included, by name.
     * @param ids          The allocator for the ids of parsed nodes.
     * @return The program.
     * @throws PreprocessorException If a directive is malformed, a file is missing or a shader doesn't parse.
     */
    @NotNull
    public static ShaderProgram parseFile(String fileName, Map<String, String> libraryFiles, IdAllocator ids) {
        Sources sources = new Sources();
        List<String> includeStack = new ArrayList<>();
        parseFileSource(fileName, libraryFiles, sources, includeStack);

        Node vertexAst = parseShader("vertex", sources.vertex.toString(), StartRule.VERTEX,
                sources.vertexMap, libraryFiles, ids);
        Node fragmentAst = parseShader("fragment", sources.fragment.toString(), StartRule.FRAGMENT,
                sources.fragmentMap, libraryFiles, ids);

        ShaderProgram program = new ShaderProgram(vertexAst, fragmentAst);
        sources.copyTo(program);
        return program;
    }

    private static Node parseShader(String shaderType,
                                    String source,
                                    StartRule rule,
                                    List<SourceLocation> sourceMap,
                                    Map<String, String> libraryFiles,
                                    IdAllocator ids) {
        try {
            return GlslParser.parse(source, rule, ids);
        } catch (ParseException e) {
            throw new PreprocessorException(formatParseError(e, shaderType, sourceMap, libraryFiles), e);
        }
    }

    private static String formatParseError(ParseException e,
                                           String shaderType,
                                           List<SourceLocation> sourceMap,
                                           Map<String, String> libraryFiles) {
        StringBuilder sb = new StringBuilder("Error while parsing the ")
                .append(shaderType)
                .append(" shader code\n");
        int index = e.getLine() - 1;
        if (index < 0 || index >= sourceMap.size()) {
            // past the last line of the assembled source
            return sb.append(e.getMessage()).toString();
        }
        SourceLocation location = sourceMap.get(index);
        String[] fileLines = libraryFiles.get(location.fileName).split("\n", -1);
        sb.append(location.fileName).append(' ').append(location.localLine + 1)
                .append(':').append(e.getRawMessage()).append('\n');
        sb.append(location.localLine < fileLines.length ? fileLines[location.localLine] : "").append('\n');
        for (int i = 1; i < e.getColumn(); i++) {
            sb.append(' ');
        }
        return sb.append('^').toString();
    }

    // the state of one file, merged into its includer's
    private static final class Sources {
        final StringBuilder vertex = new StringBuilder();
        final StringBuilder fragment = new StringBuilder();
        final List<SourceLocation> vertexMap;
        final List<SourceLocation> fragmentMap;
        final List<ShaderMode> modes = new ArrayList<>();
        final List<ShaderVariant> variants = new ArrayList<>();
        final List<String> jsRequires = new ArrayList<>();
        final List<JsConst> jsConsts = new ArrayList<>();
        String className = "";
        String superClass = "";
        String namespace = "";
        String template = "";

        Sources() {
            this(new ArrayList<>(), new ArrayList<>());
        }

        // included files extend the source maps of the file including them
        Sources(List<SourceLocation> vertexMap, List<SourceLocation> fragmentMap) {
            this.vertexMap = vertexMap;
            this.fragmentMap = fragmentMap;
        }

        void copyTo(ShaderProgram program) {
            program.className = className;
            program.superClass = superClass;
            program.namespace = namespace;
            program.template = template;
            program.originalVertexSource = vertex.toString();
            program.originalFragmentSource = fragment.toString();
            program.shaderModes.addAll(modes);
            program.shaderVariants.addAll(variants);
            program.jsRequires.addAll(jsRequires);
            program.jsConsts.addAll(jsConsts);
        }
    }

    private static void parseFileSource(String fileName,
                                        Map<String, String> libraryFiles,
                                        Sources result,
                                        List<String> includeStack) {
        String contents = libraryFiles.get(fileName);
        if (contents == null) {
            throw new PreprocessorException(includeStack.isEmpty()
                    ? "Unknown file: " + fileName
                    : "Unknown file: " + fileName + " included from " + includeStack.get(includeStack.size() - 1));
        }
        if (includeStack.contains(fileName)) {
            throw new PreprocessorException("Recursive include of " + fileName + ": "
                    + String.join(" -> ", includeStack) + " -> " + fileName);
        }
        includeStack.add(fileName);

        boolean inVertex = true;
        boolean inFragment = true;
        String[] lines = contents.replace("\\\n", "").split("\n", -1);
        for (int index = 0; index < lines.length; index++) {
            String line = lines[index];
            Matcher match;
            if ((match = RE_CLASS.matcher(line)).find()) {
                result.className = match.group(1);
            } else if ((match = RE_SUPERCLASS.matcher(line)).find()) {
                result.superClass = match.group(1);
            } else if ((match = RE_NAMESPACE.matcher(line)).find()) {
                result.namespace = match.group(1);
            } else if (RE_FRAGMENT.matcher(line).find()) {
                inFragment = true;
                inVertex = false;
            } else if (RE_VERTEX.matcher(line).find()) {
                inFragment = false;
                inVertex = true;
            } else if (RE_COMMON.matcher(line).find()) {
                inFragment = true;
                inVertex = true;
            } else if ((match = RE_MODE.matcher(line)).find()) {
                ShaderMode mode = new ShaderMode();
                mode.preprocessorName = match.group(1);
                String[] options = match.group(2).split(",", -1);
                if (options.length < 2) {
                    throw directiveError(fileName, index, "Mode with less than two options given!", line);
                }
                for (String option : options) {
                    mode.options.add(parseSetting(option, fileName, index, "Mode option has invalid format!", line));
                }
                result.modes.add(mode);
            } else if ((match = RE_DEFAULT_MODE.matcher(line)).find()) {
                ShaderMode mode = new ShaderMode();
                mode.preprocessorName = match.group(1);
                mode.options.add(new ShaderMode.Setting("OFF", 0));
                mode.options.add(new ShaderMode.Setting("ON", 1));
                result.modes.add(mode);
            } else if ((match = RE_OVERRIDE.matcher(line)).find()) {
                if (inFragment) {
                    overrideFunction(result.fragment, match.group(1), match.group(2));
                }
                if (inVertex) {
                    overrideFunction(result.vertex, match.group(1), match.group(2));
                }
            } else if ((match = RE_JSREQUIRE.matcher(line)).find()) {
                result.jsRequires.add(match.group(1));
            } else if ((match = RE_JSCONST.matcher(line)).find()) {
                result.jsConsts.add(new JsConst(match.group(1), match.group(2)));
            } else if ((match = RE_PROGRAM.matcher(line)).find()) {
                ShaderVariant variant = new ShaderVariant();
                variant.name = match.group(1);
                for (String setting : match.group(2).split(",", -1)) {
                    variant.modeSettings.add(parseSetting(setting, fileName, index,
                            "Program mode setting has invalid format!", line));
                }
                result.variants.add(variant);
            }

            if (inFragment) {
                result.fragment.append(line).append('\n');
                result.fragmentMap.add(new SourceLocation(fileName, index));
            }
            if (inVertex) {
                result.vertex.append(line).append('\n');
                result.vertexMap.add(new SourceLocation(fileName, index));
            }
            if ((match = RE_TEMPLATE.matcher(line)).find()) {
                result.template = match.group(1);
            }
            // included code goes after the directive's own line
            if ((match = RE_INCLUDE.matcher(line)).find()) {
                String includedFile = match.group(1).trim();
                LOGGER.debug("Including {} from {}:{}", includedFile, fileName, index + 1);
                Sources included = new Sources(result.vertexMap, result.fragmentMap);
                parseFileSource(includedFile, libraryFiles, included, includeStack);
                result.vertex.append(included.vertex);
                result.fragment.append(included.fragment);
                result.modes.addAll(included.modes);
                result.variants.addAll(included.variants);
                result.jsRequires.addAll(included.jsRequires);
                result.jsConsts.addAll(included.jsConsts);
            }
        }
        includeStack.remove(includeStack.size() - 1);
    }

    private static ShaderMode.Setting parseSetting(String setting,
                                                   String fileName,
                                                   int index,
                                                   String error,
                                                   String line) {
        String[] keyVal = setting.split(":", -1);
        if (keyVal.length != 2 || !RE_SETTING_VALUE.matcher(keyVal[1]).matches()) {
            throw directiveError(fileName, index, error, line);
        }
        try {
            return new ShaderMode.Setting(keyVal[0], Integer.parseInt(keyVal[1]));
        } catch (NumberFormatException e) {
            throw new PreprocessorException(directiveMessage(fileName, index, error, line), e);
        }
    }

    private static PreprocessorException directiveError(String fileName, int index, String error, String line) {
        return new PreprocessorException(directiveMessage(fileName, index, error, line));
    }

    private static String directiveMessage(String fileName, int index, String error, String line) {
        return fileName + " " + index + ":0 " + error + "\n\t" + line;
    }

    /**
     * Turn every definition of a function in the source so far into a prototype, followed by the
     * same definition under another name.
     *
     * @param source      The source, edited in place.
     * @param original    The name of the function.
     * @param replacement The new name of its body.
     */
    public static void overrideFunction(StringBuilder source, String original, String replacement) {
        Pattern declaration = Pattern.compile("\\b(" + OVERRIDABLE_TYPES + ")\\s+"
                + Pattern.quote(original) + "(\\([^)]*\\))\\s*\\{");
        Matcher matcher = declaration.matcher(source);
        String replaced = matcher.replaceAll("$1 " + Matcher.quoteReplacement(original) + "$2;"
                + "$1 " + Matcher.quoteReplacement(replacement) + "$2{");
        source.setLength(0);
        source.append(replaced);
    }
}
