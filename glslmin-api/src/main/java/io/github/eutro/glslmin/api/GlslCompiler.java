package io.github.eutro.glslmin.api;

import io.github.eutro.glslmin.api.events.CompilerEventBus;
import io.github.eutro.glslmin.api.events.ProgramCompiledEvent;
import io.github.eutro.glslmin.api.events.ProgramLoadedEvent;
import io.github.eutro.glslmin.api.events.RegisterStepsEvent;
import io.github.eutro.glslmin.api.events.RunStepEvent;
import io.github.eutro.glslmin.api.events.ShaderPassesEvent;
import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.compiler.BraceReducer;
import io.github.eutro.glslmin.core.compiler.Compiler;
import io.github.eutro.glslmin.core.compiler.CompilerPhase;
import io.github.eutro.glslmin.core.compiler.CompilerStep;
import io.github.eutro.glslmin.core.compiler.ConstructorMinifier;
import io.github.eutro.glslmin.core.compiler.DeadFunctionRemover;
import io.github.eutro.glslmin.core.compiler.DeclarationConsolidation;
import io.github.eutro.glslmin.core.compiler.FunctionMinifier;
import io.github.eutro.glslmin.core.compiler.ShaderProgram;
import io.github.eutro.glslmin.core.compiler.TransformerStep;
import io.github.eutro.glslmin.core.compiler.VariableMinifier;
import io.github.eutro.glslmin.core.parse.GlslParser;
import io.github.eutro.glslmin.core.parse.StartRule;
import io.github.eutro.glslmin.core.passes.AstPass;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Loads and compiles shader programs, according to its {@link CompilerOptions}.
 * <p>
 * The compiler can be further configured through the {@link io.github.eutro.glslmin.api.events events API}.
 * For each program, it fires, in order:
 * <ol>
 *     <li>{@link ProgramLoadedEvent}, once the program is parsed;</li>
 *     <li>{@link RegisterStepsEvent}, once the configured steps are registered;</li>
 *     <li>{@link RunStepEvent}, before each configured step, which may be cancelled to skip it;</li>
 *     <li>{@link ShaderPassesEvent}, for extra passes over the compiled shaders;</li>
 *     <li>{@link ProgramCompiledEvent}, with the finished program.</li>
 * </ol>
 */
public class GlslCompiler extends CompilerEventBus {
    private static final Logger LOGGER = LoggerFactory.getLogger(GlslCompiler.class);

    private final CompilerOptions options;

    public GlslCompiler() {
        this(new CompilerOptions());
    }

    public GlslCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * Load a program file.
     *
     * @param fileName     The name of the program file.
     * @param libraryFiles The contents of every file that may be loaded or included, by name.
     * @return The loaded program.
     * @throws PreprocessorException If the program can't be loaded.
     * @see Preprocessor
     */
    @NotNull
    public ShaderProgram load(String fileName, Map<String, String> libraryFiles) {
        ShaderProgram program = Preprocessor.parseFile(fileName, libraryFiles);
        LOGGER.debug("Loaded program {} from {}", program.className, fileName);
        return loaded(program);
    }

    /**
     * Load a program from separate vertex and fragment shader sources, without directives.
     *
     * @param vertexSource   The vertex shader.
     * @param fragmentSource The fragment shader.
     * @return The loaded program.
     * @throws io.github.eutro.glslmin.core.parse.ParseException If either shader doesn't parse.
     */
    @NotNull
    public ShaderProgram loadShaders(String vertexSource, String fragmentSource) {
        ShaderProgram program = new ShaderProgram(
                GlslParser.parse(vertexSource, StartRule.VERTEX),
                GlslParser.parse(fragmentSource, StartRule.FRAGMENT));
        program.originalVertexSource = vertexSource;
        program.originalFragmentSource = fragmentSource;
        return loaded(program);
    }

    private ShaderProgram loaded(ShaderProgram program) {
        program.prettyPrint = options.prettyPrint;
        return dispatch(ProgramLoadedEvent.class, new ProgramLoadedEvent(program)).program;
    }

    /**
     * Run the configured steps, and any registered by listeners, over a program.
     *
     * @param program The program, which is modified in place.
     * @return The program.
     */
    @NotNull
    public ShaderProgram compile(ShaderProgram program) {
        Compiler compiler = new Compiler(program);
        registerSteps(compiler);
        dispatch(RegisterStepsEvent.class, new RegisterStepsEvent(compiler));
        compiler.compileProgram();

        AstPass<Node, Node> passes = dispatch(ShaderPassesEvent.class,
                new ShaderPassesEvent(AstPass.identity())).passes;
        TransformerStep.runOnShaders("shader passes", passes, program);

        program.defaultUniformsAndAttributes();
        return dispatch(ProgramCompiledEvent.class, new ProgramCompiledEvent(program)).program;
    }

    /**
     * Load and compile a program file.
     *
     * @param fileName     The name of the program file.
     * @param libraryFiles The contents of every file that may be loaded or included, by name.
     * @return The compiled program.
     * @throws PreprocessorException If the program can't be loaded.
     */
    @NotNull
    public ShaderProgram compileFile(String fileName, Map<String, String> libraryFiles) {
        return compile(load(fileName, libraryFiles));
    }

    private void registerSteps(Compiler compiler) {
        if (options.deadFunctionRemoval) {
            register(compiler, DeadFunctionRemover.STEP);
        }
        if (options.braceRemoval) {
            register(compiler, BraceReducer.STEP);
        }
        if (options.declarationConsolidation != CompilerOptions.Level.OFF) {
            register(compiler, DeclarationConsolidation.step(
                    options.declarationConsolidation == CompilerOptions.Level.ALL));
        }
        if (options.variableRenaming != CompilerOptions.Level.OFF) {
            register(compiler, VariableMinifier.step(options.variableRenaming == CompilerOptions.Level.ALL));
        }
        if (options.functionRenaming) {
            register(compiler, FunctionMinifier.STEP);
        }
        if (options.constructorMinification) {
            register(compiler, ConstructorMinifier.STEP);
        }
    }

    private void register(Compiler compiler, CompilerStep step) {
        compiler.registerStep(CompilerPhase.MINIFICATION, new EventStep(step));
    }

    /**
     * Render a compiled program as a single file, with the vertex and fragment shaders in sections.
     *
     * @param program The program.
     * @return The rendered program.
     */
    public static String formatOutput(ShaderProgram program) {
        return "\n//! VERTEX\n" + program.getVertexSource() + "\n//! FRAGMENT\n" + program.getFragmentSource();
    }

    // fires RunStepEvent around a step
    private class EventStep implements CompilerStep {
        private final CompilerStep step;

        EventStep(CompilerStep step) {
            this.step = step;
        }

        @Override
        public String getName() {
            return step.getName();
        }

        @Override
        public List<String> getDependencies() {
            return step.getDependencies();
        }

        @Override
        @Nullable
        public Object performStep(Map<String, Object> stepOutputs, ShaderProgram program) {
            RunStepEvent event = dispatch(RunStepEvent.class, new RunStepEvent(step, program));
            if (event.isCancelled()) {
                LOGGER.debug("Skipping compiler step {}, cancelled by {}", step.getName(), event.getCancelledBy());
                return null;
            }
            return step.performStep(stepOutputs, program);
        }
    }
}
