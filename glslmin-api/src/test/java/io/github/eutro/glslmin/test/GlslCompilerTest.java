package io.github.eutro.glslmin.test;

import io.github.eutro.glslmin.api.CompilerOptions;
import io.github.eutro.glslmin.api.GlslCompiler;
import io.github.eutro.glslmin.api.events.ProgramCompiledEvent;
import io.github.eutro.glslmin.api.events.ProgramLoadedEvent;
import io.github.eutro.glslmin.api.events.RegisterStepsEvent;
import io.github.eutro.glslmin.api.events.RunStepEvent;
import io.github.eutro.glslmin.api.events.ShaderPassesEvent;
import io.github.eutro.glslmin.core.ast.transform.AstTransformer;
import io.github.eutro.glslmin.core.ast.transform.QualifierTransformer;
import io.github.eutro.glslmin.core.compiler.CompilerPhase;
import io.github.eutro.glslmin.core.compiler.FunctionMinifier;
import io.github.eutro.glslmin.core.compiler.ShaderProgram;
import io.github.eutro.glslmin.core.compiler.TransformerStep;
import io.github.eutro.glslmin.core.compiler.VariableMinifier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class GlslCompilerTest {
    private static ShaderProgram compileTextured(GlslCompiler compiler) {
        return compiler.compileFile("textured.glsl", Utils.libraryFiles("textured.glsl", "lib/colors.glsllib"));
    }

    private static CompilerOptions allOff() {
        CompilerOptions options = new CompilerOptions();
        options.deadFunctionRemoval = false;
        options.braceRemoval = false;
        options.variableRenaming = CompilerOptions.Level.OFF;
        options.declarationConsolidation = CompilerOptions.Level.OFF;
        options.functionRenaming = false;
        options.constructorMinification = false;
        return options;
    }

    @Test
    void testCompileFile() {
        ShaderProgram program = compileTextured(new GlslCompiler());
        assertEquals(Utils.TEXTURED_VERTEX, program.getVertexSource());
        assertEquals(Utils.TEXTURED_FRAGMENT, program.getFragmentSource());

        assertEquals("TexturedShader", program.className);
        assertEquals("USE_TINT", program.shaderModes.get(0).preprocessorName);
        assertEquals("Tinted", program.shaderVariants.get(0).name);

        assertEquals("c", program.attributeMap.get("position").shortName);
        assertEquals(3, program.attributeMap.get("position").variableSize);
        assertEquals("d", program.attributeMap.get("texCoord").shortName);
        assertEquals(2, program.attributeMap.get("texCoord").variableSize);
        assertEquals("b", program.uniformMap.get("mvp").shortName);
        assertEquals("c", program.uniformMap.get("tex").shortName);
        assertEquals("sampler2D", program.uniformMap.get("tex").type);
        assertEquals(2, program.getAttributes().size());
        assertEquals(2, program.getUniforms().size());
    }

    @Test
    void testEvents() {
        GlslCompiler compiler = new GlslCompiler();
        List<String> steps = new ArrayList<>();
        AtomicInteger passRuns = new AtomicInteger();
        AtomicReference<ShaderProgram> compiled = new AtomicReference<>();
        compiler.listen(ProgramLoadedEvent.class, event -> event.program.className = "Renamed");
        compiler.listen(RegisterStepsEvent.class, event -> event.compiler.registerStep(CompilerPhase.OPTIMIZATION,
                new TransformerStep("VaryingsToUniforms",
                        AstTransformer.pass(() -> new QualifierTransformer("varying", "uniform")))));
        compiler.listen(RunStepEvent.class, event -> steps.add(event.step.getName()));
        compiler.listen(ShaderPassesEvent.class, event -> event.passes = event.passes.then(node -> {
            passRuns.incrementAndGet();
            return node;
        }));
        compiler.listen(ProgramCompiledEvent.class, event -> compiled.set(event.program));

        ShaderProgram program = compileTextured(compiler);
        assertSame(program, compiled.get());
        assertEquals("Renamed", program.className);
        assertEquals(Arrays.asList("DeadFunctionRemover", "BraceReducer", "DeclarationConsolidation",
                VariableMinifier.NAME, FunctionMinifier.NAME, "ConstructorMinifier"), steps);
        assertEquals(2, passRuns.get());
        assertTrue(program.getVertexSource().startsWith("uniform vec2 "), program.getVertexSource());
    }

    @Test
    void testConsolidationSeesOriginalNames() {
        GlslCompiler compiler = new GlslCompiler();
        AtomicReference<String> beforeConsolidation = new AtomicReference<>();
        compiler.listen(RunStepEvent.class, event -> {
            if ("DeclarationConsolidation".equals(event.step.getName())) {
                beforeConsolidation.set(event.program.getVertexSource());
            }
        });
        ShaderProgram program = compiler.compile(compiler.loadShaders(
                "attribute vec3 p;uniform float u;attribute vec3 q;void main(){gl_Position=vec4(p+q,u);}",
                "void main(){}"));
        assertEquals("attribute vec3 p;uniform float u;attribute vec3 q;void main(){gl_Position=vec4(p+q,u);}",
                beforeConsolidation.get());
        assertEquals("attribute vec3 b,c;uniform float a;void main(){gl_Position=vec4(b+c,a);}",
                program.getVertexSource());
    }

    @Test
    void testCancelledEventsStopPropagating() {
        GlslCompiler compiler = new GlslCompiler();
        List<String> seen = new ArrayList<>();
        AtomicReference<RunStepEvent> cancelled = new AtomicReference<>();
        compiler.listen(RunStepEvent.class, "keep function names", event -> {
            if (FunctionMinifier.NAME.equals(event.step.getName())) {
                event.cancel();
                cancelled.set(event);
            }
        });
        compiler.listen(RunStepEvent.class, event -> seen.add(event.step.getName()));
        compileTextured(compiler);
        assertFalse(seen.contains(FunctionMinifier.NAME));
        assertTrue(seen.contains(VariableMinifier.NAME));
        assertEquals("keep function names", cancelled.get().getCancelledBy());
    }

    @Test
    void testCancellingListenerIsNamed() {
        GlslCompiler compiler = new GlslCompiler();
        AtomicReference<RunStepEvent> cancelled = new AtomicReference<>();
        compiler.listen(RunStepEvent.class, event -> {
        });
        compiler.listen(RunStepEvent.class, event -> {
            event.cancel();
            cancelled.compareAndSet(null, event);
        });
        ShaderProgram program = compiler.compile(compiler.loadShaders(
                "void unused(){}void main(){}", "void main(){}"));
        assertEquals("void unused(){}void main(){}", program.getVertexSource());
        assertTrue(cancelled.get().isCancelled());
        assertEquals("RunStepEvent listener #2", cancelled.get().getCancelledBy());
    }

    @Test
    void testCancelledStepIsSkipped() {
        GlslCompiler compiler = new GlslCompiler();
        compiler.listen(RunStepEvent.class, event -> {
            if (FunctionMinifier.NAME.equals(event.step.getName())) event.cancel();
        });
        ShaderProgram program = compileTextured(compiler);
        assertEquals(Utils.TEXTURED_VERTEX, program.getVertexSource());
        assertEquals("varying vec2 a;" +
                        "vec4 tint(vec4 d){return d*vec4(1,.5,.5,1);}" +
                        "uniform sampler2D c;" +
                        "void main(){gl_FragColor=tint(texture2D(c,a));}",
                program.getFragmentSource());
    }

    @Test
    void testFunctionRenamingWithoutVariableRenaming() {
        GlslCompiler compiler = new GlslCompiler();
        compiler.listen(RunStepEvent.class, event -> {
            if (VariableMinifier.NAME.equals(event.step.getName())) event.cancel();
        });
        ShaderProgram program = compileTextured(compiler);
        assertEquals("varying vec2 uv;" +
                        "vec4 a(vec4 color){return color*vec4(1,.5,.5,1);}" +
                        "uniform sampler2D tex;" +
                        "void main(){gl_FragColor=a(texture2D(tex,uv));}",
                program.getFragmentSource());
        assertEquals("tex", program.uniformMap.get("tex").shortName);
        assertEquals("position", program.attributeMap.get("position").shortName);
    }

    @Test
    void testInternalRenaming() {
        CompilerOptions options = new CompilerOptions();
        options.variableRenaming = CompilerOptions.Level.INTERNAL;
        GlslCompiler compiler = new GlslCompiler(options);
        ShaderProgram program = compiler.compile(compiler.loadShaders(
                "attribute vec3 pos;varying vec3 v;void main(){v=pos;}",
                "varying vec3 v;void main(){gl_FragColor=vec4(v,1.);}"));
        assertEquals("attribute vec3 pos;varying vec3 a;void main(){a=pos;}", program.getVertexSource());
        assertEquals("varying vec3 a;void main(){gl_FragColor=vec4(a,1);}", program.getFragmentSource());
        assertEquals("pos", program.attributeMap.get("pos").shortName);
    }

    @Test
    void testEverythingOff() {
        GlslCompiler compiler = new GlslCompiler(allOff());
        ShaderProgram program = compiler.compile(compiler.loadShaders(
                "attribute vec3 p;void unused(){}void main(){if(true){gl_Position=vec4(p,1.0);}}",
                "void main(){}"));
        assertEquals("attribute vec3 p;void unused(){}void main(){if(true){gl_Position=vec4(p,1.);}}",
                program.getVertexSource());
        assertEquals("p", program.attributeMap.get("p").shortName);
    }

    @Test
    void testPrettyPrint() {
        CompilerOptions options = allOff();
        options.prettyPrint = true;
        GlslCompiler compiler = new GlslCompiler(options);
        ShaderProgram program = compiler.compile(compiler.loadShaders("void main(){x=1;}", "void main(){}"));
        assertEquals("\n//! VERTEX\nvoid main() {\n  x = 1;\n}\n//! FRAGMENT\nvoid main() {}",
                GlslCompiler.formatOutput(program));
    }

    @Test
    void testLevels() {
        assertEquals(CompilerOptions.Level.INTERNAL, CompilerOptions.Level.parse("internal"));
        assertEquals(CompilerOptions.Level.ALL, CompilerOptions.Level.parse("ALL"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CompilerOptions.Level.parse("maybe"));
        assertTrue(e.getMessage().startsWith("invalid level: maybe"));
    }
}
