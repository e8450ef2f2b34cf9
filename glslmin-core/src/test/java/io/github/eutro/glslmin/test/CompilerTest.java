package io.github.eutro.glslmin.test;

import io.github.eutro.glslmin.core.compiler.Compiler;
import io.github.eutro.glslmin.core.compiler.CompilerPhase;
import io.github.eutro.glslmin.core.compiler.CompilerStep;
import io.github.eutro.glslmin.core.compiler.ShaderProgram;
import io.github.eutro.glslmin.core.parse.GlslParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerTest {
    static class RecordingStep implements CompilerStep {
        private final String name;
        private final List<String> dependencies;
        private final List<String> log;

        RecordingStep(String name, List<String> log, String... dependencies) {
            this.name = name;
            this.log = log;
            this.dependencies = Arrays.asList(dependencies);
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public List<String> getDependencies() {
            return dependencies;
        }

        @Override
        public Object performStep(Map<String, Object> stepOutputs, ShaderProgram program) {
            log.add(name);
            return name + " output";
        }
    }

    private static ShaderProgram emptyProgram() {
        return new ShaderProgram(GlslParser.parse("void main(){}"), GlslParser.parse("void main(){}"));
    }

    @Test
    void testOrder() {
        List<String> log = new ArrayList<>();
        Compiler compiler = new Compiler(emptyProgram());
        compiler.registerStep(CompilerPhase.MINIFICATION, new RecordingStep("minStep", log));
        compiler.registerStep(CompilerPhase.OPTIMIZATION, new RecordingStep("opStep1", log));
        compiler.registerStep(CompilerPhase.OPTIMIZATION, new RecordingStep("opStep2", log));
        compiler.compileProgram();
        assertEquals(Arrays.asList("opStep1", "opStep2", "minStep"), log);
        assertEquals("minStep output", compiler.getStepOutputs().get("minStep"));
    }

    @Test
    void testDependencies() {
        List<String> log = new ArrayList<>();
        Compiler compiler = new Compiler(emptyProgram());
        compiler.registerStep(CompilerPhase.OPTIMIZATION, new RecordingStep("opStep1", log, "minStep", "unregistered"));
        compiler.registerStep(CompilerPhase.OPTIMIZATION, new RecordingStep("opStep2", log, "opStep1"));
        compiler.registerStep(CompilerPhase.MINIFICATION, new RecordingStep("minStep", log));
        compiler.compileProgram();
        assertEquals(Arrays.asList("minStep", "opStep1", "opStep2"), log);
        assertFalse(compiler.getStepOutputs().containsKey("unregistered"));
    }

    @Test
    void testCircularDependency() {
        List<String> log = new ArrayList<>();
        Compiler compiler = new Compiler(emptyProgram());
        compiler.registerStep(CompilerPhase.OPTIMIZATION, new RecordingStep("opStep2", log, "opStep1"));
        compiler.registerStep(CompilerPhase.OPTIMIZATION, new RecordingStep("opStep1", log, "minStep"));
        compiler.registerStep(CompilerPhase.MINIFICATION, new RecordingStep("minStep", log, "opStep2"));
        IllegalStateException e = assertThrows(IllegalStateException.class, compiler::compileProgram);
        assertEquals("Circular dependency in compiler steps.  opStep2->opStep1->minStep->opStep2", e.getMessage());
        assertTrue(log.isEmpty());
    }
}
