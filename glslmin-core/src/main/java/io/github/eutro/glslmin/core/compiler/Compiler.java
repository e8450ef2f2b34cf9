package io.github.eutro.glslmin.core.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs {@link CompilerStep}s over a {@link ShaderProgram}.
 * <p>
 * Phases run in {@link CompilerPhase} order and the steps of a phase in registration order.
 * Before a step runs, every registered step it depends on is run, recursively. Each step
 * runs at most once per compiler.
 */
public class Compiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(Compiler.class);

    private final ShaderProgram program;
    private final Map<CompilerPhase, List<CompilerStep>> phaseSteps = new EnumMap<>(CompilerPhase.class);
    private final Map<String, CompilerStep> registeredSteps = new HashMap<>();
    private final Map<String, Object> stepOutputs = new HashMap<>();

    public Compiler(ShaderProgram program) {
        this.program = program;
        for (CompilerPhase phase : CompilerPhase.values()) {
            phaseSteps.put(phase, new ArrayList<>());
        }
    }

    public ShaderProgram getProgram() {
        return program;
    }

    /**
     * Register a step to run in a phase.
     *
     * @param phase The phase.
     * @param step  The step.
     */
    public void registerStep(CompilerPhase phase, CompilerStep step) {
        phaseSteps.get(phase).add(step);
        registeredSteps.put(step.getName(), step);
    }

    public List<CompilerStep> getSteps(CompilerPhase phase) {
        return Collections.unmodifiableList(phaseSteps.get(phase));
    }

    public Map<String, Object> getStepOutputs() {
        return Collections.unmodifiableMap(stepOutputs);
    }

    /**
     * Run every registered step.
     *
     * @return The compiled program.
     * @throws IllegalStateException If the steps' dependencies form a cycle.
     */
    public ShaderProgram compileProgram() {
        for (CompilerPhase phase : CompilerPhase.values()) {
            for (CompilerStep step : phaseSteps.get(phase)) {
                runStep(step, new ArrayList<>());
            }
        }
        return program;
    }

    private void runStep(CompilerStep step, List<String> stack) {
        String name = step.getName();
        if (stack.contains(name)) {
            stack.add(name);
            throw new IllegalStateException("Circular dependency in compiler steps.  " + String.join("->", stack));
        }
        if (stepOutputs.containsKey(name)) return;
        stack.add(name);
        for (String dependency : step.getDependencies()) {
            CompilerStep dependencyStep = registeredSteps.get(dependency);
            if (dependencyStep != null) {
                runStep(dependencyStep, stack);
            }
        }
        stack.remove(stack.size() - 1);
        LOGGER.debug("Running compiler step {}", name);
        stepOutputs.put(name, step.performStep(stepOutputs, program));
    }
}
