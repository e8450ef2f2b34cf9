package io.github.eutro.glslmin.test;

import io.github.eutro.glslmin.core.ast.visit.CallGraphVisitor;
import io.github.eutro.glslmin.core.parse.GlslParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CallGraphVisitorTest {
    @Test
    void testCallGraph() {
        Map<String, List<String>> graph = CallGraphVisitor.getCallGraph(GlslParser.parse(
                "void foo(){bar();vec2(1);}void bar(){}void bar(int x){foo();}float z=foo();"));
        assertEquals(Map.of(
                CallGraphVisitor.ROOT_NAME, List.of("foo"),
                "foo", List.of("bar", "vec2"),
                "bar", List.of("foo")
        ), graph);
    }
}
