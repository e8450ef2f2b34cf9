package io.github.eutro.glslmin.test;

import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.transform.FunctionRenameTransformer;
import io.github.eutro.glslmin.core.ast.transform.IdentifierRenameTransformer;
import io.github.eutro.glslmin.core.ast.transform.QualifierTransformer;
import io.github.eutro.glslmin.core.ast.transform.ReplaceAttributeTransformer;
import io.github.eutro.glslmin.core.gen.Generator;
import io.github.eutro.glslmin.core.parse.GlslParser;
import io.github.eutro.glslmin.core.parse.StartRule;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TransformersTest {
    @Test
    void testQualifier() {
        Utils.assertTransforms(new QualifierTransformer("varying", "uniform"),
                "varying vec2 v;attribute vec2 a;void main(){}",
                "uniform vec2 v;attribute vec2 a;void main(){}");
    }

    @Test
    void testRenameVariable() {
        Node root = GlslParser.parse("float x;void main(){x=x+1.;}");
        assertEquals("float y;void main(){y=y+1.;}",
                Generator.render(IdentifierRenameTransformer.renameVariable(root, "x", "y")));
    }

    @Test
    void testFunctionRename() {
        Node root = GlslParser.parse("float f(int a);float f(float a);float f(int a){return 1.;}void main(){f(1);f(1,2);}");
        Node target = GlslParser.parse("float f(int)", StartRule.FUNCTION_PROTOTYPE);
        assertTrue(FunctionRenameTransformer.functionPrototypeEquals(Utils.statement(root, 0), target));
        assertFalse(FunctionRenameTransformer.functionPrototypeEquals(Utils.statement(root, 1), target));
        assertEquals("float g(int a);float f(float a);float g(int a){return 1.;}void main(){g(1);f(1,2);}",
                Generator.render(new FunctionRenameTransformer(target, "g").transformNode(root)));
    }

    @Test
    void testReplaceAttributes() {
        Map<String, List<Double>> replacements = new LinkedHashMap<>();
        replacements.put("pos", Arrays.asList(1., 2.));
        replacements.put("w", Collections.singletonList(3.));
        assertEquals("uniform float u;void main(){gl_Position=vec4(vec2(1.,2.),3.,u);}",
                ReplaceAttributeTransformer.replaceAttributes(
                        "attribute vec2 pos;attribute float w;uniform float u;" +
                                "void main(){gl_Position=vec4(pos,w,u);}",
                        replacements));
    }

    @Test
    void testReplaceOneOfSeveralAttributes() {
        Map<String, List<Double>> replacements = Collections.singletonMap("bar", Arrays.asList(1., 2., 3.));
        assertEquals("attribute vec3 foo,raz;void main(){gl_Position=vec4(foo.x,vec3(1.,2.,3.));}",
                ReplaceAttributeTransformer.replaceAttributes(
                        "attribute vec3 foo, bar, raz;void main() {  gl_Position = vec4(foo.x, bar);}",
                        replacements));
    }

    @Test
    void testReplaceAttributesParameterShadows() {
        Map<String, List<Double>> replacements = Collections.singletonMap("bar", Arrays.asList(1., 2., 3.));
        assertEquals("void main(vec3 bar){gl_Position=vec4(1.,bar);}",
                ReplaceAttributeTransformer.replaceAttributes(
                        "attribute vec3 bar;void main(vec3 bar) {  gl_Position = vec4(1., bar);}",
                        replacements));
    }

    @Test
    void testReplaceAttributesLocalRedeclaration() {
        Map<String, List<Double>> replacements = Collections.singletonMap("bar", Collections.singletonList(42.));
        assertEquals("attribute float raz,meh;void main(){float foo=42.;vec2 bar;gl_Position=vec4(1.,1.,bar);}",
                ReplaceAttributeTransformer.replaceAttributes(
                        "attribute float bar, raz, meh;" +
                                "void main() {" +
                                "  float foo = bar;" +
                                "  vec2 bar;" +
                                "  gl_Position = vec4(1., 1., bar);" +
                                "}",
                        replacements));
    }

    @Test
    void testReplaceAttributesShadowed() {
        Map<String, List<Double>> replacements = Collections.singletonMap("w", Collections.singletonList(3.));
        assertEquals("void main(){float w=2.;gl_Position=vec4(w);}",
                ReplaceAttributeTransformer.replaceAttributes(
                        "attribute float w;void main(){float w=2.;gl_Position=vec4(w);}",
                        replacements));
        assertEquals("float f(float w){return w;}",
                ReplaceAttributeTransformer.replaceAttributes(
                        "attribute float w;float f(float w){return w;}",
                        replacements));
    }

    @Test
    void testReplaceAttributesInInitializer() {
        Map<String, List<Double>> replacements = Collections.singletonMap("w", Collections.singletonList(3.));
        assertEquals("void main(){float x=3.;}",
                ReplaceAttributeTransformer.replaceAttributes(
                        "attribute float w;void main(){float x=w;}",
                        replacements));
    }

    @Test
    void testReplaceAttributesWrongType() {
        Map<String, List<Double>> replacements = Collections.singletonMap("pos", Collections.singletonList(3.));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
                ReplaceAttributeTransformer.replaceAttributes(
                        "attribute vec2 pos;void main(){gl_Position=vec4(pos,0.,1.);}",
                        replacements));
        assertTrue(e.getMessage().startsWith("Wrong type! Replacing vec2 with float for variable pos"));
    }
}
