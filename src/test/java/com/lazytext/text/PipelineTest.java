package com.lazytext.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PipelineTest {

    @Test
    @DisplayName("pre 按顺序执行，post 按逆序执行")
    void testStackDiscipline() {
        List<String> calls = new ArrayList<>();
        Pipeline pipeline = Pipeline.of(recording("a", calls), recording("b", calls), recording("c", calls));

        assertEquals("x+a+b+c", pipeline.pre("x"));
        assertEquals("x-c-b-a", pipeline.post("x"));
        assertEquals(List.of("pre:a", "pre:b", "pre:c", "post:c", "post:b", "post:a"), calls);
    }

    @Test
    @DisplayName("互逆步骤组成的流水线端到端可逆")
    void testSelfInverse() {
        Pipeline pipeline = Pipeline.of(
            LineTransform.of(line -> line.replace("&", " &amp; "), line -> line.replace(" &amp; ", "&")),
            new CharLevelSegmenter("@@"));

        String line = "fish&chips are tasty";
        String processed = pipeline.pre(line);

        assertEquals("f i s h @@ & a m p ; @@ c h i p s @@ a r e @@ t a s t y", processed);
        assertEquals(line, pipeline.post(processed));
    }

    @Test
    void testEmptyPipelineIsIdentity() {
        Pipeline pipeline = new Pipeline(List.of());

        assertEquals(0, pipeline.size());
        assertEquals(" keep  me ", pipeline.pre(" keep  me "));
        assertEquals(" keep  me ", pipeline.post(" keep  me "));
    }

    @Test
    @DisplayName("步骤抛出的异常原样传播，后续步骤不执行")
    void testFailingStepPropagates() {
        IllegalStateException failure = new IllegalStateException("boom");
        List<String> calls = new ArrayList<>();
        Pipeline pipeline = Pipeline.of(
            LineTransform.of(line -> {
                throw failure;
            }, line -> line),
            recording("after", calls));

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> pipeline.pre("x"));
        assertSame(failure, thrown);
        assertEquals(List.of(), calls);
    }

    @Test
    void testNullStepsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Pipeline(null));
    }

    private LineTransform recording(String name, List<String> calls) {
        return LineTransform.of(
            line -> {
                calls.add("pre:" + name);
                return line + "+" + name;
            },
            line -> {
                calls.add("post:" + name);
                return line + "-" + name;
            });
    }
}
