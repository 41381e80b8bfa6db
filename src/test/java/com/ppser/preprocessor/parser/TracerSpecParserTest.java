package com.ppser.preprocessor.parser;

import com.ppser.preprocessor.exception.DirectiveException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TracerSpecParser.
 */
class TracerSpecParserTest {

    private final TracerSpecParser parser = new TracerSpecParser();

    @Test
    void testPlainName() {
        TracerSpec spec = parser.parseSpec("TRACER", "qv");

        assertThat(spec.getSelection()).isEqualTo(TracerSpec.Selection.NAME);
        assertThat(spec.getName()).isEqualTo("qv");
        assertThat(spec.getType()).isEmpty();
        assertThat(spec.getTimeLevel()).isEmpty();
    }

    @Test
    void testNameWithTypeAndTimeLevel() {
        TracerSpec spec = parser.parseSpec("TRACER", "qc#tens@nnew");

        assertThat(spec.getName()).isEqualTo("qc");
        assertThat(spec.getType()).isEqualTo("tens");
        assertThat(spec.getTimeLevel()).contains("nnew");
    }

    @Test
    void testAll() {
        TracerSpec spec = parser.parseSpec("TRACER", "%ALL#bd");

        assertThat(spec.getSelection()).isEqualTo(TracerSpec.Selection.ALL);
        assertThat(spec.getType()).isEqualTo("bd");
    }

    @Test
    void testIndexRange() {
        TracerSpec spec = parser.parseSpec("TRACER", "$1-ntracer@nnow");

        assertThat(spec.getSelection()).isEqualTo(TracerSpec.Selection.INDEX);
        assertThat(spec.getIndices()).containsExactly("1", "ntracer");
        assertThat(spec.getTimeLevel()).contains("nnow");
    }

    @Test
    void testSingleIndex() {
        TracerSpec spec = parser.parseSpec("TRACER", "$idx(3)");

        assertThat(spec.getIndices()).containsExactly("idx(3)");
    }

    @Test
    void testUnknownTypeFails() {
        assertThatThrownBy(() -> parser.parseSpec("TRACER", "qv#foo"))
                .isInstanceOf(DirectiveException.class)
                .hasMessage("Tracer specification qv#foo is invalid");
    }

    @Test
    void testGarbageFails() {
        assertThatThrownBy(() -> parser.parseSpec("TRACER", "q-v"))
                .isInstanceOf(DirectiveException.class);
    }

    @Test
    void testParseWithCondition() {
        TracerArguments args = parser.parse("TRACER", List.of("qv", "%all", "IF", "ltrace"));

        assertThat(args.getSpecs()).hasSize(2);
        assertThat(args.getCondition()).contains("ltrace");
    }

    @Test
    void testParseWithDanglingCondition() {
        assertThatThrownBy(() -> parser.parse("TRACER", List.of("qv", "IF")))
                .isInstanceOf(DirectiveException.class)
                .hasMessage("IF must be followed by a condition");
    }
}
