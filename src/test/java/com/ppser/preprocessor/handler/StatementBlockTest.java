package com.ppser.preprocessor.handler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StatementBlockTest {

    @Test
    void testUnconditional() {
        String out = StatementBlock.unconditional()
                .line("a = 1")
                .nested(1, "b = 2")
                .render();

        assertThat(out).isEqualTo("a = 1\n  b = 2\n");
    }

    @Test
    void testConditional() {
        String out = new StatementBlock("x > 0")
                .line("a = 1")
                .blank()
                .render();

        assertThat(out).isEqualTo("IF (x > 0) THEN\n  a = 1\n  \nENDIF\n");
    }

    @Test
    void testEmptyConditionalBlock() {
        assertThat(new StatementBlock("c").render()).isEqualTo("IF (c) THEN\nENDIF\n");
    }
}
