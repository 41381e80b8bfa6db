package com.ppser.preprocessor.engine;

import com.ppser.preprocessor.config.PreprocessorConfig;
import com.ppser.preprocessor.exception.DirectiveException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GuardWrapper.
 */
class GuardWrapperTest {

    @Test
    void testBracketsDirectiveRuns() {
        GuardWrapper guard = new GuardWrapper(PreprocessorConfig.defaults());

        assertThat(guard.transition(false)).isEmpty();
        assertThat(guard.transition(true)).isEqualTo("#ifdef SERIALIZE\n");
        assertThat(guard.transition(true)).isEmpty();
        assertThat(guard.isInsideRegion()).isTrue();
        assertThat(guard.transition(false)).isEqualTo("#endif\n");
        assertThat(guard.transition(false)).isEmpty();

        guard.verifyClosed();
    }

    @Test
    void testCustomGuardSymbol() {
        GuardWrapper guard = new GuardWrapper(PreprocessorConfig.builder().guardSymbol("SER_ON").build());

        assertThat(guard.transition(true)).isEqualTo("#ifdef SER_ON\n");
    }

    @Test
    void testDisabledGuards() {
        GuardWrapper guard = new GuardWrapper(PreprocessorConfig.builder().guardSymbol(null).build());

        assertThat(guard.transition(true)).isEmpty();
        assertThat(guard.transition(false)).isEmpty();
        guard.verifyClosed();
    }

    @Test
    void testOpenRegionAtEndFails() {
        GuardWrapper guard = new GuardWrapper(PreprocessorConfig.defaults());
        guard.transition(true);

        assertThatThrownBy(guard::verifyClosed)
                .isInstanceOf(DirectiveException.class)
                .hasMessage("Unterminated #ifdef SERIALIZE encountered");
    }
}
