package com.ppser.preprocessor.handler;

import com.ppser.preprocessor.config.PreprocessorConfig;
import com.ppser.preprocessor.engine.DirectiveDispatcher;
import com.ppser.preprocessor.engine.Pass;
import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.exception.DirectiveException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TracerDirectiveHandler.
 */
class TracerDirectiveHandlerTest {

    private final DirectiveDispatcher dispatcher = DirectiveDispatcher.withDefaultHandlers();
    private final PreprocessContext context = new PreprocessContext("test.f90", PreprocessorConfig.defaults(), Pass.ANALYZE);

    @Test
    void testSelections() {
        assertThat(expand("TRACER qv#tens@nnew $1-ntracer %all")).isEqualTo("""
            call ppser_write_tracer_by_name('qv', stype='tens', timelevel=nnew)
            call ppser_write_tracer_bx_idx(1, ntracer, stype='')
            call ppser_write_tracer_all(stype='')
            """);
        assertThat(context.getCallRegistry().getHelperSymbols()).containsExactly(
                "ppser_write_tracer_all", "ppser_write_tracer_bx_idx", "ppser_write_tracer_by_name");
    }

    @Test
    void testCondition() {
        assertThat(expand("TRA $3@nnow IF ltrace")).isEqualTo("""
            IF (ltrace) THEN
              call ppser_write_tracer_bx_idx(3, stype='', timelevel=nnow)
            ENDIF
            """);
    }

    @Test
    void testInvalidSpecification() {
        assertThatThrownBy(() -> expand("TRACER qv#bogus"))
                .isInstanceOf(DirectiveException.class)
                .hasMessage("Tracer specification qv#bogus is invalid");
    }

    private String expand(String directiveText) {
        return dispatcher.dispatch("!$SER " + directiveText + "\n", directiveText, context);
    }
}
