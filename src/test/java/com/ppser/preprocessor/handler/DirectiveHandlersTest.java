package com.ppser.preprocessor.handler;

import com.ppser.preprocessor.config.ApiSymbolTable;
import com.ppser.preprocessor.config.PreprocessorConfig;
import com.ppser.preprocessor.engine.DirectiveDispatcher;
import com.ppser.preprocessor.engine.Pass;
import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.exception.DirectiveException;
import com.ppser.preprocessor.exception.ErrorKind;
import com.ppser.preprocessor.model.ApiOperation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the simple directive handlers, driven through the dispatcher.
 */
class DirectiveHandlersTest {

    private final DirectiveDispatcher dispatcher = DirectiveDispatcher.withDefaultHandlers();
    private PreprocessContext context = newContext(PreprocessorConfig.builder().realKind("wp").build());

    @Test
    void testInit() {
        String out = expand("INIT directory='.' prefix='Field'");

        assertThat(out).isEqualTo("""
            PRINT *, '>>>>>>>>>>>>>>>>>><<<<<<<<<<<<<<<<<<'
            PRINT *, '>>> WARNING: SERIALIZATION IS ON <<<'
            PRINT *, '>>>>>>>>>>>>>>>>>><<<<<<<<<<<<<<<<<<'

            ! setup serialization environment
            call ppser_initialize(directory='.',prefix='Field')
            """);
        assertThat(context.getCallRegistry().getHelperSymbols()).containsExactly("ppser_initialize");
    }

    @Test
    void testInitWithConditionForwardsOnlyLeadingArguments() {
        String out = expand("INI prefix='F' IF lser");

        assertThat(out).startsWith("IF (lser) THEN\n  PRINT *,")
                .contains("\n  \n")
                .endsWith("  call ppser_initialize(prefix='F')\nENDIF\n");
    }

    @Test
    void testOptionMapsVerbosity() {
        assertThat(expand("OPTION verbosity=on rprecision=1e-6"))
                .isEqualTo("call fs_Option(verbosity=1, rprecision=1e-6)\n");
        assertThat(expand("OPT VERBOSITY=Off"))
                .isEqualTo("call fs_Option(VERBOSITY=0)\n");
    }

    @Test
    void testOptionWithConditionIsIndented() {
        assertThat(expand("OPTION verbosity=on IF ldebug"))
                .isEqualTo("IF (ldebug) THEN\n  call fs_Option(verbosity=1)\nENDIF\n");
    }

    @Test
    void testOptionRejectsBareArguments() {
        assertThatThrownBy(() -> expand("OPTION verbose"))
                .isInstanceOf(DirectiveException.class)
                .hasMessage("Must specify a list of key=value pairs");
    }

    @Test
    void testMetainfoPairsThenNames() {
        assertThat(expand("METAINFO dt nx=ie")).isEqualTo("""
            call fs_add_serializer_metainfo(ppser_serializer, "nx", ie)
            call fs_add_serializer_metainfo(ppser_serializer, "dt", dt)
            """);
    }

    @Test
    void testVerbatim() {
        assertThat(expand("VERBATIM PRINT *, 'a  b'")).isEqualTo("PRINT *, 'a  b'\n");
        assertThat(context.getCallRegistry().isEmpty()).isTrue();
    }

    @Test
    void testZero() {
        assertThat(expand("ZERO a b c IF lfirst")).isEqualTo("""
            IF (lfirst) THEN
              a = 0.0_wp
              b = 0.0_wp
              c = 0.0_wp
            ENDIF
            """);
    }

    @Test
    void testZeroRejectsKeyValues() {
        assertThatThrownBy(() -> expand("ZERO a=b"))
                .isInstanceOf(DirectiveException.class)
                .hasMessage("Must specify a list of fields");
    }

    @Test
    void testSavepoint() {
        assertThat(expand("SAVEPOINT step.start t=ntstep IF lflag")).isEqualTo("""
            IF (lflag) THEN
              call fs_create_savepoint('step.start', ppser_savepoint)
              call fs_add_savepoint_metainfo(ppser_savepoint, 't', ntstep)
            ENDIF
            """);
        assertThat(context.getCallRegistry().getModuleSymbols())
                .containsExactly("fs_add_savepoint_metainfo", "fs_create_savepoint");
    }

    @Test
    void testSavepointRequiresOneName() {
        assertThatThrownBy(() -> expand("SAVEPOINT a b"))
                .isInstanceOf(DirectiveException.class)
                .hasMessage("Must specify a name and a list of key=value pairs")
                .extracting(e -> ((DirectiveException) e).getKind())
                .isEqualTo(ErrorKind.SEMANTIC);
    }

    @Test
    void testModeNames() {
        assertThat(expand("MODE write")).isEqualTo("call ppser_set_mode(0)\n");
        assertThat(expand("MODE read")).isEqualTo("call ppser_set_mode(1)\n");
        assertThat(expand("MOD CPU")).isEqualTo("call ppser_set_mode(0)\n");
        assertThat(expand("MODE gpu")).isEqualTo("call ppser_set_mode(1)\n");
        assertThat(expand("MODE imode")).isEqualTo("call ppser_set_mode(imode)\n");
    }

    @Test
    void testModeRequiresExactlyOneMode() {
        assertThatThrownBy(() -> expand("MODE"))
                .isInstanceOf(DirectiveException.class)
                .hasMessage("Must specify exactly one mode");
        assertThatThrownBy(() -> expand("MODE read write"))
                .isInstanceOf(DirectiveException.class);
    }

    @Test
    void testCleanup() {
        assertThat(expand("CLEANUP")).isEqualTo("! cleanup serialization environment\ncall ppser_finalize()\n");
    }

    @Test
    void testOnOffAndRegisterTracers() {
        assertThat(expand("ON")).isEqualTo("call fs_enable_serialization()\n");
        assertThat(expand("OFF")).isEqualTo("call fs_disable_serialization()\n");
        assertThat(expand("REGISTERTRACERS")).isEqualTo("call fs_RegisterAllTracers()\n");
    }

    @Test
    void testKeywordIsCaseInsensitive() {
        assertThat(expand("zero x")).isEqualTo("x = 0.0_wp\n");
    }

    @Test
    void testUnknownDirective() {
        assertThatThrownBy(() -> expand("FROB x"))
                .isInstanceOf(DirectiveException.class)
                .hasMessage("Unknown directive encountered")
                .extracting(e -> ((DirectiveException) e).getKind())
                .isEqualTo(ErrorKind.SYNTAX);
    }

    @Test
    void testBareMarkerIsKept() {
        assertThat(dispatcher.dispatch("  !$SER   \n", "", context)).isEqualTo("  !$SER   \n");
    }

    @Test
    void testSymbolOverrides() {
        ApiSymbolTable symbols = ApiSymbolTable.builder()
                .symbol(ApiOperation.SET_MODE, "my_set_mode")
                .build();
        context = newContext(PreprocessorConfig.builder().symbols(symbols).build());

        assertThat(expand("MODE read")).isEqualTo("call my_set_mode(1)\n");
        assertThat(context.getCallRegistry().contains("my_set_mode")).isTrue();
        assertThat(context.getCallRegistry().contains("ppser_set_mode")).isFalse();
    }

    @Test
    void testRegistryRequiresEveryDirective() {
        assertThatThrownBy(() -> new DirectiveHandlerRegistry(List.of(new ZeroDirectiveHandler())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No handler registered");
    }

    private String expand(String directiveText) {
        return dispatcher.dispatch("!$SER " + directiveText + "\n", directiveText, context);
    }

    private static PreprocessContext newContext(PreprocessorConfig config) {
        return new PreprocessContext("test.f90", config, Pass.GENERATE);
    }
}
