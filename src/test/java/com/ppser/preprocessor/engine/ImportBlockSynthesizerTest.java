package com.ppser.preprocessor.engine;

import com.ppser.preprocessor.config.PreprocessorConfig;
import com.ppser.preprocessor.model.SymbolOwner;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ImportBlockSynthesizer and CallRegistry.
 */
class ImportBlockSynthesizerTest {

    @Test
    void testImportBlockLayout() {
        CallRegistry registry = new CallRegistry();
        registry.record(SymbolOwner.SERIALIZATION_MODULE, "fs_write_field");
        registry.record(SymbolOwner.SERIALIZATION_MODULE, "fs_read_field");
        registry.record(SymbolOwner.PREAMBLE_HELPER, "ppser_get_mode");

        String block = new ImportBlockSynthesizer(PreprocessorConfig.defaults()).synthesize(registry).orElseThrow();

        assertThat(block).isEqualTo("\n"
                + "#ifdef SERIALIZE\n"
                + "USE m_serialize, ONLY: fs_read_field, fs_write_field\n"
                + "USE utils_ppser, ONLY: ppser_get_mode, ppser_savepoint, ppser_serializer, ppser_serializer_ref, "
                + "ppser_intlength, ppser_reallength, ppser_realtype\n"
                + "#endif\n"
                + "\n");
    }

    @Test
    void testHelperOnlyRegistryOmitsModuleImport() {
        CallRegistry registry = new CallRegistry();
        registry.record(SymbolOwner.PREAMBLE_HELPER, "ppser_set_mode");
        PreprocessorConfig config = PreprocessorConfig.builder()
                .guardSymbol(null)
                .helperModule("my_helpers")
                .build();

        String block = new ImportBlockSynthesizer(config).synthesize(registry).orElseThrow();

        assertThat(block).doesNotContain("#ifdef", "m_serialize")
                .startsWith("\nUSE my_helpers, ONLY: ppser_set_mode, ppser_savepoint,");
    }

    @Test
    void testEmptyRegistryImportsNothing() {
        assertThat(new ImportBlockSynthesizer(PreprocessorConfig.defaults()).synthesize(CallRegistry.empty())).isEmpty();
    }

    @Test
    void testAnchorDetection() {
        assertThat(ImportBlockSynthesizer.isAnchor("  IMPLICIT NONE")).isTrue();
        assertThat(ImportBlockSynthesizer.isAnchor("implicit   none ! comment")).isTrue();
        assertThat(ImportBlockSynthesizer.isAnchor("! implicit none")).isFalse();
        assertThat(ImportBlockSynthesizer.isAnchor("implicit real(a-h)")).isFalse();
    }

    @Test
    void testRegistryDeduplicatesAndSorts() {
        CallRegistry registry = new CallRegistry();
        registry.record(SymbolOwner.SERIALIZATION_MODULE, "fs_write_field");
        registry.record(SymbolOwner.SERIALIZATION_MODULE, "fs_create_savepoint");
        registry.record(SymbolOwner.SERIALIZATION_MODULE, "fs_write_field");

        assertThat(registry.getModuleSymbols()).containsExactly("fs_create_savepoint", "fs_write_field");
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.contains("fs_write_field")).isTrue();
    }

    @Test
    void testFrozenRegistryRejectsRecording() {
        CallRegistry registry = new CallRegistry();
        registry.record(SymbolOwner.PREAMBLE_HELPER, "ppser_initialize");

        CallRegistry frozen = registry.freeze();
        registry.record(SymbolOwner.PREAMBLE_HELPER, "ppser_finalize");

        assertThat(frozen.isFrozen()).isTrue();
        assertThat(frozen.getHelperSymbols()).containsExactly("ppser_initialize");
        assertThatThrownBy(() -> frozen.record(SymbolOwner.PREAMBLE_HELPER, "ppser_finalize"))
                .isInstanceOf(IllegalStateException.class);
    }
}
