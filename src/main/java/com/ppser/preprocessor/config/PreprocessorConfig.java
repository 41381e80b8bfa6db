package com.ppser.preprocessor.config;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration consumed by the preprocessing engine and its file writer.
 */
@Value
@Builder(toBuilder = true)
public class PreprocessorConfig {

    public static final String DEFAULT_GUARD = "SERIALIZE";

    /**
     * Preprocessor symbol wrapped around generated code; null or blank disables guards.
     */
    @Builder.Default
    String guardSymbol = DEFAULT_GUARD;

    /**
     * Fortran kind used in ZERO assignments ({@code 0.0_<realKind>}).
     */
    @Builder.Default
    String realKind = "ireals";

    @Builder.Default
    String serializationModule = "m_serialize";

    @Builder.Default
    String helperModule = "utils_ppser";

    @Builder.Default
    ApiSymbolTable symbols = ApiSymbolTable.defaults();

    /**
     * When false, an existing output file with identical content is left untouched.
     */
    @Builder.Default
    boolean writeIdentical = true;

    public static PreprocessorConfig defaults() {
        return builder().build();
    }

    public boolean isGuardEnabled() {
        return guardSymbol != null && !guardSymbol.isBlank();
    }

    public String guardOpen() {
        return "#ifdef " + guardSymbol + "\n";
    }

    public String guardElse() {
        return "#else\n";
    }

    public String guardClose() {
        return "#endif\n";
    }
}
