package com.ppser.preprocessor.engine;

/**
 * The two passes over a file.
 */
public enum Pass {
    /**
     * Collects referenced API symbols and INTENT(IN) removal requests; produces no output.
     */
    ANALYZE,

    /**
     * Expands directives and materializes guards, imports and declaration rewrites.
     */
    GENERATE
}
