package com.ppser.preprocessor.service;

public enum PreprocessStatus {
    /**
     * Output written (or printed).
     */
    WRITTEN,

    /**
     * Existing output already had identical content and was left untouched.
     */
    UNCHANGED,

    /**
     * Output is newer than the input; nothing done.
     */
    SKIPPED,

    FAILED
}
