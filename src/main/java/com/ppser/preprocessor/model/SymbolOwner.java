package com.ppser.preprocessor.model;

/**
 * Which module a generated symbol must be imported from.
 */
public enum SymbolOwner {
    /**
     * The Fortran serialization module (e.g. {@code m_serialize}).
     */
    SERIALIZATION_MODULE,

    /**
     * The generated preamble helper module (e.g. {@code utils_ppser}).
     */
    PREAMBLE_HELPER
}
