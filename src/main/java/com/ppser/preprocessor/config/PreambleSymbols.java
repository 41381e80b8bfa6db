package com.ppser.preprocessor.config;

import java.util.List;

import lombok.experimental.UtilityClass;

/**
 * Variables and constants defined by the generated preamble helper module.
 */
@UtilityClass
public class PreambleSymbols {

    public static final String SAVEPOINT = "ppser_savepoint";
    public static final String SERIALIZER = "ppser_serializer";
    public static final String SERIALIZER_REF = "ppser_serializer_ref";
    public static final String INT_LENGTH = "ppser_intlength";
    public static final String REAL_LENGTH = "ppser_reallength";
    public static final String REAL_TYPE = "ppser_realtype";

    /**
     * Always imported alongside the helper calls, in this order.
     */
    public static final List<String> FIXED_IMPORTS = List.of(
            SAVEPOINT, SERIALIZER, SERIALIZER_REF, INT_LENGTH, REAL_LENGTH, REAL_TYPE);
}
