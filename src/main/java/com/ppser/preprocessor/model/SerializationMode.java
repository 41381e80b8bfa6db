package com.ppser.preprocessor.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Named serialization modes accepted by the MODE directive.
 */
public enum SerializationMode {
    WRITE(0),
    READ(1),
    CPU(0),
    GPU(1);

    private final int code;

    SerializationMode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static Optional<SerializationMode> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
