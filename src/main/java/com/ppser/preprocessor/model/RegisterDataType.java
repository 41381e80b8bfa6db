package com.ppser.preprocessor.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Declared field types accepted by REGISTER, with the two arguments each expands to.
 */
public enum RegisterDataType {
    INTEGER("'int'", "ppser_intlength"),
    REAL("ppser_realtype", "ppser_reallength");

    private final String typeArgument;
    private final String lengthArgument;

    RegisterDataType(String typeArgument, String lengthArgument) {
        this.typeArgument = typeArgument;
        this.lengthArgument = lengthArgument;
    }

    public List<String> getArguments() {
        return List.of(typeArgument, lengthArgument);
    }

    /**
     * Resolves {@code integer}, {@code real}, optionally quoted, ignoring case.
     */
    public static Optional<RegisterDataType> fromDeclaration(String declared) {
        if (declared == null) {
            return Optional.empty();
        }
        String name = declared;
        if (name.length() >= 2) {
            char first = name.charAt(0);
            if ((first == '\'' || first == '"') && name.charAt(name.length() - 1) == first) {
                name = name.substring(1, name.length() - 1);
            }
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "integer" -> Optional.of(INTEGER);
            case "real" -> Optional.of(REAL);
            default -> Optional.empty();
        };
    }
}
