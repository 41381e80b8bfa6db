package com.ppser.preprocessor.model;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The !$SER directive keywords. Each keyword has one or more accepted spellings,
 * matched case-insensitively.
 */
public enum Directive {
    INIT("INIT", "INI"),
    OPTION("OPTION", "OPT"),
    METAINFO("METAINFO"),
    VERBATIM("VERBATIM", "VER"),
    REGISTER("REGISTER", "REG"),
    REGISTERTRACERS("REGISTERTRACERS"),
    ZERO("ZERO", "ZER"),
    SAVEPOINT("SAVEPOINT", "SAV"),
    MODE("MODE", "MOD"),
    DATA("DATA", "DAT"),
    TRACER("TRACER", "TRA"),
    CLEANUP("CLEANUP", "CLE"),
    ON("ON"),
    OFF("OFF");

    private static final Map<String, Directive> BY_SPELLING = new HashMap<>();

    static {
        for (Directive directive : values()) {
            for (String spelling : directive.spellings) {
                BY_SPELLING.put(spelling, directive);
            }
        }
    }

    private final List<String> spellings;

    Directive(String... spellings) {
        this.spellings = List.of(spellings);
    }

    public List<String> getSpellings() {
        return spellings;
    }

    /**
     * Resolves a keyword as written in the source.
     */
    public static Optional<Directive> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SPELLING.get(keyword.toUpperCase(Locale.ROOT)));
    }
}
