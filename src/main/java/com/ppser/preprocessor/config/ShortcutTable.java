package com.ppser.preprocessor.config;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import lombok.experimental.UtilityClass;

/**
 * Dimension/halo shortcuts for REGISTER. Every entry expands to twelve arguments:
 * four sizes followed by eight halo widths.
 */
@UtilityClass
public class ShortcutTable {

    private static final Map<String, List<String>> SHORTCUTS = Map.ofEntries(
        Map.entry("", split("1 1 1 1 0 0 0 0 0 0 0 0")),
        Map.entry("I", split("ie 1 1 1 nboundlines nboundlines 0 0 0 0 0 0")),
        Map.entry("J", split("1 je 1 1 0 0 nboundlines nboundlines 0 0 0 0")),
        Map.entry("J2", split("1 je 2 1 0 0 nboundlines nboundlines 0 0 0 0")),
        Map.entry("K", split("1 1 ke 1 0 0 0 0 0 0 0 0")),
        Map.entry("K1", split("1 1 ke1 1 0 0 0 0 0 1 0 0")),
        Map.entry("IJ", split("ie je 1 1 nboundlines nboundlines nboundlines nboundlines 0 0 0 0")),
        Map.entry("IJ3", split("ie je 3 1 nboundlines nboundlines nboundlines nboundlines 0 0 0 0")),
        Map.entry("IK", split("ie 1 ke 1 nboundlines nboundlines 0 0 0 0 0 0")),
        Map.entry("IK1", split("ie 1 ke1 1 nboundlines nboundlines 0 0 0 1 0 0")),
        Map.entry("JK", split("1 je ke 1 0 0 nboundlines nboundlines 0 0 0 0")),
        Map.entry("JK1", split("1 je ke1 1 0 0 nboundlines nboundlines 0 1 0 0")),
        Map.entry("IJK", split("ie je ke 1 nboundlines nboundlines nboundlines nboundlines 0 0 0 0")),
        Map.entry("IJK1", split("ie je ke1 1 nboundlines nboundlines nboundlines nboundlines 0 1 0 0"))
    );

    /**
     * Expansion for a mnemonic such as {@code IJK}; the empty mnemonic is the scalar layout.
     */
    public static Optional<List<String>> expand(String mnemonic) {
        if (mnemonic == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(SHORTCUTS.get(mnemonic.toUpperCase(Locale.ROOT)));
    }

    public static boolean isShortcut(String mnemonic) {
        return expand(mnemonic).isPresent();
    }

    private static List<String> split(String spec) {
        return List.of(spec.split(" "));
    }
}
