package com.ppser.preprocessor.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ShortcutTable.
 */
class ShortcutTableTest {

    @Test
    void testScalarLayout() {
        assertThat(ShortcutTable.expand("")).hasValueSatisfying(
                l -> assertThat(l).containsExactly("1", "1", "1", "1", "0", "0", "0", "0", "0", "0", "0", "0"));
    }

    @Test
    void testJ2() {
        assertThat(ShortcutTable.expand("J2")).hasValueSatisfying(
                l -> assertThat(l).startsWith("1", "je", "2", "1"));
    }

    @Test
    void testEveryEntryHasTwelveArguments() {
        for (String mnemonic : new String[] { "", "I", "J", "J2", "K", "K1", "IJ", "IJ3", "IK", "IK1", "JK", "JK1",
                "IJK", "IJK1" }) {
            assertThat(ShortcutTable.expand(mnemonic)).hasValueSatisfying(l -> assertThat(l).hasSize(12));
        }
    }

    @Test
    void testLookupIgnoresCase() {
        assertThat(ShortcutTable.isShortcut("ijk1")).isTrue();
        assertThat(ShortcutTable.isShortcut("IJKL")).isFalse();
        assertThat(ShortcutTable.expand(null)).isEmpty();
    }
}
