package com.ppser.preprocessor.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the directive and mode enums.
 */
class DirectiveTest {

    @ParameterizedTest
    @CsvSource({
        "INIT, INIT",
        "ini, INIT",
        "Opt, OPTION",
        "VER, VERBATIM",
        "reg, REGISTER",
        "ZER, ZERO",
        "sav, SAVEPOINT",
        "MOD, MODE",
        "dat, DATA",
        "TRA, TRACER",
        "cle, CLEANUP",
        "on, ON",
        "Off, OFF"
    })
    void testAbbreviations(String keyword, Directive expected) {
        assertThat(Directive.fromKeyword(keyword)).contains(expected);
    }

    @Test
    void testKeywordSpellings() {
        assertThat(Directive.fromKeyword("INIT")).contains(Directive.INIT);
        assertThat(Directive.fromKeyword("ini")).contains(Directive.INIT);
        assertThat(Directive.fromKeyword("Sav")).contains(Directive.SAVEPOINT);
        assertThat(Directive.fromKeyword("registertracers")).contains(Directive.REGISTERTRACERS);
        assertThat(Directive.fromKeyword("METAINF")).isEmpty();
        assertThat(Directive.fromKeyword(null)).isEmpty();
    }

    @Test
    void testSerializationModes() {
        assertThat(SerializationMode.fromName("Write")).contains(SerializationMode.WRITE);
        assertThat(SerializationMode.fromName("gpu").map(SerializationMode::getCode)).contains(1);
        assertThat(SerializationMode.fromName("imode")).isEmpty();
    }

    @Test
    void testRegisterDataTypes() {
        assertThat(RegisterDataType.fromDeclaration("INTEGER")).contains(RegisterDataType.INTEGER);
        assertThat(RegisterDataType.fromDeclaration("'real'")).contains(RegisterDataType.REAL);
        assertThat(RegisterDataType.fromDeclaration("double")).isEmpty();
        assertThat(RegisterDataType.INTEGER.getArguments()).containsExactly("'int'", "ppser_intlength");
    }
}
