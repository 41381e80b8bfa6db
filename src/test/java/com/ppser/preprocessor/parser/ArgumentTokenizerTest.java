package com.ppser.preprocessor.parser;

import com.ppser.preprocessor.exception.DirectiveException;
import com.ppser.preprocessor.exception.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ArgumentTokenizer.
 */
class ArgumentTokenizerTest {

    @Test
    void testSplitsOnWhitespace() {
        List<String> tokens = ArgumentTokenizer.tokenize("  DATA  u=u_field\tv=v(:,:,1)  ");

        assertThat(tokens).containsExactly("DATA", "u=u_field", "v=v(:,:,1)");
    }

    @Test
    void testEmptyInput() {
        assertThat(ArgumentTokenizer.tokenize("")).isEmpty();
        assertThat(ArgumentTokenizer.tokenize("   ")).isEmpty();
        assertThat(ArgumentTokenizer.tokenize(null)).isEmpty();
    }

    @Test
    void testQuotedStringKeepsWhitespaceAndQuotes() {
        List<String> tokens = ArgumentTokenizer.tokenize("VERBATIM PRINT *, 'hello  world' \"a b\"");

        assertThat(tokens).containsExactly("VERBATIM", "PRINT", "*,", "'hello  world'", "\"a b\"");
    }

    @Test
    void testQuoteInsideToken() {
        List<String> tokens = ArgumentTokenizer.tokenize("name='my field' x");

        assertThat(tokens).containsExactly("name='my field'", "x");
    }

    @Test
    void testOtherQuoteCharacterIsLiteralInsideQuotes() {
        List<String> tokens = ArgumentTokenizer.tokenize("\"it's\"");

        assertThat(tokens).containsExactly("\"it's\"");
    }

    @Test
    void testUnterminatedQuoteFails() {
        assertThatThrownBy(() -> ArgumentTokenizer.tokenize("VERBATIM 'oops"))
                .isInstanceOf(DirectiveException.class)
                .hasMessageContaining("Unterminated quoted string")
                .extracting(e -> ((DirectiveException) e).getKind())
                .isEqualTo(ErrorKind.SYNTAX);
    }
}
