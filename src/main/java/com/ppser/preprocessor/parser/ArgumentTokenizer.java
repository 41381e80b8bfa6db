package com.ppser.preprocessor.parser;

import java.util.ArrayList;
import java.util.List;

import com.ppser.preprocessor.exception.DirectiveException;

/**
 * Splits directive text into whitespace separated tokens. Single or double quoted
 * sections may contain whitespace and are kept verbatim, quotes included, so that
 * string literals can be emitted into generated code unchanged.
 */
public class ArgumentTokenizer {

    private final String source;
    private int pos = 0;

    public ArgumentTokenizer(String source) {
        this.source = source == null ? "" : source;
    }

    public static List<String> tokenize(String source) {
        return new ArgumentTokenizer(source).tokenize();
    }

    public List<String> tokenize() {
        List<String> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(readToken());
        }

        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private String readToken() {
        StringBuilder sb = new StringBuilder();

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                break;
            }
            if (c == '\'' || c == '"') {
                readQuoted(c, sb);
            } else {
                sb.append(c);
                pos++;
            }
        }

        return sb.toString();
    }

    private void readQuoted(char quote, StringBuilder sb) {
        int start = pos;
        int close = source.indexOf(quote, pos + 1);
        if (close < 0) {
            throw DirectiveException.syntax(null,
                    "Unterminated quoted string starting at column " + (start + 1) + ": " + source.substring(start));
        }
        sb.append(source, start, close + 1);
        pos = close + 1;
    }
}
