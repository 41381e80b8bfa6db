package com.ppser.preprocessor.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.ppser.preprocessor.exception.ErrorKind;
import com.ppser.preprocessor.exception.PreprocessException;

/**
 * Joins continued !$SER directives into logical lines.
 *
 * A directive ending in {@code " &"} continues on the next physical line, which must
 * start with {@code !$SER&}. The prefix is replaced by a single blank.
 */
public class LineAssembler {

    private static final Pattern CONTINUED_DIRECTIVE = Pattern.compile(
            "^[ \\t]*!\\$ser.* &[ \\t]*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTINUATION_MARK = Pattern.compile("[ \\t]+&[ \\t]*$");
    private static final Pattern CONTINUATION_PREFIX = Pattern.compile(
            "^[ \\t]*!\\$ser&[ \\t]*", Pattern.CASE_INSENSITIVE);

    private final String fileName;

    public LineAssembler(String fileName) {
        this.fileName = fileName;
    }

    public List<LogicalLine> assemble(String source) {
        List<String> physical = splitLines(source);
        List<LogicalLine> logical = new ArrayList<>();

        StringBuilder pending = null;
        int pendingStart = 0;

        for (int i = 0; i < physical.size(); i++) {
            int lineNumber = i + 1;
            String line = physical.get(i);

            if (pending != null) {
                Matcher prefix = CONTINUATION_PREFIX.matcher(line);
                if (!prefix.lookingAt()) {
                    throw new PreprocessException(ErrorKind.SYNTAX, fileName, lineNumber, null,
                            stripTerminator(line), "Incorrect line continuation encountered");
                }
                pending.append(' ').append(line.substring(prefix.end()));
            } else {
                pending = new StringBuilder(line);
                pendingStart = lineNumber;
            }

            String content = stripTerminator(pending.toString());
            if (CONTINUED_DIRECTIVE.matcher(content).matches()) {
                pending = new StringBuilder(CONTINUATION_MARK.matcher(content).replaceFirst("").stripTrailing());
                continue;
            }

            logical.add(new LogicalLine(pending.toString(), pendingStart, lineNumber));
            pending = null;
        }

        if (pending != null) {
            throw new PreprocessException(ErrorKind.SYNTAX, fileName, physical.size(), null,
                    pending.toString(), "Unterminated line continuation at end of file");
        }
        return logical;
    }

    /**
     * Splits text into lines, each keeping its own terminator.
     */
    public static List<String> splitLines(String source) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                lines.add(source.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < source.length()) {
            lines.add(source.substring(start));
        }
        return lines;
    }

    public static String stripTerminator(String line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\n') {
            end--;
            if (end > 0 && line.charAt(end - 1) == '\r') {
                end--;
            }
        }
        return line.substring(0, end);
    }
}
