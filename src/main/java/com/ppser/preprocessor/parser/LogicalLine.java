package com.ppser.preprocessor.parser;

import lombok.NonNull;
import lombok.Value;

/**
 * A source line after continuation lines have been joined in.
 */
@Value
public class LogicalLine {

    /**
     * Line text including its terminator, if the physical line had one.
     */
    @NonNull
    String text;

    /**
     * 1-based physical line where this logical line starts.
     */
    int firstLine;

    /**
     * 1-based physical line where this logical line ends.
     */
    int lastLine;

    /**
     * Text without the trailing line terminator.
     */
    public String getContent() {
        return LineAssembler.stripTerminator(text);
    }

    public boolean isContinued() {
        return lastLine > firstLine;
    }
}
