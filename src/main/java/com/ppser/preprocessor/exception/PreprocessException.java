package com.ppser.preprocessor.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * Fatal failure while preprocessing one file. Processing of the file stops; batch
 * callers may carry on with the next file.
 */
public class PreprocessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String fileName;
    private final int lineNumber;
    private final String directive;
    private final String lineText;
    private final String detail;

    public PreprocessException(ErrorKind kind, String fileName, int lineNumber,
                               String directive, String lineText, String detail) {
        super(format(kind, fileName, lineNumber, directive, lineText, detail));
        this.kind = kind;
        this.fileName = fileName;
        this.lineNumber = lineNumber;
        this.directive = directive;
        this.lineText = lineText;
        this.detail = detail;
    }

    public PreprocessException(String fileName, int lineNumber, String lineText, DirectiveException cause) {
        this(cause.getKind(), fileName, lineNumber, cause.getDirective(), lineText, cause.getMessage());
        initCause(cause);
    }

    private static String format(ErrorKind kind, String fileName, int lineNumber,
                                 String directive, String lineText, String detail) {
        List<String> parts = new ArrayList<>();
        parts.add("File: \"" + fileName + "\", line " + lineNumber);
        if (directive != null && !directive.isEmpty()) {
            parts.add(kind.getLabel() + ": Invalid !$SER " + directive + " directive");
        } else {
            parts.add(kind.getLabel());
        }
        if (detail != null && !detail.isEmpty()) {
            parts.add("Message: " + detail);
        }
        if (lineText != null && !lineText.isBlank()) {
            parts.add("Line " + lineNumber + ": " + lineText.stripTrailing());
        }
        return String.join(System.lineSeparator(), parts);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getDirective() {
        return directive;
    }

    public String getLineText() {
        return lineText;
    }

    public String getDetail() {
        return detail;
    }
}
