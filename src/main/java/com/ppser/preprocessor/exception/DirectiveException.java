package com.ppser.preprocessor.exception;

/**
 * Raised by tokenizers, parsers and directive handlers. Carries no source location;
 * the engine attaches file name and line number when it turns this into a
 * {@link PreprocessException}.
 */
public class DirectiveException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String directive;

    public DirectiveException(ErrorKind kind, String directive, String message) {
        super(message);
        this.kind = kind;
        this.directive = directive;
    }

    public static DirectiveException syntax(String directive, String message) {
        return new DirectiveException(ErrorKind.SYNTAX, directive, message);
    }

    public static DirectiveException semantic(String directive, String message) {
        return new DirectiveException(ErrorKind.SEMANTIC, directive, message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Directive keyword as written in the source, or {@code null} when the failure is not tied to one.
     */
    public String getDirective() {
        return directive;
    }
}
