package com.ppser.preprocessor.exception;

/**
 * Category of a preprocessing failure.
 */
public enum ErrorKind {
    /**
     * Malformed directive text: bad continuation, unknown keyword, broken key=value token,
     * misplaced IF clause, unparseable tracer specification.
     */
    SYNTAX("SyntaxError"),

    /**
     * Well-formed directive with arguments the directive does not accept.
     */
    SEMANTIC("SemanticError"),

    /**
     * Unbalanced program units or guard regions, missing IMPLICIT NONE.
     */
    STRUCTURAL("StructuralError"),

    /**
     * The two passes disagree, e.g. INTENT(IN) removal requests left unresolved.
     */
    CONSISTENCY("ConsistencyError");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
