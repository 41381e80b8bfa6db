package com.ppser.preprocessor.handler;

/**
 * Accumulates generated statements, optionally inside an {@code IF (...) THEN / ENDIF} block.
 */
public class StatementBlock {

    static final String INDENT = "  ";

    private final String condition;
    private final String indent;
    private final StringBuilder body = new StringBuilder();

    public StatementBlock(String condition) {
        this.condition = condition;
        this.indent = condition == null ? "" : INDENT;
    }

    public static StatementBlock unconditional() {
        return new StatementBlock(null);
    }

    public StatementBlock line(String statement) {
        body.append(indent).append(statement).append('\n');
        return this;
    }

    /**
     * Statement indented {@code level} steps deeper than the block body.
     */
    public StatementBlock nested(int level, String statement) {
        return line(INDENT.repeat(level) + statement);
    }

    public StatementBlock blank() {
        body.append(indent).append('\n');
        return this;
    }

    public String render() {
        if (condition == null) {
            return body.toString();
        }
        return "IF (" + condition + ") THEN\n" + body + "ENDIF\n";
    }
}
