package com.ppser.preprocessor.handler;

import java.util.List;

import com.ppser.preprocessor.exception.DirectiveException;
import com.ppser.preprocessor.model.DirectiveInvocation;
import com.ppser.preprocessor.parser.DirectiveArgumentParser;
import com.ppser.preprocessor.parser.DirectiveArguments;

abstract class AbstractDirectiveHandler implements DirectiveHandler {

    private final DirectiveArgumentParser argumentParser = new DirectiveArgumentParser();

    protected DirectiveArguments parse(DirectiveInvocation invocation) {
        return argumentParser.parse(invocation.getKeyword(), invocation.getArguments());
    }

    protected StatementBlock block(DirectiveArguments arguments) {
        return new StatementBlock(arguments.getCondition().orElse(null));
    }

    protected static String call(String symbol, List<String> arguments) {
        return "call " + symbol + "(" + String.join(", ", arguments) + ")";
    }

    protected static DirectiveException semantic(DirectiveInvocation invocation, String message) {
        return DirectiveException.semantic(invocation.getKeyword(), message);
    }

    protected static String quote(String name) {
        return "'" + name + "'";
    }
}
