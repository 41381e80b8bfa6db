package com.ppser.preprocessor.handler;

import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.ApiOperation;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;
import com.ppser.preprocessor.parser.DirectiveArgumentParser;
import com.ppser.preprocessor.parser.DirectiveArguments;

/**
 * {@code INIT [args...] [IF cond]}: prints a warning banner and initializes serialization.
 * Arguments are passed through to the initialize call unchanged.
 */
public class InitDirectiveHandler extends AbstractDirectiveHandler {

    static final String BANNER_RULE = "PRINT *, '>>>>>>>>>>>>>>>>>><<<<<<<<<<<<<<<<<<'";
    static final String BANNER_TEXT = "PRINT *, '>>> WARNING: SERIALIZATION IS ON <<<'";

    @Override
    public Directive getDirective() {
        return Directive.INIT;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        DirectiveArguments arguments = parse(invocation);
        String initialize = context.call(ApiOperation.INITIALIZE);

        String forwarded = String.join(",", DirectiveArgumentParser.beforeCondition(invocation.getArguments()));

        return block(arguments)
                .line(BANNER_RULE)
                .line(BANNER_TEXT)
                .line(BANNER_RULE)
                .blank()
                .line("! setup serialization environment")
                .line("call " + initialize + "(" + forwarded + ")")
                .render();
    }
}
