package com.ppser.preprocessor.handler;

import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;
import com.ppser.preprocessor.parser.DirectiveArguments;

/**
 * {@code ZERO field... [IF cond]}: assigns {@code 0.0_<realKind>} to each field.
 */
public class ZeroDirectiveHandler extends AbstractDirectiveHandler {

    @Override
    public Directive getDirective() {
        return Directive.ZERO;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        DirectiveArguments arguments = parse(invocation);
        if (arguments.hasKeyValues()) {
            throw semantic(invocation, "Must specify a list of fields");
        }

        StatementBlock block = block(arguments);
        for (String field : arguments.getPositionals()) {
            block.line(field + " = 0.0_" + context.getRealKind());
        }
        return block.render();
    }
}
