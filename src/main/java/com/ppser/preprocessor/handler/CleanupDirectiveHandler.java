package com.ppser.preprocessor.handler;

import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.ApiOperation;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;

/**
 * {@code CLEANUP [args...]}: finalizes serialization; arguments are passed through.
 */
public class CleanupDirectiveHandler implements DirectiveHandler {

    @Override
    public Directive getDirective() {
        return Directive.CLEANUP;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        String finalize = context.call(ApiOperation.FINALIZE);
        return "! cleanup serialization environment\n"
                + "call " + finalize + "(" + String.join(",", invocation.getArguments()) + ")\n";
    }
}
