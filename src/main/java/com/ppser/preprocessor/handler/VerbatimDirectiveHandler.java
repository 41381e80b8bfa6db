package com.ppser.preprocessor.handler;

import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;

/**
 * {@code VERBATIM text...}: emits the text with the directive marker removed.
 */
public class VerbatimDirectiveHandler implements DirectiveHandler {

    @Override
    public Directive getDirective() {
        return Directive.VERBATIM;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        return String.join(" ", invocation.getArguments()) + "\n";
    }
}
