package com.ppser.preprocessor.handler;

import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.ApiOperation;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;

public class RegisterTracersDirectiveHandler implements DirectiveHandler {

    @Override
    public Directive getDirective() {
        return Directive.REGISTERTRACERS;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        return "call " + context.call(ApiOperation.REGISTER_ALL_TRACERS) + "()\n";
    }
}
