package com.ppser.preprocessor.handler;

import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.ApiOperation;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;

/**
 * {@code ON} / {@code OFF}: enables or disables serialization at run time.
 */
public class SwitchDirectiveHandler implements DirectiveHandler {

    private final Directive directive;
    private final ApiOperation operation;

    private SwitchDirectiveHandler(Directive directive, ApiOperation operation) {
        this.directive = directive;
        this.operation = operation;
    }

    public static SwitchDirectiveHandler on() {
        return new SwitchDirectiveHandler(Directive.ON, ApiOperation.ENABLE);
    }

    public static SwitchDirectiveHandler off() {
        return new SwitchDirectiveHandler(Directive.OFF, ApiOperation.DISABLE);
    }

    @Override
    public Directive getDirective() {
        return directive;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        return "call " + context.call(operation) + "()\n";
    }
}
