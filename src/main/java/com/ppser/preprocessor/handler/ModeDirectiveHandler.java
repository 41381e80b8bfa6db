package com.ppser.preprocessor.handler;

import java.util.List;

import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.ApiOperation;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;
import com.ppser.preprocessor.model.SerializationMode;
import com.ppser.preprocessor.parser.DirectiveArguments;

/**
 * {@code MODE write|read|CPU|GPU|expr [IF cond]}.
 */
public class ModeDirectiveHandler extends AbstractDirectiveHandler {

    @Override
    public Directive getDirective() {
        return Directive.MODE;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        DirectiveArguments arguments = parse(invocation);
        if (arguments.getPositionals().size() != 1 || arguments.hasKeyValues()) {
            throw semantic(invocation, "Must specify exactly one mode");
        }
        String mode = arguments.getPositionals().get(0);
        String value = SerializationMode.fromName(mode)
                .map(m -> String.valueOf(m.getCode()))
                .orElse(mode);

        return block(arguments)
                .line(call(context.call(ApiOperation.SET_MODE), List.of(value)))
                .render();
    }
}
