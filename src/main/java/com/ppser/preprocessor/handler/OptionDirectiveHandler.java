package com.ppser.preprocessor.handler;

import java.util.ArrayList;
import java.util.List;

import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.ApiOperation;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;
import com.ppser.preprocessor.parser.DirectiveArguments;
import com.ppser.preprocessor.parser.KeyValue;

/**
 * {@code OPTION key=value... [IF cond]}. {@code verbosity=on|off} becomes {@code 1|0}.
 */
public class OptionDirectiveHandler extends AbstractDirectiveHandler {

    @Override
    public Directive getDirective() {
        return Directive.OPTION;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        DirectiveArguments arguments = parse(invocation);
        if (arguments.hasPositionals()) {
            throw semantic(invocation, "Must specify a list of key=value pairs");
        }

        List<String> options = new ArrayList<>();
        for (KeyValue kv : arguments.getKeyValues()) {
            options.add(kv.getKey() + "=" + optionValue(kv));
        }

        return block(arguments)
                .line(call(context.call(ApiOperation.SET_OPTION), options))
                .render();
    }

    private static String optionValue(KeyValue kv) {
        if (kv.getKey().equalsIgnoreCase("verbosity")) {
            if (kv.getValue().equalsIgnoreCase("off")) {
                return "0";
            }
            if (kv.getValue().equalsIgnoreCase("on")) {
                return "1";
            }
        }
        return kv.getValue();
    }
}
