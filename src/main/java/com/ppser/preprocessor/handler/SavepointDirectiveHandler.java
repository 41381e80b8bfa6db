package com.ppser.preprocessor.handler;

import java.util.List;

import com.ppser.preprocessor.config.PreambleSymbols;
import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.ApiOperation;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;
import com.ppser.preprocessor.parser.DirectiveArguments;
import com.ppser.preprocessor.parser.KeyValue;

/**
 * {@code SAVEPOINT name [key=value...] [IF cond]}.
 */
public class SavepointDirectiveHandler extends AbstractDirectiveHandler {

    @Override
    public Directive getDirective() {
        return Directive.SAVEPOINT;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        DirectiveArguments arguments = parse(invocation);
        if (arguments.getPositionals().size() != 1) {
            throw semantic(invocation, "Must specify a name and a list of key=value pairs");
        }
        String name = arguments.getPositionals().get(0);

        String create = context.call(ApiOperation.CREATE_SAVEPOINT);
        String addInfo = context.call(ApiOperation.ADD_SAVEPOINT_METAINFO);

        StatementBlock block = block(arguments)
                .line(call(create, List.of(quote(name), PreambleSymbols.SAVEPOINT)));
        for (KeyValue kv : arguments.getKeyValues()) {
            block.line(call(addInfo, List.of(PreambleSymbols.SAVEPOINT, quote(kv.getKey()), kv.getValue())));
        }
        return block.render();
    }
}
