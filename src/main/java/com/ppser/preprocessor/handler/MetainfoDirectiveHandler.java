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
 * {@code METAINFO [key=value...] [name...] [IF cond]}: adds serializer meta-information.
 * A bare name is shorthand for {@code name=name}.
 */
public class MetainfoDirectiveHandler extends AbstractDirectiveHandler {

    @Override
    public Directive getDirective() {
        return Directive.METAINFO;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        DirectiveArguments arguments = parse(invocation);
        String addInfo = context.call(ApiOperation.ADD_SERIALIZER_METAINFO);

        StatementBlock block = block(arguments);
        for (KeyValue kv : arguments.getKeyValues()) {
            block.line(metainfo(addInfo, kv.getKey(), kv.getValue()));
        }
        for (String name : arguments.getPositionals()) {
            block.line(metainfo(addInfo, name, name));
        }
        return block.render();
    }

    private static String metainfo(String symbol, String key, String value) {
        return call(symbol, List.of(PreambleSymbols.SERIALIZER, "\"" + key + "\"", value));
    }
}
