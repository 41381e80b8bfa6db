package com.ppser.preprocessor.handler;

import java.util.List;
import java.util.regex.Pattern;

import com.ppser.preprocessor.config.PreambleSymbols;
import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.ApiOperation;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;
import com.ppser.preprocessor.model.SerializationMode;
import com.ppser.preprocessor.parser.DirectiveArguments;
import com.ppser.preprocessor.parser.KeyValue;

/**
 * {@code DATA [removeintentin] name=field... [IF cond]}: writes or reads each field
 * depending on the current serialization mode.
 *
 * With {@code removeintentin} every field variable is queued for INTENT(IN) removal so
 * that read mode may overwrite it.
 */
public class DataDirectiveHandler extends AbstractDirectiveHandler {

    public static final String REMOVE_INTENT_IN = "removeintentin";

    private static final Pattern SUBSCRIPT = Pattern.compile("\\(.+\\)");

    @Override
    public Directive getDirective() {
        return Directive.DATA;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        DirectiveArguments arguments = parse(invocation);
        List<String> flags = arguments.getPositionals();
        boolean removeIntentIn = flags.size() == 1 && flags.get(0).equalsIgnoreCase(REMOVE_INTENT_IN);
        if (!flags.isEmpty() && !removeIntentIn) {
            throw semantic(invocation, "Must specify a list of key=value pairs with optional " + REMOVE_INTENT_IN);
        }

        String write = context.call(ApiOperation.WRITE_FIELD);
        String read = context.call(ApiOperation.READ_FIELD);
        String getMode = context.call(ApiOperation.GET_MODE);

        if (removeIntentIn) {
            for (KeyValue kv : arguments.getKeyValues()) {
                context.requestIntentInRemoval(SUBSCRIPT.matcher(kv.getValue()).replaceAll(""));
            }
        }

        StatementBlock block = block(arguments)
                .line("SELECT CASE ( " + getMode + "() )")
                .nested(1, "CASE(" + SerializationMode.WRITE.getCode() + ")");
        for (KeyValue kv : arguments.getKeyValues()) {
            block.nested(2, hostUpdate(kv.getValue()))
                 .nested(2, call(write, List.of(PreambleSymbols.SERIALIZER, PreambleSymbols.SAVEPOINT,
                         quote(kv.getKey()), kv.getValue())));
        }
        block.nested(1, "CASE(" + SerializationMode.READ.getCode() + ")");
        for (KeyValue kv : arguments.getKeyValues()) {
            block.nested(2, call(read, List.of(PreambleSymbols.SERIALIZER_REF, PreambleSymbols.SAVEPOINT,
                         quote(kv.getKey()), kv.getValue())))
                 .nested(2, deviceUpdate(kv.getValue()));
        }
        return block.line("END SELECT").render();
    }

    static String hostUpdate(String field) {
        return "ACC_PREFIX UPDATE HOST ( " + field + " ), IF (i_am_accel_node)";
    }

    static String deviceUpdate(String field) {
        return "ACC_PREFIX UPDATE DEVICE ( " + field + " ), IF (i_am_accel_node)";
    }
}
