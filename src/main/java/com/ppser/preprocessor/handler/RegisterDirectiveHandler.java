package com.ppser.preprocessor.handler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.ppser.preprocessor.config.PreambleSymbols;
import com.ppser.preprocessor.config.ShortcutTable;
import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.ApiOperation;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;
import com.ppser.preprocessor.model.RegisterDataType;
import com.ppser.preprocessor.parser.DirectiveArguments;

/**
 * {@code REGISTER name type [shortcut | sizes...] [IF cond]}: registers field meta-data.
 *
 * The type is {@code integer} or {@code real}. A single third argument naming a
 * {@link ShortcutTable} entry expands to its twelve sizes and halos; without a third
 * argument the field is registered as a scalar.
 */
public class RegisterDirectiveHandler extends AbstractDirectiveHandler {

    @Override
    public Directive getDirective() {
        return Directive.REGISTER;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        DirectiveArguments arguments = parse(invocation);
        List<String> positionals = arguments.getPositionals();
        if (positionals.size() < 2) {
            throw semantic(invocation, "Must specify a name, a type and the field sizes");
        }
        if (arguments.hasKeyValues()) {
            throw semantic(invocation, "Metainformation for fields are not yet implemented");
        }

        String declaredType = positionals.get(1);
        RegisterDataType type = RegisterDataType.fromDeclaration(declaredType)
                .orElseThrow(() -> semantic(invocation, "Data type " + declaredType
                        + " is not recognized. Valid types are \"integer\" and \"real\""));

        List<String> callArguments = new ArrayList<>();
        callArguments.add(PreambleSymbols.SERIALIZER);
        callArguments.add(quote(positionals.get(0)));
        callArguments.addAll(type.getArguments());
        callArguments.addAll(dimensions(positionals.subList(2, positionals.size())));

        return block(arguments)
                .line(call(context.call(ApiOperation.REGISTER_FIELD), callArguments))
                .render();
    }

    static List<String> dimensions(List<String> given) {
        if (given.size() > 1) {
            return given;
        }
        String mnemonic = given.isEmpty() ? "" : given.get(0);
        Optional<List<String>> shortcut = ShortcutTable.expand(mnemonic);
        return shortcut.orElse(given);
    }
}
