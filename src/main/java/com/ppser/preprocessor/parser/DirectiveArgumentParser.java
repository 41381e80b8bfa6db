package com.ppser.preprocessor.parser;

import java.util.List;

import com.ppser.preprocessor.exception.DirectiveException;

/**
 * Parses the arguments following a directive keyword.
 *
 * Grammar:
 * - {@code name}        bare argument
 * - {@code key=value}   key/value pair
 * - {@code IF expr}     condition; must be the last argument
 */
public class DirectiveArgumentParser {

    public static final String CONDITION_MARKER = "IF";

    public DirectiveArguments parse(String keyword, List<String> arguments) {
        DirectiveArguments.DirectiveArgumentsBuilder builder = DirectiveArguments.builder();
        boolean conditionMode = false;
        String condition = null;

        for (String argument : arguments) {
            if (CONDITION_MARKER.equalsIgnoreCase(argument)) {
                if (conditionMode) {
                    throw DirectiveException.syntax(keyword, "IF statement must be last argument");
                }
                conditionMode = true;
                continue;
            }

            if (conditionMode) {
                if (condition != null) {
                    throw DirectiveException.syntax(keyword, "IF statement must be last argument");
                }
                condition = argument;
                continue;
            }

            int first = argument.indexOf('=');
            if (first < 0) {
                builder.positional(argument);
            } else if (argument.indexOf('=', first + 1) < 0) {
                builder.keyValue(new KeyValue(argument.substring(0, first), argument.substring(first + 1)));
            } else {
                throw DirectiveException.syntax(keyword,
                        "Problem extracting arguments and key=value pairs from '" + argument + "'");
            }
        }

        if (conditionMode && condition == null) {
            throw DirectiveException.syntax(keyword, "IF must be followed by a condition");
        }

        return builder.condition(condition).build();
    }

    /**
     * Arguments preceding the IF marker, unparsed.
     */
    public static List<String> beforeCondition(List<String> arguments) {
        for (int i = 0; i < arguments.size(); i++) {
            if (CONDITION_MARKER.equalsIgnoreCase(arguments.get(i))) {
                return arguments.subList(0, i);
            }
        }
        return arguments;
    }
}
