package com.ppser.preprocessor.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.ppser.preprocessor.exception.DirectiveException;

/**
 * Parses TRACER arguments: {@code <name|$idx[-idx]|%all>[#type][@timelevel]}.
 */
public class TracerSpecParser {

    private static final Pattern TRACER_PATTERN = Pattern.compile(
            "((?i:%all)|\\$[a-zA-Z_0-9()]+(?:-[a-zA-Z_0-9()]+)?|[a-zA-Z_0-9]+)"
            + "(?:#(tens|bd|surf|sedimvel))?"
            + "(?:@([a-zA-Z_0-9]+))?");

    private final DirectiveArgumentParser argumentParser = new DirectiveArgumentParser();

    public TracerArguments parse(String keyword, List<String> arguments) {
        List<String> specTokens = DirectiveArgumentParser.beforeCondition(arguments);
        String condition = null;
        if (specTokens.size() < arguments.size()) {
            // reuse the general rules for the IF tail
            condition = argumentParser
                    .parse(keyword, arguments.subList(specTokens.size(), arguments.size()))
                    .getCondition()
                    .orElse(null);
        }

        List<TracerSpec> specs = new ArrayList<>();
        for (String token : specTokens) {
            specs.add(parseSpec(keyword, token));
        }
        return new TracerArguments(specs, condition);
    }

    public TracerSpec parseSpec(String keyword, String token) {
        Matcher m = TRACER_PATTERN.matcher(token);
        if (!m.matches()) {
            throw DirectiveException.syntax(keyword, "Tracer specification " + token + " is invalid");
        }

        String target = m.group(1);
        TracerSpec.TracerSpecBuilder builder = TracerSpec.builder()
                .type(m.group(2) == null ? "" : m.group(2))
                .timeLevel(m.group(3));

        if (target.equalsIgnoreCase("%all")) {
            builder.selection(TracerSpec.Selection.ALL);
        } else if (target.startsWith("$")) {
            builder.selection(TracerSpec.Selection.INDEX)
                    .indices(List.of(target.substring(1).split("-")));
        } else {
            builder.selection(TracerSpec.Selection.NAME).name(target);
        }
        return builder.build();
    }
}
