package com.ppser.preprocessor.engine;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.ppser.preprocessor.exception.DirectiveException;
import com.ppser.preprocessor.handler.DirectiveHandlerRegistry;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;
import com.ppser.preprocessor.parser.ArgumentTokenizer;

/**
 * Recognizes !$SER lines and routes them to the handler for their keyword.
 */
public class DirectiveDispatcher {

    private static final Pattern DIRECTIVE_LINE = Pattern.compile("^[ \\t]*!\\$ser[ \\t]*(.*)$", Pattern.CASE_INSENSITIVE);

    private final DirectiveHandlerRegistry handlers;

    public DirectiveDispatcher(DirectiveHandlerRegistry handlers) {
        this.handlers = handlers;
    }

    public static DirectiveDispatcher withDefaultHandlers() {
        return new DirectiveDispatcher(DirectiveHandlerRegistry.withDefaultHandlers());
    }

    /**
     * Text following the directive marker, if the line is a directive line.
     */
    public static Optional<String> directiveText(String content) {
        Matcher m = DIRECTIVE_LINE.matcher(content);
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * Resolves the keyword and splits the arguments. Empty if the marker stands alone.
     */
    public Optional<DirectiveInvocation> parse(String directiveText) {
        List<String> tokens = ArgumentTokenizer.tokenize(directiveText);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        String keyword = tokens.get(0);
        Directive directive = Directive.fromKeyword(keyword)
                .orElseThrow(() -> DirectiveException.syntax(keyword, "Unknown directive encountered"));
        return Optional.of(new DirectiveInvocation(directive, keyword, List.copyOf(tokens.subList(1, tokens.size()))));
    }

    /**
     * Expansion of a directive line. A bare marker line is kept as it is.
     */
    public String dispatch(String lineText, String directiveText, PreprocessContext context) {
        Optional<DirectiveInvocation> invocation = parse(directiveText);
        if (invocation.isEmpty()) {
            return lineText;
        }
        DirectiveInvocation directive = invocation.get();
        return handlers.get(directive.getDirective()).expand(directive, context);
    }
}
