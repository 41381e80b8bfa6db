package com.ppser.preprocessor.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ppser.preprocessor.config.PreprocessorConfig;
import com.ppser.preprocessor.parser.LineAssembler;

/**
 * Rewrites INTENT(IN) declarations of fields that serialization in read mode must
 * overwrite. A matching declaration is emitted twice: without INTENT(IN) when the
 * guard symbol is defined, unchanged otherwise.
 */
public class IntentInRemovalRewriter {
    private static final Logger log = LoggerFactory.getLogger(IntentInRemovalRewriter.class);

    private static final Pattern INTENT_IN_DECLARATION = Pattern.compile(
            ".*intent[ \\t]*\\([ \\t]*in[ \\t]*\\)[^:]*::.*", Pattern.CASE_INSENSITIVE);
    private static final Pattern INTENT_IN_ATTRIBUTE = Pattern.compile(
            ",[ \\t]*intent[ \\t]*\\([ \\t]*in[ \\t]*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DECLARED_NAME = Pattern.compile("[ \\t]*([A-Za-z_][A-Za-z0-9_]*)");

    private final PreprocessorConfig config;
    private final Set<String> requested;
    private final Set<String> found = new LinkedHashSet<>();

    public IntentInRemovalRewriter(PreprocessorConfig config, Set<String> requested) {
        this.config = config;
        this.requested = requested;
    }

    /**
     * Replacement text for the line, or empty if the line is left alone.
     */
    public Optional<String> rewrite(String line) {
        String content = LineAssembler.stripTerminator(line);
        if (requested.isEmpty() || content.stripLeading().startsWith("!")
                || !INTENT_IN_DECLARATION.matcher(content).matches()) {
            return Optional.empty();
        }

        List<String> declared = declaredVariables(content);
        List<String> matched = new ArrayList<>();
        for (String name : requested) {
            if (declared.stream().anyMatch(name::equalsIgnoreCase)) {
                matched.add(name);
            }
        }
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        found.addAll(matched);
        log.debug("Removing INTENT(IN) for {}", matched);

        String original = content + terminator(line);
        String stripped = INTENT_IN_ATTRIBUTE.matcher(content).replaceAll("") + terminator(line);
        if (!config.isGuardEnabled()) {
            return Optional.of(stripped);
        }
        return Optional.of(config.guardOpen() + stripped + config.guardElse() + original + config.guardClose());
    }

    /**
     * Names declared after {@code ::}, without dimension suffixes.
     */
    static List<String> declaredVariables(String declaration) {
        int separator = declaration.indexOf("::");
        String list = stripComment(declaration.substring(separator + 2));

        List<String> names = new ArrayList<>();
        for (String entry : splitTopLevel(list)) {
            Matcher m = DECLARED_NAME.matcher(entry);
            if (m.lookingAt()) {
                names.add(m.group(1));
            }
        }
        return names;
    }

    private static List<String> splitTopLevel(String list) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < list.length(); i++) {
            char c = list.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                parts.add(list.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(list.substring(start).trim());
        return parts;
    }

    private static String stripComment(String text) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '!') {
                return text.substring(0, i);
            }
        }
        return text;
    }

    private static String terminator(String line) {
        String terminator = line.substring(LineAssembler.stripTerminator(line).length());
        return terminator.isEmpty() ? "\n" : terminator;
    }

    public Set<String> getFound() {
        return found;
    }

    /**
     * Requested names no declaration has been found for, in request order.
     */
    public List<String> unresolved() {
        List<String> missing = new ArrayList<>();
        for (String name : requested) {
            if (!found.contains(name)) {
                missing.add(name);
            }
        }
        return missing;
    }
}
