package com.ppser.preprocessor.model;

import java.util.ArrayList;
import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * One recognized directive: the resolved kind, the keyword exactly as written, and the
 * argument tokens that followed it.
 */
@Value
public class DirectiveInvocation {
    @NonNull
    Directive directive;
    @NonNull
    String keyword;
    @NonNull
    List<String> arguments;

    /**
     * Keyword followed by the arguments.
     */
    public List<String> getTokens() {
        List<String> tokens = new ArrayList<>(arguments.size() + 1);
        tokens.add(keyword);
        tokens.addAll(arguments);
        return tokens;
    }
}
