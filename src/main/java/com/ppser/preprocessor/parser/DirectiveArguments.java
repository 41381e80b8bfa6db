package com.ppser.preprocessor.parser;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Directive arguments split into bare arguments, key=value pairs (in encounter order)
 * and the optional trailing IF condition.
 */
@Value
@Builder
public class DirectiveArguments {
    @NonNull
    @Singular
    List<String> positionals;

    @NonNull
    @Singular
    List<KeyValue> keyValues;

    String condition;

    public Optional<String> getCondition() {
        return Optional.ofNullable(condition);
    }

    public boolean hasPositionals() {
        return !positionals.isEmpty();
    }

    public boolean hasKeyValues() {
        return !keyValues.isEmpty();
    }
}
