package com.ppser.preprocessor.parser;

import java.util.List;
import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

@Value
public class TracerArguments {
    @NonNull
    List<TracerSpec> specs;

    String condition;

    public Optional<String> getCondition() {
        return Optional.ofNullable(condition);
    }
}
