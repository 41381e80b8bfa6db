package com.ppser.preprocessor.parser;

import lombok.NonNull;
import lombok.Value;

/**
 * A {@code key=value} directive argument.
 */
@Value
public class KeyValue {
    @NonNull
    String key;
    @NonNull
    String value;

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
