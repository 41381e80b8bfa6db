package com.ppser.preprocessor.parser;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One parsed TRACER argument, e.g. {@code qv#tens@nnew} or {@code $1-ntracer}.
 */
@Value
@Builder
public class TracerSpec {

    public enum Selection {
        /**
         * {@code %all}
         */
        ALL,

        /**
         * {@code $idx} or {@code $first-last}
         */
        INDEX,

        /**
         * Plain tracer name.
         */
        NAME
    }

    @NonNull
    Selection selection;

    /**
     * Tracer name for {@link Selection#NAME}, null otherwise.
     */
    String name;

    /**
     * One or two index expressions for {@link Selection#INDEX}, empty otherwise.
     */
    @NonNull
    @Builder.Default
    List<String> indices = List.of();

    /**
     * Storage type after {@code #}; empty string when absent.
     */
    @NonNull
    @Builder.Default
    String type = "";

    String timeLevel;

    public Optional<String> getTimeLevel() {
        return Optional.ofNullable(timeLevel);
    }
}
