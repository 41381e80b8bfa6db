package com.ppser.preprocessor.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of the analysis pass, handed unchanged to the generation pass.
 */
@Value
@Builder
public class AnalysisResult {

    /**
     * Frozen registry of symbols referenced anywhere in the file.
     */
    @NonNull
    CallRegistry callRegistry;

    /**
     * Variables whose INTENT(IN) attribute must be removed, in request order.
     */
    @NonNull
    @Builder.Default
    Set<String> removalRequests = Set.of();

    int logicalLines;
    int directiveLines;

    public static AnalysisResult of(CallRegistry registry, Set<String> removalRequests) {
        return AnalysisResult.builder()
                .callRegistry(registry.isFrozen() ? registry : registry.freeze())
                .removalRequests(Collections.unmodifiableSet(new LinkedHashSet<>(removalRequests)))
                .build();
    }
}
