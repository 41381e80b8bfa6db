package com.ppser.preprocessor.engine;

import java.util.LinkedHashSet;
import java.util.Set;

import com.ppser.preprocessor.config.PreprocessorConfig;
import com.ppser.preprocessor.model.ApiOperation;

import lombok.Getter;
import lombok.Setter;

/**
 * Mutable state of one pass over one file, threaded through the dispatcher and the
 * directive handlers.
 */
@Getter
public class PreprocessContext {

    private final String fileName;
    private final PreprocessorConfig config;
    private final Pass pass;
    private final CallRegistry callRegistry = new CallRegistry();
    private final Set<String> removalRequests = new LinkedHashSet<>();
    private final ScopeTracker scope = new ScopeTracker();
    private final GuardWrapper guard;

    @Setter
    private boolean anchorFound;
    @Setter
    private boolean importEmitted;

    private int directiveLines;

    public PreprocessContext(String fileName, PreprocessorConfig config, Pass pass) {
        this.fileName = fileName;
        this.config = config;
        this.pass = pass;
        this.guard = new GuardWrapper(config);
    }

    /**
     * Symbol for an API operation; records it as used by this file.
     */
    public String call(ApiOperation operation) {
        String symbol = config.getSymbols().symbol(operation);
        callRegistry.record(operation.getOwner(), symbol);
        return symbol;
    }

    public void requestIntentInRemoval(String variable) {
        removalRequests.add(variable);
    }

    public void countDirective() {
        directiveLines++;
    }

    public boolean isGenerating() {
        return pass == Pass.GENERATE;
    }

    public String getRealKind() {
        return config.getRealKind();
    }
}
