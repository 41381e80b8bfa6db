package com.ppser.preprocessor.engine;

import com.ppser.preprocessor.config.PreprocessorConfig;
import com.ppser.preprocessor.exception.DirectiveException;
import com.ppser.preprocessor.exception.ErrorKind;

/**
 * Brackets each run of directive-derived lines with {@code #ifdef GUARD} / {@code #endif}.
 */
public class GuardWrapper {

    private final PreprocessorConfig config;
    private boolean insideRegion;

    public GuardWrapper(PreprocessorConfig config) {
        this.config = config;
    }

    /**
     * Marker to prepend to the current line, possibly empty.
     */
    public String transition(boolean directiveDerived) {
        if (!config.isGuardEnabled()) {
            return "";
        }
        if (directiveDerived && !insideRegion) {
            insideRegion = true;
            return config.guardOpen();
        }
        if (!directiveDerived && insideRegion) {
            insideRegion = false;
            return config.guardClose();
        }
        return "";
    }

    public boolean isInsideRegion() {
        return insideRegion;
    }

    public void verifyClosed() {
        if (insideRegion) {
            throw new DirectiveException(ErrorKind.STRUCTURAL, null,
                    "Unterminated #ifdef " + config.getGuardSymbol() + " encountered");
        }
    }
}
