package com.ppser.preprocessor.handler;

import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;

/**
 * Expands one directive kind into Fortran statements.
 *
 * Handlers record every API symbol they emit in the context's call registry, in both
 * passes, so that the import block can be built before the first directive is reached.
 */
public interface DirectiveHandler {

    Directive getDirective();

    /**
     * @return generated text, one or more newline-terminated lines
     */
    String expand(DirectiveInvocation invocation, PreprocessContext context);
}
