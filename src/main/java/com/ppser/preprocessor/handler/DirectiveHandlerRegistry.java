package com.ppser.preprocessor.handler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.ppser.preprocessor.model.Directive;

/**
 * One handler per directive kind.
 */
public class DirectiveHandlerRegistry {

    private final Map<Directive, DirectiveHandler> handlers = new EnumMap<>(Directive.class);

    public DirectiveHandlerRegistry(List<DirectiveHandler> handlers) {
        for (DirectiveHandler handler : handlers) {
            this.handlers.put(handler.getDirective(), handler);
        }
        for (Directive directive : Directive.values()) {
            if (!this.handlers.containsKey(directive)) {
                throw new IllegalArgumentException("No handler registered for " + directive);
            }
        }
    }

    public static DirectiveHandlerRegistry withDefaultHandlers() {
        return new DirectiveHandlerRegistry(List.of(
                new InitDirectiveHandler(),
                new OptionDirectiveHandler(),
                new MetainfoDirectiveHandler(),
                new VerbatimDirectiveHandler(),
                new RegisterDirectiveHandler(),
                new RegisterTracersDirectiveHandler(),
                new ZeroDirectiveHandler(),
                new SavepointDirectiveHandler(),
                new ModeDirectiveHandler(),
                new DataDirectiveHandler(),
                new TracerDirectiveHandler(),
                new CleanupDirectiveHandler(),
                SwitchDirectiveHandler.on(),
                SwitchDirectiveHandler.off()));
    }

    public DirectiveHandler get(Directive directive) {
        return handlers.get(directive);
    }
}
