package com.ppser.preprocessor.handler;

import java.util.ArrayList;
import java.util.List;

import com.ppser.preprocessor.engine.PreprocessContext;
import com.ppser.preprocessor.model.ApiOperation;
import com.ppser.preprocessor.model.Directive;
import com.ppser.preprocessor.model.DirectiveInvocation;
import com.ppser.preprocessor.parser.TracerArguments;
import com.ppser.preprocessor.parser.TracerSpec;
import com.ppser.preprocessor.parser.TracerSpecParser;

/**
 * {@code TRACER spec... [IF cond]}: writes tracers selected by name, by index range or
 * {@code %all}, see {@link TracerSpecParser}.
 */
public class TracerDirectiveHandler implements DirectiveHandler {

    private final TracerSpecParser parser = new TracerSpecParser();

    @Override
    public Directive getDirective() {
        return Directive.TRACER;
    }

    @Override
    public String expand(DirectiveInvocation invocation, PreprocessContext context) {
        TracerArguments arguments = parser.parse(invocation.getKeyword(), invocation.getArguments());

        StatementBlock block = new StatementBlock(arguments.getCondition().orElse(null));
        for (TracerSpec spec : arguments.getSpecs()) {
            block.line(writeCall(spec, context));
        }
        return block.render();
    }

    private static String writeCall(TracerSpec spec, PreprocessContext context) {
        List<String> args = new ArrayList<>();
        String function;
        if (spec.getSelection() == TracerSpec.Selection.ALL) {
            function = context.call(ApiOperation.WRITE_TRACER_ALL);
        } else if (spec.getSelection() == TracerSpec.Selection.INDEX) {
            function = context.call(ApiOperation.WRITE_TRACER_BY_INDEX);
            args.addAll(spec.getIndices());
        } else {
            function = context.call(ApiOperation.WRITE_TRACER_BY_NAME);
            args.add("'" + spec.getName() + "'");
        }

        args.add("stype='" + spec.getType() + "'");
        spec.getTimeLevel().ifPresent(level -> args.add("timelevel=" + level));

        return "call " + function + "(" + String.join(", ", args) + ")";
    }
}
