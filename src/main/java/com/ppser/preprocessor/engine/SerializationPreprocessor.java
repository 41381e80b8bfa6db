package com.ppser.preprocessor.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ppser.preprocessor.config.PreprocessorConfig;
import com.ppser.preprocessor.exception.DirectiveException;
import com.ppser.preprocessor.exception.ErrorKind;
import com.ppser.preprocessor.exception.PreprocessException;
import com.ppser.preprocessor.parser.LineAssembler;
import com.ppser.preprocessor.parser.LogicalLine;

/**
 * Expands !$SER directives in one Fortran source file.
 *
 * Two passes run over the same logical lines:
 * - {@link #analyze}: collects the API symbols and INTENT(IN) removal requests of the whole
 *   file and checks its structure; produces no output.
 * - {@link #generate}: expands directives, wraps them in guards, inserts the import block
 *   in front of IMPLICIT NONE and rewrites INTENT(IN) declarations, using the frozen
 *   analysis result.
 *
 * Instances hold no per-file state and may be reused.
 */
public class SerializationPreprocessor {
    private static final Logger log = LoggerFactory.getLogger(SerializationPreprocessor.class);

    private final PreprocessorConfig config;
    private final DirectiveDispatcher dispatcher;
    private final ImportBlockSynthesizer importBlocks;

    public SerializationPreprocessor(PreprocessorConfig config) {
        this(config, DirectiveDispatcher.withDefaultHandlers());
    }

    public SerializationPreprocessor(PreprocessorConfig config, DirectiveDispatcher dispatcher) {
        this.config = config;
        this.dispatcher = dispatcher;
        this.importBlocks = new ImportBlockSynthesizer(config);
    }

    public String preprocess(String fileName, String source) {
        return generate(fileName, source, analyze(fileName, source));
    }

    public AnalysisResult analyze(String fileName, String source) {
        List<LogicalLine> lines = new LineAssembler(fileName).assemble(source);
        PreprocessContext context = new PreprocessContext(fileName, config, Pass.ANALYZE);

        runPass(context, lines, null, null);

        AnalysisResult result = AnalysisResult.builder()
                .callRegistry(context.getCallRegistry().freeze())
                .removalRequests(Collections.unmodifiableSet(new LinkedHashSet<>(context.getRemovalRequests())))
                .logicalLines(lines.size())
                .directiveLines(context.getDirectiveLines())
                .build();
        log.debug("Analyzed {}: {} logical lines, {} directives, {}", fileName,
                result.getLogicalLines(), result.getDirectiveLines(), result.getCallRegistry());
        return result;
    }

    public String generate(String fileName, String source, AnalysisResult analysis) {
        List<LogicalLine> lines = new LineAssembler(fileName).assemble(source);
        PreprocessContext context = new PreprocessContext(fileName, config, Pass.GENERATE);
        IntentInRemovalRewriter rewriter = new IntentInRemovalRewriter(config, analysis.getRemovalRequests());

        StringBuilder output = new StringBuilder(source.length() + 1024);
        runPass(context, lines, new GenerationState(analysis.getCallRegistry(), rewriter), output);

        List<String> missing = rewriter.unresolved();
        if (!missing.isEmpty()) {
            throw new PreprocessException(ErrorKind.CONSISTENCY, fileName, lastLine(lines), null, null,
                    "cannot find INTENT(IN) declaration for " + String.join(", ", missing));
        }
        log.debug("Generated {}: {} directives expanded, {} INTENT(IN) declarations rewritten",
                fileName, context.getDirectiveLines(), rewriter.getFound().size());
        return output.toString();
    }

    private void runPass(PreprocessContext context, List<LogicalLine> lines,
                         GenerationState generation, StringBuilder output) {
        for (LogicalLine line : lines) {
            try {
                String expanded = processLine(context, line, generation);
                if (output != null) {
                    output.append(expanded);
                }
            } catch (DirectiveException e) {
                throw new PreprocessException(context.getFileName(), line.getFirstLine(), line.getContent(), e);
            }
        }
        verifyEndOfFile(context, lastLine(lines));
    }

    private String processLine(PreprocessContext context, LogicalLine line, GenerationState generation) {
        String content = line.getContent();
        Optional<String> directiveText = DirectiveDispatcher.directiveText(content);

        if (directiveText.isPresent()) {
            context.countDirective();
            String body = dispatcher.dispatch(line.getText(), directiveText.get(), context);
            return context.getGuard().transition(true) + body;
        }

        context.getScope().track(content);

        String imports = "";
        if (ImportBlockSynthesizer.isAnchor(content)) {
            context.setAnchorFound(true);
            if (context.isGenerating() && !context.isImportEmitted()) {
                Optional<String> block = importBlocks.synthesize(generation.registry);
                if (block.isPresent()) {
                    imports = block.get();
                    context.setImportEmitted(true);
                }
            }
        }

        String body = line.getText();
        if (context.isGenerating()) {
            body = generation.rewriter.rewrite(body).orElse(body);
        }
        return context.getGuard().transition(false) + imports + body;
    }

    private void verifyEndOfFile(PreprocessContext context, int lastLine) {
        try {
            context.getGuard().verifyClosed();
            context.getScope().verifyClosed();
        } catch (DirectiveException e) {
            throw new PreprocessException(context.getFileName(), lastLine, null, e);
        }
        if (!context.getCallRegistry().isEmpty() && !context.isAnchorFound()) {
            throw new PreprocessException(ErrorKind.STRUCTURAL, context.getFileName(), lastLine, null, null,
                    "No IMPLICIT NONE statement found in code");
        }
    }

    private static int lastLine(List<LogicalLine> lines) {
        return lines.isEmpty() ? 0 : lines.get(lines.size() - 1).getLastLine();
    }

    private static final class GenerationState {
        private final CallRegistry registry;
        private final IntentInRemovalRewriter rewriter;

        private GenerationState(CallRegistry registry, IntentInRemovalRewriter rewriter) {
            this.registry = registry;
            this.rewriter = rewriter;
        }
    }
}
