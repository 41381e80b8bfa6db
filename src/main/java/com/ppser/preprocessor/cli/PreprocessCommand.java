package com.ppser.preprocessor.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ppser.preprocessor.cli.exception.OptionsValidationException;
import com.ppser.preprocessor.cli.model.PreprocessOptions;
import com.ppser.preprocessor.cli.model.ValidatedPreprocessOptions;
import com.ppser.preprocessor.cli.output.PreprocessResultsPrinter;
import com.ppser.preprocessor.cli.validation.PreprocessOptionsValidator;
import com.ppser.preprocessor.service.PreprocessResult;
import com.ppser.preprocessor.service.PreprocessService;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command expanding !$SER directives in Fortran source files.
 */
@Command(
        name = "ppser",
        mixinStandardHelpOptions = true,
        version = "ppser-preprocessor 1.0.0",
        description = "Expands !$SER serialization directives in Fortran source files."
)
public class PreprocessCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PreprocessCommand.class);

    @Mixin
    private PreprocessOptions options = new PreprocessOptions();

    private final PreprocessOptionsValidator validator = new PreprocessOptionsValidator();
    private final PreprocessResultsPrinter printer = new PreprocessResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedPreprocessOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(validated);

        PreprocessService service = new PreprocessService(validated.getConfig(), System.out);
        List<PreprocessResult> results = new ArrayList<>();
        for (var file : validated.getInputFiles()) {
            PreprocessResult result = service.process(file, validated.getOutputDir(), options.isForce());
            printer.printResult(result);
            results.add(result);
        }

        printer.printSummary(results);
        return results.stream().allMatch(PreprocessResult::isSuccess) ? 0 : 1;
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
