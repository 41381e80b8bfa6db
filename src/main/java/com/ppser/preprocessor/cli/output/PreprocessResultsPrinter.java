package com.ppser.preprocessor.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ppser.preprocessor.cli.model.ValidatedPreprocessOptions;
import com.ppser.preprocessor.config.PreprocessorConfig;
import com.ppser.preprocessor.service.PreprocessResult;
import com.ppser.preprocessor.service.PreprocessStatus;

/**
 * Responsible only for printing CLI output of the preprocessor.
 * No validation, no execution.
 */
public class PreprocessResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(PreprocessResultsPrinter.class);

    public void printBanner(ValidatedPreprocessOptions v) {
        PreprocessorConfig config = v.getConfig();
        log.debug("=================================================");
        log.debug("!$SER Serialization Preprocessor");
        log.debug("=================================================");
        log.debug("Files: {}", v.getInputFiles().size());
        log.debug("Output Directory: {}", v.getOutputDir() != null ? v.getOutputDir() : "stdout");
        log.debug("Guard: {}", config.isGuardEnabled() ? config.getGuardSymbol() : "disabled");
        log.debug("Real Kind: {}", config.getRealKind());
        log.debug("Modules: {} / {}", config.getSerializationModule(), config.getHelperModule());
        log.debug("Rewrite Identical Output: {}", config.isWriteIdentical());
        log.debug("=================================================");
    }

    public void printResult(PreprocessResult result) {
        if (result.getStatus() == PreprocessStatus.FAILED) {
            return;
        }
        log.debug("{}: {} ({} lines, {} directives, {} symbols imported, {} INTENT(IN) removals)",
                result.getInputFile(), result.getStatus(), result.getLogicalLines(),
                result.getDirectiveLines(), result.getImportedSymbols(), result.getIntentInRemovals());
    }

    public void printSummary(List<PreprocessResult> results) {
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        long skipped = results.stream().filter(r -> r.getStatus() == PreprocessStatus.SKIPPED).count();
        long unchanged = results.stream().filter(r -> r.getStatus() == PreprocessStatus.UNCHANGED).count();

        log.debug("Processed: {}, Skipped: {}, Unchanged: {}, Failed: {}",
                results.size() - failed - skipped - unchanged, skipped, unchanged, failed);

        if (failed > 0) {
            log.error("{} of {} files failed:", failed, results.size());
            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("  {}", r.getInputFile()));
        }
    }
}
