package com.ppser.preprocessor.service;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ppser.preprocessor.config.PreprocessorConfig;
import com.ppser.preprocessor.engine.AnalysisResult;
import com.ppser.preprocessor.engine.SerializationPreprocessor;
import com.ppser.preprocessor.exception.PreprocessException;
import com.ppser.preprocessor.util.FileWriteUtil;

/**
 * Preprocesses source files on disk: reads the input, runs both passes and writes the
 * result to the output directory, or to the given stream when there is none.
 */
public class PreprocessService {
    private static final Logger log = LoggerFactory.getLogger(PreprocessService.class);

    private final PreprocessorConfig config;
    private final SerializationPreprocessor preprocessor;
    private final PrintStream stdout;

    public PreprocessService(PreprocessorConfig config, PrintStream stdout) {
        this.config = config;
        this.preprocessor = new SerializationPreprocessor(config);
        this.stdout = stdout;
    }

    /**
     * @param outputDir target directory, or null to print the result
     * @param force     process even if the output is newer than the input
     */
    public PreprocessResult process(Path inputFile, Path outputDir, boolean force) {
        Path outputFile = outputDir == null ? null : outputDir.resolve(inputFile.getFileName());
        String fileName = inputFile.toString();

        try {
            if (outputFile != null && !force && FileWriteUtil.isNewer(outputFile, inputFile)) {
                log.info("Skipping {}", inputFile);
                return PreprocessResult.skipped(inputFile, outputFile);
            }

            log.info("Processing file {}", inputFile);
            String source = FileWriteUtil.readSource(inputFile);

            AnalysisResult analysis = preprocessor.analyze(fileName, source);
            String output = preprocessor.generate(fileName, source, analysis);

            PreprocessStatus status = write(output, outputFile);

            return PreprocessResult.builder()
                    .status(status)
                    .inputFile(inputFile)
                    .outputFile(outputFile)
                    .logicalLines(analysis.getLogicalLines())
                    .directiveLines(analysis.getDirectiveLines())
                    .importedSymbols(analysis.getCallRegistry().size())
                    .intentInRemovals(analysis.getRemovalRequests().size())
                    .build();

        } catch (PreprocessException e) {
            log.error(e.getMessage());
            return PreprocessResult.failure(inputFile, e.getMessage());
        } catch (IOException e) {
            log.error("I/O error while processing {}", inputFile, e);
            return PreprocessResult.failure(inputFile, "I/O error: " + e.getMessage());
        }
    }

    private PreprocessStatus write(String output, Path outputFile) throws IOException {
        if (outputFile == null) {
            stdout.print(output);
            stdout.flush();
            return PreprocessStatus.WRITTEN;
        }
        if (!config.isWriteIdentical() && FileWriteUtil.hasContent(outputFile, output)) {
            log.debug("Output {} is identical, not rewritten", outputFile);
            return PreprocessStatus.UNCHANGED;
        }
        FileWriteUtil.writeAtomically(outputFile, output);
        log.debug("Wrote {}", outputFile);
        return PreprocessStatus.WRITTEN;
    }
}
