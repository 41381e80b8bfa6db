package com.ppser.preprocessor.service;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Result of preprocessing one file.
 */
@Data
@Builder
public class PreprocessResult {
    private PreprocessStatus status;
    private Path inputFile;
    private Path outputFile;
    private String errorMessage;

    private int logicalLines;
    private int directiveLines;
    private int importedSymbols;
    private int intentInRemovals;

    public boolean isSuccess() {
        return status != PreprocessStatus.FAILED;
    }

    public static PreprocessResult failure(Path inputFile, String errorMessage) {
        return PreprocessResult.builder()
                .status(PreprocessStatus.FAILED)
                .inputFile(inputFile)
                .errorMessage(errorMessage)
                .build();
    }

    public static PreprocessResult skipped(Path inputFile, Path outputFile) {
        return PreprocessResult.builder()
                .status(PreprocessStatus.SKIPPED)
                .inputFile(inputFile)
                .outputFile(outputFile)
                .build();
    }
}
