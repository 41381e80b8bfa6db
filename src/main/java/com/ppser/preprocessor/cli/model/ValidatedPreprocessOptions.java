package com.ppser.preprocessor.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.ppser.preprocessor.config.PreprocessorConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps PreprocessCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedPreprocessOptions {
    PreprocessorConfig config;
    List<Path> inputFiles;
    Path outputDir;
}
