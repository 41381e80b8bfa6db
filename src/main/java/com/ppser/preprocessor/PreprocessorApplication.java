package com.ppser.preprocessor;

import com.ppser.preprocessor.cli.PreprocessCommand;
import picocli.CommandLine;

/**
 * Main entry point for the !$SER serialization preprocessor.
 * Expands serialization directives in Fortran sources into calls to the
 * serialization library.
 */
public class PreprocessorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PreprocessCommand()).execute(args);
        System.exit(exitCode);
    }
}
