package com.ppser.preprocessor.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.ppser.preprocessor.config.PreprocessorConfig;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options of the preprocessor. No validation, no execution logic,
 * no printing.
 */
@Getter
public class PreprocessOptions {

	@Parameters(paramLabel = "FILE", arity = "1..*", description = "Fortran source files to preprocess")
	private List<Path> files;

	@Option(names = { "--output-dir",
			"-d" }, description = "The target directory for writing pre-processed files (default: print to stdout)")
	private Path outputDir;

	@Option(names = { "--ignore-identical",
			"-i" }, description = "Do not rewrite output files whose content would not change")
	private boolean ignoreIdentical;

	@Option(names = { "--force", "-f" }, description = "Process files even if the output is newer than the input")
	private boolean force;

	@Option(names = { "--verbose", "-v" }, description = "Enable verbose execution")
	private boolean verbose;

	@Option(names = {
			"--ifdef" }, defaultValue = PreprocessorConfig.DEFAULT_GUARD, description = "Preprocessor symbol guarding generated code (default: ${DEFAULT-VALUE})")
	private String guardSymbol;

	@Option(names = { "--no-ifdef" }, description = "Do not wrap generated code in #ifdef/#endif")
	private boolean noGuard;

	@Option(names = { "--real" }, defaultValue = "wp", description = "Fortran real kind used by ZERO (default: ${DEFAULT-VALUE})")
	private String realKind;

	@Option(names = {
			"--module" }, defaultValue = "m_serialize", description = "Fortran serialization module (default: ${DEFAULT-VALUE})")
	private String serializationModule;

	@Option(names = {
			"--helper-module" }, defaultValue = "utils_ppser", description = "Fortran helper module of the generated preamble (default: ${DEFAULT-VALUE})")
	private String helperModule;

	@Option(names = { "--symbols" }, description = "Properties file overriding serialization API symbol names")
	private Path symbolsFile;

}
