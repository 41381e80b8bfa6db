package com.ppser.preprocessor.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.ppser.preprocessor.cli.exception.OptionsValidationException;
import com.ppser.preprocessor.cli.model.PreprocessOptions;
import com.ppser.preprocessor.cli.model.ValidatedPreprocessOptions;
import com.ppser.preprocessor.config.ApiSymbolTable;
import com.ppser.preprocessor.config.ApiSymbolTableLoader;
import com.ppser.preprocessor.config.PreprocessorConfig;

public class PreprocessOptionsValidator {

	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private final ApiSymbolTableLoader symbolTableLoader = new ApiSymbolTableLoader();

	public ValidatedPreprocessOptions validate(PreprocessOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> files = o.getFiles() == null ? List.of() : o.getFiles();
		if (files.isEmpty()) {
			errors.add("Need at least one source file to process.");
		}
		for (Path file : files) {
			if (!Files.isRegularFile(file)) {
				errors.add("Source file does not exist or is not a regular file: " + file);
			}
		}

		Path outputDir = null;
		if (o.getOutputDir() != null) {
			outputDir = o.getOutputDir().toAbsolutePath().normalize();
			if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
				errors.add("Output directory is not a directory: " + outputDir);
			}
		}

		if (!o.isNoGuard() && !isIdentifier(o.getGuardSymbol())) {
			errors.add("Guard symbol must be an identifier (--ifdef). Got: " + o.getGuardSymbol());
		}
		if (!isIdentifier(o.getRealKind())) {
			errors.add("Real kind must be an identifier (--real). Got: " + o.getRealKind());
		}
		if (!isIdentifier(o.getSerializationModule())) {
			errors.add("Serialization module must be an identifier (--module). Got: " + o.getSerializationModule());
		}
		if (!isIdentifier(o.getHelperModule())) {
			errors.add("Helper module must be an identifier (--helper-module). Got: " + o.getHelperModule());
		}

		ApiSymbolTable symbols = loadSymbols(o.getSymbolsFile(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		PreprocessorConfig config = PreprocessorConfig.builder()
				.guardSymbol(o.isNoGuard() ? null : o.getGuardSymbol())
				.realKind(o.getRealKind())
				.serializationModule(o.getSerializationModule())
				.helperModule(o.getHelperModule())
				.symbols(symbols)
				.writeIdentical(!o.isIgnoreIdentical())
				.build();

		return new ValidatedPreprocessOptions(config, List.copyOf(files), outputDir);
	}

	private ApiSymbolTable loadSymbols(Path symbolsFile, List<String> errors) {
		if (symbolsFile == null) {
			return ApiSymbolTable.defaults();
		}
		if (!Files.isRegularFile(symbolsFile)) {
			errors.add("Symbols file does not exist or is not a regular file: " + symbolsFile);
			return ApiSymbolTable.defaults();
		}
		try {
			return symbolTableLoader.load(symbolsFile);
		} catch (IOException e) {
			errors.add("Cannot read symbols file " + symbolsFile + ": " + e.getMessage());
		} catch (IllegalArgumentException e) {
			errors.add("Invalid symbols file " + symbolsFile + ": " + e.getMessage());
		}
		return ApiSymbolTable.defaults();
	}

	private static boolean isIdentifier(String s) {
		return s != null && IDENTIFIER.matcher(s.trim()).matches();
	}
}
