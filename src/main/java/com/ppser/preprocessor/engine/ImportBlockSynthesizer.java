package com.ppser.preprocessor.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.ppser.preprocessor.config.PreambleSymbols;
import com.ppser.preprocessor.config.PreprocessorConfig;

/**
 * Builds the USE statements inserted in front of the first IMPLICIT NONE.
 */
public class ImportBlockSynthesizer {

    private static final Pattern ANCHOR = Pattern.compile("^[ \\t]*implicit[ \\t]+none", Pattern.CASE_INSENSITIVE);

    private final PreprocessorConfig config;

    public ImportBlockSynthesizer(PreprocessorConfig config) {
        this.config = config;
    }

    public static boolean isAnchor(String line) {
        return ANCHOR.matcher(line).find();
    }

    /**
     * Import block for the given registry, or empty if nothing needs importing.
     */
    public Optional<String> synthesize(CallRegistry registry) {
        if (registry.isEmpty()) {
            return Optional.empty();
        }

        List<String> helperImports = new ArrayList<>(registry.getHelperSymbols());
        helperImports.addAll(PreambleSymbols.FIXED_IMPORTS);

        StringBuilder sb = new StringBuilder("\n");
        if (config.isGuardEnabled()) {
            sb.append(config.guardOpen());
        }
        if (!registry.getModuleSymbols().isEmpty()) {
            sb.append(useStatement(config.getSerializationModule(), registry.getModuleSymbols()));
        }
        sb.append(useStatement(config.getHelperModule(), helperImports));
        if (config.isGuardEnabled()) {
            sb.append(config.guardClose());
        }
        sb.append('\n');
        return Optional.of(sb.toString());
    }

    private static String useStatement(String module, Iterable<String> symbols) {
        return "USE " + module + ", ONLY: " + String.join(", ", symbols) + "\n";
    }
}
