package com.ppser.preprocessor.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ppser.preprocessor.model.ApiOperation;

/**
 * Reads symbol overrides from a properties file.
 *
 * Format (keys are operation names, lower case, dot separated):
 * - set.mode = my_set_mode
 * - write.field = my_write_field
 */
public class ApiSymbolTableLoader {
    private static final Logger log = LoggerFactory.getLogger(ApiSymbolTableLoader.class);

    private static final Map<String, ApiOperation> BY_KEY = new HashMap<>();

    static {
        for (ApiOperation operation : ApiOperation.values()) {
            BY_KEY.put(operation.getPropertyKey(), operation);
        }
    }

    public ApiSymbolTable load(Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file)) {
            properties.load(reader);
        }
        return apply(ApiSymbolTable.defaults(), properties);
    }

    public ApiSymbolTable apply(ApiSymbolTable base, Properties overrides) {
        ApiSymbolTable.Builder builder = base.toBuilder();
        List<String> unknown = new ArrayList<>();

        for (String key : overrides.stringPropertyNames()) {
            ApiOperation operation = BY_KEY.get(key.trim());
            if (operation == null) {
                unknown.add(key);
                continue;
            }
            String symbol = overrides.getProperty(key);
            builder.symbol(operation, symbol);
            log.debug("Symbol override: {} -> {}", operation, symbol.trim());
        }

        if (!unknown.isEmpty()) {
            unknown.sort(null);
            throw new IllegalArgumentException("Unknown symbol keys: " + String.join(", ", unknown)
                    + ". Valid keys are: " + String.join(", ", new TreeSet<>(BY_KEY.keySet())));
        }
        return builder.build();
    }
}
