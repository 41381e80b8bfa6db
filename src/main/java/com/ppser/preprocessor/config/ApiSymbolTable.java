package com.ppser.preprocessor.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.ppser.preprocessor.model.ApiOperation;

/**
 * Maps logical API operations to the symbol names emitted into generated code.
 * Immutable; use {@link #toBuilder()} to derive a table with overrides.
 */
public final class ApiSymbolTable {

    private static final ApiSymbolTable DEFAULTS = builder().build();

    private final Map<ApiOperation, String> symbols;

    private ApiSymbolTable(Map<ApiOperation, String> symbols) {
        this.symbols = Collections.unmodifiableMap(new EnumMap<>(symbols));
    }

    public static ApiSymbolTable defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.symbols.putAll(symbols);
        return builder;
    }

    public String symbol(ApiOperation operation) {
        return symbols.get(operation);
    }

    public Map<ApiOperation, String> asMap() {
        return symbols;
    }

    public static final class Builder {
        private final Map<ApiOperation, String> symbols = new EnumMap<>(ApiOperation.class);

        private Builder() {
            for (ApiOperation operation : ApiOperation.values()) {
                symbols.put(operation, operation.getDefaultSymbol());
            }
        }

        public Builder symbol(ApiOperation operation, String symbol) {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("Symbol for " + operation + " must not be blank");
            }
            symbols.put(operation, symbol.trim());
            return this;
        }

        public ApiSymbolTable build() {
            return new ApiSymbolTable(symbols);
        }
    }
}
