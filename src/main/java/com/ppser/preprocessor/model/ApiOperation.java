package com.ppser.preprocessor.model;

import java.util.Locale;

/**
 * Logical operations of the external serialization API that generated code calls.
 * The concrete symbol names live in {@link com.ppser.preprocessor.config.ApiSymbolTable}.
 */
public enum ApiOperation {
    INITIALIZE("ppser_initialize", SymbolOwner.PREAMBLE_HELPER),
    FINALIZE("ppser_finalize", SymbolOwner.PREAMBLE_HELPER),
    SET_MODE("ppser_set_mode", SymbolOwner.PREAMBLE_HELPER),
    GET_MODE("ppser_get_mode", SymbolOwner.PREAMBLE_HELPER),
    WRITE_FIELD("fs_write_field", SymbolOwner.SERIALIZATION_MODULE),
    READ_FIELD("fs_read_field", SymbolOwner.SERIALIZATION_MODULE),
    SET_OPTION("fs_Option", SymbolOwner.SERIALIZATION_MODULE),
    ADD_SERIALIZER_METAINFO("fs_add_serializer_metainfo", SymbolOwner.SERIALIZATION_MODULE),
    REGISTER_FIELD("fs_register_field", SymbolOwner.SERIALIZATION_MODULE),
    REGISTER_ALL_TRACERS("fs_RegisterAllTracers", SymbolOwner.SERIALIZATION_MODULE),
    ADD_FIELD_METAINFO("fs_AddFieldMetaInfo", SymbolOwner.SERIALIZATION_MODULE),
    CREATE_SAVEPOINT("fs_create_savepoint", SymbolOwner.SERIALIZATION_MODULE),
    ADD_SAVEPOINT_METAINFO("fs_add_savepoint_metainfo", SymbolOwner.SERIALIZATION_MODULE),
    ENABLE("fs_enable_serialization", SymbolOwner.SERIALIZATION_MODULE),
    DISABLE("fs_disable_serialization", SymbolOwner.SERIALIZATION_MODULE),
    WRITE_TRACER_ALL("ppser_write_tracer_all", SymbolOwner.PREAMBLE_HELPER),
    WRITE_TRACER_BY_INDEX("ppser_write_tracer_bx_idx", SymbolOwner.PREAMBLE_HELPER),
    WRITE_TRACER_BY_NAME("ppser_write_tracer_by_name", SymbolOwner.PREAMBLE_HELPER);

    private final String defaultSymbol;
    private final SymbolOwner owner;

    ApiOperation(String defaultSymbol, SymbolOwner owner) {
        this.defaultSymbol = defaultSymbol;
        this.owner = owner;
    }

    public String getDefaultSymbol() {
        return defaultSymbol;
    }

    public SymbolOwner getOwner() {
        return owner;
    }

    /**
     * Key used in symbol override files: {@code SET_MODE -> set.mode}.
     */
    public String getPropertyKey() {
        return name().toLowerCase(Locale.ROOT).replace('_', '.');
    }
}
