package com.rpcstub.generator.model.input;

/**
 * Struct-like declaration kinds.
 */
public enum RecordKind {
    STRUCT,
    UNION,
    EXCEPTION
}
