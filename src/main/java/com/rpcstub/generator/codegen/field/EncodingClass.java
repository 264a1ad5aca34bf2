package com.rpcstub.generator.codegen.field;

/**
 * Encoding-width class of a field.
 */
public enum EncodingClass {
    /** Encoded length is fixed by the declared shape. */
    FIXED_WIDTH,
    /** Encoded length depends on the value. */
    VARIABLE_WIDTH
}
