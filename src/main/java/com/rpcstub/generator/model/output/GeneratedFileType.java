package com.rpcstub.generator.model.output;

/**
 * Categories of files produced by one patch run.
 */
public enum GeneratedFileType {
    /** Generated code for one IDL document. */
    SOURCE,
    /** Per-directory file declaring the always-referenced protection symbol. */
    PROTECTION,
    /** Verbatim copy of an IDL source. */
    IDL_COPY
}
