package com.rpcstub.generator.codegen.render;

import com.rpcstub.generator.model.input.IdlDocument;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;

/**
 * Data model handed to the {@code file} template for one document.
 */
@Value
@Builder
public class RenderContext {

    @NonNull
    IdlDocument document;

    @NonNull
    String pkgName;

    /**
     * Filtered imports, path to alias.
     */
    @NonNull
    Map<String, String> imports;

    @NonNull
    PatchHelpers helpers;

    @NonNull
    String runtimeImport;

    @NonNull
    String protectionSymbol;
}
