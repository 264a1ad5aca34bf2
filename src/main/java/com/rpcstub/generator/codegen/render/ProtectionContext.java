package com.rpcstub.generator.codegen.render;

import lombok.NonNull;
import lombok.Value;

/**
 * Data model of the {@code protection} template.
 */
@Value
public class ProtectionContext {

    @NonNull
    String pkgName;

    @NonNull
    String protectionSymbol;
}
