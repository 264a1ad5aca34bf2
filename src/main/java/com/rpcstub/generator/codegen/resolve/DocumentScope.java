package com.rpcstub.generator.codegen.resolve;

import com.rpcstub.generator.codegen.exception.ImportResolutionException;

import java.util.Map;

/**
 * Names visible from one document.
 */
public interface DocumentScope {

    /**
     * Import path to local alias; an empty alias means the package's own name is used.
     */
    Map<String, String> resolveImports() throws ImportResolutionException;
}
