package com.rpcstub.generator.codegen.resolve;

import com.rpcstub.generator.codegen.exception.ScopeResolutionException;
import com.rpcstub.generator.model.input.IdlDocument;

import java.nio.file.Path;

/**
 * Target-language naming decisions for documents and identifiers.
 */
public interface DocumentNaming {

    /**
     * Target package name for the document's namespace.
     */
    String packageName(IdlDocument document);

    /**
     * Output file of the document, relative to the run's output path.
     * Distinct documents must map to distinct paths.
     */
    Path outputFile(IdlDocument document) throws ScopeResolutionException;

    /**
     * The unexported (package-private) form of an identifier, e.g. "BaseResp" -> "baseResp".
     */
    String unexport(String name);

    /**
     * The exported form of an identifier, e.g. "base_resp" -> "BaseResp".
     */
    String export(String name);
}
