package com.rpcstub.generator.codegen.resolve;

import com.rpcstub.generator.codegen.exception.SourceReadException;
import com.rpcstub.generator.model.input.IdlDocument;

/**
 * Reads the raw text of an IDL document for verbatim copies.
 */
@FunctionalInterface
public interface IdlSourceReader {

    String read(IdlDocument document) throws SourceReadException;
}
