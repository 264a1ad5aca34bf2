package com.rpcstub.generator.codegen.resolve;

import com.rpcstub.generator.codegen.exception.ScopeResolutionException;
import com.rpcstub.generator.model.input.IdlDocument;

public interface ScopeResolver {

    DocumentScope resolve(IdlDocument document) throws ScopeResolutionException;
}
