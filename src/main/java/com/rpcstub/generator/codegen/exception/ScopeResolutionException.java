package com.rpcstub.generator.codegen.exception;

/**
 * Namespace, package or output path of a document could not be computed.
 */
public class ScopeResolutionException extends PatchException {

    private static final long serialVersionUID = 1L;

    public ScopeResolutionException(String reason) {
        super(reason, null, null);
    }

    public ScopeResolutionException(String reason, Throwable cause) {
        super(reason, null, cause);
    }

    public ScopeResolutionException(String reason, String document, Throwable cause) {
        super(reason, document, cause);
    }

    @Override
    public ScopeResolutionException withDocument(String document) {
        return new ScopeResolutionException(getReason(), document, this);
    }
}
