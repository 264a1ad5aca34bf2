package com.rpcstub.generator.codegen.exception;

/**
 * The import set of a document could not be resolved.
 */
public class ImportResolutionException extends PatchException {

    private static final long serialVersionUID = 1L;

    public ImportResolutionException(String reason) {
        super(reason, null, null);
    }

    public ImportResolutionException(String reason, Throwable cause) {
        super(reason, null, cause);
    }

    public ImportResolutionException(String reason, String document, Throwable cause) {
        super(reason, document, cause);
    }

    @Override
    public ImportResolutionException withDocument(String document) {
        return new ImportResolutionException(getReason(), document, this);
    }
}
