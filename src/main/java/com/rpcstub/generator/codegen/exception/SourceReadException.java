package com.rpcstub.generator.codegen.exception;

/**
 * The raw IDL source could not be read for verbatim copy.
 */
public class SourceReadException extends PatchException {

    private static final long serialVersionUID = 1L;

    public SourceReadException(String reason) {
        super(reason, null, null);
    }

    public SourceReadException(String reason, Throwable cause) {
        super(reason, null, cause);
    }

    public SourceReadException(String reason, String document, Throwable cause) {
        super(reason, document, cause);
    }

    @Override
    public SourceReadException withDocument(String document) {
        return new SourceReadException(getReason(), document, this);
    }
}
