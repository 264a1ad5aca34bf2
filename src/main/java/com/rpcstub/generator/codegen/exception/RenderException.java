package com.rpcstub.generator.codegen.exception;

/**
 * Template execution failed.
 */
public class RenderException extends PatchException {

    private static final long serialVersionUID = 1L;

    public RenderException(String reason) {
        super(reason, null, null);
    }

    public RenderException(String reason, Throwable cause) {
        super(reason, null, cause);
    }

    public RenderException(String reason, String document, Throwable cause) {
        super(reason, document, cause);
    }

    @Override
    public RenderException withDocument(String document) {
        return new RenderException(getReason(), document, this);
    }
}
