package com.rpcstub.generator.codegen.exception;

/**
 * A fixed-width or string/binary type question could not be answered, usually because the type graph is malformed or cyclic.
 */
public class TypeClassificationException extends PatchException {

    private static final long serialVersionUID = 1L;

    public TypeClassificationException(String reason) {
        super(reason, null, null);
    }

    public TypeClassificationException(String reason, Throwable cause) {
        super(reason, null, cause);
    }

    public TypeClassificationException(String reason, String document, Throwable cause) {
        super(reason, document, cause);
    }

    @Override
    public TypeClassificationException withDocument(String document) {
        return new TypeClassificationException(getReason(), document, this);
    }
}
