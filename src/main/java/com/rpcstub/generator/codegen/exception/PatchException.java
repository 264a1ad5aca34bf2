package com.rpcstub.generator.codegen.exception;

import java.util.Optional;

/**
 * Base of every failure that aborts a patch run.
 *
 * None of them is recovered locally: the driver attaches the filename of the
 * document being processed and propagates.
 */
public abstract class PatchException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String reason;
    private final String document;

    protected PatchException(String reason, String document, Throwable cause) {
        super(document == null ? reason : "\"" + document + "\": " + reason, cause);
        this.reason = reason;
        this.document = document;
    }

    /**
     * Message without the document prefix.
     */
    public String getReason() {
        return reason;
    }

    /**
     * Filename of the IDL document that was being processed, once the driver has attached it.
     */
    public Optional<String> getDocument() {
        return Optional.ofNullable(document);
    }

    /**
     * Same failure kind, tagged with the document's filename and caused by this exception.
     */
    public abstract PatchException withDocument(String document);
}
