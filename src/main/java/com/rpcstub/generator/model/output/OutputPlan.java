package com.rpcstub.generator.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * Where one document's output goes.
 */
@Value
@Builder
public class OutputPlan {

    /**
     * Path of the document's own generated file.
     */
    @NonNull
    Path target;

    /**
     * Path of the protection file shared by every document in the same directory.
     */
    @NonNull
    Path protectionPath;

    /**
     * True only for the first document planned into the protection file's directory.
     */
    boolean protectionNeeded;

    public Path getDirectory() {
        return protectionPath.getParent();
    }
}
