package com.rpcstub.generator.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered output of one successful patch run. The caller writes it to storage.
 */
@Value
@Builder
public class PatchResult {

    @NonNull
    @Singular("file")
    List<GeneratedFile> files;

    int documentsProcessed;

    public List<GeneratedFile> getFilesOfType(GeneratedFileType type) {
        return files.stream()
                .filter(f -> f.getType() == type)
                .collect(Collectors.toList());
    }
}
