package com.rpcstub.generator.codegen.util;

import com.rpcstub.generator.model.output.GeneratedFile;
import com.rpcstub.generator.model.output.PatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for writing patch output with automatic directory creation.
 */
public class FileWriteUtil {

    private static final Logger log = LoggerFactory.getLogger(FileWriteUtil.class);

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes every file of a finished run, in order. Existing files are overwritten.
     *
     * @return number of files written
     */
    public static int writeAll(PatchResult result) throws IOException {
        int written = 0;
        for (GeneratedFile file : result.getFiles()) {
            safeWriteString(file.getPath(), file.getContents());
            written++;
        }
        log.info("Wrote {} generated files", written);
        return written;
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }
}
