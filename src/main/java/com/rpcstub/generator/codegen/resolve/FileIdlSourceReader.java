package com.rpcstub.generator.codegen.resolve;

import com.rpcstub.generator.codegen.exception.SourceReadException;
import com.rpcstub.generator.model.input.IdlDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads IDL sources from the filesystem, resolving relative filenames against a base directory.
 */
public class FileIdlSourceReader implements IdlSourceReader {

    private static final Logger log = LoggerFactory.getLogger(FileIdlSourceReader.class);

    private final Path baseDir;

    public FileIdlSourceReader() {
        this(Path.of("."));
    }

    public FileIdlSourceReader(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public String read(IdlDocument document) throws SourceReadException {
        Path source = baseDir.resolve(document.getFilename());
        log.debug("Reading IDL source {}", source);
        try (InputStream in = Files.newInputStream(source)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceReadException("read " + source + ": " + e.getMessage(), e);
        }
    }
}
