package com.rpcstub.generator.codegen.output;

import com.rpcstub.generator.model.core.context.PatcherConfig;
import com.rpcstub.generator.model.output.OutputPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Maps resolved document paths to generated file paths for one run.
 *
 * Each directory gets one protection file, requested by the first document planned into it.
 * No two targets of one run share a path. A planner must not be shared between runs.
 */
public class OutputPlanner {

    private static final Logger log = LoggerFactory.getLogger(OutputPlanner.class);

    private final Path outputPath;
    private final String targetPrefix;
    private final String protectionFileName;

    private final Set<Path> protectedDirectories = new HashSet<>();
    private final Set<Path> plannedTargets = new HashSet<>();

    public OutputPlanner(Path outputPath, String targetPrefix, String protectionFileName) {
        this.outputPath = outputPath;
        this.targetPrefix = targetPrefix;
        this.protectionFileName = protectionFileName;
    }

    public static OutputPlanner forRun(PatcherConfig config) {
        return new OutputPlanner(config.getOutputPath(), config.getTargetPrefix(), config.getProtectionFileName());
    }

    /**
     * @param resolvedPath the document's output file relative to the output root, e.g. "example/user/user.go"
     */
    public OutputPlan plan(Path resolvedPath) {
        Path full = outputPath.resolve(resolvedPath).normalize();
        Path dir = full.getParent() != null ? full.getParent() : outputPath;
        Path protection = dir.resolve(protectionFileName);
        String fileName = targetPrefix + full.getFileName();
        Path target = dir.resolve(fileName);

        // consts.thrift would otherwise land on the protection file, consts_gen.thrift on its renamed target
        for (int attempt = 1; target.equals(protection) || plannedTargets.contains(target); attempt++) {
            target = dir.resolve(disambiguate(fileName, attempt));
        }
        plannedTargets.add(target);

        boolean needed = protectedDirectories.add(dir);
        if (needed) {
            log.debug("Protection file {} requested for {}", protection, resolvedPath);
        }
        return OutputPlan.builder()
                .target(target)
                .protectionPath(protection)
                .protectionNeeded(needed)
                .build();
    }

    public int getProtectedDirectoryCount() {
        return protectedDirectories.size();
    }

    /**
     * Inserts "_gen" before the extension, numbered from the second attempt on: "_gen", "_gen2", ...
     */
    static String disambiguate(String fileName, int attempt) {
        String suffix = attempt <= 1 ? "_gen" : "_gen" + attempt;
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + suffix;
        }
        return fileName.substring(0, dot) + suffix + fileName.substring(dot);
    }
}
