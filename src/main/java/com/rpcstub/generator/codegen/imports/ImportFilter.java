package com.rpcstub.generator.codegen.imports;

import com.rpcstub.generator.model.core.context.PatcherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prunes a resolved import set down to what generated code may import itself.
 *
 * Dropped entries:
 * - paths inside the generated module (referenced locally),
 * - the legacy Thrift runtime, which generated code imports under a fixed alias,
 * - the IDL compiler's own support packages,
 * - standard library paths (no dot anywhere in the path).
 *
 * Templates must only reference imports that survive this filter.
 */
public class ImportFilter {

    private static final Logger log = LoggerFactory.getLogger(ImportFilter.class);

    private final String module;
    private final String legacyRuntimeImport;
    private final String generatorSupportPrefix;

    public ImportFilter(String module, String legacyRuntimeImport, String generatorSupportPrefix) {
        this.module = module == null ? "" : module;
        this.legacyRuntimeImport = legacyRuntimeImport == null ? "" : legacyRuntimeImport;
        this.generatorSupportPrefix = generatorSupportPrefix == null ? "" : generatorSupportPrefix;
    }

    public static ImportFilter from(PatcherConfig config) {
        return new ImportFilter(config.getModule(), config.getLegacyRuntimeImport(), config.getGeneratorSupportPrefix());
    }

    /**
     * Returns a new map with the surviving entries in their original order; the argument is not modified.
     */
    public Map<String, String> filter(Map<String, String> imports) {
        Map<String, String> kept = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : imports.entrySet()) {
            String path = entry.getKey();
            if (isDropped(path)) {
                log.debug("Dropping import {}", path);
                continue;
            }
            kept.put(path, entry.getValue() == null ? "" : entry.getValue());
        }
        return kept;
    }

    public boolean isDropped(String path) {
        return isLocalModule(path)
                || (!legacyRuntimeImport.isEmpty() && path.equals(legacyRuntimeImport))
                || (!generatorSupportPrefix.isEmpty() && path.startsWith(generatorSupportPrefix))
                || !path.contains(".");
    }

    private boolean isLocalModule(String path) {
        if (module.isBlank()) {
            return false;
        }
        return path.equals(module) || path.startsWith(module + "/");
    }
}
