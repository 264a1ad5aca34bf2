package com.rpcstub.generator.model.core.context;

import com.rpcstub.generator.codegen.envelope.EnvelopeRule;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration for one patcher instance.
 *
 * Only {@code outputPath} is required; everything else defaults to the
 * conventions of the Go stub generator.
 */
@Value
@Builder(toBuilder = true)
public class PatcherConfig {

    public static final String DEFAULT_VERSION = "v0.6.1";

    /**
     * Root directory that resolved document paths are relative to.
     */
    @NonNull
    Path outputPath;

    /**
     * Module path of the generated code (e.g. "example.com/mod"). Imports under it are dropped.
     * Blank disables the module rule.
     */
    @Builder.Default
    String module = "";

    /**
     * Skip the fast encode/decode code path.
     */
    boolean noFastApi;

    /**
     * Copy each IDL source next to its generated file.
     */
    boolean copyIdl;

    @NonNull
    @Builder.Default
    String version = DEFAULT_VERSION;

    /**
     * Prefix added to the base name of every generated file.
     */
    @NonNull
    @Builder.Default
    String targetPrefix = "k-";

    /**
     * Name of the per-directory protection file, the same for every document.
     */
    @NonNull
    @Builder.Default
    String protectionFileName = "k-consts.go";

    /**
     * Symbol declared in every protection file and referenced by every importing file.
     */
    @NonNull
    @Builder.Default
    String protectionSymbol = "KitexUnusedProtection";

    /**
     * Runtime import that generated code already references under a fixed alias.
     */
    @NonNull
    @Builder.Default
    String legacyRuntimeImport = "github.com/apache/thrift/lib/go/thrift";

    /**
     * Import prefix of the IDL compiler's own support packages.
     */
    @NonNull
    @Builder.Default
    String generatorSupportPrefix = "github.com/cloudwego/thriftgo";

    /**
     * Envelope field rules; empty means {@link EnvelopeRule#defaults()}.
     */
    @NonNull
    @Singular
    List<EnvelopeRule> envelopeRules;

    public List<EnvelopeRule> getEffectiveEnvelopeRules() {
        return envelopeRules.isEmpty() ? EnvelopeRule.defaults() : envelopeRules;
    }

    public boolean isGenerateFastApis() {
        return !noFastApi;
    }
}
