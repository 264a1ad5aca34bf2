package com.rpcstub.generator.codegen;

import com.rpcstub.generator.codegen.envelope.EnvelopeExtractor;
import com.rpcstub.generator.codegen.exception.ImportResolutionException;
import com.rpcstub.generator.codegen.exception.PatchException;
import com.rpcstub.generator.codegen.exception.ScopeResolutionException;
import com.rpcstub.generator.codegen.field.FieldClassifier;
import com.rpcstub.generator.codegen.field.FieldReorderer;
import com.rpcstub.generator.codegen.imports.ImportFilter;
import com.rpcstub.generator.codegen.output.OutputPlanner;
import com.rpcstub.generator.codegen.render.FreemarkerTemplateRenderer;
import com.rpcstub.generator.codegen.render.PatchHelpers;
import com.rpcstub.generator.codegen.render.ProtectionContext;
import com.rpcstub.generator.codegen.render.RenderContext;
import com.rpcstub.generator.codegen.render.TemplateRenderer;
import com.rpcstub.generator.codegen.resolve.DocumentNaming;
import com.rpcstub.generator.codegen.resolve.DocumentScope;
import com.rpcstub.generator.codegen.resolve.FileIdlSourceReader;
import com.rpcstub.generator.codegen.resolve.GoDocumentNaming;
import com.rpcstub.generator.codegen.resolve.IdlSourceReader;
import com.rpcstub.generator.codegen.resolve.IncludeScopeResolver;
import com.rpcstub.generator.codegen.resolve.ScopeResolver;
import com.rpcstub.generator.codegen.resolve.StructuralTypeInspector;
import com.rpcstub.generator.codegen.resolve.TypeInspector;
import com.rpcstub.generator.model.core.context.PatcherConfig;
import com.rpcstub.generator.model.input.DocumentForest;
import com.rpcstub.generator.model.input.IdlDocument;
import com.rpcstub.generator.model.output.GeneratedFile;
import com.rpcstub.generator.model.output.GeneratedFileType;
import com.rpcstub.generator.model.output.OutputPlan;
import com.rpcstub.generator.model.output.PatchResult;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drives one generation pass over a document forest.
 *
 * Documents are processed one at a time in depth-first order. Per document:
 * resolve scope, name the package, plan output, filter imports, render, and
 * optionally copy the IDL source. Any failure aborts the run with the
 * document's filename attached; no partial result is returned.
 */
public class StubPatcher {

    private static final Logger log = LoggerFactory.getLogger(StubPatcher.class);

    private final PatcherConfig config;
    private final ScopeResolver scopeResolver;
    private final DocumentNaming naming;
    private final TypeInspector typeInspector;
    private final IdlSourceReader sourceReader;
    private final TemplateRenderer renderer;

    /**
     * Unset collaborators fall back to the Go reference implementations; a missing
     * type inspector is built from the forest of each run.
     */
    @Builder
    public StubPatcher(@NonNull PatcherConfig config,
                       ScopeResolver scopeResolver,
                       DocumentNaming naming,
                       TypeInspector typeInspector,
                       IdlSourceReader sourceReader,
                       TemplateRenderer renderer) {
        GoDocumentNaming goNaming = new GoDocumentNaming();
        this.config = config;
        this.naming = naming != null ? naming : goNaming;
        this.scopeResolver = scopeResolver != null ? scopeResolver : new IncludeScopeResolver(config.getModule(), goNaming);
        this.typeInspector = typeInspector;
        this.sourceReader = sourceReader != null ? sourceReader : new FileIdlSourceReader();
        this.renderer = renderer != null ? renderer : new FreemarkerTemplateRenderer();
    }

    public PatchResult patch(@NonNull DocumentForest forest) throws PatchException {
        log.info("Starting patch run into {}", config.getOutputPath());

        log.debug("Building templates...");
        renderer.preload();
        TypeInspector inspector = typeInspector != null ? typeInspector : new StructuralTypeInspector(forest);
        PatchHelpers helpers = buildHelpers(inspector);

        OutputPlanner planner = OutputPlanner.forRun(config);
        ImportFilter importFilter = ImportFilter.from(config);
        List<GeneratedFile> files = new ArrayList<>();

        int documents = 0;
        for (IdlDocument document : forest.depthFirst()) {
            try {
                patchDocument(document, helpers, planner, importFilter, files);
            } catch (PatchException e) {
                throw e.getDocument().isPresent() ? e : e.withDocument(document.getFilename());
            }
            documents++;
        }

        log.info("Patch run complete: {} documents, {} files, {} package directories",
                documents, files.size(), planner.getProtectedDirectoryCount());
        return PatchResult.builder()
                .files(files)
                .documentsProcessed(documents)
                .build();
    }

    private PatchHelpers buildHelpers(TypeInspector inspector) {
        FieldReorderer reorderer = new FieldReorderer(new FieldClassifier(inspector));
        EnvelopeExtractor envelopes = new EnvelopeExtractor(config.getEffectiveEnvelopeRules(), naming::unexport);
        return PatchHelpers.builder()
                .fieldReorderer(reorderer)
                .envelopeExtractor(envelopes)
                .typeInspector(inspector)
                .naming(naming)
                .version(config.getVersion())
                .generateFastApis(config.isGenerateFastApis())
                .build();
    }

    private void patchDocument(IdlDocument document,
                               PatchHelpers helpers,
                               OutputPlanner planner,
                               ImportFilter importFilter,
                               List<GeneratedFile> files) throws PatchException {
        log.info("Patching {}", document.getFilename());

        DocumentScope scope = scopeResolver.resolve(document);
        String pkgName = naming.packageName(document);
        if (pkgName == null || pkgName.isBlank()) {
            throw new ScopeResolutionException("no package name for namespace "
                    + document.getNamespaceOrReferenceName(GoDocumentNaming.LANGUAGE));
        }

        OutputPlan plan = planner.plan(naming.outputFile(document));
        if (plan.isProtectionNeeded()) {
            String protection = renderer.render(TemplateRenderer.PROTECTION_TEMPLATE,
                    new ProtectionContext(pkgName, config.getProtectionSymbol()));
            files.add(GeneratedFile.builder()
                    .path(plan.getProtectionPath())
                    .contents(protection)
                    .type(GeneratedFileType.PROTECTION)
                    .build());
        }

        Map<String, String> resolved = scope.resolveImports();
        if (resolved == null) {
            throw new ImportResolutionException("scope returned no imports");
        }
        Map<String, String> imports = importFilter.filter(resolved);
        log.debug("{}: {} of {} imports kept", document.getFilename(), imports.size(), resolved.size());

        RenderContext context = RenderContext.builder()
                .document(document)
                .pkgName(pkgName)
                .imports(imports)
                .helpers(helpers)
                .runtimeImport(config.getLegacyRuntimeImport())
                .protectionSymbol(config.getProtectionSymbol())
                .build();
        String contents = renderer.render(TemplateRenderer.FILE_TEMPLATE, context);
        files.add(GeneratedFile.builder()
                .path(plan.getTarget())
                .contents(contents)
                .type(GeneratedFileType.SOURCE)
                .build());

        if (config.isCopyIdl()) {
            Path copy = plan.getDirectory().resolve(Path.of(document.getFilename()).getFileName());
            files.add(GeneratedFile.builder()
                    .path(copy)
                    .contents(sourceReader.read(document))
                    .type(GeneratedFileType.IDL_COPY)
                    .build());
        }
    }
}
