package com.rpcstub.generator.codegen.resolve;

import com.rpcstub.generator.codegen.util.NamingUtil;
import com.rpcstub.generator.model.input.IdlDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a document's imports from its includes, the way the Go Thrift generator lays out packages.
 *
 * The result also carries the imports every generated Thrift file starts with (the standard
 * library packages and the Thrift runtime), which is what the import filter later prunes.
 */
public class IncludeScopeResolver implements ScopeResolver {

    private static final Logger log = LoggerFactory.getLogger(IncludeScopeResolver.class);

    static final List<String> BASE_IMPORTS = List.of(
            "bytes",
            "context",
            "fmt",
            "strings",
            "github.com/apache/thrift/lib/go/thrift"
    );

    private final String importBase;
    private final GoDocumentNaming naming;

    /**
     * @param importBase import path of the output root, e.g. "example.com/mod/kitex_gen"
     */
    public IncludeScopeResolver(String importBase, GoDocumentNaming naming) {
        this.importBase = importBase == null ? "" : importBase;
        this.naming = naming;
    }

    @Override
    public DocumentScope resolve(IdlDocument document) {
        String ownPath = importPathOf(document);
        return () -> {
            Map<String, String> imports = new LinkedHashMap<>();
            for (String base : BASE_IMPORTS) {
                imports.put(base, "");
            }
            for (IdlDocument include : document.getIncludes()) {
                String path = importPathOf(include);
                if (path.equals(ownPath)) {
                    continue;
                }
                String pkg = naming.packageName(include);
                String alias = pkg.equals(NamingUtil.lastPathSegment(path)) ? "" : pkg;
                imports.put(path, alias);
            }
            log.debug("Resolved {} imports for {}", imports.size(), document.getFilename());
            return imports;
        };
    }

    private String importPathOf(IdlDocument document) {
        String packagePath = naming.packagePath(document);
        return importBase.isEmpty() ? packagePath : importBase + "/" + packagePath;
    }
}
