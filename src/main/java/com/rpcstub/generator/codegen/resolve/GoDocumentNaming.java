package com.rpcstub.generator.codegen.resolve;

import com.rpcstub.generator.codegen.exception.ScopeResolutionException;
import com.rpcstub.generator.codegen.util.NamingUtil;
import com.rpcstub.generator.model.input.IdlDocument;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Go naming: namespace "a.b.c" lives in directory a/b/c as package c, and
 * document "user.thrift" generates "user.go".
 */
public class GoDocumentNaming implements DocumentNaming {

    public static final String LANGUAGE = "go";

    @Override
    public String packageName(IdlDocument document) {
        return NamingUtil.toPackageName(document.getNamespaceOrReferenceName(LANGUAGE));
    }

    /**
     * Slash-separated directory of the document's package, relative to the output root.
     */
    public String packagePath(IdlDocument document) {
        String namespace = document.getNamespaceOrReferenceName(LANGUAGE);
        StringBuilder sb = new StringBuilder();
        for (String segment : namespace.split("[./]")) {
            if (segment.isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(NamingUtil.toPackageName(segment));
        }
        return sb.toString();
    }

    @Override
    public Path outputFile(IdlDocument document) throws ScopeResolutionException {
        String packagePath = packagePath(document);
        if (packagePath.isEmpty()) {
            throw new ScopeResolutionException("empty go namespace for " + document.getFilename());
        }
        String fileName = document.getReferenceName().toLowerCase(Locale.ROOT) + ".go";
        return Path.of(packagePath).resolve(fileName);
    }

    @Override
    public String unexport(String name) {
        return NamingUtil.toCamelCase(name);
    }

    @Override
    public String export(String name) {
        return NamingUtil.toPascalCase(name);
    }
}
