package com.rpcstub.generator.model.input;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One parsed IDL file.
 *
 * Equality is identity so documents can be tracked in visit sets even when
 * two files happen to have the same contents.
 */
@Getter
@Builder(toBuilder = true)
@ToString(of = "filename")
public final class IdlDocument {

    /**
     * Path of the IDL source (e.g. "idl/user.thrift").
     */
    @NonNull
    private final String filename;

    /**
     * Namespace per target language, e.g. "go" -> "example.user".
     */
    @NonNull
    @Singular("namespace")
    private final Map<String, String> namespaces;

    /**
     * Struct-like declarations in declaration order.
     */
    @NonNull
    @Singular("record")
    private final List<IdlRecord> records;

    /**
     * Documents this one includes.
     */
    @NonNull
    @Singular("include")
    private final List<IdlDocument> includes;

    public Optional<String> getNamespace(String language) {
        return Optional.ofNullable(namespaces.get(language));
    }

    /**
     * Reference name used by other documents: the file name without directory and extension.
     */
    public String getReferenceName() {
        String base = filename;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }

    /**
     * Namespace for the language, falling back to the reference name, as the Thrift compiler does.
     */
    public String getNamespaceOrReferenceName(String language) {
        return getNamespace(language).orElseGet(this::getReferenceName);
    }
}
