package com.rpcstub.generator.codegen.render;

import com.rpcstub.generator.codegen.envelope.EnvelopeExtractor;
import com.rpcstub.generator.codegen.envelope.EnvelopeMatch;
import com.rpcstub.generator.codegen.exception.TypeClassificationException;
import com.rpcstub.generator.codegen.field.FieldReorderer;
import com.rpcstub.generator.codegen.resolve.DocumentNaming;
import com.rpcstub.generator.codegen.resolve.TypeInspector;
import com.rpcstub.generator.codegen.util.NamingUtil;
import com.rpcstub.generator.model.input.FieldRequiredness;
import com.rpcstub.generator.model.input.IdlDocument;
import com.rpcstub.generator.model.input.IdlField;
import com.rpcstub.generator.model.input.IdlType;
import com.rpcstub.generator.model.input.TypeCategory;
import lombok.Builder;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Functions exposed to templates as {@code helpers}.
 *
 * Computed fresh on every call; nothing is cached between documents or runs.
 */
@Builder
public class PatchHelpers {

    @NonNull
    private final FieldReorderer fieldReorderer;

    @NonNull
    private final EnvelopeExtractor envelopeExtractor;

    @NonNull
    private final TypeInspector typeInspector;

    @NonNull
    private final DocumentNaming naming;

    @NonNull
    private final String version;

    private final boolean generateFastApis;

    public List<IdlField> reorderStructFields(List<IdlField> fields) throws TypeClassificationException {
        return fieldReorderer.reorder(fields);
    }

    public EnvelopeMatch filterBase(IdlDocument document) {
        return envelopeExtractor.extract(document);
    }

    public boolean isBinaryOrStringType(IdlType type) throws TypeClassificationException {
        return typeInspector.isBinary(type) || typeInspector.isString(type);
    }

    public String typeIdToGoType(String typeId) {
        return PrimitiveTypeMapper.toGoType(typeId);
    }

    /**
     * Thrift wire type constant of a type, following typedefs.
     */
    public String wireType(IdlType type) throws TypeClassificationException {
        return resolveTypedef(type).getCategory().getWireType();
    }

    /**
     * Whether the generated Go field is a pointer that must be dereferenced before encoding:
     * optional scalars and enums are, optional binaries, containers and structs are not.
     */
    public boolean isOptionalPointer(IdlField field) throws TypeClassificationException {
        if (field.getRequiredness() != FieldRequiredness.OPTIONAL) {
            return false;
        }
        TypeCategory category = resolveTypedef(field.getType()).getCategory();
        return category == TypeCategory.ENUM
                || (category.isBaseType() && category != TypeCategory.BINARY);
    }

    /**
     * Package names the generated file must reference once: the alias when present,
     * otherwise the lower-cased last path segment. Sorted.
     */
    public List<String> toPackageNames(Map<String, String> imports) {
        List<String> names = new ArrayList<>(imports.size());
        for (Map.Entry<String, String> entry : imports.entrySet()) {
            String alias = entry.getValue();
            if (alias != null && !alias.isEmpty()) {
                names.add(alias);
            } else {
                names.add(NamingUtil.lastPathSegment(entry.getKey()).toLowerCase(Locale.ROOT));
            }
        }
        Collections.sort(names);
        return names;
    }

    public String exportName(String name) {
        return naming.export(name);
    }

    private static IdlType resolveTypedef(IdlType type) throws TypeClassificationException {
        IdlType current = type;
        for (int depth = 0; current.getCategory() == TypeCategory.TYPEDEF; depth++) {
            if (current.getValueType() == null || depth > 32) {
                throw new TypeClassificationException("cannot resolve typedef " + type.getName());
            }
            current = current.getValueType();
        }
        return current;
    }

    public String getVersion() {
        return version;
    }

    public boolean isGenerateFastApis() {
        return generateFastApis;
    }
}
