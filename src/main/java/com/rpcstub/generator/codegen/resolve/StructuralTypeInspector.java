package com.rpcstub.generator.codegen.resolve;

import com.rpcstub.generator.codegen.exception.TypeClassificationException;
import com.rpcstub.generator.model.input.DocumentForest;
import com.rpcstub.generator.model.input.IdlDocument;
import com.rpcstub.generator.model.input.IdlField;
import com.rpcstub.generator.model.input.IdlRecord;
import com.rpcstub.generator.model.input.IdlType;
import com.rpcstub.generator.model.input.RecordKind;
import com.rpcstub.generator.model.input.TypeCategory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Answers type questions by walking the record declarations of a forest.
 *
 * Struct references are looked up by qualified name ({@code base.Base}) or, when the
 * unqualified name is declared exactly once in the forest, by plain name.
 */
public class StructuralTypeInspector implements TypeInspector {

    private final Map<String, IdlRecord> qualified = new HashMap<>();
    private final Map<String, IdlRecord> unqualified = new HashMap<>();
    private final Set<String> ambiguous = new HashSet<>();

    public StructuralTypeInspector(DocumentForest forest) {
        for (IdlDocument document : forest.depthFirst()) {
            for (IdlRecord record : document.getRecords()) {
                qualified.put(document.getReferenceName() + "." + record.getName(), record);
                if (unqualified.putIfAbsent(record.getName(), record) != null) {
                    ambiguous.add(record.getName());
                }
            }
        }
        ambiguous.forEach(unqualified::remove);
    }

    @Override
    public boolean isFixedLength(IdlType type) throws TypeClassificationException {
        return isFixedLength(type, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private boolean isFixedLength(IdlType type, Set<IdlRecord> inProgress) throws TypeClassificationException {
        return switch (type.getCategory()) {
            case BOOL, BYTE, I16, I32, I64, DOUBLE, ENUM -> true;
            case STRING, BINARY, LIST, SET, MAP, UNION -> false;
            case TYPEDEF -> isFixedLength(typedefTarget(type), inProgress);
            case STRUCT, EXCEPTION -> isRecordFixedLength(lookup(type), inProgress);
        };
    }

    private boolean isRecordFixedLength(IdlRecord record, Set<IdlRecord> inProgress) throws TypeClassificationException {
        if (record.getKind() == RecordKind.UNION) {
            return false;
        }
        if (!inProgress.add(record)) {
            throw new TypeClassificationException("self-referential type " + record.getName());
        }
        try {
            for (IdlField field : record.getFields()) {
                if (!isFixedLength(field.getType(), inProgress)) {
                    return false;
                }
            }
            return true;
        } finally {
            inProgress.remove(record);
        }
    }

    @Override
    public boolean isBinary(IdlType type) throws TypeClassificationException {
        return resolveTypedefs(type).getCategory() == TypeCategory.BINARY;
    }

    @Override
    public boolean isString(IdlType type) throws TypeClassificationException {
        return resolveTypedefs(type).getCategory() == TypeCategory.STRING;
    }

    private IdlType resolveTypedefs(IdlType type) throws TypeClassificationException {
        IdlType current = type;
        Set<IdlType> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        while (current.getCategory() == TypeCategory.TYPEDEF) {
            if (!seen.add(current)) {
                throw new TypeClassificationException("cyclic typedef " + type.getName());
            }
            current = typedefTarget(current);
        }
        return current;
    }

    private IdlType typedefTarget(IdlType typedef) throws TypeClassificationException {
        if (typedef.getValueType() == null) {
            throw new TypeClassificationException("typedef " + typedef.getName() + " has no target type");
        }
        return typedef.getValueType();
    }

    private IdlRecord lookup(IdlType type) throws TypeClassificationException {
        IdlRecord record = qualified.get(type.getName());
        if (record == null) {
            record = unqualified.get(type.getName());
        }
        if (record == null) {
            String reason = ambiguous.contains(type.getName()) ? "ambiguous" : "unknown";
            throw new TypeClassificationException(reason + " type " + type.getName());
        }
        return record;
    }
}
