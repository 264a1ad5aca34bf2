package com.rpcstub.generator.codegen.field;

import com.rpcstub.generator.codegen.exception.TypeClassificationException;
import com.rpcstub.generator.model.input.IdlField;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Moves fixed-width fields ahead of variable-width ones so the encoder can write them
 * at known offsets. The partition is stable: declaration order is kept within each class.
 */
@RequiredArgsConstructor
public class FieldReorderer {

    @NonNull
    private final FieldClassifier classifier;

    /**
     * Returns a new list; the input is left untouched. Every field is classified before
     * anything is returned, so a classification failure yields no partial ordering.
     */
    public List<IdlField> reorder(List<IdlField> fields) throws TypeClassificationException {
        List<IdlField> fixed = new ArrayList<>(fields.size());
        List<IdlField> variable = new ArrayList<>();
        for (IdlField field : fields) {
            if (classifier.classify(field) == EncodingClass.FIXED_WIDTH) {
                fixed.add(field);
            } else {
                variable.add(field);
            }
        }
        fixed.addAll(variable);
        return Collections.unmodifiableList(fixed);
    }
}
