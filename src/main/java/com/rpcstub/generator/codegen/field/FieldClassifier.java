package com.rpcstub.generator.codegen.field;

import com.rpcstub.generator.codegen.exception.TypeClassificationException;
import com.rpcstub.generator.codegen.resolve.TypeInspector;
import com.rpcstub.generator.model.input.IdlField;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Classifies fields by encoding width using the type checker's fixed-length predicate.
 */
@RequiredArgsConstructor
public class FieldClassifier {

    @NonNull
    private final TypeInspector typeInspector;

    public EncodingClass classify(IdlField field) throws TypeClassificationException {
        return typeInspector.isFixedLength(field.getType())
                ? EncodingClass.FIXED_WIDTH
                : EncodingClass.VARIABLE_WIDTH;
    }
}
