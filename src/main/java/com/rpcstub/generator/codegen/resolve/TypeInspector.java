package com.rpcstub.generator.codegen.resolve;

import com.rpcstub.generator.codegen.exception.TypeClassificationException;
import com.rpcstub.generator.model.input.IdlType;

/**
 * Type questions answered by the IDL type checker.
 */
public interface TypeInspector {

    /**
     * Whether the encoded length of the type is known statically: true for fixed-size
     * scalars and enums, false for strings, binaries, containers and unions, and for
     * structs only when every field is itself fixed length.
     *
     * @throws TypeClassificationException if the type cannot be resolved or refers back to itself
     */
    boolean isFixedLength(IdlType type) throws TypeClassificationException;

    boolean isBinary(IdlType type) throws TypeClassificationException;

    boolean isString(IdlType type) throws TypeClassificationException;
}
