package com.rpcstub.generator.model.input;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * A named aggregate (struct, union or exception) owned by one document.
 *
 * Equality is identity: two records with identical shape in different
 * documents are still different declarations.
 */
@Getter
@Builder(toBuilder = true)
@ToString(of = {"name", "kind"})
public final class IdlRecord {

    @NonNull
    private final String name;

    @NonNull
    @Builder.Default
    private final RecordKind kind = RecordKind.STRUCT;

    /**
     * Fields in declaration order.
     */
    @NonNull
    @Singular("field")
    private final List<IdlField> fields;
}
