package com.rpcstub.generator.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One field of a record. Immutable once parsed.
 */
@Value
@Builder(toBuilder = true)
public class IdlField {

    /**
     * Wire field id.
     */
    int id;

    /**
     * Field name as declared in the IDL (e.g. "Base", "baseResp", "user_id").
     */
    @NonNull
    String name;

    @NonNull
    IdlType type;

    @NonNull
    @Builder.Default
    FieldRequiredness requiredness = FieldRequiredness.DEFAULT;
}
