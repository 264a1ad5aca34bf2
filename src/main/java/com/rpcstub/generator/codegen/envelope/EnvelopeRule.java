package com.rpcstub.generator.codegen.envelope;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * A field named {@code fieldName} (after unexporting) whose declared type is exactly
 * {@code typeName} marks its record as having {@code role}.
 */
@Value
public class EnvelopeRule {

    @NonNull
    String fieldName;

    @NonNull
    String typeName;

    @NonNull
    EnvelopeRole role;

    public static final EnvelopeRule BASE = new EnvelopeRule("base", "base.Base", EnvelopeRole.REQUEST);

    public static final EnvelopeRule BASE_RESP = new EnvelopeRule("baseResp", "base.BaseResp", EnvelopeRole.RESPONSE);

    public static List<EnvelopeRule> defaults() {
        return List.of(BASE, BASE_RESP);
    }

    boolean matches(String normalizedFieldName, String declaredTypeName) {
        return fieldName.equals(normalizedFieldName) && typeName.equals(declaredTypeName);
    }
}
