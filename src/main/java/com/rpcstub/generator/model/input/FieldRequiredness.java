package com.rpcstub.generator.model.input;

public enum FieldRequiredness {
    DEFAULT,
    REQUIRED,
    OPTIONAL
}
