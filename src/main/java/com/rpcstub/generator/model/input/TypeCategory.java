package com.rpcstub.generator.model.input;

/**
 * Thrift type categories as seen by the generator.
 *
 * The type id is the name the generated code uses for the wire type
 * (e.g. {@code WriteI64}, {@code thrift.I64}).
 */
public enum TypeCategory {
    BOOL("Bool", "BOOL"),
    BYTE("Byte", "BYTE"),
    I16("I16", "I16"),
    I32("I32", "I32"),
    I64("I64", "I64"),
    DOUBLE("Double", "DOUBLE"),
    STRING("String", "STRING"),
    BINARY("Binary", "STRING"),
    ENUM("I32", "I32"),
    LIST("List", "LIST"),
    SET("Set", "SET"),
    MAP("Map", "MAP"),
    STRUCT("Struct", "STRUCT"),
    UNION("Struct", "STRUCT"),
    EXCEPTION("Struct", "STRUCT"),
    TYPEDEF("Typedef", null);

    private final String typeId;
    private final String wireType;

    TypeCategory(String typeId, String wireType) {
        this.typeId = typeId;
        this.wireType = wireType;
    }

    public String getTypeId() {
        return typeId;
    }

    /**
     * Thrift wire type constant name; null for typedefs, which take their target's.
     */
    public String getWireType() {
        return wireType;
    }

    public boolean isBaseType() {
        return switch (this) {
            case BOOL, BYTE, I16, I32, I64, DOUBLE, STRING, BINARY -> true;
            default -> false;
        };
    }

    public boolean isContainer() {
        return this == LIST || this == SET || this == MAP;
    }

    /**
     * Struct-like categories are resolved by name against the declaring documents.
     */
    public boolean isStructLike() {
        return this == STRUCT || this == UNION || this == EXCEPTION;
    }
}
