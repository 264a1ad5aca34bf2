package com.rpcstub.generator.codegen.render;

import lombok.experimental.UtilityClass;

import java.util.Map;

/**
 * Go type for each Thrift base type id.
 */
@UtilityClass
public class PrimitiveTypeMapper {

    private static final Map<String, String> TYPE_ID_TO_GO_TYPE = Map.of(
            "Bool", "bool",
            "Byte", "int8",
            "I16", "int16",
            "I32", "int32",
            "I64", "int64",
            "Double", "float64",
            "String", "string",
            "Binary", "[]byte"
    );

    /**
     * @return the Go type, or an empty string for ids that are not base types
     */
    public static String toGoType(String typeId) {
        if (typeId == null) {
            return "";
        }
        return TYPE_ID_TO_GO_TYPE.getOrDefault(typeId, "");
    }
}
