package com.rpcstub.generator.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Locale;

/**
 * Declared type of a field as produced by the IDL parser.
 *
 * Pure structure only: fixed-width and string/binary questions are answered
 * by a {@link com.rpcstub.generator.codegen.resolve.TypeInspector}.
 */
@Value
@Builder(toBuilder = true)
public class IdlType {

    /**
     * Declared name. Base types use their keyword ({@code i64}), references
     * use the qualified form ({@code base.Base}).
     */
    @NonNull
    String name;

    @NonNull
    TypeCategory category;

    /**
     * Key type for maps.
     */
    IdlType keyType;

    /**
     * Element type for lists and sets, value type for maps, target type for typedefs.
     */
    IdlType valueType;

    public static IdlType of(TypeCategory category) {
        return IdlType.builder()
                .name(category.name().toLowerCase(Locale.ROOT))
                .category(category)
                .build();
    }

    public static IdlType ref(String name, TypeCategory category) {
        return IdlType.builder().name(name).category(category).build();
    }

    public static IdlType listOf(IdlType element) {
        return IdlType.builder()
                .name("list<" + element.getName() + ">")
                .category(TypeCategory.LIST)
                .valueType(element)
                .build();
    }

    public static IdlType setOf(IdlType element) {
        return IdlType.builder()
                .name("set<" + element.getName() + ">")
                .category(TypeCategory.SET)
                .valueType(element)
                .build();
    }

    public static IdlType mapOf(IdlType key, IdlType value) {
        return IdlType.builder()
                .name("map<" + key.getName() + "," + value.getName() + ">")
                .category(TypeCategory.MAP)
                .keyType(key)
                .valueType(value)
                .build();
    }
}
