package com.rpcstub.generator.codegen.field;

import com.rpcstub.generator.codegen.exception.TypeClassificationException;
import com.rpcstub.generator.codegen.resolve.TypeInspector;
import com.rpcstub.generator.model.input.IdlField;
import com.rpcstub.generator.model.input.IdlType;
import com.rpcstub.generator.model.input.TypeCategory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.rpcstub.generator.IdlFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the stable fixed-first field partition.
 */
class FieldReordererTest {

    /**
     * Base types answer directly; anything else is variable width.
     */
    private static final TypeInspector SCALARS = new TypeInspector() {
        @Override
        public boolean isFixedLength(IdlType type) {
            return type.getCategory().isBaseType()
                    && type.getCategory() != TypeCategory.STRING
                    && type.getCategory() != TypeCategory.BINARY;
        }

        @Override
        public boolean isBinary(IdlType type) {
            return type.getCategory() == TypeCategory.BINARY;
        }

        @Override
        public boolean isString(IdlType type) {
            return type.getCategory() == TypeCategory.STRING;
        }
    };

    private final FieldReorderer reorderer = new FieldReorderer(new FieldClassifier(SCALARS));

    private static List<String> names(List<IdlField> fields) {
        return fields.stream().map(IdlField::getName).collect(Collectors.toList());
    }

    @Test
    void testFixedWidthFieldsMoveFirst() throws Exception {
        List<IdlField> reordered = reorderer.reorder(user().getFields());

        assertThat(names(reordered)).containsExactly("id", "active", "name");
    }

    @Test
    void testOrderWithinEachClassIsPreserved() throws Exception {
        List<IdlField> fields = List.of(
                field(1, "s1", STRING_TYPE),
                field(2, "f1", I64),
                field(3, "b1", BINARY),
                field(4, "f2", BOOL),
                field(5, "s2", STRING_TYPE),
                field(6, "f3", DOUBLE_TYPE));

        List<IdlField> reordered = reorderer.reorder(fields);

        assertThat(names(reordered)).containsExactly("f1", "f2", "f3", "s1", "b1", "s2");
    }

    @Test
    void testReorderIsIdempotent() throws Exception {
        List<IdlField> fields = List.of(
                field(1, "tags", IdlType.listOf(STRING_TYPE)),
                field(2, "score", DOUBLE_TYPE),
                field(3, "name", STRING_TYPE),
                field(4, "id", I64));

        List<IdlField> once = reorderer.reorder(fields);
        List<IdlField> twice = reorderer.reorder(once);

        assertThat(twice).containsExactlyElementsOf(once);
    }

    @Test
    void testEveryFixedFieldPrecedesEveryVariableField() throws Exception {
        List<IdlField> fields = new ArrayList<>();
        IdlType[] pool = {I64, STRING_TYPE, BOOL, BINARY, I32, IdlType.mapOf(STRING_TYPE, I64), DOUBLE_TYPE};
        for (int i = 0; i < 40; i++) {
            fields.add(field(i + 1, "f" + i, pool[(i * 5 + 3) % pool.length]));
        }

        List<IdlField> reordered = reorderer.reorder(fields);

        int lastFixed = -1;
        int firstVariable = reordered.size();
        for (int i = 0; i < reordered.size(); i++) {
            if (SCALARS.isFixedLength(reordered.get(i).getType())) {
                lastFixed = i;
            } else if (firstVariable == reordered.size()) {
                firstVariable = i;
            }
        }
        assertThat(lastFixed).isLessThan(firstVariable);
        assertThat(reordered).containsExactlyInAnyOrderElementsOf(fields);
    }

    @Test
    void testInputListIsNotModified() throws Exception {
        List<IdlField> fields = new ArrayList<>(user().getFields());

        reorderer.reorder(fields);

        assertThat(names(fields)).containsExactly("id", "name", "active");
    }

    @Test
    void testEmptyRecord() throws Exception {
        assertThat(reorderer.reorder(List.of())).isEmpty();
    }

    @Test
    void testClassificationFailureFailsWholeReorder() {
        TypeInspector failing = new TypeInspector() {
            @Override
            public boolean isFixedLength(IdlType type) throws TypeClassificationException {
                if (type.getCategory() == TypeCategory.STRUCT) {
                    throw new TypeClassificationException("self-referential type " + type.getName());
                }
                return true;
            }

            @Override
            public boolean isBinary(IdlType type) {
                return false;
            }

            @Override
            public boolean isString(IdlType type) {
                return false;
            }
        };
        FieldReorderer failingReorderer = new FieldReorderer(new FieldClassifier(failing));
        List<IdlField> fields = List.of(
                field(1, "id", I64),
                field(2, "next", IdlType.ref("Node", TypeCategory.STRUCT)));

        assertThatThrownBy(() -> failingReorderer.reorder(fields))
                .isInstanceOf(TypeClassificationException.class)
                .hasMessageContaining("Node");
    }

    @Test
    void testClassifier() throws Exception {
        FieldClassifier classifier = new FieldClassifier(SCALARS);

        assertThat(classifier.classify(field(1, "id", I64))).isEqualTo(EncodingClass.FIXED_WIDTH);
        assertThat(classifier.classify(field(2, "name", STRING_TYPE))).isEqualTo(EncodingClass.VARIABLE_WIDTH);
    }
}
