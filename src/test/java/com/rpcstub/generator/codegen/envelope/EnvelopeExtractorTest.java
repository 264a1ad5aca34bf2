package com.rpcstub.generator.codegen.envelope;

import com.rpcstub.generator.codegen.resolve.GoDocumentNaming;
import com.rpcstub.generator.model.input.IdlDocument;
import com.rpcstub.generator.model.input.IdlRecord;
import com.rpcstub.generator.model.input.IdlType;
import com.rpcstub.generator.model.input.TypeCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.rpcstub.generator.IdlFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for envelope field matching.
 */
class EnvelopeExtractorTest {

    private final GoDocumentNaming naming = new GoDocumentNaming();
    private final EnvelopeExtractor extractor = new EnvelopeExtractor(EnvelopeRule.defaults(), naming::unexport);

    private static IdlRecord record(String name, String fieldName, IdlType type) {
        return IdlRecord.builder().name(name).field(field(1, "id", I64)).field(field(255, fieldName, type)).build();
    }

    @Test
    void testRequestAndResponseRecordsMatched() {
        IdlDocument document = userService(baseDocument());

        EnvelopeMatch match = extractor.extract(document);

        assertThat(match.getRequests()).extracting(IdlRecord::getName).containsExactly("GetUserRequest");
        assertThat(match.getResponses()).extracting(IdlRecord::getName).containsExactly("GetUserResponse");
    }

    @Test
    void testFieldNameIsNormalisedBeforeComparison() {
        IdlDocument document = document("a.thrift", "a",
                record("Lower", "base", BASE),
                record("Exported", "Base", BASE),
                record("Snake", "base_resp", BASE_RESP));

        EnvelopeMatch match = extractor.extract(document);

        assertThat(match.getRequests()).extracting(IdlRecord::getName).containsExactly("Lower", "Exported");
        assertThat(match.getResponses()).extracting(IdlRecord::getName).containsExactly("Snake");
    }

    @Test
    void testTypeNameMustMatchExactly() {
        IdlDocument document = document("a.thrift", "a",
                record("Unqualified", "base", IdlType.ref("Base", TypeCategory.STRUCT)),
                record("OtherPackage", "base", IdlType.ref("common.Base", TypeCategory.STRUCT)),
                record("Swapped", "base", BASE_RESP),
                record("Scalar", "base", STRING_TYPE));

        EnvelopeMatch match = extractor.extract(document);

        assertThat(match.isEmpty()).isTrue();
    }

    @Test
    void testNameMatchIsCaseSensitiveAndWhole() {
        IdlDocument document = document("a.thrift", "a",
                record("Shouting", "BASE", BASE),
                record("Longer", "baseline", BASE),
                record("Prefixed", "myBase", BASE));

        assertThat(extractor.extract(document).isEmpty()).isTrue();
    }

    @Test
    void testRecordWithBothRolesAppearsInBoth() {
        IdlRecord both = IdlRecord.builder()
                .name("Relay")
                .field(field(1, "Base", BASE))
                .field(field(2, "BaseResp", BASE_RESP))
                .build();

        EnvelopeMatch match = extractor.extract(document("a.thrift", "a", both));

        assertThat(match.getRequests()).containsExactly(both);
        assertThat(match.getResponses()).containsExactly(both);
    }

    @Test
    void testRecordListedOncePerRole() {
        IdlRecord twice = IdlRecord.builder()
                .name("Twice")
                .field(field(1, "base", BASE))
                .field(field(2, "Base", BASE))
                .build();

        EnvelopeMatch match = extractor.extract(document("a.thrift", "a", twice));

        assertThat(match.getRequests()).containsExactly(twice);
    }

    @Test
    void testDeclarationOrderKept() {
        IdlDocument document = document("a.thrift", "a",
                record("C", "base", BASE),
                record("A", "base", BASE),
                record("B", "base", BASE));

        assertThat(extractor.extract(document).getRequests())
                .extracting(IdlRecord::getName)
                .containsExactly("C", "A", "B");
    }

    @Test
    void testCustomRuleTable() {
        EnvelopeRule trace = new EnvelopeRule("trace", "common.Trace", EnvelopeRole.REQUEST);
        EnvelopeExtractor custom = new EnvelopeExtractor(List.of(trace), naming::unexport);
        IdlDocument document = document("a.thrift", "a",
                record("Traced", "Trace", IdlType.ref("common.Trace", TypeCategory.STRUCT)),
                record("Based", "base", BASE));

        EnvelopeMatch match = custom.extract(document);

        assertThat(match.getRequests()).extracting(IdlRecord::getName).containsExactly("Traced");
        assertThat(match.getResponses()).isEmpty();
    }
}
