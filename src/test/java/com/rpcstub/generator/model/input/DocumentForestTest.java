package com.rpcstub.generator.model.input;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DocumentForest traversal.
 */
class DocumentForestTest {

    private static IdlDocument doc(String name, IdlDocument... includes) {
        IdlDocument.IdlDocumentBuilder builder = IdlDocument.builder().filename(name);
        for (IdlDocument include : includes) {
            builder.include(include);
        }
        return builder.build();
    }

    @Test
    void testSharedDependencyVisitedOnce() {
        IdlDocument d = doc("d.thrift");
        IdlDocument a = doc("a.thrift", d);
        IdlDocument b = doc("b.thrift", d);
        IdlDocument root = doc("root.thrift", a, b);

        List<IdlDocument> order = DocumentForest.of(root).depthFirst();

        assertThat(order).containsExactly(root, a, d, b);
    }

    @Test
    void testDependencyReachableFromTwoRootsVisitedOnce() {
        IdlDocument d = doc("d.thrift");
        IdlDocument a = doc("a.thrift", d);
        IdlDocument b = doc("b.thrift", d);

        List<IdlDocument> order = DocumentForest.of(a, b).depthFirst();

        assertThat(order).containsExactly(a, d, b);
    }

    @Test
    void testRootListedTwiceVisitedOnce() {
        IdlDocument a = doc("a.thrift");

        assertThat(DocumentForest.of(a, a).depthFirst()).containsExactly(a);
    }

    @Test
    void testDocumentsWithSameContentAreDistinct() {
        IdlDocument first = doc("same.thrift");
        IdlDocument second = doc("same.thrift");

        assertThat(DocumentForest.of(first, second).depthFirst()).hasSize(2);
    }

    @Test
    void testReferenceNameStripsDirectoryAndExtension() {
        IdlDocument document = doc("idl/shared/base.thrift");

        assertThat(document.getReferenceName()).isEqualTo("base");
        assertThat(document.getNamespaceOrReferenceName("go")).isEqualTo("base");
    }
}
