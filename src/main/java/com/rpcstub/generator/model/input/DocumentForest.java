package com.rpcstub.generator.model.input;

import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * The documents of one compilation, reachable from a set of roots through includes.
 */
public class DocumentForest {

    private final List<IdlDocument> roots;

    public DocumentForest(@NonNull List<IdlDocument> roots) {
        this.roots = List.copyOf(roots);
    }

    public static DocumentForest of(IdlDocument... roots) {
        return new DocumentForest(List.of(roots));
    }

    public List<IdlDocument> getRoots() {
        return roots;
    }

    /**
     * Pre-order depth-first walk: a document comes before the documents it includes,
     * and every document appears exactly once no matter how many others include it.
     */
    public List<IdlDocument> depthFirst() {
        Set<IdlDocument> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        List<IdlDocument> order = new ArrayList<>();
        for (IdlDocument root : roots) {
            visit(root, visited, order);
        }
        return Collections.unmodifiableList(order);
    }

    private void visit(IdlDocument document, Set<IdlDocument> visited, List<IdlDocument> order) {
        if (!visited.add(document)) {
            return;
        }
        order.add(document);
        for (IdlDocument include : document.getIncludes()) {
            visit(include, visited, order);
        }
    }
}
