package com.rpcstub.generator.codegen.envelope;

import com.rpcstub.generator.model.input.IdlDocument;
import com.rpcstub.generator.model.input.IdlField;
import com.rpcstub.generator.model.input.IdlRecord;
import lombok.NonNull;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Finds records whose fields match an envelope rule by name and exact type name.
 *
 * Matching is purely conventional: a project that names its envelope fields differently
 * gets no matches. A record is listed at most once per role even when several of its
 * fields match the same role.
 */
public class EnvelopeExtractor {

    private final List<EnvelopeRule> rules;
    private final UnaryOperator<String> unexport;

    public EnvelopeExtractor(@NonNull List<EnvelopeRule> rules, @NonNull UnaryOperator<String> unexport) {
        this.rules = List.copyOf(rules);
        this.unexport = unexport;
    }

    public EnvelopeMatch extract(IdlDocument document) {
        EnvelopeMatch.EnvelopeMatchBuilder match = EnvelopeMatch.builder();
        Set<IdlRecord> requests = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<IdlRecord> responses = Collections.newSetFromMap(new IdentityHashMap<>());

        for (IdlRecord record : document.getRecords()) {
            for (IdlField field : record.getFields()) {
                String name = unexport.apply(field.getName());
                String typeName = field.getType().getName();
                for (EnvelopeRule rule : rules) {
                    if (!rule.matches(name, typeName)) {
                        continue;
                    }
                    if (rule.getRole() == EnvelopeRole.REQUEST) {
                        if (requests.add(record)) {
                            match.request(record);
                        }
                    } else if (responses.add(record)) {
                        match.response(record);
                    }
                }
            }
        }
        return match.build();
    }
}
