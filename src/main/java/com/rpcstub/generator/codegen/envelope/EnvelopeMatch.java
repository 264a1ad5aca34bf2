package com.rpcstub.generator.codegen.envelope;

import com.rpcstub.generator.model.input.IdlRecord;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Records of one document that carry request or response envelope fields,
 * in declaration order.
 */
@Value
@Builder
public class EnvelopeMatch {

    @NonNull
    @Singular("request")
    List<IdlRecord> requests;

    @NonNull
    @Singular("response")
    List<IdlRecord> responses;

    public boolean isEmpty() {
        return requests.isEmpty() && responses.isEmpty();
    }
}
