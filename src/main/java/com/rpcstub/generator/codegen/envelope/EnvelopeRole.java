package com.rpcstub.generator.codegen.envelope;

/**
 * Role a record plays when it carries an envelope field.
 */
public enum EnvelopeRole {
    REQUEST,
    RESPONSE
}
