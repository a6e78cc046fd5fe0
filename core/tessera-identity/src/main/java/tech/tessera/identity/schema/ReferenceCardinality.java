package tech.tessera.identity.schema;

public enum ReferenceCardinality {
    SINGLE,
    MULTIPLE
}
