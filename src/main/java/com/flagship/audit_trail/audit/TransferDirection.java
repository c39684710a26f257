package com.flagship.audit_trail.audit;

/**
 * Side of a document transfer between two matters.
 */
public enum TransferDirection {
    FROM("from"),
    TO("to");

    private final String preposition;

    TransferDirection(String preposition) {
        this.preposition = preposition;
    }

    public String getPreposition() {
        return preposition;
    }

    public TransferDirection opposite() {
        return this == FROM ? TO : FROM;
    }
}
