package org.carball.sentinel.signature;

/**
 * Stable identifier shared by all executions of structurally identical SQL.
 */
public record Signature(String value) {

    public Signature {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Signature value must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
