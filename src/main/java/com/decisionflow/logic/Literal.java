package com.decisionflow.logic;

import java.util.Objects;

/**
 * Identifier tagged with the truth value it must take.
 *
 * @param name     Identifier name
 * @param positive true if the identifier must evaluate to true
 */
public record Literal(String name, boolean positive) {

    public Literal {
        Objects.requireNonNull(name, "Literal name cannot be null");
    }

    public static Literal positive(String name) {
        return new Literal(name, true);
    }

    public static Literal negative(String name) {
        return new Literal(name, false);
    }

    /**
     * Same identifier, opposite polarity.
     */
    public Literal negate() {
        return new Literal(name, !positive);
    }

    @Override
    public String toString() {
        return positive ? name : "NOT " + name;
    }
}
