package com.decisionflow.logic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Disjunctive normal form: a disjunction of conjunctive terms.
 * Term order only affects rendering but is kept stable across runs.
 *
 * @param terms Terms, in derivation order
 */
public record Dnf(List<Term> terms) {

    /**
     * No terms (logical false, no approvable path).
     */
    public static final Dnf FALSE = new Dnf(List.of());

    /**
     * Single empty term (logical true).
     */
    public static final Dnf TRUE = new Dnf(List.of(Term.EMPTY));

    public Dnf {
        terms = List.copyOf(terms);
    }

    public static Dnf of(Term... terms) {
        return new Dnf(List.of(terms));
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public int size() {
        return terms.size();
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "FALSE";
        }
        return terms.stream()
                .map(Term::toString)
                .collect(Collectors.joining(" OR "));
    }
}
