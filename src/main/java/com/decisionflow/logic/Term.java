package com.decisionflow.logic;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Conjunction of literals. Literal order is significant: it becomes the
 * chain of questions in the rendered graph.
 *
 * @param literals Literals, left to right
 */
public record Term(List<Literal> literals) {

    /**
     * The empty conjunction (logical true).
     */
    public static final Term EMPTY = new Term(List.of());

    public Term {
        literals = List.copyOf(literals);
    }

    public static Term of(Literal... literals) {
        return new Term(List.of(literals));
    }

    /**
     * Concatenate this term's literals with another term's literals.
     */
    public Term concat(Term other) {
        List<Literal> joined = new ArrayList<>(literals.size() + other.literals.size());
        joined.addAll(literals);
        joined.addAll(other.literals);
        return new Term(joined);
    }

    public boolean isEmpty() {
        return literals.isEmpty();
    }

    public int size() {
        return literals.size();
    }

    public Literal get(int index) {
        return literals.get(index);
    }

    @Override
    public String toString() {
        return literals.stream()
                .map(Literal::toString)
                .collect(Collectors.joining(" AND ", "(", ")"));
    }
}
