package com.decisionflow.factoring;

import java.util.List;

/**
 * Synthetic identifier standing in for a factored OR-clause.
 *
 * @param virtualId Synthetic identifier (V1, V2, ...)
 * @param members   Original identifiers of the clause, in clause order
 * @param negated   true for the {@code (not a or not b)} shape
 */
public record FactorGroup(String virtualId, List<String> members, boolean negated) {

    public FactorGroup {
        members = List.copyOf(members);
    }
}
