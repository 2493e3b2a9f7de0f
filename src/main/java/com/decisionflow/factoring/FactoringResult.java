package com.decisionflow.factoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the OR-group factoring pass.
 *
 * @param logic     Logic text with factored clauses replaced by virtual ids
 * @param questions Question map extended with the composite questions
 * @param groups    Factor groups in allocation order
 * @param applied   false when the input was returned unchanged
 */
public record FactoringResult(String logic,
                              Map<String, String> questions,
                              List<FactorGroup> groups,
                              boolean applied) {

    public FactoringResult {
        questions = Collections.unmodifiableMap(new LinkedHashMap<>(questions));
        groups = List.copyOf(groups);
    }

    /**
     * Result carrying the original input and no groups.
     */
    public static FactoringResult unchanged(String logic, Map<String, String> questions) {
        return new FactoringResult(logic, questions, List.of(), false);
    }

    /**
     * Get the factor group for a virtual identifier.
     *
     * @return the group, or null if the identifier is not virtual
     */
    public FactorGroup getGroup(String virtualId) {
        return groups.stream()
                .filter(g -> g.virtualId().equals(virtualId))
                .findFirst()
                .orElse(null);
    }
}
