package com.decisionflow.config;

import com.decisionflow.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compilation input: the logic text and the question behind each identifier.
 *
 * @param logic     Boolean expression over the identifiers
 * @param questions Identifier to question text (read-only)
 */
public record DecisionDocument(String logic, Map<String, String> questions) {

    /**
     * Reserved key holding the logic text; every other key is an identifier.
     */
    public static final String LOGIC_KEY = "logic";

    public DecisionDocument {
        if (logic == null || logic.isBlank()) {
            throw new ConfigurationException("Decision document requires a '" + LOGIC_KEY + "' expression");
        }
        questions = Collections.unmodifiableMap(new LinkedHashMap<>(questions));
    }

    /**
     * Create a document from a flat key/value map.
     * Keys and non-string question values are converted with toString(); null values are skipped.
     *
     * @param data Map containing the 'logic' key and one key per identifier
     * @return Decision document
     */
    public static DecisionDocument from(Map<?, ?> data) {
        if (data == null) {
            throw new ConfigurationException("Decision document is empty");
        }

        Object logic = data.get(LOGIC_KEY);
        Map<String, String> questions = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : data.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (LOGIC_KEY.equals(key)) {
                continue;
            }
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (value instanceof Map || value instanceof Iterable) {
                throw new ConfigurationException("Question '" + key + "' must be a plain text value");
            }
            questions.put(key, value.toString());
        }

        return new DecisionDocument(logic != null ? logic.toString() : null, questions);
    }
}
