package com.decisionflow.config;

import com.decisionflow.exception.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads decision documents from inline JSON or from YAML/JSON files.
 */
public class DecisionDocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DecisionDocumentLoader.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parse an inline JSON document, e.g. {@code {"Q1":"a?","logic":"Q1"}}.
     *
     * @param json JSON object text
     * @return Decision document
     */
    public static DecisionDocument fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new ConfigurationException("Decision document JSON is empty");
        }
        try {
            Map<String, Object> data = objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
            return DecisionDocument.from(data);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid decision document JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Load a document from a path.
     * Supports classpath: prefix for classpath resources. YAML and JSON are both accepted.
     *
     * @param path Path to the document
     * @return Decision document
     */
    public static DecisionDocument load(String path) {
        log.info("Loading decision document from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load decision document from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    private static DecisionDocument parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Decision document is empty");
        }
        if (!(root instanceof Map<?, ?> data)) {
            throw new ConfigurationException("Decision document must be a mapping, found "
                    + root.getClass().getSimpleName());
        }

        // The document may sit at the root or under a 'decision' key
        if (data.get("decision") instanceof Map<?, ?> nested) {
            data = nested;
        }

        DecisionDocument document = DecisionDocument.from(data);
        log.info("Loaded decision document with {} questions, logic: {}",
                document.questions().size(), document.logic());
        return document;
    }
}
