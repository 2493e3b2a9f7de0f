package com.decisionflow.adapter.spring;

import com.decisionflow.compiler.CompilerSettings;
import com.decisionflow.factoring.OrGroupFactorizer;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the decision flow compiler.
 */
@ConfigurationProperties(prefix = "decision-flow")
public class DecisionFlowProperties {

    /**
     * Whether the compiler beans are created.
     */
    private boolean enabled = true;

    /**
     * Document compiled when no --data or --file argument is given.
     * Supports classpath: prefix for classpath resources.
     */
    private String documentPath = "classpath:default-decision.yaml";

    /**
     * Whether and-joined OR-clauses are collapsed into virtual decision nodes.
     */
    private boolean factorOrGroups = true;

    /**
     * AND/OR nesting levels inspected by the factoring pass.
     */
    private int maxFactorDepth = OrGroupFactorizer.DEFAULT_MAX_DEPTH;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public void setDocumentPath(String documentPath) {
        this.documentPath = documentPath;
    }

    public boolean isFactorOrGroups() {
        return factorOrGroups;
    }

    public void setFactorOrGroups(boolean factorOrGroups) {
        this.factorOrGroups = factorOrGroups;
    }

    public int getMaxFactorDepth() {
        return maxFactorDepth;
    }

    public void setMaxFactorDepth(int maxFactorDepth) {
        this.maxFactorDepth = maxFactorDepth;
    }

    /**
     * Convert to pipeline settings.
     */
    public CompilerSettings toSettings() {
        return new CompilerSettings(factorOrGroups, maxFactorDepth);
    }
}
