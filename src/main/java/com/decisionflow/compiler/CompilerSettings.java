package com.decisionflow.compiler;

import com.decisionflow.exception.ConfigurationException;
import com.decisionflow.factoring.OrGroupFactorizer;

/**
 * Settings of the compilation pipeline.
 *
 * @param factorOrGroups  Whether the OR-group factoring pre-pass runs
 * @param maxFactorDepth  AND/OR nesting levels the factoring pass inspects
 */
public record CompilerSettings(boolean factorOrGroups, int maxFactorDepth) {

    public CompilerSettings {
        if (maxFactorDepth < 1) {
            throw new ConfigurationException("max-factor-depth must be at least 1, got " + maxFactorDepth);
        }
    }

    /**
     * Factoring enabled, default depth.
     */
    public static CompilerSettings defaults() {
        return new CompilerSettings(true, OrGroupFactorizer.DEFAULT_MAX_DEPTH);
    }

    /**
     * Same settings with factoring switched on or off.
     */
    public CompilerSettings withFactoring(boolean enabled) {
        return new CompilerSettings(enabled, maxFactorDepth);
    }
}
