package com.decisionflow.compiler;

/**
 * Factory for creating DecisionCompiler implementations from settings.
 */
public final class DecisionCompilerFactory {

    private DecisionCompilerFactory() {
    }

    public static DecisionCompiler create(CompilerSettings settings) {
        return new DefaultDecisionCompiler(settings);
    }

    public static DecisionCompiler createDefault() {
        return create(CompilerSettings.defaults());
    }
}
