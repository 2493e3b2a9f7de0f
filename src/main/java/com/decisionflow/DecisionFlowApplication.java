package com.decisionflow;

import com.decisionflow.adapter.spring.DecisionFlowProperties;
import com.decisionflow.compiler.CompilerSettings;
import com.decisionflow.compiler.DecisionCompiler;
import com.decisionflow.spring.EnableDecisionFlow;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot application compiling a decision document into a Mermaid flowchart
 * or a JSON decision DAG on standard output.
 */
@SpringBootApplication
@EnableDecisionFlow
public class DecisionFlowApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DecisionFlowApplication.class, args)));
    }

    @Bean
    @ConditionalOnProperty(prefix = "decision-flow", name = "enabled", havingValue = "true", matchIfMissing = true)
    public DecisionFlowRunner decisionFlowRunner(DecisionCompiler decisionCompiler,
                                                 CompilerSettings compilerSettings,
                                                 DecisionFlowProperties properties) {
        return new DecisionFlowRunner(decisionCompiler, compilerSettings, properties, System.out);
    }
}
