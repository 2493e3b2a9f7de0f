package com.decisionflow.adapter.spring;

import com.decisionflow.compiler.CompilerSettings;
import com.decisionflow.compiler.DecisionCompiler;
import com.decisionflow.compiler.DecisionCompilerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the decision flow compiler.
 */
@Configuration
@ConditionalOnProperty(prefix = "decision-flow", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DecisionFlowProperties.class)
public class DecisionFlowAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CompilerSettings compilerSettings(DecisionFlowProperties properties) {
        CompilerSettings settings = properties.toSettings();
        log.info("Decision flow compiler settings: factoring={}, max-factor-depth={}",
                settings.factorOrGroups(), settings.maxFactorDepth());
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionCompiler decisionCompiler(CompilerSettings settings) {
        return DecisionCompilerFactory.create(settings);
    }
}
