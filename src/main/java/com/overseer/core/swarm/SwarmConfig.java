package com.overseer.core.swarm;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default worker runtime, verification and decomposition. Any application bean of the same
 * type replaces the default.
 */
@Configuration
public class SwarmConfig {

    @Bean
    @ConditionalOnMissingBean(AgentExecutor.class)
    public AgentExecutor agentExecutor() {
        return new DryRunAgentExecutor();
    }

    @Bean
    @ConditionalOnMissingBean(VerificationProvider.class)
    public VerificationProvider verificationProvider() {
        return new OutcomeVerificationProvider();
    }

    @Bean
    @ConditionalOnMissingBean(TaskDecomposer.class)
    public TaskDecomposer taskDecomposer() {
        return new ResourceGroupDecomposer();
    }
}
