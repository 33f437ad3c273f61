package com.overseer.core.persistence;

import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Optional in-memory graph checkpointing, enabled with
 * {@code overseer.workflow.graph-checkpoints=true}. Checkpoints never outlive the process.
 */
@Configuration
@ConditionalOnProperty(prefix = "overseer.workflow", name = "graph-checkpoints", havingValue = "true")
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    @ConditionalOnMissingBean(BaseCheckpointSaver.class)
    public BaseCheckpointSaver memoryCheckpointSaver() {
        log.info("Using in-memory graph checkpoint saver");
        return new MemorySaver();
    }
}
