package com.example.optimizerdaemon.decision;

import com.example.optimizerdaemon.config.DaemonProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the decider by {@code optimizer-daemon.decision.mode}: local rule table (default) or remote service.
 */
@Slf4j
@Configuration
public class DecisionConfig {

    @Bean
    @ConditionalOnProperty(prefix = "optimizer-daemon.decision", name = "mode", havingValue = "local", matchIfMissing = true)
    public Decider ruleTableDecider(DaemonProperties properties, ObjectMapper objectMapper) {
        DaemonProperties.ThresholdConfig thresholds = properties.getThresholds();
        log.info("Using local rule table (cpu > {}%, memory > {}%, disk > {}%)",
                thresholds.getCpuPercent(), thresholds.getMemoryPercent(), thresholds.getDiskPercent());
        return new RuleTableDecider(thresholds, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "optimizer-daemon.decision", name = "mode", havingValue = "remote")
    public Decider httpDecisionClient(DaemonProperties properties, ObjectMapper objectMapper, OkHttpClient okHttpClient) {
        log.info("Using remote decision service at {} (timeout {}s)",
                properties.decisionUrl(), properties.getDecision().getTimeoutSeconds());
        return new HttpDecisionClient(properties, objectMapper, okHttpClient);
    }
}
