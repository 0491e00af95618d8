package com.example.optimizerdaemon.decision;

import com.example.optimizerdaemon.config.DaemonProperties;
import com.example.optimizerdaemon.domain.ActionKind;
import com.example.optimizerdaemon.domain.ActionRequest;
import com.example.optimizerdaemon.domain.Decision;
import com.example.optimizerdaemon.domain.MetricsSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Local decision engine: a fixed-order threshold table.
 *
 * Rules are evaluated CPU, memory, disk, and every rule whose metric is strictly
 * greater than its limit contributes its action. When nothing triggers the
 * result is a single no-op, so a healthy tick is still recorded.
 */
@Slf4j
public class RuleTableDecider implements Decider {

    public static final String SOURCE = "local";

    private final List<ThresholdRule> rules;
    private final ObjectMapper objectMapper;

    public RuleTableDecider(DaemonProperties.ThresholdConfig thresholds, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.rules = List.of(
                new ThresholdRule("cpu_percent", MetricsSnapshot::cpuPercent,
                        thresholds.getCpuPercent(), ActionKind.CLEAR_CACHE),
                new ThresholdRule("memory.percent", s -> s.memory().percent(),
                        thresholds.getMemoryPercent(), ActionKind.CLEANUP_TMP),
                new ThresholdRule("disk.percent", s -> s.disk().percent(),
                        thresholds.getDiskPercent(), ActionKind.ARCHIVE_OLD_LOGS)
        );
    }

    @Override
    public Decision decide(MetricsSnapshot snapshot) {
        List<ActionRequest> actions = evaluate(snapshot);
        ObjectNode raw = objectMapper.createObjectNode();
        raw.set("actions", objectMapper.valueToTree(actions));
        return new Decision(SOURCE, actions, raw);
    }

    /**
     * Pure evaluation of the rule table. Never empty.
     */
    public List<ActionRequest> evaluate(MetricsSnapshot snapshot) {
        List<ActionRequest> actions = new ArrayList<>();
        for (ThresholdRule rule : rules) {
            double value = rule.metric().applyAsDouble(snapshot);
            if (value > rule.limit()) {
                log.debug("Rule {} triggered: {} > {} -> {}", rule.name(), value, rule.limit(), rule.action().getName());
                actions.add(ActionRequest.of(rule.action()));
            }
        }
        if (actions.isEmpty()) {
            actions.add(ActionRequest.noOp());
        }
        return List.copyOf(actions);
    }

    public record ThresholdRule(String name, ToDoubleFunction<MetricsSnapshot> metric,
                                double limit, ActionKind action) {}
}
