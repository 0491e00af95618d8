package com.example.optimizerdaemon.decision;

import com.example.optimizerdaemon.TestSnapshots;
import com.example.optimizerdaemon.config.DaemonProperties;
import com.example.optimizerdaemon.domain.ActionKind;
import com.example.optimizerdaemon.domain.ActionRequest;
import com.example.optimizerdaemon.domain.Decision;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleTableDeciderTest {

    private RuleTableDecider decider;

    @BeforeEach
    void setUp() {
        decider = new RuleTableDecider(new DaemonProperties.ThresholdConfig(), new ObjectMapper());
    }

    private static List<String> kinds(List<ActionRequest> actions) {
        return actions.stream().map(ActionRequest::kind).toList();
    }

    @Test
    @DisplayName("Every metric at or below its limit yields exactly one no-op")
    void healthySnapshotYieldsSingleNoOp() {
        double[][] samples = {
                {0, 0, 0}, {10, 40, 20}, {80, 85, 90}, {79.9, 84.9, 89.9}, {50, 85, 0}
        };
        for (double[] s : samples) {
            List<ActionRequest> actions = decider.evaluate(TestSnapshots.of(s[0], s[1], s[2]));
            assertEquals(List.of("no_op"), kinds(actions), "for " + java.util.Arrays.toString(s));
        }
    }

    @Test
    @DisplayName("High CPU alone yields only clear_cache")
    void highCpuOnlyYieldsClearCache() {
        for (double cpu : new double[]{80.1, 90, 95, 100}) {
            List<ActionRequest> actions = decider.evaluate(TestSnapshots.of(cpu, 85, 90));
            assertEquals(List.of("clear_cache"), kinds(actions));
        }
    }

    @Test
    @DisplayName("Simultaneous triggers follow CPU, memory, disk order")
    void multipleTriggersKeepFixedOrder() {
        assertEquals(List.of("clear_cache", "cleanup_tmp", "archive_old_logs"),
                kinds(decider.evaluate(TestSnapshots.of(99, 99, 99))));
        assertEquals(List.of("cleanup_tmp", "archive_old_logs"),
                kinds(decider.evaluate(TestSnapshots.of(10, 90, 95))));
        assertEquals(List.of("clear_cache", "archive_old_logs"),
                kinds(decider.evaluate(TestSnapshots.of(81, 10, 91))));
    }

    @Test
    @DisplayName("Thresholds come from configuration")
    void thresholdsAreConfigurable() {
        DaemonProperties.ThresholdConfig thresholds = new DaemonProperties.ThresholdConfig();
        thresholds.setCpuPercent(50);
        thresholds.setMemoryPercent(99);
        RuleTableDecider custom = new RuleTableDecider(thresholds, new ObjectMapper());

        assertEquals(List.of("clear_cache"), kinds(custom.evaluate(TestSnapshots.of(60, 90, 10))));
        assertEquals(List.of("no_op"), kinds(custom.evaluate(TestSnapshots.of(40, 98, 10))));
    }

    @Test
    @DisplayName("Evaluation is deterministic for the same snapshot")
    void evaluationIsDeterministic() {
        var snapshot = TestSnapshots.of(95, 90, 95);
        assertEquals(decider.evaluate(snapshot), decider.evaluate(snapshot));
    }

    @Test
    @DisplayName("decide() wraps actions with a raw actions payload")
    void decideProducesLocalDecisionWithRawPayload() {
        Decision decision = decider.decide(TestSnapshots.of(95, 40, 20));

        assertEquals(RuleTableDecider.SOURCE, decision.source());
        assertEquals(List.of(ActionRequest.of(ActionKind.CLEAR_CACHE)), decision.actions());
        assertEquals("clear_cache", decision.raw().get("actions").get(0).get("type").asText());
    }
}
