package com.example.optimizerdaemon.daemon;

import com.example.optimizerdaemon.audit.AuditLogWriter;
import com.example.optimizerdaemon.config.DaemonProperties;
import com.example.optimizerdaemon.decision.Decider;
import com.example.optimizerdaemon.decision.DecisionUnavailableException;
import com.example.optimizerdaemon.domain.ActionRequest;
import com.example.optimizerdaemon.domain.Decision;
import com.example.optimizerdaemon.domain.ExecutionResult;
import com.example.optimizerdaemon.domain.MetricsSnapshot;
import com.example.optimizerdaemon.executor.ActionExecutor;
import com.example.optimizerdaemon.monitoring.MetricsCollector;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Daemon Loop - sample, decide, execute and audit on a fixed interval.
 *
 * One cycle: IDLE → SAMPLING → DECIDING → (EXECUTING → LOGGING) per action → IDLE.
 * - Cycles run one at a time on the single daemonExecutor thread
 * - Actions run strictly in emission order, each result audited before the next starts
 * - A missing decision skips execution for that cycle only
 * - A failing action never prevents the following ones
 *
 * The loop has no terminal state. Stopping the lifecycle ends the sleep, cancels a
 * pending decision request and lets a running action finish; actions not yet started
 * are dropped. The loop thread is never interrupted.
 */
@Slf4j
@Service
public class DaemonLoop implements SmartLifecycle {

    private final MetricsCollector collector;
    private final Decider decider;
    private final ActionExecutor executor;
    private final AuditLogWriter auditLog;
    private final DaemonProperties properties;
    private final MeterRegistry meterRegistry;
    private final TaskExecutor daemonExecutor;

    private final ActionTally tally = new ActionTally();
    private final AtomicLong cycles = new AtomicLong();

    private volatile DaemonState state = DaemonState.IDLE;
    private volatile boolean running;
    private volatile boolean stopRequested;
    private volatile CountDownLatch shutdownSignal = new CountDownLatch(1);
    private volatile CountDownLatch loopFinished = new CountDownLatch(0);

    public DaemonLoop(MetricsCollector collector,
                      Decider decider,
                      ActionExecutor executor,
                      AuditLogWriter auditLog,
                      DaemonProperties properties,
                      MeterRegistry meterRegistry,
                      @Qualifier("daemonExecutor") TaskExecutor daemonExecutor) {
        this.collector = collector;
        this.decider = decider;
        this.executor = executor;
        this.auditLog = auditLog;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.daemonExecutor = daemonExecutor;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        if (loopFinished.getCount() > 0) {
            log.warn("Previous daemon loop is still finishing, not starting a new one");
            return;
        }

        stopRequested = false;
        shutdownSignal = new CountDownLatch(1);
        loopFinished = new CountDownLatch(1);
        running = true;

        log.info("Starting optimizer daemon: interval {}s, decider {}, audit log {}",
                properties.getDaemon().getPollIntervalSeconds(),
                decider.getClass().getSimpleName(),
                auditLog.getLogPath().toAbsolutePath());
        executor.describePolicy().forEach((kind, policy) -> log.info("  - {}: {}", kind, policy));

        decider.resume();
        auditLog.daemonStarted();
        daemonExecutor.execute(this::run);
    }

    @Override
    public void stop() {
        CountDownLatch finished;
        synchronized (this) {
            if (!running) return;
            running = false;
            stopRequested = true;
            shutdownSignal.countDown();
            finished = loopFinished;
        }

        log.info("Stopping optimizer daemon (state: {})", state);
        decider.cancel();
        try {
            int timeout = properties.getDaemon().getShutdownTimeoutSeconds();
            if (!finished.await(timeout, TimeUnit.SECONDS)) {
                log.warn("Daemon loop still busy after {}s, leaving it to finish in the background", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        auditLog.daemonStopped();
        log.info("Optimizer daemon stopped after {} cycle(s)", cycles.get());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getDaemon().isAutoStart();
    }

    void run() {
        try {
            while (!stopRequested) {
                try {
                    runCycle();
                } catch (RuntimeException e) {
                    log.error("Cycle {} failed unexpectedly", cycles.get(), e);
                }
                if (!awaitNextCycle()) break;
            }
        } finally {
            state = DaemonState.IDLE;
            loopFinished.countDown();
        }
    }

    /**
     * @return false when shutdown was requested during the wait
     */
    private boolean awaitNextCycle() {
        try {
            return !shutdownSignal.await(properties.getDaemon().getPollIntervalSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Run one full cycle on the calling thread.
     */
    public CycleReport runCycle() {
        long cycle = cycles.incrementAndGet();
        Timer.Sample timer = Timer.start(meterRegistry);
        try {
            state = DaemonState.SAMPLING;
            MetricsSnapshot snapshot = collector.sample();
            auditLog.snapshot(snapshot);

            state = DaemonState.DECIDING;
            Decision decision;
            try {
                decision = decider.decide(snapshot);
            } catch (DecisionUnavailableException e) {
                log.warn("Cycle {}: decision unavailable, nothing executed: {}", cycle, e.getMessage());
                auditLog.decisionUnavailable(e.getMessage());
                countCycle("undecided");
                return CycleReport.undecided(cycle, snapshot, e.getMessage());
            }
            auditLog.decision(decision);

            List<ActionRequest> actions = decision.actions().isEmpty()
                    ? List.of(ActionRequest.noOp())
                    : decision.actions();
            List<ExecutionResult> results = new ArrayList<>();
            for (int i = 0; i < actions.size(); i++) {
                if (stopRequested) {
                    int pending = actions.size() - i;
                    log.info("Cycle {}: shutdown requested, {} action(s) not started", cycle, pending);
                    auditLog.pendingActionsAborted(pending);
                    break;
                }
                state = DaemonState.EXECUTING;
                ExecutionResult result = execute(actions.get(i));

                state = DaemonState.LOGGING;
                auditLog.result(result);
                tally.record(result);
                countAction(result);
                results.add(result);
            }

            countCycle("decided");
            log.debug("Cycle {} complete: {} result(s), tally {}", cycle, results.size(), tally.snapshot());
            return CycleReport.decided(cycle, snapshot, decision, results);

        } finally {
            state = DaemonState.IDLE;
            timer.stop(meterRegistry.timer("optimizer.cycle.duration"));
        }
    }

    private ExecutionResult execute(ActionRequest action) {
        try {
            return executor.execute(action);
        } catch (RuntimeException e) {
            log.error("Executor raised for action {}", action.kind(), e);
            return ExecutionResult.error(action.kind(), "Executor failure: " + e);
        }
    }

    private void countCycle(String outcome) {
        Counter.builder("optimizer.cycles")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private void countAction(ExecutionResult result) {
        Counter.builder("optimizer.actions")
                .tag("kind", ActionTally.key(result.kind()))
                .tag("status", result.status().name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    public DaemonState getState() {
        return state;
    }

    public long getCycleCount() {
        return cycles.get();
    }

    public Map<String, Map<ExecutionResult.Status, Long>> getTally() {
        return tally.snapshot();
    }
}
