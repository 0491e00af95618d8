package com.example.optimizerdaemon.executor;

import com.example.optimizerdaemon.config.DaemonProperties;
import com.example.optimizerdaemon.domain.ActionKind;
import com.example.optimizerdaemon.domain.ActionRequest;
import com.example.optimizerdaemon.domain.ExecutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Trust boundary between decided and executed actions.
 *
 * Only kinds in the allow-list can run, and each maps to a fixed host operation.
 * Request data never reaches a command line; the single external value accepted
 * is the PID of {@code kill_high_cpu}, which must name a running process.
 * Every call returns exactly one {@link ExecutionResult} and never throws.
 */
@Slf4j
@Service
public class ActionExecutor {

    @FunctionalInterface
    private interface HostOperation {
        String run() throws HostOperationException;
    }

    private final HostOperations hostOperations;
    private final ActionPolicyEngine policyEngine;
    private final DaemonProperties properties;
    private final Map<ActionKind, HostOperation> operations;
    private final Set<ActionKind> allowList;

    public ActionExecutor(HostOperations hostOperations, ActionPolicyEngine policyEngine, DaemonProperties properties) {
        this.hostOperations = hostOperations;
        this.policyEngine = policyEngine;
        this.properties = properties;

        Map<ActionKind, HostOperation> ops = new EnumMap<>(ActionKind.class);
        ops.put(ActionKind.NO_OP, () -> "No action needed, system healthy");
        ops.put(ActionKind.CLEAR_CACHE, hostOperations::dropCaches);
        ops.put(ActionKind.CLEANUP_TMP, hostOperations::cleanupTmp);
        ops.put(ActionKind.ARCHIVE_OLD_LOGS, hostOperations::archiveOldLogs);
        ops.put(ActionKind.RESTART_NETWORK, hostOperations::restartNetwork);
        this.operations = Collections.unmodifiableMap(ops);

        EnumSet<ActionKind> allowed = EnumSet.copyOf(ops.keySet());
        allowed.add(ActionKind.KILL_HIGH_CPU);
        this.allowList = Collections.unmodifiableSet(allowed);
    }

    public ExecutionResult execute(ActionRequest request) {
        String kind = request.kind();
        ActionPolicyEngine.Verdict verdict = policyEngine.evaluate(request, allowList);
        if (!verdict.allowed()) {
            log.warn("Skipping action {}: {}", kind, verdict.reason());
            return ExecutionResult.skipped(kind, verdict.reason());
        }

        try {
            ExecutionResult result = verdict.kind() == ActionKind.KILL_HIGH_CPU
                    ? terminate(request)
                    : runOperation(verdict.kind());
            log.info("Action {} -> {}: {}", kind, result.status(), result.detail());
            return result;
        } catch (HostOperationException e) {
            log.error("Action {} failed: {}", kind, e.getMessage());
            return ExecutionResult.error(kind, "Failed " + kind + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Action {} failed unexpectedly", kind, e);
            return ExecutionResult.error(kind, "Failed " + kind + ": " + e);
        }
    }

    /**
     * Effective policy per known kind: enabled, disabled or unmapped.
     */
    public Map<String, String> describePolicy() {
        return policyEngine.describe(allowList);
    }

    private ExecutionResult runOperation(ActionKind kind) throws HostOperationException {
        if (kind != ActionKind.NO_OP && properties.getActions().isDryRun()) {
            return ExecutionResult.done(kind.getName(), "Dry run, would execute " + kind.getName());
        }
        return ExecutionResult.done(kind.getName(), operations.get(kind).run());
    }

    private ExecutionResult terminate(ActionRequest request) throws HostOperationException {
        String kind = request.kind();
        Object rawPid = request.details().get("pid");
        if (rawPid == null) {
            return ExecutionResult.skipped(kind, "No PID provided for high CPU process");
        }

        Long pid = parsePid(rawPid);
        if (pid == null) {
            return ExecutionResult.skipped(kind, "Invalid PID: " + rawPid);
        }
        if (pid <= 1 || pid == ProcessHandle.current().pid()) {
            return ExecutionResult.skipped(kind, "Refusing to terminate protected PID " + pid);
        }
        if (!hostOperations.isRunning(pid)) {
            return ExecutionResult.skipped(kind, "No running process with PID " + pid);
        }
        if (properties.getActions().isDryRun()) {
            return ExecutionResult.done(kind, "Dry run, would terminate PID " + pid);
        }
        return ExecutionResult.done(kind, hostOperations.terminate(pid));
    }

    private static Long parsePid(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger big) {
            return big.bitLength() < 63 ? big.longValue() : null;
        }
        if (raw instanceof String text && text.matches("\\d{1,18}")) {
            return Long.parseLong(text);
        }
        return null;
    }
}
