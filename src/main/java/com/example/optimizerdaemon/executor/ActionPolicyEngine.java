package com.example.optimizerdaemon.executor;

import com.example.optimizerdaemon.config.DaemonProperties;
import com.example.optimizerdaemon.domain.ActionKind;
import com.example.optimizerdaemon.domain.ActionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Action policy gate, evaluated in order:
 * 1. Allow-list: the kind must be a known, mapped action
 * 2. Configuration: the kind must not be disabled under optimizer-daemon.actions.enabled
 *
 * A deny at any layer rejects the action.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionPolicyEngine {

    private final DaemonProperties properties;

    public Verdict evaluate(ActionRequest request, Set<ActionKind> allowList) {
        Optional<ActionKind> kind = request.knownKind();

        // Layer 1: allow-list
        if (kind.isEmpty() || !allowList.contains(kind.get())) {
            log.debug("Action {} denied by allow-list", request.kind());
            return Verdict.deny("Unsafe or unmapped action: " + request.kind());
        }

        // Layer 2: configuration switch
        if (!properties.getActions().isEnabled(kind.get())) {
            log.debug("Action {} denied by configuration", request.kind());
            return Verdict.deny("Action disabled by configuration: " + request.kind());
        }

        return Verdict.allow(kind.get());
    }

    /**
     * Effective policy for every known kind, for startup diagnostics.
     */
    public Map<String, String> describe(Set<ActionKind> allowList) {
        Map<String, String> summary = new LinkedHashMap<>();
        for (ActionKind kind : ActionKind.values()) {
            String state;
            if (!allowList.contains(kind)) {
                state = "unmapped";
            } else if (!properties.getActions().isEnabled(kind)) {
                state = "disabled";
            } else {
                state = properties.getActions().isDryRun() ? "enabled (dry-run)" : "enabled";
            }
            summary.put(kind.getName(), state);
        }
        return summary;
    }

    public record Verdict(boolean allowed, ActionKind kind, String reason) {
        static Verdict allow(ActionKind kind) {
            return new Verdict(true, kind, null);
        }

        static Verdict deny(String reason) {
            return new Verdict(false, null, reason);
        }
    }
}
