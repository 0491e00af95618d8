package com.example.optimizerdaemon.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One recommended action, as produced by a decider.
 * The kind is kept verbatim so unrecognized kinds can be reported as skipped.
 * Details may come from the network and are untrusted.
 */
public record ActionRequest(
        @JsonProperty("type") String kind,
        Map<String, Object> details
) {

    public ActionRequest {
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ActionRequest of(ActionKind kind) {
        return new ActionRequest(kind.getName(), Map.of());
    }

    public static ActionRequest noOp() {
        return of(ActionKind.NO_OP);
    }

    public Optional<ActionKind> knownKind() {
        return ActionKind.fromName(kind);
    }
}
