package com.example.optimizerdaemon.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Ordered actions recommended for one snapshot, with the raw payload they were read from.
 *
 * @param source  "local" for the rule table, "remote" for the decision service
 * @param actions actions in emission order
 * @param raw     decision payload as received or produced, kept for the audit log
 */
public record Decision(String source, List<ActionRequest> actions, JsonNode raw) {

    public Decision {
        actions = List.copyOf(actions);
    }
}
