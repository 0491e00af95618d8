package com.example.optimizerdaemon.decision;

import com.example.optimizerdaemon.config.DaemonProperties;
import com.example.optimizerdaemon.domain.ActionRequest;
import com.example.optimizerdaemon.domain.Decision;
import com.example.optimizerdaemon.domain.MetricsSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remote decider: posts the snapshot to the decision service and parses
 * its {@code {"actions": [...]}} response.
 *
 * Every failure mode (transport, timeout, cancellation, non-2xx, malformed body)
 * surfaces as {@link DecisionUnavailableException}. No default decision is ever substituted.
 */
@Slf4j
public class HttpDecisionClient implements Decider {

    public static final String SOURCE = "remote";

    private static final MediaType JSON = MediaType.get("application/json");
    private static final int MAX_ERROR_BODY = 200;

    private final DaemonProperties.DecisionConfig config;
    private final HttpUrl url;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;
    private final AtomicReference<Call> inFlight = new AtomicReference<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public HttpDecisionClient(DaemonProperties properties, ObjectMapper objectMapper, OkHttpClient httpClient) {
        this.config = properties.getDecision();
        this.url = properties.decisionUrl();
        if (url == null) {
            throw new IllegalArgumentException("Invalid decision service URL: " + config.getBaseUrl() + config.getPath());
        }
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public Decision decide(MetricsSnapshot snapshot) {
        return query(snapshot);
    }

    /**
     * Send a snapshot to the decision service and parse the recommended actions.
     */
    public Decision query(MetricsSnapshot snapshot) {
        Request request = buildRequest(snapshot);
        Call call = httpClient.newCall(request);
        inFlight.set(call);
        // cancel() may have run before the call was published
        if (cancelled.get()) {
            call.cancel();
        }
        log.debug("Querying decision service at {}", url);

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            String bodyText = body != null ? body.string() : "";

            if (!response.isSuccessful()) {
                throw new DecisionUnavailableException(String.format(
                        "Decision service returned HTTP %d: %s", response.code(), abbreviate(bodyText)));
            }
            return parseResponse(bodyText);

        } catch (IOException e) {
            String reason = call.isCanceled() ? "request cancelled" : e.getMessage();
            throw new DecisionUnavailableException("Decision service unreachable: " + reason, e);
        } finally {
            inFlight.compareAndSet(call, null);
        }
    }

    @Override
    public void cancel() {
        cancelled.set(true);
        Call call = inFlight.get();
        if (call != null) {
            log.info("Cancelling in-flight decision request");
            call.cancel();
        }
    }

    @Override
    public void resume() {
        cancelled.set(false);
    }

    private Request buildRequest(MetricsSnapshot snapshot) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("input", config.getPrompt());
        payload.set("data", objectMapper.valueToTree(snapshot));

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new DecisionUnavailableException("Cannot serialize snapshot", e);
        }

        Request.Builder builder = new Request.Builder()
                .url(url)
                .addHeader("Accept", "application/json")
                .post(RequestBody.create(json, JSON));
        if (config.getApiToken() != null && !config.getApiToken().isBlank()) {
            builder.addHeader("Authorization", "Bearer " + config.getApiToken());
        }
        return builder.build();
    }

    Decision parseResponse(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new DecisionUnavailableException("Non-JSON response: " + abbreviate(responseBody), e);
        }

        if (root == null || !root.isObject()) {
            throw new DecisionUnavailableException("Response is not a JSON object: " + abbreviate(responseBody));
        }
        JsonNode actionsNode = root.get("actions");
        if (actionsNode == null || !actionsNode.isArray()) {
            throw new DecisionUnavailableException("Response has no 'actions' array: " + abbreviate(responseBody));
        }

        List<ActionRequest> actions = new ArrayList<>();
        for (JsonNode element : actionsNode) {
            actions.add(parseAction(element));
        }
        log.debug("Decision service recommended {} action(s)", actions.size());
        return new Decision(SOURCE, actions, root);
    }

    private ActionRequest parseAction(JsonNode element) {
        if (!element.isObject()) {
            throw new DecisionUnavailableException("Action entry is not an object: " + element);
        }
        JsonNode type = element.get("type");
        if (type == null || !type.isTextual()) {
            throw new DecisionUnavailableException("Action entry has no string 'type': " + element);
        }

        JsonNode detailsNode = element.get("details");
        Map<String, Object> details = Map.of();
        if (detailsNode != null && !detailsNode.isNull()) {
            if (!detailsNode.isObject()) {
                throw new DecisionUnavailableException("Action 'details' is not an object: " + element);
            }
            details = objectMapper.convertValue(detailsNode, new TypeReference<Map<String, Object>>() {});
        }
        return new ActionRequest(type.asText(), details);
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() > MAX_ERROR_BODY ? text.substring(0, MAX_ERROR_BODY) + "..." : text;
    }
}
