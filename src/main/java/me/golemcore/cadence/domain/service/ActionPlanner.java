package me.golemcore.cadence.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.ActionParameter;
import me.golemcore.cadence.domain.model.ActionPlan;
import me.golemcore.cadence.domain.model.ActionRequest;
import me.golemcore.cadence.domain.model.ActionType;
import me.golemcore.cadence.domain.model.ConversationHistory;
import me.golemcore.cadence.domain.model.ConversationTurn;
import me.golemcore.cadence.domain.model.LlmRequest;
import me.golemcore.cadence.domain.model.LlmResponse;
import me.golemcore.cadence.domain.model.LlmUsage;
import me.golemcore.cadence.domain.model.PlanMeta;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.LlmPort;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Turns a coordinator message into a validated {@link ActionPlan} with one
 * language-model call.
 *
 * <p>
 * The planner never throws to its caller. Unparseable model output becomes a
 * zero-action plan carrying the raw text, and a failed model call becomes a
 * zero-action plan with a fixed apology. Actions naming an unknown kind, with
 * mistyped parameters or with missing required parameters are dropped while
 * the rest of the plan is kept.
 */
@Service
@Slf4j
public class ActionPlanner {

    static final String UNAVAILABLE_RESPONSE = "I'm having trouble reaching the planning model right now. "
            + "Please try again in a moment.";
    static final String PARSE_FAILURE_THINKING = "Could not parse structured plan";

    private static final String PATIENT_ID = "patient_id";
    private static final TypeReference<Map<String, Object>> PARAMETERS_TYPE_REF = new TypeReference<>() {
    };

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final PromptTemplateEngine templateEngine;
    private final CadenceProperties properties;
    private final Clock clock;

    private volatile String promptTemplate;

    public ActionPlanner(LlmPort llmPort, ObjectMapper objectMapper, PromptTemplateEngine templateEngine,
            CadenceProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.objectMapper = objectMapper;
        this.templateEngine = templateEngine;
        this.properties = properties;
        this.clock = clock;
    }

    public ActionPlan plan(String message, Map<String, Object> context, ConversationHistory history) {
        return plan(message, context, history, null);
    }

    public ActionPlan plan(String message, Map<String, Object> context, ConversationHistory history,
            String sessionId) {
        CadenceProperties.PlannerProperties config = properties.getPlanner();
        String content = withContext(message, context);

        List<ConversationTurn> messages = new ArrayList<>(history.getTurns());
        messages.add(ConversationTurn.user(content));

        LlmResponse response;
        try {
            LlmRequest request = LlmRequest.builder()
                    .systemPrompt(buildSystemPrompt())
                    .messages(messages)
                    .temperature(config.getTemperature())
                    .maxTokens(config.getMaxTokens())
                    .sessionId(sessionId)
                    .purpose("planner")
                    .build();
            response = llmPort.chat(request).get(config.getTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Planner] Interrupted while waiting for the model");
            return ActionPlan.fallback("Planning interrupted", UNAVAILABLE_RESPONSE, PlanMeta.empty());
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[Planner] Planning failed: {}", e.getMessage(), e);
            return ActionPlan.fallback("Planning model unavailable", UNAVAILABLE_RESPONSE, PlanMeta.empty());
        }

        String raw = response.getContent() != null ? response.getContent() : "";
        history.appendExchange(content, raw);

        ActionPlan plan = parsePlan(raw, toMeta(response));
        log.info("[Planner] {} action(s) planned, {} gated", plan.getActions().size(),
                plan.getActions().stream().filter(ActionRequest::isRequiresApproval).count());
        return plan;
    }

    ActionPlan parsePlan(String raw, PlanMeta meta) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripFences(raw));
        } catch (JsonProcessingException e) {
            log.warn("[Planner] Could not parse plan: {}", e.getOriginalMessage());
            return ActionPlan.fallback(PARSE_FAILURE_THINKING, raw, meta);
        }
        if (root == null || !root.isObject()) {
            log.warn("[Planner] Plan is not a JSON object");
            return ActionPlan.fallback(PARSE_FAILURE_THINKING, raw, meta);
        }

        List<ActionRequest> actions = new ArrayList<>();
        JsonNode actionsNode = root.path("actions");
        if (actionsNode.isArray()) {
            for (JsonNode actionNode : actionsNode) {
                validateAction(actionNode, actions).ifPresent(actions::add);
            }
        }

        return ActionPlan.builder()
                .thinking(textOrNull(root, "thinking"))
                .actions(actions)
                .responseTemplate(textOrNull(root, "response_template"))
                .requiresApproval(root.path("requires_approval").asBoolean(false))
                .meta(meta)
                .build();
    }

    private Optional<ActionRequest> validateAction(JsonNode actionNode, List<ActionRequest> earlier) {
        String kind = actionNode.path("action_type").asText(null);
        Optional<ActionType> type = ActionType.fromWireName(kind);
        if (type.isEmpty()) {
            log.debug("[Planner] Dropping unknown action kind: {}", kind);
            return Optional.empty();
        }
        ActionType actionType = type.get();

        Map<String, Object> parameters = new LinkedHashMap<>();
        JsonNode parametersNode = actionNode.path("parameters");
        if (parametersNode.isObject()) {
            parameters.putAll(objectMapper.convertValue(parametersNode, PARAMETERS_TYPE_REF));
        }
        parameters.values().removeIf(Objects::isNull);

        for (ActionParameter declared : actionType.getParameters()) {
            Object value = parameters.get(declared.getName());
            if (value != null) {
                Optional<Object> coerced = declared.getType().coerce(value);
                if (coerced.isEmpty()) {
                    log.debug("[Planner] Dropping {}: {} must be {}", kind, declared.getName(),
                            declared.getType().label());
                    return Optional.empty();
                }
                value = coerced.get();
                parameters.put(declared.getName(), value);
            }
            if (declared.isRequired() && isMissing(value)
                    && !suppliedByEarlierResolution(declared.getName(), earlier)) {
                log.debug("[Planner] Dropping {}: missing {}", kind, declared.getName());
                return Optional.empty();
            }
        }

        boolean gated = actionNode.path("requires_approval").asBoolean(false) || actionType.isWrite();
        return Optional.of(ActionRequest.builder()
                .actionType(actionType)
                .parameters(parameters)
                .description(textOrNull(actionNode, "description"))
                .requiresApproval(gated)
                .build());
    }

    private boolean isMissing(Object value) {
        return value == null || (value instanceof String text && text.isBlank());
    }

    private boolean suppliedByEarlierResolution(String parameter, List<ActionRequest> earlier) {
        return PATIENT_ID.equals(parameter)
                && earlier.stream().anyMatch(action -> action.getActionType() == ActionType.RESOLVE_PATIENT);
    }

    String withContext(String message, Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return message;
        }
        try {
            return "[Context: " + objectMapper.writeValueAsString(context) + "]\n\n" + message;
        } catch (JsonProcessingException e) {
            log.warn("[Planner] Could not serialize context, sending message alone: {}", e.getOriginalMessage());
            return message;
        }
    }

    String buildSystemPrompt() {
        CadenceProperties.PlannerProperties config = properties.getPlanner();
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("TODAY", LocalDate.now(clock).toString());
        variables.put("ACTIONS", renderCatalogue());
        variables.put("TRIALS", bulletList(config.getTrials()));
        variables.put("SITES", bulletList(config.getSites()));
        return templateEngine.render(loadPromptTemplate(), variables);
    }

    static String renderCatalogue() {
        StringBuilder sb = new StringBuilder();
        for (ActionType type : ActionType.values()) {
            String parameters = type.getParameters().stream()
                    .map(parameter -> parameter.getName() + (parameter.isRequired() ? "" : "?")
                            + ": " + parameter.getType().label())
                    .collect(Collectors.joining(", "));
            sb.append("- ").append(type.getWireName())
                    .append(" {").append(parameters).append("}: ")
                    .append(type.getDescription());
            if (type.isWrite()) {
                sb.append(" (write, requires approval)");
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String loadPromptTemplate() {
        String cached = promptTemplate;
        if (cached != null) {
            return cached;
        }
        String resourceName = properties.getPlanner().getPromptResource();
        try (InputStream is = new ClassPathResource(resourceName).getInputStream()) {
            cached = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Planner prompt resource not readable: " + resourceName, e);
        }
        promptTemplate = cached;
        return cached;
    }

    private static String bulletList(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return "- (none configured)";
        }
        return lines.stream().map(line -> "- " + line).collect(Collectors.joining("\n"));
    }

    static String stripFences(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```")) {
            int newline = cleaned.indexOf('\n');
            cleaned = newline >= 0 ? cleaned.substring(newline + 1) : cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        if (cleaned.startsWith("json")) {
            cleaned = cleaned.substring(4).trim();
        }
        return cleaned;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static PlanMeta toMeta(LlmResponse response) {
        LlmUsage usage = response.getUsage();
        if (usage == null) {
            return PlanMeta.builder().model(response.getModel()).build();
        }
        return PlanMeta.builder()
                .model(response.getModel())
                .inputTokens(usage.getInputTokens())
                .outputTokens(usage.getOutputTokens())
                .latencyMs(usage.getLatency() != null ? usage.getLatency().toMillis() : 0)
                .costUsd(usage.getCostUsd())
                .build();
    }
}
