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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.ActionOutcome;
import me.golemcore.cadence.domain.model.ActionPlan;
import me.golemcore.cadence.domain.model.ActionResult;
import me.golemcore.cadence.domain.model.ConversationTurn;
import me.golemcore.cadence.domain.model.KnowledgeEntry;
import me.golemcore.cadence.domain.model.LlmRequest;
import me.golemcore.cadence.domain.model.LlmResponse;
import me.golemcore.cadence.domain.model.Patient;
import me.golemcore.cadence.domain.model.ScoredKnowledgeEntry;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the reply shown to the coordinator after a plan's actions ran.
 *
 * <p>
 * {@code {result_i}} placeholders in the plan's template are replaced with the
 * formatted i-th result. When the template is blank or still has unresolved
 * placeholders, the model writes the reply from a size-capped view of the
 * results; if that call fails the action summaries are joined instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseComposer {

    private static final Pattern UNRESOLVED_PLACEHOLDER = Pattern.compile("\\{result_\\d+}");
    private static final String SYNTHESIS_SYSTEM_PROMPT = "You are Cadence, an assistant for clinical research "
            + "coordinators. Be concise and actionable.";
    private static final double HIGH_RISK = 0.7;
    private static final double MEDIUM_RISK = 0.4;

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final CadenceProperties properties;

    public String compose(String message, ActionPlan plan, List<ActionOutcome> outcomes, String sessionId) {
        String template = plan.getResponseTemplate() != null ? plan.getResponseTemplate() : "";
        if (plan.isRawText()) {
            return template;
        }

        String response = template;
        for (int i = 0; i < outcomes.size(); i++) {
            String placeholder = "{result_" + i + "}";
            if (response.contains(placeholder)) {
                response = response.replace(placeholder, formatResult(outcomes.get(i).getResult()));
            }
        }

        if (!response.isBlank() && !UNRESOLVED_PLACEHOLDER.matcher(response).find()) {
            return response;
        }
        if (outcomes.isEmpty() && !response.isBlank()) {
            return UNRESOLVED_PLACEHOLDER.matcher(response).replaceAll("").trim();
        }
        return synthesize(message, outcomes, sessionId);
    }

    String formatResult(ActionResult result) {
        Object payload = result.getPayload();
        if (result.isSuccess() && payload instanceof List<?> list && !list.isEmpty()) {
            Object first = list.get(0);
            if (first instanceof Patient) {
                return formatPatients(list);
            }
            if (first instanceof ScoredKnowledgeEntry || first instanceof KnowledgeEntry) {
                return formatKnowledge(list);
            }
        }
        if (result.isSuccess()) {
            return result.getSummary();
        }
        return result.getSummary() != null ? result.getSummary() : result.getError();
    }

    private String formatPatients(List<?> patients) {
        int cap = properties.getResponse().getListDisplayLimit();
        List<String> lines = new ArrayList<>();
        for (Object item : patients.subList(0, Math.min(cap, patients.size()))) {
            Patient patient = (Patient) item;
            double risk = patient.getDropoutRiskScore();
            StringBuilder line = new StringBuilder()
                    .append(riskMarker(risk)).append(" **")
                    .append(patient.getName() != null ? patient.getName() : patient.getPatientId())
                    .append("** (").append(patient.getPatientId()).append(") - ")
                    .append(String.format(Locale.ROOT, "%.0f%%", risk * 100)).append(" risk");
            if (patient.getRiskFactors() != null && !patient.getRiskFactors().isEmpty()) {
                line.append("\n   Top factor: ").append(patient.getRiskFactors().get(0));
            }
            if (patient.getRecommendedActions() != null && !patient.getRecommendedActions().isEmpty()) {
                line.append("\n   Next: ").append(patient.getRecommendedActions().get(0));
            }
            lines.add(line.toString());
        }
        if (patients.size() > cap) {
            lines.add("... and " + (patients.size() - cap) + " more patients");
        }
        return String.join("\n\n", lines);
    }

    private String formatKnowledge(List<?> items) {
        List<String> lines = new ArrayList<>();
        for (Object item : items) {
            KnowledgeEntry entry = item instanceof ScoredKnowledgeEntry scored
                    ? scored.getEntry()
                    : (KnowledgeEntry) item;
            String category = entry.getCategory() != null ? entry.getCategory() : "tip";
            StringBuilder line = new StringBuilder("**").append(category).append("**: ").append(entry.getContent());
            if (item instanceof ScoredKnowledgeEntry scoredItem && scoredItem.isStale()) {
                line.append(" _(needs revalidation)_");
            }
            if (entry.getSource() != null) {
                line.append("\n   _Source: ").append(entry.getSource()).append('_');
            }
            lines.add(line.toString());
        }
        return String.join("\n\n", lines);
    }

    private String riskMarker(double risk) {
        if (risk >= HIGH_RISK) {
            return "[HIGH]";
        }
        return risk >= MEDIUM_RISK ? "[MEDIUM]" : "[LOW]";
    }

    private String synthesize(String message, List<ActionOutcome> outcomes, String sessionId) {
        CadenceProperties.ResponseProperties config = properties.getResponse();
        String prompt;
        try {
            prompt = "The coordinator asked: \"" + message + "\"\n\n"
                    + "Results of the actions taken:\n"
                    + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(resultsView(outcomes))
                    + "\n\nWrite a concise, specific reply for the coordinator. Include numbers and patient "
                    + "details where relevant. Keep it under 300 words.";
        } catch (JsonProcessingException e) {
            log.warn("[Response] Could not serialize results: {}", e.getOriginalMessage());
            return joinedSummaries(outcomes);
        }

        LlmRequest request = LlmRequest.builder()
                .systemPrompt(SYNTHESIS_SYSTEM_PROMPT)
                .messages(List.of(ConversationTurn.user(prompt)))
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens())
                .sessionId(sessionId)
                .purpose("response")
                .build();
        try {
            LlmResponse response = llmPort.chat(request).get(config.getTimeoutSeconds(), TimeUnit.SECONDS);
            if (response.getContent() != null && !response.getContent().isBlank()) {
                return response.getContent().trim();
            }
            log.warn("[Response] Model returned an empty reply, using action summaries");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Response] Interrupted while composing reply");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Response] Reply synthesis failed, using action summaries: {}", e.getMessage());
        }
        return joinedSummaries(outcomes);
    }

    List<Map<String, Object>> resultsView(List<ActionOutcome> outcomes) {
        int itemLimit = properties.getResponse().getSummaryItemLimit();
        List<Map<String, Object>> view = new ArrayList<>();
        for (ActionOutcome outcome : outcomes) {
            ActionResult result = outcome.getResult();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("action", outcome.getRequest().getDescription());
            entry.put("success", result.isSuccess());
            entry.put("summary", result.getSummary());
            entry.put("data", cappedData(result.getPayload(), itemLimit));
            view.add(entry);
        }
        return view;
    }

    private Object cappedData(Object payload, int itemLimit) {
        if (!(payload instanceof List<?> list)) {
            return describe(payload);
        }
        List<Object> capped = list.stream()
                .limit(itemLimit)
                .map(this::describe)
                .collect(Collectors.toCollection(ArrayList::new));
        if (list.size() > itemLimit) {
            capped.add(Map.of("note", "... and " + (list.size() - itemLimit) + " more"));
        }
        return capped;
    }

    private Object describe(Object item) {
        KnowledgeEntry entry = null;
        if (item instanceof ScoredKnowledgeEntry scored) {
            entry = scored.getEntry();
        } else if (item instanceof KnowledgeEntry knowledgeEntry) {
            entry = knowledgeEntry;
        }
        if (entry == null) {
            return item;
        }
        // Vectors are large and meaningless to the model
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", entry.getId());
        view.put("tier", entry.getTier() != null ? entry.getTier().getLevel() : null);
        view.put("category", entry.getCategory());
        view.put("content", entry.getContent());
        view.put("source", entry.getSource());
        return view;
    }

    private String joinedSummaries(List<ActionOutcome> outcomes) {
        if (outcomes.isEmpty()) {
            return "I couldn't find anything to act on. Could you rephrase or add detail?";
        }
        return outcomes.stream()
                .map(outcome -> outcome.getResult().getSummary())
                .filter(summary -> summary != null && !summary.isBlank())
                .collect(Collectors.joining("\n"));
    }
}
