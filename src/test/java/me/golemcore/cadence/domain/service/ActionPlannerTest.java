package me.golemcore.cadence.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ActionPlannerTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private LlmPort llmPort;
    private CadenceProperties properties;
    private ActionPlanner planner;
    private ConversationHistory history;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new CadenceProperties();
        properties.getPlanner().setTrials(List.of("NCT06789012 CARDIO-GLP1"));
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        planner = new ActionPlanner(llmPort, objectMapper, new PromptTemplateEngine(), properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
        history = new ConversationHistory(properties.getPlanner().getHistoryLimit());
    }

    @Test
    void shouldParseWellFormedPlan() {
        respondWith("""
                {"thinking": "Find high-risk patients", "actions": [
                  {"action_type": "query_patients", "parameters": {"risk_level": "high", "limit": 5},
                   "description": "Get high-risk patients"}
                ], "response_template": "Here they are: {result_0}", "requires_approval": false}
                """);

        ActionPlan plan = planner.plan("Show me high-risk patients", Map.of(), history);

        assertFalse(plan.isRawText());
        assertEquals("Find high-risk patients", plan.getThinking());
        assertEquals(1, plan.getActions().size());
        ActionRequest action = plan.getActions().get(0);
        assertEquals(ActionType.QUERY_PATIENTS, action.getActionType());
        assertEquals("high", action.getParameters().get("risk_level"));
        assertEquals(5, action.getParameters().get("limit"));
        assertFalse(action.isRequiresApproval());
        assertEquals("Here they are: {result_0}", plan.getResponseTemplate());
    }

    @Test
    void shouldDropUnknownActionKindAndKeepValidOne() {
        respondWith("""
                {"actions": [
                  {"action_type": "teleport_patient", "parameters": {"patient_id": "PT-1"}},
                  {"action_type": "get_today_tasks", "parameters": {}}
                ], "response_template": "{result_0}"}
                """);

        ActionPlan plan = planner.plan("What's on today?", Map.of(), history);

        assertEquals(1, plan.getActions().size());
        assertEquals(ActionType.GET_TODAY_TASKS, plan.getActions().get(0).getActionType());
    }

    @Test
    void shouldDropActionsWithMistypedOrMissingParameters() {
        respondWith("""
                {"actions": [
                  {"action_type": "query_patients", "parameters": {"limit": "ten"}},
                  {"action_type": "get_trial_info", "parameters": {}},
                  {"action_type": "get_patient_timeline", "parameters": {"patient_id": "PT-1"}}
                ]}
                """);

        ActionPlan plan = planner.plan("timeline", Map.of(), history);

        assertEquals(List.of(ActionType.GET_PATIENT_TIMELINE),
                plan.getActions().stream().map(ActionRequest::getActionType).toList());
    }

    @Test
    void shouldConvertNumericStringsToDeclaredTypes() {
        respondWith("""
                {"actions": [
                  {"action_type": "search_knowledge_graph",
                   "parameters": {"query": "nausea", "tier": "3", "limit": " 10 "}}
                ]}
                """);

        ActionPlan plan = planner.plan("cross-site nausea tips", Map.of(), history);

        assertEquals(1, plan.getActions().size());
        ActionRequest action = plan.getActions().get(0);
        assertEquals(3, action.getParameters().get("tier"));
        assertEquals(10, action.getParameters().get("limit"));
        assertEquals("nausea", action.getParameters().get("query"));
    }

    @Test
    void shouldReturnApologyPlanWhenPromptResourceIsMissing() {
        properties.getPlanner().setPromptResource("prompts/missing.md");

        ActionPlan plan = planner.plan("hi", Map.of(), history);

        assertTrue(plan.isRawText());
        assertEquals(ActionPlanner.UNAVAILABLE_RESPONSE, plan.getResponseTemplate());
        assertEquals(0, history.size());
        verify(llmPort, never()).chat(any(LlmRequest.class));
    }

    @Test
    void shouldAllowMissingPatientIdAfterResolvePatient() {
        respondWith("""
                {"actions": [
                  {"action_type": "resolve_patient", "parameters": {"query": "Maria"}},
                  {"action_type": "get_patient_summary", "parameters": {}}
                ]}
                """);

        ActionPlan plan = planner.plan("How is Maria doing?", Map.of(), history);

        assertEquals(2, plan.getActions().size());
        assertFalse(plan.getActions().get(1).hasParameter("patient_id"));
    }

    @Test
    void shouldForceApprovalOnWriteActions() {
        respondWith("""
                {"actions": [
                  {"action_type": "log_intervention",
                   "parameters": {"patient_id": "PT-1", "type": "phone_call"}, "requires_approval": false},
                  {"action_type": "create_task",
                   "parameters": {"title": "Call", "category": "call", "due_date": "2026-02-12"},
                   "requires_approval": true},
                  {"action_type": "list_tasks", "parameters": {}}
                ], "requires_approval": true}
                """);

        ActionPlan plan = planner.plan("Log call and add a task", Map.of(), history);

        assertTrue(plan.getActions().get(0).isRequiresApproval());
        assertTrue(plan.getActions().get(1).isRequiresApproval());
        assertFalse(plan.getActions().get(2).isRequiresApproval());
        assertTrue(plan.isRequiresApproval());
    }

    @Test
    void shouldStripCodeFences() {
        respondWith("```json\n{\"actions\": [{\"action_type\": \"get_today_tasks\"}]}\n```");

        ActionPlan plan = planner.plan("today", Map.of(), history);

        assertFalse(plan.isRawText());
        assertEquals(1, plan.getActions().size());
    }

    @Test
    void shouldReturnRawTextPlanWhenOutputIsNotJson() {
        respondWith("Hello! How can I help with your patients today?");

        ActionPlan plan = planner.plan("hi", Map.of(), history);

        assertTrue(plan.isRawText());
        assertTrue(plan.getActions().isEmpty());
        assertEquals("Hello! How can I help with your patients today?", plan.getResponseTemplate());
        assertEquals(ActionPlanner.PARSE_FAILURE_THINKING, plan.getThinking());
    }

    @Test
    void shouldReturnApologyPlanWhenModelFails() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));

        ActionPlan plan = planner.plan("hi", Map.of(), history);

        assertTrue(plan.isRawText());
        assertEquals(ActionPlanner.UNAVAILABLE_RESPONSE, plan.getResponseTemplate());
        assertEquals(0, history.size());
    }

    @Test
    void shouldPrefixContextAndRecordExchangeInHistory() {
        respondWith("{\"actions\": []}");

        planner.plan("Show my tasks", Map.of("site_id", "site_sinai"), history);

        List<ConversationTurn> turns = history.getTurns();
        assertEquals(2, turns.size());
        assertEquals("[Context: {\"site_id\":\"site_sinai\"}]\n\nShow my tasks", turns.get(0).getContent());
        assertEquals("{\"actions\": []}", turns.get(1).getContent());
    }

    @Test
    void shouldSendHistoryAndRenderedSystemPrompt() {
        history.appendExchange("earlier question", "{\"actions\": []}");
        respondWith("{\"actions\": []}");

        planner.plan("next question", null, history, "session-1");

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals(3, request.getMessages().size());
        assertEquals("next question", request.getMessages().get(2).getContent());
        assertEquals(0.2, request.getTemperature());
        assertEquals(2048, request.getMaxTokens());
        assertEquals("session-1", request.getSessionId());
        assertEquals("planner", request.getPurpose());
        assertTrue(request.getSystemPrompt().contains("Today is 2026-02-11."));
        assertTrue(request.getSystemPrompt().contains("- NCT06789012 CARDIO-GLP1"));
        assertTrue(request.getSystemPrompt().contains("- schedule_visit {patient_id: string, visit_date: string, "
                + "visit_type?: string}"));
        assertFalse(request.getSystemPrompt().contains("{{ACTIONS}}"));
    }

    @Test
    void shouldKeepHistoryWithinCap() {
        ConversationHistory small = new ConversationHistory(4);
        respondWith("{\"actions\": []}");

        for (int i = 0; i < 10; i++) {
            planner.plan("message " + i, Map.of(), small);
            assertTrue(small.size() <= 4);
        }
        assertEquals("message 9", small.getTurns().get(2).getContent());
    }

    @Test
    void shouldCarryUsageIntoPlanMeta() {
        LlmResponse response = LlmResponse.builder()
                .content("{\"actions\": []}")
                .model("gpt-4o")
                .usage(LlmUsage.builder()
                        .inputTokens(1200)
                        .outputTokens(80)
                        .latency(Duration.ofMillis(950))
                        .costUsd(0.0038)
                        .build())
                .build();
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.completedFuture(response));

        PlanMeta meta = planner.plan("hi", Map.of(), history).getMeta();

        assertEquals("gpt-4o", meta.getModel());
        assertEquals(1200, meta.getInputTokens());
        assertEquals(80, meta.getOutputTokens());
        assertEquals(950, meta.getLatencyMs());
        assertEquals(0.0038, meta.getCostUsd());
    }

    @Test
    void shouldStripFencesWithoutLanguageTag() {
        assertEquals("{}", ActionPlanner.stripFences("```\n{}\n```"));
        assertEquals("{}", ActionPlanner.stripFences("  {}  "));
    }

    private void respondWith(String content) {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(content).model("gpt-4o").build()));
    }
}
