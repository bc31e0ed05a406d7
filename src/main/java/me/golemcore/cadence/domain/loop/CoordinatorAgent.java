package me.golemcore.cadence.domain.loop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.ActionFailureKind;
import me.golemcore.cadence.domain.model.ActionOutcome;
import me.golemcore.cadence.domain.model.ActionPlan;
import me.golemcore.cadence.domain.model.ActionRequest;
import me.golemcore.cadence.domain.model.ActionResult;
import me.golemcore.cadence.domain.model.ActionType;
import me.golemcore.cadence.domain.model.ConversationHistory;
import me.golemcore.cadence.domain.model.Patient;
import me.golemcore.cadence.domain.model.PlanMeta;
import me.golemcore.cadence.domain.model.ResolutionMemory;
import me.golemcore.cadence.domain.model.ResolutionResult;
import me.golemcore.cadence.domain.model.TurnResult;
import me.golemcore.cadence.domain.service.ActionPlanner;
import me.golemcore.cadence.domain.service.ResponseComposer;
import me.golemcore.cadence.port.outbound.ActionProviderPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs coordinator turns for one session: plan, execute the auto actions in
 * order, hold back the gated ones and compose the reply.
 *
 * <p>
 * An agent owns its conversation history, resolution memory and pending
 * actions. It is not thread-safe; {@code CoordinatorSessionService} serializes
 * turns of the same session.
 */
@Slf4j
public class CoordinatorAgent {

    static final String RESOLVED_PATIENTS = "resolved_patients";
    private static final String PATIENT_ID = "patient_id";
    private static final String SITE_ID = "site_id";

    private final String sessionId;
    private final ActionPlanner planner;
    private final ActionProviderPort actionProvider;
    private final ResponseComposer responseComposer;
    private final ConversationHistory history;
    private final ResolutionMemory resolutionMemory = new ResolutionMemory();
    private final List<ActionRequest> pendingActions = new ArrayList<>();

    public CoordinatorAgent(String sessionId, ActionPlanner planner, ActionProviderPort actionProvider,
            ResponseComposer responseComposer, int historyLimit) {
        this.sessionId = sessionId;
        this.planner = planner;
        this.actionProvider = actionProvider;
        this.responseComposer = responseComposer;
        this.history = new ConversationHistory(historyLimit);
    }

    public TurnResult handleMessage(String message, Map<String, Object> context) {
        Map<String, Object> turnContext = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        if (!resolutionMemory.isEmpty()) {
            turnContext.put(RESOLVED_PATIENTS, resolutionMemory.asMap());
        }

        ActionPlan plan = planner.plan(message, turnContext, history, sessionId);

        List<ActionRequest> auto = new ArrayList<>();
        List<ActionRequest> gated = new ArrayList<>();
        for (ActionRequest action : plan.getActions()) {
            if (action.isRequiresApproval()) {
                gated.add(action);
            } else {
                auto.add(action);
            }
        }
        pendingActions.clear();
        pendingActions.addAll(gated);
        log.info("[Executor] Session {}: {} auto, {} awaiting approval", sessionId, auto.size(), gated.size());

        List<ActionOutcome> outcomes = new ArrayList<>();
        String currentPatientId = null;
        for (ActionRequest action : auto) {
            ActionRequest prepared = prepare(action, currentPatientId, turnContext);
            ActionResult result = executeSafely(prepared);
            outcomes.add(new ActionOutcome(prepared, result));
            String resolvedId = rememberResolution(prepared, result);
            if (resolvedId != null) {
                currentPatientId = resolvedId;
            }
        }
        // Gated actions run later, so they take the patient resolved in this turn now
        for (int i = 0; i < pendingActions.size(); i++) {
            pendingActions.set(i, prepare(pendingActions.get(i), currentPatientId, turnContext));
        }

        String response = responseComposer.compose(message, plan, outcomes, sessionId);
        return toTurnResult(response, outcomes, plan.getMeta());
    }

    /**
     * Runs the pending action at {@code index} as stored, without planning
     * again, and removes it from the pending list.
     */
    public TurnResult approvePending(int index) {
        ActionRequest action = takePending(index);
        ActionResult result = executeSafely(action);
        ActionOutcome outcome = new ActionOutcome(action, result);
        rememberResolution(action, result);
        log.info("[Executor] Session {}: approved {} -> {}", sessionId, action.getActionType().getWireName(),
                result.isSuccess() ? "ok" : result.getFailureKind());
        return toTurnResult(result.getSummary(), List.of(outcome), PlanMeta.empty());
    }

    public ActionRequest rejectPending(int index) {
        ActionRequest action = takePending(index);
        log.info("[Executor] Session {}: rejected {}", sessionId, action.getActionType().getWireName());
        return action;
    }

    public List<ActionRequest> getPendingActions() {
        return List.copyOf(pendingActions);
    }

    public ConversationHistory getHistory() {
        return history;
    }

    public ResolutionMemory getResolutionMemory() {
        return resolutionMemory;
    }

    public void reset() {
        history.clear();
        resolutionMemory.clear();
        pendingActions.clear();
    }

    private ActionRequest takePending(int index) {
        if (index < 0 || index >= pendingActions.size()) {
            throw new IndexOutOfBoundsException("No pending action at index " + index + " (have "
                    + pendingActions.size() + ")");
        }
        return pendingActions.remove(index);
    }

    private ActionRequest prepare(ActionRequest action, String currentPatientId, Map<String, Object> context) {
        ActionRequest prepared = action;
        ActionType type = action.getActionType();
        if (currentPatientId != null && !prepared.hasParameter(PATIENT_ID)
                && type.findParameter(PATIENT_ID).isPresent()) {
            prepared = prepared.withParameter(PATIENT_ID, currentPatientId);
        }
        if (!prepared.hasParameter(SITE_ID) && type.findParameter(SITE_ID).isPresent()
                && context.get(SITE_ID) instanceof String siteId && !siteId.isBlank()) {
            prepared = prepared.withParameter(SITE_ID, siteId);
        }
        return prepared;
    }

    private ActionResult executeSafely(ActionRequest action) {
        try {
            ActionResult result = actionProvider.execute(action);
            if (result == null) {
                return ActionResult.failure(ActionFailureKind.EXECUTION_FAILED, "Action returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("[Executor] {} failed: {}", action.getActionType().getWireName(), e.getMessage(), e);
            return ActionResult.failure(ActionFailureKind.EXECUTION_FAILED, e.getMessage());
        }
    }

    private String rememberResolution(ActionRequest action, ActionResult result) {
        if (action.getActionType() != ActionType.RESOLVE_PATIENT || !result.isSuccess()
                || !(result.getPayload() instanceof ResolutionResult resolution) || !resolution.isResolved()) {
            return null;
        }
        Patient patient = resolution.getCandidates().get(0);
        resolutionMemory.remember(patient.getName(), patient.getPatientId());
        log.debug("[Executor] Remembered {} -> {}", patient.getName(), patient.getPatientId());
        return patient.getPatientId();
    }

    private TurnResult toTurnResult(String response, List<ActionOutcome> outcomes, PlanMeta meta) {
        TurnResult.TurnResultBuilder builder = TurnResult.builder()
                .response(response)
                .requiresApproval(!pendingActions.isEmpty())
                .pendingActions(pendingActions)
                .meta(meta != null ? meta : PlanMeta.empty());
        for (ActionOutcome outcome : outcomes) {
            builder.actionTaken(outcome.toExecutedAction());
            ActionResult result = outcome.getResult();
            if (result.isSuccess() && result.getPayload() != null) {
                builder.dataItem(result.getPayload());
            }
        }
        return builder.build();
    }
}
