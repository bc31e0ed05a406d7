package me.golemcore.cadence.adapter.outbound.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.ActionFailureKind;
import me.golemcore.cadence.domain.model.ActionRequest;
import me.golemcore.cadence.domain.model.ActionResult;
import me.golemcore.cadence.domain.model.ActionType;
import me.golemcore.cadence.port.outbound.ActionProviderPort;
import me.golemcore.cadence.port.outbound.PatientDirectoryPort;
import org.springframework.stereotype.Component;

/**
 * Action router backed by the local clinical and knowledge stores.
 *
 * <p>
 * Every action kind has a handler. Handler exceptions are mapped to failure
 * kinds: missing records to {@link ActionFailureKind#NOT_FOUND}, bad parameter
 * values to {@link ActionFailureKind#INVALID_PARAMETERS}, anything else to
 * {@link ActionFailureKind#EXECUTION_FAILED}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataStoreActionProvider implements ActionProviderPort {

    private final PatientActions patientActions;
    private final TaskActions taskActions;
    private final KnowledgeActions knowledgeActions;
    private final AnalyticsActions analyticsActions;
    private final PatientDirectoryPort patientDirectory;

    @Override
    public ActionResult execute(ActionRequest request) {
        if (request == null || request.getActionType() == null) {
            return ActionResult.failure(ActionFailureKind.UNSUPPORTED_ACTION, "No action type given");
        }
        ActionType type = request.getActionType();
        log.debug("[Actions] Executing {} with {}", type.getWireName(), request.getParameters());
        try {
            return dispatch(type, request);
        } catch (RecordNotFoundException e) {
            log.info("[Actions] {}: {}", type.getWireName(), e.getMessage());
            return ActionResult.failure(ActionFailureKind.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("[Actions] {} rejected: {}", type.getWireName(), e.getMessage());
            return ActionResult.failure(ActionFailureKind.INVALID_PARAMETERS, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Actions] {} failed", type.getWireName(), e);
            return ActionResult.failure(ActionFailureKind.EXECUTION_FAILED, e.getMessage());
        }
    }

    private ActionResult dispatch(ActionType type, ActionRequest request) {
        return switch (type) {
        case QUERY_PATIENTS -> patientActions.queryPatients(request);
        case GET_RISK_SCORES -> patientActions.getRiskScores(request);
        case GET_PATIENT_TIMELINE -> patientActions.getPatientTimeline(request);
        case GET_PATIENT_SUMMARY -> patientActions.getPatientSummary(request);
        case RESOLVE_PATIENT -> patientActions.resolvePatient(request);
        case SCHEDULE_VISIT -> patientActions.scheduleVisit(request);
        case LOG_INTERVENTION -> patientActions.logIntervention(request);
        case SEND_REMINDER -> patientActions.sendReminder(request);
        case REASSIGN_PATIENT -> patientActions.reassignPatient(request);
        case CREATE_TASK -> taskActions.createTask(request);
        case LIST_TASKS -> taskActions.listTasks(request);
        case GET_TODAY_TASKS -> taskActions.getTodayTasks(request);
        case COMPLETE_TASK -> taskActions.completeTask(request);
        case SEARCH_KNOWLEDGE -> knowledgeActions.searchKnowledge(request);
        case SEARCH_KNOWLEDGE_GRAPH -> knowledgeActions.searchKnowledgeGraph(request);
        case ADD_SITE_KNOWLEDGE -> knowledgeActions.addSiteKnowledge(request);
        case GET_KNOWLEDGE_SUGGESTIONS -> knowledgeActions.getKnowledgeSuggestions(request);
        case GET_INTERVENTION_STATS -> analyticsActions.getInterventionStats(request);
        case GET_SITE_ANALYTICS -> analyticsActions.getSiteAnalytics(request);
        case GET_TRIAL_INFO -> analyticsActions.getTrialInfo(request);
        case GET_STAFF_WORKLOAD -> analyticsActions.getStaffWorkload(request);
        };
    }

    @Override
    public boolean canExecute(ActionType type) {
        return type != null;
    }

    @Override
    public boolean healthCheck() {
        try {
            patientDirectory.findPatients(null);
            return true;
        } catch (RuntimeException e) {
            log.warn("[Actions] Health check failed: {}", e.getMessage());
            return false;
        }
    }
}
