package me.golemcore.cadence.adapter.outbound.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.ActionRequest;
import me.golemcore.cadence.domain.model.ActionResult;
import me.golemcore.cadence.domain.model.CoordinatorTask;
import me.golemcore.cadence.domain.model.InterventionRecord;
import me.golemcore.cadence.domain.model.Patient;
import me.golemcore.cadence.domain.model.PatientEvent;
import me.golemcore.cadence.domain.model.ResolutionResult;
import me.golemcore.cadence.domain.model.StaffMember;
import me.golemcore.cadence.domain.service.PatientResolutionService;
import me.golemcore.cadence.port.outbound.InterventionRecordPort;
import me.golemcore.cadence.port.outbound.PatientDirectoryPort;
import me.golemcore.cadence.port.outbound.TaskPort;
import me.golemcore.cadence.port.outbound.TrialCatalogPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.DoublePredicate;
import java.util.stream.Collectors;

/**
 * Patient-facing actions: roster queries, risk, timelines, resolution and the
 * write actions that change a patient's record.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class PatientActions {

    private static final String PATIENT_ID = "patient_id";
    private static final String SITE_ID = "site_id";
    private static final int DEFAULT_QUERY_LIMIT = 20;
    private static final int RECENT_ITEMS = 5;

    private final PatientDirectoryPort patientDirectory;
    private final InterventionRecordPort interventionRecords;
    private final TaskPort taskPort;
    private final TrialCatalogPort trialCatalog;
    private final PatientResolutionService resolutionService;
    private final Clock clock;

    ActionResult queryPatients(ActionRequest request) {
        List<Patient> patients = patientDirectory.findPatients(request.optionalString(SITE_ID).orElse(null));
        LocalDate today = LocalDate.now(clock);

        String trialId = request.optionalString("trial_id").orElse(null);
        String status = request.optionalString("status").orElse(null);
        DoublePredicate riskFilter = request.optionalString("risk_level")
                .map(this::riskFilter)
                .orElse(score -> true);
        boolean overdueOnly = request.booleanParameter("overdue_only", false);
        int limit = request.intParameter("limit", DEFAULT_QUERY_LIMIT);

        List<Patient> matches = patients.stream()
                .filter(patient -> trialId == null || trialId.equals(patient.getTrialId()))
                .filter(patient -> status == null || status.equals(patient.getStatus()))
                .filter(patient -> riskFilter.test(patient.getDropoutRiskScore()))
                .filter(patient -> !overdueOnly
                        || (patient.getNextVisitDate() != null && patient.getNextVisitDate().isBefore(today)))
                .sorted(Comparator.comparingDouble(Patient::getDropoutRiskScore).reversed())
                .limit(Math.max(limit, 1))
                .toList();
        return ActionResult.success("Found " + matches.size() + " patients matching your criteria.", matches);
    }

    ActionResult getRiskScores(ActionRequest request) {
        String patientId = request.optionalString(PATIENT_ID).orElse(null);
        List<Patient> patients = patientDirectory.findPatients(request.optionalString(SITE_ID).orElse(null)).stream()
                .filter(patient -> patientId == null || patientId.equals(patient.getPatientId()))
                .sorted(Comparator.comparingDouble(Patient::getDropoutRiskScore).reversed())
                .toList();
        if (patientId != null && patients.isEmpty()) {
            throw new RecordNotFoundException("Patient", patientId);
        }

        List<Map<String, Object>> scores = patients.stream().map(patient -> {
            Map<String, Object> score = new LinkedHashMap<>();
            score.put(PATIENT_ID, patient.getPatientId());
            score.put("name", patient.getName());
            score.put(SITE_ID, patient.getSiteId());
            score.put("trial_id", patient.getTrialId());
            score.put("dropout_risk_score", patient.getDropoutRiskScore());
            score.put("risk_level", HandlerSupport.riskLevel(patient.getDropoutRiskScore()));
            score.put("risk_factors", patient.getRiskFactors());
            score.put("recommended_actions", patient.getRecommendedActions());
            return score;
        }).toList();
        long high = patients.stream().filter(patient -> patient.getDropoutRiskScore() >= HandlerSupport.HIGH_RISK)
                .count();
        return ActionResult.success(
                "Retrieved risk scores for " + scores.size() + " patients (" + high + " high-risk).", scores);
    }

    ActionResult getPatientTimeline(ActionRequest request) {
        Patient patient = requirePatient(request);
        List<PatientEvent> events = patient.getEvents() == null ? List.of()
                : patient.getEvents().stream()
                        .sorted(Comparator.comparing(PatientEvent::getDate,
                                Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())))
                        .toList();

        Map<String, Object> timeline = new LinkedHashMap<>();
        timeline.put(PATIENT_ID, patient.getPatientId());
        timeline.put("name", patient.getName());
        timeline.put(SITE_ID, patient.getSiteId());
        timeline.put("trial_id", patient.getTrialId());
        timeline.put("enrollment_date", patient.getEnrollmentDate());
        timeline.put("events", events);
        timeline.put("next_visit_date", patient.getNextVisitDate());
        timeline.put("dropout_risk_score", patient.getDropoutRiskScore());
        return ActionResult.success(
                "Timeline for " + patient.getName() + ": " + events.size() + " events.", timeline);
    }

    ActionResult getPatientSummary(ActionRequest request) {
        Patient patient = requirePatient(request);
        List<CoordinatorTask> upcoming = taskPort.findTasks(patient.getSiteId()).stream()
                .filter(task -> patient.getPatientId().equals(task.getPatientId()))
                .filter(task -> CoordinatorTask.STATUS_PENDING.equals(task.getStatus()))
                .sorted(Comparator.comparing(CoordinatorTask::getDueDate,
                        Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())))
                .limit(RECENT_ITEMS)
                .toList();
        List<InterventionRecord> interventions = interventionRecords.findInterventionsForPatient(
                patient.getPatientId());
        List<InterventionRecord> recent = interventions.subList(Math.max(0, interventions.size() - RECENT_ITEMS),
                interventions.size());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("patient", patient);
        summary.put("upcoming_tasks", upcoming);
        summary.put("recent_interventions", List.copyOf(recent));
        return ActionResult.success(String.format(Locale.ROOT,
                "%s (%s): %s, %.0f%% dropout risk, %d pending task(s).",
                patient.getName(), patient.getPatientId(), patient.getStatus(),
                patient.getDropoutRiskScore() * 100, upcoming.size()), summary);
    }

    ActionResult resolvePatient(ActionRequest request) {
        String query = request.requireString("query");
        ResolutionResult resolution = resolutionService.resolve(query, request.optionalString(SITE_ID).orElse(null));
        String summary = switch (resolution.getMatch()) {
        case EXACT, SINGLE -> {
            Patient patient = resolution.getCandidates().get(0);
            yield "Resolved '" + query + "' to " + patient.getName() + " (" + patient.getPatientId() + ").";
        }
        case MULTIPLE -> "Found " + resolution.getCandidates().size() + " possible matches for '" + query + "': "
                + resolution.getCandidates().stream()
                        .map(patient -> patient.getName() + " (" + patient.getPatientId() + ")")
                        .collect(Collectors.joining(", "))
                + ". Which one did you mean?";
        case NONE -> "No patient matched '" + query + "'. Could you give a full name or patient ID?";
        };
        return ActionResult.success(summary, resolution);
    }

    ActionResult scheduleVisit(ActionRequest request) {
        Patient patient = requirePatient(request);
        LocalDate visitDate = HandlerSupport.requireDate(request, "visit_date");
        String visitType = request.optionalString("visit_type").orElse("follow_up");

        patient.setNextVisitDate(visitDate);
        patientDirectory.savePatient(patient);
        CoordinatorTask task = taskPort.saveTask(CoordinatorTask.builder()
                .id(newTaskId())
                .title(visitType.replace('_', ' ') + " visit: " + patient.getName())
                .patientId(patient.getPatientId())
                .trialId(patient.getTrialId())
                .siteId(patient.getSiteId())
                .dueDate(visitDate)
                .category("visit")
                .assignedTo(patient.getPrimaryCrcId())
                .build());
        log.info("[Actions] Scheduled {} visit for {} on {}", visitType, patient.getPatientId(), visitDate);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("scheduled", true);
        payload.put(PATIENT_ID, patient.getPatientId());
        payload.put("visit_date", visitDate);
        payload.put("visit_type", visitType);
        payload.put("task_id", task.getId());
        payload.put("note", "Logged in Cadence only. Also enter the visit in your CTMS.");
        return ActionResult.success(
                "Visit scheduled for patient " + patient.getPatientId() + " on " + visitDate + ".", payload);
    }

    ActionResult logIntervention(ActionRequest request) {
        Patient patient = requirePatient(request);
        LocalDate today = LocalDate.now(clock);
        InterventionRecord record = InterventionRecord.builder()
                .id("int-" + UUID.randomUUID().toString().substring(0, 8))
                .patientId(patient.getPatientId())
                .siteId(patient.getSiteId())
                .trialId(patient.getTrialId())
                .type(request.requireString("type"))
                .date(today)
                .outcome(request.optionalString("outcome").orElse(InterventionRecord.OUTCOME_PENDING))
                .notes(request.optionalString("notes").orElse(null))
                .triggeredBy(request.optionalString("triggered_by").orElse(InterventionRecord.TRIGGER_MANUAL))
                .build();
        interventionRecords.appendIntervention(record);
        patient.setLastContactDate(today);
        patientDirectory.savePatient(patient);
        log.info("[Actions] Logged {} for {} ({})", record.getType(), patient.getPatientId(), record.getOutcome());
        return ActionResult.success("Logged " + record.getType() + " for " + patient.getPatientId()
                + " (outcome: " + record.getOutcome() + ").", record);
    }

    ActionResult sendReminder(ActionRequest request) {
        Patient patient = requirePatient(request);
        String channel = request.optionalString("channel").orElse("sms");
        String visitDate = HandlerSupport.optionalDate(request, "visit_date")
                .or(() -> Optional.ofNullable(patient.getNextVisitDate()))
                .map(LocalDate::toString)
                .orElse("TBD");

        CoordinatorTask task = taskPort.saveTask(CoordinatorTask.builder()
                .id(newTaskId())
                .title("Send " + channel + " reminder to " + patient.getName())
                .description("Reminder for visit on " + visitDate)
                .patientId(patient.getPatientId())
                .trialId(patient.getTrialId())
                .siteId(patient.getSiteId())
                .dueDate(LocalDate.now(clock))
                .category("call")
                .assignedTo(patient.getPrimaryCrcId())
                .build());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("logged", true);
        payload.put(PATIENT_ID, patient.getPatientId());
        payload.put("channel", channel);
        payload.put("message_preview", "Reminder for upcoming visit on " + visitDate);
        payload.put("task_id", task.getId());
        payload.put("note", "Delivery is not connected yet. Contact the patient manually.");
        return ActionResult.success("Reminder logged for " + patient.getPatientId() + " via " + channel
                + ". Contact the patient manually; automatic delivery is not connected.", payload);
    }

    ActionResult reassignPatient(ActionRequest request) {
        Patient patient = requirePatient(request);
        String staffId = request.requireString("staff_id");
        StaffMember staff = trialCatalog.findStaffMember(staffId)
                .orElseThrow(() -> new RecordNotFoundException("Staff member", staffId));
        if (!staff.isActive()) {
            throw new IllegalArgumentException("Staff member " + staffId + " is not active");
        }
        String previous = patient.getPrimaryCrcId();
        patient.setPrimaryCrcId(staff.getId());
        patientDirectory.savePatient(patient);
        log.info("[Actions] Reassigned {} from {} to {}", patient.getPatientId(), previous, staff.getId());
        return ActionResult.success("Reassigned " + patient.getName() + " to " + staff.getName() + ".", patient);
    }

    private Patient requirePatient(ActionRequest request) {
        String patientId = request.requireString(PATIENT_ID);
        return patientDirectory.findPatient(patientId)
                .orElseThrow(() -> new RecordNotFoundException("Patient", patientId));
    }

    private DoublePredicate riskFilter(String level) {
        return switch (level.toLowerCase(Locale.ROOT)) {
        case "high" -> score -> score >= HandlerSupport.HIGH_RISK;
        case "medium" -> score -> score >= HandlerSupport.MEDIUM_RISK && score < HandlerSupport.HIGH_RISK;
        case "low" -> score -> score < HandlerSupport.MEDIUM_RISK;
        default -> throw new IllegalArgumentException("risk_level must be high, medium or low: " + level);
        };
    }

    private String newTaskId() {
        return "task-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
