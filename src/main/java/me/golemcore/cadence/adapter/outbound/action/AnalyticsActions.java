package me.golemcore.cadence.adapter.outbound.action;

import lombok.RequiredArgsConstructor;
import me.golemcore.cadence.domain.model.ActionRequest;
import me.golemcore.cadence.domain.model.ActionResult;
import me.golemcore.cadence.domain.model.CoordinatorTask;
import me.golemcore.cadence.domain.model.InterventionRecord;
import me.golemcore.cadence.domain.model.Patient;
import me.golemcore.cadence.domain.model.StaffMember;
import me.golemcore.cadence.domain.model.Trial;
import me.golemcore.cadence.port.outbound.InterventionRecordPort;
import me.golemcore.cadence.port.outbound.PatientDirectoryPort;
import me.golemcore.cadence.port.outbound.TaskPort;
import me.golemcore.cadence.port.outbound.TrialCatalogPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only aggregates over interventions, patients, trials and staff.
 */
@Component
@RequiredArgsConstructor
class AnalyticsActions {

    private static final String SITE_ID = "site_id";

    private final PatientDirectoryPort patientDirectory;
    private final InterventionRecordPort interventionRecords;
    private final TaskPort taskPort;
    private final TrialCatalogPort trialCatalog;
    private final Clock clock;

    ActionResult getInterventionStats(ActionRequest request) {
        List<InterventionRecord> records = interventionRecords.findInterventions(
                request.optionalString(SITE_ID).orElse(null));
        LocalDate weekAgo = LocalDate.now(clock).minusDays(7);

        Map<String, Long> byOutcome = new TreeMap<>();
        Map<String, Long> byType = new TreeMap<>();
        long systemRecommended = 0;
        long systemPositive = 0;
        long thisWeek = 0;
        for (InterventionRecord record : records) {
            byOutcome.merge(String.valueOf(record.getOutcome()), 1L, Long::sum);
            byType.merge(String.valueOf(record.getType()), 1L, Long::sum);
            if (InterventionRecord.TRIGGER_SYSTEM.equals(record.getTriggeredBy())) {
                systemRecommended++;
                if (record.isPositive()) {
                    systemPositive++;
                }
            }
            if (record.getDate() != null && !record.getDate().isBefore(weekAgo)) {
                thisWeek++;
            }
        }
        double systemSuccessRate = systemRecommended > 0
                ? HandlerSupport.round((double) systemPositive / systemRecommended, 2)
                : 0.0;

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total", records.size());
        stats.put("by_outcome", byOutcome);
        stats.put("by_type", byType);
        stats.put("system_recommended", systemRecommended);
        stats.put("system_success_rate", systemSuccessRate);
        stats.put("this_week", thisWeek);
        return ActionResult.success(records.size() + " interventions logged, " + thisWeek + " this week.", stats);
    }

    ActionResult getSiteAnalytics(ActionRequest request) {
        String siteId = request.optionalString(SITE_ID).orElse(null);
        List<Patient> patients = patientDirectory.findPatients(siteId);
        List<InterventionRecord> records = interventionRecords.findInterventions(siteId);
        LocalDate monthStart = LocalDate.now(clock).withDayOfMonth(1);

        long active = patients.stream().filter(Patient::isInActiveCare).count();
        long withdrawn = patients.stream().filter(patient -> Patient.STATUS_WITHDRAWN.equals(patient.getStatus()))
                .count();
        double retentionRate = patients.isEmpty() ? 0.0
                : HandlerSupport.round((double) (patients.size() - withdrawn) / patients.size(), 3);
        double avgRisk = HandlerSupport.round(patients.stream()
                .filter(Patient::isInActiveCare)
                .mapToDouble(Patient::getDropoutRiskScore)
                .average()
                .orElse(0.0), 3);

        Map<String, Long> riskDistribution = new LinkedHashMap<>();
        riskDistribution.put("high", 0L);
        riskDistribution.put("medium", 0L);
        riskDistribution.put("low", 0L);
        patients.stream()
                .filter(Patient::isInActiveCare)
                .forEach(patient -> riskDistribution.merge(
                        HandlerSupport.riskLevel(patient.getDropoutRiskScore()), 1L, Long::sum));

        Map<String, Object> analytics = new LinkedHashMap<>();
        analytics.put(SITE_ID, siteId != null ? siteId : "all");
        analytics.put("total_patients", patients.size());
        analytics.put("active", active);
        analytics.put("withdrawn", withdrawn);
        analytics.put("retention_rate", retentionRate);
        analytics.put("avg_risk_score", avgRisk);
        analytics.put("risk_distribution", riskDistribution);
        analytics.put("interventions_total", records.size());
        analytics.put("interventions_this_month", records.stream()
                .filter(record -> record.getDate() != null && !record.getDate().isBefore(monthStart))
                .count());
        return ActionResult.success(String.format(Locale.ROOT,
                "%d patients, %d active, retention %.0f%%.", patients.size(), active, retentionRate * 100),
                analytics);
    }

    ActionResult getTrialInfo(ActionRequest request) {
        String trialId = request.requireString("trial_id");
        Trial trial = trialCatalog.findTrial(trialId)
                .orElseThrow(() -> new RecordNotFoundException("Trial", trialId));
        return ActionResult.success(trial.getName() + " (" + trial.getTrialId() + "), phase " + trial.getPhase()
                + ", " + trial.getCondition() + ".", trial);
    }

    ActionResult getStaffWorkload(ActionRequest request) {
        String siteId = request.optionalString(SITE_ID).orElse(null);
        LocalDate today = LocalDate.now(clock);
        List<Patient> patients = patientDirectory.findPatients(siteId);
        List<CoordinatorTask> pending = taskPort.findTasks(siteId).stream()
                .filter(task -> CoordinatorTask.STATUS_PENDING.equals(task.getStatus()))
                .toList();

        List<Map<String, Object>> workload = new ArrayList<>();
        for (StaffMember staff : trialCatalog.findStaff(siteId)) {
            if (!staff.isActive()) {
                continue;
            }
            long patientCount = patients.stream()
                    .filter(Patient::isInActiveCare)
                    .filter(patient -> staff.getId().equals(patient.getPrimaryCrcId()))
                    .count();
            List<CoordinatorTask> assigned = pending.stream()
                    .filter(task -> staff.getId().equals(task.getAssignedTo()))
                    .toList();
            int capacity = staff.getMaxPatientLoad();

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("staff_id", staff.getId());
            row.put("name", staff.getName());
            row.put("role", staff.getRole());
            row.put(SITE_ID, staff.getSiteId());
            row.put("patients", patientCount);
            row.put("max_patient_load", capacity);
            row.put("utilization_pct", capacity > 0 ? Math.round(100.0 * patientCount / capacity) : 0);
            row.put("available_capacity", Math.max(0, capacity - patientCount));
            row.put("pending_tasks", assigned.size());
            row.put("overdue_tasks", assigned.stream()
                    .filter(task -> task.getDueDate() != null && task.getDueDate().isBefore(today))
                    .count());
            row.put("today_tasks", assigned.stream().filter(task -> today.equals(task.getDueDate())).count());
            workload.add(row);
        }
        return ActionResult.success("Workload for " + workload.size() + " active coordinator(s).", workload);
    }
}
