package me.golemcore.cadence.adapter.outbound.action;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.ActionRequest;
import me.golemcore.cadence.domain.model.ActionResult;
import me.golemcore.cadence.domain.model.CoordinatorTask;
import me.golemcore.cadence.domain.model.Patient;
import me.golemcore.cadence.port.outbound.PatientDirectoryPort;
import me.golemcore.cadence.port.outbound.TaskPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Coordinator task calendar: create, list, today's view and completion.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class TaskActions {

    private static final List<String> PRIORITIES = List.of("urgent", "high", "normal", "low");
    private static final int TODAY_LIST_LIMIT = 10;
    private static final int UPCOMING_DAYS = 7;

    private static final Comparator<CoordinatorTask> BY_PRIORITY_THEN_DUE = Comparator
            .comparingInt((CoordinatorTask task) -> priorityIndex(task.getPriority()))
            .thenComparing(CoordinatorTask::getDueDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()));

    private final TaskPort taskPort;
    private final PatientDirectoryPort patientDirectory;
    private final Clock clock;

    ActionResult createTask(ActionRequest request) {
        Optional<Patient> patient = request.optionalString("patient_id").flatMap(patientDirectory::findPatient);
        String siteId = request.optionalString("site_id")
                .or(() -> patient.map(Patient::getSiteId))
                .orElseThrow(() -> new IllegalArgumentException("site_id is required when no known patient is given"));

        String priority = request.optionalString("priority").orElse("normal").toLowerCase(Locale.ROOT);
        if (!PRIORITIES.contains(priority)) {
            throw new IllegalArgumentException("priority must be one of " + PRIORITIES + ": " + priority);
        }

        CoordinatorTask task = CoordinatorTask.builder()
                .id("task-" + UUID.randomUUID().toString().substring(0, 8))
                .title(request.requireString("title"))
                .description(request.optionalString("notes").orElse(null))
                .patientId(request.optionalString("patient_id").orElse(null))
                .trialId(request.optionalString("trial_id").or(() -> patient.map(Patient::getTrialId)).orElse(null))
                .siteId(siteId)
                .dueDate(HandlerSupport.requireDate(request, "due_date"))
                .scheduledTime(request.optionalString("scheduled_time").orElse(null))
                .estimatedDurationMinutes(request.optionalInteger("estimated_duration_minutes"))
                .priority(priority)
                .category(request.requireString("category"))
                .assignedTo(patient.map(Patient::getPrimaryCrcId).orElse(null))
                .build();
        taskPort.saveTask(task);
        log.info("[Actions] Created task {} due {} ({})", task.getId(), task.getDueDate(), task.getCategory());
        return ActionResult.success("Created task '" + task.getTitle() + "' due " + task.getDueDate() + ".", task);
    }

    ActionResult listTasks(ActionRequest request) {
        Optional<LocalDate> start = HandlerSupport.optionalDate(request, "start_date");
        Optional<LocalDate> end = HandlerSupport.optionalDate(request, "end_date");
        String status = request.optionalString("status").orElse(CoordinatorTask.STATUS_PENDING);
        String category = request.optionalString("category").orElse(null);

        List<CoordinatorTask> tasks = taskPort.findTasks(request.optionalString("site_id").orElse(null)).stream()
                .filter(task -> status.equals(task.getStatus()))
                .filter(task -> category == null || category.equals(task.getCategory()))
                .filter(task -> start.isEmpty() || (task.getDueDate() != null && !task.getDueDate().isBefore(start.get())))
                .filter(task -> end.isEmpty() || (task.getDueDate() != null && !task.getDueDate().isAfter(end.get())))
                .sorted(BY_PRIORITY_THEN_DUE)
                .toList();
        return ActionResult.success("Found " + tasks.size() + " tasks.", tasks);
    }

    ActionResult getTodayTasks(ActionRequest request) {
        LocalDate today = LocalDate.now(clock);
        LocalDate horizon = today.plusDays(UPCOMING_DAYS);
        List<CoordinatorTask> pending = taskPort.findTasks(request.optionalString("site_id").orElse(null)).stream()
                .filter(task -> CoordinatorTask.STATUS_PENDING.equals(task.getStatus()))
                .sorted(BY_PRIORITY_THEN_DUE)
                .toList();

        List<CoordinatorTask> overdue = pending.stream()
                .filter(task -> task.getDueDate() != null && task.getDueDate().isBefore(today))
                .toList();
        List<CoordinatorTask> dueToday = pending.stream()
                .filter(task -> today.equals(task.getDueDate()))
                .toList();
        List<CoordinatorTask> upcoming = pending.stream()
                .filter(task -> task.getDueDate() != null && task.getDueDate().isAfter(today)
                        && !task.getDueDate().isAfter(horizon))
                .toList();

        Map<String, Long> byPriority = new TreeMap<>();
        for (CoordinatorTask task : dueToday) {
            byPriority.merge(task.getPriority(), 1L, Long::sum);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("date", today);
        summary.put("overdue_count", overdue.size());
        summary.put("today_count", dueToday.size());
        summary.put("upcoming_7d_count", upcoming.size());
        summary.put("total_pending", pending.size());
        summary.put("by_priority", byPriority);
        summary.put("overdue", overdue.stream().limit(TODAY_LIST_LIMIT).toList());
        summary.put("today", dueToday.stream().limit(TODAY_LIST_LIMIT).toList());
        summary.put("upcoming", upcoming.stream().limit(TODAY_LIST_LIMIT).toList());
        return ActionResult.success("Today: " + dueToday.size() + " tasks, " + overdue.size() + " overdue.", summary);
    }

    ActionResult completeTask(ActionRequest request) {
        String taskId = request.requireString("task_id");
        CoordinatorTask task = taskPort.findTask(taskId)
                .orElseThrow(() -> new RecordNotFoundException("Task", taskId));
        task.setStatus(CoordinatorTask.STATUS_COMPLETED);
        task.setCompletedDate(LocalDate.now(clock));
        taskPort.saveTask(task);
        log.info("[Actions] Completed task {}", taskId);
        return ActionResult.success("Completed task '" + task.getTitle() + "'.", task);
    }

    private static int priorityIndex(String priority) {
        int index = priority == null ? -1 : PRIORITIES.indexOf(priority.toLowerCase(Locale.ROOT));
        return index >= 0 ? index : PRIORITIES.size();
    }
}
