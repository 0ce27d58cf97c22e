package com.sandy.aiot.automation.engine.service.impl;

import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.Action;
import com.sandy.aiot.automation.engine.model.ScheduleType;
import com.sandy.aiot.automation.engine.model.ScheduledTask;
import com.sandy.aiot.automation.engine.service.ActionDispatcher;
import com.sandy.aiot.automation.engine.service.AuditLogService;
import com.sandy.aiot.automation.engine.service.SnapshotPersistenceService;
import com.sandy.aiot.automation.engine.service.TimeTriggerCalculator;
import com.sandy.aiot.automation.engine.vo.ActionResult;
import com.sandy.aiot.automation.engine.vo.SchedulerStatus;
import com.sandy.aiot.automation.engine.worker.AutomationWorker;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs time triggered tasks. A task is due once {@code now >= nextRunAt}; after each run the next
 * fire time is recomputed from the completion time, except for {@code once} tasks which are disabled.
 */
@Service
@Slf4j
public class SchedulerService implements AutomationWorker {

    public static final String COLLECTION = "tasks";

    private final TimeTriggerCalculator calculator;
    private final ActionDispatcher actionDispatcher;
    private final SnapshotPersistenceService snapshots;
    private final AuditLogService auditLogService;
    private final Executor actionExecutor;
    private final Clock clock;

    private final Map<String, ScheduledTask> tasks = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Value("${automation.scheduler.tick-interval-ms:1000}")
    private long tickIntervalMs = 1000;

    public SchedulerService(TimeTriggerCalculator calculator,
                            ActionDispatcher actionDispatcher,
                            SnapshotPersistenceService snapshots,
                            AuditLogService auditLogService,
                            @Qualifier("actionExecutor") Executor actionExecutor,
                            Clock clock) {
        this.calculator = calculator;
        this.actionDispatcher = actionDispatcher;
        this.snapshots = snapshots;
        this.auditLogService = auditLogService;
        this.actionExecutor = actionExecutor;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        Instant now = clock.instant();
        for (ScheduledTask task : snapshots.register(COLLECTION, ScheduledTask.class, this::listTasks)) {
            try {
                validate(task);
            } catch (ConfigurationException e) {
                log.error("Skipping stored task id={} error={}", task.getId(), e.getMessage());
                continue;
            }
            // fire times are recomputed on load, missed runs are not replayed
            Instant next = task.isEnabled() ? calculator.computeNextRun(task.getScheduleType(), task.getScheduleConfig(), now).orElse(null) : null;
            tasks.put(task.getId(), task.toBuilder().nextRunAt(next).build());
        }
        log.info("Scheduler initialized: tasks={} tickIntervalMs={}", tasks.size(), tickIntervalMs);
    }

    @Override
    public String workerName() {
        return "scheduler";
    }

    @Override
    public Duration tickInterval() {
        return Duration.ofMillis(tickIntervalMs);
    }

    @Override
    public void tick() {
        Instant now = clock.instant();
        List<ScheduledTask> due = tasks.values().stream()
                .filter(t -> t.isEnabled() && t.getNextRunAt() != null && !now.isBefore(t.getNextRunAt()))
                .sorted(Comparator.comparing(ScheduledTask::getNextRunAt))
                .toList();
        for (ScheduledTask task : due) {
            if (inFlight.contains(task.getId())) continue;
            if (task.getMaxRuns() != null && task.getRunCount() >= task.getMaxRuns()) {
                exhaust(task.getId());
                continue;
            }
            submit(task, true);
        }
    }

    private void exhaust(String taskId) {
        ScheduledTask updated = tasks.computeIfPresent(taskId, (id, t) -> t.toBuilder().enabled(false).nextRunAt(null).build());
        if (updated == null) return;
        snapshots.markDirty(COLLECTION);
        auditLogService.record("task_exhausted", taskId, Map.of("runCount", updated.getRunCount()));
        log.info("Task reached max runs, disabled id={} runCount={}", taskId, updated.getRunCount());
    }

    /**
     * Runs the task action now regardless of its schedule. The schedule itself is left untouched.
     *
     * @return false when the task is unknown or already running
     */
    public boolean runNow(String taskId) {
        ScheduledTask task = tasks.get(taskId);
        return task != null && submit(task, false);
    }

    private boolean submit(ScheduledTask task, boolean scheduled) {
        String id = task.getId();
        if (!inFlight.add(id)) return false;
        Action action = task.getAction();
        try {
            actionExecutor.execute(() -> runTask(id, action, scheduled));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(id);
            log.warn("Task run rejected id={} error={}", id, e.getMessage());
            return false;
        }
    }

    private void runTask(String taskId, Action action, boolean scheduled) {
        try {
            log.info("Task running id={} scheduled={}", taskId, scheduled);
            ActionResult result = actionDispatcher.execute(action, taskId);
            recordRun(taskId, result, scheduled);
        } catch (Exception e) {
            log.error("Task run failed id={} error={}", taskId, e.getMessage(), e);
        } finally {
            inFlight.remove(taskId);
        }
    }

    private void recordRun(String taskId, ActionResult result, boolean scheduled) {
        Instant now = clock.instant();
        ScheduledTask updated = tasks.computeIfPresent(taskId, (id, t) -> {
            ScheduledTask.ScheduledTaskBuilder b = t.toBuilder()
                    .runCount(t.getRunCount() + 1)
                    .lastRunAt(now)
                    .lastResult(result)
                    .lastError(result.isSuccess() ? null : result.getError())
                    .lastErrorAt(result.isSuccess() ? t.getLastErrorAt() : now);
            if (scheduled) {
                if (t.getScheduleType() == ScheduleType.ONCE) {
                    b.enabled(false).nextRunAt(null);
                } else if (t.isEnabled()) {
                    b.nextRunAt(calculator.computeNextRun(t.getScheduleType(), t.getScheduleConfig(), now).orElse(null));
                }
            }
            return b.build();
        });
        if (updated == null) {
            log.info("Task removed while running id={}", taskId);
            return;
        }
        snapshots.markDirty(COLLECTION);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scheduled", scheduled);
        details.put("success", result.isSuccess());
        details.put("runCount", updated.getRunCount());
        if (result.getError() != null) details.put("error", result.getError());
        auditLogService.record("task_executed", taskId, details);
        log.info("Task executed id={} success={} runCount={} nextRunAt={}", taskId, result.isSuccess(),
                updated.getRunCount(), updated.getNextRunAt());
    }

    /**
     * Stores a new definition. The run record of an existing task is carried over inside the
     * registry update, so a run that completes concurrently still counts towards {@code maxRuns}.
     */
    public ScheduledTask saveTask(ScheduledTask task) {
        validate(task);
        Instant now = clock.instant();
        Map<String, Object> config = task.getScheduleConfig() == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(task.getScheduleConfig()));
        ScheduledTask draft = task.toBuilder()
                .scheduleConfig(config)
                .action(task.getAction().toBuilder().build())
                .nextRunAt(task.isEnabled() ? calculator.computeNextRun(task.getScheduleType(), config, now).orElse(null) : null)
                .build();
        boolean[] created = new boolean[1];
        ScheduledTask saved = tasks.compute(draft.getId(), (id, existing) -> {
            created[0] = existing == null;
            ScheduledTask.ScheduledTaskBuilder b = draft.toBuilder();
            if (existing != null) {
                b.createdAt(existing.getCreatedAt())
                        .lastRunAt(existing.getLastRunAt())
                        .runCount(existing.getRunCount())
                        .lastError(existing.getLastError())
                        .lastErrorAt(existing.getLastErrorAt())
                        .lastResult(existing.getLastResult());
            } else {
                b.createdAt(now).lastRunAt(null).runCount(0).lastError(null).lastErrorAt(null).lastResult(null);
            }
            return b.build();
        });
        snapshots.markDirty(COLLECTION);
        auditLogService.record(created[0] ? "task_created" : "task_updated", saved.getId(),
                Map.of("name", saved.getName(), "scheduleType", saved.getScheduleType().code()));
        log.info("Task saved id={} type={} nextRunAt={}", saved.getId(), saved.getScheduleType(), saved.getNextRunAt());
        return copyOf(saved);
    }

    public boolean removeTask(String taskId) {
        ScheduledTask removed = tasks.remove(taskId);
        if (removed == null) return false;
        snapshots.markDirty(COLLECTION);
        auditLogService.record("task_removed", taskId, Map.of("name", removed.getName()));
        log.info("Task removed id={}", taskId);
        return true;
    }

    /** Enabling recomputes the next fire time, disabling clears it. */
    public Optional<ScheduledTask> setEnabled(String taskId, boolean enabled) {
        Instant now = clock.instant();
        ScheduledTask updated = tasks.computeIfPresent(taskId, (id, t) -> t.toBuilder()
                .enabled(enabled)
                .nextRunAt(enabled ? calculator.computeNextRun(t.getScheduleType(), t.getScheduleConfig(), now).orElse(null) : null)
                .build());
        if (updated == null) return Optional.empty();
        snapshots.markDirty(COLLECTION);
        auditLogService.record(enabled ? "task_enabled" : "task_disabled", taskId, Map.of());
        log.info("Task {} id={} nextRunAt={}", enabled ? "enabled" : "disabled", taskId, updated.getNextRunAt());
        return Optional.of(copyOf(updated));
    }

    public Optional<ScheduledTask> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(SchedulerService::copyOf);
    }

    public List<ScheduledTask> listTasks() {
        return tasks.values().stream().sorted(Comparator.comparing(ScheduledTask::getId)).map(SchedulerService::copyOf).toList();
    }

    private static ScheduledTask copyOf(ScheduledTask task) {
        return task.toBuilder().action(task.getAction() == null ? null : task.getAction().toBuilder().build()).build();
    }

    public boolean isRunning(String taskId) {
        return inFlight.contains(taskId);
    }

    public SchedulerStatus status() {
        Instant now = clock.instant();
        List<ScheduledTask> all = listTasks();
        int active = (int) all.stream().filter(ScheduledTask::isEnabled).count();
        List<SchedulerStatus.UpcomingTask> upcoming = all.stream()
                .filter(t -> t.isEnabled() && t.getNextRunAt() != null)
                .sorted(Comparator.comparing(ScheduledTask::getNextRunAt))
                .limit(10)
                .map(t -> new SchedulerStatus.UpcomingTask(t.getId(), t.getName(), t.getNextRunAt(),
                        Math.max(0, Duration.between(now, t.getNextRunAt()).getSeconds())))
                .toList();
        return SchedulerStatus.builder()
                .totalTasks(all.size())
                .activeTasks(active)
                .disabledTasks(all.size() - active)
                .totalRuns(all.stream().mapToLong(ScheduledTask::getRunCount).sum())
                .upcoming(upcoming)
                .build();
    }

    private void validate(ScheduledTask task) {
        if (task == null) throw new ConfigurationException("Task must not be null");
        if (task.getId() == null || task.getId().isBlank()) throw new ConfigurationException("Task id is required");
        if (task.getName() == null || task.getName().isBlank()) throw new ConfigurationException("Task " + task.getId() + " needs a name");
        if (task.getMaxRuns() != null && task.getMaxRuns() <= 0) {
            throw new ConfigurationException("Task " + task.getId() + " maxRuns must be positive");
        }
        calculator.validate(task.getScheduleType(), task.getScheduleConfig());
        if (task.getAction() == null) throw new ConfigurationException("Task " + task.getId() + " needs an action");
        actionDispatcher.validate(task.getAction());
    }
}
