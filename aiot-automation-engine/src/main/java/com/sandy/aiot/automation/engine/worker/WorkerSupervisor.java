package com.sandy.aiot.automation.engine.worker;

import jakarta.annotation.PreDestroy;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs every {@link AutomationWorker} at a fixed delay and keeps each one alive: a failing tick is
 * logged and counted, and the worker simply runs again on its next tick.
 * Workers can be stopped and restarted one by one; stopping never interrupts a tick in progress.
 */
@Component
@Slf4j
public class WorkerSupervisor {

    private final Map<String, AutomationWorker> workers = new LinkedHashMap<>();
    private final TaskScheduler workerScheduler;
    private final Clock clock;
    private final Map<String, ScheduledFuture<?>> running = new ConcurrentHashMap<>();
    private final Map<String, WorkerHealth> health = new ConcurrentHashMap<>();

    @Value("${automation.workers.autostart:true}")
    private boolean autostart;

    public WorkerSupervisor(List<AutomationWorker> workers,
                            @Qualifier("workerScheduler") TaskScheduler workerScheduler,
                            Clock clock) {
        this.workerScheduler = workerScheduler;
        this.clock = clock;
        for (AutomationWorker w : workers) {
            this.workers.put(w.workerName(), w);
            this.health.put(w.workerName(), new WorkerHealth(w.workerName()));
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!autostart) {
            log.info("Worker autostart disabled, registered workers={}", workers.keySet());
            return;
        }
        workers.keySet().forEach(this::start);
    }

    public boolean start(String name) {
        AutomationWorker worker = workers.get(name);
        if (worker == null) return false;
        running.computeIfAbsent(name, n -> {
            log.info("Starting worker name={} interval={}ms", n, worker.tickInterval().toMillis());
            return workerScheduler.scheduleWithFixedDelay(() -> runGuarded(worker), worker.tickInterval());
        });
        return true;
    }

    public boolean stop(String name) {
        ScheduledFuture<?> future = running.remove(name);
        if (future == null) return false;
        future.cancel(false);
        log.info("Stopped worker name={}", name);
        return true;
    }

    /** Runs one tick behind the fault barrier; also used for manual ticks. */
    public boolean tickNow(String name) {
        AutomationWorker worker = workers.get(name);
        if (worker == null) return false;
        runGuarded(worker);
        return true;
    }

    void runGuarded(AutomationWorker worker) {
        WorkerHealth h = health.get(worker.workerName());
        Instant started = clock.instant();
        try {
            worker.tick();
            h.recordSuccess(started);
        } catch (Exception e) {
            h.recordFailure(started, e);
            log.error("Worker tick failed name={} error={}:{}, continuing on next tick",
                    worker.workerName(), e.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    public List<WorkerHealth> status() {
        List<WorkerHealth> list = new ArrayList<>();
        for (String name : workers.keySet()) {
            WorkerHealth h = health.get(name).copy();
            h.setRunning(running.containsKey(name));
            list.add(h);
        }
        return list;
    }

    @PreDestroy
    public void shutdown() {
        new ArrayList<>(running.keySet()).forEach(this::stop);
    }

    @Data
    public static class WorkerHealth {
        private final String name;
        private boolean running;
        private long ticks;
        private long failures;
        private Instant lastTickAt;
        private Instant lastFailureAt;
        private String lastFailure;

        synchronized void recordSuccess(Instant at) {
            ticks++;
            lastTickAt = at;
        }

        synchronized void recordFailure(Instant at, Exception e) {
            ticks++;
            failures++;
            lastTickAt = at;
            lastFailureAt = at;
            lastFailure = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        synchronized WorkerHealth copy() {
            WorkerHealth c = new WorkerHealth(name);
            c.ticks = ticks;
            c.failures = failures;
            c.lastTickAt = lastTickAt;
            c.lastFailureAt = lastFailureAt;
            c.lastFailure = lastFailure;
            return c;
        }
    }
}
