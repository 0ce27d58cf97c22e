package com.sandy.aiot.automation.engine.worker;

import java.time.Duration;

/**
 * Periodic unit of work driven by the {@link WorkerSupervisor}.
 */
public interface AutomationWorker {

    String workerName();

    /** Delay between the end of one tick and the start of the next. */
    Duration tickInterval();

    void tick();
}
