package com.sandy.aiot.automation.engine.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatus {
    private int totalTasks;
    private int activeTasks;
    private int disabledTasks;
    private long totalRuns;
    private List<UpcomingTask> upcoming;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpcomingTask {
        private String taskId;
        private String name;
        private Instant nextRunAt;
        private long secondsUntil;
    }
}
