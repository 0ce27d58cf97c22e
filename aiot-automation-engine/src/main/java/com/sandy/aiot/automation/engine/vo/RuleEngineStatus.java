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
public class RuleEngineStatus {
    private int totalRules;
    private int activeRules;
    private int disabledRules;
    private int inFlight;
    private long totalExecutions;
    private int variables;
    private List<RecentExecution> recentExecutions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecentExecution {
        private String ruleId;
        private String name;
        private Instant lastExecutedAt;
        private long executionCount;
        private String lastError;
    }
}
