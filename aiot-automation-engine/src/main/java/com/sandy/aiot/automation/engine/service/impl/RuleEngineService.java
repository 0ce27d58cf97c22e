package com.sandy.aiot.automation.engine.service.impl;

import com.sandy.aiot.automation.engine.event.RuleToggleRequestedEvent;
import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.Action;
import com.sandy.aiot.automation.engine.model.Condition;
import com.sandy.aiot.automation.engine.model.LogicOperator;
import com.sandy.aiot.automation.engine.model.Rule;
import com.sandy.aiot.automation.engine.service.*;
import com.sandy.aiot.automation.engine.vo.ActionResult;
import com.sandy.aiot.automation.engine.vo.RuleEngineStatus;
import com.sandy.aiot.automation.engine.worker.AutomationWorker;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the rule registry and fires rules whose conditions hold.
 * <p>
 * Every tick walks the enabled rules in descending priority, skips rules that are cooling down,
 * over their daily cap or already firing, and hands each matching rule to the action executor.
 * A firing runs its actions in order; its execution record is written only after the last action.
 */
@Service
@Slf4j
public class RuleEngineService implements AutomationWorker {

    public static final String COLLECTION = "rules";

    private static final Comparator<Rule> BY_PRIORITY =
            Comparator.comparingInt(Rule::getPriority).reversed().thenComparing(Rule::getId);

    private final ConditionEvaluator conditionEvaluator;
    private final ActionDispatcher actionDispatcher;
    private final StateSnapshot stateSnapshot;
    private final SnapshotPersistenceService snapshots;
    private final AuditLogService auditLogService;
    private final VariableStore variableStore;
    private final Executor actionExecutor;
    private final Clock clock;

    private final Map<String, Rule> rules = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Value("${automation.rules.tick-interval-ms:1000}")
    private long tickIntervalMs = 1000;

    public RuleEngineService(ConditionEvaluator conditionEvaluator,
                             ActionDispatcher actionDispatcher,
                             StateSnapshot stateSnapshot,
                             SnapshotPersistenceService snapshots,
                             AuditLogService auditLogService,
                             VariableStore variableStore,
                             @Qualifier("actionExecutor") Executor actionExecutor,
                             Clock clock) {
        this.conditionEvaluator = conditionEvaluator;
        this.actionDispatcher = actionDispatcher;
        this.stateSnapshot = stateSnapshot;
        this.snapshots = snapshots;
        this.auditLogService = auditLogService;
        this.variableStore = variableStore;
        this.actionExecutor = actionExecutor;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        for (Rule rule : snapshots.register(COLLECTION, Rule.class, this::listRules)) {
            try {
                validate(rule);
                rules.put(rule.getId(), rule);
            } catch (ConfigurationException e) {
                log.error("Skipping stored rule id={} error={}", rule.getId(), e.getMessage());
            }
        }
        log.info("Rule engine initialized: rules={} tickIntervalMs={}", rules.size(), tickIntervalMs);
    }

    @Override
    public String workerName() {
        return "rule-engine";
    }

    @Override
    public Duration tickInterval() {
        return Duration.ofMillis(tickIntervalMs);
    }

    @Override
    public void tick() {
        Instant now = clock.instant();
        List<Rule> candidates = rules.values().stream().filter(Rule::isEnabled).sorted(BY_PRIORITY).toList();
        for (Rule rule : candidates) {
            if (inFlight.contains(rule.getId()) || !shouldEvaluate(rule, now)) continue;
            boolean matched;
            try {
                matched = conditionEvaluator.evaluate(rule.getConditions(), rule.getLogicOperator(), stateSnapshot);
            } catch (RuntimeException e) {
                log.warn("Rule evaluation failed id={} error={}", rule.getId(), e.getMessage());
                continue;
            }
            if (matched) {
                fire(rule, "condition");
            }
        }
    }

    /**
     * Cooldown and daily cap gate. Today's count is zero when the last execution was on another date.
     */
    public boolean shouldEvaluate(Rule rule, Instant now) {
        Instant last = rule.getLastExecutedAt();
        if (last != null && rule.getCooldownSeconds() > 0
                && Duration.between(last, now).compareTo(Duration.ofSeconds(rule.getCooldownSeconds())) < 0) {
            return false;
        }
        Integer cap = rule.getMaxExecutionsPerDay();
        return cap == null || countToday(rule, now) < cap;
    }

    private int countToday(Rule rule, Instant now) {
        Instant last = rule.getLastExecutedAt();
        if (last == null || !date(last).equals(date(now))) return 0;
        return rule.getExecutionCountToday();
    }

    private LocalDate date(Instant instant) {
        return instant.atZone(clock.getZone()).toLocalDate();
    }

    /**
     * Manual firing: skips conditions, cooldown and cap but still respects a firing in progress.
     *
     * @return false when the rule is unknown or already firing
     */
    public boolean trigger(String ruleId) {
        Rule rule = rules.get(ruleId);
        if (rule == null) return false;
        return fire(rule, "manual");
    }

    private boolean fire(Rule rule, String trigger) {
        String id = rule.getId();
        if (!inFlight.add(id)) return false;
        List<Action> actions = rule.getActions() == null ? List.of() : rule.getActions();
        try {
            actionExecutor.execute(() -> runFiring(id, actions, trigger));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(id);
            log.warn("Rule firing rejected id={} error={}", id, e.getMessage());
            return false;
        }
    }

    private void runFiring(String ruleId, List<Action> actions, String trigger) {
        try {
            log.info("Rule firing id={} trigger={} actions={}", ruleId, trigger, actions.size());
            List<ActionResult> results = actionDispatcher.executeAll(actions, ruleId);
            recordExecution(ruleId, trigger, results);
        } catch (Exception e) {
            log.error("Rule firing failed id={} error={}", ruleId, e.getMessage(), e);
        } finally {
            inFlight.remove(ruleId);
        }
    }

    private void recordExecution(String ruleId, String trigger, List<ActionResult> results) {
        Instant now = clock.instant();
        Optional<ActionResult> firstFailure = results.stream().filter(r -> !r.isSuccess()).findFirst();
        Rule updated = rules.computeIfPresent(ruleId, (id, r) -> r.toBuilder()
                .lastExecutedAt(now)
                .executionCount(r.getExecutionCount() + 1)
                .executionCountToday(countToday(r, now) + 1)
                .lastResults(List.copyOf(results))
                .lastError(firstFailure.map(ActionResult::getError).orElse(null))
                .lastErrorAt(firstFailure.isPresent() ? now : r.getLastErrorAt())
                .build());
        if (updated == null) {
            log.info("Rule removed while firing id={}", ruleId);
            return;
        }
        snapshots.markDirty(COLLECTION);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("trigger", trigger);
        details.put("actions", results.size());
        details.put("failed", results.stream().filter(r -> !r.isSuccess()).count());
        firstFailure.ifPresent(f -> details.put("error", f.getError()));
        auditLogService.record("rule_executed", ruleId, details);
        log.info("Rule executed id={} count={} today={} failed={}", ruleId,
                updated.getExecutionCount(), updated.getExecutionCountToday(), details.get("failed"));
    }

    /**
     * Stores a new definition. The execution record of an existing rule is carried over inside the
     * registry update, so a firing that completes concurrently is never lost.
     */
    public Rule saveRule(Rule rule) {
        validate(rule);
        Instant now = clock.instant();
        Rule draft = rule.toBuilder()
                .conditions(rule.getConditions() == null ? List.of() : rule.getConditions().stream().map(c -> c.toBuilder().build()).toList())
                .actions(rule.getActions().stream().map(a -> a.toBuilder().build()).toList())
                .logicOperator(rule.getLogicOperator() == null ? LogicOperator.AND : rule.getLogicOperator())
                .updatedAt(now)
                .build();
        boolean[] created = new boolean[1];
        Rule saved = rules.compute(draft.getId(), (id, existing) -> {
            created[0] = existing == null;
            Rule.RuleBuilder copy = draft.toBuilder();
            if (existing != null) {
                copy.createdAt(existing.getCreatedAt())
                        .lastExecutedAt(existing.getLastExecutedAt())
                        .executionCount(existing.getExecutionCount())
                        .executionCountToday(existing.getExecutionCountToday())
                        .lastError(existing.getLastError())
                        .lastErrorAt(existing.getLastErrorAt())
                        .lastResults(existing.getLastResults());
            } else {
                copy.createdAt(now)
                        .lastExecutedAt(null)
                        .executionCount(0)
                        .executionCountToday(0)
                        .lastError(null)
                        .lastErrorAt(null)
                        .lastResults(null);
            }
            return copy.build();
        });
        snapshots.markDirty(COLLECTION);
        auditLogService.record(created[0] ? "rule_created" : "rule_updated", saved.getId(),
                Map.of("name", saved.getName(), "enabled", saved.isEnabled(), "priority", saved.getPriority()));
        log.info("Rule saved id={} name={} conditions={} actions={} enabled={}", saved.getId(), saved.getName(),
                saved.getConditions().size(), saved.getActions().size(), saved.isEnabled());
        return copyOf(saved);
    }

    public boolean removeRule(String ruleId) {
        Rule removed = rules.remove(ruleId);
        if (removed == null) return false;
        snapshots.markDirty(COLLECTION);
        auditLogService.record("rule_removed", ruleId, Map.of("name", removed.getName()));
        log.info("Rule removed id={}", ruleId);
        return true;
    }

    /** Takes effect from the next tick; a firing in progress completes. */
    public Optional<Rule> setEnabled(String ruleId, boolean enabled) {
        Instant now = clock.instant();
        Rule updated = rules.computeIfPresent(ruleId, (id, r) ->
                r.isEnabled() == enabled ? r : r.toBuilder().enabled(enabled).updatedAt(now).build());
        if (updated == null) return Optional.empty();
        snapshots.markDirty(COLLECTION);
        auditLogService.record(enabled ? "rule_enabled" : "rule_disabled", ruleId, Map.of());
        log.info("Rule {} id={}", enabled ? "enabled" : "disabled", ruleId);
        return Optional.of(copyOf(updated));
    }

    @EventListener
    public void onToggleRequested(RuleToggleRequestedEvent event) {
        if (setEnabled(event.ruleId(), event.enabled()).isEmpty()) {
            log.warn("Toggle requested for unknown rule id={} origin={}", event.ruleId(), event.origin());
        }
    }

    public Optional<Rule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId)).map(RuleEngineService::copyOf);
    }

    /** Copies in descending priority; changing one never touches the registry. */
    public List<Rule> listRules() {
        return rules.values().stream().sorted(BY_PRIORITY).map(RuleEngineService::copyOf).toList();
    }

    private static Rule copyOf(Rule rule) {
        return rule.toBuilder()
                .conditions(rule.getConditions() == null ? null : rule.getConditions().stream().map(c -> c.toBuilder().build()).toList())
                .actions(rule.getActions() == null ? null : rule.getActions().stream().map(a -> a.toBuilder().build()).toList())
                .build();
    }

    public boolean isFiring(String ruleId) {
        return inFlight.contains(ruleId);
    }

    public RuleEngineStatus status() {
        List<Rule> all = listRules();
        int active = (int) all.stream().filter(Rule::isEnabled).count();
        List<RuleEngineStatus.RecentExecution> recent = all.stream()
                .filter(r -> r.getLastExecutedAt() != null)
                .sorted(Comparator.comparing(Rule::getLastExecutedAt).reversed())
                .limit(10)
                .map(r -> new RuleEngineStatus.RecentExecution(r.getId(), r.getName(), r.getLastExecutedAt(),
                        r.getExecutionCount(), r.getLastError()))
                .toList();
        return RuleEngineStatus.builder()
                .totalRules(all.size())
                .activeRules(active)
                .disabledRules(all.size() - active)
                .inFlight(inFlight.size())
                .totalExecutions(all.stream().mapToLong(Rule::getExecutionCount).sum())
                .variables(variableStore.size())
                .recentExecutions(recent)
                .build();
    }

    private void validate(Rule rule) {
        if (rule == null) throw new ConfigurationException("Rule must not be null");
        if (rule.getId() == null || rule.getId().isBlank()) throw new ConfigurationException("Rule id is required");
        if (rule.getName() == null || rule.getName().isBlank()) throw new ConfigurationException("Rule " + rule.getId() + " needs a name");
        if (rule.getCooldownSeconds() < 0) throw new ConfigurationException("Rule " + rule.getId() + " has negative cooldown");
        if (rule.getMaxExecutionsPerDay() != null && rule.getMaxExecutionsPerDay() <= 0) {
            throw new ConfigurationException("Rule " + rule.getId() + " maxExecutionsPerDay must be positive");
        }
        if (rule.getActions() == null || rule.getActions().isEmpty()) {
            throw new ConfigurationException("Rule " + rule.getId() + " needs at least one action");
        }
        if (rule.getConditions() != null) {
            for (Condition c : rule.getConditions()) conditionEvaluator.validate(c);
        }
        for (Action a : rule.getActions()) actionDispatcher.validate(a);
    }
}
