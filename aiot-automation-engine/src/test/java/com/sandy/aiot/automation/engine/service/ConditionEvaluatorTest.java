package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.ComparisonOperator;
import com.sandy.aiot.automation.engine.model.Condition;
import com.sandy.aiot.automation.engine.model.ConditionType;
import com.sandy.aiot.automation.engine.model.LogicOperator;
import org.junit.jupiter.api.Test;

import java.time.ZonedDateTime;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();
    private final FixedSnapshot snapshot = new FixedSnapshot();

    private static Condition device(String target, String property, ComparisonOperator op, Object value) {
        return Condition.builder().type(ConditionType.DEVICE_STATE).target(target).property(property).operator(op).value(value).build();
    }

    private Condition alwaysTrue() {
        return device("m1", "temperature", ComparisonOperator.GREATER_THAN, 0);
    }

    private Condition alwaysFalse() {
        return device("m1", "temperature", ComparisonOperator.LESS_THAN, 0);
    }

    @Test
    void notIsNegatedConjunction() {
        snapshot.devices.put("m1", Map.of("temperature", 50.0));
        assertTrue(evaluator.evaluate(List.of(alwaysTrue(), alwaysFalse()), LogicOperator.NOT, snapshot));
        assertFalse(evaluator.evaluate(List.of(alwaysTrue(), alwaysTrue()), LogicOperator.NOT, snapshot));
    }

    @Test
    void andOrAndEmptyList() {
        snapshot.devices.put("m1", Map.of("temperature", 50.0));
        assertFalse(evaluator.evaluate(List.of(alwaysTrue(), alwaysFalse()), LogicOperator.AND, snapshot));
        assertTrue(evaluator.evaluate(List.of(alwaysTrue(), alwaysFalse()), LogicOperator.OR, snapshot));
        assertTrue(evaluator.evaluate(List.of(), LogicOperator.AND, snapshot));
        assertTrue(evaluator.evaluate(null, LogicOperator.OR, snapshot));
    }

    @Test
    void missingValueIsFalseForEveryOperator() {
        for (ComparisonOperator op : ComparisonOperator.values()) {
            Object value = op == ComparisonOperator.IN_RANGE ? List.of(1, 2) : 1;
            assertFalse(evaluator.evaluateLeaf(device("ghost", "temperature", op, value), snapshot), op.code());
        }
    }

    @Test
    void numericComparisonAcceptsNumericStrings() {
        assertTrue(evaluator.compare(92.0, ComparisonOperator.GREATER_THAN, 85));
        assertTrue(evaluator.compare("85", ComparisonOperator.EQUALS, 85.0));
        assertTrue(evaluator.compare(10, ComparisonOperator.GREATER_EQUAL, "10"));
        assertFalse(evaluator.compare(9, ComparisonOperator.GREATER_THAN, "10"));
    }

    @Test
    void lexicalForStringsAndFalseForMixedTypes() {
        assertTrue(evaluator.compare("08:30", ComparisonOperator.GREATER_THAN, "07:45"));
        assertTrue(evaluator.compare("on", ComparisonOperator.EQUALS, "on"));
        assertTrue(evaluator.compare("on", ComparisonOperator.NOT_EQUALS, "off"));
        assertFalse(evaluator.compare("warm", ComparisonOperator.GREATER_THAN, 5));
        assertFalse(evaluator.compare(true, ComparisonOperator.LESS_THAN, "z"));
    }

    @Test
    void containsRangeAndRegex() {
        assertTrue(evaluator.compare("pump-overheat", ComparisonOperator.CONTAINS, "overheat"));
        assertTrue(evaluator.compare(20, ComparisonOperator.IN_RANGE, List.of(20, 25)));
        assertTrue(evaluator.compare(25.0, ComparisonOperator.IN_RANGE, List.of(20, 25)));
        assertFalse(evaluator.compare(25.1, ComparisonOperator.IN_RANGE, List.of(20, 25)));
        assertTrue(evaluator.compare("sensor-12", ComparisonOperator.REGEX_MATCH, "sensor-\\d+"));
        // full match only
        assertFalse(evaluator.compare("my-sensor-12", ComparisonOperator.REGEX_MATCH, "sensor-\\d+"));
    }

    @Test
    void timePropertiesUseMondayAsZero() {
        // 2024-03-06 is a Wednesday
        snapshot.now = ZonedDateTime.parse("2024-03-06T07:30:00Z");
        Condition weekday = Condition.builder().type(ConditionType.TIME).property("weekday").operator(ComparisonOperator.EQUALS).value(2).build();
        Condition time = Condition.builder().type(ConditionType.TIME).property("time").operator(ComparisonOperator.EQUALS).value("07:30").build();
        Condition hour = Condition.builder().type(ConditionType.TIME).property("hour").operator(ComparisonOperator.IN_RANGE).value(List.of(6, 8)).build();
        assertTrue(evaluator.evaluate(List.of(weekday, time, hour), LogicOperator.AND, snapshot));
    }

    @Test
    void groupAndCustomConditions() {
        snapshot.groups.put("floor1", Map.of("device_count", 3, "online_devices", 2, "all_online", false));
        snapshot.variables.put("mode", "away");
        Condition group = Condition.builder().type(ConditionType.GROUP_STATE).target("floor1").property("online_devices").operator(ComparisonOperator.LESS_THAN).value(3).build();
        Condition custom = Condition.builder().type(ConditionType.CUSTOM).target("mode").operator(ComparisonOperator.EQUALS).value("away").build();
        assertTrue(evaluator.evaluate(List.of(group, custom), LogicOperator.AND, snapshot));
    }

    @Test
    void validateRejectsUnusableConditions() {
        assertThrows(ConfigurationException.class, () -> evaluator.validate(
                device("m1", "temperature", ComparisonOperator.IN_RANGE, 5)));
        assertThrows(ConfigurationException.class, () -> evaluator.validate(
                device("m1", "name", ComparisonOperator.REGEX_MATCH, "[unclosed")));
        assertThrows(ConfigurationException.class, () -> evaluator.validate(
                Condition.builder().type(ConditionType.TIME).property("fortnight").operator(ComparisonOperator.EQUALS).value(1).build()));
        assertThrows(ConfigurationException.class, () -> evaluator.validate(
                device("m1", "temperature", null, 5)));
        assertDoesNotThrow(() -> evaluator.validate(device("m1", "temperature", ComparisonOperator.GREATER_THAN, 85)));
    }

    static class FixedSnapshot implements StateSnapshot {
        ZonedDateTime now = ZonedDateTime.parse("2024-03-04T08:00:00Z");
        final Map<String, Map<String, Object>> devices = new HashMap<>();
        final Map<String, Map<String, Object>> groups = new HashMap<>();
        final Map<String, Object> variables = new HashMap<>();

        @Override
        public ZonedDateTime now() {
            return now;
        }

        @Override
        public Optional<Object> deviceProperty(String deviceId, String property) {
            return Optional.ofNullable(devices.getOrDefault(deviceId, Map.of()).get(property));
        }

        @Override
        public Map<String, Object> groupStatus(String groupId) {
            return groups.getOrDefault(groupId, Map.of());
        }

        @Override
        public Optional<Object> variable(String name) {
            return Optional.ofNullable(variables.get(name));
        }
    }

    @Test
    void regexCacheStaysBounded() {
        for (int i = 0; i < ConditionEvaluator.MAX_CACHED_PATTERNS + 100; i++) {
            assertTrue(evaluator.compare("x" + i, ComparisonOperator.REGEX_MATCH, "x" + i));
        }
        assertEquals(ConditionEvaluator.MAX_CACHED_PATTERNS, evaluator.cachedPatternCount());
        assertTrue(evaluator.compare("sensor-7", ComparisonOperator.REGEX_MATCH, "sensor-\\d"));
    }
}
