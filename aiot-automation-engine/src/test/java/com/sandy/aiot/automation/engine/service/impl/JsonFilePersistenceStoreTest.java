package com.sandy.aiot.automation.engine.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sandy.aiot.automation.engine.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFilePersistenceStoreTest {

    @TempDir
    Path dir;

    private JsonFilePersistenceStore store() {
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return new JsonFilePersistenceStore(mapper, dir.resolve("store").toString());
    }

    @Test
    void missingCollectionLoadsEmpty() {
        assertTrue(store().loadCollection("rules", Rule.class).isEmpty());
    }

    @Test
    void rulesSurviveAReload() throws Exception {
        Rule rule = Rule.builder()
                .id("r1")
                .name("Night lights")
                .conditions(List.of(Condition.builder().type(ConditionType.TIME).target("system").property("hour")
                        .operator(ComparisonOperator.GREATER_EQUAL).value(20).build()))
                .logicOperator(LogicOperator.AND)
                .actions(List.of(Action.builder().type(ActionType.GROUP_CONTROL).target("lights").command("on").build()))
                .cooldownSeconds(600)
                .lastExecutedAt(Instant.parse("2024-03-04T20:00:00Z"))
                .executionCount(7)
                .build();

        store().saveCollection("rules", List.of(rule));
        assertTrue(Files.exists(dir.resolve("store").resolve("rules.json")));
        assertFalse(Files.exists(dir.resolve("store").resolve("rules.json.tmp")));

        List<Rule> loaded = store().loadCollection("rules", Rule.class);
        assertEquals(1, loaded.size());
        Rule r = loaded.get(0);
        assertEquals("Night lights", r.getName());
        assertEquals(ConditionType.TIME, r.getConditions().get(0).getType());
        assertEquals(ActionType.GROUP_CONTROL, r.getActions().get(0).getType());
        assertEquals(Instant.parse("2024-03-04T20:00:00Z"), r.getLastExecutedAt());
        assertEquals(7, r.getExecutionCount());
        assertEquals(600, r.getCooldownSeconds());
    }

    @Test
    void saveReplacesWholeCollection() {
        JsonFilePersistenceStore store = store();
        store.saveCollection("thresholds", List.of(
                Threshold.builder().deviceId("a").sensorType("t").max(1.0).build(),
                Threshold.builder().deviceId("b").sensorType("t").max(2.0).build()));
        store.saveCollection("thresholds", List.of(Threshold.builder().deviceId("c").sensorType("t").min(0.5).build()));

        List<Threshold> loaded = store.loadCollection("thresholds", Threshold.class);
        assertEquals(1, loaded.size());
        assertEquals("c", loaded.get(0).getDeviceId());
        assertEquals(0.5, loaded.get(0).getMin());
    }
}
