package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.InMemoryPersistenceStoreTest;
import com.sandy.aiot.automation.engine.MutableClock;
import com.sandy.aiot.automation.engine.event.RuleToggleRequestedEvent;
import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.Action;
import com.sandy.aiot.automation.engine.model.ActionType;
import com.sandy.aiot.automation.engine.vo.ActionResult;
import com.sandy.aiot.automation.engine.vo.CommandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ActionDispatcherTest {

    private DeviceChannel deviceChannel;
    private GroupManager groupManager;
    private SceneActivator sceneActivator;
    private NotificationSender notificationSender;
    private ApplicationEventPublisher publisher;
    private VariableStore variableStore;
    private MutableClock clock;
    private final List<Duration> sleeps = new ArrayList<>();

    private ActionDispatcher dispatcher(Optional<CustomScriptHandler> scripts) {
        ActionDispatcher d = new ActionDispatcher(deviceChannel, groupManager, sceneActivator, notificationSender,
                variableStore, publisher, scripts, clock, "email");
        d.setSleeper(d2 -> {
            sleeps.add(d2);
            clock.advance(d2);
        });
        return d;
    }

    @BeforeEach
    void setup() {
        deviceChannel = mock(DeviceChannel.class);
        groupManager = mock(GroupManager.class);
        sceneActivator = mock(SceneActivator.class);
        notificationSender = mock(NotificationSender.class);
        publisher = mock(ApplicationEventPublisher.class);
        variableStore = new VariableStore(new SnapshotPersistenceService(new InMemoryPersistenceStoreTest()));
        clock = new MutableClock(Instant.parse("2024-03-04T08:00:00Z"), ZoneOffset.UTC);
        sleeps.clear();
    }

    private static Action device(String id, String target, String command) {
        return Action.builder().id(id).type(ActionType.DEVICE_CONTROL).target(target).command(command).build();
    }

    @Test
    void actionsRunInOrderAndFailureDoesNotAbortTheRest() {
        when(deviceChannel.send(eq("pump"), anyString(), any())).thenThrow(new IllegalStateException("timeout"));
        when(deviceChannel.send(eq("fan"), anyString(), any())).thenReturn(CommandResult.ok("fan on"));
        when(sceneActivator.activate("night")).thenReturn(CommandResult.fail("unknown scene night"));

        List<ActionResult> results = dispatcher(Optional.empty()).executeAll(List.of(
                device("a1", "pump", "stop"),
                device("a2", "fan", "on"),
                Action.builder().id("a3").type(ActionType.SCENE_ACTIVATE).target("night").build()), "r1");

        assertThat(results, hasSize(3));
        assertFalse(results.get(0).isSuccess());
        assertThat(results.get(0).getError(), containsString("timeout"));
        assertTrue(results.get(1).isSuccess());
        assertFalse(results.get(2).isSuccess());
        assertEquals("unknown scene night", results.get(2).getError());

        InOrder order = inOrder(deviceChannel, sceneActivator);
        order.verify(deviceChannel).send(eq("pump"), eq("stop"), any());
        order.verify(deviceChannel).send(eq("fan"), eq("on"), any());
        order.verify(sceneActivator).activate("night");
    }

    @Test
    void delayPausesBeforeTheAction() {
        when(deviceChannel.send(anyString(), anyString(), any())).thenReturn(CommandResult.ok("ok"));
        Action delayed = device("a1", "valve", "close").toBuilder().delaySeconds(5).build();

        ActionResult result = dispatcher(Optional.empty()).execute(delayed, "t1");

        assertTrue(result.isSuccess());
        assertEquals(List.of(Duration.ofSeconds(5)), sleeps);
        assertEquals(Instant.parse("2024-03-04T08:00:00Z"), result.getStartedAt());
    }

    @Test
    void notificationNotDeliveredIsAnError() {
        when(notificationSender.send(anyString(), anyList(), anyString(), anyString(), anyMap())).thenReturn(false);
        Action notify = Action.builder().id("n1").type(ActionType.NOTIFICATION)
                .parameters(Map.of("channel", "sms", "recipients", "a@x, b@x", "message", "hot")).build();

        ActionResult result = dispatcher(Optional.empty()).execute(notify, "r9");

        assertFalse(result.isSuccess());
        assertThat(result.getError(), containsString("sms"));
        verify(notificationSender).send(eq("sms"), eq(List.of("a@x", "b@x")), eq("Automation notification"), eq("hot"), anyMap());
    }

    @Test
    void ruleToggleIsPublishedAsEvent() {
        ActionDispatcher d = dispatcher(Optional.empty());
        d.execute(Action.builder().type(ActionType.RULE_DISABLE).target("r2").build(), "r1");
        verify(publisher).publishEvent(new RuleToggleRequestedEvent("r2", false, "r1"));
    }

    @Test
    void variableSetWritesTheStore() {
        ActionResult r = dispatcher(Optional.empty()).execute(Action.builder().type(ActionType.VARIABLE_SET)
                .target("mode").parameters(Map.of("value", "away")).build(), "t1");
        assertTrue(r.isSuccess());
        assertEquals(Optional.of("away"), variableStore.get("mode"));
    }

    @Test
    void customScriptWithoutHandlerFailsAndWithHandlerRuns() throws Exception {
        Action script = Action.builder().type(ActionType.CUSTOM_SCRIPT).command("reset-counters").build();
        assertFalse(dispatcher(Optional.empty()).execute(script, "r1").isSuccess());

        CustomScriptHandler handler = mock(CustomScriptHandler.class);
        when(handler.run(eq("reset-counters"), anyMap())).thenReturn(42);
        ActionResult r = dispatcher(Optional.of(handler)).execute(script, "r1");
        assertTrue(r.isSuccess());
        assertEquals(42, r.getResult());
    }

    @Test
    void validateRejectsMissingTargetAndCommand() {
        ActionDispatcher d = dispatcher(Optional.empty());
        assertThrows(ConfigurationException.class, () -> d.validate(Action.builder().type(ActionType.DEVICE_CONTROL).command("on").build()));
        assertThrows(ConfigurationException.class, () -> d.validate(Action.builder().type(ActionType.GROUP_CONTROL).target("g1").build()));
        assertThrows(ConfigurationException.class, () -> d.validate(Action.builder().target("x").build()));
        assertThrows(ConfigurationException.class, () -> d.validate(device("a", "pump", "on").toBuilder().delaySeconds(-1).build()));
        assertDoesNotThrow(() -> d.validate(Action.builder().type(ActionType.NOTIFICATION).build()));
    }
}
