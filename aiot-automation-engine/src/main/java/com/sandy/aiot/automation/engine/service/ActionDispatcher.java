package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.event.RuleToggleRequestedEvent;
import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.Action;
import com.sandy.aiot.automation.engine.model.ActionType;
import com.sandy.aiot.automation.engine.vo.ActionResult;
import com.sandy.aiot.automation.engine.vo.CommandResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Runs actions for rule firings and scheduled tasks and normalizes every outcome into an {@link ActionResult}.
 * <p>
 * Actions of one list run strictly in order on the calling thread; a delay blocks only that thread.
 * A failing action is recorded on its result and never stops the ones after it.
 */
@Service
@Slf4j
public class ActionDispatcher {

    /** Blocking pause used for action delays. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final DeviceChannel deviceChannel;
    private final GroupManager groupManager;
    private final SceneActivator sceneActivator;
    private final NotificationSender notificationSender;
    private final VariableStore variableStore;
    private final ApplicationEventPublisher eventPublisher;
    private final Optional<CustomScriptHandler> scriptHandler;
    private final Clock clock;
    private final String defaultChannel;

    private Sleeper sleeper = d -> Thread.sleep(d.toMillis());

    public ActionDispatcher(DeviceChannel deviceChannel,
                            GroupManager groupManager,
                            SceneActivator sceneActivator,
                            NotificationSender notificationSender,
                            VariableStore variableStore,
                            ApplicationEventPublisher eventPublisher,
                            Optional<CustomScriptHandler> scriptHandler,
                            Clock clock,
                            @Value("${automation.notification.default-channel:email}") String defaultChannel) {
        this.deviceChannel = deviceChannel;
        this.groupManager = groupManager;
        this.sceneActivator = sceneActivator;
        this.notificationSender = notificationSender;
        this.variableStore = variableStore;
        this.eventPublisher = eventPublisher;
        this.scriptHandler = scriptHandler;
        this.clock = clock;
        this.defaultChannel = defaultChannel;
    }

    public void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Runs the actions in order.
     *
     * @param origin id of the rule or task that owns the actions
     */
    public List<ActionResult> executeAll(List<Action> actions, String origin) {
        if (actions == null || actions.isEmpty()) return List.of();
        List<ActionResult> results = new ArrayList<>(actions.size());
        for (Action action : actions) {
            results.add(execute(action, origin));
        }
        return results;
    }

    public ActionResult execute(Action action, String origin) {
        Instant startedAt = clock.instant();
        long t0 = System.nanoTime();
        ActionResult.ActionResultBuilder result = ActionResult.builder()
                .actionId(action.getId())
                .type(action.getType())
                .target(action.getTarget())
                .command(action.getCommand())
                .startedAt(startedAt);
        try {
            if (action.getDelaySeconds() > 0) {
                sleeper.sleep(Duration.ofSeconds(action.getDelaySeconds()));
            }
            CommandResult outcome = dispatch(action, origin);
            result.success(outcome.isSuccess())
                    .result(outcome.getPayload() != null ? outcome.getPayload() : outcome.getMessage())
                    .error(outcome.isSuccess() ? null : outcome.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.success(false).error("interrupted");
        } catch (Exception e) {
            log.warn("Action failed origin={} action={} type={} target={} error={}",
                    origin, action.getId(), action.getType(), action.getTarget(), e.getMessage());
            result.success(false).error(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        ActionResult done = result.durationMs(Duration.ofNanos(System.nanoTime() - t0).toMillis()).build();
        log.info("Action executed origin={} type={} target={} command={} success={} durationMs={}",
                origin, action.getType(), action.getTarget(), action.getCommand(), done.isSuccess(), done.getDurationMs());
        return done;
    }

    private CommandResult dispatch(Action action, String origin) throws Exception {
        ActionType type = Objects.requireNonNull(action.getType(), "action type");
        Map<String, Object> params = action.getParameters() == null ? Map.of() : action.getParameters();
        return switch (type) {
            case DEVICE_CONTROL -> deviceChannel.send(action.getTarget(), action.getCommand(), params);
            case GROUP_CONTROL -> groupManager.controlGroup(action.getTarget(), action.getCommand(), params);
            case SCENE_ACTIVATE -> sceneActivator.activate(action.getTarget());
            case NOTIFICATION -> sendNotification(action, origin);
            case DELAY -> CommandResult.ok("waited " + action.getDelaySeconds() + "s");
            case VARIABLE_SET -> {
                variableStore.set(action.getTarget(), action.parameter("value"));
                yield CommandResult.ok("variable " + action.getTarget() + " set");
            }
            case RULE_ENABLE -> {
                eventPublisher.publishEvent(new RuleToggleRequestedEvent(action.getTarget(), true, origin));
                yield CommandResult.ok("rule " + action.getTarget() + " enable requested");
            }
            case RULE_DISABLE -> {
                eventPublisher.publishEvent(new RuleToggleRequestedEvent(action.getTarget(), false, origin));
                yield CommandResult.ok("rule " + action.getTarget() + " disable requested");
            }
            case CUSTOM_SCRIPT -> runScript(action, params);
        };
    }

    private CommandResult sendNotification(Action action, String origin) {
        String channel = Objects.toString(action.parameter("channel"), defaultChannel);
        List<String> recipients = recipients(action.parameter("recipients"));
        String title = Objects.toString(action.parameter("title"), "Automation notification");
        String message = Objects.toString(action.parameter("message"), "Rule executed: " + origin);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("origin", origin);
        if (action.getTarget() != null) metadata.put("target", action.getTarget());
        boolean delivered = notificationSender.send(channel, recipients, title, message, metadata);
        return delivered ? CommandResult.ok("notification sent via " + channel)
                : CommandResult.fail("notification not delivered via " + channel);
    }

    private CommandResult runScript(Action action, Map<String, Object> params) throws Exception {
        if (scriptHandler.isEmpty()) {
            return CommandResult.fail("no custom script handler configured");
        }
        String script = action.getCommand() != null ? action.getCommand() : action.getTarget();
        return CommandResult.ok("script executed", scriptHandler.get().run(script, params));
    }

    static List<String> recipients(Object raw) {
        if (raw == null) return List.of();
        if (raw instanceof Collection<?> c) {
            return c.stream().filter(Objects::nonNull).map(Object::toString).toList();
        }
        return Arrays.stream(raw.toString().split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    /**
     * @throws ConfigurationException when the action has no type, lacks a required target or has a negative delay
     */
    public void validate(Action action) {
        if (action == null) throw new ConfigurationException("Action must not be null");
        String id = action.getId() == null ? "<unnamed>" : action.getId();
        if (action.getType() == null) throw new ConfigurationException("Action " + id + " has no type");
        if (action.getType().requiresTarget() && (action.getTarget() == null || action.getTarget().isBlank())) {
            throw new ConfigurationException("Action " + id + " of type " + action.getType().code() + " needs a target");
        }
        if (action.getDelaySeconds() < 0) {
            throw new ConfigurationException("Action " + id + " has negative delay");
        }
        if ((action.getType() == ActionType.DEVICE_CONTROL || action.getType() == ActionType.GROUP_CONTROL)
                && (action.getCommand() == null || action.getCommand().isBlank())) {
            throw new ConfigurationException("Action " + id + " of type " + action.getType().code() + " needs a command");
        }
    }
}
