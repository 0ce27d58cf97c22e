package com.sandy.aiot.automation.engine;

import com.sandy.aiot.automation.engine.service.DeviceChannel;
import com.sandy.aiot.automation.engine.vo.CommandResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Device channel double that remembers every command; devices listed in {@link #failFor} reply with an error.
 */
@Component
@Primary
@Profile("test")
public class RecordingDeviceChannel implements DeviceChannel {

    private final List<SentCommand> sent = new CopyOnWriteArrayList<>();
    private final Set<String> failing = Collections.synchronizedSet(new HashSet<>());

    @Override
    public CommandResult send(String target, String command, Map<String, Object> parameters) {
        sent.add(new SentCommand(target, command, parameters));
        if (failing.contains(target)) return CommandResult.fail("device " + target + " unreachable");
        return CommandResult.ok("ok");
    }

    public void failFor(String target) {
        failing.add(target);
    }

    public List<SentCommand> sent() {
        return List.copyOf(sent);
    }

    public long count(String target, String command) {
        return sent.stream().filter(c -> c.getTarget().equals(target) && c.getCommand().equals(command)).count();
    }

    public void reset() {
        sent.clear();
        failing.clear();
    }

    @Data
    @AllArgsConstructor
    public static class SentCommand {
        private String target;
        private String command;
        private Map<String, Object> parameters;
    }
}
