package com.sandy.aiot.automation.engine.service.impl;

import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.Scene;
import com.sandy.aiot.automation.engine.service.DeviceChannel;
import com.sandy.aiot.automation.engine.service.SceneActivator;
import com.sandy.aiot.automation.engine.service.SnapshotPersistenceService;
import com.sandy.aiot.automation.engine.vo.CommandResult;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultSceneActivator implements SceneActivator {

    public static final String COLLECTION = "scenes";

    private final DeviceChannel deviceChannel;
    private final SnapshotPersistenceService snapshots;
    private final Map<String, Scene> scenes = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (Scene s : snapshots.register(COLLECTION, Scene.class, this::listScenes)) {
            if (s.getId() != null) scenes.put(s.getId(), s);
        }
    }

    public Scene saveScene(Scene scene) {
        if (scene == null || scene.getId() == null || scene.getId().isBlank()) {
            throw new ConfigurationException("Scene id is required");
        }
        List<Scene.SceneCommand> commands = scene.getCommands() == null ? List.of() : List.copyOf(scene.getCommands());
        for (Scene.SceneCommand c : commands) {
            if (c.getTarget() == null || c.getTarget().isBlank() || c.getCommand() == null || c.getCommand().isBlank()) {
                throw new ConfigurationException("Scene " + scene.getId() + " has a command without target or command");
            }
        }
        Scene copy = Scene.builder()
                .id(scene.getId())
                .name(scene.getName() != null ? scene.getName() : scene.getId())
                .description(scene.getDescription())
                .commands(commands)
                .enabled(scene.isEnabled())
                .build();
        scenes.put(copy.getId(), copy);
        snapshots.markDirty(COLLECTION);
        log.info("Scene saved id={} commands={}", copy.getId(), commands.size());
        return copy;
    }

    public boolean removeScene(String sceneId) {
        boolean removed = scenes.remove(sceneId) != null;
        if (removed) snapshots.markDirty(COLLECTION);
        return removed;
    }

    public Optional<Scene> getScene(String sceneId) {
        return Optional.ofNullable(scenes.get(sceneId));
    }

    public List<Scene> listScenes() {
        return scenes.values().stream().sorted(Comparator.comparing(Scene::getId)).toList();
    }

    /** Sends the scene's commands in order; a failing command does not stop the rest. */
    @Override
    public CommandResult activate(String sceneId) {
        Scene scene = scenes.get(sceneId);
        if (scene == null) return CommandResult.fail("unknown scene " + sceneId);
        if (!scene.isEnabled()) return CommandResult.fail("scene " + sceneId + " is disabled");
        List<String> failures = new ArrayList<>();
        for (Scene.SceneCommand c : scene.getCommands()) {
            try {
                CommandResult r = deviceChannel.send(c.getTarget(), c.getCommand(),
                        c.getParameters() == null ? Map.of() : c.getParameters());
                if (r == null || !r.isSuccess()) failures.add(c.getTarget() + ": " + (r == null ? "no reply" : r.getMessage()));
            } catch (RuntimeException e) {
                failures.add(c.getTarget() + ": " + e.getMessage());
            }
        }
        log.info("Scene activated id={} commands={} failures={}", sceneId, scene.getCommands().size(), failures.size());
        return failures.isEmpty() ? CommandResult.ok("scene " + sceneId + " activated")
                : CommandResult.fail("scene " + sceneId + " partially failed: " + String.join("; ", failures));
    }
}
