package com.sandy.aiot.automation.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Preset of device commands applied in order when the scene is activated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Scene {
    private String id;
    private String name;
    private String description;
    private List<SceneCommand> commands;
    @Builder.Default
    private boolean enabled = true;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SceneCommand {
        private String target;
        private String command;
        private Map<String, Object> parameters;
    }
}
