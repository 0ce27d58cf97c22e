package com.sandy.aiot.automation.engine.controller;

import com.sandy.aiot.automation.engine.model.Scene;
import com.sandy.aiot.automation.engine.service.impl.DefaultSceneActivator;
import com.sandy.aiot.automation.engine.vo.ActionResp;
import com.sandy.aiot.automation.engine.vo.CommandResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/scenes")
@RequiredArgsConstructor
public class SceneController {

    private final DefaultSceneActivator sceneActivator;

    @GetMapping
    public List<Scene> list() {
        return sceneActivator.listScenes();
    }

    @PutMapping
    public ResponseEntity<ActionResp> save(@RequestBody Scene scene) {
        return ResponseEntity.ok(ActionResp.ok(sceneActivator.saveScene(scene)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ActionResp> remove(@PathVariable String id) {
        if (!sceneActivator.removeScene(id)) return ResponseEntity.ok(ActionResp.fail("Scene not found"));
        return ResponseEntity.ok(ActionResp.ok());
    }

    @PostMapping("/{id}/activate")
    public ResponseEntity<ActionResp> activate(@PathVariable String id) {
        CommandResult r = sceneActivator.activate(id);
        return ResponseEntity.ok(r.isSuccess() ? ActionResp.ok(r.getMessage()) : ActionResp.fail(r.getMessage()));
    }
}
