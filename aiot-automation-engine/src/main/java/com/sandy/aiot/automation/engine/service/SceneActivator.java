package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.vo.CommandResult;

public interface SceneActivator {
    CommandResult activate(String sceneId);
}
