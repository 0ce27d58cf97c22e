package com.sandy.aiot.automation.engine.service;

import java.util.Map;

/**
 * Optional hook for custom_script actions. Without a bean of this type such actions fail with an error result.
 */
public interface CustomScriptHandler {
    Object run(String script, Map<String, Object> parameters) throws Exception;
}
