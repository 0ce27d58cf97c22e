package com.sandy.aiot.automation.engine.event;

/**
 * Request from an action to enable or disable a rule. Applied by the rule engine, the only writer of rule state.
 *
 * @param ruleId  rule to change
 * @param enabled requested state
 * @param origin  rule or task whose action asked for the change
 */
public record RuleToggleRequestedEvent(String ruleId, boolean enabled, String origin) {
}
