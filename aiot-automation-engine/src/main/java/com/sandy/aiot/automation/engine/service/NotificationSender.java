package com.sandy.aiot.automation.engine.service;

import java.util.List;
import java.util.Map;

/**
 * One capability behind every notification channel (email, SMS, webhook, Slack, Telegram ...).
 */
public interface NotificationSender {
    /**
     * @return true when the message was accepted for every recipient
     */
    boolean send(String channel, List<String> recipients, String title, String message, Map<String, Object> metadata);
}
