package com.sandy.aiot.automation.engine.service.impl;

import com.sandy.aiot.automation.engine.service.NotificationSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public boolean send(String channel, List<String> recipients, String title, String message, Map<String, Object> metadata) {
        log.info("Notification channel={} recipients={} title={} message={} metadata={}", channel, recipients, title, message, metadata);
        return true;
    }
}
