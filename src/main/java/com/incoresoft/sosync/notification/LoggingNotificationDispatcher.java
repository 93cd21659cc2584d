package com.incoresoft.sosync.notification;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Used when no push transport is configured: notifications only go to the log.
 */
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void init() {
        log.info("[NOTIFY] push transport disabled, notifications are logged only");
    }

    @Override
    public void send(String groupId, String title, String body, Map<String, String> payload, String excludeUserId) {
        log.info("[NOTIFY] group={} title='{}' body='{}' payload={} exclude={}",
                groupId, title, body, payload, excludeUserId);
    }
}
