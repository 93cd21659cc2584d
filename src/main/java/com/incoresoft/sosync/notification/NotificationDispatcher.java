package com.incoresoft.sosync.notification;

import java.util.Map;

/**
 * Push transport towards group members. One instance lives for the whole process.
 */
public interface NotificationDispatcher {

    default void init() {
    }

    /**
     * @param excludeUserId member who triggered the notification and should not receive it, may be null
     */
    void send(String groupId, String title, String body, Map<String, String> payload, String excludeUserId);

    default void shutdown() {
    }
}
