package com.incoresoft.sosync.notification;

import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.sos.dto.SosAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Wording of the notifications the coordinators send. Failures of the transport are logged
 * and never fail the operation that triggered them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GroupNotifications {
    private final NotificationDispatcher dispatcher;

    public void safetyCheckStarted(String groupId, String checkId, String initiatedBy) {
        send(groupId, "Safety Check", "Please confirm if you are safe",
                Map.of("type", "safety_check", "groupId", groupId, "checkId", checkId, "initiatedBy", initiatedBy),
                initiatedBy);
    }

    public void sosRaised(SosAlert alert) {
        String where = alert.getLocation() == null ? "Unknown location" : alert.getLocation().describe();
        send(alert.getGroupId(), "SOS ALERT", alert.getUserId() + " needs help! Location: " + where,
                Map.of("type", "sos_alert", "groupId", alert.getGroupId(), "userId", alert.getUserId(),
                        "alertId", alert.getId(), "location", where),
                alert.getUserId());
    }

    public void sosCancelled(SosAlert alert, String cancelledBy) {
        send(alert.getGroupId(), "SOS Cancelled", "The SOS alert from " + alert.getUserId() + " is over",
                Map.of("type", "sos_cancelled", "groupId", alert.getGroupId(), "alertId", alert.getId(),
                        "cancelledBy", cancelledBy),
                cancelledBy);
    }

    public void checkCompleted(String groupId, String checkId, GroupStatus outcome) {
        String body = outcome == GroupStatus.EMERGENCY
                ? "Safety check finished: at least one member needs help"
                : "Safety check finished: everyone is safe";
        send(groupId, outcome.getDisplayName(), body,
                Map.of("type", "group_status", "groupId", groupId, "checkId", checkId, "status", outcome.getValue()),
                null);
    }

    private void send(String groupId, String title, String body, Map<String, String> payload, String exclude) {
        try {
            dispatcher.send(groupId, title, body, payload, exclude);
        } catch (Exception ex) {
            log.warn("[NOTIFY] '{}' for group {} not delivered: {}", title, groupId, ex.getMessage(), ex);
        }
    }
}
