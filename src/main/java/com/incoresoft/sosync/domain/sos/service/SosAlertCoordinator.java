package com.incoresoft.sosync.domain.sos.service;

import com.incoresoft.sosync.config.SafetyProps;
import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.check.dto.SafetyResponse;
import com.incoresoft.sosync.domain.check.dto.SafetyResponseStatus;
import com.incoresoft.sosync.domain.check.service.ResponseAggregator;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.group.service.GroupStatusService;
import com.incoresoft.sosync.domain.shared.dto.CooldownDecision;
import com.incoresoft.sosync.domain.shared.dto.LocationData;
import com.incoresoft.sosync.domain.shared.exception.NotFoundException;
import com.incoresoft.sosync.domain.shared.exception.PermissionDeniedException;
import com.incoresoft.sosync.domain.shared.exception.RateLimitedException;
import com.incoresoft.sosync.domain.shared.service.CooldownGuard;
import com.incoresoft.sosync.domain.sos.dto.SosAlert;
import com.incoresoft.sosync.notification.GroupNotifications;
import com.incoresoft.sosync.repository.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Raises and resolves SOS alerts.
 * <p>
 * An SOS always escalates the group to Emergency. Resolution is idempotent: the store only
 * deactivates an alert that is still active, so the first resolvedAt/resolvedReason stick.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SosAlertCoordinator {
    public static final String SUPERSEDED_REASON = "superseded by later Safe response";

    private final RecordStore store;
    private final CooldownGuard cooldownGuard;
    private final ResponseAggregator aggregator;
    private final GroupStatusService statusService;
    private final GroupNotifications notifications;
    private final SafetyProps props;
    private final Clock clock;

    /**
     * Direct SOS from a member, rate limited per (user, group).
     */
    public SosAlert sendDirect(String userId, String groupId, LocationData location, String message) {
        SafetyGroup group = store.findGroup(groupId)
                .orElseThrow(() -> new NotFoundException("Group", groupId));
        if (!group.isMember(userId)) {
            throw new PermissionDeniedException("User " + userId + " is not a member of group " + groupId);
        }
        CooldownDecision decision = cooldownGuard.canSendSos(userId, group);
        if (!decision.allowed()) {
            log.info("[SOS] {} in group {} rate limited, {} min left", userId, groupId, decision.remainingMinutes());
            throw new RateLimitedException("Wait " + decision.remainingMinutes() + " more minutes for another SOS.",
                    decision.remainingMinutes());
        }

        Instant now = clock.instant();
        SosAlert alert = SosAlert.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .groupId(groupId)
                .timestamp(now)
                .location(location)
                .message(StringUtils.trimToNull(message))
                .build();
        store.saveAlert(alert);
        store.setLastSosAt(userId, groupId, now);
        store.setGroupStatus(groupId, GroupStatus.EMERGENCY);
        log.info("[SOS] alert {} raised by {} in group {}", alert.getId(), userId, groupId);
        notifications.sosRaised(alert);
        return alert;
    }

    /**
     * Alert raised by an SOS answer to a safety check. Not rate limited: it is a separate
     * trigger from the direct SOS button.
     */
    public SosAlert createFromCheckResponse(String groupId, String userId, String checkId, Instant timestamp,
                                            LocationData location, String message) {
        SosAlert alert = SosAlert.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .groupId(groupId)
                .timestamp(timestamp)
                .location(location != null ? location : LocationData.unknown(props.getCheckResponseAddress()))
                .message(StringUtils.trimToNull(message))
                .originSafetyCheckId(checkId)
                .build();
        store.saveAlert(alert);
        store.setGroupStatus(groupId, GroupStatus.EMERGENCY);
        log.info("[SOS] alert {} raised by {} answering check {}", alert.getId(), userId, checkId);
        notifications.sosRaised(alert);
        return alert;
    }

    /**
     * Cancels an alert. The owner may always cancel; the group admin may cancel someone
     * else's alert once it is old enough. If the alert came with an SOS answer to a check that
     * is still pending, that answer is withdrawn and the check re-evaluated.
     */
    public SosAlert cancel(String alertId, String requesterId, String reason) {
        SosAlert alert = store.findAlert(alertId)
                .orElseThrow(() -> new NotFoundException("SOS alert", alertId));
        SafetyGroup group = store.findGroup(alert.getGroupId())
                .orElseThrow(() -> new NotFoundException("Group", alert.getGroupId()));
        Instant now = clock.instant();

        if (!isCancelPermitted(alert, group, requesterId, now)) {
            throw new PermissionDeniedException(denialMessage(alert, group, requesterId, now));
        }

        String why = StringUtils.isNotBlank(reason) ? reason.trim()
                : requesterId.equals(alert.getUserId()) ? "Cancelled by user" : "Cancelled by group admin";
        if (!store.resolveAlert(alertId, now, why)) {
            log.info("[SOS] alert {} was already resolved", alertId);
            return store.findAlert(alertId).orElse(alert);
        }
        log.info("[SOS] alert {} cancelled by {}", alertId, requesterId);

        withdrawCheckAnswers(alert);
        statusService.refresh(alert.getGroupId());
        notifications.sosCancelled(alert, requesterId);
        return store.findAlert(alertId).orElse(alert);
    }

    /**
     * Self-cancel is always allowed. The admin override opens once the alert has been active
     * for the configured cooling-off period (24h by default).
     */
    public boolean isCancelPermitted(SosAlert alert, SafetyGroup group, String requesterId, Instant now) {
        if (requesterId == null) return false;
        if (requesterId.equals(alert.getUserId())) return true;
        if (!group.isAdmin(requesterId)) return false;
        Duration elapsed = Duration.between(alert.getTimestamp(), now);
        return elapsed.compareTo(props.getAdminCancelAfter()) >= 0;
    }

    /**
     * Resolves a user's active alerts raised before {@code checkTimestamp}; used when the user
     * answers Safe to a later check.
     *
     * @return number of alerts this call resolved
     */
    public int autoResolve(String userId, String groupId, Instant checkTimestamp) {
        Instant now = clock.instant();
        int resolved = 0;
        for (SosAlert alert : store.findAlertsByGroup(groupId)) {
            if (alert.isActive()
                    && Objects.equals(alert.getUserId(), userId)
                    && alert.getTimestamp() != null
                    && alert.getTimestamp().isBefore(checkTimestamp)
                    && store.resolveAlert(alert.getId(), now, SUPERSEDED_REASON)) {
                resolved++;
            }
        }
        if (resolved > 0) {
            log.info("[SOS] {} alert(s) of {} in group {} superseded by a Safe answer", resolved, userId, groupId);
            statusService.refresh(groupId);
        }
        return resolved;
    }

    public boolean hasActiveAlerts(String groupId) {
        return store.findAlertsByGroup(groupId).stream().anyMatch(SosAlert::isActive);
    }

    public List<SosAlert> findAlerts(String groupId, String requesterId, boolean activeOnly) {
        SafetyGroup group = store.findGroup(groupId)
                .orElseThrow(() -> new NotFoundException("Group", groupId));
        if (!group.isMember(requesterId)) {
            throw new PermissionDeniedException("User " + requesterId + " is not a member of group " + groupId);
        }
        return store.findAlertsByGroup(groupId).stream()
                .filter(a -> !activeOnly || a.isActive())
                .toList();
    }

    private void withdrawCheckAnswers(SosAlert alert) {
        List<SafetyCheck> pending = store.findChecksByGroup(alert.getGroupId()).stream()
                .filter(SafetyCheck::isPending)
                .filter(c -> alert.getOriginSafetyCheckId() == null || alert.getOriginSafetyCheckId().equals(c.getId()))
                .filter(c -> {
                    SafetyResponse answer = c.getResponses().get(alert.getUserId());
                    return answer != null && answer.status() == SafetyResponseStatus.SOS;
                })
                .toList();
        for (SafetyCheck check : pending) {
            store.removeResponse(check.getId(), alert.getUserId());
            log.info("[SOS] SOS answer of {} withdrawn from check {}", alert.getUserId(), check.getId());
            aggregator.settleAndEvaluate(check.getId(), alert.getGroupId());
        }
    }

    private String denialMessage(SosAlert alert, SafetyGroup group, String requesterId, Instant now) {
        if (group.isAdmin(requesterId)) {
            Duration left = props.getAdminCancelAfter().minus(Duration.between(alert.getTimestamp(), now));
            return "Admins can cancel SOS alerts after " + props.getAdminCancelAfter().toHours() + " hours. "
                    + Math.max(0, left.toHours()) + " hours remaining.";
        }
        return "You can only cancel your own SOS alerts.";
    }
}
