package com.incoresoft.sosync.domain.check.service;

import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.check.dto.SafetyCheckStatus;
import com.incoresoft.sosync.domain.check.dto.SafetyResponse;
import com.incoresoft.sosync.domain.check.dto.SafetyResponseStatus;
import com.incoresoft.sosync.domain.group.dto.GroupPatch;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.shared.dto.CooldownDecision;
import com.incoresoft.sosync.domain.shared.dto.LocationData;
import com.incoresoft.sosync.domain.shared.exception.NotFoundException;
import com.incoresoft.sosync.domain.shared.exception.PermissionDeniedException;
import com.incoresoft.sosync.domain.shared.exception.RateLimitedException;
import com.incoresoft.sosync.domain.shared.service.CooldownGuard;
import com.incoresoft.sosync.domain.sos.service.SosAlertCoordinator;
import com.incoresoft.sosync.notification.GroupNotifications;
import com.incoresoft.sosync.repository.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Safety check lifecycle: start a check, take answers, hand over to completion evaluation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SafetyCheckCoordinator {
    private final RecordStore store;
    private final CooldownGuard cooldownGuard;
    private final SosAlertCoordinator sosCoordinator;
    private final ResponseAggregator aggregator;
    private final GroupNotifications notifications;
    private final Clock clock;

    /**
     * Starts a check for the whole group. A group with an active SOS alert stays in Emergency.
     */
    public SafetyCheck initiate(String groupId, String initiatorId) {
        SafetyGroup group = memberGroup(groupId, initiatorId);
        CooldownDecision decision = cooldownGuard.canStartSafetyCheck(group);
        if (!decision.allowed()) {
            log.info("[CHECK] group {} rate limited, {} min left", groupId, decision.remainingMinutes());
            throw new RateLimitedException("Wait " + decision.remainingMinutes() + " more minutes.",
                    decision.remainingMinutes());
        }

        Instant now = clock.instant();
        SafetyCheck check = SafetyCheck.builder()
                .id(UUID.randomUUID().toString())
                .groupId(groupId)
                .initiatedBy(initiatorId)
                .createdAt(now)
                .status(SafetyCheckStatus.PENDING)
                .build();
        store.saveCheck(check);

        GroupStatus status = sosCoordinator.hasActiveAlerts(groupId)
                ? GroupStatus.EMERGENCY
                : GroupStatus.CHECKING_STATUS;
        store.updateGroup(groupId, GroupPatch.builder()
                .currentStatus(status)
                .lastSafetyCheckAt(now)
                .build());
        log.info("[CHECK] {} started by {} in group {}, group is {}", check.getId(), initiatorId, groupId, status);
        notifications.safetyCheckStarted(groupId, check.getId(), initiatorId);
        return check;
    }

    /**
     * Records a member's answer. An SOS answer escalates the group at once and raises a linked
     * alert; a Safe answer supersedes the member's older alerts. Either way the check is then
     * evaluated for completion.
     *
     * @param contextGroupId group the caller is working in, used when the check record lacks one
     */
    public SafetyCheck respond(String checkId, String userId, SafetyResponseStatus status,
                               LocationData location, String message, String contextGroupId) {
        if (status == null) throw new IllegalArgumentException("Response status is required");
        SafetyCheck check = store.findCheck(checkId)
                .orElseThrow(() -> new NotFoundException("Safety check", checkId));
        String groupId = aggregator.groupIdOf(check, contextGroupId);
        memberGroup(groupId, userId);

        Instant now = clock.instant();
        store.putResponse(checkId, new SafetyResponse(userId, status, now, location,
                StringUtils.trimToNull(message)));
        log.info("[CHECK] {} answered {} by {}", checkId, status, userId);

        switch (status) {
            case SOS -> {
                store.setGroupStatus(groupId, GroupStatus.EMERGENCY);
                sosCoordinator.createFromCheckResponse(groupId, userId, checkId, now, location, message);
            }
            case SAFE -> sosCoordinator.autoResolve(userId, groupId, check.getCreatedAt());
            default -> {
                // NoResponse counts towards completion only
            }
        }
        return aggregator.settleAndEvaluate(checkId, groupId);
    }

    public SafetyCheck getCheck(String checkId, String requesterId) {
        SafetyCheck check = store.findCheck(checkId)
                .orElseThrow(() -> new NotFoundException("Safety check", checkId));
        memberGroup(aggregator.groupIdOf(check, null), requesterId);
        return check;
    }

    /** Checks of a group, newest first. */
    public List<SafetyCheck> listChecks(String groupId, String requesterId) {
        memberGroup(groupId, requesterId);
        return store.findChecksByGroup(groupId);
    }

    private SafetyGroup memberGroup(String groupId, String userId) {
        SafetyGroup group = store.findGroup(groupId)
                .orElseThrow(() -> new NotFoundException("Group", groupId));
        if (!group.isMember(userId)) {
            throw new PermissionDeniedException("User " + userId + " is not a member of group " + groupId);
        }
        return group;
    }
}
