package com.incoresoft.sosync.domain.group.service;

import com.incoresoft.sosync.config.SafetyProps;
import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.check.service.ResponseAggregator;
import com.incoresoft.sosync.domain.group.dto.GroupPatch;
import com.incoresoft.sosync.domain.group.dto.GroupSettingsRequest;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.shared.exception.NotFoundException;
import com.incoresoft.sosync.domain.shared.exception.PermissionDeniedException;
import com.incoresoft.sosync.repository.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Group membership and settings. Membership changes go through the store's compare-and-swap
 * transaction so that concurrent joins and removals never lose each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupService {
    public static final int MIN_CHECK_INTERVAL = 1;
    public static final int MAX_CHECK_INTERVAL = 1440;
    public static final int MIN_SOS_INTERVAL = 1;
    public static final int MAX_SOS_INTERVAL = 60;

    private final RecordStore store;
    private final ResponseAggregator aggregator;
    private final SafetyProps props;
    private final Clock clock;

    public SafetyGroup createGroup(String creatorId, String name) {
        if (StringUtils.isBlank(creatorId)) throw new IllegalArgumentException("Creator is required");
        if (StringUtils.isBlank(name)) throw new IllegalArgumentException("Group name must not be blank");

        Set<String> members = new LinkedHashSet<>();
        members.add(creatorId);
        SafetyGroup group = SafetyGroup.builder()
                .id(UUID.randomUUID().toString())
                .name(name.trim())
                .adminId(creatorId)
                .members(members)
                .safetyCheckIntervalMinutes(props.getDefaultSafetyCheckIntervalMinutes())
                .sosIntervalMinutesPerUser(props.getDefaultSosIntervalMinutes())
                .currentStatus(GroupStatus.NORMAL)
                .createdAt(clock.instant())
                .build();
        store.saveGroup(group);
        log.info("[GROUP] {} '{}' created by {}", group.getId(), group.getName(), creatorId);
        return group;
    }

    public SafetyGroup getGroup(String groupId, String requesterId) {
        SafetyGroup group = findGroup(groupId);
        requireMember(group, requesterId);
        return group;
    }

    /** Groups of a user, the most urgent first. */
    public List<SafetyGroup> listGroupsForUser(String userId) {
        return store.findGroupsByMember(userId).stream()
                .sorted(Comparator.comparingInt((SafetyGroup g) -> g.getCurrentStatus().getPriority()).reversed()
                        .thenComparing(SafetyGroup::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public SafetyGroup updateSettings(String groupId, String requesterId, GroupSettingsRequest request) {
        SafetyGroup group = findGroup(groupId);
        requireAdmin(group, requesterId, "Only the group admin can change settings");

        if (request.name() != null && StringUtils.isBlank(request.name())) {
            throw new IllegalArgumentException("Group name must not be blank");
        }
        checkRange("Safety check interval", request.safetyCheckIntervalMinutes(),
                MIN_CHECK_INTERVAL, MAX_CHECK_INTERVAL);
        checkRange("SOS interval", request.sosIntervalMinutesPerUser(), MIN_SOS_INTERVAL, MAX_SOS_INTERVAL);

        GroupPatch patch = GroupPatch.builder()
                .name(StringUtils.trimToNull(request.name()))
                .safetyCheckIntervalMinutes(request.safetyCheckIntervalMinutes())
                .sosIntervalMinutesPerUser(request.sosIntervalMinutesPerUser())
                .build();
        store.updateGroup(groupId, patch);
        log.info("[GROUP] {} settings changed by {}: {}", groupId, requesterId, patch);
        return findGroup(groupId);
    }

    public SafetyGroup invite(String groupId, String requesterId, String inviteeId) {
        if (StringUtils.isBlank(inviteeId)) throw new IllegalArgumentException("Invitee is required");
        SafetyGroup updated = store.transactGroup(groupId, group -> {
            requireAdmin(group, requesterId, "Only the group admin can invite members");
            if (group.isMember(inviteeId)) {
                throw new IllegalArgumentException("User " + inviteeId + " is already a member");
            }
            group.getPendingMembers().add(inviteeId);
            return group;
        });
        log.info("[GROUP] {} invited to {} by {}", inviteeId, groupId, requesterId);
        return updated;
    }

    public SafetyGroup acceptInvitation(String groupId, String userId) {
        SafetyGroup updated = store.transactGroup(groupId, group -> {
            requireInvited(group, userId);
            group.getPendingMembers().remove(userId);
            group.getMembers().add(userId);
            return group;
        });
        log.info("[GROUP] {} joined {}", userId, groupId);
        return updated;
    }

    public void declineInvitation(String groupId, String userId) {
        store.transactGroup(groupId, group -> {
            requireInvited(group, userId);
            group.getPendingMembers().remove(userId);
            return group;
        });
        log.info("[GROUP] {} declined the invitation to {}", userId, groupId);
    }

    public SafetyGroup removeMember(String groupId, String requesterId, String memberId) {
        SafetyGroup updated = store.transactGroup(groupId, group -> {
            requireAdmin(group, requesterId, "Only the group admin can remove members");
            if (group.isAdmin(memberId)) {
                throw new IllegalArgumentException("The group admin cannot be removed");
            }
            if (!group.getMembers().remove(memberId)) {
                throw new NotFoundException("Member", memberId);
            }
            return group;
        });
        log.info("[GROUP] {} removed from {} by {}", memberId, groupId, requesterId);
        reevaluatePendingChecks(groupId);
        return updated;
    }

    /**
     * The admin can only leave a group they are alone in, and leaving deletes it.
     */
    public void leaveGroup(String groupId, String userId) {
        SafetyGroup group = findGroup(groupId);
        requireMember(group, userId);
        if (group.isAdmin(userId)) {
            if (group.getMembers().size() > 1) {
                throw new PermissionDeniedException("The group admin cannot leave while other members remain");
            }
            store.deleteGroup(groupId);
            log.info("[GROUP] {} left by its last member {}, deleted", groupId, userId);
            return;
        }
        store.transactGroup(groupId, g -> {
            g.getMembers().remove(userId);
            return g;
        });
        log.info("[GROUP] {} left {}", userId, groupId);
        reevaluatePendingChecks(groupId);
    }

    public void deleteGroup(String groupId, String requesterId) {
        SafetyGroup group = findGroup(groupId);
        requireAdmin(group, requesterId, "Only the group admin can delete the group");
        store.deleteGroup(groupId);
        log.info("[GROUP] {} deleted by {}", groupId, requesterId);
    }

    /**
     * Completeness is judged against current membership, so a removal may complete a check
     * that was waiting for the removed member.
     */
    private void reevaluatePendingChecks(String groupId) {
        List<String> pending = store.findChecksByGroup(groupId).stream()
                .filter(SafetyCheck::isPending)
                .map(SafetyCheck::getId)
                .toList();
        for (String checkId : pending) {
            aggregator.evaluate(checkId, groupId);
        }
    }

    private SafetyGroup findGroup(String groupId) {
        return store.findGroup(groupId).orElseThrow(() -> new NotFoundException("Group", groupId));
    }

    private static void requireMember(SafetyGroup group, String userId) {
        if (!group.isMember(userId)) {
            throw new PermissionDeniedException("User " + userId + " is not a member of group " + group.getId());
        }
    }

    private static void requireAdmin(SafetyGroup group, String userId, String message) {
        if (!group.isAdmin(userId)) throw new PermissionDeniedException(message);
    }

    private static void requireInvited(SafetyGroup group, String userId) {
        if (!group.getPendingMembers().contains(userId)) {
            throw new NotFoundException("Invitation for user", userId);
        }
    }

    private static void checkRange(String what, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            throw new IllegalArgumentException(what + " must be between " + min + " and " + max + " minutes");
        }
    }
}
