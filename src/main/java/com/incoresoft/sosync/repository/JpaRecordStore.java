package com.incoresoft.sosync.repository;

import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.check.dto.SafetyCheckStatus;
import com.incoresoft.sosync.domain.check.dto.SafetyResponse;
import com.incoresoft.sosync.domain.group.dto.GroupPatch;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.shared.dto.LocationData;
import com.incoresoft.sosync.domain.shared.exception.NotFoundException;
import com.incoresoft.sosync.domain.sos.dto.SosAlert;
import com.incoresoft.sosync.repository.entity.GroupEntity;
import com.incoresoft.sosync.repository.entity.SafetyCheckEntity;
import com.incoresoft.sosync.repository.entity.SafetyResponseEntity;
import com.incoresoft.sosync.repository.entity.SafetyResponsePK;
import com.incoresoft.sosync.repository.entity.SosAlertEntity;
import com.incoresoft.sosync.repository.entity.SosCooldownEntity;
import com.incoresoft.sosync.repository.entity.SosCooldownPK;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * {@link RecordStore} on PostgreSQL through Spring Data JPA.
 * <p>
 * Each write is its own statement and commits on its own; subscribers are notified after
 * the commit with the record as it now reads.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaRecordStore implements RecordStore {
    private final GroupRepository groupRepository;
    private final SafetyCheckRepository checkRepository;
    private final SafetyResponseRepository responseRepository;
    private final SosAlertRepository alertRepository;
    private final SosCooldownRepository cooldownRepository;
    private final TransactionTemplate transactionTemplate;
    private final RecordChangeBus bus;

    // --- groups ---

    @Override
    public Optional<SafetyGroup> findGroup(String groupId) {
        return groupRepository.findById(groupId).map(JpaRecordStore::toGroup);
    }

    @Override
    public List<SafetyGroup> findGroupsByMember(String userId) {
        return groupRepository.findByMember(userId).stream()
                .map(JpaRecordStore::toGroup)
                .toList();
    }

    @Override
    public void saveGroup(SafetyGroup group) {
        GroupEntity entity = groupRepository.findById(group.getId()).orElseGet(GroupEntity::new);
        copyInto(group, entity);
        SafetyGroup saved = toGroup(groupRepository.save(entity));
        publishGroup(saved);
    }

    @Override
    public void updateGroup(String groupId, GroupPatch patch) {
        if (patch.isEmpty()) return;
        int rows = groupRepository.patch(groupId,
                patch.getName(),
                patch.getSafetyCheckIntervalMinutes(),
                patch.getSosIntervalMinutesPerUser(),
                patch.getLastSafetyCheckAt(),
                patch.getCurrentStatus());
        if (rows == 0) throw new NotFoundException("Group", groupId);
        findGroup(groupId).ifPresent(this::publishGroup);
    }

    @Override
    public void setGroupStatus(String groupId, GroupStatus status) {
        int rows = groupRepository.updateStatus(groupId, status);
        if (rows == 0) {
            log.warn("[STORE] status {} not written, group {} is gone", status, groupId);
            return;
        }
        findGroup(groupId).ifPresent(this::publishGroup);
    }

    @Override
    @Retryable(retryFor = ObjectOptimisticLockingFailureException.class, maxAttempts = 5,
            backoff = @Backoff(delay = 20, multiplier = 2))
    public SafetyGroup transactGroup(String groupId, UnaryOperator<SafetyGroup> mutation) {
        SafetyGroup updated = transactionTemplate.execute(status -> {
            GroupEntity entity = groupRepository.findById(groupId)
                    .orElseThrow(() -> new NotFoundException("Group", groupId));
            SafetyGroup next = mutation.apply(toGroup(entity));
            copyInto(next, entity);
            return toGroup(groupRepository.saveAndFlush(entity));
        });
        publishGroup(updated);
        return updated;
    }

    @Override
    public void deleteGroup(String groupId) {
        transactionTemplate.executeWithoutResult(status -> {
            List<String> checkIds = checkRepository.findByGroupIdOrderByCreatedAtDesc(groupId).stream()
                    .map(SafetyCheckEntity::getId)
                    .toList();
            if (!checkIds.isEmpty()) {
                responseRepository.deleteByCheckIds(checkIds);
            }
            int checks = checkRepository.deleteByGroupId(groupId);
            int alerts = alertRepository.deleteByGroupId(groupId);
            cooldownRepository.deleteByGroupId(groupId);
            groupRepository.deleteById(groupId);
            log.info("[STORE] group {} deleted with {} checks and {} alerts", groupId, checks, alerts);
        });
        // checks and alerts of the group are gone too
        for (RecordKind kind : RecordKind.values()) {
            bus.publish(new RecordChange(kind, groupId, groupId, null));
        }
    }

    // --- safety checks ---

    @Override
    public void saveCheck(SafetyCheck check) {
        SafetyCheckEntity entity = new SafetyCheckEntity();
        entity.setId(check.getId());
        entity.setGroupId(check.getGroupId());
        entity.setInitiatedBy(check.getInitiatedBy());
        entity.setCreatedAt(check.getCreatedAt());
        entity.setStatus(check.getStatus());
        entity.setCompletedAt(check.getCompletedAt());
        checkRepository.save(entity);
        if (!check.getResponses().isEmpty()) {
            responseRepository.saveAll(check.getResponses().values().stream()
                    .map(r -> toEntity(check.getId(), r))
                    .toList());
        }
        publishCheck(check.getId());
    }

    @Override
    public Optional<SafetyCheck> findCheck(String checkId) {
        return checkRepository.findById(checkId)
                .map(entity -> toCheck(entity, responseRepository.findByCheckId(checkId)));
    }

    @Override
    public List<SafetyCheck> findChecksByGroup(String groupId) {
        List<SafetyCheckEntity> checks = checkRepository.findByGroupIdOrderByCreatedAtDesc(groupId);
        if (checks.isEmpty()) return List.of();
        Map<String, List<SafetyResponseEntity>> byCheck = responseRepository
                .findByCheckIdIn(checks.stream().map(SafetyCheckEntity::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(SafetyResponseEntity::getCheckId));
        return checks.stream()
                .map(c -> toCheck(c, byCheck.getOrDefault(c.getId(), List.of())))
                .toList();
    }

    @Override
    public void putResponse(String checkId, SafetyResponse response) {
        responseRepository.save(toEntity(checkId, response));
        publishCheck(checkId);
    }

    @Override
    public void removeResponse(String checkId, String userId) {
        responseRepository.deleteById(new SafetyResponsePK(checkId, userId));
        publishCheck(checkId);
    }

    @Override
    public boolean markCheckStatus(String checkId, SafetyCheckStatus status, Instant completedAt) {
        boolean changed = checkRepository.updateStatusIfPending(checkId, status, completedAt) > 0;
        if (changed) publishCheck(checkId);
        return changed;
    }

    // --- SOS alerts ---

    @Override
    public void saveAlert(SosAlert alert) {
        alertRepository.save(toEntity(alert));
        bus.publish(new RecordChange(RecordKind.SOS_ALERT, alert.getGroupId(), alert.getId(), alert));
    }

    @Override
    public Optional<SosAlert> findAlert(String alertId) {
        return alertRepository.findById(alertId).map(JpaRecordStore::toAlert);
    }

    @Override
    public List<SosAlert> findAlertsByGroup(String groupId) {
        return alertRepository.findByGroupIdOrderByTimestampDesc(groupId).stream()
                .map(JpaRecordStore::toAlert)
                .toList();
    }

    @Override
    public boolean resolveAlert(String alertId, Instant resolvedAt, String reason) {
        boolean resolved = alertRepository.resolveIfActive(alertId, resolvedAt, reason) > 0;
        if (resolved) {
            findAlert(alertId).ifPresent(a ->
                    bus.publish(new RecordChange(RecordKind.SOS_ALERT, a.getGroupId(), a.getId(), a)));
        }
        return resolved;
    }

    // --- cooldowns ---

    @Override
    public Optional<Instant> findLastSosAt(String userId, String groupId) {
        return cooldownRepository.findById(new SosCooldownPK(userId, groupId))
                .map(SosCooldownEntity::getLastSosAt);
    }

    @Override
    public void setLastSosAt(String userId, String groupId, Instant at) {
        cooldownRepository.save(new SosCooldownEntity(userId, groupId, at));
    }

    @Override
    public Subscription subscribe(RecordKind kind, String groupId, Consumer<RecordChange> listener) {
        return bus.subscribe(kind, groupId, listener);
    }

    // --- push helpers ---

    private void publishGroup(SafetyGroup group) {
        bus.publish(new RecordChange(RecordKind.GROUP, group.getId(), group.getId(), group));
    }

    private void publishCheck(String checkId) {
        findCheck(checkId).ifPresent(c ->
                bus.publish(new RecordChange(RecordKind.SAFETY_CHECK, c.getGroupId(), c.getId(), c)));
    }

    // --- mapping ---

    static SafetyGroup toGroup(GroupEntity e) {
        return SafetyGroup.builder()
                .id(e.getId())
                .name(e.getName())
                .adminId(e.getAdminId())
                .members(new LinkedHashSet<>(e.getMembers()))
                .pendingMembers(new LinkedHashSet<>(e.getPendingMembers()))
                .safetyCheckIntervalMinutes(e.getSafetyCheckIntervalMinutes())
                .sosIntervalMinutesPerUser(e.getSosIntervalMinutesPerUser())
                .lastSafetyCheckAt(e.getLastSafetyCheckAt())
                .currentStatus(e.getCurrentStatus() == null ? GroupStatus.NORMAL : e.getCurrentStatus())
                .createdAt(e.getCreatedAt())
                .build();
    }

    private static void copyInto(SafetyGroup g, GroupEntity e) {
        e.setId(g.getId());
        e.setName(g.getName());
        e.setAdminId(g.getAdminId());
        // mutate the managed collections so Hibernate only rewrites what changed
        e.getMembers().retainAll(g.getMembers());
        e.getMembers().addAll(g.getMembers());
        e.getPendingMembers().retainAll(g.getPendingMembers());
        e.getPendingMembers().addAll(g.getPendingMembers());
        e.setSafetyCheckIntervalMinutes(g.getSafetyCheckIntervalMinutes());
        e.setSosIntervalMinutesPerUser(g.getSosIntervalMinutesPerUser());
        e.setLastSafetyCheckAt(g.getLastSafetyCheckAt());
        e.setCurrentStatus(g.getCurrentStatus());
        e.setCreatedAt(g.getCreatedAt());
    }

    static SafetyCheck toCheck(SafetyCheckEntity e, List<SafetyResponseEntity> responses) {
        Map<String, SafetyResponse> byUser = new LinkedHashMap<>();
        responses.stream()
                .sorted(Comparator.comparing(SafetyResponseEntity::getTimestamp,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .forEach(r -> byUser.put(r.getUserId(), toResponse(r)));
        return SafetyCheck.builder()
                .id(e.getId())
                .groupId(e.getGroupId())
                .initiatedBy(e.getInitiatedBy())
                .createdAt(e.getCreatedAt())
                .status(e.getStatus() == null ? SafetyCheckStatus.PENDING : e.getStatus())
                .responses(byUser)
                .completedAt(e.getCompletedAt())
                .build();
    }

    private static SafetyResponse toResponse(SafetyResponseEntity e) {
        LocationData location = (e.getLatitude() == null || e.getLongitude() == null)
                ? null
                : new LocationData(e.getLatitude(), e.getLongitude(), e.getAddress());
        return new SafetyResponse(e.getUserId(), e.getStatus(), e.getTimestamp(), location, e.getMessage());
    }

    private static SafetyResponseEntity toEntity(String checkId, SafetyResponse r) {
        SafetyResponseEntity e = new SafetyResponseEntity();
        e.setCheckId(checkId);
        e.setUserId(r.userId());
        e.setStatus(r.status());
        e.setTimestamp(r.timestamp());
        if (r.location() != null) {
            e.setLatitude(r.location().latitude());
            e.setLongitude(r.location().longitude());
            e.setAddress(r.location().address());
        }
        e.setMessage(r.message());
        return e;
    }

    static SosAlert toAlert(SosAlertEntity e) {
        return SosAlert.builder()
                .id(e.getId())
                .userId(e.getUserId())
                .groupId(e.getGroupId())
                .timestamp(e.getTimestamp())
                .location(new LocationData(e.getLatitude(), e.getLongitude(), e.getAddress()))
                .message(e.getMessage())
                .active(e.isActive())
                .resolvedAt(e.getResolvedAt())
                .resolvedReason(e.getResolvedReason())
                .originSafetyCheckId(e.getOriginSafetyCheckId())
                .build();
    }

    private static SosAlertEntity toEntity(SosAlert a) {
        SosAlertEntity e = new SosAlertEntity();
        e.setId(a.getId());
        e.setUserId(a.getUserId());
        e.setGroupId(a.getGroupId());
        e.setTimestamp(a.getTimestamp());
        LocationData location = a.getLocation();
        if (location != null) {
            e.setLatitude(location.latitude());
            e.setLongitude(location.longitude());
            e.setAddress(location.address());
        }
        e.setMessage(a.getMessage());
        e.setActive(a.isActive());
        e.setResolvedAt(a.getResolvedAt());
        e.setResolvedReason(a.getResolvedReason());
        e.setOriginSafetyCheckId(a.getOriginSafetyCheckId());
        return e;
    }
}
