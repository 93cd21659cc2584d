package com.incoresoft.sosync.support;

import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.check.dto.SafetyCheckStatus;
import com.incoresoft.sosync.domain.check.dto.SafetyResponse;
import com.incoresoft.sosync.domain.group.dto.GroupPatch;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.shared.exception.NotFoundException;
import com.incoresoft.sosync.domain.sos.dto.SosAlert;
import com.incoresoft.sosync.repository.RecordChange;
import com.incoresoft.sosync.repository.RecordChangeBus;
import com.incoresoft.sosync.repository.RecordKind;
import com.incoresoft.sosync.repository.RecordStore;
import com.incoresoft.sosync.repository.Subscription;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * {@link RecordStore} kept in maps. Records are copied on the way in and out so that tests
 * see the same isolation a real store gives.
 */
public class InMemoryRecordStore implements RecordStore {
    private final Map<String, SafetyGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, SafetyCheck> checks = new ConcurrentHashMap<>();
    private final Map<String, SosAlert> alerts = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSos = new ConcurrentHashMap<>();
    private final RecordChangeBus bus;

    public InMemoryRecordStore() {
        this(new RecordChangeBus());
    }

    public InMemoryRecordStore(RecordChangeBus bus) {
        this.bus = bus;
    }

    // --- groups ---

    @Override
    public Optional<SafetyGroup> findGroup(String groupId) {
        return Optional.ofNullable(groups.get(groupId)).map(SafetyGroup::copy);
    }

    @Override
    public List<SafetyGroup> findGroupsByMember(String userId) {
        return groups.values().stream()
                .filter(g -> g.isMember(userId))
                .map(SafetyGroup::copy)
                .toList();
    }

    @Override
    public void saveGroup(SafetyGroup group) {
        groups.put(group.getId(), group.copy());
        publishGroup(group.getId());
    }

    @Override
    public void updateGroup(String groupId, GroupPatch patch) {
        if (groups.computeIfPresent(groupId, (id, g) -> {
            SafetyGroup next = g.copy();
            patch.applyTo(next);
            return next;
        }) == null) {
            throw new NotFoundException("Group", groupId);
        }
        publishGroup(groupId);
    }

    @Override
    public void setGroupStatus(String groupId, GroupStatus status) {
        if (groups.computeIfPresent(groupId, (id, g) -> g.toBuilder().currentStatus(status).build()) != null) {
            publishGroup(groupId);
        }
    }

    @Override
    public SafetyGroup transactGroup(String groupId, UnaryOperator<SafetyGroup> mutation) {
        SafetyGroup updated = groups.compute(groupId, (id, current) -> {
            if (current == null) throw new NotFoundException("Group", groupId);
            return mutation.apply(current.copy()).copy();
        });
        publishGroup(groupId);
        return updated.copy();
    }

    @Override
    public void deleteGroup(String groupId) {
        groups.remove(groupId);
        checks.values().removeIf(c -> groupId.equals(c.getGroupId()));
        alerts.values().removeIf(a -> groupId.equals(a.getGroupId()));
        lastSos.keySet().removeIf(k -> k.endsWith("|" + groupId));
        for (RecordKind kind : RecordKind.values()) {
            bus.publish(new RecordChange(kind, groupId, groupId, null));
        }
    }

    // --- safety checks ---

    @Override
    public void saveCheck(SafetyCheck check) {
        checks.put(check.getId(), check.copy());
        publishCheck(check.getId());
    }

    @Override
    public Optional<SafetyCheck> findCheck(String checkId) {
        return Optional.ofNullable(checks.get(checkId)).map(SafetyCheck::copy);
    }

    @Override
    public List<SafetyCheck> findChecksByGroup(String groupId) {
        return checks.values().stream()
                .filter(c -> Objects.equals(groupId, c.getGroupId()))
                .sorted(Comparator.comparing(SafetyCheck::getCreatedAt,
                        Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed())
                .map(SafetyCheck::copy)
                .toList();
    }

    @Override
    public void putResponse(String checkId, SafetyResponse response) {
        checks.computeIfPresent(checkId, (id, c) -> {
            SafetyCheck next = c.copy();
            next.getResponses().put(response.userId(), response);
            return next;
        });
        publishCheck(checkId);
    }

    @Override
    public void removeResponse(String checkId, String userId) {
        checks.computeIfPresent(checkId, (id, c) -> {
            SafetyCheck next = c.copy();
            next.getResponses().remove(userId);
            return next;
        });
        publishCheck(checkId);
    }

    @Override
    public boolean markCheckStatus(String checkId, SafetyCheckStatus status, Instant completedAt) {
        AtomicBoolean changed = new AtomicBoolean(false);
        checks.computeIfPresent(checkId, (id, c) -> {
            if (!c.isPending()) return c;
            changed.set(true);
            return c.toBuilder().status(status).completedAt(completedAt).build();
        });
        if (changed.get()) publishCheck(checkId);
        return changed.get();
    }

    // --- SOS alerts ---

    @Override
    public void saveAlert(SosAlert alert) {
        alerts.put(alert.getId(), alert.toBuilder().build());
        publishAlert(alert.getId());
    }

    @Override
    public Optional<SosAlert> findAlert(String alertId) {
        return Optional.ofNullable(alerts.get(alertId)).map(a -> a.toBuilder().build());
    }

    @Override
    public List<SosAlert> findAlertsByGroup(String groupId) {
        return alerts.values().stream()
                .filter(a -> Objects.equals(groupId, a.getGroupId()))
                .sorted(Comparator.comparing(SosAlert::getTimestamp).reversed())
                .map(a -> a.toBuilder().build())
                .toList();
    }

    @Override
    public boolean resolveAlert(String alertId, Instant resolvedAt, String reason) {
        AtomicBoolean resolved = new AtomicBoolean(false);
        alerts.computeIfPresent(alertId, (id, a) -> {
            if (!a.isActive()) return a;
            resolved.set(true);
            return a.toBuilder().active(false).resolvedAt(resolvedAt).resolvedReason(reason).build();
        });
        if (resolved.get()) publishAlert(alertId);
        return resolved.get();
    }

    // --- cooldowns ---

    @Override
    public Optional<Instant> findLastSosAt(String userId, String groupId) {
        return Optional.ofNullable(lastSos.get(userId + "|" + groupId));
    }

    @Override
    public void setLastSosAt(String userId, String groupId, Instant at) {
        lastSos.put(userId + "|" + groupId, at);
    }

    @Override
    public Subscription subscribe(RecordKind kind, String groupId, Consumer<RecordChange> listener) {
        return bus.subscribe(kind, groupId, listener);
    }

    // --- test helpers ---

    /** Puts a check exactly as given, bypassing the coordinators. */
    public void putRawCheck(SafetyCheck check) {
        checks.put(check.getId(), check.copy());
    }

    private void publishGroup(String groupId) {
        findGroup(groupId).ifPresent(g -> bus.publish(new RecordChange(RecordKind.GROUP, groupId, groupId, g)));
    }

    private void publishCheck(String checkId) {
        findCheck(checkId).ifPresent(c ->
                bus.publish(new RecordChange(RecordKind.SAFETY_CHECK, c.getGroupId(), c.getId(), c)));
    }

    private void publishAlert(String alertId) {
        findAlert(alertId).ifPresent(a ->
                bus.publish(new RecordChange(RecordKind.SOS_ALERT, a.getGroupId(), a.getId(), a)));
    }
}
