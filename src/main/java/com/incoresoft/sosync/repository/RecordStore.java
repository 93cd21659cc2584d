package com.incoresoft.sosync.repository;

import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.check.dto.SafetyCheckStatus;
import com.incoresoft.sosync.domain.check.dto.SafetyResponse;
import com.incoresoft.sosync.domain.group.dto.GroupPatch;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.sos.dto.SosAlert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Shared record store used by every coordinator.
 * <p>
 * Writes are atomic per record field and last-write-wins; there are no transactions across
 * records. The single exception is {@link #transactGroup}, a compare-and-swap over one group
 * used for membership changes. Every write is pushed to subscribers of the record's group.
 */
public interface RecordStore {

    // --- groups ---

    Optional<SafetyGroup> findGroup(String groupId);

    List<SafetyGroup> findGroupsByMember(String userId);

    void saveGroup(SafetyGroup group);

    /** Writes the non-null fields of {@code patch} in one update. */
    void updateGroup(String groupId, GroupPatch patch);

    void setGroupStatus(String groupId, GroupStatus status);

    /**
     * Reads the group, applies {@code mutation} and writes it back only if nobody changed the
     * group in between; otherwise the whole cycle is repeated.
     */
    SafetyGroup transactGroup(String groupId, UnaryOperator<SafetyGroup> mutation);

    /** Deletes the group with all its checks, responses, alerts and cooldowns. */
    void deleteGroup(String groupId);

    // --- safety checks ---

    void saveCheck(SafetyCheck check);

    Optional<SafetyCheck> findCheck(String checkId);

    /** Checks of a group, newest first. */
    List<SafetyCheck> findChecksByGroup(String groupId);

    void putResponse(String checkId, SafetyResponse response);

    void removeResponse(String checkId, String userId);

    /**
     * Sets the status of a check that is still pending. A check that already holds a terminal
     * status is left alone.
     *
     * @return true when the stored status was changed or re-asserted
     */
    boolean markCheckStatus(String checkId, SafetyCheckStatus status, Instant completedAt);

    // --- SOS alerts ---

    void saveAlert(SosAlert alert);

    Optional<SosAlert> findAlert(String alertId);

    /** Alerts of a group, newest first. */
    List<SosAlert> findAlertsByGroup(String groupId);

    /**
     * Deactivates an active alert. An alert that is already inactive keeps its first
     * resolvedAt and resolvedReason.
     *
     * @return true when this call resolved the alert
     */
    boolean resolveAlert(String alertId, Instant resolvedAt, String reason);

    // --- per (user, group) SOS cooldown ---

    Optional<Instant> findLastSosAt(String userId, String groupId);

    void setLastSosAt(String userId, String groupId, Instant at);

    // --- push ---

    Subscription subscribe(RecordKind kind, String groupId, Consumer<RecordChange> listener);
}
