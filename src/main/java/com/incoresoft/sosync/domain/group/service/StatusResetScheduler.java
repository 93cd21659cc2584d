package com.incoresoft.sosync.domain.group.service;

import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.repository.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Fire-once delayed reset of AllSafe back to Normal.
 * <p>
 * There is no explicit cancellation: when the task fires it re-reads the group and only
 * writes Normal if the status is still AllSafe. Anything that moved the group elsewhere in
 * the meantime (a new check, an SOS) wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatusResetScheduler {
    private final RecordStore store;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public ScheduledFuture<?> schedule(String groupId, Duration delay) {
        log.info("[RESET] group {} returns to normal in {} min if still all safe", groupId, delay.toMinutes());
        return taskScheduler.schedule(() -> resetIfStillAllSafe(groupId), clock.instant().plus(delay));
    }

    /**
     * @return true when the group was moved from AllSafe to Normal
     */
    boolean resetIfStillAllSafe(String groupId) {
        Optional<SafetyGroup> group = store.findGroup(groupId);
        if (group.isEmpty()) {
            log.info("[RESET] group {} no longer exists", groupId);
            return false;
        }
        GroupStatus current = group.get().getCurrentStatus();
        if (current != GroupStatus.ALL_SAFE) {
            log.info("[RESET] group {} is {} now, reset skipped", groupId, current);
            return false;
        }
        store.setGroupStatus(groupId, GroupStatus.NORMAL);
        log.info("[RESET] group {} reset to normal", groupId);
        return true;
    }
}
