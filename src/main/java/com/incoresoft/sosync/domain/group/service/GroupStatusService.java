package com.incoresoft.sosync.domain.group.service;

import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.shared.exception.NotFoundException;
import com.incoresoft.sosync.domain.sos.dto.SosAlert;
import com.incoresoft.sosync.repository.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Re-derives a group's status from what the store holds right now and writes it.
 * Called after every mutation; the write is unconditional.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupStatusService {
    private final RecordStore store;
    private final GroupStatusResolver resolver;
    private final Clock clock;

    public GroupStatus refresh(String groupId) {
        SafetyGroup group = store.findGroup(groupId)
                .orElseThrow(() -> new NotFoundException("Group", groupId));
        List<SosAlert> alerts = store.findAlertsByGroup(groupId);
        List<SafetyCheck> checks = store.findChecksByGroup(groupId);
        GroupStatus status = resolver.resolve(group, alerts, checks, clock.instant());
        store.setGroupStatus(groupId, status);
        if (status != group.getCurrentStatus()) {
            log.info("[STATUS] group {} {} -> {}", groupId, group.getCurrentStatus(), status);
        }
        return status;
    }
}
