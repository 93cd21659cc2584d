package com.incoresoft.sosync.support;

import com.incoresoft.sosync.config.SafetyProps;
import com.incoresoft.sosync.domain.check.service.ResponseAggregator;
import com.incoresoft.sosync.domain.check.service.SafetyCheckCoordinator;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.group.service.GroupService;
import com.incoresoft.sosync.domain.group.service.GroupStatusResolver;
import com.incoresoft.sosync.domain.group.service.GroupStatusService;
import com.incoresoft.sosync.domain.group.service.StatusResetScheduler;
import com.incoresoft.sosync.domain.shared.service.CooldownGuard;
import com.incoresoft.sosync.domain.sos.service.SosAlertCoordinator;
import com.incoresoft.sosync.notification.GroupNotifications;
import com.incoresoft.sosync.notification.NotificationDispatcher;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;

import static org.mockito.Mockito.mock;

/**
 * All coordinators wired against an in-memory store, a settable clock, a mocked scheduler and
 * a mocked notification transport. No settle delay.
 */
public class CoordinationFixture {
    public final MutableClock clock = MutableClock.at("2025-03-01T10:00:00Z");
    public final InMemoryRecordStore store = new InMemoryRecordStore();
    public final SafetyProps props = new SafetyProps();
    public final TaskScheduler taskScheduler = mock(TaskScheduler.class);
    public final NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);

    public final GroupStatusService statusService;
    public final StatusResetScheduler resetScheduler;
    public final ResponseAggregator aggregator;
    public final CooldownGuard cooldownGuard;
    public final SosAlertCoordinator sos;
    public final SafetyCheckCoordinator checks;
    public final GroupService groups;

    public CoordinationFixture() {
        props.setSettleDelay(Duration.ZERO);
        RetryTemplate retry = RetryTemplate.builder()
                .maxAttempts(3)
                .noBackoff()
                .retryOn(DataAccessException.class)
                .build();
        GroupNotifications notifications = new GroupNotifications(dispatcher);

        statusService = new GroupStatusService(store, new GroupStatusResolver(props), clock);
        resetScheduler = new StatusResetScheduler(store, taskScheduler, clock);
        aggregator = new ResponseAggregator(store, statusService, resetScheduler, notifications, props, clock, retry);
        cooldownGuard = new CooldownGuard(store, clock);
        sos = new SosAlertCoordinator(store, cooldownGuard, aggregator, statusService, notifications, props, clock);
        checks = new SafetyCheckCoordinator(store, cooldownGuard, sos, aggregator, notifications, clock);
        groups = new GroupService(store, aggregator, props, clock);
    }

    /** Stores a group administered by the first member, never checked, status Normal. */
    public SafetyGroup group(String groupId, String... members) {
        SafetyGroup group = SafetyGroup.builder()
                .id(groupId)
                .name("Group " + groupId)
                .adminId(members[0])
                .members(new LinkedHashSet<>(Arrays.asList(members)))
                .safetyCheckIntervalMinutes(30)
                .sosIntervalMinutesPerUser(5)
                .currentStatus(GroupStatus.NORMAL)
                .createdAt(clock.instant())
                .build();
        store.saveGroup(group);
        return group;
    }

    public GroupStatus statusOf(String groupId) {
        return store.findGroup(groupId).orElseThrow().getCurrentStatus();
    }

    public Instant now() {
        return clock.instant();
    }
}
