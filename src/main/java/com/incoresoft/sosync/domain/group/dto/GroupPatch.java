package com.incoresoft.sosync.domain.group.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Partial multi-field update of a group. Null fields are left untouched.
 */
@Value
@Builder
public class GroupPatch {
    String name;
    Integer safetyCheckIntervalMinutes;
    Integer sosIntervalMinutesPerUser;
    Instant lastSafetyCheckAt;
    GroupStatus currentStatus;

    public boolean isEmpty() {
        return name == null && safetyCheckIntervalMinutes == null && sosIntervalMinutesPerUser == null
                && lastSafetyCheckAt == null && currentStatus == null;
    }

    /** Applies the non-null fields to {@code group} in place. */
    public void applyTo(SafetyGroup group) {
        if (name != null) group.setName(name);
        if (safetyCheckIntervalMinutes != null) group.setSafetyCheckIntervalMinutes(safetyCheckIntervalMinutes);
        if (sosIntervalMinutesPerUser != null) group.setSosIntervalMinutesPerUser(sosIntervalMinutesPerUser);
        if (lastSafetyCheckAt != null) group.setLastSafetyCheckAt(lastSafetyCheckAt);
        if (currentStatus != null) group.setCurrentStatus(currentStatus);
    }
}
