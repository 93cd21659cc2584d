package com.incoresoft.sosync.domain.group.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Derived status of a group. The priority doubles as precedence when several
 * conditions hold at once and as the sort order for group lists.
 */
@Getter
@RequiredArgsConstructor
public enum GroupStatus {
    NORMAL("normal", "Normal", 1),
    ALL_SAFE("allSafe", "All Safe", 2),
    CHECKING_STATUS("checkingStatus", "Checking Status", 3),
    EMERGENCY("emergency", "Emergency", 4);

    private final String value;
    private final String displayName;
    private final int priority;

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static GroupStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown group status: " + value));
    }
}
