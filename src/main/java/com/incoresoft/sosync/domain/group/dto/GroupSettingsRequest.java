package com.incoresoft.sosync.domain.group.dto;

/**
 * Admin edit of group settings; any field may be left out.
 */
public record GroupSettingsRequest(String name,
                                   Integer safetyCheckIntervalMinutes,
                                   Integer sosIntervalMinutesPerUser) {
}
