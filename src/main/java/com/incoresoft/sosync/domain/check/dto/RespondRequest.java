package com.incoresoft.sosync.domain.check.dto;

import com.incoresoft.sosync.domain.shared.dto.LocationData;
import jakarta.validation.constraints.NotNull;

/**
 * @param groupId group the caller is looking at; used only when the check record lacks its own groupId
 */
public record RespondRequest(@NotNull SafetyResponseStatus status,
                             LocationData location,
                             String message,
                             String groupId) {
}
