package com.incoresoft.sosync.domain.check.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.incoresoft.sosync.domain.shared.dto.LocationData;

import java.time.Instant;

/**
 * One member's answer to a safety check. Written once per (check, user); a repeated
 * answer simply overwrites the previous one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SafetyResponse(String userId,
                             SafetyResponseStatus status,
                             Instant timestamp,
                             LocationData location,
                             String message) {
}
