package com.incoresoft.sosync.domain.sos.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.incoresoft.sosync.domain.shared.dto.LocationData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A standing emergency beacon for one user in one group. Active until resolved;
 * resolution happens once, later attempts leave it as it is.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SosAlert {
    private String id;
    private String userId;
    private String groupId;
    private Instant timestamp;
    private LocationData location;
    private String message;
    @JsonProperty("isActive")
    @Builder.Default
    private boolean active = true;
    private Instant resolvedAt;
    private String resolvedReason;
    /** Set when the alert was raised by an SOS answer to a safety check. */
    private String originSafetyCheckId;
}
