package com.incoresoft.sosync.domain.check.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A poll asking every member of a group to confirm they are safe.
 * A freshly created record may lack responses and status; they read back as
 * an empty map and {@link SafetyCheckStatus#PENDING}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SafetyCheck {
    private String id;
    private String groupId;
    private String initiatedBy;
    private Instant createdAt;
    @Builder.Default
    private SafetyCheckStatus status = SafetyCheckStatus.PENDING;
    /** userId -> response */
    @Builder.Default
    private Map<String, SafetyResponse> responses = new LinkedHashMap<>();
    /** Set together with the terminal status. */
    private Instant completedAt;

    public void setStatus(SafetyCheckStatus status) {
        this.status = status == null ? SafetyCheckStatus.PENDING : status;
    }

    public void setResponses(Map<String, SafetyResponse> responses) {
        this.responses = responses == null ? new LinkedHashMap<>() : responses;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == SafetyCheckStatus.PENDING;
    }

    @JsonIgnore
    public boolean hasSosResponse() {
        return responses.values().stream().anyMatch(r -> r.status() == SafetyResponseStatus.SOS);
    }

    public SafetyCheck copy() {
        return toBuilder().responses(new LinkedHashMap<>(responses)).build();
    }
}
