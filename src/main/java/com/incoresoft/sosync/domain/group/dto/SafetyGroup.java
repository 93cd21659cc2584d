package com.incoresoft.sosync.domain.group.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A group of people watching out for each other. The admin is always a member;
 * members and pending members never overlap.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SafetyGroup {
    private String id;
    private String name;
    private String adminId;
    @Builder.Default
    private Set<String> members = new LinkedHashSet<>();
    /** Invited, not joined yet. */
    @Builder.Default
    private Set<String> pendingMembers = new LinkedHashSet<>();
    private int safetyCheckIntervalMinutes;
    private int sosIntervalMinutesPerUser;
    private Instant lastSafetyCheckAt;
    @Builder.Default
    private GroupStatus currentStatus = GroupStatus.NORMAL;
    private Instant createdAt;

    public void setMembers(Set<String> members) {
        this.members = members == null ? new LinkedHashSet<>() : members;
    }

    public void setPendingMembers(Set<String> pendingMembers) {
        this.pendingMembers = pendingMembers == null ? new LinkedHashSet<>() : pendingMembers;
    }

    public void setCurrentStatus(GroupStatus currentStatus) {
        this.currentStatus = currentStatus == null ? GroupStatus.NORMAL : currentStatus;
    }

    @JsonIgnore
    public boolean isMember(String userId) {
        return userId != null && members.contains(userId);
    }

    @JsonIgnore
    public boolean isAdmin(String userId) {
        return userId != null && userId.equals(adminId);
    }

    /** Copy with its own member sets, safe to mutate. */
    public SafetyGroup copy() {
        return toBuilder()
                .members(new LinkedHashSet<>(members))
                .pendingMembers(new LinkedHashSet<>(pendingMembers))
                .build();
    }
}
