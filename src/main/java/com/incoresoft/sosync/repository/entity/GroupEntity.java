package com.incoresoft.sosync.repository.entity;

import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Data;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Row of the `safety_group` table. Only changed columns are written, so a membership
 * transaction does not overwrite a concurrent status write.
 */
@Entity
@Table(name = "safety_group")
@DynamicUpdate
@Data
public class GroupEntity {
    @Id
    @Column(name = "id", length = 64)
    private String id;
    @Column(name = "name", nullable = false)
    private String name;
    @Column(name = "admin_id", nullable = false)
    private String adminId;
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "group_member", joinColumns = @JoinColumn(name = "group_id"))
    @Column(name = "user_id")
    private Set<String> members = new LinkedHashSet<>();
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "group_pending_member", joinColumns = @JoinColumn(name = "group_id"))
    @Column(name = "user_id")
    private Set<String> pendingMembers = new LinkedHashSet<>();
    @Column(name = "safety_check_interval_minutes")
    private int safetyCheckIntervalMinutes;
    @Column(name = "sos_interval_minutes")
    private int sosIntervalMinutesPerUser;
    @Column(name = "last_safety_check_at")
    private Instant lastSafetyCheckAt;
    @Enumerated(EnumType.STRING)
    @Column(name = "current_status", length = 32)
    private GroupStatus currentStatus;
    @Column(name = "created_at")
    private Instant createdAt;
    /** Guards the compare-and-swap membership path only. */
    @Version
    @Column(name = "version")
    private Long version;
}
