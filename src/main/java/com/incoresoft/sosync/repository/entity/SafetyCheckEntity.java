package com.incoresoft.sosync.repository.entity;

import com.incoresoft.sosync.domain.check.dto.SafetyCheckStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "safety_check", indexes = @Index(name = "idx_safety_check_group", columnList = "group_id"))
@Data
public class SafetyCheckEntity {
    @Id
    @Column(name = "id", length = 64)
    private String id;
    @Column(name = "group_id")
    private String groupId;
    @Column(name = "initiated_by")
    private String initiatedBy;
    @Column(name = "created_at")
    private Instant createdAt;
    /** Null on rows written before the status column existed; reads as pending. */
    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32)
    private SafetyCheckStatus status;
    @Column(name = "completed_at")
    private Instant completedAt;
}
