package com.incoresoft.sosync.repository.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "sos_alert", indexes = @Index(name = "idx_sos_alert_group", columnList = "group_id"))
@Data
public class SosAlertEntity {
    @Id
    @Column(name = "id", length = 64)
    private String id;
    @Column(name = "user_id")
    private String userId;
    @Column(name = "group_id")
    private String groupId;
    @Column(name = "created_at")
    private Instant timestamp;
    @Column(name = "latitude")
    private double latitude;
    @Column(name = "longitude")
    private double longitude;
    @Column(name = "address")
    private String address;
    @Column(name = "message", length = 1000)
    private String message;
    @Column(name = "active")
    private boolean active;
    @Column(name = "resolved_at")
    private Instant resolvedAt;
    @Column(name = "resolved_reason")
    private String resolvedReason;
    @Column(name = "origin_safety_check_id", length = 64)
    private String originSafetyCheckId;
}
