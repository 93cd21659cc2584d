package com.incoresoft.sosync.repository.entity;

import com.incoresoft.sosync.domain.check.dto.SafetyResponseStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "safety_response")
@IdClass(SafetyResponsePK.class)
@Data
public class SafetyResponseEntity {
    @Id
    @Column(name = "check_id", length = 64)
    private String checkId;
    @Id
    @Column(name = "user_id")
    private String userId;
    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32)
    private SafetyResponseStatus status;
    @Column(name = "responded_at")
    private Instant timestamp;
    /** Location columns are all null when the member sent none. */
    @Column(name = "latitude")
    private Double latitude;
    @Column(name = "longitude")
    private Double longitude;
    @Column(name = "address")
    private String address;
    @Column(name = "message", length = 1000)
    private String message;
}
