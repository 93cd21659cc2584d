package com.incoresoft.sosync.repository.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Last direct SOS a user sent in a group.
 */
@Entity
@Table(name = "sos_cooldown")
@IdClass(SosCooldownPK.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SosCooldownEntity {
    @Id
    @Column(name = "user_id")
    private String userId;
    @Id
    @Column(name = "group_id", length = 64)
    private String groupId;
    @Column(name = "last_sos_at")
    private Instant lastSosAt;
}
