package com.incoresoft.sosync.repository.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of a response: one row per (check, user).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SafetyResponsePK implements Serializable {
    private String checkId;
    private String userId;
}
