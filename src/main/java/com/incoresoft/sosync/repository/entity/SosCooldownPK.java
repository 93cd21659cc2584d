package com.incoresoft.sosync.repository.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SosCooldownPK implements Serializable {
    private String userId;
    private String groupId;
}
