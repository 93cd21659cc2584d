package com.incoresoft.sosync.domain.group.dto;

import jakarta.validation.constraints.NotBlank;

public record InviteRequest(@NotBlank String userId) {
}
