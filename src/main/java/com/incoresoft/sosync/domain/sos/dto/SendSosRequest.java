package com.incoresoft.sosync.domain.sos.dto;

import com.incoresoft.sosync.domain.shared.dto.LocationData;
import jakarta.validation.constraints.NotNull;

public record SendSosRequest(@NotNull LocationData location, String message) {
}
