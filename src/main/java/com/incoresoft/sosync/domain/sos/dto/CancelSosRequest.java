package com.incoresoft.sosync.domain.sos.dto;

public record CancelSosRequest(String reason) {
}
