package com.incoresoft.sosync.domain.shared.exception;

public class PermissionDeniedException extends SafetyException {
    public PermissionDeniedException(String message) {
        super("permission_denied", message);
    }
}
