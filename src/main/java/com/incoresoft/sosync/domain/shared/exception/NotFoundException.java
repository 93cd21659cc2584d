package com.incoresoft.sosync.domain.shared.exception;

public class NotFoundException extends SafetyException {
    public NotFoundException(String kind, String id) {
        super("not_found", kind + " " + id + " not found");
    }
}
