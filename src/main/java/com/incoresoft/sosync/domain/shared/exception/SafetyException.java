package com.incoresoft.sosync.domain.shared.exception;

import lombok.Getter;

/**
 * Base of the per-call failures reported back to the caller. None of them is fatal to the process.
 */
@Getter
public abstract class SafetyException extends RuntimeException {
    private final String code;

    protected SafetyException(String code, String message) {
        super(message);
        this.code = code;
    }
}
