package com.incoresoft.sosync.domain.shared.exception;

/**
 * A stored record is missing data it must carry, e.g. a safety check without its group.
 */
public class InconsistentRecordException extends SafetyException {
    public InconsistentRecordException(String message) {
        super("inconsistent_record", message);
    }
}
