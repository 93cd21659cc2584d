package com.incoresoft.sosync.repository;

/**
 * A write under one record's subtree.
 *
 * @param record the record as it reads after the write, or null when it was deleted
 */
public record RecordChange(RecordKind kind, String groupId, String recordId, Object record) {

    public boolean isDeletion() {
        return record == null;
    }
}
