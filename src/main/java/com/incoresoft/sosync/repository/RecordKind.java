package com.incoresoft.sosync.repository;

public enum RecordKind {
    GROUP,
    SAFETY_CHECK,
    SOS_ALERT
}
