package com.indexsync.model;

public enum SyncStatus {
    PENDING,
    SUCCESS,
    FAILED,
    RETRYING
}
