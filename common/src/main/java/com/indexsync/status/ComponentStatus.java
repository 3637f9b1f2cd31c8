package com.indexsync.status;

public enum ComponentStatus {
    UP,
    DOWN
}
