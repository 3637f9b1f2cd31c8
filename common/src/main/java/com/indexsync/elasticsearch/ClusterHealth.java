package com.indexsync.elasticsearch;

public enum ClusterHealth {
    GREEN,
    YELLOW,
    RED,
    UNREACHABLE;

    /** Green and yellow clusters accept writes. */
    public boolean isUp() {
        return this == GREEN || this == YELLOW;
    }
}
