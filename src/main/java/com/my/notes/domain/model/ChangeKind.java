package com.my.notes.domain.model;

/**
 * 감시자가 보고하는 변경 종류.
 */
public enum ChangeKind {
    ADDED,
    CHANGED,
    REMOVED,
    DIR_ADDED,
    DIR_REMOVED,
    /** 이벤트 유실. 전체 재스캔이 필요하다. */
    OVERFLOW,
    /** 감시 자체의 실패. detail 에 원인이 담긴다. */
    WATCH_FAILED;

    public boolean isDirectoryEvent() {
        return this == DIR_ADDED || this == DIR_REMOVED;
    }
}
