package com.my.notes.domain.model;

/**
 * 노트 저장소 작업의 실패 분류.
 */
public enum StoreError {
    NAME_COLLISION,
    PROTECTED_GROUP,
    INVALID_MOVE,
    NOT_FOUND,
    INVALID_NAME,
    INVALID_PATH,
    IO_FAILURE;

    /**
     * 호출자가 이름 변경이나 대상 변경으로 복구할 수 있는 실패인지 여부.
     */
    public boolean isUserRecoverable() {
        return this == NAME_COLLISION || this == INVALID_MOVE || this == INVALID_NAME;
    }
}
