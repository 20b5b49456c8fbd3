package com.my.notes.domain.exception;

import com.my.notes.domain.model.StoreError;

/**
 * 왜: 파일 시스템 어댑터의 실패를 오류 분류와 함께 도메인으로 올려 API 경계에서 결과 값으로 바꿀 수 있게 하기 위함.
 */
public class NoteStorageException extends RuntimeException {

    private final StoreError error;

    public NoteStorageException(StoreError error, String message) {
        super(message);
        this.error = error;
    }

    public NoteStorageException(StoreError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public StoreError error() {
        return error;
    }
}
