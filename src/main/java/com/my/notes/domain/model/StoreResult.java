package com.my.notes.domain.model;

import java.util.Objects;

/**
 * 왜: 저장소 작업의 성공/실패를 예외 대신 값으로 돌려주어 호출자가 오류 분류에 따라 분기하도록 하기 위함.
 */
public record StoreResult<T>(T value, StoreError error, String message) {

    public StoreResult {
        if (error == null && message != null) {
            throw new IllegalArgumentException("성공 결과에는 오류 메시지가 없어야 합니다.");
        }
    }

    public static <T> StoreResult<T> ok(T value) {
        return new StoreResult<>(value, null, null);
    }

    public static StoreResult<Void> ok() {
        return new StoreResult<>(null, null, null);
    }

    public static <T> StoreResult<T> failure(StoreError error, String message) {
        Objects.requireNonNull(error, "error");
        return new StoreResult<>(null, error, message == null ? error.name() : message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * 성공 값을 꺼낸다. 실패 결과에서 호출하면 {@link IllegalStateException}.
     */
    public T orElseThrow() {
        if (error != null) {
            throw new IllegalStateException(error + ": " + message);
        }
        return value;
    }
}
