package com.my.notes.domain.port.in;

/**
 * 변경 구독 핸들. 여러 번 취소해도 안전하다.
 */
public interface Subscription extends AutoCloseable {

    void cancel();

    boolean isActive();

    @Override
    default void close() {
        cancel();
    }
}
