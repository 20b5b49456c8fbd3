package com.my.notes.domain.port.out;

import com.my.notes.domain.port.in.NoteChangeListener;

import java.nio.file.Path;

/**
 * 왜: 파일 시스템 감시 방식을 추상화하여 도메인이 감시 기본 요소나 디바운스 구현에 종속되지 않도록 하기 위함.
 */
public interface ChangeWatchPort {

    /**
     * 루트 아래 전체를 감시하기 시작한다. 시작 시점에 이미 있던 항목은 보고하지 않는다.
     */
    void start(Path root, NoteChangeListener listener);

    /**
     * 감시를 멈춘다. 반환 후에는 대기 중이던 콜백도 호출되지 않는다.
     */
    void stop();

    boolean isRunning();
}
