package com.my.notes.domain.port.in;

/**
 * 왜: 저장소가 소유한 감시자의 시작/중지와 변경 구독을 외부 변경 알림의 단일 경로로 제공하기 위함.
 */
public interface WatchNotesUseCase {

    Subscription onChange(NoteChangeListener listener);

    void startWatching();

    void stopWatching();

    boolean isWatching();
}
