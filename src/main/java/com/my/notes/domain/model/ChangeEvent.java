package com.my.notes.domain.model;

import java.util.Objects;

/**
 * 왜: 감시자의 원시 이벤트를 종류와 논리 경로로 태깅해 소비자가 재스캔 여부를 판단할 수 있게 하기 위함.
 *
 * @param kind   변경 종류
 * @param path   루트 기준 상대 경로 ("/" 구분), 루트 자체는 빈 문자열
 * @param group  변경이 닿은 논리 그룹 (디렉터리 이벤트면 그 디렉터리, 파일 이벤트면 부모)
 * @param detail 실패 원인 등 부가 설명, 없으면 null
 */
public record ChangeEvent(ChangeKind kind, String path, GroupPath group, String detail) {
    public ChangeEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(group, "group");
    }

    public static ChangeEvent of(ChangeKind kind, String path, GroupPath group) {
        return new ChangeEvent(kind, path, group, null);
    }

    public static ChangeEvent failure(String path, String detail) {
        return new ChangeEvent(ChangeKind.WATCH_FAILED, path, GroupPath.DEFAULT, detail);
    }
}
