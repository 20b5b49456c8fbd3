package com.my.notes.domain.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 노트 파일 머리의 메타데이터 블록. 에디터/내보내기 쪽과 같은 형식을 공유한다.
 */
public record NoteHeader(String title, String id, OffsetDateTime date) {
    public NoteHeader {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(id, "id");
    }
}
