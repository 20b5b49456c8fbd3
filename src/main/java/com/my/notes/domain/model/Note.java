package com.my.notes.domain.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 저장소 경로를 식별자로 삼는 노트 한 건을 구조화하여 스캔 결과와 CRUD 결과를 같은 형태로 다루기 위함.
 *
 * @param path         노트 파일의 물리 경로 (식별자)
 * @param name         확장자를 뺀 표시 이름
 * @param fileName     확장자를 포함한 파일 이름
 * @param group        소속 그룹, 루트에 있으면 기본 그룹
 * @param lastModified 마지막 수정 시각
 */
public record Note(Path path, String name, String fileName, GroupPath group, Instant lastModified) {
    public Note {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(lastModified, "lastModified");
        if (name.isBlank()) {
            throw new IllegalArgumentException("노트 이름은 비어 있을 수 없습니다.");
        }
    }
}
