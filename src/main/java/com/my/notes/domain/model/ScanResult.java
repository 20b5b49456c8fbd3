package com.my.notes.domain.model;

import java.util.Comparator;
import java.util.List;

/**
 * 왜: 한 번의 전체 스캔이 돌려주는 노트 집합과 빈 그룹 집합을 함께 묶어 화면 갱신의 단일 근거로 삼기 위함.
 */
public record ScanResult(List<Note> notes, List<GroupPath> emptyGroups) {

    public static final Comparator<Note> NOTE_ORDER = Comparator
            .comparing((Note note) -> note.group().value())
            .thenComparing(Note::fileName);

    public ScanResult {
        notes = notes.stream().sorted(NOTE_ORDER).toList();
        emptyGroups = emptyGroups.stream().distinct().sorted(Comparator.comparing(GroupPath::value)).toList();
    }

    public static ScanResult empty() {
        return new ScanResult(List.of(), List.of());
    }

    public List<Note> notesIn(GroupPath group) {
        return notes.stream().filter(note -> note.group().equals(group)).toList();
    }

    public List<String> emptyGroupNames() {
        return emptyGroups.stream().map(GroupPath::value).toList();
    }
}
