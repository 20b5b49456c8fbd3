package com.my.notes.domain.port.in;

import com.my.notes.domain.model.GroupPath;
import com.my.notes.domain.model.GroupTree;
import com.my.notes.domain.model.Note;
import com.my.notes.domain.model.NoteDocument;
import com.my.notes.domain.model.ScanResult;
import com.my.notes.domain.model.StoreResult;

import java.nio.file.Path;

/**
 * 왜: 노트/그룹 조작을 도메인 진입점 하나로 모아 모든 호출이 같은 검증과 오류 분류를 거치게 하기 위함.
 * <p>
 * 그룹 인자는 "Work/Notes" 형태의 논리 경로이며 null, "", "default" 는 기본 그룹이다.
 * 어떤 작업도 예외를 던지지 않고 {@link StoreResult} 로 실패를 돌려준다.
 */
public interface NoteStoreUseCase {

    StoreResult<ScanResult> scan();

    StoreResult<GroupTree> groupTree();

    StoreResult<Note> createNote(String name, String group, String content);

    StoreResult<Note> createTitledNote(String title, String group, String body);

    StoreResult<NoteDocument> readNote(Path notePath);

    StoreResult<Note> saveNote(Path notePath, String content);

    StoreResult<Path> renameNote(Path notePath, String newName);

    StoreResult<Void> deleteNote(Path notePath);

    StoreResult<Void> createGroup(String group);

    StoreResult<Void> deleteGroup(String group);

    StoreResult<Path> moveNote(Path notePath, String targetGroup);

    StoreResult<GroupPath> moveGroup(String sourceGroup, String targetGroup);
}
