package com.my.notes.domain.port.out;

import com.my.notes.domain.model.GroupPath;
import com.my.notes.domain.model.Note;
import com.my.notes.domain.model.ScanResult;

import java.nio.file.Path;

/**
 * 왜: 파일 시스템 작업을 추상화하여 도메인이 저장소나 경로 구조에 종속되지 않도록 하기 위함.
 * <p>
 * 구현체는 실패 시 {@link com.my.notes.domain.exception.NoteStorageException} 을,
 * 잘못된 그룹 경로에는 {@link com.my.notes.domain.exception.InvalidGroupPathException} 을 던진다.
 */
public interface NoteStoragePort {

    Path root();

    String noteExtension();

    /** true 면 '.' 으로 시작하는 항목은 스캔에 나타나지 않는다. */
    boolean ignoresHidden();

    /** 그룹 디렉터리를 돌려주며 없으면 중간 디렉터리까지 만든다. */
    Path resolveGroupDir(GroupPath group);

    /** 그룹 디렉터리 위치만 계산한다. 아무것도 만들지 않는다. */
    Path locateGroupDir(GroupPath group);

    GroupPath relativeGroupPath(Path directory);

    boolean isInsideRoot(Path path);

    ScanResult scan();

    boolean exists(Path path);

    boolean isDirectory(Path path);

    Note describe(Path notePath);

    /** 새 파일로만 쓴다. 이미 있으면 NAME_COLLISION. */
    Note writeNew(Path notePath, String content);

    /** 이미 있는 파일의 내용을 덮어쓴다. 없으면 NOT_FOUND. */
    Note overwrite(Path notePath, String content);

    String read(Path notePath);

    Path rename(Path source, Path target);

    void delete(Path notePath);

    void copyTree(Path sourceDir, Path targetDir);

    void deleteTree(Path directory);
}
