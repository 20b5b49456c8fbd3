package com.my.notes.adapter.out.filesystem;

import com.my.notes.domain.exception.InvalidGroupPathException;
import com.my.notes.domain.exception.NoteStorageException;
import com.my.notes.domain.model.GroupPath;
import com.my.notes.domain.model.StoreError;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 왜: 논리 그룹 경로와 물리 디렉터리 사이의 변환을 한 곳에 모아 루트 밖으로 벗어나는 경로를 차단하기 위함.
 */
public class GroupPathResolver {

    private final Path root;

    public GroupPathResolver(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /**
     * 그룹 디렉터리 위치를 계산한다. 기본 그룹은 루트다.
     */
    public Path locateGroupDir(GroupPath group) {
        Path dir = root;
        for (String segment : group.segments()) {
            dir = dir.resolve(segment);
        }
        Path normalized = dir.normalize();
        if (!normalized.startsWith(root)) {
            throw new InvalidGroupPathException(group.value(), "루트 밖을 가리키는 그룹 경로입니다");
        }
        return normalized;
    }

    /**
     * 그룹 디렉터리를 돌려주며 루트를 포함해 빠진 디렉터리를 모두 만든다. 여러 번 불러도 같다.
     */
    public Path resolveGroupDir(GroupPath group) {
        Path dir = locateGroupDir(group);
        try {
            Files.createDirectories(dir);
            return dir;
        } catch (FileAlreadyExistsException e) {
            throw new NoteStorageException(StoreError.NAME_COLLISION,
                    "그룹 경로에 같은 이름의 파일이 있습니다: " + group.value(), e);
        } catch (IOException e) {
            throw new NoteStorageException(StoreError.IO_FAILURE,
                    "그룹 디렉터리 생성 실패: " + group.value() + " (" + e.getMessage() + ")", e);
        }
    }

    /**
     * 루트 아래 디렉터리의 논리 그룹 경로. 루트 자체는 기본 그룹이다.
     */
    public GroupPath relativeGroupPath(Path directory) {
        Path normalized = directory.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            throw new InvalidGroupPathException(directory.toString(), "노트 루트 밖의 경로입니다");
        }
        if (normalized.equals(root)) {
            return GroupPath.DEFAULT;
        }
        Path relative = root.relativize(normalized);
        List<String> segments = new ArrayList<>(relative.getNameCount());
        for (Path name : relative) {
            segments.add(name.toString());
        }
        return new GroupPath(segments);
    }

    /**
     * 루트 기준 상대 경로를 "/" 로 이은 문자열. 루트 자체는 빈 문자열이다.
     */
    public String relativePath(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            return normalized.toString().replace('\\', '/');
        }
        return root.relativize(normalized).toString().replace('\\', '/');
    }

    public boolean isInsideRoot(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return normalized.startsWith(root) && !normalized.equals(root);
    }
}
