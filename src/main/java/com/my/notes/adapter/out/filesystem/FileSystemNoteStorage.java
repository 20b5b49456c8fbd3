package com.my.notes.adapter.out.filesystem;

import com.my.notes.config.AppConfig;
import com.my.notes.domain.exception.NoteStorageException;
import com.my.notes.domain.model.GroupPath;
import com.my.notes.domain.model.Note;
import com.my.notes.domain.model.ScanResult;
import com.my.notes.domain.model.StoreError;
import com.my.notes.domain.port.out.NoteStoragePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * 왜: 노트 루트 아래의 파일/디렉터리 조작을 중앙집중식으로 처리하여 경로 검증과 오류 분류를 일관되게 적용하기 위함.
 */
@ApplicationScoped
public class FileSystemNoteStorage implements NoteStoragePort {

    private static final Logger log = Logger.getLogger(FileSystemNoteStorage.class);

    private final GroupPathResolver resolver;
    private final FileSystemTreeScanner scanner;
    private final String noteExtension;
    private final boolean ignoreHidden;

    @Inject
    public FileSystemNoteStorage(AppConfig appConfig) {
        this(Path.of(appConfig.store().rootPath()),
                appConfig.store().noteExtension(),
                appConfig.store().ignoreHidden());
    }

    public FileSystemNoteStorage(Path root, String noteExtension, boolean ignoreHidden) {
        this.resolver = new GroupPathResolver(root);
        this.scanner = new FileSystemTreeScanner(resolver, noteExtension, ignoreHidden);
        this.noteExtension = noteExtension;
        this.ignoreHidden = ignoreHidden;
    }

    @Override
    public Path root() {
        return resolver.root();
    }

    @Override
    public String noteExtension() {
        return noteExtension;
    }

    @Override
    public boolean ignoresHidden() {
        return ignoreHidden;
    }

    @Override
    public Path resolveGroupDir(GroupPath group) {
        return resolver.resolveGroupDir(group);
    }

    @Override
    public Path locateGroupDir(GroupPath group) {
        return resolver.locateGroupDir(group);
    }

    @Override
    public GroupPath relativeGroupPath(Path directory) {
        return resolver.relativeGroupPath(directory);
    }

    @Override
    public boolean isInsideRoot(Path path) {
        return resolver.isInsideRoot(path);
    }

    @Override
    public ScanResult scan() {
        return scanner.scan();
    }

    @Override
    public boolean exists(Path path) {
        return Files.exists(path, LinkOption.NOFOLLOW_LINKS);
    }

    @Override
    public boolean isDirectory(Path path) {
        return Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS);
    }

    @Override
    public Note describe(Path notePath) {
        Path normalized = notePath.toAbsolutePath().normalize();
        try {
            BasicFileAttributes attrs = Files.readAttributes(normalized, BasicFileAttributes.class);
            if (attrs.isDirectory()) {
                throw new NoteStorageException(StoreError.NOT_FOUND, "노트가 아니라 디렉터리입니다: " + relative(normalized));
            }
            GroupPath group = resolver.relativeGroupPath(normalized.getParent());
            return scanner.toNote(normalized, group, attrs);
        } catch (IOException e) {
            throw failure("노트 정보 조회", normalized, e);
        }
    }

    @Override
    public Note writeNew(Path notePath, String content) {
        try {
            Files.writeString(notePath, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.debugf("노트 파일 생성: %s", relative(notePath));
            return describe(notePath);
        } catch (IOException e) {
            throw failure("노트 생성", notePath, e);
        }
    }

    @Override
    public Note overwrite(Path notePath, String content) {
        if (!Files.isRegularFile(notePath)) {
            throw new NoteStorageException(StoreError.NOT_FOUND, "노트가 존재하지 않습니다: " + relative(notePath));
        }
        try {
            Files.writeString(notePath, content, StandardCharsets.UTF_8,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
            return describe(notePath);
        } catch (IOException e) {
            throw failure("노트 저장", notePath, e);
        }
    }

    @Override
    public String read(Path notePath) {
        try {
            return Files.readString(notePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw failure("노트 읽기", notePath, e);
        }
    }

    @Override
    public Path rename(Path source, Path target) {
        if (source.equals(target)) {
            return target;
        }
        try {
            return Files.move(source, target);
        } catch (IOException e) {
            throw failure("노트 이름 변경", source, e);
        }
    }

    @Override
    public void delete(Path notePath) {
        try {
            Files.delete(notePath);
        } catch (IOException e) {
            throw failure("삭제", notePath, e);
        }
    }

    /**
     * 원본 디렉터리 내용을 재귀적으로 복사한다. 대상 디렉터리는 아직 없어야 한다.
     */
    @Override
    public void copyTree(Path sourceDir, Path targetDir) {
        try {
            Path parent = targetDir.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.createDirectory(targetDir);
        } catch (IOException e) {
            throw failure("그룹 복사", targetDir, e);
        }
        copyContents(sourceDir, targetDir);
    }

    private void copyContents(Path sourceDir, Path targetDir) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(sourceDir)) {
            for (Path entry : entries) {
                Path destination = targetDir.resolve(entry.getFileName().toString());
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    Files.createDirectory(destination);
                    copyContents(entry, destination);
                } else {
                    Files.copy(entry, destination, StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
                }
            }
        } catch (IOException e) {
            throw failure("그룹 복사", sourceDir, e);
        }
    }

    /**
     * 디렉터리와 그 아래 모든 항목을 지운다. 심볼릭 링크는 따라가지 않고 링크 자체만 지운다.
     */
    @Override
    public void deleteTree(Path directory) {
        try {
            if (Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
                try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
                    for (Path entry : entries) {
                        deleteTree(entry);
                    }
                }
            }
            Files.delete(directory);
            log.debugf("삭제: %s", relative(directory));
        } catch (IOException e) {
            throw failure("그룹 삭제", directory, e);
        }
    }

    private NoteStorageException failure(String action, Path path, IOException e) {
        String target = relative(path);
        if (e instanceof NoSuchFileException) {
            return new NoteStorageException(StoreError.NOT_FOUND, action + " 실패, 대상이 없습니다: " + target, e);
        }
        if (e instanceof FileAlreadyExistsException) {
            String existing = ((FileAlreadyExistsException) e).getFile();
            String name = existing == null ? target : relative(Path.of(existing));
            return new NoteStorageException(StoreError.NAME_COLLISION, action + " 실패, 같은 이름이 이미 있습니다: " + name, e);
        }
        if (e instanceof CharacterCodingException) {
            return new NoteStorageException(StoreError.IO_FAILURE, action + " 실패, UTF-8 텍스트가 아닙니다: " + target, e);
        }
        return new NoteStorageException(StoreError.IO_FAILURE, action + " 실패: " + target + " (" + e.getMessage() + ")", e);
    }

    private String relative(Path path) {
        return resolver.relativePath(path);
    }
}
