package com.my.notes.domain.service;

import com.my.notes.domain.exception.InvalidGroupPathException;
import com.my.notes.domain.exception.NoteStorageException;
import com.my.notes.domain.model.GroupPath;
import com.my.notes.domain.model.GroupTree;
import com.my.notes.domain.model.Note;
import com.my.notes.domain.model.NoteDocument;
import com.my.notes.domain.model.NoteHeader;
import com.my.notes.domain.model.ScanResult;
import com.my.notes.domain.model.StoreError;
import com.my.notes.domain.model.StoreResult;
import com.my.notes.domain.port.in.NoteChangeListener;
import com.my.notes.domain.port.in.NoteStoreUseCase;
import com.my.notes.domain.port.in.Subscription;
import com.my.notes.domain.port.in.WatchNotesUseCase;
import com.my.notes.domain.port.out.ChangeWatchPort;
import com.my.notes.domain.port.out.ClockPort;
import com.my.notes.domain.port.out.NoteStoragePort;
import org.jboss.logging.Logger;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * 왜: 모든 노트/그룹 조작을 검증 후 실행하고 실패를 오류 분류 값으로 바꿔, 호출자가 예외 없이 결과만으로 분기하게 하기 위함.
 * <p>
 * 충돌 검사는 확인 후 실행 방식이라 다른 프로세스와 경합하면 늦게 IO_FAILURE 가 날 수 있다.
 * 저장소 인스턴스 하나가 자기 감시자를 소유한다.
 */
public class NoteStoreService implements NoteStoreUseCase, WatchNotesUseCase {

    private static final Logger log = Logger.getLogger(NoteStoreService.class);

    private static final Pattern ILLEGAL_TITLE_CHARS = Pattern.compile("[\\\\/:*?\"<>|]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("__+");
    private static final int MAX_TITLE_FILE_NAME = 200;
    private static final String UNTITLED = "untitled";

    private final NoteStoragePort storage;
    private final ChangeWatchPort watchPort;
    private final ClockPort clockPort;
    private final ChangeNotifier notifier;
    private final GroupTreeBuilder treeBuilder;

    public NoteStoreService(NoteStoragePort storage, ChangeWatchPort watchPort, ClockPort clockPort) {
        this.storage = storage;
        this.watchPort = watchPort;
        this.clockPort = clockPort;
        this.notifier = new ChangeNotifier();
        this.treeBuilder = new GroupTreeBuilder();
    }

    @Override
    public StoreResult<ScanResult> scan() {
        return execute("스캔", storage::scan);
    }

    @Override
    public StoreResult<GroupTree> groupTree() {
        return execute("그룹 트리 구성", () -> treeBuilder.build(storage.scan()));
    }

    @Override
    public StoreResult<Note> createNote(String name, String group, String content) {
        return execute("노트 생성", () -> {
            String fileName = toFileName(name);
            GroupPath target = parseTargetGroup(group);
            Note note = writeNote(target, fileName, content == null ? "" : content);
            log.infof("노트를 만들었습니다: %s/%s", target, note.fileName());
            return note;
        });
    }

    @Override
    public StoreResult<Note> createTitledNote(String title, String group, String body) {
        return execute("제목 노트 생성", () -> {
            GroupPath target = parseTargetGroup(group);
            OffsetDateTime now = clockPort.now();
            String id = String.valueOf(now.toInstant().toEpochMilli());
            String safeTitle = title == null ? "" : title;
            String fileName = sanitizeTitle(safeTitle) + "_" + id + storage.noteExtension();
            NoteDocument document = new NoteDocument(new NoteHeader(safeTitle, id, now), body == null ? "" : body);
            Note note = writeNote(target, fileName, document.render());
            log.infof("제목 노트를 만들었습니다: %s/%s (id=%s)", target, note.fileName(), id);
            return note;
        });
    }

    @Override
    public StoreResult<NoteDocument> readNote(Path notePath) {
        return execute("노트 읽기", () -> NoteDocument.parse(storage.read(requireNotePath(notePath))));
    }

    @Override
    public StoreResult<Note> saveNote(Path notePath, String content) {
        return execute("노트 저장", () -> storage.overwrite(requireNotePath(notePath), content == null ? "" : content));
    }

    @Override
    public StoreResult<Path> renameNote(Path notePath, String newName) {
        return execute("노트 이름 변경", () -> {
            Path source = requireNotePath(notePath);
            String fileName = toFileName(newName);
            Path target = source.resolveSibling(fileName);
            if (!storage.exists(source) || storage.isDirectory(source)) {
                throw new NoteStorageException(StoreError.NOT_FOUND, "노트가 존재하지 않습니다: " + source.getFileName());
            }
            if (!target.equals(source) && storage.exists(target)) {
                throw new NoteStorageException(StoreError.NAME_COLLISION, "이 그룹에 같은 이름의 노트가 이미 있습니다: " + fileName);
            }
            Path renamed = storage.rename(source, target);
            log.infof("노트 이름을 바꿨습니다: %s -> %s", source.getFileName(), renamed.getFileName());
            return renamed;
        });
    }

    @Override
    public StoreResult<Void> deleteNote(Path notePath) {
        return execute("노트 삭제", () -> {
            Path source = requireNotePath(notePath);
            if (storage.isDirectory(source)) {
                throw new NoteStorageException(StoreError.NOT_FOUND, "노트가 아니라 그룹입니다: " + source.getFileName());
            }
            // 비게 된 부모 디렉터리는 빈 그룹으로 남긴다.
            storage.delete(source);
            log.infof("노트를 삭제했습니다: %s", source.getFileName());
            return null;
        });
    }

    @Override
    public StoreResult<Void> createGroup(String group) {
        return execute("그룹 생성", () -> {
            GroupPath target = parseTargetGroup(group);
            storage.resolveGroupDir(target);
            log.infof("그룹을 준비했습니다: %s", target);
            return null;
        });
    }

    @Override
    public StoreResult<Void> deleteGroup(String group) {
        return execute("그룹 삭제", () -> {
            GroupPath target = GroupPath.parse(group);
            if (target.isDefault()) {
                throw new NoteStorageException(StoreError.PROTECTED_GROUP, "기본 그룹은 삭제할 수 없습니다.");
            }
            Path dir = storage.locateGroupDir(target);
            if (!storage.isDirectory(dir)) {
                throw new NoteStorageException(StoreError.NOT_FOUND, "그룹이 존재하지 않습니다: " + target);
            }
            storage.deleteTree(dir);
            log.infof("그룹을 삭제했습니다: %s", target);
            return null;
        });
    }

    @Override
    public StoreResult<Path> moveNote(Path notePath, String targetGroup) {
        return execute("노트 이동", () -> {
            Path source = requireNotePath(notePath);
            GroupPath target = parseTargetGroup(targetGroup);
            if (!storage.exists(source) || storage.isDirectory(source)) {
                throw new NoteStorageException(StoreError.NOT_FOUND, "노트가 존재하지 않습니다: " + source.getFileName());
            }
            GroupPath current = storage.relativeGroupPath(source.getParent());
            if (current.equals(target)) {
                return source;
            }
            Path destination = storage.resolveGroupDir(target).resolve(source.getFileName().toString());
            if (storage.exists(destination)) {
                throw new NoteStorageException(StoreError.NAME_COLLISION,
                        "대상 그룹에 같은 이름의 노트가 이미 있습니다: " + target + "/" + source.getFileName());
            }
            // 볼륨이 달라도 되도록 읽어서 쓰고 원본을 지운다.
            String content = storage.read(source);
            storage.writeNew(destination, content);
            storage.delete(source);
            log.infof("노트를 옮겼습니다: %s -> %s", current, target);
            return destination;
        });
    }

    @Override
    public StoreResult<GroupPath> moveGroup(String sourceGroup, String targetGroup) {
        return execute("그룹 이동", () -> {
            GroupPath source = GroupPath.parse(sourceGroup);
            GroupPath target = parseTargetGroup(targetGroup);
            if (source.isDefault()) {
                throw new NoteStorageException(StoreError.PROTECTED_GROUP, "기본 그룹은 이동할 수 없습니다.");
            }
            if (target.isSameOrDescendantOf(source)) {
                throw new NoteStorageException(StoreError.INVALID_MOVE,
                        "그룹을 자기 자신이나 하위 그룹으로 옮길 수 없습니다: " + source + " -> " + target);
            }
            Path sourceDir = storage.locateGroupDir(source);
            if (!storage.isDirectory(sourceDir)) {
                throw new NoteStorageException(StoreError.NOT_FOUND, "그룹이 존재하지 않습니다: " + source);
            }
            GroupPath moved = target.isDefault() ? new GroupPath(List.of(source.leaf())) : target.child(source.leaf());
            Path destinationDir = storage.locateGroupDir(moved);
            if (storage.exists(destinationDir)) {
                throw new NoteStorageException(StoreError.NAME_COLLISION, "대상 위치에 같은 이름의 그룹이 이미 있습니다: " + moved);
            }
            storage.resolveGroupDir(target);
            storage.copyTree(sourceDir, destinationDir);
            storage.deleteTree(sourceDir);
            log.infof("그룹을 옮겼습니다: %s -> %s", source, moved);
            return moved;
        });
    }

    @Override
    public Subscription onChange(NoteChangeListener listener) {
        return notifier.subscribe(listener);
    }

    @Override
    public synchronized void startWatching() {
        if (watchPort.isRunning()) {
            return;
        }
        try {
            storage.resolveGroupDir(GroupPath.DEFAULT);
        } catch (NoteStorageException e) {
            // 감시자가 루트가 생길 때까지 기다리며 실패를 알린다.
            log.errorf(e, "노트 루트를 준비하지 못했습니다: %s", storage.root());
        }
        watchPort.start(storage.root(), notifier::publish);
    }

    @Override
    public synchronized void stopWatching() {
        watchPort.stop();
    }

    @Override
    public boolean isWatching() {
        return watchPort.isRunning();
    }

    private Note writeNote(GroupPath group, String fileName, String content) {
        Path dir = storage.resolveGroupDir(group);
        Path notePath = dir.resolve(fileName);
        if (storage.exists(notePath)) {
            throw new NoteStorageException(StoreError.NAME_COLLISION, "이 그룹에 같은 이름의 노트가 이미 있습니다: " + fileName);
        }
        return storage.writeNew(notePath, content);
    }

    /**
     * 쓰기 대상 그룹 경로. 숨김 항목을 스캔에서 빼는 저장소에서는 '.' 으로 시작하는 세그먼트를 거부한다.
     */
    private GroupPath parseTargetGroup(String raw) {
        GroupPath group = GroupPath.parse(raw);
        if (storage.ignoresHidden() && group.isHidden()) {
            throw new InvalidGroupPathException(raw, "숨김 그룹은 스캔에 나타나지 않으므로 만들 수 없습니다");
        }
        return group;
    }

    private Path requireNotePath(Path notePath) {
        if (notePath == null) {
            throw new NoteStorageException(StoreError.INVALID_PATH, "노트 경로가 비어 있습니다.");
        }
        Path normalized = notePath.toAbsolutePath().normalize();
        if (!storage.isInsideRoot(normalized)) {
            throw new NoteStorageException(StoreError.INVALID_PATH, "노트 루트 밖의 경로입니다: " + notePath);
        }
        return normalized;
    }

    private String toFileName(String name) {
        if (name == null || name.isBlank()) {
            throw new NoteStorageException(StoreError.INVALID_NAME, "노트 이름은 비어 있을 수 없습니다.");
        }
        if (name.contains("/") || name.contains("\\") || name.indexOf('\0') >= 0) {
            throw new NoteStorageException(StoreError.INVALID_NAME, "노트 이름에 경로 구분자를 쓸 수 없습니다: " + name);
        }
        if (name.startsWith(".")) {
            throw new NoteStorageException(StoreError.INVALID_NAME, "노트 이름은 '.' 으로 시작할 수 없습니다: " + name);
        }
        String extension = storage.noteExtension();
        if (name.endsWith(extension)) {
            if (name.length() == extension.length()) {
                throw new NoteStorageException(StoreError.INVALID_NAME, "노트 이름은 비어 있을 수 없습니다.");
            }
            return name;
        }
        return name + extension;
    }

    private String sanitizeTitle(String title) {
        String cleaned = ILLEGAL_TITLE_CHARS.matcher(title.strip()).replaceAll("_");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll("_");
        cleaned = cleaned.replace('.', '_');
        cleaned = REPEATED_UNDERSCORES.matcher(cleaned).replaceAll("_");
        if (cleaned.length() > MAX_TITLE_FILE_NAME) {
            cleaned = cleaned.substring(0, MAX_TITLE_FILE_NAME);
        }
        return cleaned.isEmpty() ? UNTITLED : cleaned;
    }

    private <T> StoreResult<T> execute(String action, Supplier<T> work) {
        try {
            return StoreResult.ok(work.get());
        } catch (NoteStorageException e) {
            return failed(action, e.error(), e.getMessage(), e);
        } catch (InvalidGroupPathException e) {
            return failed(action, StoreError.INVALID_PATH, e.getMessage(), e);
        } catch (UncheckedIOException e) {
            return failed(action, StoreError.IO_FAILURE, e.getMessage(), e);
        } catch (RuntimeException e) {
            return failed(action, StoreError.IO_FAILURE, action + " 중 예상하지 못한 오류: " + e, e);
        }
    }

    private <T> StoreResult<T> failed(String action, StoreError error, String message, RuntimeException cause) {
        if (error == StoreError.IO_FAILURE) {
            log.errorf(cause, "%s 실패: %s", action, message);
        } else {
            log.warnf("%s 실패 [%s]: %s", action, error, message);
        }
        return StoreResult.failure(error, message);
    }
}
