package com.my.notes.adapter.out.watcher;

import com.my.notes.adapter.out.filesystem.GroupPathResolver;
import com.my.notes.config.AppConfig;
import com.my.notes.domain.exception.InvalidGroupPathException;
import com.my.notes.domain.model.ChangeEvent;
import com.my.notes.domain.model.ChangeKind;
import com.my.notes.domain.model.GroupPath;
import com.my.notes.domain.port.in.NoteChangeListener;
import com.my.notes.domain.port.out.ChangeWatchPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * 왜: 노트 루트 아래 모든 디렉터리를 감시해 다른 프로세스가 만든 변경까지 디바운스된 알림으로 전달하기 위함.
 * <p>
 * 시작 시점에 이미 있던 항목은 보고하지 않는다. 새로 생긴 디렉터리는 재귀적으로 등록하고 그 안의 기존 항목을
 * 추가로 보고한다. 이벤트 하나의 처리 실패나 루트 소실은 WATCH_FAILED 로 알리고 루프는 계속 돈다.
 */
@ApplicationScoped
public class WatchServiceChangeWatcher implements ChangeWatchPort {

    private static final Logger log = Logger.getLogger(WatchServiceChangeWatcher.class);
    private static final long STOP_TIMEOUT_SECONDS = 5;

    private final Duration stabilityWindow;
    private final Duration pollInterval;
    private final boolean ignoreHidden;

    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private final Set<Path> directories = ConcurrentHashMap.newKeySet();

    private WatchService watchService;
    private ExecutorService loopExecutor;
    private ChangeDebouncer debouncer;
    private GroupPathResolver resolver;
    private volatile boolean running;
    private volatile boolean rootLost;

    @Inject
    public WatchServiceChangeWatcher(AppConfig appConfig) {
        this(Duration.ofMillis(appConfig.watcher().stabilityMillis()),
                Duration.ofMillis(appConfig.watcher().pollMillis()),
                appConfig.store().ignoreHidden());
    }

    public WatchServiceChangeWatcher(Duration stabilityWindow, Duration pollInterval, boolean ignoreHidden) {
        this.stabilityWindow = stabilityWindow;
        this.pollInterval = pollInterval;
        this.ignoreHidden = ignoreHidden;
    }

    @Override
    public synchronized void start(Path root, NoteChangeListener listener) {
        if (running) {
            stop();
        }
        this.resolver = new GroupPathResolver(root);
        this.debouncer = new ChangeDebouncer(stabilityWindow, listener);
        try {
            this.watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            debouncer.close();
            throw new IllegalStateException("WatchService 생성 실패", e);
        }
        running = true;
        rootLost = false;
        try {
            registerTree(resolver.root(), false);
        } catch (IOException e) {
            rootLost = true;
            log.warnf("노트 루트 감시 등록 실패, 루트가 생기면 다시 시도합니다: %s (%s)", resolver.root(), e.getMessage());
            debouncer.fail(ChangeEvent.failure("", "노트 루트 감시 등록 실패: " + e.getMessage()));
        }
        this.loopExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "note-watcher");
            thread.setDaemon(true);
            return thread;
        });
        loopExecutor.execute(this::loop);
        log.infof("노트 루트 감시 시작: %s (디렉터리 %d개)", resolver.root(), keys.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            watchService.close();
        } catch (IOException e) {
            log.debugf("WatchService 종료 중 예외: %s", e.getMessage());
        }
        loopExecutor.shutdownNow();
        try {
            if (!loopExecutor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("감시 루프가 제한 시간 안에 끝나지 않았습니다.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        debouncer.close();
        keys.clear();
        directories.clear();
        log.infof("노트 루트 감시 중지: %s", resolver.root());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void loop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            if (key == null) {
                recoverRootIfBack();
                continue;
            }
            Path dir = keys.get(key);
            if (dir == null) {
                key.reset();
                continue;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                try {
                    handle(dir, event);
                } catch (RuntimeException e) {
                    log.warnf(e, "감시 이벤트 처리 실패: %s", dir);
                    debouncer.fail(ChangeEvent.failure(resolver.relativePath(dir), "감시 이벤트 처리 실패: " + e.getMessage()));
                }
            }
            if (!key.reset()) {
                keys.remove(key);
                if (dir.equals(resolver.root()) && running) {
                    rootLost = true;
                    directories.clear();
                    log.warnf("노트 루트가 사라졌습니다: %s", dir);
                    debouncer.fail(ChangeEvent.failure("", "노트 루트가 사라졌습니다: " + dir));
                }
            }
        }
    }

    private void handle(Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == OVERFLOW) {
            debouncer.submit(ChangeEvent.of(ChangeKind.OVERFLOW, resolver.relativePath(dir), groupOf(dir)), null);
            registerQuietly(dir);
            return;
        }
        Path name = (Path) event.context();
        if (ignoreHidden && name.toString().startsWith(".")) {
            return;
        }
        Path full = dir.resolve(name);
        if (kind == ENTRY_CREATE) {
            if (Files.isDirectory(full, LinkOption.NOFOLLOW_LINKS)) {
                emitDirectory(ChangeKind.DIR_ADDED, full);
                try {
                    registerTree(full, true);
                } catch (IOException e) {
                    log.debugf("새 디렉터리 등록 실패 (이미 사라졌을 수 있음): %s", full);
                }
            } else {
                emitFile(ChangeKind.ADDED, full);
            }
        } else if (kind == ENTRY_DELETE) {
            if (directories.contains(full)) {
                unregisterTree(full);
                emitDirectory(ChangeKind.DIR_REMOVED, full);
            } else {
                emitFile(ChangeKind.REMOVED, full);
            }
        } else if (kind == ENTRY_MODIFY && !Files.isDirectory(full, LinkOption.NOFOLLOW_LINKS)) {
            emitFile(ChangeKind.CHANGED, full);
        }
    }

    private void emitFile(ChangeKind kind, Path file) {
        Path parent = file.getParent();
        GroupPath group = parent == null ? GroupPath.DEFAULT : groupOf(parent);
        debouncer.submit(ChangeEvent.of(kind, resolver.relativePath(file), group), kind == ChangeKind.REMOVED ? null : file);
    }

    private void emitDirectory(ChangeKind kind, Path directory) {
        debouncer.submit(ChangeEvent.of(kind, resolver.relativePath(directory), groupOf(directory)), null);
    }

    private GroupPath groupOf(Path directory) {
        try {
            return resolver.relativeGroupPath(directory);
        } catch (InvalidGroupPathException e) {
            return GroupPath.DEFAULT;
        }
    }

    /**
     * 디렉터리와 그 하위 디렉터리를 모두 등록한다. report 가 true 면 안에 이미 있던 항목을 추가 이벤트로 보고한다.
     */
    private void registerTree(Path dir, boolean report) throws IOException {
        if (!isWatchedDirectory(dir)) {
            WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
            keys.put(key, dir);
        }
        directories.add(dir);
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                if (ignoreHidden && entry.getFileName().toString().startsWith(".")) {
                    continue;
                }
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    if (report) {
                        emitDirectory(ChangeKind.DIR_ADDED, entry);
                    }
                    registerTree(entry, report);
                } else if (report) {
                    emitFile(ChangeKind.ADDED, entry);
                }
            }
        }
    }

    private void registerQuietly(Path dir) {
        try {
            registerTree(dir, false);
        } catch (IOException e) {
            log.debugf("디렉터리 재등록 실패: %s (%s)", dir, e.getMessage());
        }
    }

    private boolean isWatchedDirectory(Path dir) {
        return keys.containsValue(dir);
    }

    private void unregisterTree(Path dir) {
        directories.removeIf(known -> known.startsWith(dir));
        keys.entrySet().removeIf(entry -> {
            if (entry.getValue().startsWith(dir)) {
                entry.getKey().cancel();
                return true;
            }
            return false;
        });
    }

    private void recoverRootIfBack() {
        if (!rootLost || !Files.isDirectory(resolver.root())) {
            return;
        }
        try {
            registerTree(resolver.root(), false);
            rootLost = false;
            log.infof("노트 루트가 다시 생겨 감시를 재개합니다: %s", resolver.root());
            debouncer.submit(ChangeEvent.of(ChangeKind.OVERFLOW, "", GroupPath.DEFAULT), null);
        } catch (IOException e) {
            log.debugf("노트 루트 재등록 실패: %s", e.getMessage());
        }
    }
}
