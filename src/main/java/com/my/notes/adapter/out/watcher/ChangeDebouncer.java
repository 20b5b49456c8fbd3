package com.my.notes.adapter.out.watcher;

import com.my.notes.domain.model.ChangeEvent;
import com.my.notes.domain.model.ChangeKind;
import com.my.notes.domain.port.in.NoteChangeListener;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 저장 중 연속으로 들어오는 원시 이벤트를 경로별로 합쳐, 안정 구간이 지난 뒤 한 번의 변경 묶음으로 내보내기 위함.
 * <p>
 * 새 이벤트가 들어올 때마다 타이머를 다시 건다. 타이머가 끝났을 때 대기 중인 파일의 크기나 수정 시각이
 * 기록과 다르면 아직 쓰는 중으로 보고 한 구간 더 기다린다. 콜백은 항상 스케줄러 스레드에서 불린다.
 */
public class ChangeDebouncer implements AutoCloseable {

    private static final Logger log = Logger.getLogger(ChangeDebouncer.class);
    private static final String OVERFLOW_KEY = "\0overflow";
    private static final long CLOSE_TIMEOUT_SECONDS = 5;

    private final Duration stabilityWindow;
    private final NoteChangeListener listener;
    private final ScheduledExecutorService scheduler;
    private final Object lock = new Object();
    private final Map<String, Pending> pending = new LinkedHashMap<>();

    private volatile Thread schedulerThread;
    private ScheduledFuture<?> flushTask;
    private long lastSubmitNanos;
    private boolean closed;

    public ChangeDebouncer(Duration stabilityWindow, NoteChangeListener listener) {
        this.stabilityWindow = stabilityWindow;
        this.listener = listener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "note-change-debouncer");
            thread.setDaemon(true);
            schedulerThread = thread;
            return thread;
        });
    }

    /**
     * 이벤트를 대기열에 합친다. file 은 안정성 확인에 쓸 실제 경로이며 디렉터리 이벤트면 null 이어도 된다.
     */
    public void submit(ChangeEvent event, Path file) {
        synchronized (lock) {
            if (closed) {
                return;
            }
            String key = event.kind() == ChangeKind.OVERFLOW ? OVERFLOW_KEY : event.path();
            Pending previous = pending.get(key);
            ChangeKind merged = previous == null ? event.kind() : merge(previous.event().kind(), event.kind());
            if (merged == null) {
                pending.remove(key);
            } else {
                ChangeEvent mergedEvent = merged == event.kind() ? event
                        : new ChangeEvent(merged, event.path(), event.group(), event.detail());
                pending.put(key, new Pending(mergedEvent, file, Snapshot.of(file)));
            }
            lastSubmitNanos = System.nanoTime();
            reschedule(stabilityWindow.toMillis());
        }
    }

    /**
     * 감시 실패는 합치지 않고 바로 별도 묶음으로 내보낸다.
     */
    public void fail(ChangeEvent failure) {
        synchronized (lock) {
            if (closed) {
                return;
            }
            scheduler.execute(() -> deliverIfOpen(List.of(failure)));
        }
    }

    int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    /**
     * 앞선 종류와 새 종류를 합친 결과. null 이면 둘이 상쇄되어 보고할 것이 없다.
     */
    static ChangeKind merge(ChangeKind previous, ChangeKind next) {
        return switch (previous) {
            case ADDED -> switch (next) {
                case REMOVED -> null;
                case CHANGED, ADDED -> ChangeKind.ADDED;
                default -> next;
            };
            case REMOVED -> next == ChangeKind.ADDED ? ChangeKind.CHANGED : next;
            case DIR_ADDED -> switch (next) {
                case DIR_REMOVED -> null;
                case CHANGED, DIR_ADDED -> ChangeKind.DIR_ADDED;
                default -> next;
            };
            case DIR_REMOVED -> next == ChangeKind.DIR_ADDED ? ChangeKind.DIR_ADDED : next;
            default -> next;
        };
    }

    private void reschedule(long delayMillis) {
        if (flushTask != null) {
            flushTask.cancel(false);
        }
        flushTask = scheduler.schedule(this::flush, delayMillis, TimeUnit.MILLISECONDS);
    }

    private void flush() {
        List<ChangeEvent> batch;
        synchronized (lock) {
            if (closed || pending.isEmpty()) {
                return;
            }
            long quietMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastSubmitNanos);
            if (quietMillis < stabilityWindow.toMillis()) {
                reschedule(stabilityWindow.toMillis() - quietMillis);
                return;
            }
            boolean stillWriting = false;
            for (Map.Entry<String, Pending> entry : pending.entrySet()) {
                Pending item = entry.getValue();
                if (item.file() == null) {
                    continue;
                }
                Snapshot current = Snapshot.of(item.file());
                if (!current.equals(item.snapshot())) {
                    entry.setValue(new Pending(item.event(), item.file(), current));
                    stillWriting = true;
                }
            }
            if (stillWriting) {
                reschedule(stabilityWindow.toMillis());
                return;
            }
            batch = new ArrayList<>(pending.size());
            for (Pending item : pending.values()) {
                batch.add(item.event());
            }
            pending.clear();
            flushTask = null;
        }
        deliver(batch);
    }

    private void deliverIfOpen(List<ChangeEvent> batch) {
        synchronized (lock) {
            if (closed) {
                return;
            }
        }
        deliver(batch);
    }

    private void deliver(List<ChangeEvent> batch) {
        try {
            listener.onChange(List.copyOf(batch));
        } catch (RuntimeException e) {
            log.warnf(e, "변경 알림 콜백 처리 중 예외: %s", e.getMessage());
        }
    }

    /**
     * 대기 중인 묶음을 버리고 스케줄러를 멈춘다. 반환 후에는 콜백이 불리지 않는다.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            pending.clear();
            if (flushTask != null) {
                flushTask.cancel(false);
                flushTask = null;
            }
        }
        scheduler.shutdownNow();
        if (Thread.currentThread() == schedulerThread) {
            return;
        }
        try {
            if (!scheduler.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("변경 알림 콜백이 제한 시간 안에 끝나지 않았습니다.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Pending(ChangeEvent event, Path file, Snapshot snapshot) {
    }

    private record Snapshot(long size, long modifiedMillis) {

        private static final Snapshot NONE = new Snapshot(-1, -1);

        static Snapshot of(Path file) {
            if (file == null) {
                return NONE;
            }
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                if (attrs.isDirectory()) {
                    return NONE;
                }
                return new Snapshot(attrs.size(), attrs.lastModifiedTime().toMillis());
            } catch (IOException e) {
                return NONE;
            }
        }
    }
}
