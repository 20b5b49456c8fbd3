package com.my.notes.adapter.in.watch;

import com.my.notes.config.AppConfig;
import com.my.notes.domain.model.ChangeEvent;
import com.my.notes.domain.model.ChangeKind;
import com.my.notes.domain.port.in.Subscription;
import com.my.notes.domain.port.in.WatchNotesUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * 왜: 애플리케이션 수명에 맞춰 저장소의 감시자를 켜고 끄며, 감시 실패를 로그로 드러내기 위함.
 */
@Startup
@ApplicationScoped
public class NoteWatchLifecycle {

    private static final Logger log = Logger.getLogger(NoteWatchLifecycle.class);

    private final WatchNotesUseCase watchNotesUseCase;
    private final boolean enabled;
    private Subscription failureLog;

    @Inject
    public NoteWatchLifecycle(WatchNotesUseCase watchNotesUseCase, AppConfig appConfig) {
        this.watchNotesUseCase = watchNotesUseCase;
        this.enabled = appConfig.watcher().enabled();
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("노트 감시가 꺼져 있습니다 (app.watcher.enabled=false).");
            return;
        }
        failureLog = watchNotesUseCase.onChange(this::logFailures);
        watchNotesUseCase.startWatching();
    }

    void logFailures(List<ChangeEvent> changes) {
        for (ChangeEvent change : changes) {
            if (change.kind() == ChangeKind.WATCH_FAILED) {
                log.warnf("노트 감시 실패: path=%s, detail=%s", change.path(), change.detail());
            } else if (change.kind() == ChangeKind.OVERFLOW) {
                log.infof("감시 이벤트가 넘쳐 전체 재스캔이 필요합니다: %s", change.path());
            }
        }
    }

    @PreDestroy
    void stop() {
        if (failureLog != null) {
            failureLog.cancel();
        }
        watchNotesUseCase.stopWatching();
    }
}
