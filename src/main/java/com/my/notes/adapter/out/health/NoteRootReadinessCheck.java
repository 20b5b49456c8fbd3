package com.my.notes.adapter.out.health;

import com.my.notes.config.AppConfig;
import com.my.notes.domain.port.in.WatchNotesUseCase;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

@Readiness
@ApplicationScoped
public class NoteRootReadinessCheck implements HealthCheck {

    private final AppConfig appConfig;
    private final WatchNotesUseCase watchNotesUseCase;

    public NoteRootReadinessCheck(AppConfig appConfig, WatchNotesUseCase watchNotesUseCase) {
        this.appConfig = appConfig;
        this.watchNotesUseCase = watchNotesUseCase;
    }

    @Override
    public HealthCheckResponse call() {
        Path root = Path.of(appConfig.store().rootPath());
        boolean rootOk = Files.isDirectory(root);
        boolean writable = rootOk && Files.isWritable(root);
        boolean watcherExpected = appConfig.watcher().enabled();
        boolean watching = watchNotesUseCase.isWatching();
        return HealthCheckResponse.named("note-store-readiness")
                .withData("rootPath", root.toAbsolutePath().toString())
                .withData("rootExists", rootOk)
                .withData("rootWritable", writable)
                .withData("watching", watching)
                .status(rootOk && writable && (!watcherExpected || watching))
                .build();
    }
}
