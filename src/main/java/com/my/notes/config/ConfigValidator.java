package com.my.notes.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        validate(LaunchMode.current() == LaunchMode.NORMAL);
    }

    /**
     * isProd 가 true 면 첫 위반에서 {@link IllegalStateException}, 아니면 경고만 남긴다.
     */
    void validate(boolean isProd) {
        validateExtension(appConfig.store().noteExtension(), isProd);
        validateRoot(appConfig.store().rootPath(), isProd);
        validatePositive("app.watcher.stability-millis", appConfig.watcher().stabilityMillis(), isProd);
        validatePositive("app.watcher.poll-millis", appConfig.watcher().pollMillis(), isProd);
        validateZone(appConfig.clock().timezone(), isProd);
    }

    private void validateExtension(String extension, boolean strict) {
        if (extension == null || extension.length() < 2 || !extension.startsWith(".") || extension.contains("/")) {
            fail("노트 확장자 형식이 올바르지 않습니다: app.store.note-extension=" + extension, strict);
        }
    }

    private void validateRoot(String rootPath, boolean strict) {
        if (rootPath == null || rootPath.isBlank()) {
            fail("필수 설정이 비어 있습니다: app.store.root-path", strict);
            return;
        }
        Path resolved = Path.of(rootPath);
        if (Files.exists(resolved) && !Files.isDirectory(resolved)) {
            fail("노트 루트가 디렉터리가 아닙니다: " + rootPath, strict);
        } else if (!Files.exists(resolved)) {
            // 저장소가 첫 사용 시 만든다.
            log.infof("노트 루트가 아직 없습니다. 첫 사용 시 생성합니다: %s", resolved.toAbsolutePath());
        }
    }

    private void validatePositive(String name, long value, boolean strict) {
        if (value <= 0) {
            fail("0보다 커야 합니다: " + name + "=" + value, strict);
        }
    }

    private void validateZone(String zone, boolean strict) {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            fail("알 수 없는 시간대입니다: app.clock.timezone=" + zone, strict);
        }
    }

    private void fail(String message, boolean strict) {
        if (strict) {
            throw new IllegalStateException(message);
        }
        log.warn(message);
    }
}
