package com.my.notes.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    StoreConfig store();

    WatcherConfig watcher();

    ClockConfig clock();

    interface StoreConfig {
        @WithName("root-path")
        @WithDefault("./data/notes")
        String rootPath();

        @WithName("note-extension")
        @WithDefault(".md")
        String noteExtension();

        @WithName("ignore-hidden")
        @WithDefault("true")
        boolean ignoreHidden();
    }

    interface WatcherConfig {
        @WithDefault("true")
        boolean enabled();

        /**
         * 마지막 이벤트 이후 이 시간 동안 크기/수정 시각 변화가 없어야 변경 묶음을 내보낸다.
         */
        @WithName("stability-millis")
        @WithDefault("1500")
        long stabilityMillis();

        @WithName("poll-millis")
        @WithDefault("500")
        long pollMillis();
    }

    interface ClockConfig {
        @WithDefault("Asia/Seoul")
        String timezone();
    }
}
