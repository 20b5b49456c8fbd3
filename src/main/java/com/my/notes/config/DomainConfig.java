package com.my.notes.config;

import com.my.notes.adapter.out.clock.OffsetClockAdapter;
import com.my.notes.domain.port.out.ChangeWatchPort;
import com.my.notes.domain.port.out.ClockPort;
import com.my.notes.domain.port.out.NoteStoragePort;
import com.my.notes.domain.service.NoteStoreService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public NoteStoreService noteStoreService(NoteStoragePort noteStoragePort,
                                             ChangeWatchPort changeWatchPort,
                                             ClockPort clockPort) {
        return new NoteStoreService(noteStoragePort, changeWatchPort, clockPort);
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.system(appConfig.clock().timezone());
    }
}
