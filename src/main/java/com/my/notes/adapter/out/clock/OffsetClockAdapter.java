package com.my.notes.adapter.out.clock;

import com.my.notes.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 왜: 설정된 시간대로 현재 시각을 제공해 노트 헤더의 date 값이 어느 호스트에서나 같은 오프셋을 갖게 하기 위함.
 */
public class OffsetClockAdapter implements ClockPort {

    public static final String DEFAULT_TIMEZONE = "Asia/Seoul";

    private final ZoneId zoneId;

    private OffsetClockAdapter(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public static OffsetClockAdapter system() {
        return system(DEFAULT_TIMEZONE);
    }

    public static OffsetClockAdapter system(String timezone) {
        return new OffsetClockAdapter(ZoneId.of(timezone));
    }

    public ZoneId zone() {
        return zoneId;
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(zoneId);
    }
}
