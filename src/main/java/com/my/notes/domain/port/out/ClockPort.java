package com.my.notes.domain.port.out;

import java.time.OffsetDateTime;

/**
 * 왜: 현재 시간을 주입형으로 분리하여 제목 노트의 id 와 헤더 날짜를 테스트에서 고정할 수 있게 하기 위함.
 */
public interface ClockPort {

    OffsetDateTime now();
}
