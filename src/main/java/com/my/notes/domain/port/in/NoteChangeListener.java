package com.my.notes.domain.port.in;

import com.my.notes.domain.model.ChangeEvent;

import java.util.List;

/**
 * 변경 묶음을 받는 콜백. 받은 쪽은 보통 전체 재스캔을 한다.
 */
@FunctionalInterface
public interface NoteChangeListener {
    void onChange(List<ChangeEvent> changes);
}
