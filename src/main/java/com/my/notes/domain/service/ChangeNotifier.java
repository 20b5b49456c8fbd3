package com.my.notes.domain.service;

import com.my.notes.domain.model.ChangeEvent;
import com.my.notes.domain.port.in.NoteChangeListener;
import com.my.notes.domain.port.in.Subscription;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 왜: 감시자에서 올라온 변경 묶음을 모든 구독자에게 나눠 주되, 한 구독자의 실패가 다른 구독자에게 번지지 않게 하기 위함.
 */
public class ChangeNotifier {

    private static final Logger log = Logger.getLogger(ChangeNotifier.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public Subscription subscribe(NoteChangeListener listener) {
        Objects.requireNonNull(listener, "listener");
        Registration registration = new Registration(listener);
        registrations.add(registration);
        return registration;
    }

    public void publish(List<ChangeEvent> changes) {
        if (changes.isEmpty()) {
            return;
        }
        log.debugf("변경 알림 %d건을 구독자 %d명에게 전달합니다.", changes.size(), registrations.size());
        for (Registration registration : registrations) {
            try {
                registration.listener.onChange(changes);
            } catch (RuntimeException e) {
                log.warnf(e, "변경 구독자 처리 중 예외: %s", e.getMessage());
            }
        }
    }

    public int subscriberCount() {
        return registrations.size();
    }

    private final class Registration implements Subscription {

        private final NoteChangeListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(NoteChangeListener listener) {
            this.listener = listener;
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                registrations.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
