package io.github.drompincen.taskcore.runtime.event;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide event counter. Not persisted, so ids restart at 1 after a restart and resume
 * cursors from an earlier process are meaningless.
 */
@Component
public class SequenceGenerator {

    private final AtomicLong counter = new AtomicLong();

    public long nextId() {
        return counter.incrementAndGet();
    }

    /** Latest issued id, 0 if none. */
    public long currentId() {
        return counter.get();
    }
}
