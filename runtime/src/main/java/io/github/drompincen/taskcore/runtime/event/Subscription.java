package io.github.drompincen.taskcore.runtime.event;

import io.github.drompincen.taskcore.protocol.event.DomainEvent;
import io.github.drompincen.taskcore.protocol.event.StreamMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One long-lived client feed. Messages accepted by {@link #offer} sit in a bounded buffer and
 * are drained to the push sink on the dispatcher, with at most one drain running at a time, so
 * the sink sees them in offer order.
 */
public class Subscription {

    private static final Logger log = LoggerFactory.getLogger(Subscription.class);

    private final String id;
    private final SubscriptionFilter filter;
    private final long resumeCursor;
    private final BlockingQueue<StreamMessage> buffer;
    private final PushSink sink;
    private final Executor dispatcher;
    private final Consumer<Subscription> onClose;
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    Subscription(String id, SubscriptionFilter filter, long resumeCursor, int bufferSize,
                 PushSink sink, Executor dispatcher, Consumer<Subscription> onClose) {
        this.id = id;
        this.filter = filter;
        this.resumeCursor = Math.max(0L, resumeCursor);
        this.buffer = new ArrayBlockingQueue<>(bufferSize);
        this.sink = sink;
        this.dispatcher = dispatcher;
        this.onClose = onClose;
    }

    public boolean shouldDeliver(DomainEvent event) {
        return event.eventId() > resumeCursor && filter.test(event);
    }

    /** Queues a message without blocking; false when the buffer is full. */
    boolean offer(StreamMessage message) {
        if (closed.get()) {
            return true;
        }
        if (!buffer.offer(message)) {
            return false;
        }
        scheduleDrain();
        return true;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            dispatcher.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Dispatcher rejected drain for subscription {}; messages stay buffered", id, e);
        }
    }

    private void drain() {
        try {
            StreamMessage message;
            while (!closed.get() && (message = buffer.poll()) != null) {
                if (!deliver(message)) {
                    close();
                    return;
                }
            }
        } finally {
            draining.set(false);
        }
        // an offer may have landed between the last poll and the flag reset
        if (!closed.get() && !buffer.isEmpty()) {
            scheduleDrain();
        }
    }

    private boolean deliver(StreamMessage message) {
        try {
            return sink.deliver(message);
        } catch (Exception e) {
            log.warn("Push sink of subscription {} failed: {}", id, e.getMessage());
            return false;
        }
    }

    /** Removes the subscription from its bus and closes the sink. Idempotent. */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        buffer.clear();
        onClose.accept(this);
        try {
            sink.close();
        } catch (RuntimeException e) {
            log.debug("Closing push sink of subscription {} failed", id, e);
        }
    }

    public boolean isClosed() { return closed.get(); }
    public String getId() { return id; }
    public SubscriptionFilter getFilter() { return filter; }
    public long getResumeCursor() { return resumeCursor; }
    public int getBuffered() { return buffer.size(); }
}
