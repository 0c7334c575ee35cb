package io.github.drompincen.taskcore.runtime.event;

import io.github.drompincen.taskcore.protocol.event.DomainEvent;
import io.github.drompincen.taskcore.protocol.event.StreamMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Fan-out point for domain events. Stamping and offering happen under one lock, so every
 * subscription sees events in id order. Offering never blocks: a full subscription buffer
 * drops the event for that subscription only.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final SequenceGenerator sequenceGenerator;
    private final Executor dispatcher;
    private final int bufferSize;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final Object publishLock = new Object();

    public EventBus(SequenceGenerator sequenceGenerator,
                    @Qualifier("streamDispatcher") Executor dispatcher,
                    @Value("${taskcore.stream.buffer-size:256}") int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("taskcore.stream.buffer-size must be positive: " + bufferSize);
        }
        this.sequenceGenerator = sequenceGenerator;
        this.dispatcher = dispatcher;
        this.bufferSize = bufferSize;
    }

    /**
     * Stamps the event with the next sequence number and offers it to every matching
     * subscription.
     *
     * @return the stamped event
     */
    public DomainEvent publish(DomainEvent event) {
        if (event.isStamped()) {
            throw new IllegalArgumentException("Event already stamped with id " + event.eventId());
        }
        DomainEvent stamped;
        synchronized (publishLock) {
            stamped = event.withEventId(sequenceGenerator.nextId());
            StreamMessage message = StreamMessage.event(stamped);
            for (Subscription subscription : subscriptions.values()) {
                if (subscription.shouldDeliver(stamped) && !subscription.offer(message)) {
                    log.warn("Delivery failure: dropped event {} ({}) for subscription {}, buffer full",
                            stamped.eventId(), stamped.type(), subscription.getId());
                }
            }
        }
        log.debug("Published event {} {}", stamped.eventId(), stamped.type());
        return stamped;
    }

    public Subscription subscribe(SubscriptionFilter filter, long resumeCursor, PushSink sink) {
        return subscribe(UUID.randomUUID().toString(), filter, resumeCursor, sink);
    }

    /** Registers a subscription under a caller-chosen id, which must be unique. */
    public Subscription subscribe(String id, SubscriptionFilter filter, long resumeCursor, PushSink sink) {
        Subscription subscription = new Subscription(id, filter, resumeCursor, bufferSize, sink, dispatcher,
                s -> subscriptions.remove(s.getId(), s));
        if (subscriptions.putIfAbsent(id, subscription) != null) {
            throw new IllegalArgumentException("Duplicate subscription id " + id);
        }
        log.info("Subscription {} opened: {} resumeCursor={}", id, filter, subscription.getResumeCursor());
        return subscription;
    }

    public boolean unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            return false;
        }
        subscription.close();
        log.info("Subscription {} closed", subscriptionId);
        return true;
    }

    /** Queues a liveness signal on every subscription, ignoring filters and cursors. */
    public void heartbeat() {
        StreamMessage heartbeat = StreamMessage.heartbeat();
        for (Subscription subscription : subscriptions.values()) {
            if (!subscription.offer(heartbeat)) {
                log.debug("Skipped heartbeat for busy subscription {}", subscription.getId());
            }
        }
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public Collection<Subscription> getSubscriptions() {
        return subscriptions.values();
    }

    public long currentEventId() {
        return sequenceGenerator.currentId();
    }
}
