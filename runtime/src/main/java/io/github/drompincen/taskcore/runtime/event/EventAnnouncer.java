package io.github.drompincen.taskcore.runtime.event;

import io.github.drompincen.taskcore.protocol.event.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Publishes events on behalf of commands. Runs after persistence; a failure here is logged and
 * never undoes the stored change.
 */
@Component
public class EventAnnouncer {

    private static final Logger log = LoggerFactory.getLogger(EventAnnouncer.class);

    private final EventBus eventBus;

    public EventAnnouncer(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public void announce(DomainEvent event) {
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} for task {}", event.type(), event.taskId(), e);
        }
    }
}
