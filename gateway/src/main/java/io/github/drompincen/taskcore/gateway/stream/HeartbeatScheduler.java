package io.github.drompincen.taskcore.gateway.stream;

import io.github.drompincen.taskcore.runtime.event.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class HeartbeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

    private final EventBus eventBus;

    public HeartbeatScheduler(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Scheduled(fixedDelayString = "${taskcore.stream.heartbeat-interval-ms:15000}",
            initialDelayString = "${taskcore.stream.heartbeat-interval-ms:15000}")
    public void beat() {
        int subscriptions = eventBus.subscriptionCount();
        if (subscriptions == 0) {
            return;
        }
        eventBus.heartbeat();
        log.trace("Heartbeat queued for {} subscriptions", subscriptions);
    }
}
