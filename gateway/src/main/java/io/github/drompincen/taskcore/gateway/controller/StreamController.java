package io.github.drompincen.taskcore.gateway.controller;

import io.github.drompincen.taskcore.gateway.config.TaskCoreProperties;
import io.github.drompincen.taskcore.gateway.stream.SsePushSink;
import io.github.drompincen.taskcore.protocol.api.StreamStatusDto;
import io.github.drompincen.taskcore.protocol.event.EventCategory;
import io.github.drompincen.taskcore.runtime.event.EventBus;
import io.github.drompincen.taskcore.runtime.event.Subscription;
import io.github.drompincen.taskcore.runtime.event.SubscriptionFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Server-sent event feeds. Reconnecting clients send {@code Last-Event-ID} and only receive
 * events with a higher id.
 */
@RestController
@RequestMapping("/api/v1/stream")
public class StreamController {

    private static final Logger log = LoggerFactory.getLogger(StreamController.class);
    static final String LAST_EVENT_ID = "Last-Event-ID";

    private final EventBus eventBus;
    private final TaskCoreProperties properties;

    public StreamController(EventBus eventBus, TaskCoreProperties properties) {
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @GetMapping(path = "/board", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter board(@RequestParam(required = false) String listKeys,
                            @RequestHeader(value = LAST_EVENT_ID, required = false) String lastEventId) {
        return open(SubscriptionFilter.boardLists(SubscriptionFilter.splitCsv(listKeys)), lastEventId);
    }

    @GetMapping(path = "/timeline", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter timeline(@RequestParam(required = false) String taskIds,
                               @RequestHeader(value = LAST_EVENT_ID, required = false) String lastEventId) {
        return open(SubscriptionFilter.timelineTasks(SubscriptionFilter.splitCsv(taskIds)), lastEventId);
    }

    @GetMapping(path = "/tasks", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter tasks(@RequestHeader(value = LAST_EVENT_ID, required = false) String lastEventId) {
        return open(SubscriptionFilter.category(EventCategory.TASK), lastEventId);
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestHeader(value = LAST_EVENT_ID, required = false) String lastEventId) {
        return open(SubscriptionFilter.all(), lastEventId);
    }

    @GetMapping("/status")
    public ResponseEntity<StreamStatusDto> status() {
        return ResponseEntity.ok(new StreamStatusDto(eventBus.currentEventId(), eventBus.subscriptionCount()));
    }

    private SseEmitter open(SubscriptionFilter filter, String lastEventId) {
        SseEmitter emitter = new SseEmitter(properties.stream().sseTimeoutMs());
        Subscription subscription = eventBus.subscribe(filter, parseCursor(lastEventId), new SsePushSink(emitter));
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());
        return emitter;
    }

    /** Missing, negative or unparseable ids mean "from now". */
    static long parseCursor(String lastEventId) {
        if (lastEventId == null || lastEventId.isBlank()) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(lastEventId.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable {} header '{}'", LAST_EVENT_ID, lastEventId);
            return 0L;
        }
    }
}
