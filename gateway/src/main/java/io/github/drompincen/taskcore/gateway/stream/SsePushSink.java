package io.github.drompincen.taskcore.gateway.stream;

import io.github.drompincen.taskcore.protocol.event.DomainEvent;
import io.github.drompincen.taskcore.protocol.event.StreamMessage;
import io.github.drompincen.taskcore.runtime.event.PushSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Writes stream messages as server-sent events: {@code id} is the event id, {@code event} the
 * event type and {@code data} the JSON event. Heartbeats go out as comments.
 */
public class SsePushSink implements PushSink {

    private static final Logger log = LoggerFactory.getLogger(SsePushSink.class);

    static final String HEARTBEAT_COMMENT = "heartbeat";

    private final SseEmitter emitter;

    public SsePushSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public boolean deliver(StreamMessage message) throws IOException {
        if (message.isHeartbeat()) {
            emitter.send(SseEmitter.event().comment(HEARTBEAT_COMMENT));
            return true;
        }
        DomainEvent event = message.event();
        emitter.send(SseEmitter.event()
                .id(String.valueOf(event.eventId()))
                .name(event.type().name())
                .data(event, MediaType.APPLICATION_JSON));
        return true;
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("SSE emitter already completed", e);
        }
    }
}
