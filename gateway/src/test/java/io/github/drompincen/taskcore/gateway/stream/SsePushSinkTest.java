package io.github.drompincen.taskcore.gateway.stream;

import io.github.drompincen.taskcore.protocol.api.BoardRowDto;
import io.github.drompincen.taskcore.protocol.event.DomainEvent;
import io.github.drompincen.taskcore.protocol.event.EventType;
import io.github.drompincen.taskcore.protocol.event.StreamMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SsePushSinkTest {

    @Mock private SseEmitter emitter;

    @Test
    void eventCarriesIdAndTypeName() throws Exception {
        SsePushSink sink = new SsePushSink(emitter);
        DomainEvent event = DomainEvent.of(EventType.BOARD_ROW_CREATED, new BoardRowDto("r1", "t1", "todo", 0, null))
                .withEventId(7);

        assertThat(sink.deliver(StreamMessage.event(event))).isTrue();

        String frame = frameOf(captureSent());
        assertThat(frame).contains("id:7").contains("event:BOARD_ROW_CREATED");
    }

    @Test
    void heartbeatIsAComment() throws Exception {
        SsePushSink sink = new SsePushSink(emitter);

        sink.deliver(StreamMessage.heartbeat());

        assertThat(frameOf(captureSent())).startsWith(":" + SsePushSink.HEARTBEAT_COMMENT);
    }

    @Test
    void sendFailurePropagates() throws Exception {
        doThrow(new IOException("broken pipe")).when(emitter).send(any(SseEmitter.SseEventBuilder.class));
        SsePushSink sink = new SsePushSink(emitter);

        assertThatThrownBy(() -> sink.deliver(StreamMessage.heartbeat())).isInstanceOf(IOException.class);
    }

    @Test
    void closeCompletesEmitter() {
        new SsePushSink(emitter).close();

        verify(emitter).complete();
    }

    private SseEmitter.SseEventBuilder captureSent() throws IOException {
        ArgumentCaptor<SseEmitter.SseEventBuilder> captor = ArgumentCaptor.forClass(SseEmitter.SseEventBuilder.class);
        verify(emitter).send(captor.capture());
        return captor.getValue();
    }

    private static String frameOf(SseEmitter.SseEventBuilder builder) {
        Set<ResponseBodyEmitter.DataWithMediaType> parts = builder.build();
        return parts.stream().map(p -> String.valueOf(p.getData())).collect(Collectors.joining());
    }
}
