package io.github.drompincen.taskcore.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskcore.protocol.event.StreamMessage;
import io.github.drompincen.taskcore.protocol.ws.WsMessage;
import io.github.drompincen.taskcore.protocol.ws.WsMessageType;
import io.github.drompincen.taskcore.runtime.event.PushSink;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/** Sends the messages of one subscription over a shared websocket session. */
class WebSocketPushSink implements PushSink {

    private final WebSocketSession session;
    private final String subscriptionId;
    private final ObjectMapper objectMapper;

    WebSocketPushSink(WebSocketSession session, String subscriptionId, ObjectMapper objectMapper) {
        this.session = session;
        this.subscriptionId = subscriptionId;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean deliver(StreamMessage message) throws IOException {
        if (!session.isOpen()) {
            return false;
        }
        WsMessage out = message.isHeartbeat()
                ? WsMessage.of(WsMessageType.HEARTBEAT, subscriptionId, null)
                : WsMessage.of(WsMessageType.EVENT, subscriptionId, objectMapper.valueToTree(message.event()));
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(out)));
        return true;
    }
}
