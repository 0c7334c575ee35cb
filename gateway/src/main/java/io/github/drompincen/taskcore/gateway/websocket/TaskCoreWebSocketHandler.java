package io.github.drompincen.taskcore.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.taskcore.protocol.ws.WsMessage;
import io.github.drompincen.taskcore.protocol.ws.WsMessageType;
import io.github.drompincen.taskcore.runtime.event.EventBus;
import io.github.drompincen.taskcore.runtime.event.Subscription;
import io.github.drompincen.taskcore.runtime.event.SubscriptionFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Websocket access to the event stream. A connection may hold several subscriptions, each
 * opened with {@code SUBSCRIBE} ({@code category}, {@code listKeys}, {@code taskIds},
 * {@code lastEventId}) and closed with {@code UNSUBSCRIBE} or by disconnecting.
 */
@Component
public class TaskCoreWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TaskCoreWebSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final EventBus eventBus;
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Subscription>> subscriptionsBySession = new ConcurrentHashMap<>();

    public TaskCoreWebSocketHandler(ObjectMapper objectMapper, EventBus eventBus) {
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        concurrent(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        Map<String, Subscription> subscriptions = subscriptionsBySession.remove(session.getId());
        if (subscriptions != null) {
            subscriptions.values().forEach(Subscription::close);
            log.info("Websocket {} closed ({}), dropped {} subscriptions", session.getId(), status, subscriptions.size());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        if (!session.isOpen()) {
            log.debug("Ignoring message on closed websocket {}", session.getId());
            return;
        }
        WebSocketSession out = concurrent(session);
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (IOException e) {
            send(out, WsMessage.error(null, errorPayload("Malformed message")));
            return;
        }
        String type = node.path("type").asText();
        if (WsMessageType.SUBSCRIBE.name().equals(type)) {
            subscribe(out, node);
        } else if (WsMessageType.UNSUBSCRIBE.name().equals(type)) {
            unsubscribe(out, node.path("subscriptionId").asText(null));
        } else {
            send(out, WsMessage.error(null, errorPayload("Unsupported message type: " + type)));
        }
    }

    private void subscribe(WebSocketSession session, JsonNode node) throws IOException {
        SubscriptionFilter filter = SubscriptionFilter.parse(
                node.path("category").asText(null), strings(node.path("listKeys")), strings(node.path("taskIds")));
        long cursor = Math.max(0L, node.path("lastEventId").asLong(0L));

        String subscriptionId = UUID.randomUUID().toString();
        ObjectNode ack = objectMapper.createObjectNode();
        ack.put("filter", filter.toString());
        ack.put("lastEventId", cursor);
        ack.put("currentEventId", eventBus.currentEventId());
        // ack goes out before the subscription can produce its first event
        send(session, WsMessage.of(WsMessageType.SUBSCRIBED, subscriptionId, ack));

        Subscription subscription = eventBus.subscribe(subscriptionId, filter, cursor,
                new WebSocketPushSink(session, subscriptionId, objectMapper));
        Map<String, Subscription> owned = subscriptionsBySession.computeIfAbsent(session.getId(),
                k -> new ConcurrentHashMap<>());
        owned.put(subscriptionId, subscription);
        if (!session.isOpen()) {
            // close ran while subscribing and may have missed this registration
            discard(session.getId(), owned, subscription);
        }
    }

    private void discard(String sessionId, Map<String, Subscription> owned, Subscription subscription) {
        owned.remove(subscription.getId());
        subscription.close();
        subscriptionsBySession.computeIfPresent(sessionId, (id, current) -> current.isEmpty() ? null : current);
        sessions.remove(sessionId);
        log.info("Websocket {} closed during subscribe, dropped subscription {}", sessionId, subscription.getId());
    }

    private void unsubscribe(WebSocketSession session, String subscriptionId) throws IOException {
        Map<String, Subscription> owned = subscriptionsBySession.get(session.getId());
        Subscription subscription = owned == null || subscriptionId == null ? null : owned.remove(subscriptionId);
        if (subscription == null) {
            send(session, WsMessage.error(subscriptionId, errorPayload("Unknown subscription")));
            return;
        }
        eventBus.unsubscribe(subscription.getId());
        send(session, WsMessage.of(WsMessageType.UNSUBSCRIBED, subscriptionId, null));
    }

    int subscriptionCount(String sessionId) {
        Map<String, Subscription> owned = subscriptionsBySession.get(sessionId);
        return owned == null ? 0 : owned.size();
    }

    private WebSocketSession concurrent(WebSocketSession session) {
        return sessions.computeIfAbsent(session.getId(),
                id -> new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES));
    }

    private void send(WebSocketSession session, WsMessage message) throws IOException {
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
    }

    private JsonNode errorPayload(String message) {
        return objectMapper.createObjectNode().put("message", message);
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(v -> values.add(v.asText()));
        } else if (array.isTextual()) {
            values.addAll(SubscriptionFilter.splitCsv(array.asText()));
        }
        return values;
    }
}
