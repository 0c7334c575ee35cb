package io.github.drompincen.taskcore.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String subscriptionId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String subscriptionId, JsonNode payload) {
        return new WsMessage(type, subscriptionId, payload, Instant.now());
    }

    public static WsMessage error(String subscriptionId, JsonNode payload) {
        return of(WsMessageType.ERROR, subscriptionId, payload);
    }
}
