package io.github.drompincen.taskcore.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE,
    UNSUBSCRIBE,

    // Server -> Client
    EVENT,
    HEARTBEAT,
    ERROR,
    SUBSCRIBED,
    UNSUBSCRIBED
}
