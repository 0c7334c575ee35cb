package io.github.drompincen.taskcore.protocol.event;

/**
 * Unit handed to a push sink: either a stamped event or a liveness signal. Heartbeats carry
 * no event and bypass filtering and resume checks.
 */
public record StreamMessage(Kind kind, DomainEvent event) {

    public enum Kind {
        EVENT,
        HEARTBEAT
    }

    private static final StreamMessage HEARTBEAT = new StreamMessage(Kind.HEARTBEAT, null);

    public static StreamMessage event(DomainEvent event) {
        return new StreamMessage(Kind.EVENT, event);
    }

    public static StreamMessage heartbeat() {
        return HEARTBEAT;
    }

    public boolean isHeartbeat() {
        return kind == Kind.HEARTBEAT;
    }
}
