package io.github.drompincen.taskcore.runtime.event;

import io.github.drompincen.taskcore.protocol.event.StreamMessage;

/**
 * Transport end of one subscription. Returning false or throwing tears the subscription down.
 */
public interface PushSink {

    boolean deliver(StreamMessage message) throws Exception;

    /** Called once when the subscription is removed. */
    default void close() {}
}
