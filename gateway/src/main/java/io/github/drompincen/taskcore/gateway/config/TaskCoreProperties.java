package io.github.drompincen.taskcore.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * The {@code taskcore} block of application.yml.
 *
 * @param stream push-stream tuning
 * @param mongo  persistence switches
 */
@ConfigurationProperties(prefix = "taskcore")
public record TaskCoreProperties(@DefaultValue Stream stream, @DefaultValue Mongo mongo) {

    /**
     * @param heartbeatIntervalMs interval of the liveness signal sent on every subscription
     * @param bufferSize          per-subscription buffer; events beyond it are dropped for that subscriber
     * @param sseTimeoutMs        SSE connection timeout, 0 for none
     */
    public record Stream(@DefaultValue("15000") long heartbeatIntervalMs,
                         @DefaultValue("256") int bufferSize,
                         @DefaultValue("0") long sseTimeoutMs) {}

    /** @param transactions wrap each command in a Mongo multi-document transaction (needs a replica set) */
    public record Mongo(@DefaultValue("false") boolean transactions) {}
}
