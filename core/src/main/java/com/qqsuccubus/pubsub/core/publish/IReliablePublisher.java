package com.qqsuccubus.pubsub.core.publish;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Publishes sequenced messages that stay recoverable for a limited time.
 * <p>
 * Each publish assigns the next id of the channel, stores the content under that id with
 * the given TTL and broadcasts {@code <id>:<content>} to the channel, all in one atomic
 * server-side step. Nothing is retried here; retries are up to the caller.
 * </p>
 */
public interface IReliablePublisher {

    /**
     * Publishes a message and waits for its id.
     *
     * @param channel Channel name
     * @param content Message content
     * @param ttl     How long the message stays recoverable (at least one second)
     * @return Assigned message id
     */
    long publish(String channel, String content, Duration ttl);

    /**
     * Publishes a message with the default TTL.
     */
    long publish(String channel, String content);

    /**
     * Non-blocking variant of {@link #publish(String, String, Duration)}.
     *
     * @return Mono emitting the assigned message id
     */
    Mono<Long> publishAsync(String channel, String content, Duration ttl);

    /**
     * Non-blocking publish with the default TTL.
     */
    Mono<Long> publishAsync(String channel, String content);
}
