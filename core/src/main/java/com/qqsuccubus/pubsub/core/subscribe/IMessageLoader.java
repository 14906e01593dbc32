package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.model.Message;
import reactor.core.publisher.Flux;

/**
 * Read access to messages persisted by the publisher (Dependency Inversion Principle).
 * <p>
 * Enables testing with in-memory implementations.
 * </p>
 */
public interface IMessageLoader {
    /**
     * Loads stored messages of a channel whose ids fall into {@code [fromId, toId]}.
     * <p>
     * The returned Flux is cold: nothing is queried until it is subscribed, and each
     * subscription queries the store again. Messages come in ascending id order; ids
     * that expired or were never written are skipped without an error.
     * </p>
     *
     * @param channel Channel name
     * @param fromId  First id, inclusive
     * @param toId    Last id, inclusive
     * @return Flux of stored messages
     */
    Flux<Message> getMessages(String channel, long fromId, long toId);

    /**
     * Loads every stored message from {@code fromId} to the newest one.
     */
    default Flux<Message> getMessages(String channel, long fromId) {
        return getMessages(channel, fromId, Long.MAX_VALUE);
    }
}
