package com.qqsuccubus.pubsub.core.subscribe;

import reactor.core.Disposable;

import java.util.function.Consumer;

/**
 * Raw pub/sub transport underneath the reliable subscriber.
 * <p>
 * Implementations deliver the payloads of one channel sequentially and in arrival order.
 * An exception thrown by the consumer belongs to the transport's delivery loop.
 * </p>
 */
public interface IPubSubTransport {
    /**
     * Opens a subscription.
     *
     * @param channel     Channel name (no patterns)
     * @param rawMessages Receives each raw payload
     * @return Handle that closes the subscription when disposed
     */
    Disposable subscribe(String channel, Consumer<String> rawMessages);
}
