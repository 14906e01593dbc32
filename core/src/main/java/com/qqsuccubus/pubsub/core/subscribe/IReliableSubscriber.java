package com.qqsuccubus.pubsub.core.subscribe;

import java.util.Optional;
import java.util.Set;

/**
 * Subscriber that detects duplicates and gaps and backfills gaps from the message store.
 */
public interface IReliableSubscriber {
    /**
     * Subscribes a handler to a channel.
     *
     * @return Checker for polling missed messages and activity of the channel
     * @throws DuplicateSubscriptionException if the channel already has a handler
     * @throws UnsupportedOperationException  if the channel name is a pattern
     */
    IMessageDeliveryChecker subscribe(String channel, IMessageHandler handler);

    /**
     * Stops delivery for a channel. Does nothing when the channel is not subscribed.
     */
    void unsubscribe(String channel);

    void unsubscribeAll();

    /**
     * Checker of a subscribed channel, empty when the channel is not subscribed.
     */
    Optional<IMessageDeliveryChecker> getDeliveryChecker(String channel);

    Set<String> getSubscribedChannels();
}
