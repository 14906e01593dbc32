package com.qqsuccubus.pubsub.core.subscribe;

import java.time.Instant;

/**
 * Health handle of one subscribed channel, returned by
 * {@link IReliableSubscriber#subscribe(String, IMessageHandler)}.
 */
public interface IMessageDeliveryChecker {
    /**
     * Name of the checked channel.
     */
    String getChannel();

    /**
     * Fetches stored messages newer than the last processed id and runs them through the
     * regular processing path. Safe to call at any time, e.g. on a timer or after a reconnect.
     *
     * @return What was found
     */
    MissedMessagesReport checkForMissedMessages();

    /**
     * When a message was last processed, live or by a check. {@link Instant#EPOCH} before that.
     */
    Instant getLastActivityAt();
}
