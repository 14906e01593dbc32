package com.qqsuccubus.pubsub.core.subscribe;

import lombok.Value;

/**
 * Outcome of {@link IMessageDeliveryChecker#checkForMissedMessages()}.
 * <p>
 * {@code firstMessageId} and {@code lastMessageId} are 0 when nothing was found.
 * </p>
 */
@Value
public class MissedMessagesReport {
    String channel;
    int messagesCount;
    long firstMessageId;
    long lastMessageId;

    public static MissedMessagesReport none(String channel) {
        return new MissedMessagesReport(channel, 0, 0, 0);
    }

    public boolean hasMissedMessages() {
        return messagesCount > 0;
    }
}
