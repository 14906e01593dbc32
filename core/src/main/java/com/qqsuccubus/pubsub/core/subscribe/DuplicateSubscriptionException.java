package com.qqsuccubus.pubsub.core.subscribe;

/**
 * Thrown when a handler is subscribed to a channel that already has one.
 */
public class DuplicateSubscriptionException extends IllegalStateException {

    private final String channel;

    public DuplicateSubscriptionException(String channel) {
        super("There already exists a handler subscribed to channel '" + channel + "'");
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
