package com.qqsuccubus.pubsub.core.subscribe;

@FunctionalInterface
public interface MessagesCountAction {
    void accept(String channel, long messagesCount);
}
