package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.model.Message;

@FunctionalInterface
public interface MessageAction {
    void accept(String channel, Message message);
}
