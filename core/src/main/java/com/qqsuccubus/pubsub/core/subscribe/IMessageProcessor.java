package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.model.Message;

/**
 * Entry point for messages delivered live by the transport.
 */
public interface IMessageProcessor {
    void processMessage(Message message);
}
