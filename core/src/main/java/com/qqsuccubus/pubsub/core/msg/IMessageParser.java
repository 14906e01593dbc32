package com.qqsuccubus.pubsub.core.msg;

import com.qqsuccubus.pubsub.core.model.Message;

import java.util.Optional;

/**
 * Decodes raw channel payloads into sequenced messages.
 */
public interface IMessageParser {
    /**
     * Parses a raw payload.
     *
     * @param raw Payload as delivered by the transport
     * @return Parsed message, or empty if the payload is not in {@link WireFormat}
     */
    Optional<Message> tryParse(String raw);
}
