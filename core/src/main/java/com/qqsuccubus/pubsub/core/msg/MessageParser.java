package com.qqsuccubus.pubsub.core.msg;

import com.qqsuccubus.pubsub.core.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Default {@link IMessageParser} for the {@code <id>:<content>} layout.
 * <p>
 * Malformed input is reported as an empty result and never as an exception.
 * Only lengths are logged, the payload itself stays out of the logs.
 * </p>
 */
public class MessageParser implements IMessageParser {
    private static final Logger log = LoggerFactory.getLogger(MessageParser.class);

    @Override
    public Optional<Message> tryParse(String raw) {
        if (raw == null) {
            log.warn("Message is null");
            return Optional.empty();
        }

        int separatorAt = raw.indexOf(WireFormat.SEPARATOR);
        if (separatorAt < 0) {
            log.warn("Message format should be 'messageId{}messageContent'. It contains 1 part (length={}).",
                WireFormat.SEPARATOR, raw.length());
            return Optional.empty();
        }

        String idPart = raw.substring(0, separatorAt);
        long id;
        try {
            id = Long.parseLong(idPart);
        } catch (NumberFormatException e) {
            log.warn("MessageId should be convertible to integer (messageId length={}).", idPart.length());
            return Optional.empty();
        }

        if (id < 0) {
            log.warn("MessageId should not be negative: {}", id);
            return Optional.empty();
        }

        return Optional.of(new Message(id, raw.substring(separatorAt + 1)));
    }
}
