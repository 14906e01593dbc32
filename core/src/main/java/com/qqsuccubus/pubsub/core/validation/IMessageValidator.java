package com.qqsuccubus.pubsub.core.validation;

import com.qqsuccubus.pubsub.core.model.Message;

/**
 * Ordering state machine of one channel.
 * <p>
 * Implementations are not required to be thread-safe; callers serialize access.
 * </p>
 */
public interface IMessageValidator {
    /**
     * Classifies a message and moves the watermark to {@code max(watermark, message.id)}.
     */
    ValidationResult validate(Message message);

    /**
     * Highest id observed so far, 0 before the first message.
     */
    long getLastMessageId();
}
