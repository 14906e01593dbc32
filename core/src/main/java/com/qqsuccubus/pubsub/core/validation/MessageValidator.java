package com.qqsuccubus.pubsub.core.validation;

import com.qqsuccubus.pubsub.core.model.Message;

/**
 * Watermark-based {@link IMessageValidator}.
 * <p>
 * The watermark starts at 0 ("not synchronized"), so the first message is always accepted
 * and seeds it. Afterwards:
 * <ul>
 *   <li>{@code id <= watermark}: {@link ValidationResult.Outcome#DUPLICATE}</li>
 *   <li>{@code id == watermark + 1}: {@link ValidationResult.Outcome#SUCCESS}</li>
 *   <li>{@code id > watermark + 1}: {@link ValidationResult.Outcome#MISSING_MESSAGES}</li>
 * </ul>
 * </p>
 */
public class MessageValidator implements IMessageValidator {

    private long lastMessageId;

    @Override
    public ValidationResult validate(Message message) {
        long previousMessageId = lastMessageId;
        if (previousMessageId < message.getId()) {
            lastMessageId = message.getId();
        }

        if (previousMessageId == 0) {
            return ValidationResult.success();
        }

        if (previousMessageId >= message.getId()) {
            return ValidationResult.duplicate();
        }

        if (previousMessageId + 1 < message.getId()) {
            return ValidationResult.missingMessages(previousMessageId);
        }

        return ValidationResult.success();
    }

    @Override
    public long getLastMessageId() {
        return lastMessageId;
    }
}
