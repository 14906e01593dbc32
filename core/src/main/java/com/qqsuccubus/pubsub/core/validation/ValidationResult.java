package com.qqsuccubus.pubsub.core.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Classification of an incoming message against the channel watermark.
 * <p>
 * {@link Outcome#MISSING_MESSAGES} carries the id of the last message processed before
 * the gap; the other outcomes carry no payload.
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    public enum Outcome {
        /**
         * Next expected id, or the first message this validator ever saw.
         */
        SUCCESS,
        /**
         * Id not above the watermark: already delivered or superseded.
         */
        DUPLICATE,
        /**
         * Id beyond {@code watermark + 1}: at least one message was skipped.
         */
        MISSING_MESSAGES
    }

    private static final ValidationResult SUCCESS = new ValidationResult(Outcome.SUCCESS, 0);
    private static final ValidationResult DUPLICATE = new ValidationResult(Outcome.DUPLICATE, 0);

    Outcome outcome;
    long lastProcessedId;

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult duplicate() {
        return DUPLICATE;
    }

    public static ValidationResult missingMessages(long lastProcessedId) {
        return new ValidationResult(Outcome.MISSING_MESSAGES, lastProcessedId);
    }

    /**
     * Number of ids strictly between the last processed message and {@code currentId}.
     */
    public long gapSize(long currentId) {
        return currentId - lastProcessedId - 1;
    }

    @Override
    public String toString() {
        return outcome == Outcome.MISSING_MESSAGES
            ? "MissingMessages:LastProcessedMessageId=" + lastProcessedId
            : outcome.name();
    }
}
