package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.metrics.DeliveryMetrics;
import com.qqsuccubus.pubsub.core.model.Message;
import com.qqsuccubus.pubsub.core.validation.IMessageValidator;
import com.qqsuccubus.pubsub.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Validates, recovers and delivers the messages of one channel.
 * <p>
 * <b>Locking:</b> live delivery ({@link #processMessage}) and polled recovery
 * ({@link #checkForMissedMessages}) share one lock. It covers validation, the recovery
 * fetch and the application callbacks, so the watermark never moves while a gap is being
 * backfilled and recovered messages are never reordered with live ones.
 * </p>
 * <p>
 * <b>Delivery:</b>
 * <ul>
 *   <li>live message in order: expected-message callback</li>
 *   <li>gap: each recovered message to the missed-message callback, the unrecoverable
 *       count to the missing-messages callback, then the triggering message</li>
 *   <li>already processed id: duplicated-message callback only</li>
 *   <li>message reached by a check: missed-message callback</li>
 * </ul>
 * </p>
 */
public class MessageProcessor implements IMessageProcessor, IMessageDeliveryChecker {
    private static final Logger log = LoggerFactory.getLogger(MessageProcessor.class);

    private enum Source { LIVE, RECOVERY }

    private final String channel;
    private final IMessageValidator validator;
    private final IMessageLoader loader;
    private final IMessageHandler handler;
    private final DeliveryMetrics metrics;
    private final Clock clock;
    private final Object lock = new Object();

    private volatile Instant lastActivityAt = Instant.EPOCH;

    public MessageProcessor(String channel,
                            IMessageValidator validator,
                            IMessageLoader loader,
                            IMessageHandler handler,
                            DeliveryMetrics metrics,
                            Clock clock) {
        this.channel = channel;
        this.validator = validator;
        this.loader = loader;
        this.handler = handler;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public String getChannel() {
        return channel;
    }

    @Override
    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    /**
     * Last id seen by this channel's validator.
     */
    public long getLastMessageId() {
        synchronized (lock) {
            return validator.getLastMessageId();
        }
    }

    @Override
    public void processMessage(Message message) {
        synchronized (lock) {
            handle(message, Source.LIVE);
        }
        lastActivityAt = clock.instant();
    }

    @Override
    public MissedMessagesReport checkForMissedMessages() {
        log.debug("Checking missed messages in channel '{}'", channel);
        int messagesCount = 0;
        long firstMessageId = 0;
        long lastMessageId = 0;

        synchronized (lock) {
            long fromMessageId = validator.getLastMessageId() + 1;
            for (Message message : loader.getMessages(channel, fromMessageId).toIterable()) {
                if (messagesCount == 0) {
                    firstMessageId = message.getId();
                }
                handle(message, Source.RECOVERY);
                messagesCount++;
                lastMessageId = message.getId();
            }
        }
        lastActivityAt = clock.instant();

        if (messagesCount == 0) {
            log.debug("Checked missed messages: no missed messages found in channel '{}'", channel);
            return MissedMessagesReport.none(channel);
        }

        log.warn("Missed messages in channel '{}' processed: messagesCount={}, IDs range=<{}, {}>",
            channel, messagesCount, firstMessageId, lastMessageId);
        return new MissedMessagesReport(channel, messagesCount, firstMessageId, lastMessageId);
    }

    private void handle(Message message, Source source) {
        ValidationResult result = validator.validate(message);
        switch (result.getOutcome()) {
            case SUCCESS:
                deliver(message, source);
                break;
            case MISSING_MESSAGES:
                recoverGap(message, result);
                deliver(message, source);
                break;
            case DUPLICATE:
                onDuplicatedMessage(message);
                break;
            default:
                log.debug("Other validation result in channel '{}': {}, message: {}", channel, result, message);
                break;
        }
    }

    private void deliver(Message message, Source source) {
        if (source == Source.LIVE) {
            metrics.recordExpected(channel);
            handler.onExpectedMessage(channel, message);
        } else {
            metrics.recordRecovered(channel);
            handler.onMissedMessage(channel, message);
        }
    }

    private void recoverGap(Message currentMessage, ValidationResult result) {
        long fromMessageId = result.getLastProcessedId() + 1;
        long toMessageId = currentMessage.getId() - 1;
        long expectedMessagesCount = result.gapSize(currentMessage.getId());

        log.debug("Gap detected in channel '{}': recovering IDs <{}, {}>", channel, fromMessageId, toMessageId);

        long recoveredCount = 0;
        for (Message missedMessage : loader.getMessages(channel, fromMessageId, toMessageId).toIterable()) {
            recoveredCount++;
            metrics.recordRecovered(channel);
            handler.onMissedMessage(channel, missedMessage);
        }

        if (recoveredCount < expectedMessagesCount) {
            long missingMessagesCount = expectedMessagesCount - recoveredCount;
            log.warn("It was not possible to get {} missed messages from expected {} messages in channel '{}'",
                missingMessagesCount, expectedMessagesCount, channel);
            metrics.recordUnrecoverable(channel, missingMessagesCount);
            handler.onMissingMessages(channel, missingMessagesCount);
        }
    }

    private void onDuplicatedMessage(Message message) {
        metrics.recordDuplicated(channel);
        handler.onDuplicatedMessage(channel, message);
        log.warn("Message in channel '{}' was received again: {}", channel, message);
    }
}
