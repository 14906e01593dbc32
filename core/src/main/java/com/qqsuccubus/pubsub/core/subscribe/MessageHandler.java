package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.model.Message;

import java.util.Objects;

/**
 * {@link IMessageHandler} assembled from lambdas.
 * <p>
 * Defaults: missed messages go to the expected-message action, duplicates and missing
 * counts are ignored.
 * </p>
 */
public class MessageHandler implements IMessageHandler {
    private static final MessageAction NOOP = (channel, message) -> { };
    private static final MessagesCountAction NOOP_COUNT = (channel, count) -> { };

    private final MessageAction onExpectedMessage;
    private final MessageAction onMissedMessage;
    private final MessageAction onDuplicatedMessage;
    private final MessagesCountAction onMissingMessages;

    public MessageHandler(MessageAction onExpectedMessage) {
        this(onExpectedMessage, null, null, null);
    }

    public MessageHandler(MessageAction onExpectedMessage,
                          MessageAction onMissedMessage,
                          MessageAction onDuplicatedMessage,
                          MessagesCountAction onMissingMessages) {
        this.onExpectedMessage = Objects.requireNonNull(onExpectedMessage, "onExpectedMessage");
        this.onMissedMessage = onMissedMessage != null ? onMissedMessage : onExpectedMessage;
        this.onDuplicatedMessage = onDuplicatedMessage != null ? onDuplicatedMessage : NOOP;
        this.onMissingMessages = onMissingMessages != null ? onMissingMessages : NOOP_COUNT;
    }

    @Override
    public void onExpectedMessage(String channel, Message message) {
        onExpectedMessage.accept(channel, message);
    }

    @Override
    public void onMissedMessage(String channel, Message message) {
        onMissedMessage.accept(channel, message);
    }

    @Override
    public void onDuplicatedMessage(String channel, Message message) {
        onDuplicatedMessage.accept(channel, message);
    }

    @Override
    public void onMissingMessages(String channel, long missingMessagesCount) {
        onMissingMessages.accept(channel, missingMessagesCount);
    }
}
