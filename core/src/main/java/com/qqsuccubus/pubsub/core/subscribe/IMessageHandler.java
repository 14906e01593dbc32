package com.qqsuccubus.pubsub.core.subscribe;

import com.qqsuccubus.pubsub.core.model.Message;

/**
 * Application callbacks invoked by a {@link MessageProcessor}.
 * <p>
 * All callbacks of a channel run on one thread at a time and under the channel lock,
 * so a slow callback delays further delivery for that channel only.
 * </p>
 */
public interface IMessageHandler {

    /**
     * A message arrived live in the expected order.
     */
    void onExpectedMessage(String channel, Message message);

    /**
     * A message that was not received live and has been recovered from the store.
     */
    void onMissedMessage(String channel, Message message);

    /**
     * A message whose id was already processed.
     */
    void onDuplicatedMessage(String channel, Message message);

    /**
     * Some messages of a gap could not be recovered (expired or never stored).
     *
     * @param missingMessagesCount Number of unrecoverable messages
     */
    void onMissingMessages(String channel, long missingMessagesCount);
}
