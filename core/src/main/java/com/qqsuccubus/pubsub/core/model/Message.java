package com.qqsuccubus.pubsub.core.model;

import lombok.Value;

/**
 * A sequenced message received from (or recovered for) a channel.
 * <p>
 * <b>Identity:</b> {@code id} is assigned by the publisher per channel, starting at 1.
 * Equality and hash code cover both {@code id} and {@code content}.
 * </p>
 */
@Value
public class Message {

    /**
     * Placeholder meaning "no message" (id 0, no content).
     */
    public static final Message UNDEFINED = new Message(0, null);

    long id;
    String content;

    public boolean isUndefined() {
        return id == 0 && content == null;
    }

    @Override
    public String toString() {
        return "Message:Id=" + id;
    }
}
