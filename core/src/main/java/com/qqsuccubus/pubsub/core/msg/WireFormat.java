package com.qqsuccubus.pubsub.core.msg;

/**
 * Payload layout of a message travelling through a pub/sub channel.
 * <p>
 * <b>Format:</b> {@code <id>:<content>}
 * <ul>
 *   <li>{@code id}: base-10, non-negative 64-bit sequence number</li>
 *   <li>{@code content}: arbitrary text, may itself contain the separator</li>
 * </ul>
 * Readers split on the first separator only.
 * </p>
 */
public final class WireFormat {
    public static final char SEPARATOR = ':';

    private WireFormat() {
    }

    public static String encode(long id, String content) {
        return id + String.valueOf(SEPARATOR) + content;
    }
}
