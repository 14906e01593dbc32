package com.qqsuccubus.pubsub.core.redis;

/**
 * Redis keyspace used to persist channel messages for recovery.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>All keys of a channel share the {@code {channel}} hash tag, so a publish script
 *       touches a single cluster slot</li>
 *   <li>Message keys always carry a TTL; only the id counter lives forever</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Sequence counter of a channel: {@code ch:{channel}:id}
     * <p>
     * <b>Type:</b> String (integer), advanced with INCR
     * <br>
     * <b>Content:</b> last id handed out for the channel
     * </p>
     *
     * @param channel Channel name
     * @return Redis key
     */
    public static String counter(String channel) {
        return messagePrefix(channel) + "id";
    }

    /**
     * Stored message: {@code ch:{channel}:<id>}
     * <p>
     * <b>Type:</b> String
     * <br>
     * <b>Content:</b> message content (without the id prefix)
     * <br>
     * <b>TTL:</b> message retention, 10 minutes unless configured otherwise
     * </p>
     *
     * @param channel Channel name
     * @param id      Message id
     * @return Redis key
     */
    public static String message(String channel, long id) {
        return messagePrefix(channel) + id;
    }

    /**
     * Common prefix of every key of a channel, used by scripts that derive message keys.
     */
    public static String messagePrefix(String channel) {
        return "ch:{" + channel + "}:";
    }
}
