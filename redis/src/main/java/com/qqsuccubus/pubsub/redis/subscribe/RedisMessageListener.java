package com.qqsuccubus.pubsub.redis.subscribe;

import io.lettuce.core.pubsub.RedisPubSubAdapter;

import java.util.function.BiConsumer;

/**
 * Redis pub/sub listener that forwards (channel, payload) pairs.
 * <p>
 * Runs on a Lettuce I/O thread, so the handler must hand work off instead of blocking.
 * </p>
 */
public final class RedisMessageListener extends RedisPubSubAdapter<String, String> {

    private final BiConsumer<String, String> messageHandler;

    public RedisMessageListener(BiConsumer<String, String> messageHandler) {
        this.messageHandler = messageHandler;
    }

    @Override
    public void message(String channel, String message) {
        messageHandler.accept(channel, message);
    }
}
