package com.qqsuccubus.pubsub.redis.subscribe;

import com.qqsuccubus.pubsub.core.subscribe.IPubSubTransport;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.lettuce.core.pubsub.api.async.RedisPubSubAsyncCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * {@link IPubSubTransport} on top of a Lettuce pub/sub connection.
 * <p>
 * <b>Threading:</b> Lettuce calls listeners on its I/O threads. Each subscribed channel gets
 * its own {@link Scheduler.Worker}; payloads are scheduled on it in arrival order, so one
 * channel is processed sequentially while different channels run in parallel, and blocking
 * recovery reads never stall the I/O thread.
 * </p>
 * <p>
 * An exception thrown by a channel consumer ends up in the worker and is reported through
 * Reactor's scheduler error handling; later payloads of the channel are still delivered.
 * </p>
 */
public class LettucePubSubTransport implements IPubSubTransport {
    private static final Logger log = LoggerFactory.getLogger(LettucePubSubTransport.class);

    private final RedisPubSubAsyncCommands<String, String> commands;
    private final Scheduler scheduler;

    // Active channels: channel -> dispatcher
    private final Map<String, ChannelDispatcher> dispatchers = new ConcurrentHashMap<>();

    public LettucePubSubTransport(StatefulRedisPubSubConnection<String, String> connection, Scheduler scheduler) {
        this.commands = connection.async();
        this.scheduler = scheduler;
        connection.addListener(new RedisMessageListener(this::dispatch));
    }

    @Override
    public Disposable subscribe(String channel, Consumer<String> rawMessages) {
        ChannelDispatcher dispatcher = new ChannelDispatcher(scheduler.createWorker(), rawMessages);
        ChannelDispatcher previous = dispatchers.put(channel, dispatcher);
        if (previous != null) {
            previous.dispose();
        }

        commands.subscribe(channel).whenComplete((v, err) -> {
            if (err != null) {
                log.error("Failed to subscribe to channel '{}'", channel, err);
            } else {
                log.debug("Subscribed to channel '{}'", channel);
            }
        });

        return () -> unsubscribe(channel, dispatcher);
    }

    private void unsubscribe(String channel, ChannelDispatcher dispatcher) {
        if (!dispatchers.remove(channel, dispatcher)) {
            return;
        }
        dispatcher.dispose();

        commands.unsubscribe(channel).whenComplete((v, err) -> {
            if (err != null) {
                log.error("Failed to unsubscribe from channel '{}'", channel, err);
            } else {
                log.debug("Unsubscribed from channel '{}'", channel);
            }
        });
    }

    private void dispatch(String channel, String rawMessage) {
        ChannelDispatcher dispatcher = dispatchers.get(channel);
        if (dispatcher == null) {
            log.debug("Received message on channel without subscriber: {}", channel);
            return;
        }
        dispatcher.dispatch(rawMessage);
    }

    private static final class ChannelDispatcher {
        private final Scheduler.Worker worker;
        private final Consumer<String> consumer;
        private volatile boolean active = true;

        private ChannelDispatcher(Scheduler.Worker worker, Consumer<String> consumer) {
            this.worker = worker;
            this.consumer = consumer;
        }

        void dispatch(String rawMessage) {
            if (!active) {
                return;
            }
            worker.schedule(() -> {
                if (active) {
                    consumer.accept(rawMessage);
                }
            });
        }

        // Queued behind the in-flight payload, so a running callback is never interrupted.
        void dispose() {
            active = false;
            worker.schedule(worker::dispose);
        }
    }
}
