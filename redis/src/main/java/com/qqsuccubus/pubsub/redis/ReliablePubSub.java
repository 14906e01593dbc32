package com.qqsuccubus.pubsub.redis;

import com.qqsuccubus.pubsub.core.metrics.DeliveryMetrics;
import com.qqsuccubus.pubsub.core.msg.MessageParser;
import com.qqsuccubus.pubsub.core.publish.IReliablePublisher;
import com.qqsuccubus.pubsub.core.subscribe.DeliveryMonitor;
import com.qqsuccubus.pubsub.core.subscribe.IMessageDeliveryChecker;
import com.qqsuccubus.pubsub.core.subscribe.IReliableSubscriber;
import com.qqsuccubus.pubsub.core.subscribe.MessageAction;
import com.qqsuccubus.pubsub.core.subscribe.MessageHandler;
import com.qqsuccubus.pubsub.core.subscribe.MessagesCountAction;
import com.qqsuccubus.pubsub.core.subscribe.ReliableSubscriber;
import com.qqsuccubus.pubsub.redis.config.ReliableDeliveryConfig;
import com.qqsuccubus.pubsub.redis.publish.ReliablePublisher;
import com.qqsuccubus.pubsub.redis.subscribe.LettucePubSubTransport;
import com.qqsuccubus.pubsub.redis.subscribe.RedisMessageLoader;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

/**
 * Reliable publisher and subscriber over one Redis deployment.
 * <p>
 * The caller creates and holds the instance next to its {@link RedisClient}; there is no
 * lookup by connection. Two connections are opened: a regular one for the publish and
 * recovery scripts and a pub/sub one for delivery.
 * </p>
 * <pre>{@code
 * try (ReliablePubSub pubSub = ReliablePubSub.create(ReliableDeliveryConfig.fromEnv())) {
 *     IMessageDeliveryChecker checker = pubSub.subscribe("orders", (channel, msg) -> handle(msg));
 *     Disposable monitor = pubSub.monitor(checker);
 *     pubSub.publish("orders", "{\"id\":42}");
 * }
 * }</pre>
 */
public class ReliablePubSub implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReliablePubSub.class);

    private final RedisClient client;
    private final boolean ownsClient;
    private final StatefulRedisConnection<String, String> connection;
    private final StatefulRedisPubSubConnection<String, String> pubSubConnection;
    private final IReliablePublisher publisher;
    private final IReliableSubscriber subscriber;
    private final DeliveryMonitor monitor;

    public ReliablePubSub(RedisClient client, ReliableDeliveryConfig config, MeterRegistry registry) {
        this(client, false, config, new DeliveryMetrics(registry));
    }

    private ReliablePubSub(RedisClient client, boolean ownsClient, ReliableDeliveryConfig config,
                           DeliveryMetrics metrics) {
        this.client = client;
        this.ownsClient = ownsClient;
        this.connection = client.connect();
        this.pubSubConnection = client.connectPubSub();

        this.publisher = new ReliablePublisher(connection, config.getMessageTtl(), metrics);
        this.subscriber = new ReliableSubscriber(
            new LettucePubSubTransport(pubSubConnection, Schedulers.boundedElastic()),
            new MessageParser(),
            new RedisMessageLoader(connection, config.getLoadBatchSize()),
            metrics,
            Clock.systemUTC());
        this.monitor = new DeliveryMonitor(config.getCheckInterval(), config.getIdleThreshold(), metrics);

        log.info("Reliable pub/sub connected (message TTL {})", config.getMessageTtl());
    }

    /**
     * Creates an instance that owns its Redis client and closes it on {@link #close()}.
     */
    public static ReliablePubSub create(ReliableDeliveryConfig config) {
        log.info("Connecting to Redis: {}", config.getRedisUrl());
        RedisClient client = RedisClient.create(config.getRedisUrl());
        try {
            return new ReliablePubSub(client, true, config, new DeliveryMetrics(new SimpleMeterRegistry()));
        } catch (RuntimeException e) {
            client.shutdown();
            throw e;
        }
    }

    public IReliablePublisher getPublisher() {
        return publisher;
    }

    public IReliableSubscriber getSubscriber() {
        return subscriber;
    }

    // ==================== Publishing ====================

    public long publish(String channel, String content) {
        return publisher.publish(channel, content);
    }

    public long publish(String channel, String content, Duration ttl) {
        return publisher.publish(channel, content, ttl);
    }

    public Mono<Long> publishAsync(String channel, String content) {
        return publisher.publishAsync(channel, content);
    }

    public Mono<Long> publishAsync(String channel, String content, Duration ttl) {
        return publisher.publishAsync(channel, content, ttl);
    }

    // ==================== Subscribing ====================

    public IMessageDeliveryChecker subscribe(String channel, MessageAction onExpectedMessage) {
        return subscriber.subscribe(channel, new MessageHandler(onExpectedMessage));
    }

    public IMessageDeliveryChecker subscribe(String channel,
                                             MessageAction onExpectedMessage,
                                             MessageAction onMissedMessage,
                                             MessageAction onDuplicatedMessage,
                                             MessagesCountAction onMissingMessages) {
        return subscriber.subscribe(channel,
            new MessageHandler(onExpectedMessage, onMissedMessage, onDuplicatedMessage, onMissingMessages));
    }

    public void unsubscribe(String channel) {
        subscriber.unsubscribe(channel);
    }

    public void unsubscribeAll() {
        subscriber.unsubscribeAll();
    }

    /**
     * Polls the channel for missed messages whenever it has been idle, until disposed.
     */
    public Disposable monitor(IMessageDeliveryChecker checker) {
        return monitor.watch(checker);
    }

    @Override
    public void close() {
        log.info("Closing reliable pub/sub");
        try {
            subscriber.unsubscribeAll();
            pubSubConnection.close();
            connection.close();
        } finally {
            if (ownsClient) {
                client.shutdown();
            }
        }
        log.info("Reliable pub/sub closed");
    }
}
