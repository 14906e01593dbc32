package com.qqsuccubus.pubsub.redis.publish;

import com.qqsuccubus.pubsub.core.metrics.DeliveryMetrics;
import com.qqsuccubus.pubsub.core.msg.WireFormat;
import com.qqsuccubus.pubsub.core.publish.IReliablePublisher;
import com.qqsuccubus.pubsub.core.redis.Keys;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.async.RedisAsyncCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;

/**
 * Publishes sequenced messages through a single Lua script.
 * <p>
 * The script runs atomically on the server:
 * <ol>
 *   <li>{@code INCR} the channel counter to get the next id</li>
 *   <li>{@code SET} the content under the message key with {@code EX ttl}</li>
 *   <li>{@code PUBLISH} {@code <id>:<content>}, but only on the primary: when
 *       {@code CLUSTER NODES} fails (standalone server) or reports {@code myself,master}</li>
 * </ol>
 * Replicas apply the stored message without broadcasting it a second time. If the script
 * fails after the counter moved, subscribers see that id as a permanently missing message.
 * </p>
 */
public class ReliablePublisher implements IReliablePublisher {
    private static final Logger log = LoggerFactory.getLogger(ReliablePublisher.class);

    // KEYS[1] = counter key; ARGV = channel, content, ttl seconds, message key prefix
    static final String PUBLISH_SCRIPT = String.join("\n",
        "local channel = ARGV[1]",
        "local message = ARGV[2]",
        "local expiration = ARGV[3]",
        "local message_id = redis.call('INCR', KEYS[1])",
        "redis.call('SET', ARGV[4] .. message_id, message, 'EX', expiration)",
        "local cluster_nodes = redis.pcall('CLUSTER', 'NODES')",
        "if type(cluster_nodes) ~= 'string' or string.match(cluster_nodes, 'myself,master') then",
        "    redis.call('PUBLISH', channel, message_id .. '" + WireFormat.SEPARATOR + "' .. message)",
        "end",
        "return message_id");

    private final RedisAsyncCommands<String, String> commands;
    private final Duration defaultTtl;
    private final DeliveryMetrics metrics;

    public ReliablePublisher(StatefulRedisConnection<String, String> connection,
                             Duration defaultTtl,
                             DeliveryMetrics metrics) {
        this.commands = connection.async();
        this.defaultTtl = requireValidTtl(defaultTtl);
        this.metrics = metrics;
    }

    @Override
    public long publish(String channel, String content, Duration ttl) {
        Long id = publishAsync(channel, content, ttl).block();
        return Objects.requireNonNull(id, "publish script returned no id");
    }

    @Override
    public long publish(String channel, String content) {
        return publish(channel, content, defaultTtl);
    }

    @Override
    public Mono<Long> publishAsync(String channel, String content) {
        return publishAsync(channel, content, defaultTtl);
    }

    @Override
    public Mono<Long> publishAsync(String channel, String content, Duration ttl) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(content, "content");
        String expiration = String.valueOf(requireValidTtl(ttl).getSeconds());

        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            return Mono.<Long>fromCompletionStage(() -> commands.eval(
                    PUBLISH_SCRIPT,
                    ScriptOutputType.INTEGER,
                    new String[]{Keys.counter(channel)},
                    channel, content, expiration, Keys.messagePrefix(channel)))
                .doOnNext(id -> {
                    metrics.recordPublishLatency(Duration.ofNanos(System.nanoTime() - startNanos));
                    log.debug("Published message {} to channel '{}'", id, channel);
                })
                .doOnError(err -> log.error("Failed to publish message to channel '{}'", channel, err));
        });
    }

    private static Duration requireValidTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.getSeconds() < 1) {
            throw new IllegalArgumentException("Message TTL must be at least one second: " + ttl);
        }
        return ttl;
    }
}
