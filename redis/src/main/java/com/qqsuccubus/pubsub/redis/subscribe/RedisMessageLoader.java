package com.qqsuccubus.pubsub.redis.subscribe;

import com.qqsuccubus.pubsub.core.model.Message;
import com.qqsuccubus.pubsub.core.redis.Keys;
import com.qqsuccubus.pubsub.core.subscribe.IMessageLoader;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.async.RedisAsyncCommands;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads persisted channel messages back from Redis for gap recovery.
 * <p>
 * A range is read in batches of {@code batchSize} ids, one Lua script call per batch, so a
 * long backfill never holds the server inside a single script. Each batch is clamped to the
 * channel counter, and reading stops at the newest assigned id.
 * </p>
 * <p>
 * <b>Script reply:</b> {@code {lastId, id1, content1, id2, content2, ...}}, or an empty list
 * when the channel has never been published to.
 * </p>
 */
public class RedisMessageLoader implements IMessageLoader {
    private static final Logger log = LoggerFactory.getLogger(RedisMessageLoader.class);

    // KEYS[1] = counter key; ARGV = message key prefix, from id, to id
    static final String GET_MESSAGES_SCRIPT = String.join("\n",
        "local last_id = redis.call('GET', KEYS[1])",
        "if not last_id then",
        "    return {}",
        "end",
        "last_id = tonumber(last_id)",
        "local to_id = math.min(tonumber(ARGV[3]), last_id)",
        "local result = { last_id }",
        "for id = tonumber(ARGV[2]), to_id do",
        "    local content = redis.call('GET', ARGV[1] .. id)",
        "    if content then",
        "        table.insert(result, id)",
        "        table.insert(result, content)",
        "    end",
        "end",
        "return result");

    private final RedisAsyncCommands<String, String> commands;
    private final int batchSize;

    public RedisMessageLoader(StatefulRedisConnection<String, String> connection, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.commands = connection.async();
        this.batchSize = batchSize;
    }

    @Override
    public Flux<Message> getMessages(String channel, long fromId, long toId) {
        return Flux.defer(() -> loadFrom(channel, Math.max(fromId, 1), toId));
    }

    private Flux<Message> loadFrom(String channel, long fromId, long toId) {
        if (fromId > toId) {
            return Flux.empty();
        }

        long batchEnd = toId - fromId < batchSize ? toId : fromId + batchSize - 1;
        return loadBatch(channel, fromId, batchEnd)
            .flatMapMany(batch -> {
                Flux<Message> messages = Flux.fromIterable(batch.getMessages());
                long lastId = Math.min(toId, batch.getLastMessageId());
                if (batchEnd >= lastId) {
                    return messages;
                }
                return messages.concatWith(Flux.defer(() -> loadFrom(channel, batchEnd + 1, toId)));
            });
    }

    private Mono<Batch> loadBatch(String channel, long fromId, long toId) {
        return Mono.<List<Object>>fromCompletionStage(() -> commands.eval(
                GET_MESSAGES_SCRIPT,
                ScriptOutputType.MULTI,
                new String[]{Keys.counter(channel)},
                Keys.messagePrefix(channel), String.valueOf(fromId), String.valueOf(toId)))
            .map(RedisMessageLoader::toBatch)
            .doOnNext(batch -> log.debug("Loaded {} messages of channel '{}' in IDs range <{}, {}>",
                batch.getMessages().size(), channel, fromId, toId))
            .doOnError(err -> log.error("Failed to load messages of channel '{}' in IDs range <{}, {}>",
                channel, fromId, toId, err));
    }

    private static Batch toBatch(List<Object> reply) {
        if (reply.isEmpty()) {
            return new Batch(0, Collections.emptyList());
        }

        long lastMessageId = (Long) reply.get(0);
        List<Message> messages = new ArrayList<>((reply.size() - 1) / 2);
        for (int i = 1; i + 1 < reply.size(); i += 2) {
            long id = (Long) reply.get(i);
            String content = (String) reply.get(i + 1);
            messages.add(new Message(id, content));
        }
        return new Batch(lastMessageId, messages);
    }

    @Value
    private static class Batch {
        long lastMessageId;
        List<Message> messages;
    }
}
